package pal.runtime.vm;

import pal.runtime.PalException;

import java.util.Collections;
import java.util.List;

/**
 * PAL 运行时错误
 *
 * <p>携带出错时每个活动调用帧的 {@code [line N in name]} 条目，由外到内排列。</p>
 */
public class PalRuntimeException extends PalException {

    private final List<String> traceback;

    public PalRuntimeException(String message) {
        this(message, Collections.<String>emptyList(), null);
    }

    public PalRuntimeException(String message, List<String> traceback, Throwable cause) {
        super(message, cause);
        this.traceback = Collections.unmodifiableList(traceback);
    }

    public List<String> getTraceback() {
        return traceback;
    }

    /** 返回不含调用栈的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    /**
     * 面向用户的格式：{@code RunTimeError on [line 7 in script]; [line 3 in f]: msg}
     */
    public String format() {
        if (traceback.isEmpty()) {
            return "RunTimeError: " + getRawMessage();
        }
        return "RunTimeError on " + String.join("; ", traceback) + ": " + getRawMessage();
    }

    @Override
    public String getMessage() {
        return format();
    }
}
