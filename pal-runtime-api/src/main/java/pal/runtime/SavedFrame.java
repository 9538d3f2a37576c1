package pal.runtime;

import java.util.Collections;
import java.util.List;

/**
 * 生成器挂起时保存的帧：栈窗口内容与指令位置
 */
public final class SavedFrame {

    private final List<PalValue> window;
    private final int position;

    public SavedFrame(List<PalValue> window, int position) {
        this.window = Collections.unmodifiableList(window);
        this.position = position;
    }

    public List<PalValue> getWindow() {
        return window;
    }

    public int getPosition() {
        return position;
    }
}
