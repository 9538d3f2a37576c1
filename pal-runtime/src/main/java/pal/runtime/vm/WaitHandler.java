package pal.runtime.vm;

/**
 * {@code wait} 语句的宿主绑定
 */
@FunctionalInterface
public interface WaitHandler {

    /** 阻塞当前线程 */
    WaitHandler SLEEP = seconds -> Thread.sleep(Math.round(seconds * 1000));

    /** 立即返回 */
    WaitHandler NONE = seconds -> { };

    void await(double seconds) throws InterruptedException;
}
