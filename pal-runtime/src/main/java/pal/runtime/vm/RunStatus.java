package pal.runtime.vm;

/**
 * 一次运行的终止状态
 */
public enum RunStatus {
    OK,
    COMPILE_ERROR,
    RUNTIME_ERROR
}
