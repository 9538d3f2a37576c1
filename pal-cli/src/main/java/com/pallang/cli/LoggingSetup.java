package com.pallang.cli;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * 命令行日志配置：日志写到 stderr，不与脚本输出混在一起
 */
final class LoggingSetup {

    private LoggingSetup() {
    }

    /**
     * @param verbosity 0 = WARNING，1 = FINE，2 及以上 = FINEST（指令跟踪）
     */
    static void configure(int verbosity) {
        if (System.getProperty("java.util.logging.SimpleFormatter.format") == null) {
            System.setProperty("java.util.logging.SimpleFormatter.format", "[%4$s] %3$s: %5$s%6$s%n");
        }
        Level level = levelFor(verbosity);

        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
    }

    static Level levelFor(int verbosity) {
        if (verbosity <= 0) return Level.WARNING;
        if (verbosity == 1) return Level.FINE;
        return Level.FINEST;
    }
}
