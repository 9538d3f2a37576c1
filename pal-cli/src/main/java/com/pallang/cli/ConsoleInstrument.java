package com.pallang.cli;

import com.pallang.compiler.lexer.Keyword;
import pal.runtime.bytecode.OpCode;
import pal.runtime.vm.InstrumentActions;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 模拟仪器：把每个动作打印为 {@code [action] <关键词>}
 */
public class ConsoleInstrument implements InstrumentActions {

    private static final Logger LOG = Logger.getLogger(ConsoleInstrument.class.getName());

    private final PrintStream out;
    private final List<String> performed = new ArrayList<>();

    public ConsoleInstrument(PrintStream out) {
        this.out = out;
    }

    @Override
    public void perform(OpCode action) {
        String name = Keyword.valueOf(action.name()).getLexeme();
        LOG.fine("Instrument action " + name);
        performed.add(name);
        out.println("[action] " + name);
    }

    /**
     * 已执行动作的关键词，按执行顺序
     */
    public List<String> getPerformed() {
        return Collections.unmodifiableList(performed);
    }
}
