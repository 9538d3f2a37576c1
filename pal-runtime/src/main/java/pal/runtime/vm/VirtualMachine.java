package pal.runtime.vm;

import com.pallang.compiler.compiler.PalCompiler;
import com.pallang.compiler.parser.CompileError;
import com.pallang.compiler.parser.CompileResult;
import pal.runtime.BinaryOperator;
import pal.runtime.CallContext;
import pal.runtime.MemberAccess;
import pal.runtime.PalArray;
import pal.runtime.PalBoolean;
import pal.runtime.PalEnum;
import pal.runtime.PalException;
import pal.runtime.PalFunction;
import pal.runtime.PalIterator;
import pal.runtime.PalNativeIterator;
import pal.runtime.PalNil;
import pal.runtime.PalNumber;
import pal.runtime.PalString;
import pal.runtime.PalValue;
import pal.runtime.SavedFrame;
import pal.runtime.ValueStack;
import pal.runtime.bytecode.Chunk;
import pal.runtime.bytecode.Disassembler;
import pal.runtime.bytecode.InstructionPointer;
import pal.runtime.bytecode.OpCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PAL 栈式虚拟机
 *
 * <p>所有调用帧共享一个操作数栈，每帧拥有从其基址开始的窗口。
 * 全局变量表在同一实例的多次运行之间保留；栈与调用帧每次运行重置。
 * 实例不是线程安全的。</p>
 *
 * <p>生成器不依赖宿主协程：YIELD 把帧窗口与指令位置保存到生成器上，
 * ADVANCE 再把它们放回栈上继续执行。迭代耗尽时进入跳过模式，
 * 解码但不执行指令，直到回到触发 ADVANCE 的循环的回跳指令之后。</p>
 */
public class VirtualMachine implements CallContext {

    private static final Logger LOG = Logger.getLogger(VirtualMachine.class.getName());

    /** 默认最大调用深度 */
    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private final Map<String, PalValue> globals = new LinkedHashMap<>();
    private final BiConsumer<String, PalValue> variableListener;
    private final UnhandledOpcodeHandler unhandledOpcode;
    private final Consumer<String> output;
    private final Consumer<String> errorOutput;
    private final InstrumentActions actions;
    private final WaitHandler waitHandler;
    private final int maxCallDepth;
    private final int maxStackSize;

    private ValueStack stack;
    private final List<CallFrame> frames = new ArrayList<>();
    private CallFrame frame;

    // 跳过模式：origin 为触发它的 ADVANCE 所在位置
    private boolean skipping;
    private int skipOrigin;

    private PalRuntimeException lastError;

    public VirtualMachine() {
        this(builder());
    }

    private VirtualMachine(Builder builder) {
        this.variableListener = builder.variableListener;
        this.unhandledOpcode = builder.unhandledOpcode;
        this.output = builder.output;
        this.errorOutput = builder.errorOutput != null ? builder.errorOutput : builder.output;
        this.actions = builder.actions;
        this.waitHandler = builder.waitHandler;
        this.maxCallDepth = builder.maxCallDepth;
        this.maxStackSize = builder.maxStackSize;
        this.globals.putAll(builder.globals);
        this.stack = new ValueStack(maxStackSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ============ 入口 ============

    /**
     * 编译并执行源码
     */
    public RunStatus run(String source) {
        return run(source, "<script>");
    }

    /**
     * 编译并执行源码；任何语法错误都会阻止执行
     */
    public RunStatus run(String source, String fileName) {
        lastError = null;
        CompileResult result = PalCompiler.compile(source, fileName);
        if (result.hasErrors()) {
            for (CompileError error : result.getErrors()) {
                errorOutput.accept(error.format());
            }
            return RunStatus.COMPILE_ERROR;
        }
        return execute(result.getScript());
    }

    /**
     * 执行已编译的顶层脚本
     */
    public RunStatus execute(PalFunction script) {
        lastError = null;
        reset();
        LOG.fine("Executing " + script);
        try {
            stack.push(script);
            pushFrame(script, 0);
            runLoop();
            LOG.fine("Finished " + script);
            return RunStatus.OK;
        } catch (PalException e) {
            lastError = toRuntimeError(e);
            LOG.log(Level.FINE, "Run aborted: " + lastError.format(), e);
            errorOutput.accept(lastError.format());
            return RunStatus.RUNTIME_ERROR;
        } finally {
            frames.clear();
            frame = null;
            skipping = false;
        }
    }

    private void reset() {
        stack = new ValueStack(maxStackSize);
        frames.clear();
        frame = null;
        skipping = false;
        skipOrigin = -1;
    }

    private PalRuntimeException toRuntimeError(PalException e) {
        List<String> traceback = new ArrayList<>(frames.size());
        for (CallFrame f : frames) {
            traceback.add(f.describe());
        }
        String message = e instanceof PalRuntimeException
                ? ((PalRuntimeException) e).getRawMessage()
                : e.getMessage();
        return new PalRuntimeException(message, traceback, e);
    }

    // ============ 调用协议 ============

    @Override
    public ValueStack getStack() {
        return stack;
    }

    @Override
    public void pushFrame(PalFunction function, int base) {
        pushFrame(function, new InstructionPointer(function.getChunk()), base, null);
    }

    private CallFrame pushFrame(PalFunction function, InstructionPointer ip, int base, PalIterator iterator) {
        if (frames.size() >= maxCallDepth) {
            throw new PalRuntimeException("Stack overflow: more than " + maxCallDepth + " nested calls");
        }
        CallFrame callFrame = new CallFrame(function, ip, base, iterator);
        frames.add(callFrame);
        frame = callFrame;
        return callFrame;
    }

    // ============ 执行循环 ============

    private void runLoop() {
        while (true) {
            InstructionPointer ip = frame.getIp();
            int code = ip.next();
            OpCode op = OpCode.fromCode(code);

            if (skipping) {
                skip(op, code);
                continue;
            }
            if (op == null) {
                unhandledOpcode.handle(code);
                continue;
            }
            if (LOG.isLoggable(Level.FINEST)) {
                trace(ip.getPosition() - 1);
            }

            switch (op) {
                case CONSTANT:
                    push(readConstant());
                    break;
                case TRUE:
                    push(PalBoolean.TRUE);
                    break;
                case FALSE:
                    push(PalBoolean.FALSE);
                    break;
                case NULL:
                    push(PalNil.NIL);
                    break;

                case NEGATE: {
                    PalValue operand = pop();
                    PalValue result = operand.negate();
                    if (result == null) {
                        throw new PalRuntimeException("Cannot negate '" + operand.getTypeName() + "'");
                    }
                    push(result);
                    break;
                }
                case INVERT: {
                    PalValue operand = pop();
                    PalValue result = operand.invert();
                    if (result == null) {
                        throw new PalRuntimeException("Cannot invert '" + operand.getTypeName() + "'");
                    }
                    push(result);
                    break;
                }
                case POWER:
                    binary(BinaryOperator.POWER);
                    break;
                case ADD:
                    binary(BinaryOperator.ADD);
                    break;
                case SUB:
                    binary(BinaryOperator.SUB);
                    break;
                case EQUAL:
                    binary(BinaryOperator.EQUAL);
                    break;
                case LESS:
                    binary(BinaryOperator.LESS);
                    break;
                case MORE:
                    binary(BinaryOperator.MORE);
                    break;
                case MIX:
                    binary(BinaryOperator.MIX);
                    break;
                case PRINT:
                    output.accept(String.valueOf(peek()));
                    break;

                case GET_GLOBAL: {
                    String name = readName();
                    PalValue value = globals.get(name);
                    if (value == null) {
                        throw undefined(name);
                    }
                    push(value);
                    break;
                }
                case SET_GLOBAL: {
                    String name = readName();
                    if (!globals.containsKey(name)) {
                        throw undefined(name);
                    }
                    PalValue value = peek();
                    globals.put(name, value);
                    variableListener.accept(name, value);
                    break;
                }
                case DEF_GLOBAL:
                    globals.put(readName(), pop());
                    break;
                case GET_LOCAL:
                    push(stack.get(localIndex(ip.next())));
                    break;
                case SET_LOCAL:
                    stack.set(localIndex(ip.next()), peek());
                    break;

                case LOOP:
                    ip.jump(-ip.next());
                    break;
                case FALSEY_JUMP: {
                    int offset = ip.next();
                    if (!peek().isTruthy()) {
                        ip.jump(offset);
                    }
                    break;
                }
                case ALWAYS_JUMP:
                    ip.jump(ip.next());
                    break;
                case ADVANCE:
                    advance();
                    break;
                case POP:
                    pop();
                    break;

                case ENUM:
                    push(new PalEnum(readName()));
                    break;
                case DEF_FIELD: {
                    String member = readName();
                    PalValue target = peek();
                    if (!(target instanceof PalEnum)) {
                        throw new PalRuntimeException("Can only define members on enumerations, got '"
                                + target.getTypeName() + "'");
                    }
                    if (!((PalEnum) target).addMember(member)) {
                        throw new PalRuntimeException(target + " already has a member '" + member + "'");
                    }
                    break;
                }
                case GET_FIELD: {
                    String member = readName();
                    PalValue target = pop();
                    if (!(target instanceof MemberAccess)) {
                        throw new PalRuntimeException("Can only read properties from enumerations, got '"
                                + target.getTypeName() + "'");
                    }
                    PalValue value = ((MemberAccess) target).getMember(member);
                    if (value == null) {
                        throw new PalRuntimeException(target + " has no property '" + member + "'");
                    }
                    push(value);
                    break;
                }
                case ARRAY:
                    push(new PalArray());
                    break;
                case DEF_ELEM: {
                    PalValue element = pop();
                    PalValue target = peek();
                    if (!(target instanceof PalArray)) {
                        throw new PalRuntimeException("Can only append elements to arrays, got '"
                                + target.getTypeName() + "'");
                    }
                    ((PalArray) target).append(element);
                    break;
                }

                case RETURN:
                    if (!returnFromFrame()) {
                        return;
                    }
                    break;
                case CALL: {
                    int argCount = ip.next();
                    PalValue callee = peek(argCount);
                    if (!callee.call(this, argCount)) {
                        throw new PalRuntimeException("'" + callee.getTypeName() + "' objects aren't callable");
                    }
                    break;
                }
                case YIELD:
                    yieldFromFrame();
                    break;
                case SLEEP:
                    sleep(pop());
                    break;

                case SCAN:
                case CLUSTER:
                case FILTER:
                case MARK:
                case TIGHTEN:
                case SEARCH:
                    if (actions != null) {
                        actions.perform(op);
                    } else {
                        unhandledOpcode.handle(code);
                    }
                    break;

                default:
                    unhandledOpcode.handle(code);
                    break;
            }
        }
    }

    // ============ 栈操作 ============

    private void push(PalValue value) {
        stack.push(value);
    }

    /**
     * 弹出当前帧窗口内的值，不允许越过窗口基址
     */
    private PalValue pop() {
        if (stack.size() <= frame.getBase() + 1) {
            throw new PalRuntimeException("Stack underflow");
        }
        return stack.pop();
    }

    private PalValue peek() {
        return peek(0);
    }

    private PalValue peek(int distance) {
        if (stack.size() - 1 - distance < frame.getBase()) {
            throw new PalRuntimeException("Stack underflow");
        }
        return stack.peek(distance);
    }

    private int localIndex(int slot) {
        int index = frame.getBase() + slot;
        if (index >= stack.size()) {
            throw new PalRuntimeException("Stack underflow: local slot " + slot + " is not on the stack");
        }
        return index;
    }

    private PalValue readConstant() {
        int index = frame.getIp().next();
        Chunk chunk = frame.getFunction().getChunk();
        if (index < 0 || index >= chunk.getConstantCount()) {
            throw new PalRuntimeException("Constant index " + index + " is out of range");
        }
        return chunk.getConstant(index);
    }

    private String readName() {
        PalValue name = readConstant();
        if (!(name instanceof PalString)) {
            throw new PalRuntimeException("Expected a name constant, got '" + name.getTypeName() + "'");
        }
        return ((PalString) name).getValue();
    }

    private PalRuntimeException undefined(String name) {
        return new PalRuntimeException("Undefined variable '" + name + "'");
    }

    private void binary(BinaryOperator operator) {
        PalValue right = pop();
        PalValue left = pop();
        push(operator.applyOrThrow(left, right));
    }

    // ============ 返回与生成器 ============

    /**
     * @return 最外层帧返回（运行结束）时为 false
     */
    private boolean returnFromFrame() {
        PalValue result = pop();
        CallFrame finished = frames.remove(frames.size() - 1);
        if (frames.isEmpty()) {
            stack.clear();
            frame = null;
            return false;
        }
        frame = frames.get(frames.size() - 1);
        stack.truncate(finished.getBase());
        if (finished.getIterator() != null) {
            // 生成器结束：迭代耗尽，调用方跳过所在循环
            finished.getIterator().markExhausted();
            beginSkip();
        } else {
            push(result);
        }
        return true;
    }

    private void yieldFromFrame() {
        PalIterator iterator = frame.getIterator();
        if (iterator == null) {
            throw new PalRuntimeException("Cannot yield outside of a running generator");
        }
        PalValue value = pop();
        int base = frame.getBase();
        iterator.getGenerator().save(new SavedFrame(stack.sliceFrom(base), frame.getIp().getPosition()));
        stack.truncate(base);
        frames.remove(frames.size() - 1);
        frame = frames.get(frames.size() - 1);
        push(value);
    }

    private void advance() {
        PalValue target = pop();
        if (target instanceof PalIterator) {
            PalIterator iterator = (PalIterator) target;
            if (iterator.isExhausted()) {
                beginSkip();
                return;
            }
            SavedFrame saved = iterator.getGenerator().getSavedFrame();
            PalFunction function = iterator.getGenerator().getFunction();
            int base = stack.size();
            stack.pushAll(saved.getWindow());
            pushFrame(function, new InstructionPointer(function.getChunk(), saved.getPosition()), base, iterator);
            return;
        }
        if (target instanceof PalNativeIterator) {
            PalNativeIterator iterator = (PalNativeIterator) target;
            PalValue next;
            try {
                next = iterator.hasNext() ? iterator.next() : null;
            } catch (PalException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PalRuntimeException("Native iterator '" + iterator.getName() + "' failed: "
                        + e.getMessage(), Collections.<String>emptyList(), e);
            }
            if (next == null) {
                beginSkip();
            } else {
                push(next);
            }
            return;
        }
        throw new PalRuntimeException("Can only iterate over iterators, got '" + target.getTypeName() + "'");
    }

    private void beginSkip() {
        skipping = true;
        skipOrigin = frame.getIp().getPosition() - 1;
    }

    /**
     * 跳过模式：解码但不执行，遇到跳回 ADVANCE 之前的 LOOP 后恢复执行
     */
    private void skip(OpCode op, int code) {
        if (op == null) {
            throw new PalRuntimeException("Corrupt bytecode: unknown opcode " + code + " inside a loop");
        }
        if (!op.hasOperand()) {
            return;
        }
        InstructionPointer ip = frame.getIp();
        int operand = ip.next();
        if (op == OpCode.LOOP && ip.getPosition() - operand <= skipOrigin) {
            skipping = false;
        }
    }

    // ============ 宿主交互 ============

    private void sleep(PalValue duration) {
        if (!(duration instanceof PalNumber)) {
            throw new PalRuntimeException("Can only wait for a number of seconds, got '"
                    + duration.getTypeName() + "'");
        }
        double seconds = ((PalNumber) duration).getValue();
        if (seconds < 0 || Double.isNaN(seconds)) {
            throw new PalRuntimeException("Cannot wait for " + duration + " seconds");
        }
        try {
            waitHandler.await(seconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PalRuntimeException("Interrupted while waiting", Collections.<String>emptyList(), e);
        }
    }

    private void trace(int offset) {
        StringBuilder sb = new StringBuilder();
        sb.append(stack).append('\n');
        Disassembler.instruction(frame.getFunction().getChunk(), offset, sb);
        LOG.finest(sb.toString());
    }

    // ============ 全局变量 ============

    public void defineGlobal(String name, PalValue value) {
        globals.put(name, value);
    }

    /**
     * @return 未定义时返回 null
     */
    public PalValue getGlobal(String name) {
        return globals.get(name);
    }

    public Map<String, PalValue> getGlobals() {
        return Collections.unmodifiableMap(globals);
    }

    /**
     * 最近一次运行的运行时错误；成功或编译失败时为 null
     */
    public PalRuntimeException getLastError() {
        return lastError;
    }

    // ============ Builder ============

    public static final class Builder {
        private final Map<String, PalValue> globals = new LinkedHashMap<>();
        private BiConsumer<String, PalValue> variableListener = (name, value) -> { };
        private UnhandledOpcodeHandler unhandledOpcode = UnhandledOpcodeHandler.RAISE;
        private Consumer<String> output = System.out::println;
        private Consumer<String> errorOutput;
        private InstrumentActions actions;
        private WaitHandler waitHandler = WaitHandler.SLEEP;
        private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
        private int maxStackSize = ValueStack.DEFAULT_LIMIT;

        Builder() {
        }

        /**
         * 全局变量被赋值时通知（用于宿主界面同步）
         */
        public Builder onVariableChanged(BiConsumer<String, PalValue> listener) {
            this.variableListener = listener;
            return this;
        }

        public Builder onUnhandledOpcode(UnhandledOpcodeHandler handler) {
            this.unhandledOpcode = handler;
            return this;
        }

        /**
         * 打印输出，每次一行
         */
        public Builder output(Consumer<String> output) {
            this.output = output;
            return this;
        }

        /**
         * 语法错误与运行时错误的输出；未设置时与打印输出相同
         */
        public Builder errorOutput(Consumer<String> errorOutput) {
            this.errorOutput = errorOutput;
            return this;
        }

        /**
         * 仪器动作绑定；未设置时动作交给 {@link #onUnhandledOpcode}
         */
        public Builder instrumentActions(InstrumentActions actions) {
            this.actions = actions;
            return this;
        }

        public Builder waitHandler(WaitHandler waitHandler) {
            this.waitHandler = waitHandler;
            return this;
        }

        public Builder global(String name, PalValue value) {
            globals.put(name, value);
            return this;
        }

        public Builder globals(Map<String, ? extends PalValue> values) {
            globals.putAll(values);
            return this;
        }

        public Builder maxCallDepth(int depth) {
            if (depth <= 0) {
                throw new IllegalArgumentException("maxCallDepth must be positive: " + depth);
            }
            this.maxCallDepth = depth;
            return this;
        }

        public Builder maxStackSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("maxStackSize must be positive: " + size);
            }
            this.maxStackSize = size;
            return this;
        }

        public VirtualMachine build() {
            return new VirtualMachine(this);
        }
    }
}
