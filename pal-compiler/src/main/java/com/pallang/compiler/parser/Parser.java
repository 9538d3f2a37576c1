package com.pallang.compiler.parser;

import com.pallang.compiler.lexer.Keyword;
import com.pallang.compiler.lexer.Lexer;
import com.pallang.compiler.lexer.Token;
import com.pallang.compiler.lexer.TokenType;
import pal.runtime.PalFunction;
import pal.runtime.PalString;
import pal.runtime.PalValue;
import pal.runtime.bytecode.Chunk;
import pal.runtime.bytecode.OpCode;

import java.util.ArrayList;
import java.util.List;

import static com.pallang.compiler.lexer.TokenType.*;

/**
 * PAL 单遍编译器（Pratt 优先级爬升）
 *
 * <p>不构建语法树：规则在解析的同时直接向当前函数的 {@link Chunk} 生成字节码。
 * 语法错误以 {@link ParseException} 抛出，在声明边界捕获、记录并同步，
 * 因此一次编译可以报告多个互不相关的错误。</p>
 */
public class Parser {

    /** 常量索引与跳转距离上限 */
    static final int MAX_OPERAND = 0xFFFF;

    /** 参数个数上限 */
    static final int MAX_ARGUMENTS = 255;

    /** foreach 隐藏迭代器槽位的名字（含空格，源码无法引用） */
    static final String ITERATOR_SLOT = " iterator";

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;

    private final List<CompileError> errors = new ArrayList<>();
    private FunctionScope scope;

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        this.scope = new FunctionScope(null, FunctionKind.SCRIPT, PalFunction.SCRIPT_NAME);
        advance();  // 读取第一个 token
    }

    public Parser(String source, String fileName) {
        this(new Lexer(source, fileName), fileName);
    }

    // ============ 入口 ============

    /**
     * 编译整个源码
     *
     * @return 编译结果；存在错误时不含脚本函数
     */
    public CompileResult compile() {
        skipNewlines();
        while (!check(EOF)) {
            declaration();
            skipNewlines();
        }
        PalFunction script = (PalFunction) endFunction();
        if (!errors.isEmpty()) {
            return new CompileResult(null, errors);
        }
        return new CompileResult(script, errors);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean check(Keyword keyword) {
        return current.is(keyword);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 消费指定类型的 token，否则报错
     */
    Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw errorAtCurrent(message);
    }

    Token consume(Keyword keyword, String message) {
        if (check(keyword)) {
            return advance();
        }
        throw errorAtCurrent(message);
    }

    void skipNewlines() {
        while (match(EOL)) {
            // 空行
        }
    }

    // ============ 错误 ============

    ParseException error(Token token, String message) {
        return new ParseException(message, token);
    }

    /**
     * 以当前 token 报错；当前 token 本身是词法错误时报告它自己的信息
     */
    ParseException errorAtCurrent(String message) {
        if (current.is(ERROR)) {
            return new ParseException((String) current.getLiteral(), current);
        }
        return new ParseException(message, current);
    }

    ParseException errorAtPrevious(String message) {
        return new ParseException(message, previous);
    }

    public List<CompileError> getErrors() {
        return errors;
    }

    // ============ 声明与语句 ============

    /**
     * 编译一条语句；语法错误在此捕获并同步到下一条语句
     */
    void declaration() {
        FunctionScope savedScope = scope;
        int savedDepth = scope.getScopeDepth();
        int savedLocals = scope.getLocalCount();
        try {
            statement();
            if (!check(EOL) && !check(RBRACE) && !check(EOF)) {
                throw errorAtCurrent("Expected a '\\n' between statements");
            }
        } catch (ParseException e) {
            errors.add(new CompileError(e.getMessage(), e.getToken()));
            scope = savedScope;
            scope.restore(savedDepth, savedLocals);
            synchronize();
        }
    }

    private void statement() {
        StatementRule rule = RuleTable.statement(current);
        if (rule != null) {
            Token keyword = advance();
            rule.parse(this, keyword);
        } else if (match(LBRACE)) {
            scopedBlock();
        } else {
            expression();
            emit(OpCode.POP);
        }
    }

    /**
     * 恐慌模式同步：跳到换行之后或语句关键词之前
     */
    private void synchronize() {
        while (!check(EOF)) {
            if (previous != null && previous.is(EOL)) {
                return;
            }
            if (RuleTable.statement(current) != null) {
                return;
            }
            advance();
        }
    }

    /**
     * 跳过被拒绝的声明：同一行内直到 {@code {} 的部分以及配对的整个块。
     * 之后的同步从块的闭合括号之后开始，外层块的 {@code }} 不会被误配。
     */
    void skipRejectedBlock() {
        while (!check(LBRACE)) {
            if (check(EOL) || check(EOF)) {
                return;
            }
            advance();
        }
        int depth = 0;
        do {
            if (match(LBRACE)) {
                depth++;
            } else if (match(RBRACE)) {
                depth--;
            } else {
                advance();
            }
        } while (depth > 0 && !check(EOF));
    }

    /**
     * 编译 {@code {} 之后直到 {@code }} 的语句（不开新作用域）
     */
    void block() {
        skipNewlines();
        while (!check(RBRACE) && !check(EOF)) {
            declaration();
            skipNewlines();
        }
        consume(RBRACE, "Expected '}' to close the block");
    }

    /**
     * 在新的块作用域中编译 {@link #block()}
     */
    void scopedBlock() {
        beginScope();
        block();
        endScope();
    }

    // ============ 表达式 ============

    void expression() {
        parsePrecedence(Precedence.NONE);
    }

    /**
     * 优先级爬升：先调用前缀规则，再消费优先级高于 floor 的中缀运算
     */
    void parsePrecedence(Precedence floor) {
        Token token = advance();
        if (token.is(ERROR)) {
            throw error(token, (String) token.getLiteral());
        }
        if (token.isOneOf(EOL, EOF)) {
            throw error(token, "Expected expression");
        }
        PrefixRule prefix = RuleTable.prefix(token);
        if (prefix == null) {
            throw error(token, "Unexpected token '" + token.getLexeme() + "'");
        }

        boolean canAssign = floor.allowsAssignment();
        prefix.parse(this, token, canAssign);

        while (true) {
            InfixRule infix = RuleTable.infix(current);
            if (infix == null || infix.getPrecedence().compareTo(floor) <= 0) {
                break;
            }
            Token operator = advance();
            infix.parse(this, operator);
        }

        if (canAssign && check(ASSIGN)) {
            throw errorAtCurrent("Invalid assignment target");
        }
    }

    // ============ 变量 ============

    /**
     * 声明变量名
     *
     * @return 全局变量的名称常量索引；局部变量返回 0
     */
    int parseVariable(String message) {
        Token name = consume(IDENTIFIER, message);
        declareVariable(name);
        if (!scope.isGlobalScope()) {
            return 0;
        }
        return identifierConstant(name.getLexeme());
    }

    void declareVariable(Token name) {
        if (scope.isGlobalScope()) {
            return;
        }
        declareLocal(name, name.getLexeme());
    }

    /**
     * 声明局部变量（同一块内重名为错误）
     *
     * @return 槽位
     */
    int declareLocal(Token at, String localName) {
        if (scope.isDeclaredInCurrentScope(localName)) {
            throw error(at, "Already a variable called '" + localName + "' in this scope");
        }
        int slot = scope.addLocal(localName);
        if (slot < 0) {
            throw error(at, "Too many local variables in function");
        }
        return slot;
    }

    /**
     * 定义变量：全局生成 DEF_GLOBAL，局部标记为已初始化
     */
    void defineVariable(int global) {
        if (!scope.isGlobalScope()) {
            scope.markInitialized();
            return;
        }
        emit(OpCode.DEF_GLOBAL, global);
    }

    void markInitialized() {
        scope.markInitialized();
    }

    /**
     * 读取或赋值一个具名变量
     */
    void namedVariable(Token name, boolean canAssign) {
        OpCode getOp;
        OpCode setOp;
        int operand = scope.resolveLocal(name.getLexeme());
        if (operand >= 0) {
            if (!scope.isInitialized(operand)) {
                throw error(name, "Cannot read local variable in its own initializer");
            }
            getOp = OpCode.GET_LOCAL;
            setOp = OpCode.SET_LOCAL;
        } else {
            operand = identifierConstant(name.getLexeme());
            getOp = OpCode.GET_GLOBAL;
            setOp = OpCode.SET_GLOBAL;
        }

        if (canAssign && match(ASSIGN)) {
            expression();
            emit(setOp, operand);
        } else {
            emit(getOp, operand);
        }
    }

    int identifierConstant(String name) {
        return makeConstant(PalString.of(name));
    }

    // ============ 作用域与函数 ============

    void beginScope() {
        scope.beginScope();
    }

    void endScope() {
        int removed = scope.endScope();
        for (int i = 0; i < removed; i++) {
            emit(OpCode.POP);
        }
    }

    FunctionScope getScope() {
        return scope;
    }

    /**
     * 开始编译嵌套函数
     */
    void beginFunction(FunctionKind kind, String name) {
        scope = new FunctionScope(scope, kind, name);
        scope.beginScope();
    }

    /**
     * 结束当前函数：补充隐式返回并回到外层
     *
     * @return 编译得到的函数或生成器
     */
    PalValue endFunction() {
        emit(OpCode.NULL);
        emit(OpCode.RETURN);
        PalValue value = scope.toValue();
        if (scope.getEnclosing() != null) {
            scope = scope.getEnclosing();
        }
        return value;
    }

    // ============ 字节码生成 ============

    Chunk currentChunk() {
        return scope.getChunk();
    }

    private int line() {
        return previous != null ? previous.getLine() : 1;
    }

    void emit(OpCode op) {
        currentChunk().write(op, line());
    }

    void emit(OpCode op, int operand) {
        currentChunk().write(op, line());
        currentChunk().write(operand, line());
    }

    void emitConstant(PalValue value) {
        emit(OpCode.CONSTANT, makeConstant(value));
    }

    int makeConstant(PalValue value) {
        int index = currentChunk().addConstant(value);
        if (index > MAX_OPERAND) {
            throw errorAtPrevious("Too many constants in one chunk");
        }
        return index;
    }

    /**
     * 生成带占位操作数的向前跳转
     *
     * @return 占位操作数的位置
     */
    int emitJump(OpCode op) {
        emit(op, MAX_OPERAND);
        return currentChunk().size() - 1;
    }

    /**
     * 回填跳转：距离为从操作数之后到当前末尾
     */
    void patchJump(int operandIndex) {
        int jump = currentChunk().size() - operandIndex - 1;
        if (jump > MAX_OPERAND) {
            throw errorAtPrevious("Too much code to jump over");
        }
        currentChunk().set(operandIndex, jump);
    }

    /**
     * 生成向后跳转到 loopStart 的 LOOP
     */
    void emitLoop(int loopStart) {
        emit(OpCode.LOOP);
        int offset = currentChunk().size() + 1 - loopStart;
        if (offset > MAX_OPERAND) {
            throw errorAtPrevious("Loop body too large");
        }
        currentChunk().write(offset, line());
    }
}
