package pal.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pal.runtime.bytecode.Chunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 值模型单元测试
 */
class PalValueTest {

    enum Shape { CIRCLE, SQUARE }

    private static PalNumber num(double value) {
        return PalNumber.of(value);
    }

    /** 记录压入的调用帧的最小调用上下文 */
    private static final class RecordingContext implements CallContext {
        final ValueStack stack = new ValueStack();
        final List<Integer> frameBases = new ArrayList<>();

        @Override
        public ValueStack getStack() {
            return stack;
        }

        @Override
        public void pushFrame(PalFunction function, int base) {
            frameBases.add(base);
        }
    }

    @Nested
    @DisplayName("数值")
    class NumberTests {

        @Test
        @DisplayName("算术运算")
        void testArithmetic() {
            assertEquals(num(5), num(2).add(num(3)));
            assertEquals(num(-1), num(2).sub(num(3)));
            assertEquals(num(8), num(2).power(num(3)));
            assertEquals(num(-2), num(2).negate());
        }

        @Test
        @DisplayName("按位或仅对整数有效")
        void testMix() {
            assertEquals(num(7), num(5).mix(num(3)));
            assertNull(num(1.5).mix(num(3)));
        }

        @Test
        @DisplayName("比较运算")
        void testComparison() {
            assertSame(PalBoolean.TRUE, num(1).less(num(2)));
            assertSame(PalBoolean.FALSE, num(1).more(num(2)));
            assertSame(PalBoolean.TRUE, num(2).equal(num(2)));
        }

        @Test
        @DisplayName("整数值不带小数打印")
        void testToString() {
            assertEquals("3", num(3).toString());
            assertEquals("-4", num(-4).toString());
            assertEquals("2.5", num(2.5).toString());
        }

        @Test
        @DisplayName("零为假")
        void testTruthiness() {
            assertFalse(num(0).isTruthy());
            assertTrue(num(0.1).isTruthy());
        }

        @Test
        @DisplayName("与其它类型运算时拒绝")
        void testDeclines() {
            assertNull(num(1).add(PalString.of("a")));
            assertNull(num(1).equal(PalNil.NIL));
        }
    }

    @Nested
    @DisplayName("布尔、空值与字符串")
    class ScalarTests {

        @Test
        @DisplayName("布尔取反与相等")
        void testBoolean() {
            assertSame(PalBoolean.FALSE, PalBoolean.TRUE.invert());
            assertSame(PalBoolean.TRUE, PalBoolean.TRUE.equal(num(1)));
            assertSame(PalBoolean.FALSE, PalBoolean.TRUE.equal(num(2)));
            assertSame(PalBoolean.TRUE, PalBoolean.FALSE.equal(num(0)));
        }

        @Test
        @DisplayName("void 为假且只等于自身")
        void testNil() {
            assertFalse(PalNil.NIL.isTruthy());
            assertSame(PalBoolean.TRUE, PalNil.NIL.equal(PalNil.NIL));
            assertSame(PalBoolean.FALSE, PalNil.NIL.equal(num(0)));
            assertEquals("void", PalNil.NIL.toString());
        }

        @Test
        @DisplayName("字符串拼接与比较")
        void testString() {
            assertEquals(PalString.of("ab"), PalString.of("a").add(PalString.of("b")));
            assertSame(PalBoolean.TRUE, PalString.of("x").equal(PalString.of("x")));
            assertFalse(PalString.of("").isTruthy());
        }

        @Test
        @DisplayName("校正与算法标签按名称解析")
        void testTags() {
            assertSame(PalCorrection.DRIFT, PalCorrection.of("Drift"));
            assertSame(PalAlgorithm.MANHATTAN, PalAlgorithm.of("manhattan"));
            assertThrows(IllegalArgumentException.class, () -> PalCorrection.of("blur"));
        }
    }

    @Nested
    @DisplayName("数组")
    class ArrayTests {

        @Test
        @DisplayName("取反返回逆序副本")
        void testInvert() {
            PalArray array = new PalArray(Arrays.asList(num(1), num(2), num(3)));
            PalValue reversed = array.invert();
            assertEquals("[3, 2, 1]", reversed.toString());
            assertEquals("[1, 2, 3]", array.toString());
        }

        @Test
        @DisplayName("| 拼接两个数组")
        void testMix() {
            PalArray left = new PalArray(Collections.singletonList(num(1)));
            PalArray right = new PalArray(Arrays.asList(PalString.of("a"), PalNil.NIL));
            assertEquals("[1, a, void]", left.mix(right).toString());
        }

        @Test
        @DisplayName("逐元素相等")
        void testEqual() {
            PalArray a = new PalArray(Arrays.asList(num(1), PalString.of("x")));
            PalArray b = new PalArray(Arrays.asList(num(1), PalString.of("x")));
            PalArray c = new PalArray(Arrays.asList(num(1), num(2)));
            assertSame(PalBoolean.TRUE, a.equal(b));
            assertSame(PalBoolean.FALSE, a.equal(c));
            assertSame(PalBoolean.FALSE, a.equal(new PalArray()));
        }
        @Test
        @DisplayName("append 追加元素，+ 不适用于数组")
        void testAppend() {
            PalArray array = new PalArray();
            array.append(num(1));
            array.append(PalString.of("b"));

            assertEquals("[1, b]", array.toString());
            assertEquals(2, array.size());
            PalException e = assertThrows(PalException.class,
                    () -> BinaryOperator.ADD.applyOrThrow(array, new PalArray()));
            assertEquals("Unsupported operands for add: 'Array' and 'Array'", e.getMessage());
        }
    }

    @Nested
    @DisplayName("宿主对象")
    class NativeObjectTests {

        @Test
        @DisplayName("按载荷相等")
        void testEqual() {
            PalNativeObject stage = new PalNativeObject("stage-1");
            assertSame(PalBoolean.TRUE, stage.equal(new PalNativeObject("stage-1")));
            assertSame(PalBoolean.FALSE, stage.equal(new PalNativeObject("stage-2")));
            assertNull(stage.equal(num(1)));
            assertNull(BinaryOperator.EQUAL.apply(stage, num(1)));
        }

        @Test
        @DisplayName("类型名与打印形式")
        void testDescribe() {
            PalNativeObject stage = new PalNativeObject(new StringBuilder("xy"));
            assertEquals("NativeObject", stage.getTypeName());
            assertEquals("<NativeObject StringBuilder>", stage.toString());
            assertTrue(stage.isTruthy());
        }

        @Test
        @DisplayName("不支持算术运算")
        void testUnsupported() {
            PalException e = assertThrows(PalException.class,
                    () -> BinaryOperator.ADD.applyOrThrow(new PalNativeObject("s"), num(1)));
            assertEquals("Unsupported operands for add: 'NativeObject' and 'Number'", e.getMessage());
        }

        @Test
        @DisplayName("载荷不能为空")
        void testNullPayload() {
            assertThrows(NullPointerException.class, () -> new PalNativeObject(null));
        }
    }

    @Nested
    @DisplayName("二元运算分派")
    class BinaryOperatorTests {

        /** 只实现镜像加法的值 */
        private final PalValue meters = new PalValue() {
            @Override
            public String getTypeName() {
                return "Meters";
            }

            @Override
            public PalValue rAdd(PalValue left) {
                return PalString.of("meters+" + left);
            }
        };

        @Test
        @DisplayName("左操作数拒绝时使用右操作数的镜像方法")
        void testMirrored() {
            assertEquals(PalString.of("meters+2"), BinaryOperator.ADD.apply(num(2), meters));
        }

        @Test
        @DisplayName("less 的镜像为 more")
        void testComparisonMirror() {
            PalValue rightOnly = new PalValue() {
                @Override
                public String getTypeName() {
                    return "Probe";
                }

                @Override
                public PalValue more(PalValue other) {
                    return PalBoolean.TRUE;
                }
            };
            assertSame(PalBoolean.TRUE, BinaryOperator.LESS.apply(PalNil.NIL, rightOnly));
        }

        @Test
        @DisplayName("都拒绝时报告两个类型名")
        void testUnsupported() {
            assertNull(BinaryOperator.ADD.apply(num(1), PalString.of("a")));
            PalException e = assertThrows(PalException.class,
                    () -> BinaryOperator.ADD.applyOrThrow(num(1), PalString.of("a")));
            assertEquals("Unsupported operands for add: 'Number' and 'String'", e.getMessage());
        }
    }

    @Nested
    @DisplayName("可调用值")
    class CallableTests {

        @Test
        @DisplayName("函数调用压入以被调用者为基址的帧")
        void testFunctionCall() {
            RecordingContext context = new RecordingContext();
            PalFunction function = new PalFunction("f", 2, new Chunk());
            context.stack.push(PalNil.NIL);
            context.stack.push(function);
            context.stack.push(num(1));
            context.stack.push(num(2));

            assertTrue(function.call(context, 2));
            assertEquals(Collections.singletonList(1), context.frameBases);
        }

        @Test
        @DisplayName("参数个数不匹配")
        void testArity() {
            RecordingContext context = new RecordingContext();
            PalFunction function = new PalFunction("add", 2, new Chunk());
            context.stack.push(function);
            context.stack.push(num(1));

            PalException e = assertThrows(PalException.class, () -> function.call(context, 1));
            assertEquals("<Function add> expected 2 arguments, got 1", e.getMessage());
        }

        @Test
        @DisplayName("生成器调用得到迭代器")
        void testGeneratorCall() {
            RecordingContext context = new RecordingContext();
            PalGenerator generator = new PalGenerator(new PalFunction("g", 1, new Chunk()));
            context.stack.push(generator);
            context.stack.push(num(5));

            assertTrue(generator.call(context, 1));
            assertEquals(1, context.stack.size());
            PalValue top = context.stack.peek();
            assertTrue(top instanceof PalIterator);

            SavedFrame saved = ((PalIterator) top).getGenerator().getSavedFrame();
            assertEquals(0, saved.getPosition());
            assertEquals(Arrays.asList(generator, num(5)), saved.getWindow());
            assertNull(generator.getSavedFrame(), "声明的生成器本身不被修改");
        }

        @Test
        @DisplayName("原生函数替换被调用者与参数为结果")
        void testNativeFunction() {
            RecordingContext context = new RecordingContext();
            PalNativeFunction sum = new PalNativeFunction("sum", PalNativeFunction.VARIADIC, args -> {
                double total = 0;
                for (PalValue arg : args) {
                    total += ((PalNumber) arg).getValue();
                }
                return num(total);
            });
            context.stack.push(sum);
            context.stack.push(num(1));
            context.stack.push(num(2));
            context.stack.push(num(3));

            assertTrue(sum.call(context, 3));
            assertEquals(Collections.singletonList(num(6)), context.stack.snapshot());
        }

        @Test
        @DisplayName("原生函数内部异常被包装")
        void testNativeFailure() {
            RecordingContext context = new RecordingContext();
            PalNativeFunction broken = new PalNativeFunction("broken", 0, args -> {
                throw new IllegalStateException("boom");
            });
            context.stack.push(broken);

            PalException e = assertThrows(PalException.class, () -> broken.call(context, 0));
            assertEquals("Native function 'broken' failed: boom", e.getMessage());
        }

        @Test
        @DisplayName("普通值不可调用")
        void testNotCallable() {
            assertFalse(num(1).call(new RecordingContext(), 0));
        }
    }

    @Nested
    @DisplayName("枚举")
    class EnumTests {

        @Test
        @DisplayName("成员值为声明顺序")
        void testEnum() {
            PalEnum colors = new PalEnum("Color");
            assertTrue(colors.addMember("Red"));
            assertTrue(colors.addMember("Green"));
            assertFalse(colors.addMember("Red"));
            assertEquals(num(1), colors.getMember("Green"));
            assertNull(colors.getMember("Blue"));
            assertEquals("<Enum Color>", colors.toString());
        }

        @Test
        @DisplayName("原生枚举按序号映射")
        void testNativeEnum() {
            PalNativeEnum shapes = PalNativeEnum.of(Shape.class);
            assertEquals(num(0), shapes.getMember("CIRCLE"));
            assertEquals(num(1), shapes.getMember("SQUARE"));
        }
    }
}
