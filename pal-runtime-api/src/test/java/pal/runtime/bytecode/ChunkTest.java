package pal.runtime.bytecode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pal.runtime.PalException;
import pal.runtime.PalNumber;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chunk 与 InstructionPointer 测试
 */
class ChunkTest {

    @Nested
    @DisplayName("字节码块")
    class ChunkTests {

        @Test
        @DisplayName("每个位置都记录行号")
        void testLines() {
            Chunk chunk = new Chunk();
            chunk.write(OpCode.CONSTANT, 1);
            chunk.write(0, 1);
            chunk.write(OpCode.RETURN, 2);

            assertEquals(3, chunk.size());
            assertEquals(OpCode.CONSTANT.getCode(), chunk.get(0));
            assertEquals(1, chunk.getLine(1));
            assertEquals(2, chunk.getLine(2));
        }

        @Test
        @DisplayName("容量自动增长")
        void testGrowth() {
            Chunk chunk = new Chunk();
            for (int i = 0; i < 100; i++) {
                chunk.write(OpCode.POP, i);
            }
            assertEquals(100, chunk.size());
            assertEquals(99, chunk.getLine(99));
        }

        @Test
        @DisplayName("回填已写入的位置")
        void testSet() {
            Chunk chunk = new Chunk();
            chunk.write(OpCode.ALWAYS_JUMP, 1);
            chunk.write(0xFFFF, 1);
            chunk.set(1, 4);
            assertEquals(4, chunk.get(1));
            assertThrows(IndexOutOfBoundsException.class, () -> chunk.set(2, 0));
        }

        @Test
        @DisplayName("常量索引按加入顺序分配")
        void testConstants() {
            Chunk chunk = new Chunk();
            assertEquals(0, chunk.addConstant(PalNumber.of(1)));
            assertEquals(1, chunk.addConstant(PalNumber.of(1)));
            assertEquals(2, chunk.getConstantCount());
            assertEquals(PalNumber.of(1), chunk.getConstant(1));
        }
    }

    @Nested
    @DisplayName("操作码")
    class OpCodeTests {

        @Test
        @DisplayName("编码从 1 开始并可反查")
        void testCodes() {
            assertEquals(1, OpCode.CONSTANT.getCode());
            for (OpCode op : OpCode.values()) {
                assertSame(op, OpCode.fromCode(op.getCode()));
            }
            assertNull(OpCode.fromCode(0));
            assertNull(OpCode.fromCode(1000));
        }

        @Test
        @DisplayName("指令长度")
        void testLength() {
            assertEquals(2, OpCode.CONSTANT.getLength());
            assertEquals(2, OpCode.LOOP.getLength());
            assertEquals(2, OpCode.CALL.getLength());
            assertEquals(1, OpCode.ADVANCE.getLength());
            assertEquals(1, OpCode.SCAN.getLength());
        }

        @Test
        @DisplayName("仪器动作")
        void testActions() {
            assertTrue(OpCode.SEARCH.isInstrumentAction());
            assertTrue(OpCode.SCAN.isInstrumentAction());
            assertFalse(OpCode.SLEEP.isInstrumentAction());
        }
    }

    @Nested
    @DisplayName("指令游标")
    class InstructionPointerTests {

        private Chunk threeOps() {
            Chunk chunk = new Chunk();
            chunk.write(OpCode.TRUE, 1);
            chunk.write(OpCode.POP, 2);
            chunk.write(OpCode.NULL, 3);
            return chunk;
        }

        @Test
        @DisplayName("顺序读取与查看")
        void testNextAndPeek() {
            InstructionPointer ip = new InstructionPointer(threeOps());
            assertEquals(-1, ip.previous());
            assertEquals(OpCode.TRUE.getCode(), ip.next());
            assertEquals(OpCode.TRUE.getCode(), ip.previous());
            assertEquals(OpCode.POP.getCode(), ip.peek(0));
            assertEquals(-1, ip.peek(5));
            assertEquals(1, ip.getLine());
        }

        @Test
        @DisplayName("越过块尾报错")
        void testPastEnd() {
            InstructionPointer ip = new InstructionPointer(threeOps(), 3);
            assertTrue(ip.isAtEnd());
            assertThrows(PalException.class, ip::next);
        }

        @Test
        @DisplayName("相对跳转")
        void testJump() {
            InstructionPointer ip = new InstructionPointer(threeOps());
            ip.jump(2);
            assertEquals(OpCode.NULL.getCode(), ip.next());
            ip.jump(-3);
            assertEquals(0, ip.getPosition());
            assertThrows(PalException.class, () -> ip.jump(-1));
        }
    }
}
