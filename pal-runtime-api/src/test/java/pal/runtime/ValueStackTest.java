package pal.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 共享操作数栈测试
 */
class ValueStackTest {

    private static PalNumber num(double value) {
        return PalNumber.of(value);
    }

    @Test
    @DisplayName("后进先出")
    void testPushPop() {
        ValueStack stack = new ValueStack();
        stack.push(num(1));
        stack.push(num(2));
        assertThat(stack.peek()).isEqualTo(num(2));
        assertThat(stack.peek(1)).isEqualTo(num(1));
        assertThat(stack.pop()).isEqualTo(num(2));
        assertThat(stack.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("空栈弹出报告下溢")
    void testUnderflow() {
        ValueStack stack = new ValueStack();
        assertThatThrownBy(stack::pop)
                .isInstanceOf(PalException.class)
                .hasMessage("Stack underflow");
    }

    @Test
    @DisplayName("超过容量上限报告溢出")
    void testOverflow() {
        ValueStack stack = new ValueStack(2);
        stack.push(num(1));
        stack.push(num(2));
        assertThatThrownBy(() -> stack.push(num(3)))
                .isInstanceOf(PalException.class)
                .hasMessage("Stack overflow");
    }

    @Test
    @DisplayName("窗口复制与收缩")
    void testWindow() {
        ValueStack stack = new ValueStack();
        stack.pushAll(Arrays.asList(num(1), num(2), num(3), num(4)));

        assertThat(stack.sliceFrom(2)).containsExactly(num(3), num(4));
        stack.truncate(1);
        assertThat(stack.snapshot()).containsExactly(num(1));
        assertThatThrownBy(() -> stack.truncate(5)).isInstanceOf(PalException.class);
    }

    @Test
    @DisplayName("按槽位读写")
    void testSlots() {
        ValueStack stack = new ValueStack();
        stack.push(PalNil.NIL);
        stack.push(num(7));
        stack.set(0, num(9));

        assertThat(stack.get(0)).isEqualTo(num(9));
        assertThat(stack.toString()).isEqualTo("[ 9 ][ 7 ]");
        assertThatThrownBy(() -> stack.get(2))
                .isInstanceOf(PalException.class)
                .hasMessageContaining("out of range");
    }
}
