package pal.runtime.bytecode;

import pal.runtime.PalException;

/**
 * 指向 {@link Chunk} 的指令游标
 */
public final class InstructionPointer {

    private final Chunk chunk;
    private int position;

    public InstructionPointer(Chunk chunk) {
        this(chunk, 0);
    }

    public InstructionPointer(Chunk chunk, int position) {
        this.chunk = chunk;
        moveTo(position);
    }

    public Chunk getChunk() {
        return chunk;
    }

    /**
     * 读取当前位置并前进一格
     *
     * @throws PalException 已越过块尾
     */
    public int next() {
        if (position >= chunk.size()) {
            throw new PalException("Instruction pointer ran past the end of the chunk");
        }
        return chunk.get(position++);
    }

    /**
     * 向前查看（0 为下一次 {@link #next()} 将读取的位置）
     *
     * @return 越界时返回 -1
     */
    public int peek(int distance) {
        int index = position + distance;
        return index >= 0 && index < chunk.size() ? chunk.get(index) : -1;
    }

    /**
     * 最近一次读取的值，尚未读取时返回 -1
     */
    public int previous() {
        return position > 0 ? chunk.get(position - 1) : -1;
    }

    public int getPosition() {
        return position;
    }

    /**
     * 相对跳转
     */
    public void jump(int offset) {
        moveTo(position + offset);
    }

    public void moveTo(int target) {
        if (target < 0 || target > chunk.size()) {
            throw new PalException("Jump target " + target + " is outside the chunk (size " + chunk.size() + ")");
        }
        position = target;
    }

    public boolean isAtEnd() {
        return position >= chunk.size();
    }

    /**
     * 最近一次读取位置的源码行号
     */
    public int getLine() {
        if (chunk.size() == 0) {
            return 0;
        }
        return chunk.getLine(Math.max(0, Math.min(position, chunk.size()) - 1));
    }
}
