package com.lumenlang.compiler.ast;

/**
 * 源码位置信息。
 * <p>
 * IR 节点只使用 [startOffset, endOffset) 区间，行列号仅用于诊断输出。
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int startOffset;
    private final int endOffset;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, -1, -1);

    public SourceLocation(String file, int line, int column, int startOffset, int endOffset) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    /** 仅有偏移量的位置（合成代码使用） */
    public static SourceLocation ofOffsets(int startOffset, int endOffset) {
        return new SourceLocation(null, 0, 0, startOffset, endOffset);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public String toString() {
        if (file == null) {
            return "[" + startOffset + ", " + endOffset + ")";
        }
        return file + ":" + line + ":" + column;
    }
}
