package com.chih.TextScript.core.parsing;

/**
 * 源文本中的位置 (偏移量、行、列均从 0 开始)
 *
 * @since 2025/12/14
 */
public record TextPosition(int offset, int line, int column) {

    public static final TextPosition START = new TextPosition(0, 0, 0);

    public static final TextPosition EOF = new TextPosition(-1, -1, -1);

    public TextPosition nextColumn() {
        return new TextPosition(offset + 1, line, column + 1);
    }

    public TextPosition nextLine() {
        return new TextPosition(offset + 1, line + 1, 0);
    }

    /**
     * 面向用户的 1-based 表示: {@code line,column}
     */
    public String toStringSimple() {
        return (line + 1) + "," + (column + 1);
    }

    @Override
    public String toString() {
        return "(" + offset + ":" + line + "," + column + ")";
    }
}
