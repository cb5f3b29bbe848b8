package com.chih.TextScript.core.parsing;

/**
 * 源码区间，起止位置均为闭区间
 */
public record SourceSpan(String fileName, TextPosition start, TextPosition end) {

    public static final SourceSpan EMPTY = new SourceSpan("<input>", TextPosition.START, TextPosition.START);

    public SourceSpan withEnd(TextPosition newEnd) {
        return new SourceSpan(fileName, start, newEnd);
    }

    public String toStringSimple() {
        return fileName + "(" + start.toStringSimple() + ")";
    }

    @Override
    public String toString() {
        return fileName + "(" + start.toStringSimple() + ")-(" + end.toStringSimple() + ")";
    }
}
