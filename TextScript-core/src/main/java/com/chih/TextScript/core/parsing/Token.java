package com.chih.TextScript.core.parsing;

/**
 * 词法单元，起止位置均为闭区间
 */
public record Token(TokenType type, TextPosition start, TextPosition end) {

    public static final Token EOF = new Token(TokenType.EOF, TextPosition.EOF, TextPosition.EOF);

    public String getText(String source) {
        if (type == TokenType.EOF) {
            return "<eof>";
        }
        if (start.offset() >= 0 && start.offset() <= source.length()
                && end.offset() < source.length() && end.offset() + 1 >= start.offset()) {
            return source.substring(start.offset(), end.offset() + 1);
        }
        return "<error>";
    }

    public boolean match(String text, String source) {
        int length = end.offset() - start.offset() + 1;
        if (text.length() != length || start.offset() < 0) {
            return false;
        }
        return source.regionMatches(start.offset(), text, 0, length);
    }

    @Override
    public String toString() {
        return type + "(" + start + ":" + end + ")";
    }
}
