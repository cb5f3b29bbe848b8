package com.chih.TextScript.core.parsing;

/**
 * 词法单元类型，固定文本的 token 带有其字面量
 */
public enum TokenType {

    INVALID,

    FRONT_MATTER_MARKER,
    CODE_ENTER("{{"),
    LIQUID_TAG_ENTER("{%"),
    CODE_EXIT("}}"),
    LIQUID_TAG_EXIT("%}"),

    RAW,
    ESCAPE,
    ESCAPE_COUNT1,
    ESCAPE_COUNT2,
    ESCAPE_COUNT3,
    ESCAPE_COUNT4,
    ESCAPE_COUNT5,
    ESCAPE_COUNT6,
    ESCAPE_COUNT7,
    ESCAPE_COUNT8,
    ESCAPE_COUNT9,

    NEW_LINE,
    WHITESPACE,
    WHITESPACE_FULL,
    COMMENT,
    COMMENT_MULTI,

    IDENTIFIER,
    IDENTIFIER_SPECIAL,
    INTEGER,
    FLOAT,
    STRING,
    IMPLICIT_STRING,
    VERBATIM_STRING,

    SEMI_COLON(";"),
    ARROBA("@"),
    CARET("^"),
    COLON(":"),
    EQUAL("="),
    PIPE("|"),
    EXCLAMATION("!"),
    DOUBLE_AMP("&&"),
    DOUBLE_PIPE("||"),
    DOUBLE_EQUAL("=="),
    EXCLAMATION_EQUAL("!="),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    DOUBLE_LESS("<<"),
    DOUBLE_GREATER(">>"),
    DOT("."),
    DOUBLE_DOT(".."),
    DOUBLE_DOT_LESS("..<"),
    QUESTION("?"),
    DOUBLE_QUESTION("??"),
    PLUS("+"),
    MINUS("-"),
    ASTERISK("*"),
    DIVIDE("/"),
    DOUBLE_DIVIDE("//"),
    PERCENT("%"),
    COMMA(","),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    OPEN_BRACKET("["),
    CLOSE_BRACKET("]"),

    EOF;

    private final String text;

    TokenType() {
        this(null);
    }

    TokenType(String text) {
        this.text = text;
    }

    /**
     * 固定文本，非固定 token 返回 null
     */
    public String getText() {
        return text;
    }

    public boolean isEscapeCount() {
        return compareTo(ESCAPE_COUNT1) >= 0 && compareTo(ESCAPE_COUNT9) <= 0;
    }

    /**
     * ESCAPE_COUNTn 中的 n
     */
    public int escapeCount() {
        return isEscapeCount() ? ordinal() - ESCAPE_COUNT1.ordinal() + 1 : 0;
    }

    public static TokenType escapeCount(int count) {
        int capped = Math.max(1, Math.min(count, 9));
        return values()[ESCAPE_COUNT1.ordinal() + capped - 1];
    }
}
