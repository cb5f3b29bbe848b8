package com.chih.TextScript.core.syntax;

/**
 * 二元运算符，带源码文本与优先级 (数值越大结合越紧)
 */
public enum ScriptBinaryOperator {

    EMPTY_COALESCING("??", 20),
    SHIFT_LEFT("<<", 25),
    SHIFT_RIGHT(">>", 25),
    OR("||", 30),
    AND("&&", 40),
    COMPARE_EQUAL("==", 50),
    COMPARE_NOT_EQUAL("!=", 50),
    COMPARE_LESS("<", 60),
    COMPARE_LESS_OR_EQUAL("<=", 60),
    COMPARE_GREATER(">", 60),
    COMPARE_GREATER_OR_EQUAL(">=", 60),
    LIQUID_CONTAINS("contains", 65),
    LIQUID_STARTS_WITH("startsWith", 65),
    LIQUID_ENDS_WITH("endsWith", 65),
    LIQUID_HAS_KEY("hasKey", 65),
    LIQUID_HAS_VALUE("hasValue", 65),
    ADD("+", 70),
    SUBTRACT("-", 70),
    MULTIPLY("*", 80),
    DIVIDE("/", 80),
    DIVIDE_ROUND("//", 80),
    MODULUS("%", 80),
    RANGE_INCLUDE("..", 90),
    RANGE_EXCLUDE("..<", 90);

    private final String text;

    private final int precedence;

    ScriptBinaryOperator(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    public String getText() {
        return text;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 50 || precedence == 60;
    }

    public boolean isArithmetic() {
        return precedence >= 70;
    }

    /**
     * 原生语法中等价的内置函数，只有 Liquid 专用运算符有
     */
    public String getFunctionName() {
        switch (this) {
            case LIQUID_CONTAINS:
                return "string.contains";
            case LIQUID_STARTS_WITH:
                return "string.starts_with";
            case LIQUID_ENDS_WITH:
                return "string.ends_with";
            case LIQUID_HAS_KEY:
                return "object.has_key";
            case LIQUID_HAS_VALUE:
                return "object.has_value";
            default:
                return null;
        }
    }

    /**
     * Liquid 的 contains / startsWith / endsWith
     */
    public boolean isStringMatch() {
        return this == LIQUID_CONTAINS || this == LIQUID_STARTS_WITH || this == LIQUID_ENDS_WITH;
    }
}
