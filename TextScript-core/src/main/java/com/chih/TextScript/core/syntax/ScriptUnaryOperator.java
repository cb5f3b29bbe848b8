package com.chih.TextScript.core.syntax;

/**
 * 一元运算符
 */
public enum ScriptUnaryOperator {

    NOT("!"),
    NEGATE("-"),
    PLUS("+"),
    /** {@code @f} 取函数本身而不调用 */
    FUNCTION_ALIAS("@"),
    /** {@code ^list} 调用时把列表展开为多个参数 */
    FUNCTION_PARAMETERS_EXPAND("^");

    private final String text;

    ScriptUnaryOperator(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
