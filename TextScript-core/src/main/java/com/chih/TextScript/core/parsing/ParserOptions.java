package com.chih.TextScript.core.parsing;

/**
 * 语法分析选项 (不可变)
 *
 * @param expressionDepthLimit   表达式/语句嵌套深度上限，0 表示不限制
 * @param convertLiquidFunctions 将 Liquid 过滤器名 (abs, downcase...) 映射为内置函数 (math.abs, string.downcase...)
 */
public record ParserOptions(int expressionDepthLimit, boolean convertLiquidFunctions) {

    public static final ParserOptions DEFAULT = new ParserOptions(0, false);

    public ParserOptions withExpressionDepthLimit(int limit) {
        return new ParserOptions(limit, convertLiquidFunctions);
    }

    public ParserOptions withConvertLiquidFunctions(boolean enabled) {
        return new ParserOptions(expressionDepthLimit, enabled);
    }
}
