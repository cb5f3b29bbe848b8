package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.syntax.ScriptBinaryExpression;
import com.chih.TextScript.core.syntax.ScriptBinaryOperator;

import java.util.Locale;

/**
 * {@code string.*} 文本函数，参数统一按字符串转换，null 视为空串
 */
public class StringFunctions extends ScriptFunctionLibrary {

    public StringFunctions() {
        super("string");
        register("upcase", 1, 1, args -> upcase(args.getString(0)));
        register("downcase", 1, 1, args -> downcase(args.getString(0)));
        register("capitalize", 1, 1, args -> capitalize(args.getString(0)));
        register("append", 2, 2, args -> append(args.getString(0), args.getString(1)));
        register("prepend", 2, 2, args -> prepend(args.getString(0), args.getString(1)));
        register("size", 1, 1, args -> size(args.getString(0)));
        register("strip", 1, 1, args -> strip(args.getString(0)));
        // 与 Liquid 的 contains / startsWith / endsWith 运算符等价
        register("contains", 2, 2, args -> match(args, ScriptBinaryOperator.LIQUID_CONTAINS));
        register("starts_with", 2, 2, args -> match(args, ScriptBinaryOperator.LIQUID_STARTS_WITH));
        register("ends_with", 2, 2, args -> match(args, ScriptBinaryOperator.LIQUID_ENDS_WITH));
    }

    private static Object match(FunctionArguments args, ScriptBinaryOperator operator) {
        return ScriptBinaryExpression.evaluate(args.getContext(), args.getSpan(), operator, args.get(0), args.get(1));
    }

    public static String upcase(String text) {
        return text == null ? null : text.toUpperCase(Locale.ROOT);
    }

    public static String downcase(String text) {
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }

    public static String capitalize(String text) {
        if (text == null || text.isEmpty() || Character.isUpperCase(text.charAt(0))) {
            return text == null ? "" : text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    public static String append(String text, String with) {
        return (text == null ? "" : text) + (with == null ? "" : with);
    }

    public static String prepend(String text, String by) {
        return (by == null ? "" : by) + (text == null ? "" : text);
    }

    public static int size(String text) {
        return text == null ? 0 : text.length();
    }

    public static String strip(String text) {
        return text == null ? null : text.strip();
    }
}
