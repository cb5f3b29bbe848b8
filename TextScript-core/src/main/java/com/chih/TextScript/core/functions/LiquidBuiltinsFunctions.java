package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.runtime.ScriptObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liquid 过滤器名称到内置函数的映射
 * <p>
 * Liquid 上下文把这些名称直接放在内置对象顶层 ({@code abs}、{@code downcase} 等)；
 * 解析器开启 {@code convertLiquidFunctions} 时则在语法树中改写为 {@code math.abs} 这样的成员访问。
 * </p>
 */
public class LiquidBuiltinsFunctions extends BuiltinFunctions {

    private static final Map<String, QualifiedName> LIQUID_FUNCTIONS = new LinkedHashMap<>();

    static {
        map("abs", "math", "abs");
        map("append", "string", "append");
        map("capitalize", "string", "capitalize");
        map("cycle", "array", "cycle");
        map("divided_by", "math", "divided_by");
        map("downcase", "string", "downcase");
        map("first", "array", "first");
        map("join", "array", "join");
        map("last", "array", "last");
        map("minus", "math", "minus");
        map("modulo", "math", "modulo");
        map("plus", "math", "plus");
        map("prepend", "string", "prepend");
        map("reverse", "array", "reverse");
        map("round", "math", "round");
        map("size", "array", "size");
        map("strip", "string", "strip");
        map("times", "math", "times");
        map("upcase", "string", "upcase");
    }

    public LiquidBuiltinsFunctions() {
        for (Map.Entry<String, QualifiedName> entry : LIQUID_FUNCTIONS.entrySet()) {
            QualifiedName target = entry.getValue();
            ScriptObject library = (ScriptObject) getValue(target.library());
            setValue(entry.getKey(), library.getValue(target.member()), true);
        }
    }

    /**
     * @return Liquid 过滤器对应的 {@code library.member}，未知名称返回 null
     */
    public static QualifiedName tryImportLiquid(String liquidName) {
        return LIQUID_FUNCTIONS.get(liquidName);
    }

    private static void map(String liquidName, String library, String member) {
        LIQUID_FUNCTIONS.put(liquidName, new QualifiedName(library, member));
    }

    public record QualifiedName(String library, String member) {
    }
}
