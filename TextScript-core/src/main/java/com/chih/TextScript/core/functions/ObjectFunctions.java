package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.syntax.ScriptBinaryExpression;
import com.chih.TextScript.core.syntax.ScriptBinaryOperator;

/**
 * {@code object.*} 对象函数
 * <p>
 * {@code has_key} 与 {@code has_value} 对应 Liquid 的 hasKey / hasValue 运算符，
 * Liquid 模板写回原生语法时使用。
 * </p>
 */
public class ObjectFunctions extends ScriptFunctionLibrary {

    public ObjectFunctions() {
        super("object");
        register("has_key", 2, 2, args -> ScriptBinaryExpression.evaluate(args.getContext(), args.getSpan(),
                ScriptBinaryOperator.LIQUID_HAS_KEY, args.get(0), args.get(1)));
        register("has_value", 2, 2, args -> ScriptBinaryExpression.evaluate(args.getContext(), args.getSpan(),
                ScriptBinaryOperator.LIQUID_HAS_VALUE, args.get(0), args.get(1)));
    }
}
