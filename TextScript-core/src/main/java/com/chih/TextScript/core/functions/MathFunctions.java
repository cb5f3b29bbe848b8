package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.syntax.ScriptBinaryExpression;
import com.chih.TextScript.core.syntax.ScriptBinaryOperator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * {@code math.*} 数值函数
 * <p>
 * 四则运算复用二元表达式的数值提升规则，结果类型与 {@code a + b} 等运算符一致。
 * </p>
 */
public class MathFunctions extends ScriptFunctionLibrary {

    public MathFunctions() {
        super("math");
        register("abs", 1, 1, args -> abs(args.getSpan(), args.get(0)));
        register("plus", 2, 2, args -> binary(args, ScriptBinaryOperator.ADD));
        register("minus", 2, 2, args -> binary(args, ScriptBinaryOperator.SUBTRACT));
        register("times", 2, 2, args -> binary(args, ScriptBinaryOperator.MULTIPLY));
        register("modulo", 2, 2, args -> binary(args, ScriptBinaryOperator.MODULUS));
        register("divided_by", 2, 2, MathFunctions::dividedBy);
        register("round", 1, 2, args -> round(
                args.getContext().toObject(args.getSpan(), args.get(0), Double.class),
                args.getInt(1, "precision", 0)));
    }

    static Object abs(SourceSpan span, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer) {
            return Math.abs((Integer) value);
        } else if (value instanceof Long) {
            return Math.abs((Long) value);
        } else if (value instanceof Double) {
            return Math.abs((Double) value);
        } else if (value instanceof Float) {
            return Math.abs((Float) value);
        } else if (value instanceof BigDecimal) {
            return ((BigDecimal) value).abs();
        }
        throw new ScriptRuntimeException(span, String.format(
                "The value `%s` is not a number", value));
    }

    private static Object binary(FunctionArguments args, ScriptBinaryOperator operator) {
        return ScriptBinaryExpression.evaluate(args.getContext(), args.getSpan(), operator, args.get(0), args.get(1));
    }

    /**
     * 除数为整数时结果向下取整为整数
     */
    static Object dividedBy(FunctionArguments args) {
        TemplateContext context = args.getContext();
        Object divisor = args.get(1);
        Double value = context.toObject(args.getSpan(), args.get(0), Double.class);
        Object result = ScriptBinaryExpression.evaluate(context, args.getSpan(), ScriptBinaryOperator.DIVIDE, value, divisor);
        if (divisor instanceof Integer && (result instanceof Double || result instanceof Float)) {
            return (int) Math.floor(((Number) result).doubleValue());
        }
        return result;
    }

    /**
     * 银行家舍入
     */
    public static double round(double value, int precision) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
    }
}
