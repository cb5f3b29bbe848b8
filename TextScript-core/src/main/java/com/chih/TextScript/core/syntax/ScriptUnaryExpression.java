package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 一元表达式
 */
public final class ScriptUnaryExpression extends ScriptExpression {

    private final ScriptUnaryOperator operator;

    private final ScriptExpression right;

    public ScriptUnaryExpression(SourceSpan span, ScriptUnaryOperator operator, ScriptExpression right) {
        super(span);
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    public ScriptUnaryOperator getOperator() {
        return operator;
    }

    public ScriptExpression getRight() {
        return right;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        switch (operator) {
            case NOT:
                return !context.toBool(right.getSpan(), context.evaluate(right));
            case NEGATE:
            case PLUS: {
                Object value = context.evaluate(right);
                if (value == null) {
                    return null;
                }
                boolean negate = operator == ScriptUnaryOperator.NEGATE;
                if (value instanceof Integer) {
                    return negate ? -((Integer) value) : value;
                }
                if (value instanceof Double) {
                    return negate ? -((Double) value) : value;
                }
                if (value instanceof Float) {
                    return negate ? -((Float) value) : value;
                }
                if (value instanceof Long) {
                    return negate ? -((Long) value) : value;
                }
                if (value instanceof BigDecimal) {
                    return negate ? ((BigDecimal) value).negate() : value;
                }
                throw new ScriptRuntimeException(getSpan(), String.format("Unexpected value `%s` of type `%s` for unary operator `%s`",
                        value, value.getClass().getSimpleName(), operator.getText()));
            }
            case FUNCTION_ALIAS:
                return context.evaluate(right, true);
            case FUNCTION_PARAMETERS_EXPAND:
                // 展开在函数调用处完成，这里只返回列表本身
                return context.evaluate(right);
            default:
                throw new ScriptRuntimeException(getSpan(), "Operator `" + operator + "` is not supported");
        }
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(operator.getText()).write(right);
    }
}
