package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.EmptyScriptObject;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 二元表达式
 * <p>
 * 求值时两侧操作数都会先求值 ({@code &&} 与 {@code ||} 不短路)，再按固定的判定顺序分派：
 * 空合并、逻辑运算、列表移位、hasKey/hasValue、empty 语义、字符串语义，最后按最宽的数值类型计算。
 * </p>
 */
public final class ScriptBinaryExpression extends ScriptExpression {

    private static final MathContext DECIMAL_CONTEXT = MathContext.DECIMAL128;

    private final ScriptExpression left;

    private final ScriptBinaryOperator operator;

    private final ScriptExpression right;

    public ScriptBinaryExpression(SourceSpan span, ScriptExpression left, ScriptBinaryOperator operator, ScriptExpression right) {
        super(span);
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    public ScriptExpression getLeft() {
        return left;
    }

    public ScriptBinaryOperator getOperator() {
        return operator;
    }

    public ScriptExpression getRight() {
        return right;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object leftValue = context.evaluate(left);
        Object rightValue = context.evaluate(right);
        return evaluate(context, getSpan(), operator, leftValue, rightValue);
    }

    @Override
    public void write(TemplateRewriter writer) {
        String functionName = operator.getFunctionName();
        if (functionName != null) {
            // 原生语法没有 Liquid 专用运算符，写为函数调用
            writer.write("(").write(functionName)
                    .write(" (").write(left).write(") (").write(right).write("))");
            return;
        }
        writer.write(left).write(" ").write(operator.getText()).write(" ").write(right);
    }

    /**
     * 对两个已求值的操作数执行运算，case/when 的相等比较也走这里
     */
    public static Object evaluate(TemplateContext context, SourceSpan span, ScriptBinaryOperator op,
                                  Object leftValue, Object rightValue) {
        switch (op) {
            case EMPTY_COALESCING:
                return leftValue != null ? leftValue : rightValue;
            case AND:
            case OR: {
                boolean leftBool = context.toBool(span, leftValue);
                boolean rightBool = context.toBool(span, rightValue);
                return op == ScriptBinaryOperator.AND ? leftBool && rightBool : leftBool || rightBool;
            }
            case SHIFT_LEFT:
                if (leftValue instanceof List) {
                    ScriptArray newList = new ScriptArray((List<?>) leftValue);
                    newList.add(rightValue);
                    return newList;
                }
                break;
            case SHIFT_RIGHT:
                if (rightValue instanceof List) {
                    ScriptArray newList = new ScriptArray((List<?>) rightValue);
                    newList.add(0, leftValue);
                    return newList;
                }
                break;
            case LIQUID_HAS_KEY:
                if (leftValue instanceof Map) {
                    return ((Map<?, ?>) leftValue).containsKey(context.toString(span, rightValue));
                }
                break;
            case LIQUID_HAS_VALUE:
                if (leftValue instanceof Map) {
                    return ((Map<?, ?>) leftValue).get(context.toString(span, rightValue)) != null;
                }
                break;
            default:
                if (leftValue == EmptyScriptObject.DEFAULT || rightValue == EmptyScriptObject.DEFAULT) {
                    return calculateEmpty(context, span, op, leftValue, rightValue);
                }
                if (leftValue instanceof String || rightValue instanceof String) {
                    return calculateToString(context, span, op, leftValue, rightValue);
                }
                return calculateOthers(context, span, op, leftValue, rightValue);
        }
        throw new ScriptRuntimeException(span, String.format("Operator `%s` is not implemented for `%s` and `%s`",
                op.getText(), leftValue, rightValue));
    }

    private static Object calculateEmpty(TemplateContext context, SourceSpan span, ScriptBinaryOperator op,
                                         Object leftValue, Object rightValue) {
        boolean leftIsEmpty = leftValue == EmptyScriptObject.DEFAULT;
        boolean rightIsEmpty = rightValue == EmptyScriptObject.DEFAULT;
        if (leftIsEmpty && rightIsEmpty) {
            switch (op) {
                case COMPARE_EQUAL:
                case COMPARE_GREATER_OR_EQUAL:
                case COMPARE_LESS_OR_EQUAL:
                    return true;
                case COMPARE_NOT_EQUAL:
                case COMPARE_GREATER:
                case COMPARE_LESS:
                case LIQUID_CONTAINS:
                case LIQUID_STARTS_WITH:
                case LIQUID_ENDS_WITH:
                    return false;
                default:
                    return EmptyScriptObject.DEFAULT;
            }
        }

        Object against = leftIsEmpty ? rightValue : leftValue;
        Object againstEmpty = context.isEmpty(span, against);
        if (op.isArithmetic()) {
            return EmptyScriptObject.DEFAULT;
        }
        switch (op) {
            case COMPARE_EQUAL:
            case COMPARE_GREATER_OR_EQUAL:
            case COMPARE_LESS_OR_EQUAL:
                return againstEmpty;
            case COMPARE_NOT_EQUAL:
                return againstEmpty instanceof Boolean ? !(Boolean) againstEmpty : againstEmpty;
            case COMPARE_GREATER:
            case COMPARE_LESS:
            case LIQUID_CONTAINS:
            case LIQUID_STARTS_WITH:
            case LIQUID_ENDS_WITH:
                return false;
            default:
                throw new ScriptRuntimeException(span, String.format("Operator `%s` is not implemented for `%s` and `%s`",
                        op.getText(), leftIsEmpty ? "empty" : leftValue, rightIsEmpty ? "empty" : rightValue));
        }
    }

    private static Object calculateToString(TemplateContext context, SourceSpan span, ScriptBinaryOperator op,
                                            Object leftValue, Object rightValue) {
        if (op == ScriptBinaryOperator.MULTIPLY) {
            Object count = leftValue;
            Object text = rightValue;
            if (rightValue instanceof Integer) {
                count = rightValue;
                text = leftValue;
            }
            if (!(count instanceof Integer)) {
                throw new ScriptRuntimeException(span, "Operator `*` is not supported for the expression. "
                        + "Only working on string x int or int x string");
            }
            return Objects.toString(context.toString(span, text), "").repeat(Math.max(0, (Integer) count));
        }

        String leftText = Objects.toString(context.toString(span, leftValue), "");
        String rightText = Objects.toString(context.toString(span, rightValue), "");
        switch (op) {
            case ADD:
                return leftText + rightText;
            case COMPARE_EQUAL:
                return leftText.equals(rightText);
            case COMPARE_NOT_EQUAL:
                return !leftText.equals(rightText);
            case COMPARE_GREATER:
                return leftText.compareTo(rightText) > 0;
            case COMPARE_LESS:
                return leftText.compareTo(rightText) < 0;
            case COMPARE_GREATER_OR_EQUAL:
                return leftText.compareTo(rightText) >= 0;
            case COMPARE_LESS_OR_EQUAL:
                return leftText.compareTo(rightText) <= 0;
            case LIQUID_CONTAINS:
                return leftText.contains(rightText);
            case LIQUID_STARTS_WITH:
                return leftText.startsWith(rightText);
            case LIQUID_ENDS_WITH:
                return leftText.endsWith(rightText);
            default:
                throw new ScriptRuntimeException(span, String.format("Operator `%s` is not supported on string", op.getText()));
        }
    }

    private static Object calculateOthers(TemplateContext context, SourceSpan span, ScriptBinaryOperator op,
                                          Object leftValue, Object rightValue) {
        if (leftValue == null && rightValue == null) {
            if (op == ScriptBinaryOperator.COMPARE_EQUAL) {
                return true;
            }
            return op.isArithmetic() ? null : Boolean.FALSE;
        }
        if (leftValue == null || rightValue == null) {
            return op.isArithmetic() ? null : Boolean.FALSE;
        }

        try {
            if (isDecimal(leftValue) || isDecimal(rightValue)) {
                return calculateDecimal(op, span,
                        context.toObject(span, leftValue, BigDecimal.class),
                        context.toObject(span, rightValue, BigDecimal.class));
            }
            if (leftValue instanceof Double || rightValue instanceof Double) {
                return calculateDouble(op, span,
                        context.toObject(span, leftValue, Double.class),
                        context.toObject(span, rightValue, Double.class));
            }
            if (leftValue instanceof Float || rightValue instanceof Float) {
                return calculateFloat(op, span,
                        context.toObject(span, leftValue, Float.class),
                        context.toObject(span, rightValue, Float.class));
            }
            if (leftValue instanceof Long || rightValue instanceof Long) {
                return calculateLong(op, span,
                        context.toObject(span, leftValue, Long.class),
                        context.toObject(span, rightValue, Long.class));
            }
            if (isIntLike(leftValue) || isIntLike(rightValue)) {
                return calculateInt(op, span,
                        context.toObject(span, leftValue, Integer.class),
                        context.toObject(span, rightValue, Integer.class));
            }
        } catch (ArithmeticException e) {
            throw new ScriptRuntimeException(span, String.format("Arithmetic error for `%s %s %s`: %s",
                    leftValue, op.getText(), rightValue, e.getMessage()), e);
        }
        if (leftValue instanceof Boolean || rightValue instanceof Boolean) {
            return calculateBool(op, span,
                    context.toObject(span, leftValue, Boolean.class),
                    context.toObject(span, rightValue, Boolean.class));
        }
        if (leftValue instanceof LocalDateTime && rightValue instanceof LocalDateTime) {
            return calculateDateTime(op, span, (LocalDateTime) leftValue, (LocalDateTime) rightValue);
        }
        if (leftValue instanceof LocalDateTime && rightValue instanceof Duration) {
            if (op == ScriptBinaryOperator.ADD) {
                return ((LocalDateTime) leftValue).plus((Duration) rightValue);
            }
            throw new ScriptRuntimeException(span, String.format("Operator `%s` is not implemented for `datetime` and `timespan`",
                    op.getText()));
        }
        if (op == ScriptBinaryOperator.COMPARE_EQUAL) {
            return leftValue.equals(rightValue);
        }
        if (op == ScriptBinaryOperator.COMPARE_NOT_EQUAL) {
            return !leftValue.equals(rightValue);
        }
        throw new ScriptRuntimeException(span, String.format("Unsupported types `%s/%s` %s `%s/%s` for binary operation",
                leftValue, leftValue.getClass().getSimpleName(), op.getText(),
                rightValue, rightValue.getClass().getSimpleName()));
    }

    private static boolean isDecimal(Object value) {
        return value instanceof BigDecimal || value instanceof BigInteger;
    }

    private static boolean isIntLike(Object value) {
        return value instanceof Integer || value instanceof Short || value instanceof Byte || value instanceof Enum;
    }

    private static Object calculateInt(ScriptBinaryOperator op, SourceSpan span, int left, int right) {
        switch (op) {
            case ADD:
                return left + right;
            case SUBTRACT:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                return (double) left / right;
            case DIVIDE_ROUND:
                return left / right;
            case MODULUS:
                return left % right;
            case COMPARE_EQUAL:
                return left == right;
            case COMPARE_NOT_EQUAL:
                return left != right;
            case COMPARE_GREATER:
                return left > right;
            case COMPARE_LESS:
                return left < right;
            case COMPARE_GREATER_OR_EQUAL:
                return left >= right;
            case COMPARE_LESS_OR_EQUAL:
                return left <= right;
            case RANGE_INCLUDE:
                return new Range(left, right, true, true);
            case RANGE_EXCLUDE:
                return new Range(left, right, false, true);
            default:
                throw unsupportedForType(span, op, "integer");
        }
    }

    private static Object calculateLong(ScriptBinaryOperator op, SourceSpan span, long left, long right) {
        switch (op) {
            case ADD:
                return left + right;
            case SUBTRACT:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                return (double) left / right;
            case DIVIDE_ROUND:
                return left / right;
            case MODULUS:
                return left % right;
            case COMPARE_EQUAL:
                return left == right;
            case COMPARE_NOT_EQUAL:
                return left != right;
            case COMPARE_GREATER:
                return left > right;
            case COMPARE_LESS:
                return left < right;
            case COMPARE_GREATER_OR_EQUAL:
                return left >= right;
            case COMPARE_LESS_OR_EQUAL:
                return left <= right;
            case RANGE_INCLUDE:
                return new Range(left, right, true, false);
            case RANGE_EXCLUDE:
                return new Range(left, right, false, false);
            default:
                throw unsupportedForType(span, op, "long");
        }
    }

    private static Object calculateDouble(ScriptBinaryOperator op, SourceSpan span, double left, double right) {
        switch (op) {
            case ADD:
                return left + right;
            case SUBTRACT:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                return left / right;
            case DIVIDE_ROUND:
                return Math.rint(left / right);
            case MODULUS:
                return left % right;
            case COMPARE_EQUAL:
                return left == right;
            case COMPARE_NOT_EQUAL:
                return left != right;
            case COMPARE_GREATER:
                return left > right;
            case COMPARE_LESS:
                return left < right;
            case COMPARE_GREATER_OR_EQUAL:
                return left >= right;
            case COMPARE_LESS_OR_EQUAL:
                return left <= right;
            default:
                throw unsupportedForType(span, op, "double");
        }
    }

    private static Object calculateFloat(ScriptBinaryOperator op, SourceSpan span, float left, float right) {
        switch (op) {
            case ADD:
                return left + right;
            case SUBTRACT:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                return left / right;
            case DIVIDE_ROUND:
                return (double) (int) (left / right);
            case MODULUS:
                return left % right;
            case COMPARE_EQUAL:
                return left == right;
            case COMPARE_NOT_EQUAL:
                return left != right;
            case COMPARE_GREATER:
                return left > right;
            case COMPARE_LESS:
                return left < right;
            case COMPARE_GREATER_OR_EQUAL:
                return left >= right;
            case COMPARE_LESS_OR_EQUAL:
                return left <= right;
            default:
                throw unsupportedForType(span, op, "float");
        }
    }

    private static Object calculateDecimal(ScriptBinaryOperator op, SourceSpan span, BigDecimal left, BigDecimal right) {
        switch (op) {
            case ADD:
                return left.add(right);
            case SUBTRACT:
                return left.subtract(right);
            case MULTIPLY:
                return left.multiply(right);
            case DIVIDE:
                return left.divide(right, DECIMAL_CONTEXT);
            case DIVIDE_ROUND:
                return left.divide(right, 0, RoundingMode.HALF_EVEN);
            case MODULUS:
                return left.remainder(right);
            case COMPARE_EQUAL:
                return left.compareTo(right) == 0;
            case COMPARE_NOT_EQUAL:
                return left.compareTo(right) != 0;
            case COMPARE_GREATER:
                return left.compareTo(right) > 0;
            case COMPARE_LESS:
                return left.compareTo(right) < 0;
            case COMPARE_GREATER_OR_EQUAL:
                return left.compareTo(right) >= 0;
            case COMPARE_LESS_OR_EQUAL:
                return left.compareTo(right) <= 0;
            default:
                throw unsupportedForType(span, op, "decimal");
        }
    }

    private static Object calculateBool(ScriptBinaryOperator op, SourceSpan span, boolean left, boolean right) {
        switch (op) {
            case COMPARE_EQUAL:
                return left == right;
            case COMPARE_NOT_EQUAL:
                return left != right;
            default:
                throw unsupportedForType(span, op, "bool");
        }
    }

    private static Object calculateDateTime(ScriptBinaryOperator op, SourceSpan span, LocalDateTime left, LocalDateTime right) {
        switch (op) {
            case SUBTRACT:
                return Duration.between(right, left);
            case COMPARE_EQUAL:
                return left.isEqual(right);
            case COMPARE_NOT_EQUAL:
                return !left.isEqual(right);
            case COMPARE_LESS:
                return left.isBefore(right);
            case COMPARE_LESS_OR_EQUAL:
                return !left.isAfter(right);
            case COMPARE_GREATER:
                return left.isAfter(right);
            case COMPARE_GREATER_OR_EQUAL:
                return !left.isBefore(right);
            default:
                throw unsupportedForType(span, op, "datetime");
        }
    }

    private static ScriptRuntimeException unsupportedForType(SourceSpan span, ScriptBinaryOperator op, String typeName) {
        return new ScriptRuntimeException(span, String.format("Operator `%s` is not supported for type `%s`", op.getText(), typeName));
    }

    /**
     * 惰性整数区间，左端大于右端时递减
     */
    static final class Range implements Iterable<Object> {

        private final long from;

        private final long to;

        private final boolean inclusive;

        private final boolean asInt;

        Range(long from, long to, boolean inclusive, boolean asInt) {
            this.from = from;
            this.to = to;
            this.inclusive = inclusive;
            this.asInt = asInt;
        }

        @Override
        public Iterator<Object> iterator() {
            long step = from <= to ? 1 : -1;
            long last = inclusive ? to : to - step;
            boolean empty = !inclusive && from == to;
            return new Iterator<>() {
                private long next = from;
                private boolean done = empty;

                @Override
                public boolean hasNext() {
                    return !done;
                }

                @Override
                public Object next() {
                    if (done) {
                        throw new NoSuchElementException();
                    }
                    long current = next;
                    if (current == last) {
                        done = true;
                    } else {
                        next += step;
                    }
                    return asInt ? (Object) (int) current : (Object) current;
                }
            };
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder("[");
            for (Object value : this) {
                if (builder.length() > 1) {
                    builder.append(", ");
                }
                builder.append(value);
            }
            return builder.append(']').toString();
        }
    }
}
