package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.math.BigDecimal;

/**
 * 字面量：null、布尔、数字、字符串
 */
public final class ScriptLiteral extends ScriptExpression {

    private final Object value;

    private final ScriptLiteralStringQuoteType quoteType;

    public ScriptLiteral(SourceSpan span, Object value) {
        this(span, value, ScriptLiteralStringQuoteType.DOUBLE_QUOTE);
    }

    public ScriptLiteral(SourceSpan span, Object value, ScriptLiteralStringQuoteType quoteType) {
        super(span);
        this.value = value;
        this.quoteType = quoteType != null ? quoteType : ScriptLiteralStringQuoteType.DOUBLE_QUOTE;
    }

    public Object getValue() {
        return value;
    }

    public ScriptLiteralStringQuoteType getQuoteType() {
        return quoteType;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return value;
    }

    public boolean isPositiveInteger() {
        if (value instanceof Integer) {
            return (Integer) value >= 0;
        }
        if (value instanceof Long) {
            return (Long) value > 0;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue() >= 0;
        }
        return false;
    }

    @Override
    public void write(TemplateRewriter writer) {
        if (value == null) {
            writer.write("null");
        } else if (value instanceof String) {
            writer.write(toLiteral(quoteType, (String) value));
        } else if (value instanceof Boolean) {
            writer.write((Boolean) value ? "true" : "false");
        } else if (value instanceof Double || value instanceof Float) {
            writer.write(appendDecimalPoint(value.toString()));
        } else if (value instanceof BigDecimal) {
            writer.write(appendDecimalPoint(((BigDecimal) value).toPlainString()));
        } else if (value instanceof Character) {
            writer.write(toLiteral(ScriptLiteralStringQuoteType.SIMPLE_QUOTE, value.toString()));
        } else {
            writer.write(value.toString());
        }
    }

    @Override
    public String toString() {
        return value != null ? value.toString() : "null";
    }

    public static String toLiteral(ScriptLiteralStringQuoteType quoteType, String input) {
        char quote;
        switch (quoteType) {
            case SIMPLE_QUOTE:
                quote = '\'';
                break;
            case VERBATIM:
                quote = '`';
                break;
            default:
                quote = '"';
                break;
        }

        StringBuilder literal = new StringBuilder(input.length() + 2);
        literal.append(quote);
        if (quoteType == ScriptLiteralStringQuoteType.VERBATIM) {
            literal.append(input.replace("`", "``"));
        } else {
            for (int i = 0; i < input.length(); i++) {
                char c = input.charAt(i);
                switch (c) {
                    case '\\':
                        literal.append("\\\\");
                        break;
                    case '\0':
                        literal.append("\\0");
                        break;
                    case '\b':
                        literal.append("\\b");
                        break;
                    case '\f':
                        literal.append("\\f");
                        break;
                    case '\n':
                        literal.append("\\n");
                        break;
                    case '\r':
                        literal.append("\\r");
                        break;
                    case '\t':
                        literal.append("\\t");
                        break;
                    case '\u000B':
                        literal.append("\\v");
                        break;
                    default:
                        if (c == quote) {
                            literal.append('\\').append(c);
                        } else if (Character.isISOControl(c)) {
                            literal.append(String.format("\\u%04x", (int) c));
                        } else {
                            literal.append(c);
                        }
                        break;
                }
            }
        }
        literal.append(quote);
        return literal.toString();
    }

    private static String appendDecimalPoint(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == 'e' || c == 'E' || c == '.') {
                return text;
            }
        }
        if ("NaN".equals(text) || text.contains("Infinity")) {
            return text;
        }
        return text + ".0";
    }
}
