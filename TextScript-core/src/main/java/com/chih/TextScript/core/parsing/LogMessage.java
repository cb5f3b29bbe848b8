package com.chih.TextScript.core.parsing;

import java.util.Locale;
import java.util.Objects;

/**
 * 词法/语法诊断信息
 * <p>
 * 格式化为单行文本：{@code <file>(<line>,<col>) : <severity> : <message>}
 * </p>
 */
public record LogMessage(ParserMessageType type, SourceSpan span, String message) {

    public LogMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(message, "message");
    }

    public static LogMessage error(SourceSpan span, String message) {
        return new LogMessage(ParserMessageType.ERROR, span, message);
    }

    public boolean isError() {
        return type == ParserMessageType.ERROR;
    }

    @Override
    public String toString() {
        return span.toStringSimple() + " : " + type.name().toLowerCase(Locale.ROOT) + " : " + message;
    }
}
