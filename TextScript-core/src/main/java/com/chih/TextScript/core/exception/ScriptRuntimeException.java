package com.chih.TextScript.core.exception;

import com.chih.TextScript.core.parsing.SourceSpan;

/**
 * 求值阶段的错误，携带出错节点的源码位置
 * <p>
 * {@link #getMessage()} 格式为 {@code <file>(<line>,<col>) : error : <message>}，
 * 原始描述可通过 {@link #getOriginalMessage()} 获取。
 * </p>
 */
public class ScriptRuntimeException extends TextScriptException {

    private final SourceSpan span;

    private final String originalMessage;

    public ScriptRuntimeException(SourceSpan span, String message) {
        this(span, message, null);
    }

    public ScriptRuntimeException(SourceSpan span, String message, Throwable cause) {
        super(format(span, message), cause);
        this.span = span != null ? span : SourceSpan.EMPTY;
        this.originalMessage = message;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public String getOriginalMessage() {
        return originalMessage;
    }

    private static String format(SourceSpan span, String message) {
        SourceSpan actual = span != null ? span : SourceSpan.EMPTY;
        return actual.toStringSimple() + " : error : " + message;
    }
}
