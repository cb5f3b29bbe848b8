package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 原样输出的文本，escapeCount 大于 0 时来自 {@code {%{ ... }%}} 转义块
 */
public final class ScriptRawStatement extends ScriptStatement {

    private final String text;

    private final int escapeCount;

    public ScriptRawStatement(SourceSpan span, String text, int escapeCount) {
        super(span);
        this.text = Objects.requireNonNull(text, "text");
        this.escapeCount = escapeCount;
    }

    public String getText() {
        return text;
    }

    public int getEscapeCount() {
        return escapeCount;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        if (text.isEmpty()) {
            return null;
        }
        if (context.isEnableOutput()) {
            context.write(text);
            return null;
        }
        return text;
    }

    @Override
    public void write(TemplateRewriter writer) {
        if (escapeCount > 0) {
            writer.writeEscape(text, escapeCount);
        } else {
            writer.writeRaw(text);
        }
    }
}
