package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

/**
 * 空语句，例如 {@code {{ }}}
 */
public final class ScriptNopStatement extends ScriptStatement {

    public ScriptNopStatement(SourceSpan span) {
        super(span);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.endStatement();
    }
}
