package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

/**
 * {@code continue}
 */
public final class ScriptContinueStatement extends ScriptStatement {

    public ScriptContinueStatement(SourceSpan span) {
        super(span);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.setFlowState(ScriptBreakStatement.exitFlow(context, getSpan(), ScriptFlowState.CONTINUE, "continue"));
        return null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("continue");
        writer.endStatement();
    }
}
