package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

/**
 * {@code ret value}
 */
public final class ScriptReturnStatement extends ScriptStatement {

    private final ScriptExpression expression;

    public ScriptReturnStatement(SourceSpan span, ScriptExpression expression) {
        super(span);
        this.expression = expression;
    }

    public ScriptExpression getExpression() {
        return expression;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.setFlowState(ScriptFlowState.RETURN);
        return context.evaluate(expression);
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("ret");
        if (expression != null) {
            writer.write(" ").write(expression);
        }
        writer.endStatement();
    }
}
