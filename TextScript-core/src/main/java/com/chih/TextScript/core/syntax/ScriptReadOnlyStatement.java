package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * {@code readonly x}
 */
public final class ScriptReadOnlyStatement extends ScriptStatement {

    private final ScriptVariable variable;

    public ScriptReadOnlyStatement(SourceSpan span, ScriptVariable variable) {
        super(span);
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public ScriptVariable getVariable() {
        return variable;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.setReadOnly(variable, true);
        return null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("readonly ").write(variable);
        writer.endStatement();
    }
}
