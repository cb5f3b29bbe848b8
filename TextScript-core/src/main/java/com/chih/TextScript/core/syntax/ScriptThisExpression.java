package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

/**
 * {@code this}：当前全局对象
 */
public final class ScriptThisExpression extends ScriptExpression implements ScriptVariablePath {

    public ScriptThisExpression(SourceSpan span) {
        super(span);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.getValue(this);
    }

    @Override
    public Object getValue(TemplateContext context) {
        return context.getCurrentGlobal();
    }

    @Override
    public void setValue(TemplateContext context, Object value) {
        throw new ScriptRuntimeException(getSpan(), "Cannot set this variable");
    }

    @Override
    public String getFirstPath() {
        return "this";
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write("this");
    }
}
