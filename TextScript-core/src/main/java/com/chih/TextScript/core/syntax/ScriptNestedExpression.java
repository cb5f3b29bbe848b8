package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 括号表达式 {@code (expr)}，内部使用独立的管道参数
 */
public final class ScriptNestedExpression extends ScriptExpression implements ScriptVariablePath {

    private final ScriptExpression expression;

    public ScriptNestedExpression(SourceSpan span, ScriptExpression expression) {
        super(span);
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public ScriptExpression getExpression() {
        return expression;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.pushPipeArguments();
        try {
            return context.getValue(this);
        } finally {
            context.popPipeArguments();
        }
    }

    @Override
    public Object getValue(TemplateContext context) {
        return context.evaluate(expression);
    }

    @Override
    public void setValue(TemplateContext context, Object value) {
        context.setValue(expression, value);
    }

    @Override
    public String getFirstPath() {
        return expression instanceof ScriptVariablePath ? ((ScriptVariablePath) expression).getFirstPath() : null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write("(").write(expression).write(")");
    }
}
