package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 表达式语句
 */
public final class ScriptExpressionStatement extends ScriptStatement {

    private final ScriptExpression expression;

    public ScriptExpressionStatement(SourceSpan span, ScriptExpression expression) {
        super(span);
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public ScriptExpression getExpression() {
        return expression;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object result = context.evaluate(expression);
        // $$ 得到的是 wrap 传入的语句块，在这里执行
        if (result instanceof ScriptNode) {
            return context.evaluate((ScriptNode) result);
        }
        return result;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write(expression);
        writer.endStatement();
    }
}
