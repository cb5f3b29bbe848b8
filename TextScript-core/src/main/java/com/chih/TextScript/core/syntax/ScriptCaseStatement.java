package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * case 语句，求值期间把判定值压入上下文的 case 栈
 */
public final class ScriptCaseStatement extends ScriptConditionStatement {

    private final ScriptExpression value;

    private final ScriptBlockStatement body;

    public ScriptCaseStatement(SourceSpan span, ScriptExpression value, ScriptBlockStatement body) {
        super(span);
        this.value = Objects.requireNonNull(value, "value");
        this.body = Objects.requireNonNull(body, "body");
    }

    public ScriptExpression getValue() {
        return value;
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.pushCase(context.evaluate(value));
        try {
            return context.evaluate(body);
        } finally {
            context.popCase();
        }
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("case ").write(value);
        writer.endStatement();
        writer.write(body);
        writer.beginStatement();
        writer.write("end");
        writer.endStatement();
    }
}
