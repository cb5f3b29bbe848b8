package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;
import java.util.Objects;

/**
 * when 分支，任一候选值与 case 值相等即执行
 */
public final class ScriptWhenStatement extends ScriptConditionStatement {

    private final List<ScriptExpression> values;

    private final ScriptBlockStatement body;

    private final ScriptConditionStatement next;

    public ScriptWhenStatement(SourceSpan span, List<ScriptExpression> values, ScriptBlockStatement body,
                               ScriptConditionStatement next) {
        super(span);
        this.values = List.copyOf(values);
        this.body = Objects.requireNonNull(body, "body");
        this.next = next;
    }

    public List<ScriptExpression> getValues() {
        return values;
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    public ScriptConditionStatement getNext() {
        return next;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object caseValue = context.peekCase();
        for (ScriptExpression value : values) {
            Object whenValue = context.evaluate(value);
            Object result = ScriptBinaryExpression.evaluate(context, getSpan(), ScriptBinaryOperator.COMPARE_EQUAL,
                    caseValue, whenValue);
            if (Boolean.TRUE.equals(result)) {
                return context.evaluate(body);
            }
        }
        return context.evaluate(next);
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("when ").write(values, ", ");
        writer.endStatement();
        writer.write(body);
        writer.write(next);
    }
}
