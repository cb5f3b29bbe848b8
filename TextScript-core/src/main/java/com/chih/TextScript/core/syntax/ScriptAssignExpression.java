package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 赋值 {@code target = value}，只允许出现在语句最外层
 */
public final class ScriptAssignExpression extends ScriptExpression {

    private final ScriptExpression target;

    private final ScriptExpression value;

    public ScriptAssignExpression(SourceSpan span, ScriptExpression target, ScriptExpression value) {
        super(span);
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public ScriptExpression getTarget() {
        return target;
    }

    public ScriptExpression getValue() {
        return value;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object result = context.evaluate(value);
        context.setValue(target, result);
        return result;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(target).write(" = ").write(value);
    }
}
