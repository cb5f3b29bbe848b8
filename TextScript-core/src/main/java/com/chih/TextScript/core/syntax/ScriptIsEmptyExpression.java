package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * {@code target.empty?}
 */
public final class ScriptIsEmptyExpression extends ScriptExpression implements ScriptVariablePath {

    private final ScriptExpression target;

    public ScriptIsEmptyExpression(SourceSpan span, ScriptExpression target) {
        super(span);
        this.target = Objects.requireNonNull(target, "target");
    }

    public ScriptExpression getTarget() {
        return target;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.getValue(this);
    }

    @Override
    public Object getValue(TemplateContext context) {
        Object targetObject = context.getValue(target);
        if (targetObject == null && !context.isEnableRelaxedMemberAccess()) {
            throw new ScriptRuntimeException(getSpan(), String.format(
                    "Object `%s` is null. Cannot access property `empty?`", target));
        }
        return context.isEmpty(getSpan(), targetObject);
    }

    @Override
    public void setValue(TemplateContext context, Object value) {
        throw new ScriptRuntimeException(getSpan(), "Cannot set a value for the readonly property `empty?`");
    }

    @Override
    public String getFirstPath() {
        return target instanceof ScriptVariablePath ? ((ScriptVariablePath) target).getFirstPath() : null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(target).write(".empty?");
    }
}
