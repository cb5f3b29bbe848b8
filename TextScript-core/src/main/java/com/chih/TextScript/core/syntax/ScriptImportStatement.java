package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * {@code import obj}：把对象的成员复制到当前全局对象
 */
public final class ScriptImportStatement extends ScriptStatement {

    private final ScriptExpression expression;

    public ScriptImportStatement(SourceSpan span, ScriptExpression expression) {
        super(span);
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public ScriptExpression getExpression() {
        return expression;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object value = context.evaluate(expression);
        if (value == null) {
            return null;
        }
        if (!(value instanceof ScriptObject)) {
            throw new ScriptRuntimeException(expression.getSpan(), String.format(
                    "Unexpected value `%s` for import. Expecting a ScriptObject", value.getClass().getSimpleName()));
        }
        context.getCurrentGlobal().importObject(value);
        return null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("import ").write(expression);
        writer.endStatement();
    }
}
