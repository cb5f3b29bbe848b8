package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * {@code with obj ... end}：把对象压为当前全局作用域
 */
public final class ScriptWithStatement extends ScriptStatement {

    private final ScriptExpression name;

    private final ScriptBlockStatement body;

    public ScriptWithStatement(SourceSpan span, ScriptExpression name, ScriptBlockStatement body) {
        super(span);
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
    }

    public ScriptExpression getName() {
        return name;
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object target = context.getValue(name);
        if (!(target instanceof ScriptObject)) {
            String targetName = target != null ? target.getClass().getSimpleName() : "null";
            throw new ScriptRuntimeException(name.getSpan(), String.format(
                    "Invalid target property `%s` used for the with statement. Must be a ScriptObject instead of `%s`",
                    name, targetName));
        }
        context.pushGlobal((ScriptObject) target);
        try {
            return context.evaluate(body);
        } finally {
            context.popGlobal();
        }
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("with ").write(name);
        writer.endStatement();
        writer.write(body);
        writer.beginStatement();
        writer.write("end");
        writer.endStatement();
    }
}
