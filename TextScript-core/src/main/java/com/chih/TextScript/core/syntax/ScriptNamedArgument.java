package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 命名参数 {@code name: value}，省略值时求值为 true (例如 {@code reversed})
 */
public final class ScriptNamedArgument extends ScriptExpression {

    private final String name;

    private final ScriptExpression value;

    public ScriptNamedArgument(SourceSpan span, String name, ScriptExpression value) {
        super(span);
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public ScriptExpression getValue() {
        return value;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return value != null ? context.evaluate(value) : Boolean.TRUE;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(name);
        if (value != null) {
            writer.write(": ").write(value);
        }
    }
}
