package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 函数定义 {@code func name ... end}，匿名函数的 name 为 null
 * <p>
 * 参数通过 {@code $}、{@code $0}、{@code $1} 等访问。
 * </p>
 */
public final class ScriptFunction extends ScriptStatement {

    private final ScriptVariable name;

    private final ScriptBlockStatement body;

    public ScriptFunction(SourceSpan span, ScriptVariable name, ScriptBlockStatement body) {
        super(span);
        this.name = name;
        this.body = Objects.requireNonNull(body, "body");
    }

    public ScriptVariable getName() {
        return name;
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        if (name != null) {
            context.setValue(name, this);
        }
        return null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        if (name != null) {
            writer.beginStatement();
            writer.write("func ").write(name);
        }
        writer.endStatement();
        writer.write(body);
        writer.beginStatement();
        writer.write("end");
        if (name != null) {
            writer.endStatement();
        }
    }
}
