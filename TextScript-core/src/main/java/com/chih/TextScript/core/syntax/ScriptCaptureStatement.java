package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * {@code capture x ... end}：把语句块的输出存入变量
 */
public final class ScriptCaptureStatement extends ScriptStatement {

    private final ScriptExpression target;

    private final ScriptBlockStatement body;

    public ScriptCaptureStatement(SourceSpan span, ScriptExpression target, ScriptBlockStatement body) {
        super(span);
        this.target = Objects.requireNonNull(target, "target");
        this.body = Objects.requireNonNull(body, "body");
    }

    public ScriptExpression getTarget() {
        return target;
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.pushOutput();
        try {
            context.evaluate(body);
        } finally {
            String result = context.popOutput();
            context.setValue(target, result);
        }
        return null;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("capture ").write(target);
        writer.endStatement();
        writer.write(body);
        writer.beginStatement();
        writer.write("end");
        writer.endStatement();
    }
}
