package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * else 分支
 */
public final class ScriptElseStatement extends ScriptConditionStatement {

    private final ScriptBlockStatement body;

    private final ScriptConditionStatement elseStatement;

    public ScriptElseStatement(SourceSpan span, ScriptBlockStatement body, ScriptConditionStatement elseStatement) {
        super(span);
        this.body = Objects.requireNonNull(body, "body");
        this.elseStatement = elseStatement;
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    public ScriptConditionStatement getElse() {
        return elseStatement;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object result = context.evaluate(body);
        return elseStatement != null ? context.evaluate(elseStatement) : result;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("else");
        writer.endStatement();
        writer.write(body);
        writer.write(elseStatement);
    }
}
