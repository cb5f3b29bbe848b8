package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * {@code while cond ... end}，受上下文的 loopLimit 约束
 */
public final class ScriptWhileStatement extends ScriptLoopStatementBase {

    private final ScriptExpression condition;

    public ScriptWhileStatement(SourceSpan span, ScriptExpression condition, ScriptBlockStatement body) {
        super(span, body);
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public ScriptExpression getCondition() {
        return condition;
    }

    @Override
    protected void evaluateLoop(TemplateContext context) {
        int index = 0;
        while (true) {
            context.stepLoop(this);
            if (!context.toBool(condition.getSpan(), context.evaluate(condition))) {
                break;
            }
            if (!loop(context, index, index, false)) {
                break;
            }
            index++;
        }
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("while ").write(condition);
        writeBodyAndEnd(writer);
    }
}
