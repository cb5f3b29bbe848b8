package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * if / else if 语句，Liquid 的 unless 以 invertCondition 表示
 */
public final class ScriptIfStatement extends ScriptConditionStatement {

    private final ScriptExpression condition;

    private final boolean invertCondition;

    private final ScriptBlockStatement then;

    private final ScriptConditionStatement elseStatement;

    private final boolean elseIf;

    public ScriptIfStatement(SourceSpan span, ScriptExpression condition, boolean invertCondition,
                             ScriptBlockStatement then, ScriptConditionStatement elseStatement, boolean elseIf) {
        super(span);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.invertCondition = invertCondition;
        this.then = Objects.requireNonNull(then, "then");
        this.elseStatement = elseStatement;
        this.elseIf = elseIf;
    }

    public ScriptExpression getCondition() {
        return condition;
    }

    public boolean isInvertCondition() {
        return invertCondition;
    }

    public ScriptBlockStatement getThen() {
        return then;
    }

    public ScriptConditionStatement getElse() {
        return elseStatement;
    }

    public boolean isElseIf() {
        return elseIf;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        boolean conditionValue = context.toBool(condition.getSpan(), context.evaluate(condition));
        if (invertCondition) {
            conditionValue = !conditionValue;
        }
        return conditionValue ? context.evaluate(then) : context.evaluate(elseStatement);
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write(elseIf ? "else if " : "if ");
        if (invertCondition) {
            writer.write("!(").write(condition).write(")");
        } else {
            writer.write(condition);
        }
        writer.endStatement();
        writer.write(then);
        writer.write(elseStatement);
        if (!elseIf) {
            writer.beginStatement();
            writer.write("end");
            writer.endStatement();
        }
    }
}
