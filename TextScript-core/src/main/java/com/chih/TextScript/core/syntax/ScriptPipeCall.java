package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 管道 {@code from | to}：左侧的值作为右侧函数调用的第一个参数
 */
public final class ScriptPipeCall extends ScriptExpression {

    private final ScriptExpression from;

    private final ScriptExpression to;

    public ScriptPipeCall(SourceSpan span, ScriptExpression from, ScriptExpression to) {
        super(span);
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public ScriptExpression getFrom() {
        return from;
    }

    public ScriptExpression getTo() {
        return to;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        int expectedCount = context.getPipeArguments().size() + 1;
        Object leftResult = context.evaluate(from);

        ScriptArray pipeArguments = context.getPipeArguments();
        if (from instanceof ScriptUnaryExpression
                && ((ScriptUnaryExpression) from).getOperator() == ScriptUnaryOperator.FUNCTION_PARAMETERS_EXPAND
                && leftResult instanceof Iterable) {
            for (Object item : (Iterable<?>) leftResult) {
                pipeArguments.add(item);
            }
        } else {
            pipeArguments.add(leftResult);
        }

        Object result = context.evaluate(to);
        // 右侧若是函数调用会消费掉管道参数
        if (context.getPipeArguments().size() >= expectedCount) {
            throw new ScriptRuntimeException(to.getSpan(), "Pipe expression destination `" + to + "` is not a valid function");
        }
        return result;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(from).write(" | ").write(to);
    }
}
