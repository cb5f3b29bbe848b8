package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * {@code wrap f args ... end}：语句块作为 block delegate 传给被调用的函数，函数内通过 {@code $$} 执行它
 */
public final class ScriptWrapStatement extends ScriptStatement {

    private final ScriptExpression target;

    private final ScriptBlockStatement body;

    public ScriptWrapStatement(SourceSpan span, ScriptExpression target, ScriptBlockStatement body) {
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
        if (target instanceof ScriptFunctionCall) {
            context.pushBlockDelegate(body);
            return context.evaluate(target);
        }
        Object function = context.evaluate(target, true);
        if (!ScriptFunctionCall.isFunction(function)) {
            throw new ScriptRuntimeException(target.getSpan(), String.format(
                    "Expecting a function for the wrap statement instead of `%s`", target));
        }
        context.pushBlockDelegate(body);
        return ScriptFunctionCall.call(context, this, function, false, null);
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("wrap ").write(target);
        writer.endStatement();
        writer.write(body);
        writer.beginStatement();
        writer.write("end");
        writer.endStatement();
    }
}
