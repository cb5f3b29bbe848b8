package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 匿名函数 {@code do ... end}，求值结果为函数本身
 */
public final class ScriptAnonymousFunction extends ScriptExpression {

    private final ScriptFunction function;

    public ScriptAnonymousFunction(SourceSpan span, ScriptFunction function) {
        super(span);
        this.function = Objects.requireNonNull(function, "function");
    }

    public ScriptFunction getFunction() {
        return function;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return function;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write("do");
        function.write(writer);
    }
}
