package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.syntax.ScriptBlockStatement;
import com.chih.TextScript.core.syntax.ScriptNode;

import java.util.Objects;

/**
 * 把不关心 block delegate 的 lambda 适配为 {@link ScriptCustomFunction}
 */
public class DelegateCustomFunction implements ScriptCustomFunction {

    @FunctionalInterface
    public interface Body {
        Object apply(TemplateContext context, ScriptNode callerNode, ScriptArray arguments);
    }

    private final String name;

    private final Body body;

    public DelegateCustomFunction(String name, Body body) {
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getName() {
        return name;
    }

    @Override
    public Object invoke(TemplateContext context, ScriptNode callerNode, ScriptArray arguments, ScriptBlockStatement blockDelegate) {
        return body.apply(context, callerNode, arguments);
    }

    @Override
    public String toString() {
        return name;
    }
}
