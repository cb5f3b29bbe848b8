package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;

/**
 * 数组字面量 {@code [a, b, c]}，每次求值生成新的 {@link ScriptArray}
 */
public final class ScriptArrayInitializerExpression extends ScriptExpression {

    private final List<ScriptExpression> values;

    public ScriptArrayInitializerExpression(SourceSpan span, List<ScriptExpression> values) {
        super(span);
        this.values = List.copyOf(values);
    }

    public List<ScriptExpression> getValues() {
        return values;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        ScriptArray array = new ScriptArray(values.size());
        for (ScriptExpression value : values) {
            array.add(context.evaluate(value));
        }
        return array;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write("[").write(values, ", ").write("]");
    }
}
