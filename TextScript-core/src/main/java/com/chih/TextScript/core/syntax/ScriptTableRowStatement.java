package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;

/**
 * {@code tablerow x in list cols: 3 ... end}，在循环过程中直接输出 {@code <tr>/<td>} 标签
 */
public final class ScriptTableRowStatement extends ScriptForStatement {

    public ScriptTableRowStatement(SourceSpan span, ScriptExpression variable, ScriptExpression iterator,
                                   List<ScriptNamedArgument> namedArguments, ScriptBlockStatement body) {
        super(span, variable, iterator, namedArguments, body);
    }

    @Override
    protected void processArgument(TemplateContext context, ScriptNamedArgument argument, LoopOptions options) {
        if ("cols".equals(argument.getName())) {
            options.columns = Math.max(1, context.toInt(argument.getSpan(), context.evaluate(argument)));
            return;
        }
        super.processArgument(context, argument, options);
    }

    @Override
    protected void beforeLoop(TemplateContext context, LoopOptions options) {
        context.write("<tr class=\"row1\">");
    }

    @Override
    protected void afterLoop(TemplateContext context, LoopOptions options) {
        context.write("</tr>");
        context.writeLine();
    }

    @Override
    protected boolean iterate(TemplateContext context, int index, int localIndex, boolean isLast, LoopOptions options) {
        int columnIndex = localIndex % options.columns;
        context.setValue(ScriptVariable.TABLEROW_COL, columnIndex + 1);

        if (columnIndex == 0 && localIndex > 0) {
            context.write("</tr>");
            context.writeLine();
            context.write("<tr class=\"row" + (localIndex / options.columns + 1) + "\">");
        }
        context.write("<td class=\"col" + (columnIndex + 1) + "\">");
        boolean result = loop(context, index, localIndex, isLast);
        context.write("</td>");
        return result;
    }

    @Override
    protected String keyword() {
        return "tablerow";
    }
}
