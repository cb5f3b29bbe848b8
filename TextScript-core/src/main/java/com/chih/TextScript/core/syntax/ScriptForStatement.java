package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;
import java.util.Objects;

/**
 * {@code for x in list offset: 1 limit: 2 reversed ... end}
 * <p>
 * 可迭代但不是 List 的对象 (例如区间) 会先展开为 {@link ScriptArray}。
 * 循环结束后把停止位置写入 {@code $continue}，供 Liquid 的 {@code offset: continue} 使用。
 * </p>
 */
public class ScriptForStatement extends ScriptLoopStatementBase {

    /**
     * 一次求值内的循环选项，节点本身不保存求值状态
     */
    protected static class LoopOptions {
        int offset;
        int limit;
        boolean reversed;
        int columns = 1;
    }

    private final ScriptExpression variable;

    private final ScriptExpression iterator;

    private final List<ScriptNamedArgument> namedArguments;

    public ScriptForStatement(SourceSpan span, ScriptExpression variable, ScriptExpression iterator,
                              List<ScriptNamedArgument> namedArguments, ScriptBlockStatement body) {
        super(span, body);
        this.variable = Objects.requireNonNull(variable, "variable");
        this.iterator = Objects.requireNonNull(iterator, "iterator");
        this.namedArguments = namedArguments != null ? List.copyOf(namedArguments) : List.of();
    }

    public ScriptExpression getVariable() {
        return variable;
    }

    public ScriptExpression getIterator() {
        return iterator;
    }

    public List<ScriptNamedArgument> getNamedArguments() {
        return namedArguments;
    }

    @Override
    protected void evaluateLoop(TemplateContext context) {
        Object loopIterator = context.evaluate(iterator);
        List<?> list = context.toList(iterator.getSpan(), loopIterator);
        if (list == null) {
            if (loopIterator != null) {
                throw new ScriptRuntimeException(iterator.getSpan(), String.format(
                        "Unexpected type `%s` for iterator", loopIterator.getClass().getSimpleName()));
            }
            return;
        }

        context.setValue(ScriptVariable.LOOP_LENGTH, list.size());

        LoopOptions options = new LoopOptions();
        options.limit = list.size();
        for (ScriptNamedArgument option : namedArguments) {
            switch (option.getName()) {
                case "offset":
                    options.offset = context.toInt(option.getSpan(), context.evaluate(option));
                    break;
                case "reversed":
                    options.reversed = true;
                    break;
                case "limit":
                    options.limit = context.toInt(option.getSpan(), context.evaluate(option));
                    break;
                default:
                    processArgument(context, option, options);
                    break;
            }
        }

        int startIndex = options.offset;
        int endIndex = Math.min(options.limit + startIndex, list.size()) - 1;
        boolean reversed = options.reversed;
        int index = reversed ? endIndex : startIndex;
        int dir = reversed ? -1 : 1;
        boolean isFirst = true;
        Object previousValue = null;
        int i = 0;

        beforeLoop(context, options);
        while ((!reversed && index <= endIndex) || (reversed && index >= startIndex)) {
            context.stepLoop(this);

            Object value = list.get(index);
            boolean isLast = reversed ? index == startIndex : index == endIndex;
            context.setValue(ScriptVariable.LOOP_LAST, isLast);
            context.setValue(ScriptVariable.LOOP_CHANGED, isFirst || !Objects.equals(previousValue, value));
            context.setValue(ScriptVariable.LOOP_RINDEX, list.size() - index - 1);
            context.setValue(variable, value);

            if (!iterate(context, index, i, isLast, options)) {
                break;
            }

            previousValue = value;
            isFirst = false;
            index += dir;
            i++;
        }
        afterLoop(context, options);

        context.setValue(ScriptVariable.CONTINUE, index);
    }

    protected boolean iterate(TemplateContext context, int index, int localIndex, boolean isLast, LoopOptions options) {
        return loop(context, index, localIndex, isLast);
    }

    protected void beforeLoop(TemplateContext context, LoopOptions options) {
    }

    protected void afterLoop(TemplateContext context, LoopOptions options) {
    }

    protected void processArgument(TemplateContext context, ScriptNamedArgument argument, LoopOptions options) {
        throw new ScriptRuntimeException(argument.getSpan(), String.format(
                "Unsupported argument `%s` for statement: %s", argument.getName(), keyword()));
    }

    protected String keyword() {
        return "for";
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write(keyword()).write(" ").write(variable).write(" in ").write(iterator);
        for (ScriptNamedArgument argument : namedArguments) {
            writer.write(" ").write(argument);
        }
        writeBodyAndEnd(writer);
    }
}
