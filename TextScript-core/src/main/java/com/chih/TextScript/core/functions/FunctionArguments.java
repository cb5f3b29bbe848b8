package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.syntax.ScriptNamedArgument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内置函数的实参：位置参数与已求值的命名参数
 * <p>
 * 命名参数可以替代同名的位置参数，例如 {@code array.cycle ["a", "b"] group: "g"}。
 * </p>
 */
public final class FunctionArguments {

    private final TemplateContext context;

    private final SourceSpan span;

    private final List<Object> positional;

    private final Map<String, Object> named;

    private FunctionArguments(TemplateContext context, SourceSpan span, List<Object> positional, Map<String, Object> named) {
        this.context = context;
        this.span = span;
        this.positional = positional;
        this.named = named;
    }

    /**
     * 拆分参数数组并校验个数
     *
     * @param functionName 报错时使用的函数名
     */
    static FunctionArguments parse(TemplateContext context, SourceSpan span, String functionName,
                                   ScriptArray arguments, int minCount, int maxCount) {
        List<Object> positional = new ArrayList<>(arguments.size());
        Map<String, Object> named = new HashMap<>();
        for (Object argument : arguments) {
            if (argument instanceof ScriptNamedArgument) {
                ScriptNamedArgument namedArgument = (ScriptNamedArgument) argument;
                named.put(namedArgument.getName(), context.evaluate(namedArgument));
            } else {
                positional.add(argument);
            }
        }
        int count = positional.size() + named.size();
        if (count < minCount || count > maxCount) {
            String expected = minCount == maxCount ? String.valueOf(minCount) : minCount + " to " + maxCount;
            throw new ScriptRuntimeException(span, String.format(
                    "Invalid number of arguments `%d` passed to `%s` while expecting `%s` arguments",
                    count, functionName, expected));
        }
        return new FunctionArguments(context, span, positional, named);
    }

    public TemplateContext getContext() {
        return context;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public int size() {
        return positional.size() + named.size();
    }

    public Object get(int index) {
        return index < positional.size() ? positional.get(index) : null;
    }

    /**
     * 先按名称取命名参数，再按位置取，都没有时返回默认值
     */
    public Object get(int index, String name, Object defaultValue) {
        if (named.containsKey(name)) {
            return named.get(name);
        }
        return index < positional.size() ? positional.get(index) : defaultValue;
    }

    public String getString(int index) {
        return context.toString(span, get(index));
    }

    public int getInt(int index, String name, int defaultValue) {
        Object value = get(index, name, null);
        return value == null ? defaultValue : context.toInt(span, value);
    }

    /**
     * 列表参数，null 原样返回；不可迭代的值报错
     */
    public List<?> getList(int index, String functionName) {
        Object value = get(index);
        if (value == null) {
            return null;
        }
        List<?> list = context.toList(span, value);
        if (list == null) {
            throw new ScriptRuntimeException(span, String.format(
                    "Unexpected type `%s` for the list argument of `%s`", value.getClass().getSimpleName(), functionName));
        }
        return list;
    }
}
