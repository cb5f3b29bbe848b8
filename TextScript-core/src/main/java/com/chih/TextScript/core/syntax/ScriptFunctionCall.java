package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.ScriptCustomFunction;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;
import java.util.Objects;

/**
 * 函数调用 {@code target arg1 arg2 name: value}
 * <p>
 * 参数以空格并列书写，命名参数只能出现在位置参数之后。
 * </p>
 */
public final class ScriptFunctionCall extends ScriptExpression {

    private final ScriptExpression target;

    private final List<ScriptExpression> arguments;

    public ScriptFunctionCall(SourceSpan span, ScriptExpression target, List<ScriptExpression> arguments) {
        super(span);
        this.target = Objects.requireNonNull(target, "target");
        this.arguments = List.copyOf(arguments);
    }

    public ScriptExpression getTarget() {
        return target;
    }

    public List<ScriptExpression> getArguments() {
        return arguments;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        // 只取函数本身，不做无参自动调用
        Object targetFunction = context.evaluate(target, true);
        if (targetFunction == null) {
            throw new ScriptRuntimeException(target.getSpan(), "The target function `" + target + "` is null");
        }
        return call(context, this, targetFunction, context.isPipeArgumentsAllowed(), arguments);
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(target);
        for (ScriptExpression argument : arguments) {
            writer.write(" ").write(argument);
        }
    }

    public static boolean isFunction(Object target) {
        return target instanceof ScriptFunction || target instanceof ScriptCustomFunction;
    }

    /**
     * 调用脚本函数或外部函数
     *
     * @param callerNode            调用点，用于报错位置与外部函数的上下文
     * @param processPipeArguments  是否把当前管道参数作为前置参数
     * @param arguments             语法上的参数，可为 null
     */
    public static Object call(TemplateContext context, ScriptNode callerNode, Object functionObject,
                              boolean processPipeArguments, List<ScriptExpression> arguments) {
        Objects.requireNonNull(callerNode, "callerNode");
        if (functionObject == null) {
            throw new ScriptRuntimeException(callerNode.getSpan(), "The target function `" + callerNode + "` is null");
        }
        ScriptFunction function = functionObject instanceof ScriptFunction ? (ScriptFunction) functionObject : null;
        ScriptCustomFunction externFunction = functionObject instanceof ScriptCustomFunction
                ? (ScriptCustomFunction) functionObject : null;
        if (function == null && externFunction == null) {
            throw new ScriptRuntimeException(callerNode.getSpan(), String.format(
                    "Invalid target function `%s` (%s)", callerNode, functionObject.getClass().getSimpleName()));
        }

        ScriptBlockStatement blockDelegate = context.popBlockDelegate();

        // 被调函数可能持有参数数组，每次调用都要新建
        ScriptArray argumentValues = new ScriptArray();
        if (processPipeArguments && !context.getPipeArguments().isEmpty()) {
            argumentValues.addAll(context.getPipeArguments());
            context.getPipeArguments().clear();
        }

        if (arguments != null) {
            for (ScriptExpression argument : arguments) {
                Object value;
                if (argument instanceof ScriptNamedArgument) {
                    ScriptNamedArgument namedArgument = (ScriptNamedArgument) argument;
                    if (externFunction == null) {
                        if (argumentValues.canWrite(namedArgument.getName())) {
                            argumentValues.setValue(namedArgument.getName(), context.evaluate(namedArgument), false);
                            continue;
                        }
                        value = context.evaluate(namedArgument);
                    } else {
                        // 外部函数拿到命名参数节点本身
                        value = argument;
                    }
                } else {
                    value = context.evaluate(argument);
                }

                if (argument instanceof ScriptUnaryExpression
                        && ((ScriptUnaryExpression) argument).getOperator() == ScriptUnaryOperator.FUNCTION_PARAMETERS_EXPAND
                        && value instanceof Iterable) {
                    for (Object item : (Iterable<?>) value) {
                        argumentValues.add(item);
                    }
                    continue;
                }
                argumentValues.add(value);
            }
        }

        Object result;
        context.enterFunction(callerNode);
        try {
            if (externFunction != null) {
                result = externFunction.invoke(context, callerNode, argumentValues, blockDelegate);
            } else {
                context.setValue(ScriptVariable.ARGUMENTS, argumentValues, true);
                if (blockDelegate != null) {
                    context.setValue(ScriptVariable.BLOCK_DELEGATE, blockDelegate, true);
                }
                result = context.evaluate(function.getBody());
            }
        } finally {
            context.exitFunction();
        }

        // return 不会越过函数调用
        context.setFlowState(ScriptFlowState.NONE);
        return result;
    }
}
