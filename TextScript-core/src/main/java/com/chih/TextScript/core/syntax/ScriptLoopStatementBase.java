package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 循环语句基类
 * <p>
 * 循环期间上下文中存在一份独立的循环变量存储 ({@code for.index} 等)，嵌套循环互不影响。
 * </p>
 */
public abstract class ScriptLoopStatementBase extends ScriptStatement {

    private final ScriptBlockStatement body;

    protected ScriptLoopStatementBase(SourceSpan span, ScriptBlockStatement body) {
        super(span);
        this.body = Objects.requireNonNull(body, "body");
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    /**
     * 执行一次循环体
     *
     * @return false 表示循环应当结束 (break 或 return)
     */
    protected boolean loop(TemplateContext context, int index, int localIndex, boolean isLast) {
        context.setValue(ScriptVariable.LOOP_FIRST, index == 0);
        boolean even = (index & 1) == 0;
        context.setValue(ScriptVariable.LOOP_EVEN, even);
        context.setValue(ScriptVariable.LOOP_ODD, !even);
        context.setValue(ScriptVariable.LOOP_INDEX, index);

        context.evaluate(body);

        // return 需要继续向上传递
        if (context.getFlowState() == ScriptFlowState.RETURN) {
            return false;
        }
        boolean result = context.getFlowState() != ScriptFlowState.BREAK;
        context.setFlowState(ScriptFlowState.NONE);
        return result;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.enterLoop(this);
        try {
            evaluateLoop(context);
        } finally {
            context.exitLoop(this);
            if (context.getFlowState() != ScriptFlowState.RETURN) {
                context.setFlowState(ScriptFlowState.NONE);
            }
        }
        return null;
    }

    protected abstract void evaluateLoop(TemplateContext context);

    protected void writeBodyAndEnd(TemplateRewriter writer) {
        writer.endStatement();
        writer.write(body);
        writer.beginStatement();
        writer.write("end");
        writer.endStatement();
    }
}
