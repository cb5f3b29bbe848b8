package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

/**
 * {@code break}
 */
public final class ScriptBreakStatement extends ScriptStatement {

    public ScriptBreakStatement(SourceSpan span) {
        super(span);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        context.setFlowState(exitFlow(context, getSpan(), ScriptFlowState.BREAK, "break"));
        return null;
    }

    /**
     * 循环外的 break / continue 只有在上下文允许时才视作 return
     */
    static ScriptFlowState exitFlow(TemplateContext context, SourceSpan span, ScriptFlowState inLoop, String keyword) {
        if (context.isInLoop()) {
            return inLoop;
        }
        if (context.isEnableBreakAndContinueAsReturnOutsideLoop()) {
            return ScriptFlowState.RETURN;
        }
        throw new ScriptRuntimeException(span, "The <" + keyword + "> statement can only be used inside a loop");
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.beginStatement();
        writer.write("break");
        writer.endStatement();
    }
}
