package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;

/**
 * 语句块
 * <p>
 * 依次执行语句，非赋值语句的非 null 结果直接写入输出；流程状态不为 NONE 时提前结束。
 * </p>
 */
public final class ScriptBlockStatement extends ScriptStatement {

    private final List<ScriptStatement> statements;

    public ScriptBlockStatement(SourceSpan span, List<ScriptStatement> statements) {
        super(span);
        this.statements = List.copyOf(statements);
    }

    public List<ScriptStatement> getStatements() {
        return statements;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object result = null;
        for (ScriptStatement statement : statements) {
            boolean isAssign = statement instanceof ScriptExpressionStatement
                    && ((ScriptExpressionStatement) statement).getExpression() instanceof ScriptAssignExpression;
            result = context.evaluate(statement);
            if (isAssign) {
                // 顶层赋值不输出
                result = null;
            } else if (result != null && context.getFlowState() != ScriptFlowState.RETURN && context.isEnableOutput()) {
                context.write(getSpan(), result);
                result = null;
            }
            if (context.getFlowState() != ScriptFlowState.NONE) {
                break;
            }
        }
        return result;
    }

    @Override
    public void write(TemplateRewriter writer) {
        for (ScriptStatement statement : statements) {
            writer.write(statement);
        }
    }
}
