package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.runtime.TemplateContext;

/**
 * 可读写的变量路径：变量、成员访问、下标访问等
 * <p>
 * 不要直接调用，统一经由 {@link TemplateContext#getValue(ScriptExpression)} 与
 * {@link TemplateContext#setValue(ScriptExpression, Object)}，以便上下文处理函数自动调用。
 * </p>
 */
public interface ScriptVariablePath {

    Object getValue(TemplateContext context);

    void setValue(TemplateContext context, Object value);

    /**
     * 路径的第一段名称，例如 {@code a.b[0]} 返回 {@code a}
     */
    String getFirstPath();
}
