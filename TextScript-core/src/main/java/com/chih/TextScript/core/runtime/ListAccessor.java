package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.parsing.SourceSpan;

/**
 * 按整数下标读写列表类对象
 */
public interface ListAccessor {

    int getLength(TemplateContext context, SourceSpan span, Object target);

    /**
     * 越界时返回 null
     */
    Object getValue(TemplateContext context, SourceSpan span, Object target, int index);

    /**
     * 下标超出长度时自动扩展，中间补 null
     */
    void setValue(TemplateContext context, SourceSpan span, Object target, int index, Object value);
}
