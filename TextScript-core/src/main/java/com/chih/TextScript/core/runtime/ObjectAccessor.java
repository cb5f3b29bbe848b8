package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.parsing.SourceSpan;

import java.util.Collection;

/**
 * 按成员名读写对象
 * <p>
 * 由 {@link TemplateContext#getMemberAccessor(Object)} 根据运行时类型选出实现。
 * 读取不存在的成员不是错误，调用方先用 {@link #hasMember} 判断再决定返回 null 还是报错。
 * </p>
 */
public interface ObjectAccessor {

    int getMemberCount(TemplateContext context, SourceSpan span, Object target);

    Collection<String> getMembers(TemplateContext context, SourceSpan span, Object target);

    boolean hasMember(TemplateContext context, SourceSpan span, Object target, String member);

    Object getValue(TemplateContext context, SourceSpan span, Object target, String member);

    /**
     * @return false 表示成员只读或目标不支持写入
     */
    boolean trySetValue(TemplateContext context, SourceSpan span, Object target, String member, Object value);
}
