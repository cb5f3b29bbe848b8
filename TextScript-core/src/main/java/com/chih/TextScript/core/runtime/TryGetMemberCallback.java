package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.parsing.SourceSpan;

/**
 * 成员查找失败时的回调，由宿主提供兜底值
 */
@FunctionalInterface
public interface TryGetMemberCallback {

    /**
     * @return 兜底值，没有时返回 null
     */
    Object tryGetMember(TemplateContext context, SourceSpan span, Object target, String member);
}
