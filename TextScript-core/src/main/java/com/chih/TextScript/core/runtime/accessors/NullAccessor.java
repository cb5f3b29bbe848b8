package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Collection;
import java.util.List;

/**
 * null 及无法访问成员的目标
 */
public final class NullAccessor implements ObjectAccessor {

    public static final NullAccessor INSTANCE = new NullAccessor();

    private NullAccessor() {
    }

    @Override
    public int getMemberCount(TemplateContext context, SourceSpan span, Object target) {
        return 0;
    }

    @Override
    public Collection<String> getMembers(TemplateContext context, SourceSpan span, Object target) {
        return List.of();
    }

    @Override
    public boolean hasMember(TemplateContext context, SourceSpan span, Object target, String member) {
        return false;
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, String member) {
        return null;
    }

    @Override
    public boolean trySetValue(TemplateContext context, SourceSpan span, Object target, String member, Object value) {
        return false;
    }
}
