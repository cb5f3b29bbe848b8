package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Collection;

/**
 * {@link ScriptObject} 的成员访问，写入遵守只读标记
 */
public final class ScriptObjectAccessor implements ObjectAccessor {

    public static final ScriptObjectAccessor INSTANCE = new ScriptObjectAccessor();

    private ScriptObjectAccessor() {
    }

    @Override
    public int getMemberCount(TemplateContext context, SourceSpan span, Object target) {
        return ((ScriptObject) target).size();
    }

    @Override
    public Collection<String> getMembers(TemplateContext context, SourceSpan span, Object target) {
        return ((ScriptObject) target).getMembers();
    }

    @Override
    public boolean hasMember(TemplateContext context, SourceSpan span, Object target, String member) {
        return ((ScriptObject) target).contains(member);
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, String member) {
        return ((ScriptObject) target).getValue(member);
    }

    @Override
    public boolean trySetValue(TemplateContext context, SourceSpan span, Object target, String member, Object value) {
        return ((ScriptObject) target).trySetValue(member, value);
    }
}
