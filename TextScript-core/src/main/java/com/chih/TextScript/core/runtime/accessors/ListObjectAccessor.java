package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ListAccessor;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * {@link List} 的下标访问与成员访问
 * <p>
 * 成员侧只有 {@code size}，外加 {@link ScriptArray} 上的命名成员。
 * </p>
 */
public final class ListObjectAccessor implements ListAccessor, ObjectAccessor {

    public static final ListObjectAccessor INSTANCE = new ListObjectAccessor();

    private ListObjectAccessor() {
    }

    @Override
    public int getLength(TemplateContext context, SourceSpan span, Object target) {
        return ((List<?>) target).size();
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, int index) {
        List<?> list = (List<?>) target;
        if (index < 0 || index >= list.size()) {
            return null;
        }
        return list.get(index);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void setValue(TemplateContext context, SourceSpan span, Object target, int index, Object value) {
        if (index < 0) {
            throw new ScriptRuntimeException(span, String.format("Index %d is out of bounds for a list", index));
        }
        List<Object> list = (List<Object>) target;
        // 越界写入时自动扩展
        for (int i = list.size(); i <= index; i++) {
            list.add(null);
        }
        list.set(index, value);
    }

    @Override
    public int getMemberCount(TemplateContext context, SourceSpan span, Object target) {
        return getMembers(context, span, target).size();
    }

    @Override
    public Collection<String> getMembers(TemplateContext context, SourceSpan span, Object target) {
        List<String> members = new ArrayList<>();
        members.add(ScriptArray.SIZE_MEMBER);
        if (target instanceof ScriptArray) {
            members.addAll(((ScriptArray) target).getMemberNames());
        }
        return members;
    }

    @Override
    public boolean hasMember(TemplateContext context, SourceSpan span, Object target, String member) {
        if (target instanceof ScriptArray) {
            return ((ScriptArray) target).hasMember(member);
        }
        return ScriptArray.SIZE_MEMBER.equals(member);
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, String member) {
        if (ScriptArray.SIZE_MEMBER.equals(member)) {
            return ((List<?>) target).size();
        }
        if (target instanceof ScriptArray) {
            return ((ScriptArray) target).getValue(member);
        }
        return null;
    }

    @Override
    public boolean trySetValue(TemplateContext context, SourceSpan span, Object target, String member, Object value) {
        if (target instanceof ScriptArray) {
            return ((ScriptArray) target).trySetValue(member, value);
        }
        return false;
    }
}
