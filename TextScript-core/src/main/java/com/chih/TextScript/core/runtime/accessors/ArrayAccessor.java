package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ListAccessor;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;

/**
 * Java 数组，长度固定，越界写入报错
 */
public final class ArrayAccessor implements ListAccessor, ObjectAccessor {

    public static final ArrayAccessor INSTANCE = new ArrayAccessor();

    private ArrayAccessor() {
    }

    @Override
    public int getLength(TemplateContext context, SourceSpan span, Object target) {
        return Array.getLength(target);
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, int index) {
        if (index < 0 || index >= Array.getLength(target)) {
            return null;
        }
        return Array.get(target, index);
    }

    @Override
    public void setValue(TemplateContext context, SourceSpan span, Object target, int index, Object value) {
        int length = Array.getLength(target);
        if (index < 0 || index >= length) {
            throw new ScriptRuntimeException(span, String.format("Index %d is out of bounds for an array of length %d", index, length));
        }
        Class<?> componentType = target.getClass().getComponentType();
        Array.set(target, index, context.toObject(span, value, componentType));
    }

    @Override
    public int getMemberCount(TemplateContext context, SourceSpan span, Object target) {
        return 1;
    }

    @Override
    public Collection<String> getMembers(TemplateContext context, SourceSpan span, Object target) {
        return List.of("size");
    }

    @Override
    public boolean hasMember(TemplateContext context, SourceSpan span, Object target, String member) {
        return "size".equals(member);
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, String member) {
        return "size".equals(member) ? Array.getLength(target) : null;
    }

    @Override
    public boolean trySetValue(TemplateContext context, SourceSpan span, Object target, String member, Object value) {
        return false;
    }
}
