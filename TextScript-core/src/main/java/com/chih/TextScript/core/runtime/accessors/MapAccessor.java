package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 宿主传入的普通 {@link Map}，键按字符串匹配
 */
public final class MapAccessor implements ObjectAccessor {

    public static final MapAccessor INSTANCE = new MapAccessor();

    // JDK 中已知不可写的 Map 实现，写入前按类型判断
    private static final Set<Class<?>> READ_ONLY_TYPES = Set.copyOf(List.of(
            Map.of().getClass(),
            Map.of("k", "v").getClass(),
            Map.of("k1", "v", "k2", "v").getClass(),
            Collections.emptyMap().getClass(),
            Collections.singletonMap("k", "v").getClass(),
            Collections.unmodifiableMap(new HashMap<>()).getClass(),
            Collections.unmodifiableSortedMap(new TreeMap<>()).getClass()));

    private MapAccessor() {
    }

    @Override
    public int getMemberCount(TemplateContext context, SourceSpan span, Object target) {
        return ((Map<?, ?>) target).size();
    }

    @Override
    public Collection<String> getMembers(TemplateContext context, SourceSpan span, Object target) {
        List<String> keys = new ArrayList<>();
        for (Object key : ((Map<?, ?>) target).keySet()) {
            keys.add(String.valueOf(key));
        }
        return keys;
    }

    @Override
    public boolean hasMember(TemplateContext context, SourceSpan span, Object target, String member) {
        return ((Map<?, ?>) target).containsKey(member);
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, String member) {
        return ((Map<?, ?>) target).get(member);
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean trySetValue(TemplateContext context, SourceSpan span, Object target, String member, Object value) {
        if (isReadOnly(target)) {
            return false;
        }
        try {
            ((Map<String, Object>) target).put(member, value);
            return true;
        } catch (UnsupportedOperationException e) {
            // 其他宿主自定义的只读 Map 只能在写入时发现
            return false;
        }
    }

    public static boolean isReadOnly(Object target) {
        return target != null && READ_ONLY_TYPES.contains(target.getClass());
    }
}
