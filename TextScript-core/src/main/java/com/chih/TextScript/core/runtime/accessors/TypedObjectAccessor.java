package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 宿主 Java 对象的成员访问
 * <p>
 * 可见成员来自 record 组件、JavaBean getter ({@code getName}/{@code isActive} 对应 {@code name}/{@code active})
 * 以及 public 非静态字段；写入走 setter 或非 final 的 public 字段。
 * 每个类只解析一次，结果缓存在 {@link #CACHE} 中。
 * </p>
 * <p>
 * context 与 span 可以为 null，{@link com.chih.TextScript.core.runtime.ScriptObject#importObject(Object)} 在上下文之外使用本类。
 * </p>
 */
public final class TypedObjectAccessor implements ObjectAccessor {

    private static final Map<Class<?>, TypedObjectAccessor> CACHE = new ConcurrentHashMap<>();

    private final Class<?> type;

    private final Map<String, Member> members;

    private TypedObjectAccessor(Class<?> type) {
        this.type = type;
        this.members = Collections.unmodifiableMap(resolveMembers(type));
    }

    public static TypedObjectAccessor of(Class<?> type) {
        return CACHE.computeIfAbsent(type, TypedObjectAccessor::new);
    }

    public Class<?> getType() {
        return type;
    }

    @Override
    public int getMemberCount(TemplateContext context, SourceSpan span, Object target) {
        return members.size();
    }

    @Override
    public Collection<String> getMembers(TemplateContext context, SourceSpan span, Object target) {
        return members.keySet();
    }

    @Override
    public boolean hasMember(TemplateContext context, SourceSpan span, Object target, String member) {
        return members.containsKey(member);
    }

    @Override
    public Object getValue(TemplateContext context, SourceSpan span, Object target, String member) {
        Member accessor = members.get(member);
        if (accessor == null) {
            return null;
        }
        try {
            if (accessor.getter != null) {
                return accessor.getter.invoke(target);
            }
            return accessor.field.get(target);
        } catch (InvocationTargetException e) {
            throw new ScriptRuntimeException(span, String.format(
                    "Unexpected exception while accessing member `%s` of `%s`", member, type.getSimpleName()), e.getCause());
        } catch (IllegalAccessException e) {
            throw new ScriptRuntimeException(span, String.format(
                    "Member `%s` of `%s` is not accessible", member, type.getSimpleName()), e);
        }
    }

    @Override
    public boolean trySetValue(TemplateContext context, SourceSpan span, Object target, String member, Object value) {
        Member accessor = members.get(member);
        if (accessor == null || !accessor.isWritable()) {
            return false;
        }
        try {
            if (accessor.setter != null) {
                Class<?> parameterType = accessor.setter.getParameterTypes()[0];
                accessor.setter.invoke(target, convert(context, span, value, parameterType));
            } else {
                accessor.field.set(target, convert(context, span, value, accessor.field.getType()));
            }
            return true;
        } catch (InvocationTargetException e) {
            throw new ScriptRuntimeException(span, String.format(
                    "Unexpected exception while setting member `%s` of `%s`", member, type.getSimpleName()), e.getCause());
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new ScriptRuntimeException(span, String.format(
                    "Unable to set member `%s` of `%s` to `%s`", member, type.getSimpleName(), value), e);
        }
    }

    private static Object convert(TemplateContext context, SourceSpan span, Object value, Class<?> targetType) {
        if (value == null || context == null || targetType.isInstance(value)) {
            return value;
        }
        return context.toObject(span, value, boxed(targetType));
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        } else if (type == long.class) {
            return Long.class;
        } else if (type == double.class) {
            return Double.class;
        } else if (type == float.class) {
            return Float.class;
        } else if (type == boolean.class) {
            return Boolean.class;
        }
        return type;
    }

    private static Map<String, Member> resolveMembers(Class<?> type) {
        Map<String, Member> result = new LinkedHashMap<>();
        if (!Modifier.isPublic(type.getModifiers())) {
            return result;
        }
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                result.put(component.getName(), new Member(component.getAccessor(), null, null));
            }
            return result;
        }

        for (Method method : type.getMethods()) {
            if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0
                    || method.getDeclaringClass() == Object.class || method.getReturnType() == void.class) {
                continue;
            }
            String name = propertyName(method);
            if (name != null) {
                result.putIfAbsent(name, new Member(method, findSetter(type, method), null));
            }
        }

        for (Field field : type.getFields()) {
            int modifiers = field.getModifiers();
            if (Modifier.isStatic(modifiers) || result.containsKey(field.getName())) {
                continue;
            }
            result.put(field.getName(), new Member(null, null, field));
        }
        return result;
    }

    private static String propertyName(Method method) {
        String methodName = method.getName();
        String property;
        if (methodName.startsWith("get") && methodName.length() > 3) {
            property = methodName.substring(3);
        } else if (methodName.startsWith("is") && methodName.length() > 2
                && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class)) {
            property = methodName.substring(2);
        } else {
            return null;
        }
        if (!Character.isUpperCase(property.charAt(0))) {
            return null;
        }
        // URL 这样的全大写名称保持原样
        if (property.length() > 1 && Character.isUpperCase(property.charAt(1))) {
            return property;
        }
        return Character.toLowerCase(property.charAt(0)) + property.substring(1);
    }

    private static Method findSetter(Class<?> type, Method getter) {
        String getterName = getter.getName();
        String setterName = "set" + getterName.substring(getterName.startsWith("is") ? 2 : 3);
        try {
            Method setter = type.getMethod(setterName, getter.getReturnType());
            return Modifier.isStatic(setter.getModifiers()) ? null : setter;
        } catch (NoSuchMethodException e) {
            // 只读属性
            return null;
        }
    }

    private static final class Member {

        private final Method getter;

        private final Method setter;

        private final Field field;

        private Member(Method getter, Method setter, Field field) {
            this.getter = getter;
            this.setter = setter;
            this.field = field;
        }

        private boolean isWritable() {
            return setter != null || (field != null && !Modifier.isFinal(field.getModifiers()));
        }
    }
}
