package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.exception.TextScriptException;
import com.chih.TextScript.core.runtime.accessors.TypedObjectAccessor;
import com.chih.TextScript.core.syntax.ScriptLiteral;
import com.chih.TextScript.core.syntax.ScriptLiteralStringQuoteType;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 脚本对象：按插入顺序保存成员的字典，成员可单独设为只读
 * <p>
 * 全局作用域、{@code {a: 1}} 字面量以及内置函数命名空间都是 ScriptObject。
 * 作为 {@link Map} 使用时 {@link #put} 遵守只读约束。
 * </p>
 */
public class ScriptObject extends AbstractMap<String, Object> {

    private final Map<String, Object> store = new LinkedHashMap<>();

    private final Set<String> readOnlyMembers = new HashSet<>();

    private boolean readOnly;

    public ScriptObject() {
    }

    /**
     * 从 Map 创建，嵌套的 Map / List 会转为 ScriptObject / ScriptArray
     */
    public static ScriptObject from(Map<?, ?> values) {
        ScriptObject scriptObject = new ScriptObject();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            scriptObject.setValue(String.valueOf(entry.getKey()), convert(entry.getValue()), false);
        }
        return scriptObject;
    }

    static Object convert(Object value) {
        if (value instanceof ScriptObject || value instanceof ScriptArray) {
            return value;
        }
        if (value instanceof Map) {
            return from((Map<?, ?>) value);
        }
        if (value instanceof List) {
            ScriptArray array = new ScriptArray(((List<?>) value).size());
            for (Object item : (List<?>) value) {
                array.add(convert(item));
            }
            return array;
        }
        return value;
    }

    public Object getValue(String member) {
        return store.get(member);
    }

    /**
     * 设置成员值，不检查成员的只读标记，只检查整个对象是否只读
     */
    public void setValue(String member, Object value, boolean readOnlyMember) {
        assertNotReadOnly();
        store.put(member, value);
        if (readOnlyMember) {
            readOnlyMembers.add(member);
        } else {
            readOnlyMembers.remove(member);
        }
    }

    /**
     * 按只读约束写入
     *
     * @return false 表示成员或对象只读
     */
    public boolean trySetValue(String member, Object value) {
        if (!canWrite(member)) {
            return false;
        }
        store.put(member, value);
        return true;
    }

    public boolean canWrite(String member) {
        return !readOnly && !readOnlyMembers.contains(member);
    }

    public void setReadOnly(String member, boolean value) {
        if (value) {
            readOnlyMembers.add(member);
        } else {
            readOnlyMembers.remove(member);
        }
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public boolean contains(String member) {
        return store.containsKey(member);
    }

    public Set<String> getMembers() {
        return Collections.unmodifiableSet(store.keySet());
    }

    /**
     * 导入另一个对象的成员：ScriptObject (连同只读标记)、Map 或普通 Java 对象 (公开属性)
     */
    public void importObject(Object source) {
        if (source == null) {
            return;
        }
        if (source instanceof ScriptObject) {
            ScriptObject other = (ScriptObject) source;
            for (Map.Entry<String, Object> entry : other.store.entrySet()) {
                setValue(entry.getKey(), entry.getValue(), other.readOnlyMembers.contains(entry.getKey()));
            }
            return;
        }
        if (source instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) source).entrySet()) {
                setValue(String.valueOf(entry.getKey()), convert(entry.getValue()), false);
            }
            return;
        }
        TypedObjectAccessor accessor = TypedObjectAccessor.of(source.getClass());
        for (String member : accessor.getMembers(null, null, source)) {
            setValue(member, accessor.getValue(null, null, source, member), false);
        }
    }

    /**
     * 以只读成员的形式注册外部函数
     */
    public void importFunction(String name, ScriptCustomFunction function) {
        setValue(name, function, true);
    }

    /**
     * 复制对象，deep 为 true 时递归复制嵌套的 ScriptObject 与 ScriptArray
     */
    public ScriptObject clone(boolean deep) {
        ScriptObject copy = new ScriptObject();
        for (Map.Entry<String, Object> entry : store.entrySet()) {
            Object value = entry.getValue();
            if (deep) {
                if (value instanceof ScriptObject) {
                    value = ((ScriptObject) value).clone(true);
                } else if (value instanceof ScriptArray) {
                    value = ((ScriptArray) value).clone(true);
                }
            }
            copy.store.put(entry.getKey(), value);
        }
        copy.readOnlyMembers.addAll(readOnlyMembers);
        copy.readOnly = readOnly;
        return copy;
    }

    @Override
    public Object get(Object key) {
        return store.get(key);
    }

    @Override
    public boolean containsKey(Object key) {
        return store.containsKey(key);
    }

    @Override
    public Object put(String key, Object value) {
        if (!canWrite(key)) {
            throw new TextScriptException("Cannot set the readonly member `" + key + "`");
        }
        return store.put(key, value);
    }

    @Override
    public Object remove(Object key) {
        assertNotReadOnly();
        readOnlyMembers.remove(key);
        return store.remove(key);
    }

    @Override
    public void clear() {
        assertNotReadOnly();
        readOnlyMembers.clear();
        store.clear();
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public Set<Entry<String, Object>> entrySet() {
        return Collections.unmodifiableMap(store).entrySet();
    }

    protected void assertNotReadOnly() {
        if (readOnly) {
            throw new TextScriptException("The object is readonly");
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        for (Map.Entry<String, Object> entry : store.entrySet()) {
            if (builder.length() > 1) {
                builder.append(", ");
            }
            builder.append(entry.getKey()).append(": ");
            appendValue(builder, entry.getValue());
        }
        return builder.append('}').toString();
    }

    static void appendValue(StringBuilder builder, Object value) {
        if (value instanceof String) {
            builder.append(ScriptLiteral.toLiteral(ScriptLiteralStringQuoteType.DOUBLE_QUOTE, (String) value));
        } else if (value == null) {
            builder.append("null");
        } else {
            builder.append(value);
        }
    }
}
