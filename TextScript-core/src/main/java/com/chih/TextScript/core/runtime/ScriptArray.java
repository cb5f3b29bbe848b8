package com.chih.TextScript.core.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;

/**
 * 脚本数组：有序列表，同时可以携带命名成员
 * <p>
 * 函数调用的参数数组就是 ScriptArray，命名参数按名称写入成员；
 * {@code size} 是保留成员，不可写。
 * </p>
 */
public class ScriptArray extends ArrayList<Object> {

    public static final String SIZE_MEMBER = "size";

    private ScriptObject members;

    public ScriptArray() {
    }

    public ScriptArray(int capacity) {
        super(capacity);
    }

    public ScriptArray(Collection<?> values) {
        super(values);
    }

    public static ScriptArray of(Iterable<?> values) {
        if (values instanceof Collection) {
            return new ScriptArray((Collection<?>) values);
        }
        ScriptArray array = new ScriptArray();
        for (Object value : values) {
            array.add(value);
        }
        return array;
    }

    public boolean canWrite(String member) {
        return !SIZE_MEMBER.equals(member) && (members == null || members.canWrite(member));
    }

    public void setValue(String member, Object value, boolean readOnly) {
        getOrCreateMembers().setValue(member, value, readOnly);
    }

    public boolean trySetValue(String member, Object value) {
        return canWrite(member) && getOrCreateMembers().trySetValue(member, value);
    }

    public Object getValue(String member) {
        if (SIZE_MEMBER.equals(member)) {
            return size();
        }
        return members != null ? members.getValue(member) : null;
    }

    public boolean hasMember(String member) {
        return SIZE_MEMBER.equals(member) || (members != null && members.contains(member));
    }

    /**
     * 命名成员 (不含 size)
     */
    public Set<String> getMemberNames() {
        return members != null ? members.getMembers() : Collections.emptySet();
    }

    public ScriptArray clone(boolean deep) {
        ScriptArray copy = new ScriptArray(size());
        for (Object value : this) {
            if (deep && value instanceof ScriptArray) {
                value = ((ScriptArray) value).clone(true);
            } else if (deep && value instanceof ScriptObject) {
                value = ((ScriptObject) value).clone(true);
            }
            copy.add(value);
        }
        if (members != null) {
            copy.members = members.clone(deep);
        }
        return copy;
    }

    private ScriptObject getOrCreateMembers() {
        if (members == null) {
            members = new ScriptObject();
        }
        return members;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            ScriptObject.appendValue(builder, get(i));
        }
        return builder.append(']').toString();
    }
}
