package com.chih.TextScript.core.runtime;

/**
 * {@code empty} 哨兵对象：没有成员、只读、输出为空字符串
 * <p>
 * 与任意值比较时走 empty 语义：{@code "" == empty}、{@code [] == empty} 均为 true。
 * </p>
 */
public final class EmptyScriptObject extends ScriptObject {

    public static final EmptyScriptObject DEFAULT = new EmptyScriptObject();

    private EmptyScriptObject() {
        super.setReadOnly(true);
    }

    @Override
    public void setReadOnly(boolean readOnly) {
        // 始终只读
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "";
    }
}
