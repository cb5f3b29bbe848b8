package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 变量引用，按 (名称, 作用域) 判等
 * <p>
 * 循环变量统一以 {@code for.xxx} 命名，{@code while.index} 与 {@code tablerow.col} 等只是同一份循环元数据的不同写法。
 * </p>
 */
public final class ScriptVariable extends ScriptExpression implements ScriptVariablePath {

    /** 函数参数数组 {@code $} */
    public static final ScriptVariable ARGUMENTS = local("");

    /** wrap 传入的语句块 {@code $$} */
    public static final ScriptVariable BLOCK_DELEGATE = local("$");

    /** Liquid 的 continue 计数 */
    public static final ScriptVariable CONTINUE = local("continue");

    public static final ScriptVariable LOOP_FIRST = loop("for.first");
    public static final ScriptVariable LOOP_LAST = loop("for.last");
    public static final ScriptVariable LOOP_EVEN = loop("for.even");
    public static final ScriptVariable LOOP_ODD = loop("for.odd");
    public static final ScriptVariable LOOP_INDEX = loop("for.index");
    public static final ScriptVariable LOOP_RINDEX = loop("for.rindex");
    public static final ScriptVariable LOOP_LENGTH = loop("for.length");
    public static final ScriptVariable LOOP_CHANGED = loop("for.changed");
    public static final ScriptVariable TABLEROW_COL = loop("tablerow.col");

    private final String name;

    private final ScriptVariableScope scope;

    public ScriptVariable(SourceSpan span, String name, ScriptVariableScope scope) {
        super(span);
        this.name = Objects.requireNonNull(name, "name");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public static ScriptVariable global(String name) {
        return new ScriptVariable(null, name, ScriptVariableScope.GLOBAL);
    }

    public static ScriptVariable local(String name) {
        return new ScriptVariable(null, name, ScriptVariableScope.LOCAL);
    }

    public static ScriptVariable loop(String name) {
        return new ScriptVariable(null, name, ScriptVariableScope.LOOP);
    }

    public ScriptVariable withSpan(SourceSpan newSpan) {
        return new ScriptVariable(newSpan, name, scope);
    }

    public String getName() {
        return name;
    }

    public ScriptVariableScope getScope() {
        return scope;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.getValue(this);
    }

    @Override
    public Object getValue(TemplateContext context) {
        return context.getVariableValue(this);
    }

    @Override
    public void setValue(TemplateContext context, Object value) {
        context.setVariableValue(this, value, false);
    }

    @Override
    public String getFirstPath() {
        return name;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(scope == ScriptVariableScope.LOCAL ? "$" + name : name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScriptVariable)) {
            return false;
        }
        ScriptVariable other = (ScriptVariable) o;
        return name.equals(other.name) && scope == other.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scope);
    }

    @Override
    public String toString() {
        return scope == ScriptVariableScope.LOCAL ? "$" + name : name;
    }
}
