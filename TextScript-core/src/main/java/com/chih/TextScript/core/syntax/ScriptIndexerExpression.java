package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ListAccessor;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TryGetMemberCallback;

import java.util.Map;
import java.util.Objects;

/**
 * 下标访问 {@code target[index]}
 * <p>
 * 字典类目标按字符串键访问，列表类目标按整数下标访问，负数下标从末尾倒数。
 * </p>
 */
public final class ScriptIndexerExpression extends ScriptExpression implements ScriptVariablePath {

    private final ScriptExpression target;

    private final ScriptExpression index;

    public ScriptIndexerExpression(SourceSpan span, ScriptExpression target, ScriptExpression index) {
        super(span);
        this.target = Objects.requireNonNull(target, "target");
        this.index = Objects.requireNonNull(index, "index");
    }

    public ScriptExpression getTarget() {
        return target;
    }

    public ScriptExpression getIndex() {
        return index;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.getValue(this);
    }

    @Override
    public Object getValue(TemplateContext context) {
        return getOrSetValue(context, null, false);
    }

    @Override
    public void setValue(TemplateContext context, Object value) {
        getOrSetValue(context, value, true);
    }

    @Override
    public String getFirstPath() {
        return target instanceof ScriptVariablePath ? ((ScriptVariablePath) target).getFirstPath() : null;
    }

    private Object getOrSetValue(TemplateContext context, Object valueToSet, boolean setter) {
        Object targetObject = context.getValue(target);
        if (targetObject == null) {
            if (context.isEnableRelaxedMemberAccess()) {
                return null;
            }
            throw new ScriptRuntimeException(target.getSpan(), String.format(
                    "Object `%s` is null. Cannot access indexer: %s", target, this));
        }

        Object indexValue = context.evaluate(index);
        if (indexValue == null) {
            if (context.isEnableRelaxedMemberAccess()) {
                return null;
            }
            throw new ScriptRuntimeException(index.getSpan(), String.format(
                    "Cannot access target `%s` with a null indexer: %s", target, this));
        }

        if (targetObject instanceof Map) {
            ObjectAccessor accessor = context.getMemberAccessor(targetObject);
            String key = context.toString(index.getSpan(), indexValue);
            if (setter) {
                if (!accessor.trySetValue(context, getSpan(), targetObject, key, valueToSet)) {
                    throw new ScriptRuntimeException(index.getSpan(), String.format(
                            "Cannot set a value for the readonly member `%s` in the indexer: %s", key, target));
                }
                return null;
            }
            if (accessor.hasMember(context, getSpan(), targetObject, key)) {
                return accessor.getValue(context, getSpan(), targetObject, key);
            }
            TryGetMemberCallback callback = context.getTryGetMember();
            return callback != null ? callback.tryGetMember(context, getSpan(), targetObject, key) : null;
        }

        ListAccessor accessor = context.getListAccessor(targetObject);
        if (accessor == null) {
            throw new ScriptRuntimeException(target.getSpan(), String.format(
                    "Cannot access target `%s` of type `%s` as a list for the expression: %s",
                    targetObject, targetObject.getClass().getSimpleName(), this));
        }
        int i = context.toInt(index.getSpan(), indexValue);
        if (i < 0) {
            int length = accessor.getLength(context, getSpan(), targetObject);
            if (length + i < 0) {
                // 读取时越界为 null，写入时报错
                if (setter) {
                    throw new ScriptRuntimeException(index.getSpan(), String.format(
                            "Index %d is out of bounds for a list of length %d", i, length));
                }
                return null;
            }
            i = length + i;
        }
        if (setter) {
            accessor.setValue(context, getSpan(), targetObject, i, valueToSet);
            return null;
        }
        return accessor.getValue(context, getSpan(), targetObject, i);
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(target);
        // $0 $1 这类参数访问原样写回
        boolean argumentShortcut = ScriptVariable.ARGUMENTS.equals(target)
                && index instanceof ScriptLiteral && ((ScriptLiteral) index).isPositiveInteger();
        if (argumentShortcut) {
            writer.write(index);
        } else {
            writer.write("[").write(index).write("]");
        }
    }
}
