package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ObjectAccessor;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TryGetMemberCallback;

import java.util.Objects;

/**
 * 成员访问 {@code target.member}
 */
public final class ScriptMemberExpression extends ScriptExpression implements ScriptVariablePath {

    private final ScriptExpression target;

    private final ScriptVariable member;

    public ScriptMemberExpression(SourceSpan span, ScriptExpression target, ScriptVariable member) {
        super(span);
        this.target = Objects.requireNonNull(target, "target");
        this.member = Objects.requireNonNull(member, "member");
    }

    public ScriptExpression getTarget() {
        return target;
    }

    public ScriptVariable getMember() {
        return member;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.getValue(this);
    }

    @Override
    public Object getValue(TemplateContext context) {
        Object targetObject = getTargetObject(context, false);
        // 宽松模式下目标为 null 时直接返回 null
        if (targetObject == null) {
            return null;
        }
        ObjectAccessor accessor = context.getMemberAccessor(targetObject);
        String memberName = member.getName();
        if (accessor.hasMember(context, getSpan(), targetObject, memberName)) {
            return accessor.getValue(context, getSpan(), targetObject, memberName);
        }
        TryGetMemberCallback callback = context.getTryGetMember();
        return callback != null ? callback.tryGetMember(context, getSpan(), targetObject, memberName) : null;
    }

    @Override
    public void setValue(TemplateContext context, Object value) {
        Object targetObject = getTargetObject(context, true);
        ObjectAccessor accessor = context.getMemberAccessor(targetObject);
        if (!accessor.trySetValue(context, getSpan(), targetObject, member.getName(), value)) {
            throw new ScriptRuntimeException(member.getSpan(), "Cannot set a value for the readonly member: " + this);
        }
    }

    @Override
    public String getFirstPath() {
        return target instanceof ScriptVariablePath ? ((ScriptVariablePath) target).getFirstPath() : null;
    }

    private Object getTargetObject(TemplateContext context, boolean isSet) {
        Object targetObject = context.getValue(target);
        if (targetObject == null) {
            if (isSet || !context.isEnableRelaxedMemberAccess()) {
                throw new ScriptRuntimeException(getSpan(), String.format(
                        "Object `%s` is null. Cannot access member: %s", target, this));
            }
        } else if (TemplateContext.isPrimitive(targetObject)) {
            if (isSet || !context.isEnableRelaxedMemberAccess()) {
                throw new ScriptRuntimeException(getSpan(), String.format(
                        "Cannot get or set a member on the primitive `%s/%s` when accessing member: %s",
                        targetObject, targetObject.getClass().getSimpleName(), this));
            }
            return null;
        }
        return targetObject;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write(target).write(".").write(member.getName());
    }
}
