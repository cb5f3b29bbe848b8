package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.List;
import java.util.Objects;

/**
 * 对象字面量 {@code {a: 1, "b": 2}}
 * <p>
 * 重复的键在解析时已合并 (后者覆盖前者，位置保持首次出现处)。
 * </p>
 */
public final class ScriptObjectInitializerExpression extends ScriptExpression {

    /**
     * 一个成员，键为标识符 ({@link ScriptVariable}) 或字符串 ({@link ScriptLiteral})
     */
    public record Member(ScriptExpression key, ScriptExpression value) {

        public Member {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        public String name() {
            return nameOf(key);
        }
    }

    private final List<Member> members;

    public ScriptObjectInitializerExpression(SourceSpan span, List<Member> members) {
        super(span);
        this.members = List.copyOf(members);
    }

    public List<Member> getMembers() {
        return members;
    }

    public static String nameOf(ScriptExpression key) {
        if (key instanceof ScriptVariable) {
            return ((ScriptVariable) key).getName();
        }
        if (key instanceof ScriptLiteral) {
            return String.valueOf(((ScriptLiteral) key).getValue());
        }
        throw new IllegalArgumentException("Unsupported object member key: " + key);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        ScriptObject scriptObject = new ScriptObject();
        for (Member member : members) {
            scriptObject.setValue(member.name(), context.evaluate(member.value()), false);
        }
        return scriptObject;
    }

    @Override
    public void write(TemplateRewriter writer) {
        writer.write("{");
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                writer.write(", ");
            }
            Member member = members.get(i);
            writer.write(member.key()).write(": ").write(member.value());
        }
        writer.write("}");
    }
}
