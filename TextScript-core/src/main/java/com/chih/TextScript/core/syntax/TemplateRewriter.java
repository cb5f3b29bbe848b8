package com.chih.TextScript.core.syntax;

import java.util.List;

/**
 * 将语法树写回原生 TextScript 源码
 * <p>
 * 输出是规范化形式：代码块统一为 {@code {{ ... }}}，同一代码块内的语句以 {@code ; } 分隔，
 * 原始文本原样输出。脚本模式 (front matter、ScriptOnly) 下不输出代码块定界符，语句以换行分隔。
 * 重新解析输出得到的语法树与原树求值等价。
 * </p>
 */
public class TemplateRewriter {

    private final StringBuilder builder = new StringBuilder();

    private boolean scriptOnly;

    private boolean inCode;

    private boolean separatorPending;

    public TemplateRewriter() {
        this(false);
    }

    public TemplateRewriter(boolean scriptOnly) {
        this.scriptOnly = scriptOnly;
    }

    public boolean isScriptOnly() {
        return scriptOnly;
    }

    public void setScriptOnly(boolean scriptOnly) {
        exitCode();
        this.scriptOnly = scriptOnly;
        this.separatorPending = false;
    }

    public TemplateRewriter write(String text) {
        builder.append(text);
        return this;
    }

    public TemplateRewriter write(ScriptNode node) {
        if (node != null) {
            node.write(this);
        }
        return this;
    }

    public TemplateRewriter write(List<? extends ScriptNode> nodes, String separator) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                builder.append(separator);
            }
            write(nodes.get(i));
        }
        return this;
    }

    /**
     * 开始一条代码语句：必要时进入代码块或写出分隔符
     */
    public void beginStatement() {
        if (scriptOnly) {
            if (separatorPending) {
                builder.append('\n');
            }
        } else if (!inCode) {
            builder.append("{{ ");
            inCode = true;
        } else if (separatorPending) {
            builder.append("; ");
        }
        separatorPending = false;
    }

    public void endStatement() {
        separatorPending = true;
    }

    public void writeRaw(String text) {
        exitCode();
        builder.append(text);
    }

    /**
     * 转义块 {@code {%{ ... }%}}，{@code %} 的个数为转义层数
     */
    public void writeEscape(String text, int escapeCount) {
        exitCode();
        String percents = "%".repeat(escapeCount);
        builder.append('{').append(percents).append('{')
                .append(text)
                .append('}').append(percents).append('}');
    }

    private void exitCode() {
        if (inCode) {
            builder.append(" }}");
            inCode = false;
        }
        separatorPending = false;
    }

    @Override
    public String toString() {
        if (inCode) {
            return builder + " }}";
        }
        return builder.toString();
    }
}
