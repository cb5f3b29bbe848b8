package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

import java.util.Objects;

/**
 * 解析结果的根节点：可选的 front matter 加正文
 */
public final class ScriptPage extends ScriptNode {

    private final ScriptBlockStatement frontMatter;

    private final ScriptBlockStatement body;

    public ScriptPage(SourceSpan span, ScriptBlockStatement frontMatter, ScriptBlockStatement body) {
        super(span);
        this.frontMatter = frontMatter;
        this.body = Objects.requireNonNull(body, "body");
    }

    public ScriptBlockStatement getFrontMatter() {
        return frontMatter;
    }

    public ScriptBlockStatement getBody() {
        return body;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.evaluate(body);
    }

    @Override
    public void write(TemplateRewriter writer) {
        if (frontMatter != null) {
            boolean scriptOnly = writer.isScriptOnly();
            writer.write("+++\n");
            writer.setScriptOnly(true);
            writer.write(frontMatter);
            writer.setScriptOnly(scriptOnly);
            writer.write("\n+++\n");
        }
        writer.write(body);
    }
}
