package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;

/**
 * 语法树节点基类
 * <p>
 * 节点在解析完成后不可变，可以被多个 {@link TemplateContext} 并发求值。
 * 每个节点同时负责两件事：在给定上下文中求值，以及通过 {@link TemplateRewriter} 还原为源码。
 * </p>
 */
public abstract class ScriptNode {

    private final SourceSpan span;

    protected ScriptNode(SourceSpan span) {
        this.span = span != null ? span : SourceSpan.EMPTY;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * 在上下文中求值，语句节点一般把输出写入上下文并返回 null
     */
    public abstract Object evaluate(TemplateContext context);

    /**
     * 以原生 TextScript 语法写出本节点
     */
    public abstract void write(TemplateRewriter writer);

    @Override
    public String toString() {
        TemplateRewriter writer = new TemplateRewriter(true);
        write(writer);
        return writer.toString();
    }
}
