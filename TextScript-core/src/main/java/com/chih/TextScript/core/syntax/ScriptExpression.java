package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;

/**
 * 表达式节点
 */
public abstract class ScriptExpression extends ScriptNode {

    protected ScriptExpression(SourceSpan span) {
        super(span);
    }
}
