package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;

/**
 * 语句节点
 */
public abstract class ScriptStatement extends ScriptNode {

    protected ScriptStatement(SourceSpan span) {
        super(span);
    }
}
