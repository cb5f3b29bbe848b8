package com.chih.TextScript.core.syntax;

import com.chih.TextScript.core.parsing.SourceSpan;

/**
 * 条件链上的节点：if / else / case / when
 */
public abstract class ScriptConditionStatement extends ScriptStatement {

    protected ScriptConditionStatement(SourceSpan span) {
        super(span);
    }
}
