package com.chih.TextScript.core.syntax;

/**
 * 控制流状态
 */
public enum ScriptFlowState {
    NONE,
    BREAK,
    CONTINUE,
    RETURN
}
