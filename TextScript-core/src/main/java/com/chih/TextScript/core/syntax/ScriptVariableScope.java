package com.chih.TextScript.core.syntax;

/**
 * 变量作用域
 */
public enum ScriptVariableScope {
    /** 普通变量，沿全局对象栈查找 */
    GLOBAL,
    /** {@code $name} 形式，属于当前函数调用 */
    LOCAL,
    /** {@code for.index} 等循环元数据 */
    LOOP
}
