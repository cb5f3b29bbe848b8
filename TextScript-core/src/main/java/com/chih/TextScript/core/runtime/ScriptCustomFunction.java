package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.syntax.ScriptBlockStatement;
import com.chih.TextScript.core.syntax.ScriptNode;

/**
 * 宿主提供的外部函数
 * <p>
 * 位置参数按顺序放在 arguments 中；命名参数以 {@link com.chih.TextScript.core.syntax.ScriptNamedArgument}
 * 节点原样传入，由函数自行求值。
 * </p>
 */
@FunctionalInterface
public interface ScriptCustomFunction {

    /**
     * @param callerNode    调用点
     * @param arguments     本次调用新建的参数数组
     * @param blockDelegate wrap 传入的语句块，没有时为 null
     */
    Object invoke(TemplateContext context, ScriptNode callerNode, ScriptArray arguments, ScriptBlockStatement blockDelegate);
}
