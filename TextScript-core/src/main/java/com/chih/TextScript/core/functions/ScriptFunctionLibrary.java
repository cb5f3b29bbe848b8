package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.runtime.DelegateCustomFunction;
import com.chih.TextScript.core.runtime.ScriptObject;

/**
 * 一组以成员形式挂在对象上的内置函数，例如 {@code string.upcase}
 */
public abstract class ScriptFunctionLibrary extends ScriptObject {

    @FunctionalInterface
    protected interface FunctionBody {
        Object apply(FunctionArguments arguments);
    }

    private final String libraryName;

    protected ScriptFunctionLibrary(String libraryName) {
        this.libraryName = libraryName;
    }

    public String getLibraryName() {
        return libraryName;
    }

    /**
     * 注册只读函数成员
     *
     * @param minCount 最少参数个数 (含管道传入的参数)
     * @param maxCount 最多参数个数
     */
    protected void register(String name, int minCount, int maxCount, FunctionBody body) {
        String qualifiedName = libraryName + "." + name;
        importFunction(name, new DelegateCustomFunction(qualifiedName, (context, callerNode, arguments) ->
                body.apply(FunctionArguments.parse(context, callerNode.getSpan(), qualifiedName, arguments, minCount, maxCount))));
    }
}
