package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.runtime.EmptyScriptObject;
import com.chih.TextScript.core.runtime.ScriptObject;

/**
 * 内置对象，位于全局对象栈底部
 * <p>
 * 所有成员只读，模板中对 {@code include}、{@code string} 等名称赋值会报错。
 * </p>
 */
public class BuiltinFunctions extends ScriptObject {

    public BuiltinFunctions() {
        setValue("empty", EmptyScriptObject.DEFAULT, true);
        setValue("include", new IncludeFunction(), true);
        setValue("array", readOnly(new ArrayFunctions()), true);
        setValue("string", readOnly(new StringFunctions()), true);
        setValue("math", readOnly(new MathFunctions()), true);
        setValue("object", readOnly(new ObjectFunctions()), true);
    }

    private static ScriptObject readOnly(ScriptObject library) {
        library.setReadOnly(true);
        return library;
    }
}
