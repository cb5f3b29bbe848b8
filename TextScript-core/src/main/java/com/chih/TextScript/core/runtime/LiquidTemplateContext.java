package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.functions.LiquidBuiltinsFunctions;
import com.chih.TextScript.core.parsing.LexerOptions;
import com.chih.TextScript.core.parsing.ScriptMode;

/**
 * 渲染 Liquid 模板的上下文
 * <p>
 * 内置对象额外提供 Liquid 过滤器名称，include 的子模板同样按 Liquid 解析，空的 include 名称不输出。
 * </p>
 */
public class LiquidTemplateContext extends TemplateContext {

    public LiquidTemplateContext() {
        super(new LiquidBuiltinsFunctions());
        setTemplateLoaderLexerOptions(LexerOptions.DEFAULT.withMode(ScriptMode.LIQUID));
    }
}
