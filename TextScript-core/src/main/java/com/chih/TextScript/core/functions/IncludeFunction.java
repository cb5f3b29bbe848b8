package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.exception.ScriptParserRuntimeException;
import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.LiquidTemplateContext;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.ScriptCustomFunction;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TemplateLoader;
import com.chih.TextScript.core.syntax.ScriptBlockStatement;
import com.chih.TextScript.core.syntax.ScriptNode;
import com.chih.TextScript.core.syntax.ScriptVariable;

/**
 * {@code include "name" arg1 arg2}
 * <p>
 * 通过上下文的 {@link TemplateLoader} 解析并加载子模板，解析结果按路径缓存在上下文中；
 * 子模板与调用方共享全局变量，其余参数以 {@code $} 传入。
 * 嵌套深度由函数调用的递归上限约束。
 * </p>
 */
public final class IncludeFunction implements ScriptCustomFunction {

    @Override
    public Object invoke(TemplateContext context, ScriptNode callerNode, ScriptArray arguments, ScriptBlockStatement blockDelegate) {
        SourceSpan span = callerNode.getSpan();
        if (arguments.isEmpty()) {
            throw new ScriptRuntimeException(span, "Expecting at least the name of the template to include for the <include> function");
        }

        String templateName = context.toString(span, arguments.get(0));
        if (templateName == null || templateName.isEmpty()) {
            // Liquid 下空名称不输出任何内容
            if (context instanceof LiquidTemplateContext) {
                return null;
            }
            throw new ScriptRuntimeException(span, "Include template name cannot be null or empty");
        }

        TemplateLoader loader = context.getTemplateLoader();
        if (loader == null) {
            throw new ScriptRuntimeException(span, "Unable to include <" + templateName + ">. No TemplateLoader registered in the context");
        }

        String templatePath;
        try {
            templatePath = loader.getPath(context, span, templateName);
        } catch (ScriptRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScriptRuntimeException(span, "Unexpected exception while getting the path for the include name `" + templateName + "`", e);
        }
        if (templatePath == null) {
            throw new ScriptRuntimeException(span, "Include template path is null for `" + templateName + "`");
        }

        ScriptArray includeArguments = new ScriptArray(arguments.size() - 1);
        for (int i = 1; i < arguments.size(); i++) {
            includeArguments.add(arguments.get(i));
        }
        context.setValue(ScriptVariable.ARGUMENTS, includeArguments, true);

        Template template = context.getCachedTemplates().get(templatePath);
        if (template == null) {
            template = loadTemplate(context, span, loader, templateName, templatePath);
            context.getCachedTemplates().put(templatePath, template);
        }

        context.pushOutput();
        try {
            return template.render(context);
        } finally {
            context.popOutput();
        }
    }

    private static Template loadTemplate(TemplateContext context, SourceSpan span, TemplateLoader loader,
                                         String templateName, String templatePath) {
        String text;
        try {
            text = loader.load(context, span, templatePath);
        } catch (ScriptRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScriptRuntimeException(span, String.format(
                    "Unexpected exception while loading the include `%s` from path `%s`", templateName, templatePath), e);
        }
        if (text == null) {
            throw new ScriptRuntimeException(span, String.format(
                    "The result of including `%s->%s` cannot be null", templateName, templatePath));
        }

        Template template = Template.parse(text, templatePath,
                context.getTemplateLoaderParserOptions(), context.getTemplateLoaderLexerOptions());
        if (template.hasErrors()) {
            throw new ScriptParserRuntimeException(span, String.format(
                    "Error while parsing template `%s` from `%s`", templateName, templatePath), template.getMessages());
        }
        return template;
    }
}
