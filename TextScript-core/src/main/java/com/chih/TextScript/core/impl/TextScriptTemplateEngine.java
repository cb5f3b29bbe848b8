package com.chih.TextScript.core.impl;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.exception.TemplateParseException;
import com.chih.TextScript.core.exception.TemplateRenderException;
import com.chih.TextScript.core.exception.TextScriptException;
import com.chih.TextScript.core.parsing.Lexer;
import com.chih.TextScript.core.parsing.LexerOptions;
import com.chih.TextScript.core.parsing.LogMessage;
import com.chih.TextScript.core.parsing.ParserOptions;
import com.chih.TextScript.core.parsing.ScriptMode;
import com.chih.TextScript.core.parsing.Token;
import com.chih.TextScript.core.parsing.TokenType;
import com.chih.TextScript.core.runtime.LiquidTemplateContext;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TemplateLoader;
import com.chih.TextScript.core.spi.CompiledTemplate;
import com.chih.TextScript.core.spi.TemplateEngine;
import com.chih.TextScript.core.support.TemplateResources;
import com.chih.TextScript.core.syntax.ScriptBlockStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 基于 TextScript 的模板引擎实现
 * <p>
 * 以 {@code +++} 开头的原生模板按 front matter + 正文解析，front matter 中定义的变量作为渲染时的默认值，
 * 调用方传入的同名变量优先。Liquid 模式下不识别 front matter。
 * </p>
 * <p>
 * 编译时通过词法扫描找出 {@code include "name"} 中的字面量名称作为依赖，被 include 的模板变化时
 * {@link com.chih.TextScript.core.engine.TemplateManager} 会重新编译依赖它的模板。
 * </p>
 *
 * @since 2025/12/16
 */
public class TextScriptTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(TextScriptTemplateEngine.class);

    private static final String INCLUDE = "include";

    private final boolean liquid;

    private ParserOptions parserOptions = ParserOptions.DEFAULT;

    private boolean enableRelaxedMemberAccess = true;

    private boolean strictVariables;

    private int loopLimit = TemplateContext.DEFAULT_LOOP_LIMIT;

    private int recursiveLimit = TemplateContext.DEFAULT_RECURSIVE_LIMIT;

    public TextScriptTemplateEngine() {
        this(false);
    }

    /**
     * @param liquid 是否按 Liquid 语法解析模板
     */
    public TextScriptTemplateEngine(boolean liquid) {
        this.liquid = liquid;
    }

    @Override
    public CompiledTemplate compile(String key, String text, TemplateLoader loader) {
        if (text == null) {
            return null;
        }
        LexerOptions lexerOptions = lexerOptionsFor(text);
        Template template = Template.parse(text, key, parserOptions, lexerOptions);
        if (template.hasErrors()) {
            for (LogMessage message : template.getMessages()) {
                log.warn("{}", message);
            }
            throw new TemplateParseException(template.getMessages());
        }
        Set<String> dependencies = scanIncludes(key, text, lexerOptions);
        log.debug("Compiled template `{}` with dependencies {}", key, dependencies);
        return new CompiledTemplate(key, template, loader, dependencies);
    }

    @Override
    public String render(CompiledTemplate compiled, Map<String, Object> variables) {
        if (compiled == null) {
            return "";
        }

        try {
            TemplateContext context = createContext(compiled);
            ScriptObject globals = new ScriptObject();
            context.pushGlobal(globals);
            evaluateFrontMatter(context, compiled);
            if (variables != null) {
                globals.importObject(variables);
            }
            return compiled.getTemplate().render(context);
        } catch (TextScriptException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Template execution failed: {}", compiled.getKey(), e);
            throw new TemplateRenderException(compiled.getKey(), e);
        }
    }

    @Override
    public Map<String, Object> evaluateFrontMatter(CompiledTemplate compiled) {
        if (compiled == null || compiled.getTemplate().getPage().getFrontMatter() == null) {
            return Collections.emptyMap();
        }
        TemplateContext context = createContext(compiled);
        ScriptObject globals = new ScriptObject();
        context.pushGlobal(globals);
        evaluateFrontMatter(context, compiled);
        return globals;
    }

    private void evaluateFrontMatter(TemplateContext context, CompiledTemplate compiled) {
        ScriptBlockStatement frontMatter = compiled.getTemplate().getPage().getFrontMatter();
        if (frontMatter == null) {
            return;
        }
        boolean previousOutput = context.isEnableOutput();
        context.setEnableOutput(false);
        try {
            context.evaluate(frontMatter);
        } finally {
            context.setEnableOutput(previousOutput);
        }
    }

    private TemplateContext createContext(CompiledTemplate compiled) {
        TemplateContext context = liquid ? new LiquidTemplateContext() : new TemplateContext();
        context.setTemplateLoader(compiled.getLoader());
        context.setTemplateLoaderParserOptions(parserOptions);
        context.setTemplateLoaderLexerOptions(liquid
                ? LexerOptions.DEFAULT.withMode(ScriptMode.LIQUID).withIncludeImplicitString(true)
                : LexerOptions.DEFAULT);
        context.setEnableRelaxedMemberAccess(enableRelaxedMemberAccess);
        context.setStrictVariables(strictVariables);
        context.setLoopLimit(loopLimit);
        context.setRecursiveLimit(recursiveLimit);
        return context;
    }

    private LexerOptions lexerOptionsFor(String text) {
        if (liquid) {
            return LexerOptions.DEFAULT.withMode(ScriptMode.LIQUID).withIncludeImplicitString(true);
        }
        if (text.startsWith(LexerOptions.DEFAULT_FRONT_MATTER_MARKER)) {
            return LexerOptions.DEFAULT.withMode(ScriptMode.FRONT_MATTER_AND_CONTENT);
        }
        return LexerOptions.DEFAULT;
    }

    /**
     * 找出 {@code include} 后紧跟的字面量字符串，动态计算的名称无法静态得知
     */
    private static Set<String> scanIncludes(String key, String text, LexerOptions lexerOptions) {
        Set<String> dependencies = new LinkedHashSet<>();
        Lexer lexer = new Lexer(text, key, lexerOptions);
        boolean afterInclude = false;
        for (Token token : lexer) {
            TokenType type = token.type();
            if (type == TokenType.WHITESPACE || type == TokenType.WHITESPACE_FULL
                    || type == TokenType.COMMENT || type == TokenType.COMMENT_MULTI) {
                continue;
            }
            if (afterInclude && (type == TokenType.STRING || type == TokenType.IMPLICIT_STRING)) {
                String name = token.getText(text);
                if (type == TokenType.STRING && name.length() >= 2) {
                    name = name.substring(1, name.length() - 1);
                }
                if (!name.isEmpty()) {
                    dependencies.add(TemplateResources.toKey(name));
                }
            }
            afterInclude = type == TokenType.IDENTIFIER && INCLUDE.equals(token.getText(text));
        }
        return dependencies;
    }

    public boolean isLiquid() {
        return liquid;
    }

    public ParserOptions getParserOptions() {
        return parserOptions;
    }

    public void setParserOptions(ParserOptions parserOptions) {
        this.parserOptions = parserOptions != null ? parserOptions : ParserOptions.DEFAULT;
    }

    public boolean isEnableRelaxedMemberAccess() {
        return enableRelaxedMemberAccess;
    }

    public void setEnableRelaxedMemberAccess(boolean enableRelaxedMemberAccess) {
        this.enableRelaxedMemberAccess = enableRelaxedMemberAccess;
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    public void setStrictVariables(boolean strictVariables) {
        this.strictVariables = strictVariables;
    }

    public int getLoopLimit() {
        return loopLimit;
    }

    public void setLoopLimit(int loopLimit) {
        this.loopLimit = loopLimit;
    }

    public int getRecursiveLimit() {
        return recursiveLimit;
    }

    public void setRecursiveLimit(int recursiveLimit) {
        this.recursiveLimit = recursiveLimit;
    }
}
