package com.chih.TextScript.core;

import com.chih.TextScript.core.exception.TemplateParseException;
import com.chih.TextScript.core.parsing.Lexer;
import com.chih.TextScript.core.parsing.LexerOptions;
import com.chih.TextScript.core.parsing.LogMessage;
import com.chih.TextScript.core.parsing.Parser;
import com.chih.TextScript.core.parsing.ParserOptions;
import com.chih.TextScript.core.parsing.ScriptMode;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.parsing.TextPosition;
import com.chih.TextScript.core.runtime.LiquidTemplateContext;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.syntax.ScriptBlockStatement;
import com.chih.TextScript.core.syntax.ScriptPage;
import com.chih.TextScript.core.syntax.TemplateRewriter;

import java.util.List;
import java.util.Objects;

/**
 * 解析后的模板
 * <p>
 * 模板本身不可变，可以缓存并在多个线程中用各自的 {@link TemplateContext} 渲染。
 * 存在解析错误时 {@link #render} 与 {@link #evaluate} 抛出 {@link TemplateParseException}。
 * </p>
 * <pre>{@code
 * Template template = Template.parse("Hello {{ name }}!");
 * String text = template.render(Map.of("name", "World"));
 * }</pre>
 *
 * @since 2025/12/14
 */
public final class Template {

    private final String sourcePath;

    private final ScriptMode mode;

    private final ScriptPage page;

    private final List<LogMessage> messages;

    private final boolean hasErrors;

    private Template(String sourcePath, ScriptMode mode, ScriptPage page, List<LogMessage> messages, boolean hasErrors) {
        this.sourcePath = sourcePath;
        this.mode = mode;
        this.page = page;
        this.messages = List.copyOf(messages);
        this.hasErrors = hasErrors;
    }

    public static Template parse(String text) {
        return parse(text, null, null, null);
    }

    public static Template parse(String text, String sourcePath) {
        return parse(text, sourcePath, null, null);
    }

    public static Template parse(String text, String sourcePath, ParserOptions parserOptions, LexerOptions lexerOptions) {
        ParserOptions actualParserOptions = parserOptions != null ? parserOptions : ParserOptions.DEFAULT;
        LexerOptions actualLexerOptions = lexerOptions != null ? lexerOptions : LexerOptions.DEFAULT;
        if (text == null || text.isEmpty()) {
            SourceSpan span = new SourceSpan(sourcePath != null ? sourcePath : "<input>", TextPosition.START, TextPosition.EOF);
            ScriptPage empty = new ScriptPage(span, null, new ScriptBlockStatement(span, List.of()));
            return new Template(sourcePath, actualLexerOptions.mode(), empty, List.of(), false);
        }
        Lexer lexer = new Lexer(text, sourcePath, actualLexerOptions);
        Parser parser = new Parser(lexer, actualParserOptions);
        ScriptPage page = parser.run();
        return new Template(sourcePath, actualLexerOptions.mode(), page, parser.getMessages(), parser.hasErrors());
    }

    public static Template parseLiquid(String text) {
        return parseLiquid(text, null, null, null);
    }

    public static Template parseLiquid(String text, String sourcePath, ParserOptions parserOptions, LexerOptions lexerOptions) {
        LexerOptions options = lexerOptions != null ? lexerOptions : LexerOptions.DEFAULT;
        return parse(text, sourcePath, parserOptions, options.withMode(ScriptMode.LIQUID));
    }

    /**
     * 以纯脚本模式求值一个表达式，例如 {@code Template.evaluate("1 + x", Map.of("x", 2))}
     */
    public static Object evaluate(String expression, Object model) {
        Objects.requireNonNull(expression, "expression");
        Template template = parse(expression, null, null, LexerOptions.DEFAULT.withMode(ScriptMode.SCRIPT_ONLY));
        return template.evaluate(model);
    }

    public static Object evaluate(String expression, TemplateContext context) {
        Objects.requireNonNull(expression, "expression");
        Template template = parse(expression, null, null, LexerOptions.DEFAULT.withMode(ScriptMode.SCRIPT_ONLY));
        return template.evaluate(context);
    }

    /**
     * 求值但不产生输出，返回最后一个语句的值
     */
    public Object evaluate(TemplateContext context) {
        boolean previousOutput = context.isEnableOutput();
        try {
            context.setEnableOutput(false);
            return evaluateAndRender(context, false);
        } finally {
            context.setEnableOutput(previousOutput);
        }
    }

    public Object evaluate(Object model) {
        TemplateContext context = new TemplateContext();
        context.setEnableOutput(false);
        context.pushGlobal(toGlobal(model));
        return evaluate(context);
    }

    /**
     * 在给定上下文中渲染，返回本次写入的文本并清空当前输出缓冲
     */
    public String render(TemplateContext context) {
        evaluateAndRender(context, true);
        StringBuilder output = context.getOutput();
        String result = output.toString();
        output.setLength(0);
        return result;
    }

    /**
     * 以 model 为全局变量渲染；model 可以是 Map、ScriptObject 或普通 Java 对象
     */
    public String render(Object model) {
        TemplateContext context = mode == ScriptMode.LIQUID ? new LiquidTemplateContext() : new TemplateContext();
        context.pushGlobal(toGlobal(model));
        return render(context);
    }

    /**
     * 把语法树写回 TextScript 源码
     */
    public String toText() {
        checkErrors();
        TemplateRewriter rewriter = new TemplateRewriter();
        rewriter.write(page);
        return rewriter.toString();
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public ScriptPage getPage() {
        return page;
    }

    public List<LogMessage> getMessages() {
        return messages;
    }

    public boolean hasErrors() {
        return hasErrors;
    }

    private Object evaluateAndRender(TemplateContext context, boolean render) {
        Objects.requireNonNull(context, "context");
        checkErrors();
        if (sourcePath != null) {
            context.pushSourceFile(sourcePath);
        }
        try {
            Object result = context.evaluate(page);
            if (render && context.isEnableOutput() && result != null) {
                context.write(page.getSpan(), result);
            }
            return result;
        } finally {
            if (sourcePath != null) {
                context.popSourceFile();
            }
        }
    }

    private void checkErrors() {
        if (hasErrors) {
            throw new TemplateParseException(messages);
        }
    }

    private static ScriptObject toGlobal(Object model) {
        ScriptObject global = new ScriptObject();
        if (model != null) {
            global.importObject(model);
        }
        return global;
    }
}
