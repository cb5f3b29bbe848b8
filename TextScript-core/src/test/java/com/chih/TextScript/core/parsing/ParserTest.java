package com.chih.TextScript.core.parsing;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.syntax.ScriptForStatement;
import com.chih.TextScript.core.syntax.ScriptIfStatement;
import com.chih.TextScript.core.syntax.ScriptNopStatement;
import com.chih.TextScript.core.syntax.ScriptPage;
import com.chih.TextScript.core.syntax.ScriptRawStatement;
import com.chih.TextScript.core.syntax.ScriptStatement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Parser 测试")
class ParserTest {

    private static Parser parser(String text, ScriptMode mode, ParserOptions options) {
        return new Parser(new Lexer(text, "test", LexerOptions.DEFAULT.withMode(mode)), options);
    }

    private static String errors(Parser parser) {
        StringBuilder text = new StringBuilder();
        for (LogMessage message : parser.getMessages()) {
            text.append(message).append('\n');
        }
        return text.toString();
    }

    @Test
    @DisplayName("文本与语句组成页面")
    void testPageStructure() {
        // Given
        Parser parser = parser("a{{ if x }}b{{ end }}{{ for i in items }}{{ i }}{{ end }}", ScriptMode.DEFAULT, null);

        // When
        ScriptPage page = parser.run();

        // Then
        assertThat(parser.hasErrors()).as(errors(parser)).isFalse();
        List<ScriptStatement> statements = page.getBody().getStatements();
        assertThat(statements).hasSize(3);
        assertThat(statements.get(0)).isInstanceOf(ScriptRawStatement.class);
        assertThat(statements.get(1)).isInstanceOf(ScriptIfStatement.class);
        assertThat(statements.get(2)).isInstanceOf(ScriptForStatement.class);
    }

    @Test
    @DisplayName("空代码块生成 nop 语句")
    void testEmptyCodeBlock() {
        Parser parser = parser("{{}}", ScriptMode.DEFAULT, null);

        ScriptPage page = parser.run();

        assertThat(parser.hasErrors()).isFalse();
        assertThat(page.getBody().getStatements()).singleElement().isInstanceOf(ScriptNopStatement.class);
    }

    @Test
    @DisplayName("缺少 end 时报错")
    void testMissingEnd() {
        Parser parser = parser("{{ if x }}a", ScriptMode.DEFAULT, null);

        parser.run();

        assertThat(parser.hasErrors()).isTrue();
        assertThat(errors(parser)).contains("The `end` statement was not found");
    }

    @Test
    @DisplayName("多余的 end 报错")
    void testStrayEnd() {
        Parser parser = parser("a{{ end }}", ScriptMode.DEFAULT, null);

        parser.run();

        assertThat(parser.hasErrors()).isTrue();
        assertThat(errors(parser)).contains("without a matching statement");
    }

    @Test
    @DisplayName("代码块外出现 }} 报错")
    void testUnexpectedCodeExitInScriptOnly() {
        Parser parser = parser("x = 1 }}", ScriptMode.SCRIPT_ONLY, null);

        parser.run();

        assertThat(parser.hasErrors()).isTrue();
    }

    @Test
    @DisplayName("超过深度上限时报错")
    void testExpressionDepthLimit() {
        Parser parser = parser("{{ ((((((1)))))) }}", ScriptMode.DEFAULT,
                ParserOptions.DEFAULT.withExpressionDepthLimit(3));

        parser.run();

        assertThat(parser.hasErrors()).isTrue();
        assertThat(errors(parser)).contains("depth limit `3`");
    }

    @Test
    @DisplayName("同一个 Parser 只能运行一次")
    void testRunOnlyOnce() {
        Parser parser = parser("a", ScriptMode.DEFAULT, null);
        parser.run();

        assertThatThrownBy(parser::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("front matter 单独解析")
    void testFrontMatter() {
        Parser parser = parser("+++\ntitle = 'Hi'\n+++\nbody", ScriptMode.FRONT_MATTER_AND_CONTENT, null);

        ScriptPage page = parser.run();

        assertThat(parser.hasErrors()).as(errors(parser)).isFalse();
        assertThat(page.getFrontMatter()).isNotNull();
        assertThat(page.getFrontMatter().getStatements()).hasSize(1);
        assertThat(page.getBody().getStatements()).singleElement().isInstanceOf(ScriptRawStatement.class);
    }

    @Test
    @DisplayName("缺少 front matter 标记时报错")
    void testMissingFrontMatter() {
        Parser parser = parser("body", ScriptMode.FRONT_MATTER_AND_CONTENT, null);

        parser.run();

        assertThat(parser.hasErrors()).isTrue();
    }

    @Test
    @DisplayName("Liquid 语句需要对应的 endxxx")
    void testLiquidMissingEndTag() {
        Parser ok = parser("{% if x %}a{% endif %}", ScriptMode.LIQUID, null);
        ok.run();
        Parser broken = parser("{% if x %}a", ScriptMode.LIQUID, null);
        broken.run();

        assertThat(ok.hasErrors()).as(errors(ok)).isFalse();
        assertThat(broken.hasErrors()).isTrue();
        assertThat(errors(broken)).contains("endif");
    }

    @Test
    @DisplayName("转换 Liquid 过滤器后可在原生上下文中渲染")
    void testConvertLiquidFunctions() {
        // Given
        Template template = Template.parseLiquid("{{ x | upcase }}", null,
                ParserOptions.DEFAULT.withConvertLiquidFunctions(true), null);
        TemplateContext context = new TemplateContext();
        context.pushGlobal(ScriptObject.from(Map.of("x", "abc")));

        // When
        String result = template.render(context);

        // Then
        assertThat(template.hasErrors()).isFalse();
        assertThat(result).isEqualTo("ABC");
    }

    @Test
    @DisplayName("语法树写回源码")
    void testToText() {
        Template template = Template.parse("Hi {{ x + 1 }}!");

        String text = template.toText();

        assertThat(text).startsWith("Hi ").endsWith("!").contains("x + 1");
    }

    @Test
    @DisplayName("转义块写回时保留层数")
    void testToTextEscapeBlock() {
        // Given
        String text = "a{%%%{ {{ x }} }%%%}b";

        // When
        Template template = Template.parse(text);

        // Then
        assertThat(template.hasErrors()).isFalse();
        assertThat(template.toText()).isEqualTo(text);
    }

    @Test
    @DisplayName("超过 9 层的转义块按 9 层写回")
    void testToTextEscapeBlockCap() {
        // Given
        String ten = "%".repeat(10);
        String nine = "%".repeat(9);
        Template template = Template.parse("{" + ten + "{ {{ x }} }" + ten + "}");

        // When
        String text = template.toText();

        // Then
        assertThat(text).isEqualTo("{" + nine + "{ {{ x }} }" + nine + "}");
        assertThat(Template.parse(text).render(Map.of())).isEqualTo(" {{ x }} ");
    }
}
