package com.chih.TextScript.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Lexer 测试")
class LexerTest {

    private static List<Token> tokens(String text, LexerOptions options) {
        List<Token> result = new ArrayList<>();
        for (Token token : new Lexer(text, null, options)) {
            result.add(token);
        }
        return result;
    }

    private static List<TokenType> types(String text, LexerOptions options) {
        List<TokenType> result = new ArrayList<>();
        for (Token token : tokens(text, options)) {
            result.add(token.type());
        }
        return result;
    }

    @Test
    @DisplayName("文本与代码块交替")
    void testRawAndCode() {
        String text = "Hello {{ name }}!";

        List<Token> tokens = tokens(text, LexerOptions.DEFAULT);

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.RAW, TokenType.CODE_ENTER, TokenType.IDENTIFIER, TokenType.CODE_EXIT,
                TokenType.RAW, TokenType.EOF);
        assertThat(tokens.get(0).getText(text)).isEqualTo("Hello ");
        assertThat(tokens.get(2).getText(text)).isEqualTo("name");
        assertThat(tokens.get(4).getText(text)).isEqualTo("!");
    }

    @Test
    @DisplayName("运算符按最长匹配识别")
    void testOperators() {
        List<TokenType> types = types("{{ a == b != c <= d // e ?? f ..< g }}", LexerOptions.DEFAULT);

        assertThat(types).containsSubsequence(
                TokenType.DOUBLE_EQUAL, TokenType.EXCLAMATION_EQUAL, TokenType.LESS_EQUAL,
                TokenType.DOUBLE_DIVIDE, TokenType.DOUBLE_QUESTION, TokenType.DOUBLE_DOT_LESS);
    }

    @Test
    @DisplayName("数字与字符串字面量")
    void testLiterals() {
        String text = "{{ 42 3.14 'single' \"double\" `verbatim` }}";

        List<Token> tokens = tokens(text, LexerOptions.DEFAULT);

        assertThat(tokens).extracting(Token::type).containsSubsequence(
                TokenType.INTEGER, TokenType.FLOAT, TokenType.STRING, TokenType.STRING, TokenType.VERBATIM_STRING);
        assertThat(tokens.get(1).getText(text)).isEqualTo("42");
        assertThat(tokens.get(2).getText(text)).isEqualTo("3.14");
    }

    @Test
    @DisplayName("纯脚本模式下没有代码块边界")
    void testScriptOnlyMode() {
        List<TokenType> types = types("x = 1", LexerOptions.DEFAULT.withMode(ScriptMode.SCRIPT_ONLY));

        assertThat(types).containsExactly(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER, TokenType.EOF);
    }

    @Test
    @DisplayName("Liquid 标签与输出块")
    void testLiquidTags() {
        List<TokenType> types = types("{% if x %}{{ x }}{% endif %}", LexerOptions.DEFAULT.withMode(ScriptMode.LIQUID));

        assertThat(types).startsWith(TokenType.LIQUID_TAG_ENTER, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.LIQUID_TAG_EXIT, TokenType.CODE_ENTER);
        assertThat(types).endsWith(TokenType.LIQUID_TAG_EXIT, TokenType.EOF);
    }

    @Test
    @DisplayName("空白控制符生成独立的 token")
    void testWhitespaceControl() {
        List<TokenType> types = types("a  {{- x -}}  b", LexerOptions.DEFAULT);

        assertThat(types).containsExactly(
                TokenType.RAW, TokenType.WHITESPACE_FULL, TokenType.CODE_ENTER, TokenType.IDENTIFIER,
                TokenType.CODE_EXIT, TokenType.WHITESPACE_FULL, TokenType.RAW, TokenType.EOF);
    }

    @Test
    @DisplayName("多层转义块输出原样文本与层数")
    void testEscapeBlockDepth() {
        String text = "{%%%{ {{ x }} }%%%}";

        List<Token> tokens = tokens(text, LexerOptions.DEFAULT);

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.ESCAPE, TokenType.ESCAPE_COUNT3, TokenType.EOF);
        assertThat(tokens.get(0).getText(text)).isEqualTo(" {{ x }} ");
        assertThat(tokens.get(1).type().escapeCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("转义层数最多记为 9")
    void testEscapeCountCap() {
        String percents = "%".repeat(10);
        String text = "{" + percents + "{ a }" + percents + "}";

        List<TokenType> types = types(text, LexerOptions.DEFAULT);

        assertThat(types).containsExactly(TokenType.ESCAPE, TokenType.ESCAPE_COUNT9, TokenType.EOF);
        assertThat(TokenType.escapeCount(12)).isEqualTo(TokenType.ESCAPE_COUNT9);
        assertThat(TokenType.escapeCount(0)).isEqualTo(TokenType.ESCAPE_COUNT1);
    }

    @Test
    @DisplayName("front matter 标记")
    void testFrontMatterMarker() {
        String text = "+++\nx = 1\n+++\nbody";

        List<TokenType> types = types(text, LexerOptions.DEFAULT.withMode(ScriptMode.FRONT_MATTER_AND_CONTENT));

        assertThat(types.get(0)).isEqualTo(TokenType.FRONT_MATTER_MARKER);
        assertThat(types).filteredOn(t -> t == TokenType.FRONT_MATTER_MARKER).hasSize(2);
        assertThat(types).endsWith(TokenType.RAW, TokenType.EOF);
    }

    @Test
    @DisplayName("未闭合的字符串产生词法错误")
    void testUnterminatedString() {
        Lexer lexer = new Lexer("{{ 'abc }}", null, LexerOptions.DEFAULT);

        List<TokenType> types = new ArrayList<>();
        for (Token token : lexer) {
            types.add(token.type());
        }

        assertThat(lexer.hasErrors()).isTrue();
        assertThat(lexer.getErrors()).isNotEmpty();
        assertThat(types).doesNotContain(TokenType.STRING);
    }

    @Test
    @DisplayName("起始位置越界时抛出异常")
    void testStartPositionOutOfRange() {
        LexerOptions options = new LexerOptions(ScriptMode.DEFAULT, LexerOptions.DEFAULT_FRONT_MATTER_MARKER,
                false, new TextPosition(10, 0, 10), false);

        assertThatThrownBy(() -> new Lexer("abc", null, options))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
