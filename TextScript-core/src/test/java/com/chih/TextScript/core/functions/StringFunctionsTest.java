package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.exception.ScriptRuntimeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("string 函数测试")
class StringFunctionsTest {

    private static String render(String text, Map<String, Object> model) {
        return Template.parse(text).render(model);
    }

    @Test
    @DisplayName("大小写转换")
    void testCase() {
        assertThat(render("{{ 'Hello' | string.upcase }}", Map.of())).isEqualTo("HELLO");
        assertThat(render("{{ 'Hello' | string.downcase }}", Map.of())).isEqualTo("hello");
        assertThat(render("{{ 'hello world' | string.capitalize }}", Map.of())).isEqualTo("Hello world");
    }

    @Test
    @DisplayName("拼接与去空白")
    void testAppendPrependStrip() {
        assertThat(render("{{ 'a' | string.append 'b' }}", Map.of())).isEqualTo("ab");
        assertThat(render("{{ 'a' | string.prepend 'b' }}", Map.of())).isEqualTo("ba");
        assertThat(render("[{{ '  x  ' | string.strip }}]", Map.of())).isEqualTo("[x]");
    }

    @Test
    @DisplayName("包含、前缀与后缀匹配")
    void testMatch() {
        assertThat(render("{{ 'Hello World' | string.contains 'o W' }}", Map.of())).isEqualTo("true");
        assertThat(render("{{ string.starts_with 'Hello' 'He' }}", Map.of())).isEqualTo("true");
        assertThat(render("{{ string.ends_with 'Hello' 'He' }}", Map.of())).isEqualTo("false");
        assertThat(render("{{ missing | string.contains 1 }}", Map.of())).isEqualTo("false");
    }

    @Test
    @DisplayName("null 视为空串")
    void testNullArgument() {
        assertThat(render("{{ missing | string.append 'x' }}", Map.of())).isEqualTo("x");
        assertThat(render("{{ missing | string.size }}", Map.of())).isEqualTo("0");
        assertThat(StringFunctions.upcase(null)).isNull();
        assertThat(StringFunctions.capitalize(null)).isEmpty();
    }

    @Test
    @DisplayName("参数个数不符时报错")
    void testArgumentCount() {
        Template template = Template.parse("{{ string.append 'a' }}");

        assertThatThrownBy(() -> template.render(Map.of()))
                .isInstanceOf(ScriptRuntimeException.class);
    }

    @Test
    @DisplayName("内置库不可重新赋值")
    void testLibraryIsReadOnly() {
        Template template = Template.parse("{{ string = 1 }}");

        assertThatThrownBy(() -> template.render(Map.of()))
                .isInstanceOf(ScriptRuntimeException.class)
                .hasMessageContaining("readonly");
    }
}
