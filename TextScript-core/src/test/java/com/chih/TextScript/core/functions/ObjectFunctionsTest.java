package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.exception.ScriptRuntimeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("object 函数测试")
class ObjectFunctionsTest {

    private static String render(String text, Map<String, Object> model) {
        return Template.parse(text).render(model);
    }

    @Test
    @DisplayName("has_key 判断键是否存在")
    void testHasKey() {
        Map<String, Object> page = new HashMap<>();
        page.put("id", 1);
        page.put("title", null);

        assertThat(render("{{ page | object.has_key 'id' }}", Map.of("page", page))).isEqualTo("true");
        assertThat(render("{{ page | object.has_key 'title' }}", Map.of("page", page))).isEqualTo("true");
        assertThat(render("{{ object.has_key {a: 1} 'b' }}", Map.of())).isEqualTo("false");
    }

    @Test
    @DisplayName("has_value 要求键对应的值不为 null")
    void testHasValue() {
        Map<String, Object> page = new HashMap<>();
        page.put("id", 1);
        page.put("title", null);

        assertThat(render("{{ page | object.has_value 'id' }}", Map.of("page", page))).isEqualTo("true");
        assertThat(render("{{ page | object.has_value 'title' }}", Map.of("page", page))).isEqualTo("false");
    }

    @Test
    @DisplayName("非对象参数报错")
    void testNotAnObject() {
        Template template = Template.parse("{{ object.has_key 'text' 'a' }}");

        assertThatThrownBy(() -> template.render(Map.of()))
                .isInstanceOf(ScriptRuntimeException.class)
                .hasMessageContaining("hasKey");
    }
}
