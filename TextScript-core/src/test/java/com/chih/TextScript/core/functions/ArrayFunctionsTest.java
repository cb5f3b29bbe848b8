package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.Template;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("array 函数测试")
class ArrayFunctionsTest {

    private static final Map<String, Object> MODEL = Map.of("items", List.of("a", "b", "c"));

    private static String render(String text) {
        return Template.parse(text).render(MODEL);
    }

    @Test
    @DisplayName("first / last / size")
    void testAccessors() {
        assertThat(render("{{ items | array.first }}")).isEqualTo("a");
        assertThat(render("{{ items | array.last }}")).isEqualTo("c");
        assertThat(render("{{ items | array.size }}")).isEqualTo("3");
        assertThat(render("{{ [] | array.first }}")).isEmpty();
    }

    @Test
    @DisplayName("join 与 reverse")
    void testJoinAndReverse() {
        assertThat(render("{{ items | array.join '-' }}")).isEqualTo("a-b-c");
        assertThat(render("{{ items | array.reverse | array.join '' }}")).isEqualTo("cba");
    }

    @Test
    @DisplayName("add 返回新列表且不修改原列表")
    void testAdd() {
        assertThat(render("{{ x = items | array.add 'd' }}{{ x | array.size }}/{{ items | array.size }}"))
                .isEqualTo("4/3");
    }

    @Test
    @DisplayName("cycle 按分组轮换")
    void testCycle() {
        String text = "{{ for i in 1..3 }}{{ array.cycle ['x', 'y'] }}{{ array.cycle ['1', '2'] group: 'g' }}{{ end }}";

        assertThat(render(text)).isEqualTo("x1y2x1");
    }

    @Test
    @DisplayName("直接调用静态方法")
    void testStaticHelpers() {
        assertThat(ArrayFunctions.first(null)).isNull();
        assertThat(ArrayFunctions.reverse(List.of(1, 2, 3))).containsExactly(3, 2, 1);
        assertThat(ArrayFunctions.add(List.of(1), 2)).containsExactly(1, 2);
    }
}
