package com.chih.TextScript.core;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.LiquidTemplateContext;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TemplateLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Liquid 模板测试")
class LiquidTemplateTest {

    private static String render(String text, Map<String, Object> model) {
        Template template = Template.parseLiquid(text);
        assertThat(template.hasErrors()).as("%s", template.getMessages()).isFalse();
        return template.render(model);
    }

    private static String render(String text) {
        return render(text, Map.of());
    }

    @Test
    @DisplayName("assign 与 if / else")
    void testAssignAndIf() {
        assertThat(render("{% assign x = 5 %}{% if x > 3 %}big{% else %}small{% endif %}")).isEqualTo("big");
        assertThat(render("{% if x == 1 %}one{% elsif x == 2 %}two{% endif %}", Map.of("x", 2))).isEqualTo("two");
    }

    @Test
    @DisplayName("unless")
    void testUnless() {
        assertThat(render("{% unless x %}no{% endunless %}", Map.of("x", false))).isEqualTo("no");
        assertThat(render("{% unless x %}no{% endunless %}", Map.of("x", true))).isEmpty();
    }

    @Test
    @DisplayName("for 循环与 forloop 变量")
    void testFor() {
        assertThat(render("{% for i in (1..3) %}{{ i }}{% endfor %}")).isEqualTo("123");
        assertThat(render("{% for x in items %}{{ forloop.index }}{% endfor %}", Map.of("items", List.of("a", "b", "c"))))
                .isEqualTo("123");
        assertThat(render("{% for x in items %}{{ x }}{% unless forloop.last %}, {% endunless %}{% endfor %}",
                Map.of("items", List.of("a", "b", "c")))).isEqualTo("a, b, c");
    }

    @Test
    @DisplayName("for 循环的 limit 与 reversed")
    void testForOptions() {
        assertThat(render("{% for i in (1..5) limit:2 %}{{ i }}{% endfor %}")).isEqualTo("12");
        assertThat(render("{% for i in (1..3) reversed %}{{ i }}{% endfor %}")).isEqualTo("321");
    }

    @Test
    @DisplayName("case / when 支持 or")
    void testCase() {
        String text = "{% case x %}{% when 1 %}one{% when 2 or 3 %}few{% else %}many{% endcase %}";

        assertThat(render(text, Map.of("x", 2))).isEqualTo("few");
        assertThat(render(text, Map.of("x", 7))).isEqualTo("many");
    }

    @Test
    @DisplayName("过滤器链")
    void testFilters() {
        assertThat(render("{{ \"hello\" | upcase | append: \"!\" }}")).isEqualTo("HELLO!");
        assertThat(render("{{ name | capitalize }}", Map.of("name", "bob"))).isEqualTo("Bob");
        assertThat(render("{{ items | join: \", \" }}", Map.of("items", List.of(1, 2)))).isEqualTo("1, 2");
        assertThat(render("{{ items | first }}-{{ items | last }}", Map.of("items", List.of("a", "b")))).isEqualTo("a-b");
    }

    @Test
    @DisplayName("divided_by 除数为整数时向下取整")
    void testDividedBy() {
        assertThat(render("{{ 10 | divided_by: 3 }}")).isEqualTo("3");
        assertThat(render("{{ 10 | divided_by: 4.0 }}")).isEqualTo("2.5");
    }

    @Test
    @DisplayName("capture")
    void testCapture() {
        assertThat(render("{% capture c %}hi{% endcapture %}{{ c | upcase }}")).isEqualTo("HI");
    }

    @Test
    @DisplayName("increment 与 decrement")
    void testIncrement() {
        assertThat(render("{% assign c = 1 %}{% increment c %}{% increment c %}{% decrement c %}{{ c }}"))
                .isEqualTo("2");
    }

    @Test
    @DisplayName("未赋值的计数器从 0 开始计数")
    void testIncrementFreshCounter() {
        assertThat(render("{% increment c %}{% increment c %}{{ c }}")).isEqualTo("2");
        assertThat(render("{% decrement c %}{% decrement c %}{{ c }}")).isEqualTo("-2");
        assertThat(render("{% increment c %}{% decrement d %}{{ c }}/{{ d }}")).isEqualTo("1/-1");
    }

    @Test
    @DisplayName("contains 运算符")
    void testContains() {
        assertThat(render("{% if title contains 'World' %}yes{% endif %}", Map.of("title", "Hello World")))
                .isEqualTo("yes");
    }

    @Test
    @DisplayName("Liquid 专用运算符写回原生语法后求值结果不变")
    void testLiquidOperatorsToNativeText() {
        // Given
        String text = "{% if title contains 'World' %}a{% endif %}"
                + "{% if title startsWith 'Hello' %}b{% endif %}"
                + "{% if title endsWith 'x' %}c{% endif %}"
                + "{% if page hasKey 'id' %}d{% endif %}"
                + "{% if page hasValue 'name' %}e{% endif %}";
        Map<String, Object> model = Map.of("title", "Hello World", "page", Map.of("id", 1));

        // When
        String nativeText = Template.parseLiquid(text).toText();
        Template reparsed = Template.parse(nativeText);

        // Then
        assertThat(nativeText).contains("string.contains", "string.starts_with", "string.ends_with",
                "object.has_key", "object.has_value");
        assertThat(reparsed.hasErrors()).as("%s", reparsed.getMessages()).isFalse();
        assertThat(reparsed.render(model)).isEqualTo(render(text, model)).isEqualTo("abd");
    }

    @Test
    @DisplayName("raw 与 comment")
    void testRawAndComment() {
        assertThat(render("{% raw %}{{ x }}{% endraw %}")).isEqualTo("{{ x }}");
        assertThat(render("a{% comment %}hidden {{ x }}{% endcomment %}b")).isEqualTo("ab");
    }

    @Test
    @DisplayName("cycle 依次输出")
    void testCycle() {
        assertThat(render("{% for i in (1..4) %}{% cycle 'odd', 'even' %}{% endfor %}"))
                .isEqualTo("oddevenoddeven");
    }

    @Test
    @DisplayName("tablerow 按列输出表格行")
    void testTableRow() {
        String result = render("{% tablerow x in (1..3) cols:2 %}{{ x }}{% endtablerow %}");

        assertThat(result).isEqualTo("<tr class=\"row1\"><td class=\"col1\">1</td><td class=\"col2\">2</td></tr>\n"
                + "<tr class=\"row2\"><td class=\"col1\">3</td></tr>\n");
    }

    @Test
    @DisplayName("include 传入变量")
    void testInclude() {
        // Given
        Map<String, String> templates = Map.of("greet", "Hi {{ name }}!");
        Template template = Template.parseLiquid("{% include 'greet' name: 'Bob' %}");
        TemplateContext context = new LiquidTemplateContext();
        context.setTemplateLoader(new TemplateLoader() {
            @Override
            public String getPath(TemplateContext ctx, SourceSpan callerSpan, String templateName) {
                return templates.containsKey(templateName) ? templateName : null;
            }

            @Override
            public String load(TemplateContext ctx, SourceSpan callerSpan, String templatePath) {
                return templates.get(templatePath);
            }
        });
        context.pushGlobal(new ScriptObject());

        // When
        String result = template.render(context);

        // Then
        assertThat(result).isEqualTo("Hi Bob!");
    }

    @Test
    @DisplayName("缺少 endfor 时报告解析错误")
    void testMissingEndTag() {
        Template template = Template.parseLiquid("{% for x in items %}{{ x }}");

        assertThat(template.hasErrors()).isTrue();
        assertThat(template.getMessages()).isNotEmpty();
    }
}
