package com.chih.TextScript.core;

import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.exception.TemplateParseException;
import com.chih.TextScript.core.exception.TemplateRecursionException;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * 原生语法的渲染测试
 */
@DisplayName("Template 渲染测试")
class TemplateTest {

    public record Customer(String name, int age) {
    }

    public static class Order {
        private final String id;
        private final boolean paid;

        public Order(String id, boolean paid) {
            this.id = id;
            this.paid = paid;
        }

        public String getId() {
            return id;
        }

        public boolean isPaid() {
            return paid;
        }
    }

    private static String render(String text, Map<String, Object> model) {
        Template template = Template.parse(text);
        assertThat(template.hasErrors()).as("%s", template.getMessages()).isFalse();
        return template.render(model);
    }

    private static String render(String text) {
        return render(text, Map.of());
    }

    @Nested
    @DisplayName("表达式")
    class Expressions {

        @Test
        @DisplayName("变量与纯文本")
        void testVariable() {
            assertThat(render("Hello {{ name }}!", Map.of("name", "World"))).isEqualTo("Hello World!");
        }

        @Test
        @DisplayName("算术运算与优先级")
        void testArithmetic() {
            assertThat(render("{{ 1 + 2 * 3 }}")).isEqualTo("7");
            assertThat(render("{{ (1 + 2) * 3 }}")).isEqualTo("9");
            assertThat(render("{{ 10 - 3 - 2 }}")).isEqualTo("5");
            assertThat(render("{{ -1 + 2 }}")).isEqualTo("1");
        }

        @Test
        @DisplayName("除法：/ 得到浮点数，// 整除")
        void testDivision() {
            assertThat(render("{{ 5 / 2 }}")).isEqualTo("2.5");
            assertThat(render("{{ 4 / 2 }}")).isEqualTo("2");
            assertThat(render("{{ 7 // 2 }}")).isEqualTo("3");
            assertThat(render("{{ 7 % 3 }}")).isEqualTo("1");
        }

        @Test
        @DisplayName("整除零抛出运行时异常")
        void testDivideByZero() {
            Template template = Template.parse("{{ 1 // 0 }}");

            assertThatThrownBy(() -> template.render(Map.of()))
                    .isInstanceOf(ScriptRuntimeException.class);
        }

        @Test
        @DisplayName("字符串拼接、比较与重复")
        void testStrings() {
            assertThat(render("{{ 'a' + 1 }}")).isEqualTo("a1");
            assertThat(render("{{ 'ab' * 2 }}")).isEqualTo("abab");
            assertThat(render("{{ 'a' < 'b' }}")).isEqualTo("true");
            assertThat(render("{{ \"tab\\tend\" }}")).isEqualTo("tab\tend");
            assertThat(render("{{ 'it\\'s' }}")).isEqualTo("it's");
        }

        @Test
        @DisplayName("布尔运算与取反")
        void testBoolean() {
            assertThat(render("{{ true && false }}")).isEqualTo("false");
            assertThat(render("{{ true || false }}")).isEqualTo("true");
            assertThat(render("{{ !true }}")).isEqualTo("false");
            assertThat(render("{{ 1 < 2 && 3 >= 3 }}")).isEqualTo("true");
        }

        @Test
        @DisplayName("null 合并")
        void testNullCoalescing() {
            assertThat(render("{{ missing ?? 'default' }}")).isEqualTo("default");
            assertThat(render("{{ name ?? 'default' }}", Map.of("name", "set"))).isEqualTo("set");
        }

        @Test
        @DisplayName("empty 比较")
        void testEmpty() {
            assertThat(render("{{ if items == empty }}none{{ end }}", Map.of("items", List.of()))).isEqualTo("none");
            assertThat(render("{{ if items != empty }}some{{ end }}", Map.of("items", List.of(1)))).isEqualTo("some");
            assertThat(render("{{ '' == empty }}")).isEqualTo("true");
        }

        @Test
        @DisplayName("数组与对象初始化")
        void testInitializers() {
            assertThat(render("{{ [1, 2] << 3 }}")).isEqualTo("[1, 2, 3]");
            assertThat(render("{{ o = { name: 'x', n: 2 } }}{{ o.name }}{{ o.n }}")).isEqualTo("x2");
            assertThat(render("{{ items[1] }}", Map.of("items", List.of(1, 2, 3)))).isEqualTo("2");
            assertThat(render("{{ items.size }}", Map.of("items", List.of(1, 2, 3)))).isEqualTo("3");
        }

        @Test
        @DisplayName("赋值语句不输出")
        void testAssignmentHasNoOutput() {
            assertThat(render("{{ x = 5 }}[{{ x }}]")).isEqualTo("[5]");
        }

        @Test
        @DisplayName("注释")
        void testComments() {
            assertThat(render("{{ 1 # comment }}")).isEqualTo("1");
        }
    }

    @Nested
    @DisplayName("语句")
    class Statements {

        @Test
        @DisplayName("if / else if / else")
        void testIf() {
            String text = "{{ if n > 1 }}many{{ else if n == 1 }}one{{ else }}none{{ end }}";

            assertThat(render(text, Map.of("n", 5))).isEqualTo("many");
            assertThat(render(text, Map.of("n", 1))).isEqualTo("one");
            assertThat(render(text, Map.of("n", 0))).isEqualTo("none");
        }

        @Test
        @DisplayName("只有 null、empty 与 false 为假")
        void testTruthiness() {
            assertThat(render("{{ if 0 }}yes{{ end }}")).isEqualTo("yes");
            assertThat(render("{{ if '' }}yes{{ end }}")).isEqualTo("yes");
            assertThat(render("{{ if missing }}yes{{ else }}no{{ end }}")).isEqualTo("no");
        }

        @Test
        @DisplayName("case / when")
        void testCase() {
            String text = "{{ case x }}{{ when 1 }}one{{ when 2, 3 }}few{{ else }}many{{ end }}";

            assertThat(render(text, Map.of("x", 1))).isEqualTo("one");
            assertThat(render(text, Map.of("x", 3))).isEqualTo("few");
            assertThat(render(text, Map.of("x", 9))).isEqualTo("many");
        }

        @Test
        @DisplayName("for 循环与循环变量")
        void testFor() {
            String text = "{{ for x in items }}{{ for.index }}{{ x }}{{ if !for.last }},{{ end }}{{ end }}";

            assertThat(render(text, Map.of("items", List.of("a", "b", "c")))).isEqualTo("0a,1b,2c");
        }

        @Test
        @DisplayName("for 循环遍历区间并支持 offset 与 limit")
        void testForRangeWithOptions() {
            assertThat(render("{{ for x in 1..3 }}{{ x }}{{ end }}")).isEqualTo("123");
            assertThat(render("{{ for x in 1..<3 }}{{ x }}{{ end }}")).isEqualTo("12");
            assertThat(render("{{ for x in 1..10 offset:2 limit:3 }}{{ x }}{{ end }}")).isEqualTo("345");
        }

        @Test
        @DisplayName("break 与 continue")
        void testBreakAndContinue() {
            String text = "{{ for x in 1..5 }}{{ if x == 2 }}{{ continue }}{{ end }}"
                    + "{{ if x == 4 }}{{ break }}{{ end }}{{ x }}{{ end }}";

            assertThat(render(text)).isEqualTo("13");
        }

        @Test
        @DisplayName("while 循环")
        void testWhile() {
            assertThat(render("{{ i = 0 }}{{ while i < 3 }}{{ i = i + 1 }}{{ i }}{{ end }}")).isEqualTo("123");
        }

        @Test
        @DisplayName("capture 把输出保存到变量")
        void testCapture() {
            String text = "{{ capture greeting }}Hello {{ name }}{{ end }}{{ greeting | string.upcase }}";

            assertThat(render(text, Map.of("name", "bob"))).isEqualTo("HELLO BOB");
        }

        @Test
        @DisplayName("with 以对象作为作用域")
        void testWith() {
            String text = "{{ user = { name: 'Ann', age: 7 } }}{{ with user }}{{ age = age + 1 }}{{ end }}"
                    + "{{ user.name }}-{{ user.age }}";

            assertThat(render(text)).isEqualTo("Ann-8");
        }

        @Test
        @DisplayName("自定义函数与参数")
        void testFunction() {
            assertThat(render("{{ func add; ret $0 + $1; end }}{{ add 1 2 }}")).isEqualTo("3");
            assertThat(render("{{ func hello; ret 'hi ' + $0; end }}{{ 'bob' | hello }}")).isEqualTo("hi bob");
        }

        @Test
        @DisplayName("命名参数写入参数数组的同名成员")
        void testNamedArguments() {
            assertThat(render("{{ func f; ret $.x; end }}{{ f x: 3 }}")).isEqualTo("3");
            assertThat(render("{{ func f; ret $0 + '-' + $.x; end }}{{ f 1 x: 2 }}")).isEqualTo("1-2");
        }

        @Test
        @DisplayName("重复的命名参数以最后一个为准")
        void testRepeatedNamedArgument() {
            assertThat(render("{{ func f; ret $.a; end }}{{ f a: 1 a: 2 }}")).isEqualTo("2");
        }

        @Test
        @DisplayName("保留名 size 作为位置参数传入")
        void testReservedNamedArgument() {
            assertThat(render("{{ func f; ret $0 + '/' + $.size; end }}{{ f size: 5 }}")).isEqualTo("5/1");
        }

        @Test
        @DisplayName("wrap 把语句块传给函数")
        void testWrap() {
            String text = "{{ func bold; '<b>'; $$; '</b>'; end }}{{ wrap bold }}text{{ end }}";

            assertThat(render(text)).isEqualTo("<b>text</b>");
        }

        @Test
        @DisplayName("readonly 变量不能再赋值")
        void testReadOnly() {
            Template template = Template.parse("{{ x = 1; readonly x; x = 2 }}");

            assertThatThrownBy(() -> template.render(Map.of()))
                    .isInstanceOf(ScriptRuntimeException.class)
                    .hasMessageContaining("readonly");
        }

        @Test
        @DisplayName("转义块原样输出")
        void testEscapeBlock() {
            assertThat(render("{%{ {{ x }} }%}")).isEqualTo(" {{ x }} ");
        }

        @Test
        @DisplayName("多层转义块可以包含更少层数的转义块")
        void testNestedEscapeBlock() {
            assertThat(render("{%%{ a {%{ b }%} c }%%}")).isEqualTo(" a {%{ b }%} c ");
            assertThat(render("x{%%%{{{ y }}}%%%}z")).isEqualTo("x{{ y }}z");
        }

        @Test
        @DisplayName("空白控制")
        void testWhitespaceControl() {
            assertThat(render("a {{~ 1 ~}} b")).isEqualTo("a1b");
            assertThat(render("line1\n  {{- 'X' -}}  \nline2")).isEqualTo("line1Xline2");
            assertThat(render("a\n{{~ 'X' }}")).isEqualTo("a\nX");
        }
    }

    @Nested
    @DisplayName("宿主对象")
    class HostObjects {

        @Test
        @DisplayName("record 组件作为成员")
        void testRecordModel() {
            Template template = Template.parse("{{ name }} is {{ age }}");

            assertThat(template.render(new Customer("Bob", 30))).isEqualTo("Bob is 30");
        }

        @Test
        @DisplayName("JavaBean getter 作为成员")
        void testBeanMembers() {
            String text = "{{ order.id }}:{{ order.paid }}";

            assertThat(render(text, Map.of("order", new Order("A-1", true)))).isEqualTo("A-1:true");
        }

        @Test
        @DisplayName("宽松模式下访问 null 的成员得到 null")
        void testRelaxedMemberAccess() {
            assertThat(render("[{{ nothing.a.b }}]")).isEqualTo("[]");
        }

        @Test
        @DisplayName("关闭宽松模式后访问 null 的成员抛出异常")
        void testStrictMemberAccess() {
            Template template = Template.parse("{{ nothing.a }}");
            TemplateContext context = new TemplateContext();
            context.setEnableRelaxedMemberAccess(false);

            assertThatThrownBy(() -> template.render(context)).isInstanceOf(ScriptRuntimeException.class);
        }

        @Test
        @DisplayName("严格变量模式下读取未定义变量抛出异常")
        void testStrictVariables() {
            Template template = Template.parse("{{ y }}");
            TemplateContext context = new TemplateContext();
            context.setStrictVariables(true);

            assertThatThrownBy(() -> template.render(context))
                    .isInstanceOf(ScriptRuntimeException.class)
                    .hasMessageContaining("`y` was not found");
        }

        @Test
        @DisplayName("宿主注册的全局对象")
        void testPushGlobal() {
            TemplateContext context = new TemplateContext();
            ScriptObject globals = new ScriptObject();
            globals.setValue("site", ScriptObject.from(Map.of("title", "Home")), true);
            context.pushGlobal(globals);

            assertThat(Template.parse("{{ site.title }}").render(context)).isEqualTo("Home");
        }
    }

    @Nested
    @DisplayName("限制与错误")
    class Limits {

        @Test
        @DisplayName("循环次数上限")
        void testLoopLimit() {
            Template template = Template.parse("{{ for x in 1..10 }}{{ x }}{{ end }}");
            TemplateContext context = new TemplateContext();
            context.setLoopLimit(3);

            assertThatThrownBy(() -> template.render(context))
                    .isInstanceOf(ScriptRuntimeException.class)
                    .hasMessageContaining("iteration limit `3`");
        }

        @Test
        @DisplayName("递归深度上限")
        void testRecursiveLimit() {
            Template template = Template.parse("{{ func f; f; end; f }}");
            TemplateContext context = new TemplateContext();
            context.setRecursiveLimit(10);

            assertThatThrownBy(() -> template.render(context)).isInstanceOf(TemplateRecursionException.class);
        }

        @Test
        @DisplayName("存在解析错误时渲染抛出 TemplateParseException")
        void testRenderWithParseErrors() {
            Template template = Template.parse("{{ if x }}");

            assertThat(template.hasErrors()).isTrue();
            assertThatThrownBy(() -> template.render(Map.of()))
                    .isInstanceOf(TemplateParseException.class)
                    .satisfies(e -> assertThat(((TemplateParseException) e).getMessages()).isNotEmpty());
        }

        @Test
        @DisplayName("空模板渲染为空字符串")
        void testEmptyTemplate() {
            assertThat(Template.parse("").render(Map.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("语言语义")
    class Semantics {

        @Test
        @DisplayName("区间可以递减")
        void testDescendingRange() {
            assertThat(render("{{ for x in 5..1 }}{{ x }}{{ end }}")).isEqualTo("54321");
            assertThat(render("{{ for x in 3..<1 }}{{ x }}{{ end }}")).isEqualTo("32");
        }

        @Test
        @DisplayName("字符串重复与操作数顺序无关")
        void testStringRepeat() {
            assertThat(render("{{ 3 * 'ab' }}|{{ 'ab' * 3 }}")).isEqualTo("ababab|ababab");
        }

        @Test
        @DisplayName("负数下标从末尾计数")
        void testNegativeIndex() {
            Map<String, Object> model = Map.of("items", List.of(4, 5, 6, 7, 8));

            assertThat(render("{{ items[-1] }}", model)).isEqualTo("8");
            assertThat(render("[{{ items[-9] }}]", model)).isEqualTo("[]");
        }

        @Test
        @DisplayName("负数下标写入")
        void testNegativeIndexAssign() {
            assertThat(render("{{ x = [1, 2]; x[-1] = 5; x[1] }}")).isEqualTo("5");
        }

        @Test
        @DisplayName("负数下标越过列表开头时写入报错")
        void testNegativeIndexAssignOutOfRange() {
            Template template = Template.parse("{{ x = [1]; x[-3] = 5 }}");

            assertThatThrownBy(() -> template.render(Map.of()))
                    .isInstanceOf(ScriptRuntimeException.class)
                    .hasMessageContaining("out of bounds");
        }

        @Test
        @DisplayName("null 参与算术运算结果为 null")
        void testNullArithmetic() {
            assertThat(Template.evaluate("null + 5", (Object) null)).isNull();
            assertThat(Template.evaluate("null == null", (Object) null)).isEqualTo(true);
            assertThat(Template.evaluate("null < 1", (Object) null)).isEqualTo(false);
        }

        @Test
        @DisplayName("case 匹配第一个相等的 when")
        void testCaseFirstMatch() {
            String text = "{{ case 2 }}{{ when 1 }}a{{ when 2 }}b{{ else }}c{{ end }}";

            assertThat(render(text)).isEqualTo("b");
        }

        @Test
        @DisplayName("循环元数据 first / last / rindex / changed")
        void testLoopMetadata() {
            String text = "{{ for x in items }}{{ for.first }}-{{ for.last }}-{{ for.rindex }}-{{ for.changed }};{{ end }}";

            String result = render(text, Map.of("items", List.of(10, 10, 30)));

            assertThat(result).isEqualTo("true-false-2-true;false-false-1-false;false-true-0-true;");
        }

        @Test
        @DisplayName("不支持的操作数类型抛出异常")
        void testUnsupportedOperands() {
            Template template = Template.parse("{{ true * 'x' }}{{ [1] - 1 }}");

            assertThatThrownBy(() -> template.render(Map.of()))
                    .isInstanceOf(ScriptRuntimeException.class);
        }
    }

    @Nested
    @DisplayName("表达式求值")
    class Evaluate {

        @Test
        @DisplayName("以纯脚本模式求值")
        void testEvaluateExpression() {
            assertThat(Template.evaluate("1 + 2 * 3", (Object) null)).isEqualTo(7);
            assertThat(Template.evaluate("x * 2", Map.of("x", 21))).isEqualTo(42);
            assertThat(Template.evaluate("5 / 2", (Object) null)).isEqualTo(2.5);
        }

        @Test
        @DisplayName("求值返回最后一个语句的值且不产生输出")
        void testEvaluateReturnsLastValue() {
            Object result = Template.evaluate("a = 1; b = a + 1; b * 10", (Object) null);

            assertThat(result).isEqualTo(20);
        }
    }
}
