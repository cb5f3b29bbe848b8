package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.exception.ScriptParserRuntimeException;
import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.exception.TemplateRecursionException;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TemplateLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("include 函数测试")
class IncludeFunctionTest {

    private final Map<String, String> templates = new HashMap<>();

    private final AtomicInteger loadCount = new AtomicInteger();

    private TemplateContext context;

    @BeforeEach
    void setUp() {
        context = new TemplateContext();
        context.setTemplateLoader(new TemplateLoader() {
            @Override
            public String getPath(TemplateContext ctx, SourceSpan callerSpan, String templateName) {
                return templates.containsKey(templateName) ? "/" + templateName : null;
            }

            @Override
            public String load(TemplateContext ctx, SourceSpan callerSpan, String templatePath) {
                loadCount.incrementAndGet();
                return templates.get(templatePath.substring(1));
            }
        });
        context.pushGlobal(ScriptObject.from(Map.of("user", "Ann")));
    }

    @Test
    @DisplayName("参数通过 $ 传入子模板")
    void testIncludeWithArguments() {
        templates.put("header", "Hi {{ $0 }}!");

        String result = Template.parse("{{ include 'header' 'Bob' }}").render(context);

        assertThat(result).isEqualTo("Hi Bob!");
    }

    @Test
    @DisplayName("子模板共享全局变量")
    void testIncludeSharesGlobals() {
        templates.put("footer", "by {{ user }}");

        String result = Template.parse("[{{ include 'footer' }}]").render(context);

        assertThat(result).isEqualTo("[by Ann]");
    }

    @Test
    @DisplayName("同一上下文中的子模板只加载一次")
    void testIncludeIsCached() {
        templates.put("item", "x");

        String result = Template.parse("{{ include 'item' }}{{ include 'item' }}").render(context);

        assertThat(result).isEqualTo("xx");
        assertThat(loadCount).hasValue(1);
    }

    @Test
    @DisplayName("找不到模板时报错")
    void testMissingTemplate() {
        Template template = Template.parse("{{ include 'nope' }}");

        assertThatThrownBy(() -> template.render(context))
                .isInstanceOf(ScriptRuntimeException.class)
                .hasMessageContaining("Include template path is null for `nope`");
    }

    @Test
    @DisplayName("没有注册加载器时报错")
    void testNoLoader() {
        TemplateContext bare = new TemplateContext();
        Template template = Template.parse("{{ include 'a' }}");

        assertThatThrownBy(() -> template.render(bare))
                .isInstanceOf(ScriptRuntimeException.class)
                .hasMessageContaining("No TemplateLoader registered");
    }

    @Test
    @DisplayName("子模板语法错误时报错")
    void testInvalidChildTemplate() {
        templates.put("broken", "{{ if x }}");
        Template template = Template.parse("{{ include 'broken' }}");

        assertThatThrownBy(() -> template.render(context)).isInstanceOf(ScriptParserRuntimeException.class);
    }

    @Test
    @DisplayName("自身递归 include 超过上限")
    void testRecursiveInclude() {
        templates.put("self", "{{ include 'self' }}");
        context.setRecursiveLimit(20);
        Template template = Template.parse("{{ include 'self' }}");

        assertThatThrownBy(() -> template.render(context)).isInstanceOf(TemplateRecursionException.class);
    }
}
