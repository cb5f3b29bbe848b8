package com.chih.TextScript.spring;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.runtime.TemplateContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * SpringResourceTemplateSource 单元测试
 */
@DisplayName("SpringResourceTemplateSource 测试")
class SpringResourceTemplateSourceTest {

    @TempDir
    Path tempDir;

    private SpringResourceTemplateSource source(List<String> locations) {
        return new SpringResourceTemplateSource(locations, 100L, null, null, false);
    }

    @Test
    @DisplayName("从 classpath 目录加载模板")
    void testClasspathLocation() throws Exception {
        try (SpringResourceTemplateSource source = source(List.of("classpath:templates"))) {
            // When
            Map<String, String> all = source.loadAll();

            // Then
            assertThat(all).containsOnlyKeys("greeting", "welcome", "partials/footer");
            assertThat(source.load("greeting")).startsWith("Hello {{ name }}!");
            assertThat(source.getLocations()).containsExactly("classpath:templates");
        }
    }

    @Test
    @DisplayName("从 file: 目录加载模板")
    void testFileLocation() throws Exception {
        // Given
        Files.createDirectories(tempDir.resolve("mail"));
        Files.writeString(tempDir.resolve("mail/notice.tss"), "Notice: {{ text }}");
        Files.writeString(tempDir.resolve("readme.md"), "not a template");

        // When
        try (SpringResourceTemplateSource source = source(List.of(tempDir.toUri().toString()))) {

            // Then
            assertThat(source.getKeys()).containsExactly("mail/notice");
            assertThat(source.load("mail/notice")).isEqualTo("Notice: {{ text }}");
        }
    }

    @Test
    @DisplayName("不存在的位置被忽略")
    void testMissingLocation() throws Exception {
        try (SpringResourceTemplateSource source = source(List.of("classpath:no-such-dir/", ""))) {
            assertThat(source.loadAll()).isEmpty();
            assertThat(source.getLoadErrors()).isEmpty();
        }
    }

    @Test
    @DisplayName("嵌套的根目录按最长匹配计算 key")
    void testLongestRootWins() throws Exception {
        // Given
        Path inner = Files.createDirectories(tempDir.resolve("shared"));
        Files.writeString(inner.resolve("box.tss"), "box");
        Files.writeString(tempDir.resolve("top.tss"), "top");

        // When
        List<String> locations = List.of(inner.toUri().toString(), tempDir.toUri().toString());
        try (SpringResourceTemplateSource source = source(locations)) {

            // Then
            assertThat(source.getKeys()).containsExactlyInAnyOrder("box", "top");
        }
    }

    @Test
    @DisplayName("作为 include 加载器使用")
    void testIncludeThroughSource() throws Exception {
        try (SpringResourceTemplateSource source = source(List.of("classpath:templates/"))) {
            TemplateContext context = new TemplateContext();
            context.setTemplateLoader(source);

            String result = Template.parse("[{{ include 'partials/footer.tss' }}]").render(context);

            assertThat(result).isEqualTo("[\n-- TextScript]");
        }
    }
}
