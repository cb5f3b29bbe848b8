package com.chih.TextScript.core.impl;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.runtime.PathType;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.spi.TemplateChangeEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * FileTemplateSource 单元测试
 */
@DisplayName("FileTemplateSource 测试")
class FileTemplateSourceTest {

    @TempDir
    Path tempDir;

    private FileTemplateSource source(boolean watch) {
        return new FileTemplateSource(tempDir, 100L, null, null, watch);
    }

    @Test
    @DisplayName("递归加载目录，key 为相对路径去掉扩展名")
    void testLoadDirectory() throws Exception {
        // Given
        Files.createDirectories(tempDir.resolve("mail"));
        Files.writeString(tempDir.resolve("index.tss"), "Hello {{ name }}");
        Files.writeString(tempDir.resolve("mail/welcome.liquid"), "{{ name | upcase }}");
        Files.writeString(tempDir.resolve("data.json"), "{}");
        Files.writeString(tempDir.resolve(".draft.tss"), "ignored");

        // When
        try (FileTemplateSource source = source(false)) {
            Map<String, String> all = source.loadAll();

            // Then
            assertThat(all).containsOnlyKeys("index", "mail/welcome");
            assertThat(source.load("index")).isEqualTo("Hello {{ name }}");
            assertThat(source.load("missing")).isNull();
            assertThat(source.getKeys()).containsExactlyInAnyOrder("index", "mail/welcome");
            assertThat(source.getLoadErrors()).isEmpty();
        }
    }

    @Test
    @DisplayName("目录不存在时来源为空")
    void testMissingDirectory() throws Exception {
        try (FileTemplateSource source = new FileTemplateSource(tempDir.resolve("nope"), 100L, null, null, false)) {
            assertThat(source.loadAll()).isEmpty();
        }
    }

    @Test
    @DisplayName("作为 include 加载器使用")
    void testAsTemplateLoader() throws Exception {
        Files.createDirectories(tempDir.resolve("partials"));
        Files.writeString(tempDir.resolve("partials/header.tss"), "<h1>{{ $0 }}</h1>");

        try (FileTemplateSource source = source(false)) {
            TemplateContext context = new TemplateContext();
            context.setTemplateLoader(source);

            String result = Template.parse("{{ include 'partials/header.tss' 'Title' }}").render(context);

            assertThat(result).isEqualTo("<h1>Title</h1>");
            assertThat(source.getPath(context, null, "/partials/header")).isEqualTo("partials/header");
            assertThat(source.getPath(context, null, "partials/footer")).isNull();
        }
    }

    @Test
    @DisplayName("路径查询与枚举")
    void testPathExistsAndEnumerate() throws Exception {
        Files.createDirectories(tempDir.resolve("a/b"));
        Files.writeString(tempDir.resolve("a/one.tss"), "1");
        Files.writeString(tempDir.resolve("a/two.txt"), "2");
        Files.writeString(tempDir.resolve("a/b/three.tss"), "3");

        try (FileTemplateSource source = source(false)) {
            TemplateContext context = new TemplateContext();

            assertThat(source.pathExists(context, null, "a/one", PathType.LEAF)).isTrue();
            assertThat(source.pathExists(context, null, "a", PathType.CONTAINER)).isTrue();
            assertThat(source.pathExists(context, null, "a", PathType.LEAF)).isFalse();
            assertThat(source.enumerate(context, null, "a", PathType.LEAF)).containsExactly("a/one", "a/two");
        }
    }

    @Test
    @DisplayName("UTF-8 BOM 被去掉")
    void testBom() throws Exception {
        Files.writeString(tempDir.resolve("bom.tss"), "﻿text");

        try (FileTemplateSource source = source(false)) {
            assertThat(source.load("bom")).isEqualTo("text");
        }
    }

    @Test
    @DisplayName("热更新：新增与删除文件后索引同步更新")
    void testHotReload() throws Exception {
        Files.writeString(tempDir.resolve("old.tss"), "old");

        try (FileTemplateSource source = source(true)) {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<TemplateChangeEvent> received = new AtomicReference<>();
            source.onChange(event -> {
                received.set(event);
                latch.countDown();
            });

            Files.writeString(tempDir.resolve("new.tss"), "new {{ x }}");
            Files.delete(tempDir.resolve("old.tss"));

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            // 两次变更可能分在不同的批次里，只检查最终索引
            Thread.sleep(500);
            assertThat(source.getKeys()).containsExactly("new");
            assertThat(source.load("new")).isEqualTo("new {{ x }}");
            assertThat(received.get()).isNotNull();
        }
    }
}
