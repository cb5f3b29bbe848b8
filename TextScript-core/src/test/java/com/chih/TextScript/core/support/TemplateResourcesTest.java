package com.chih.TextScript.core.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TemplateResources 测试")
class TemplateResourcesTest {

    @Test
    @DisplayName("支持的模板扩展名")
    void testIsSupportedFile() {
        assertThat(TemplateResources.isSupportedFile("mail/welcome.tss")).isTrue();
        assertThat(TemplateResources.isSupportedFile("page.LIQUID")).isTrue();
        assertThat(TemplateResources.isSupportedFile("notes.txt")).isTrue();
        assertThat(TemplateResources.isSupportedFile("data.json")).isFalse();
        assertThat(TemplateResources.isSupportedFile("dir/.hidden.tss")).isFalse();
        assertThat(TemplateResources.isSupportedFile("backup.tss~")).isFalse();
        assertThat(TemplateResources.isSupportedFile(null)).isFalse();
    }

    @Test
    @DisplayName("由相对路径生成 key")
    void testToKey() {
        assertThat(TemplateResources.toKey("mail/welcome.tss")).isEqualTo("mail/welcome");
        assertThat(TemplateResources.toKey("\\mail\\welcome.liquid")).isEqualTo("mail/welcome");
        assertThat(TemplateResources.toKey("/a.b.txt")).isEqualTo("a.b");
        assertThat(TemplateResources.stripExtension("readme.md")).isEqualTo("readme.md");
    }

    @Test
    @DisplayName("读取文本时去掉 BOM")
    void testReadText() throws IOException {
        byte[] bytes = "﻿Hello 世界".getBytes(StandardCharsets.UTF_8);

        String text = TemplateResources.readText(new ByteArrayInputStream(bytes));

        assertThat(text).isEqualTo("Hello 世界");
    }
}
