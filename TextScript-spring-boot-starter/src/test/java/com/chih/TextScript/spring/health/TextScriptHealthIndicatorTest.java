package com.chih.TextScript.spring.health;

import com.chih.TextScript.core.engine.TemplateManager;
import com.chih.TextScript.core.spi.AbstractIndexBasedTemplateSource;
import com.chih.TextScript.core.spi.TemplateSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("TextScriptHealthIndicator 测试")
class TextScriptHealthIndicatorTest {

    @Test
    @DisplayName("没有加载错误时为 UP")
    void testUp() {
        TemplateManager manager = mock(TemplateManager.class);
        when(manager.getCacheSize()).thenReturn(2L);

        Health health = new TextScriptHealthIndicator(manager, mock(TemplateSource.class)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("cachedTemplates", 2L)
                .containsEntry("message", "All templates loaded successfully.");
    }

    @Test
    @DisplayName("存在加载错误时为 DOWN 并列出错误")
    void testDown() {
        // Given
        TemplateManager manager = mock(TemplateManager.class);
        AbstractIndexBasedTemplateSource<?> source = mock(AbstractIndexBasedTemplateSource.class);
        when(source.getLoadErrors()).thenReturn(Map.of("/templates/bad.tss", new IOException("permission denied")));

        // When
        Health health = new TextScriptHealthIndicator(manager, source).health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
                .containsEntry("errorCount", 1)
                .containsEntry("errors", Map.of("/templates/bad.tss", "permission denied"));
    }
}
