package com.chih.TextScript.core.engine;

import com.chih.TextScript.core.exception.TemplateNotFoundException;
import com.chih.TextScript.core.exception.TemplateParseException;
import com.chih.TextScript.core.impl.TextScriptTemplateEngine;
import com.chih.TextScript.core.spi.TemplateChangeEvent;
import com.chih.TextScript.core.spi.TemplateMetrics;
import com.chih.TextScript.core.spi.TemplateSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * TemplateManager 核心功能测试
 *
 * 测试覆盖：
 * - 初始化编译与渲染
 * - 缓存未命中时回源
 * - 热更新与依赖传播
 * - 错误处理与指标
 */
@ExtendWith(MockitoExtension.class)
class TemplateManagerTest {

    @Mock
    private TemplateSource mockSource;

    @Mock
    private TemplateMetrics mockMetrics;

    private final Map<String, String> templates = new HashMap<>();

    private TemplateManager manager;

    private Consumer<TemplateChangeEvent> listener;

    @BeforeEach
    void setUp() {
        templates.put("header", "<{{ title }}>");
        templates.put("page", "{{ include 'header' }} body");
        templates.put("site", "[{{ include 'page' }}]");
        templates.put("plain", "Hello {{ name }}!");
    }

    @SuppressWarnings("unchecked")
    private void createManager() {
        when(mockSource.loadAll()).thenReturn(new HashMap<>(templates));
        manager = new TemplateManager(mockSource, new TextScriptTemplateEngine(), mockMetrics);

        ArgumentCaptor<Consumer<TemplateChangeEvent>> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(mockSource).onChange(captor.capture());
        listener = captor.getValue();
    }

    @Test
    void testBasicRender() {
        // Given
        createManager();

        // When
        String result = manager.render("plain", Map.of("name", "World"));

        // Then
        assertThat(result).isEqualTo("Hello World!");
        assertThat(manager.getCachedKeys()).containsExactlyInAnyOrder("header", "page", "site", "plain");
        verify(mockMetrics).recordRender(eq("plain"), anyLong(), eq(true));
    }

    @Test
    void testRenderWithInclude() {
        // Given
        createManager();
        when(mockSource.load("header")).thenReturn(templates.get("header"));
        when(mockSource.load("page")).thenReturn(templates.get("page"));

        // When
        String result = manager.render("site", Map.of("title", "T"));

        // Then
        assertThat(result).isEqualTo("[<T> body]");
    }

    @Test
    void testDependencyGraph() {
        createManager();

        assertThat(manager.getDependencies("page")).containsExactly("header");
        assertThat(manager.getDependents("header")).containsExactlyInAnyOrder("page", "site");
        assertThat(manager.getDependents("site")).isEmpty();
    }

    @Test
    void testRenderNotFound() {
        // Given
        createManager();
        when(mockSource.load("missing")).thenReturn(null);

        // When & Then
        assertThatThrownBy(() -> manager.render("missing", Map.of()))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void testCompileOnDemand() {
        // Given
        createManager();
        when(mockSource.load("late")).thenReturn("late {{ 1 + 1 }}");

        // When
        String first = manager.render("late", Map.of());
        String second = manager.render("late", Map.of());

        // Then
        assertThat(first).isEqualTo("late 2");
        assertThat(second).isEqualTo("late 2");
        verify(mockSource, times(1)).load("late");
        assertThat(manager.contains("late")).isTrue();
    }

    @Test
    void testInvalidTemplateIsReportedOnRender() {
        // Given
        templates.put("broken", "{{ if x }}");
        createManager();
        when(mockSource.load("broken")).thenReturn("{{ if x }}");

        // When & Then
        assertThat(manager.getCachedKeys()).doesNotContain("broken");
        assertThatThrownBy(() -> manager.render("broken", Map.of()))
                .isInstanceOf(TemplateParseException.class);
    }

    @Test
    void testRenderFailureRecordsMetrics() {
        // Given
        templates.put("loop", "{{ for x in 1..5000 }}{{ end }}");
        createManager();

        // When & Then
        assertThatThrownBy(() -> manager.render("loop", Map.of()))
                .hasMessageContaining("iteration limit");
        verify(mockMetrics).recordRender(eq("loop"), anyLong(), eq(false));
    }

    @Test
    void testIncrementalUpdate() {
        // Given
        createManager();
        assertThat(manager.render("plain", Map.of("name", "A"))).isEqualTo("Hello A!");

        // When
        listener.accept(new TemplateChangeEvent(Map.of("plain", "Hi {{ name }}"), Set.of()));

        // Then
        assertThat(manager.render("plain", Map.of("name", "A"))).isEqualTo("Hi A");
    }

    @Test
    void testUpdateRecompilesDependents() {
        // Given
        createManager();
        templates.put("header", "== {{ title }} ==");
        when(mockSource.load(anyString())).thenAnswer(invocation -> templates.get(invocation.<String>getArgument(0)));

        // When
        listener.accept(new TemplateChangeEvent(Map.of("header", templates.get("header")), Set.of()));

        // Then
        verify(mockSource).load("page");
        verify(mockSource).load("site");
        assertThat(manager.render("site", Map.of("title", "T"))).isEqualTo("[== T == body]");
    }

    @Test
    void testRemoveTemplate() {
        // Given
        createManager();
        when(mockSource.load("plain")).thenReturn(null);

        // When
        listener.accept(new TemplateChangeEvent(Map.of(), Set.of("plain")));

        // Then
        assertThat(manager.getCachedKeys()).doesNotContain("plain");
        assertThatThrownBy(() -> manager.render("plain", Map.of()))
                .isInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    void testFrontMatter() {
        // Given
        templates.put("post", "+++\ntitle = 'Post'\n+++\n{{ title }}");
        createManager();

        // When
        Map<String, Object> frontMatter = manager.getFrontMatter("post");

        // Then
        assertThat(frontMatter).containsEntry("title", "Post");
        assertThat(manager.render("post", Map.of())).isEqualTo("Post");
    }

    @Test
    void testConcurrentRender() throws Exception {
        // Given
        createManager();
        int threadCount = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();

        // When
        try {
            for (int i = 0; i < threadCount; i++) {
                int index = i;
                executor.submit(() -> {
                    try {
                        for (int j = 0; j < 50; j++) {
                            String result = manager.render("plain", Map.of("name", "T" + index));
                            if (result.equals("Hello T" + index + "!")) {
                                successCount.incrementAndGet();
                            }
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            // Then
            assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
            assertThat(successCount).hasValue(threadCount * 50);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testCloseClosesSource() throws Exception {
        createManager();

        manager.close();

        verify(mockSource).close();
    }

    @Test
    void testCacheStatistics() {
        createManager();

        manager.render("plain", Map.of());

        assertThat(manager.getCacheSize()).isEqualTo(4);
        assertThat(manager.getCacheStats().hitCount()).isPositive();
        assertThat(List.copyOf(manager.getCachedKeys())).hasSize(4);
    }
}
