package com.chih.TextScript.spring;

import com.chih.TextScript.core.engine.TemplateManager;
import com.chih.TextScript.core.impl.NoOpTemplateMetrics;
import com.chih.TextScript.core.impl.TextScriptTemplateEngine;
import com.chih.TextScript.core.spi.TemplateEngine;
import com.chih.TextScript.core.spi.TemplateMetrics;
import com.chih.TextScript.core.spi.TemplateSource;
import com.chih.TextScript.spring.health.TextScriptHealthIndicator;
import com.chih.TextScript.spring.metrics.MicrometerTemplateMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * TextScriptAutoConfiguration 单元测试
 *
 * 测试 Spring Boot 自动配置功能，包括：
 * - 默认 Bean 的创建
 * - 配置属性绑定
 * - 用户 Bean 覆盖默认实现
 * - 指标与健康检查
 */
@DisplayName("TextScriptAutoConfiguration 测试")
class TextScriptAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TextScriptAutoConfiguration.class))
            .withPropertyValues("text-script.watch=false");

    @Test
    @DisplayName("TextScriptProperties 默认配置应该正确")
    void testPropertiesDefaults() {
        TextScriptProperties properties = new TextScriptProperties();

        assertThat(properties.isEnabled()).isTrue();
        assertThat(properties.getLocations()).containsExactly("classpath:templates/");
        assertThat(properties.getDebounceMillis()).isEqualTo(500);
        assertThat(properties.isWatch()).isTrue();
        assertThat(properties.isLiquid()).isFalse();
        assertThat(properties.isRelaxedMemberAccess()).isTrue();
        assertThat(properties.isStrictVariables()).isFalse();
        assertThat(properties.getCacheMaxSize()).isEqualTo(TemplateManager.DEFAULT_MAXIMUM_SIZE);
        assertThat(TextScriptProperties.class.getAnnotation(ConfigurationProperties.class).prefix())
                .isEqualTo("text-script");
    }

    @Test
    @DisplayName("默认从 classpath:templates/ 加载并渲染")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TemplateSource.class);
            assertThat(context).hasSingleBean(TemplateEngine.class);
            assertThat(context).hasSingleBean(TemplateManager.class);
            assertThat(context).getBean(TemplateSource.class).isInstanceOf(SpringResourceTemplateSource.class);
            assertThat(context).getBean(TemplateMetrics.class).isInstanceOf(NoOpTemplateMetrics.class);

            TemplateManager manager = context.getBean(TemplateManager.class);
            assertThat(manager.render("greeting", Map.of("name", "Bob"))).isEqualTo("Hello Bob!\n-- TextScript");
            assertThat(manager.render("welcome", Map.of("name", "bob"))).isEqualTo("Welcome, Bob");
            assertThat(manager.getDependents("partials/footer")).containsExactly("greeting");
        });
    }

    @Test
    @DisplayName("配置属性绑定到引擎与缓存")
    void testPropertyBinding(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("page.liquid"), "{{ title | upcase }}");

        contextRunner
                .withPropertyValues(
                        "text-script.locations=" + tempDir.toUri(),
                        "text-script.liquid=true",
                        "text-script.strict-variables=true",
                        "text-script.loop-limit=50",
                        "text-script.cache-expire-after-access=10m")
                .run(context -> {
                    TextScriptProperties properties = context.getBean(TextScriptProperties.class);
                    assertThat(properties.getCacheExpireAfterAccess()).isEqualTo(Duration.ofMinutes(10));

                    TextScriptTemplateEngine engine = (TextScriptTemplateEngine) context.getBean(TemplateEngine.class);
                    assertThat(engine.isLiquid()).isTrue();
                    assertThat(engine.isStrictVariables()).isTrue();
                    assertThat(engine.getLoopLimit()).isEqualTo(50);

                    TemplateManager manager = context.getBean(TemplateManager.class);
                    assertThat(manager.render("page", Map.of("title", "hi"))).isEqualTo("HI");
                });
    }

    @Test
    @DisplayName("用户自定义 Bean 覆盖默认实现")
    void testUserBeansOverride() {
        TemplateEngine customEngine = new TextScriptTemplateEngine(true);

        contextRunner
                .withBean(TemplateEngine.class, () -> customEngine)
                .run(context -> {
                    assertThat(context).hasSingleBean(TemplateEngine.class);
                    assertThat(context.getBean(TemplateEngine.class)).isSameAs(customEngine);
                });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时记录渲染指标")
    void testMicrometerMetrics() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context).getBean(TemplateMetrics.class).isInstanceOf(MicrometerTemplateMetrics.class);

                    context.getBean(TemplateManager.class).render("greeting", Map.of("name", "A"));

                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    Counter counter = registry.find(MicrometerTemplateMetrics.COUNTER_NAME)
                            .tag("template", "greeting").tag("result", "success").counter();
                    assertThat(counter).isNotNull();
                    assertThat(counter.count()).isEqualTo(1.0);
                });
    }

    @Test
    @DisplayName("健康检查在全部模板加载成功时为 UP")
    void testHealthIndicator() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TextScriptHealthIndicator.class);

            Health health = context.getBean(TextScriptHealthIndicator.class).health();

            assertThat(health.getStatus()).isEqualTo(Status.UP);
            assertThat(health.getDetails()).containsEntry("cachedTemplates", 3L);
        });
    }

    @Test
    @DisplayName("enabled=false 时不装配任何组件")
    void testDisabled() {
        contextRunner
                .withPropertyValues("text-script.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(TemplateManager.class);
                    assertThat(context).doesNotHaveBean(TemplateSource.class);
                });
    }
}
