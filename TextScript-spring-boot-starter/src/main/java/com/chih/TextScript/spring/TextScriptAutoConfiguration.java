package com.chih.TextScript.spring;

import com.chih.TextScript.core.engine.TemplateManager;
import com.chih.TextScript.core.impl.NoOpTemplateMetrics;
import com.chih.TextScript.core.impl.TextScriptTemplateEngine;
import com.chih.TextScript.core.spi.TemplateEngine;
import com.chih.TextScript.core.spi.TemplateMetrics;
import com.chih.TextScript.core.spi.TemplateSource;
import com.chih.TextScript.spring.health.TextScriptHealthIndicator;
import com.chih.TextScript.spring.metrics.MicrometerTemplateMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * TextScript Spring Boot 自动配置
 * <p>
 * 所有组件都是 {@link ConditionalOnMissingBean}，用户可以注册自己的
 * {@link TemplateSource}、{@link TemplateEngine} 或 {@link TemplateMetrics} 覆盖默认实现。
 * </p>
 * <pre>{@code
 * text-script:
 *   locations:
 *     - classpath:templates/
 *     - file:./templates/
 *   liquid: false
 *   debounce-millis: 1000
 * }</pre>
 *
 * @since 2025/12/17
 * @see TextScriptProperties
 * @see SpringResourceTemplateSource
 * @see TemplateManager
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(TextScriptProperties.class)
@ConditionalOnProperty(prefix = "text-script", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TextScriptAutoConfiguration {

    /**
     * 文件监听线程池，单线程即可
     */
    @Bean("textScriptWatcherExecutor")
    public ExecutorService textScriptWatcherExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("textscript-watcher-");
        executor.setDaemon(true);
        executor.initialize();
        return executor.getThreadPoolExecutor();
    }

    /**
     * 防抖定时器线程池
     */
    @Bean("textScriptDebounceExecutor")
    public ScheduledExecutorService textScriptDebounceExecutor() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("textscript-debouncer-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler.getScheduledExecutor();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateSource.class)
    public TemplateSource templateSource(TextScriptProperties properties,
            @Qualifier("textScriptWatcherExecutor") ExecutorService watcherExecutor,
            @Qualifier("textScriptDebounceExecutor") ScheduledExecutorService debounceExecutor) {
        return new SpringResourceTemplateSource(properties.getLocations(), properties.getDebounceMillis(),
                watcherExecutor, debounceExecutor, properties.isWatch());
    }

    @Bean
    @ConditionalOnMissingBean(TemplateEngine.class)
    public TemplateEngine templateEngine(TextScriptProperties properties) {
        TextScriptTemplateEngine engine = new TextScriptTemplateEngine(properties.isLiquid());
        engine.setEnableRelaxedMemberAccess(properties.isRelaxedMemberAccess());
        engine.setStrictVariables(properties.isStrictVariables());
        engine.setLoopLimit(properties.getLoopLimit());
        engine.setRecursiveLimit(properties.getRecursiveLimit());
        return engine;
    }

    /**
     * 存在 Micrometer 与 MeterRegistry 时记录渲染指标
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(TemplateMetrics.class)
        public TemplateMetrics templateMetrics(MeterRegistry registry) {
            return new MicrometerTemplateMetrics(registry);
        }
    }

    // 没有 Metrics 环境时注入空实现
    @Bean
    @ConditionalOnMissingBean(TemplateMetrics.class)
    public TemplateMetrics defaultTemplateMetrics() {
        return new NoOpTemplateMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateManager.class)
    public TemplateManager templateManager(TemplateSource source,
            TemplateEngine engine,
            TemplateMetrics metrics,
            TextScriptProperties properties) {
        return new TemplateManager(source, engine, metrics,
                properties.getCacheMaxSize(), properties.getCacheExpireAfterAccess());
    }

    /**
     * 引入 Actuator 时注册健康检查
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthCheckConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "textScriptHealthIndicator")
        public TextScriptHealthIndicator textScriptHealthIndicator(TemplateManager manager, TemplateSource source) {
            return new TextScriptHealthIndicator(manager, source);
        }
    }
}
