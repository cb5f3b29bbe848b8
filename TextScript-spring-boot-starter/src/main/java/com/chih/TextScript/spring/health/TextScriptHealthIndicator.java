package com.chih.TextScript.spring.health;

import com.chih.TextScript.core.engine.TemplateManager;
import com.chih.TextScript.core.spi.AbstractIndexBasedTemplateSource;
import com.chih.TextScript.core.spi.TemplateSource;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * TextScript 健康检查
 * 存在读取失败的模板文件时状态为 DOWN
 *
 * @since 2025/12/17
 */
public class TextScriptHealthIndicator extends AbstractHealthIndicator {

    private final TemplateManager manager;

    private final TemplateSource source;

    public TextScriptHealthIndicator(TemplateManager manager, TemplateSource source) {
        this.manager = manager;
        this.source = source;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        Map<String, Throwable> errors = (source instanceof AbstractIndexBasedTemplateSource)
                ? ((AbstractIndexBasedTemplateSource<?>) source).getLoadErrors()
                : Map.of();

        builder.withDetail("cachedTemplates", manager.getCacheSize());
        if (errors.isEmpty()) {
            builder.up().withDetail("message", "All templates loaded successfully.");
        } else {
            builder.status(Status.DOWN).withDetail("message", "Some template files failed to load.")
                    .withDetail("errorCount", errors.size())
                    .withDetail("errors", errors.entrySet().stream()
                            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.valueOf(e.getValue().getMessage()))));
        }
    }
}
