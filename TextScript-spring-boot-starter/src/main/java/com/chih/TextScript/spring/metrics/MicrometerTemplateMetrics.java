package com.chih.TextScript.spring.metrics;

import com.chih.TextScript.core.spi.TemplateMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <ul>
 *   <li>textscript.render.timer: 渲染耗时，tags: template={key}, result={success|failure}</li>
 *   <li>textscript.render.count: 渲染次数，tags 同上</li>
 * </ul>
 * 模板 key 作为 tag，动态生成大量 key 的场景下注意基数。
 */
public class MicrometerTemplateMetrics implements TemplateMetrics {

    public static final String TIMER_NAME = "textscript.render.timer";

    public static final String COUNTER_NAME = "textscript.render.count";

    private final MeterRegistry registry;

    public MicrometerTemplateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String templateKey, long durationNs, boolean success) {
        String result = success ? "success" : "failure";

        Timer.builder(TIMER_NAME)
                .description("Timer for template rendering")
                .tag("template", templateKey)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder(COUNTER_NAME)
                .description("Counter for template rendering")
                .tag("template", templateKey)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
