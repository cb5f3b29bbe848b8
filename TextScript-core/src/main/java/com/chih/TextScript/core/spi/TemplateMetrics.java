package com.chih.TextScript.core.spi;

/**
 * 渲染监控指标 SPI
 */
public interface TemplateMetrics {

    /**
     * 记录一次模板渲染
     *
     * @param templateKey 模板 key
     * @param durationNs  耗时 (纳秒)
     * @param success     是否成功
     */
    void recordRender(String templateKey, long durationNs, boolean success);
}
