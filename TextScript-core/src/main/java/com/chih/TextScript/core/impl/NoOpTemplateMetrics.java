package com.chih.TextScript.core.impl;

import com.chih.TextScript.core.spi.TemplateMetrics;

public class NoOpTemplateMetrics implements TemplateMetrics {
    @Override
    public void recordRender(String templateKey, long durationNs, boolean success) {
        // Do nothing
    }
}
