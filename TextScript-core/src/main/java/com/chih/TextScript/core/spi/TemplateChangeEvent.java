package com.chih.TextScript.core.spi;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * 模板变更事件
 *
 * @since 2025/12/16
 */
public class TemplateChangeEvent {

    // 新增或修改的模板：key -> 源码
    private final Map<String, String> updated;

    // 被删除的模板 key
    private final Set<String> removed;

    public TemplateChangeEvent(Map<String, String> updated, Set<String> removed) {
        this.updated = (updated != null) ? updated : Collections.emptyMap();
        this.removed = (removed != null) ? removed : Collections.emptySet();
    }

    public Map<String, String> getUpdated() {
        return updated;
    }

    public Set<String> getRemoved() {
        return removed;
    }

    @Override
    public String toString() {
        return "TemplateChangeEvent{updated=" + updated.keySet() + ", removed=" + removed + '}';
    }
}
