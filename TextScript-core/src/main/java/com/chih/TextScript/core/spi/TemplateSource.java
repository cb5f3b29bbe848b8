package com.chih.TextScript.core.spi;

import java.util.Map;
import java.util.function.Consumer;

/**
 * 模板来源接口 (SPI)
 * <p>
 * 可以扩展不同的存储源 (文件系统、Spring Resource、数据库等)。模板以 key 标识，内容为 TextScript 源码。
 * </p>
 *
 * @since 2025/12/16
 */
public interface TemplateSource extends AutoCloseable {

    /**
     * 加载全部模板
     *
     * @return key -> 模板源码
     */
    Map<String, String> loadAll();

    /**
     * 注册变更监听，源数据变化时由实现类回调
     */
    void onChange(Consumer<TemplateChangeEvent> listener);

    /**
     * 按 key 加载单个模板，不存在时返回 null (用于缓存未命中时回源)
     */
    default String load(String key) {
        return loadAll().get(key); // 实现类应覆盖为按索引查找
    }

    /**
     * 释放线程池、WatchService 等资源
     */
    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
