package com.chih.TextScript.core.spi;

import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.PathType;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TemplateLoader;
import com.chih.TextScript.core.support.DebouncedFileWatcher;
import com.chih.TextScript.core.support.TemplateResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * 基于索引的 TemplateSource 泛型基类
 * <p>
 * 只在内存中保存 key 到资源的索引，不保存模板内容；内容在 {@link #load(String)} 时按需读取。
 * </p>
 * <ol>
 *   <li>双层索引：key -> 资源，资源 ID -> key</li>
 *   <li>增量更新：文件变更先累积在待更新/待删除集合中，防抖结束后合并为一个 {@link TemplateChangeEvent}</li>
 *   <li>监听器注册前产生的事件会暂存，注册时重放</li>
 * </ol>
 * <p>
 * 同时实现 {@link TemplateLoader}，模板中的 {@code include "a/b"} 按 key 在同一个来源中查找。
 * </p>
 *
 * @param <T> 资源类型 (Path 或 Spring Resource)
 * @since 2025/12/16
 */
public abstract class AbstractIndexBasedTemplateSource<T> implements TemplateSource, TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(AbstractIndexBasedTemplateSource.class);

    // === 索引 ===

    /**
     * 正向索引：模板 key -> 资源对象
     */
    protected final Map<String, T> keyToIndex = new ConcurrentHashMap<>();

    /**
     * 反向索引：资源 ID -> 模板 key
     * <p>
     * 资源被删除时只剩下资源 ID，需要靠它找回对应的 key。
     * </p>
     */
    protected final Map<String, String> sourceToKey = new ConcurrentHashMap<>();

    // === 热更新 (防抖) ===

    /**
     * 待更新的模板：key -> 源码
     */
    protected final Map<String, String> pendingUpdates = new ConcurrentHashMap<>();

    /**
     * 待删除的模板 key
     */
    protected final Set<String> pendingRemoves = ConcurrentHashMap.newKeySet();

    /**
     * 加载失败的资源：资源 ID -> 异常
     */
    protected final Map<String, Throwable> loadErrors = new ConcurrentHashMap<>();

    protected final DebouncedFileWatcher fileWatcher;

    protected volatile Consumer<TemplateChangeEvent> changeListener;

    /**
     * 监听器注册前产生的事件
     */
    private final Queue<TemplateChangeEvent> pendingEvents = new ConcurrentLinkedQueue<>();

    /**
     * 使用默认防抖时间 500ms，线程池由内部创建
     */
    protected AbstractIndexBasedTemplateSource() {
        this(500L, null, null);
    }

    /**
     * @param debounceDelayMs  防抖延迟 (毫秒)，用于合并连续的变更事件
     * @param watcherExecutor  文件监听线程池，为 null 时内部创建
     * @param debounceExecutor 防抖定时器线程池，为 null 时内部创建
     */
    protected AbstractIndexBasedTemplateSource(long debounceDelayMs,
                                               ExecutorService watcherExecutor,
                                               ScheduledExecutorService debounceExecutor) {
        this.fileWatcher = new DebouncedFileWatcher(
                this::handleFileChange,
                this::notifyManager,
                TemplateResources::isSupportedFile,
                debounceDelayMs,
                watcherExecutor,
                debounceExecutor
        );
    }

    // === 子类实现的资源操作 ===

    /**
     * 打开资源流，调用者负责关闭
     */
    protected abstract InputStream openStream(T resource) throws Exception;

    /**
     * 资源的唯一标识，资源被删除后也必须能计算出相同的值
     */
    protected abstract String getResourceId(T resource);

    protected abstract boolean exists(T resource);

    /**
     * 模板 key，一般为相对模板根目录的路径去掉扩展名
     *
     * @return key，资源不属于本来源时返回 null
     */
    protected abstract String getTemplateKey(T resource);

    /**
     * 把监听到的文件转换为资源对象
     *
     * @return 资源对象，不支持时返回 null
     */
    protected abstract T resolveResourceFromFile(File file);

    /**
     * 用于日志的资源描述
     */
    protected abstract String getResourceDescription(T resource);

    // === 索引维护 ===

    /**
     * 刷新单个资源的索引
     *
     * @param resource      资源对象
     * @param isIncremental 热更新时为 true，初始加载时为 false
     */
    protected void refreshIndex(T resource, boolean isIncremental) {
        String resourceId = getResourceId(resource);

        try {
            if (!exists(resource)) {
                handleResourceRemoval(resourceId, isIncremental);
                return;
            }

            String key = getTemplateKey(resource);
            if (key == null || key.isEmpty()) {
                log.debug("Resource {} does not map to a template key, skipped", resourceId);
                return;
            }
            String text = readResource(resource);
            updateIndex(resourceId, key, text, resource, isIncremental);
        } catch (Exception e) {
            log.error("Failed to refresh resource: {}", resourceId, e);
            loadErrors.put(resourceId, e);
        }
    }

    private void handleResourceRemoval(String resourceId, boolean isIncremental) {
        String removedKey = sourceToKey.remove(resourceId);

        if (removedKey != null) {
            keyToIndex.remove(removedKey);
            if (isIncremental) {
                synchronized (this) {
                    pendingRemoves.add(removedKey);
                    // 修改后又删除
                    pendingUpdates.remove(removedKey);
                }
            }
        }
        loadErrors.remove(resourceId);

        log.info("Template resource removed: {} (key: {})", resourceId, removedKey);
    }

    private void updateIndex(String resourceId, String key, String text, T resource, boolean isIncremental) {
        T previous = keyToIndex.get(key);
        if (previous != null && !getResourceId(previous).equals(resourceId)) {
            // 例如 a.tss 与 a.liquid 同时存在
            log.warn("Template key `{}` is defined by both {} and {}, the latter wins",
                    key, getResourceDescription(previous), getResourceDescription(resource));
        }

        sourceToKey.put(resourceId, key);
        keyToIndex.put(key, resource);

        if (isIncremental) {
            // 与 notifyManager 使用同一把锁，避免快照时丢失更新
            synchronized (this) {
                pendingUpdates.put(key, text);
                // 删除后又重新创建
                pendingRemoves.remove(key);
            }
        }
        loadErrors.remove(resourceId);
    }

    /**
     * 读取资源全文
     */
    protected String readResource(T resource) throws Exception {
        try (InputStream is = openStream(resource)) {
            return TemplateResources.readText(is);
        }
    }

    /**
     * 初始加载单个资源，失败只记录日志
     */
    protected final void safeLoadResource(T resource) {
        try {
            refreshIndex(resource, false);
            log.debug("Loaded template resource: {}", getResourceId(resource));
        } catch (Exception e) {
            log.error("Failed to load template resource: {}", getResourceDescription(resource), e);
        }
    }

    private void handleFileChange(File file) {
        if (!TemplateResources.isSupportedFile(file.getName())) {
            return;
        }

        T resource = resolveResourceFromFile(file);
        if (resource != null) {
            refreshIndex(resource, true);
        }
    }

    /**
     * 防抖结束后把累积的变更合并为一个事件发出
     */
    protected void notifyManager() {
        Map<String, String> updatesSnapshot;
        Set<String> removesSnapshot;

        synchronized (this) {
            if (pendingUpdates.isEmpty() && pendingRemoves.isEmpty()) {
                return;
            }

            updatesSnapshot = new HashMap<>(pendingUpdates);
            removesSnapshot = new HashSet<>(pendingRemoves);

            pendingUpdates.clear();
            pendingRemoves.clear();
        }

        TemplateChangeEvent event = new TemplateChangeEvent(updatesSnapshot, removesSnapshot);

        Consumer<TemplateChangeEvent> listener = changeListener;
        if (listener != null) {
            log.info("Debounce finished. Pushing batch updates: {} updated, {} removed.",
                    updatesSnapshot.size(), removesSnapshot.size());
            listener.accept(event);
        } else {
            pendingEvents.offer(event);
            log.debug("Change listener not registered, caching event: {} updated, {} removed",
                    updatesSnapshot.size(), removesSnapshot.size());
        }
    }

    // === TemplateSource ===

    @Override
    public Map<String, String> loadAll() {
        Map<String, String> all = new HashMap<>();
        for (Map.Entry<String, T> entry : keyToIndex.entrySet()) {
            try {
                all.put(entry.getKey(), readResource(entry.getValue()));
            } catch (Exception e) {
                log.warn("Failed to read template during loadAll: {}", getResourceId(entry.getValue()), e);
            }
        }
        return all;
    }

    @Override
    public String load(String key) {
        T resource = keyToIndex.get(key);
        if (resource == null) {
            return null;
        }

        try {
            return readResource(resource);
        } catch (Exception e) {
            log.error("Failed to load template: {}", key, e);
            return null;
        }
    }

    @Override
    public void onChange(Consumer<TemplateChangeEvent> listener) {
        this.changeListener = listener;
        replayPendingEvents();
    }

    private void replayPendingEvents() {
        if (pendingEvents.isEmpty()) {
            return;
        }

        log.info("Replaying {} cached change events from startup phase", pendingEvents.size());

        TemplateChangeEvent event;
        while ((event = pendingEvents.poll()) != null) {
            try {
                changeListener.accept(event);
            } catch (Exception e) {
                log.error("Failed to replay cached change event {}", event, e);
            }
        }
    }

    @Override
    public void close() throws Exception {
        fileWatcher.close();
    }

    // === TemplateLoader ===

    /**
     * include 名称即模板 key，允许带扩展名或以 {@code /} 开头
     */
    @Override
    public String getPath(TemplateContext context, SourceSpan callerSpan, String templateName) {
        String key = TemplateResources.toKey(templateName);
        return keyToIndex.containsKey(key) ? key : null;
    }

    @Override
    public String load(TemplateContext context, SourceSpan callerSpan, String templatePath) {
        return load(templatePath);
    }

    @Override
    public boolean pathExists(TemplateContext context, SourceSpan callerSpan, String path, PathType type) {
        String key = TemplateResources.toKey(path);
        boolean leaf = keyToIndex.containsKey(key);
        boolean container = keyToIndex.keySet().stream().anyMatch(k -> k.startsWith(key + "/"));
        switch (type) {
            case LEAF:
                return leaf;
            case CONTAINER:
                return container;
            default:
                return leaf || container;
        }
    }

    /**
     * 列出某个目录下直接包含的模板 key
     */
    @Override
    public List<String> enumerate(TemplateContext context, SourceSpan callerSpan, String path, PathType type) {
        String prefix = path == null || path.isEmpty() || "/".equals(path) ? "" : TemplateResources.toKey(path) + "/";
        List<String> result = new ArrayList<>();
        for (String key : keyToIndex.keySet()) {
            if (key.startsWith(prefix) && key.indexOf('/', prefix.length()) < 0 && type != PathType.CONTAINER) {
                result.add(key);
            }
        }
        Collections.sort(result);
        return result;
    }

    // === 辅助方法 ===

    public Set<String> getKeys() {
        return Collections.unmodifiableSet(keyToIndex.keySet());
    }

    public Map<String, Throwable> getLoadErrors() {
        return Collections.unmodifiableMap(loadErrors);
    }

    protected void startWatcher() {
        this.fileWatcher.start();
    }
}
