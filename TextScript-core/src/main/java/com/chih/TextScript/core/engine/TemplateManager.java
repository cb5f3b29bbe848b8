package com.chih.TextScript.core.engine;

import com.chih.TextScript.core.exception.TemplateNotFoundException;
import com.chih.TextScript.core.exception.TextScriptException;
import com.chih.TextScript.core.impl.NoOpTemplateMetrics;
import com.chih.TextScript.core.impl.TextScriptTemplateEngine;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.TemplateContext;
import com.chih.TextScript.core.runtime.TemplateLoader;
import com.chih.TextScript.core.spi.CompiledTemplate;
import com.chih.TextScript.core.spi.TemplateChangeEvent;
import com.chih.TextScript.core.spi.TemplateEngine;
import com.chih.TextScript.core.spi.TemplateMetrics;
import com.chih.TextScript.core.spi.TemplateSource;
import com.chih.TextScript.core.support.TemplateResources;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 模板管理器：协调 {@link TemplateSource}、{@link TemplateEngine} 与编译缓存
 * <p>
 * 锁的使用：
 * </p>
 * <ul>
 *   <li>读写锁：渲染在读锁下查缓存，热更新提交结果时持写锁</li>
 *   <li>编译锁：按 key 加锁，缓存未命中时同一个 key 只编译一次</li>
 * </ul>
 * <p>
 * include 关系记录在依赖图中，被 include 的模板变化时依赖它的模板一并重新编译。
 * </p>
 *
 * @since 2025/12/16
 */
public class TemplateManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TemplateManager.class);

    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    public static final Duration DEFAULT_EXPIRE_AFTER_ACCESS = Duration.ofHours(24);

    private final TemplateSource source;
    private final TemplateEngine templateEngine;
    private final TemplateMetrics metrics;
    private final TemplateLoader loader;

    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = rwLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = rwLock.writeLock();

    // 编译锁，30 分钟未使用自动清理
    private final Cache<String, ReentrantLock> compileLocks = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .build();

    // key -> 编译结果
    private final Cache<String, CompiledTemplate> cache;

    private final DependencyGraph dependencyGraph = new DependencyGraph();

    /**
     * 编译结果，失败时 compiled 为 null
     */
    private record CompilationResult(String key, CompiledTemplate compiled, RuntimeException error) {

        boolean isSuccess() {
            return compiled != null;
        }
    }

    /**
     * 依赖图：维护 include 关系的正向与反向索引
     */
    static class DependencyGraph {
        // 被 include 的模板 -> include 它的模板
        private final Map<String, Set<String>> reverseDependencies = new ConcurrentHashMap<>();

        // 模板 -> 它 include 的模板
        private final Map<String, Set<String>> forwardDependencies = new ConcurrentHashMap<>();

        void update(String parentId, Set<String> newDependencies) {
            Set<String> oldDependencies = forwardDependencies.get(parentId);
            if (oldDependencies != null) {
                for (String oldDep : oldDependencies) {
                    removeParent(oldDep, parentId);
                }
            }

            Set<String> newDepSet = ConcurrentHashMap.newKeySet();
            if (newDependencies != null) {
                for (String depId : newDependencies) {
                    reverseDependencies.computeIfAbsent(depId, k -> ConcurrentHashMap.newKeySet())
                            .add(parentId);
                    newDepSet.add(depId);
                }
            }

            if (newDepSet.isEmpty()) {
                forwardDependencies.remove(parentId);
            } else {
                forwardDependencies.put(parentId, newDepSet);
            }
        }

        /**
         * 移除模板自身的 include 关系；include 它的模板仍然保留对它的引用，
         * 以便它重新出现时依赖方也能被重新编译
         */
        void remove(String key) {
            Set<String> oldDependencies = forwardDependencies.remove(key);
            if (oldDependencies != null) {
                for (String oldDep : oldDependencies) {
                    removeParent(oldDep, key);
                }
            }
        }

        private void removeParent(String child, String parent) {
            Set<String> parents = reverseDependencies.get(child);
            if (parents != null) {
                parents.remove(parent);
                if (parents.isEmpty()) {
                    reverseDependencies.remove(child);
                }
            }
        }

        Set<String> getParents(String key) {
            Set<String> parents = reverseDependencies.get(key);
            return parents != null ? parents : Collections.emptySet();
        }

        Set<String> getDependencies(String key) {
            Set<String> dependencies = forwardDependencies.get(key);
            return dependencies != null ? Collections.unmodifiableSet(dependencies) : Collections.emptySet();
        }

        /**
         * 计算受影响的 key：变更的 key 加上直接或间接 include 它们的模板
         */
        Set<String> calculateAffectedKeys(Set<String> changedKeys) {
            Set<String> affectedKeys = new HashSet<>();
            Set<String> toProcess = new HashSet<>(changedKeys);

            while (!toProcess.isEmpty()) {
                String current = toProcess.iterator().next();
                toProcess.remove(current);

                if (affectedKeys.add(current)) {
                    toProcess.addAll(getParents(current));
                }
            }
            return affectedKeys;
        }
    }

    /**
     * 来源本身不是 {@link TemplateLoader} 时使用，include 名称按 key 回源读取
     */
    private static final class SourceTemplateLoader implements TemplateLoader {

        private final TemplateSource source;

        private SourceTemplateLoader(TemplateSource source) {
            this.source = source;
        }

        @Override
        public String getPath(TemplateContext context, SourceSpan callerSpan, String templateName) {
            return TemplateResources.toKey(templateName);
        }

        @Override
        public String load(TemplateContext context, SourceSpan callerSpan, String templatePath) {
            return source.load(templatePath);
        }
    }

    public TemplateManager(TemplateSource source, TemplateEngine templateEngine, TemplateMetrics metrics,
                           long maximumSize, Duration expireAfterAccess) {
        this.source = source;
        this.templateEngine = templateEngine != null ? templateEngine : new TextScriptTemplateEngine();
        this.metrics = (metrics != null) ? metrics : new NoOpTemplateMetrics();
        this.loader = (source instanceof TemplateLoader) ? (TemplateLoader) source : new SourceTemplateLoader(source);

        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .recordStats()
                .build();

        reloadAll();

        this.source.onChange(this::handleIncrementalUpdate);
    }

    public TemplateManager(TemplateSource source, TemplateEngine templateEngine, TemplateMetrics metrics) {
        this(source, templateEngine, metrics, DEFAULT_MAXIMUM_SIZE, DEFAULT_EXPIRE_AFTER_ACCESS);
    }

    public TemplateManager(TemplateSource source, TemplateEngine templateEngine) {
        this(source, templateEngine, new NoOpTemplateMetrics());
    }

    public TemplateManager(TemplateSource source) {
        this(source, new TextScriptTemplateEngine(), new NoOpTemplateMetrics());
    }

    // === 编译 ===

    private CompilationResult compileInternal(String key, String text) {
        try {
            CompiledTemplate compiled = templateEngine.compile(key, text, loader);
            return new CompilationResult(key, compiled, null);
        } catch (RuntimeException e) {
            log.error("Failed to compile template: {}", key, e);
            return new CompilationResult(key, null, e);
        }
    }

    private String resolveText(String key, Map<String, String> directUpdates) {
        String text = (directUpdates != null) ? directUpdates.get(key) : null;
        return (text != null) ? text : source.load(key);
    }

    private void applyUpdates(Map<String, CompiledTemplate> entries, Map<String, Set<String>> dependencies) {
        if (entries.isEmpty() && dependencies.isEmpty()) {
            return;
        }

        writeLock.lock();
        try {
            cache.putAll(entries);
            dependencies.forEach(dependencyGraph::update);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 增量更新：写锁内只处理删除并计算受影响的 key，读取和编译在锁外进行
     */
    private void handleIncrementalUpdate(TemplateChangeEvent event) {
        Set<String> keysToRecompile;
        Set<String> removedKeys;

        writeLock.lock();
        try {
            removedKeys = new HashSet<>(event.getRemoved());
            for (String key : removedKeys) {
                cache.invalidate(key);
                dependencyGraph.remove(key);
                log.info("Template removed: {}", key);
            }

            Set<String> changed = new HashSet<>(event.getUpdated().keySet());
            changed.addAll(removedKeys);
            keysToRecompile = dependencyGraph.calculateAffectedKeys(changed);
            keysToRecompile.removeAll(removedKeys);
        } finally {
            writeLock.unlock();
        }

        if (!keysToRecompile.isEmpty()) {
            recompileBatch(keysToRecompile, event.getUpdated(), removedKeys);
        }
    }

    private void recompileBatch(Set<String> keys, Map<String, String> directUpdates, Set<String> removedKeys) {
        Map<String, CompiledTemplate> compiledEntries = new HashMap<>();
        Map<String, Set<String>> dependencyUpdates = new HashMap<>();
        int failures = 0;

        for (String key : keys) {
            String text = resolveText(key, directUpdates);
            if (text == null) {
                if (removedKeys != null && removedKeys.contains(key)) {
                    log.debug("Skipping recompilation for {} - key was removed", key);
                } else {
                    log.warn("Failed to load template during recompilation: {}", key);
                }
                continue;
            }

            CompilationResult result = compileInternal(key, text);
            if (result.isSuccess()) {
                compiledEntries.put(key, result.compiled());
                dependencyUpdates.put(key, result.compiled().getDependencies());
                log.debug("Template compiled: {}", key);
            } else {
                // 编译失败的旧版本不再使用，下次渲染时回源并抛出解析错误
                cache.invalidate(key);
                failures++;
            }
        }

        applyUpdates(compiledEntries, dependencyUpdates);

        log.info("Template update completed: {} compiled, {} failed", compiledEntries.size(), failures);
    }

    /**
     * 全量加载并编译
     */
    public void reloadAll() {
        Map<String, String> all = source.loadAll();
        writeLock.lock();
        try {
            cache.invalidateAll();
            dependencyGraph.forwardDependencies.clear();
            dependencyGraph.reverseDependencies.clear();
        } finally {
            writeLock.unlock();
        }
        recompileBatch(all.keySet(), all, Collections.emptySet());
        log.info("Initialized {} templates.", all.size());
    }

    /**
     * 取得编译结果，缓存未命中时回源编译；编译失败时抛出解析异常
     *
     * @throws TemplateNotFoundException 来源中不存在该 key
     */
    public CompiledTemplate getCompiled(String key) {
        readLock.lock();
        try {
            CompiledTemplate compiled = cache.getIfPresent(key);
            if (compiled != null) {
                return compiled;
            }
        } finally {
            readLock.unlock();
        }

        ReentrantLock keyLock = compileLocks.get(key, k -> new ReentrantLock());
        keyLock.lock();
        try {
            CompiledTemplate compiled = cache.getIfPresent(key);
            if (compiled != null) {
                return compiled;
            }

            // 被 Caffeine 淘汰或从未加载
            String text = source.load(key);
            if (text == null) {
                throw new TemplateNotFoundException(key);
            }
            CompilationResult result = compileInternal(key, text);
            if (!result.isSuccess()) {
                throw result.error();
            }
            applyUpdates(Collections.singletonMap(key, result.compiled()),
                    Collections.singletonMap(key, result.compiled().getDependencies()));
            log.debug("Template compiled on demand: {}", key);
            return result.compiled();
        } finally {
            keyLock.unlock();
        }
    }

    /**
     * 渲染模板
     *
     * @param key       模板 key
     * @param variables 全局变量
     * @return 渲染结果
     * @throws TemplateNotFoundException 模板不存在
     * @throws TextScriptException       解析或运行错误
     */
    public String render(String key, Map<String, Object> variables) {
        CompiledTemplate compiled = getCompiled(key);
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            String result = templateEngine.render(compiled, variables);
            success = true;
            return result;
        } finally {
            metrics.recordRender(key, System.nanoTime() - startTime, success);
        }
    }

    /**
     * 模板 front matter 中定义的变量，没有 front matter 时为空
     */
    public Map<String, Object> getFrontMatter(String key) {
        return templateEngine.evaluateFrontMatter(getCompiled(key));
    }

    public boolean contains(String key) {
        readLock.lock();
        try {
            if (cache.getIfPresent(key) != null) {
                return true;
            }
        } finally {
            readLock.unlock();
        }
        return source.load(key) != null;
    }

    /**
     * 当前缓存的模板 key
     */
    public Set<String> getCachedKeys() {
        return Collections.unmodifiableSet(new HashSet<>(cache.asMap().keySet()));
    }

    public long getCacheSize() {
        return cache.estimatedSize();
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    /**
     * 模板直接 include 的模板 key
     */
    public Set<String> getDependencies(String key) {
        return dependencyGraph.getDependencies(key);
    }

    /**
     * 直接或间接 include 指定模板的模板
     */
    public Set<String> getDependents(String key) {
        Set<String> affected = dependencyGraph.calculateAffectedKeys(Collections.singleton(key));
        affected.remove(key);
        return affected;
    }

    @Override
    public void close() throws Exception {
        source.close();
    }
}
