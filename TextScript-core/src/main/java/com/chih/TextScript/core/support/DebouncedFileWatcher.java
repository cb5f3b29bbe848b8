package com.chih.TextScript.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 支持防抖的目录监听器
 * <p>
 * 封装 NIO WatchService 与 ScheduledExecutorService：每个变更文件立即回调 {@code onFileChange}，
 * 一批变更停止 {@code debounceDelayMs} 毫秒后再回调一次 {@code onDebounceComplete}。
 * 删除事件同样回调 {@code onFileChange}，此时传入的文件已不存在。
 * </p>
 */
public class DebouncedFileWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebouncedFileWatcher.class);

    private final WatchService watchService;

    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();

    private final Set<String> watchedPaths = ConcurrentHashMap.newKeySet();

    // 单个文件变更时触发 (增量更新)
    private final Consumer<File> onFileChange;

    // 防抖结束后触发 (通知上层)
    private final Runnable onDebounceComplete;

    // 文件名过滤，返回 false 的文件被忽略
    private final Predicate<String> fileFilter;

    private final long debounceDelayMs;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ExecutorService watcherExecutor;

    private final ScheduledExecutorService debounceExecutor;

    private ScheduledFuture<?> debounceTask;

    // 外部注入的线程池不由本类关闭
    private final boolean manageWatcherExecutor;

    private final boolean manageDebounceExecutor;

    public DebouncedFileWatcher(Consumer<File> onFileChange, Runnable onDebounceComplete, long debounceDelayMs) {
        this(onFileChange, onDebounceComplete, TemplateResources::isSupportedFile, debounceDelayMs, null, null);
    }

    /**
     * @param onFileChange       检测到文件变更时立即回调，参数为变更的文件
     * @param onDebounceComplete 一批变更结束后回调
     * @param fileFilter         按文件名过滤需要处理的文件
     * @param debounceDelayMs    防抖延迟 (毫秒)
     * @param watcherExecutor    监听线程池，为 null 时内部创建
     * @param debounceExecutor   防抖调度线程池，为 null 时内部创建
     */
    public DebouncedFileWatcher(Consumer<File> onFileChange, Runnable onDebounceComplete,
                                Predicate<String> fileFilter, long debounceDelayMs,
                                ExecutorService watcherExecutor, ScheduledExecutorService debounceExecutor) {
        this.onFileChange = onFileChange;
        this.onDebounceComplete = onDebounceComplete;
        this.fileFilter = fileFilter != null ? fileFilter : name -> true;
        this.debounceDelayMs = debounceDelayMs;

        try {
            this.watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize WatchService", e);
        }

        if (watcherExecutor == null) {
            this.watcherExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "TextScript-Watcher");
                t.setDaemon(true);
                return t;
            });
            manageWatcherExecutor = true;
        } else {
            this.watcherExecutor = watcherExecutor;
            manageWatcherExecutor = false;
        }

        if (debounceExecutor == null) {
            this.debounceExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "TextScript-Debouncer");
                t.setDaemon(true);
                return t;
            });
            manageDebounceExecutor = true;
        } else {
            this.debounceExecutor = debounceExecutor;
            manageDebounceExecutor = false;
        }
    }

    /**
     * 注册监听目录 (不递归，子目录需要分别注册)
     */
    public void register(File directory) {
        if (directory == null || !directory.isDirectory()) {
            return;
        }

        try {
            String absPath = directory.getCanonicalPath();
            if (!watchedPaths.add(absPath)) {
                return;
            }

            Path dirPath = directory.toPath();
            WatchKey key = dirPath.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
            watchKeys.put(key, dirPath);
            log.debug("Watching directory: {}", absPath);
        } catch (IOException e) {
            log.warn("Failed to register watch for directory: {}", directory, e);
        }
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            watcherExecutor.submit(this::watchLoop);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void watchLoop() {
        log.info("TextScript file watcher started, {} directories registered.", watchKeys.size());
        while (running.get()) {
            try {
                WatchKey key = watchService.take();
                Path dir = watchKeys.get(key);
                if (dir == null) {
                    key.cancel();
                    continue;
                }

                boolean activityDetected = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        continue;
                    }

                    Path changedPath = dir.resolve((Path) event.context());
                    File file = changedPath.toFile();

                    // 新建的子目录加入监听
                    if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && file.isDirectory()) {
                        register(file);
                        continue;
                    }
                    if (!fileFilter.test(file.getName())) {
                        continue;
                    }

                    if (onFileChange != null) {
                        try {
                            onFileChange.accept(file);
                            activityDetected = true;
                        } catch (Exception e) {
                            log.error("Error in onFileChange callback for {}", file, e);
                        }
                    } else {
                        activityDetected = true;
                    }
                }

                if (activityDetected) {
                    triggerDebounce();
                }

                if (!key.reset()) {
                    watchKeys.remove(key);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            } catch (Exception e) {
                log.error("Unexpected error in watcher loop", e);
            }
        }
    }

    private synchronized void triggerDebounce() {
        if (onDebounceComplete == null) {
            return;
        }

        if (debounceTask != null && !debounceTask.isDone()) {
            debounceTask.cancel(false);
        }

        debounceTask = debounceExecutor.schedule(() -> {
            try {
                onDebounceComplete.run();
            } catch (Exception e) {
                log.error("Error in onDebounceComplete callback", e);
            }
        }, debounceDelayMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        boolean wasRunning = running.getAndSet(false);
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close WatchService", e);
        }
        if (manageWatcherExecutor) {
            watcherExecutor.shutdownNow();
        }
        if (manageDebounceExecutor) {
            debounceExecutor.shutdownNow();
        }
        if (wasRunning) {
            log.info("TextScript file watcher stopped.");
        }
    }
}
