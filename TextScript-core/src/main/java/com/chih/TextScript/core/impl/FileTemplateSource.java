package com.chih.TextScript.core.impl;

import com.chih.TextScript.core.spi.AbstractIndexBasedTemplateSource;
import com.chih.TextScript.core.support.TemplateResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Stream;

/**
 * 基于文件系统目录的模板来源
 * <p>
 * 递归加载目录下的 {@code .tss}、{@code .liquid}、{@code .txt} 文件，key 为相对目录的路径去掉扩展名，
 * 并监听目录实现热更新。
 * </p>
 * <pre>{@code
 * FileTemplateSource source = new FileTemplateSource(Path.of("templates"));
 * TemplateManager manager = new TemplateManager(source);
 * String text = manager.render("mail/welcome", Map.of("name", "Bob"));
 * }</pre>
 *
 * @since 2025/12/16
 */
public class FileTemplateSource extends AbstractIndexBasedTemplateSource<Path> {

    private static final Logger log = LoggerFactory.getLogger(FileTemplateSource.class);

    private final Path root;

    public FileTemplateSource(Path root) {
        this(root, 500L, null, null, true);
    }

    /**
     * @param root             模板根目录，不存在时来源为空
     * @param debounceDelayMs  防抖延迟 (毫秒)
     * @param watcherExecutor  文件监听线程池，为 null 时内部创建
     * @param debounceExecutor 防抖定时器线程池，为 null 时内部创建
     * @param watch            是否监听目录变更
     */
    public FileTemplateSource(Path root, long debounceDelayMs,
                              ExecutorService watcherExecutor, ScheduledExecutorService debounceExecutor,
                              boolean watch) {
        super(debounceDelayMs, watcherExecutor, debounceExecutor);
        this.root = root.toAbsolutePath().normalize();

        initialLoad(watch);
        if (watch) {
            startWatcher();
        }
    }

    private void initialLoad(boolean watch) {
        if (!Files.isDirectory(root)) {
            log.warn("Template directory not found: {}", root);
            return;
        }

        try (Stream<Path> paths = Files.walk(root)) {
            paths.forEach(path -> {
                if (Files.isDirectory(path)) {
                    if (watch) {
                        fileWatcher.register(path.toFile());
                    }
                } else if (TemplateResources.isSupportedFile(path.getFileName().toString())) {
                    safeLoadResource(path);
                }
            });
        } catch (IOException e) {
            log.error("Failed to scan template directory: {}", root, e);
        }
        log.info("Loaded {} templates from {}", keyToIndex.size(), root);
    }

    public Path getRoot() {
        return root;
    }

    // === 实现抽象方法 ===

    @Override
    protected InputStream openStream(Path resource) throws Exception {
        return Files.newInputStream(resource);
    }

    @Override
    protected String getResourceId(Path resource) {
        return resource.toAbsolutePath().normalize().toString();
    }

    @Override
    protected boolean exists(Path resource) {
        return Files.isRegularFile(resource);
    }

    @Override
    protected String getTemplateKey(Path resource) {
        Path absolute = resource.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            return null;
        }
        return TemplateResources.toKey(root.relativize(absolute).toString());
    }

    @Override
    protected Path resolveResourceFromFile(File file) {
        return file.toPath();
    }

    @Override
    protected String getResourceDescription(Path resource) {
        return resource.toString();
    }
}
