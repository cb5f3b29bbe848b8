package com.chih.TextScript.spring;

import com.chih.TextScript.core.spi.AbstractIndexBasedTemplateSource;
import com.chih.TextScript.core.support.TemplateResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Stream;

/**
 * 基于 Spring Resource 的模板来源
 * <p>
 * 每个 location 是一个模板根目录，例如 {@code classpath:templates/} 或 {@code file:./templates/}，
 * 目录下的模板递归加载，key 为相对根目录的路径去掉扩展名。多个根目录中出现相同 key 时后加载的生效。
 * 文件系统中的根目录 (包括开发时展开在 target/classes 下的 classpath 目录) 会被监听，jar 内的资源只读。
 * </p>
 *
 * @see AbstractIndexBasedTemplateSource
 */
public class SpringResourceTemplateSource extends AbstractIndexBasedTemplateSource<Resource>
        implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceTemplateSource.class);

    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    private final List<String> locations;

    // 根目录位置，均以 / 结尾，用于计算 key
    private final List<String> roots = new ArrayList<>();

    public SpringResourceTemplateSource(List<String> locations, long debounceDelayMs,
                                        ExecutorService watcherExecutor, ScheduledExecutorService debounceExecutor) {
        this(locations, debounceDelayMs, watcherExecutor, debounceExecutor, true);
    }

    /**
     * @param locations        模板根目录列表
     * @param debounceDelayMs  防抖延迟 (毫秒)
     * @param watcherExecutor  文件监听线程池，为 null 时内部创建
     * @param debounceExecutor 防抖定时器线程池，为 null 时内部创建
     * @param watch            是否监听文件系统中的根目录
     */
    public SpringResourceTemplateSource(List<String> locations, long debounceDelayMs,
                                        ExecutorService watcherExecutor, ScheduledExecutorService debounceExecutor,
                                        boolean watch) {
        super(debounceDelayMs, watcherExecutor, debounceExecutor);
        this.locations = new ArrayList<>(locations);

        initialLoad(watch);
        if (watch) {
            startWatcher();
        }
    }

    private void initialLoad(boolean watch) {
        for (String location : locations) {
            if (!StringUtils.hasText(location)) {
                continue;
            }
            String directory = location.endsWith("/") ? location : location + "/";

            try {
                boolean found = false;
                for (Resource root : resolver.getResources(directory)) {
                    if (!root.exists()) {
                        log.debug("Template location not found: {}", root.getDescription());
                        continue;
                    }
                    found = true;
                    roots.add(locationOf(root) + "/");
                    if (watch && isFileResource(root)) {
                        registerDirectories(root.getFile().toPath());
                    }
                }
                if (!found) {
                    continue;
                }

                for (Resource resource : resolver.getResources(directory + "**/*")) {
                    if (isTemplateResource(resource)) {
                        safeLoadResource(resource);
                    }
                }
            } catch (IOException e) {
                log.error("Failed to scan template location: {}", location, e);
            }
        }
        log.info("Loaded {} templates from {}", keyToIndex.size(), locations);
    }

    private void registerDirectories(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isDirectory).forEach(dir -> fileWatcher.register(dir.toFile()));
        } catch (IOException e) {
            log.warn("Failed to register watch for template directory: {}", root, e);
        }
    }

    private boolean isTemplateResource(Resource resource) {
        String filename = resource.getFilename();
        return filename != null && resource.isReadable() && TemplateResources.isSupportedFile(filename);
    }

    // === 实现抽象方法 ===

    @Override
    protected InputStream openStream(Resource resource) throws Exception {
        return resource.getInputStream();
    }

    @Override
    protected String getResourceId(Resource resource) {
        try {
            if (isFileResource(resource)) {
                return resource.getFile().getAbsolutePath();
            }
            return resource.getURI().toString();
        } catch (IOException e) {
            return resource.getDescription();
        }
    }

    @Override
    protected boolean exists(Resource resource) {
        return resource.exists();
    }

    /**
     * 取最长匹配的根目录计算相对路径
     */
    @Override
    protected String getTemplateKey(Resource resource) {
        String location;
        try {
            location = locationOf(resource);
        } catch (IOException e) {
            log.warn("Failed to resolve template resource location: {}", resource.getDescription(), e);
            return null;
        }

        String matched = null;
        for (String root : roots) {
            if (location.startsWith(root) && (matched == null || root.length() > matched.length())) {
                matched = root;
            }
        }
        if (matched == null) {
            return null;
        }
        return TemplateResources.toKey(location.substring(matched.length()));
    }

    @Override
    protected Resource resolveResourceFromFile(File file) {
        return new FileSystemResource(file);
    }

    @Override
    protected String getResourceDescription(Resource resource) {
        return resource.getDescription();
    }

    // === 辅助方法 ===

    /**
     * 文件资源使用规范化的绝对路径，其他资源使用 URL
     */
    private String locationOf(Resource resource) throws IOException {
        String location;
        if (isFileResource(resource)) {
            location = "file:" + resource.getFile().toPath().toAbsolutePath().normalize()
                    .toString().replace('\\', '/');
        } else {
            location = resource.getURL().toString();
        }
        return location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
    }

    private boolean isFileResource(Resource resource) {
        try {
            return resource.isFile() || "file".equals(resource.getURL().getProtocol());
        } catch (IOException e) {
            return false;
        }
    }

    public List<String> getLocations() {
        return List.copyOf(locations);
    }

    @Override
    public void destroy() {
        try {
            close();
        } catch (Exception e) {
            log.error("Failed to close SpringResourceTemplateSource", e);
        }
    }
}
