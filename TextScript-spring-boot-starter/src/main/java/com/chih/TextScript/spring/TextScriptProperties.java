package com.chih.TextScript.spring;

import com.chih.TextScript.core.engine.TemplateManager;
import com.chih.TextScript.core.runtime.TemplateContext;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * TextScript 配置
 *
 * @since 2025/12/17
 */
@ConfigurationProperties(prefix = "text-script")
public class TextScriptProperties {

    private boolean enabled = true;

    /**
     * 模板根目录列表，目录下的模板递归加载，key 为相对根目录的路径去掉扩展名
     * 支持 classpath: (只读) 和 file: (支持热更新)
     */
    private List<String> locations = new ArrayList<>();

    /**
     * 热更新防抖延迟 (毫秒)
     */
    private long debounceMillis = 500;

    /**
     * 是否监听 file: 目录的变更
     */
    private boolean watch = true;

    /**
     * 按 Liquid 语法解析模板
     */
    private boolean liquid;

    private long cacheMaxSize = TemplateManager.DEFAULT_MAXIMUM_SIZE;

    private Duration cacheExpireAfterAccess = TemplateManager.DEFAULT_EXPIRE_AFTER_ACCESS;

    /**
     * 访问 null 的成员时返回 null，关闭后抛出异常
     */
    private boolean relaxedMemberAccess = true;

    /**
     * 读取未定义的变量时抛出异常
     */
    private boolean strictVariables;

    private int loopLimit = TemplateContext.DEFAULT_LOOP_LIMIT;

    private int recursiveLimit = TemplateContext.DEFAULT_RECURSIVE_LIMIT;

    public TextScriptProperties() {
        locations.add("classpath:templates/");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public void setDebounceMillis(long debounceMillis) {
        this.debounceMillis = debounceMillis;
    }

    public boolean isWatch() {
        return watch;
    }

    public void setWatch(boolean watch) {
        this.watch = watch;
    }

    public boolean isLiquid() {
        return liquid;
    }

    public void setLiquid(boolean liquid) {
        this.liquid = liquid;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public void setCacheMaxSize(long cacheMaxSize) {
        this.cacheMaxSize = cacheMaxSize;
    }

    public Duration getCacheExpireAfterAccess() {
        return cacheExpireAfterAccess;
    }

    public void setCacheExpireAfterAccess(Duration cacheExpireAfterAccess) {
        this.cacheExpireAfterAccess = cacheExpireAfterAccess;
    }

    public boolean isRelaxedMemberAccess() {
        return relaxedMemberAccess;
    }

    public void setRelaxedMemberAccess(boolean relaxedMemberAccess) {
        this.relaxedMemberAccess = relaxedMemberAccess;
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    public void setStrictVariables(boolean strictVariables) {
        this.strictVariables = strictVariables;
    }

    public int getLoopLimit() {
        return loopLimit;
    }

    public void setLoopLimit(int loopLimit) {
        this.loopLimit = loopLimit;
    }

    public int getRecursiveLimit() {
        return recursiveLimit;
    }

    public void setRecursiveLimit(int recursiveLimit) {
        this.recursiveLimit = recursiveLimit;
    }
}
