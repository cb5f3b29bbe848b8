package com.chih.TextScript.core.spi;

import com.chih.TextScript.core.runtime.TemplateLoader;

import java.util.Collections;
import java.util.Map;

/**
 * 模板引擎 SPI
 * <p>
 * 编译与渲染分离：编译只在加载或热更新时发生，渲染阶段不再解析源码。
 * </p>
 *
 * @since 2025/12/16
 */
public interface TemplateEngine {

    /**
     * 编译阶段：把模板源码解析为可执行对象
     *
     * @param key    模板 key，用作错误信息中的文件名
     * @param text   模板源码
     * @param loader include 使用的加载器，为 null 时模板中不能使用 include
     * @return 编译结果
     */
    CompiledTemplate compile(String key, String text, TemplateLoader loader);

    /**
     * 渲染阶段：以 variables 作为全局变量执行编译好的模板
     *
     * @param compiled  {@link #compile} 的返回值
     * @param variables 变量上下文，可以为 null
     * @return 渲染结果
     */
    String render(CompiledTemplate compiled, Map<String, Object> variables);

    /**
     * 求值模板的 front matter，返回其中定义的变量；没有 front matter 时返回空 Map
     */
    default Map<String, Object> evaluateFrontMatter(CompiledTemplate compiled) {
        return Collections.emptyMap();
    }
}
