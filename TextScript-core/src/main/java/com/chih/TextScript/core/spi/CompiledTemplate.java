package com.chih.TextScript.core.spi;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.runtime.TemplateLoader;

import java.util.Collections;
import java.util.Set;

/**
 * 编译后的模板，附带渲染 include 时使用的加载器以及静态分析得到的依赖
 *
 * @since 2025/12/16
 */
public class CompiledTemplate {

    private final String key;

    private final Template template;

    private final TemplateLoader loader;

    // include 的模板 key (只包含以字面量字符串给出的名称)
    private final Set<String> dependencies;

    public CompiledTemplate(String key, Template template, TemplateLoader loader, Set<String> dependencies) {
        this.key = key;
        this.template = template;
        this.loader = loader;
        this.dependencies = dependencies != null ? dependencies : Collections.emptySet();
    }

    public String getKey() {
        return key;
    }

    public Template getTemplate() {
        return template;
    }

    public TemplateLoader getLoader() {
        return loader;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }
}
