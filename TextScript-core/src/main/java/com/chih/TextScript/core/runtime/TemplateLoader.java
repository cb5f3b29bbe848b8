package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.parsing.SourceSpan;

import java.util.List;

/**
 * include 使用的模板加载器
 */
public interface TemplateLoader {

    /**
     * 把 include 中的模板名解析为加载路径，找不到时返回 null
     *
     * @param callerSpan include 调用所在位置
     */
    String getPath(TemplateContext context, SourceSpan callerSpan, String templateName);

    /**
     * 读取模板文本
     */
    String load(TemplateContext context, SourceSpan callerSpan, String templatePath);

    default boolean pathExists(TemplateContext context, SourceSpan callerSpan, String path, PathType type) {
        return false;
    }

    default List<String> enumerate(TemplateContext context, SourceSpan callerSpan, String path, PathType type) {
        return List.of();
    }
}
