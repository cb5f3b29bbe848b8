package com.chih.TextScript.core.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * 模板文件的通用处理：扩展名判断、模板 key 的生成以及文本读取
 * <p>
 * 模板 key 为相对模板根目录的路径，使用 {@code /} 分隔并去掉扩展名，例如 {@code mail/welcome.tss} 的 key 为
 * {@code mail/welcome}，在模板中即可 {@code include "mail/welcome"}。
 * </p>
 *
 * @since 2025/12/16
 */
public final class TemplateResources {

    /**
     * 支持的模板扩展名
     */
    public static final List<String> SUPPORTED_EXTENSIONS = List.of(".tss", ".liquid", ".txt");

    private static final char BOM = '\uFEFF';

    private TemplateResources() {
    }

    /**
     * 判断文件是否为支持的模板文件，忽略大小写；以 {@code .} 开头或以 {@code ~} 结尾的临时文件不算
     */
    public static boolean isSupportedFile(String filename) {
        if (filename == null) {
            return false;
        }
        String name = simpleName(filename);
        if (name.startsWith(".") || name.endsWith("~")) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    /**
     * 由相对路径生成模板 key
     *
     * @param relativePath 相对模板根目录的路径，可以使用 {@code \} 分隔
     */
    public static String toKey(String relativePath) {
        String key = relativePath.replace('\\', '/');
        while (key.startsWith("/")) {
            key = key.substring(1);
        }
        return stripExtension(key);
    }

    public static String stripExtension(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String extension : SUPPORTED_EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return path.substring(0, path.length() - extension.length());
            }
        }
        return path;
    }

    /**
     * 以 UTF-8 读取全部文本并去掉开头的 BOM，不关闭输入流
     */
    public static String readText(InputStream in) throws IOException {
        String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            return text.substring(1);
        }
        return text;
    }

    private static String simpleName(String path) {
        int lastSlash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
    }
}
