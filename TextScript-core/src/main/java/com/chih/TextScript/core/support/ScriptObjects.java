package com.chih.TextScript.core.support;

import com.chih.TextScript.core.exception.TextScriptException;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * 把 JSON / YAML 文档或任意 Java 对象转换为模板可用的 {@link ScriptObject}
 * <p>
 * 嵌套的对象与数组分别转为 ScriptObject 与 ScriptArray，模板中可以直接用 {@code a.b[0]} 访问。
 * </p>
 */
public final class ScriptObjects {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper JSON_MAPPER = ScriptObjectMapperFactory.createJsonMapper();

    private static final ObjectMapper YAML_MAPPER = ScriptObjectMapperFactory.createYamlMapper();

    private ScriptObjects() {
    }

    public static ScriptObject fromJson(String json) {
        return read(JSON_MAPPER, json, "JSON");
    }

    public static ScriptObject fromYaml(String yaml) {
        return read(YAML_MAPPER, yaml, "YAML");
    }

    /**
     * 按扩展名选择格式：{@code .yaml}/{@code .yml} 为 YAML，其余按 JSON 读取
     */
    public static ScriptObject fromFile(Path file) {
        ObjectMapper mapper = isYaml(file.getFileName().toString()) ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, Object> values = mapper.readValue(in, MAP_TYPE);
            return values != null ? ScriptObject.from(values) : new ScriptObject();
        } catch (IOException e) {
            throw new TextScriptException("Failed to read model file: " + file, e);
        }
    }

    /**
     * 通过 Jackson 把 POJO 展开为 Map 结构后导入，与 {@link ScriptObject#importObject(Object)} 的区别是
     * 结果不再引用原对象
     */
    public static ScriptObject fromObject(Object value) {
        if (value == null) {
            return new ScriptObject();
        }
        if (value instanceof ScriptObject) {
            return (ScriptObject) value;
        }
        Map<String, Object> values = JSON_MAPPER.convertValue(value, MAP_TYPE);
        return ScriptObject.from(values);
    }

    private static ScriptObject read(ObjectMapper mapper, String text, String format) {
        if (text == null || text.isBlank()) {
            return new ScriptObject();
        }
        try {
            Map<String, Object> values = mapper.readValue(text, MAP_TYPE);
            return values != null ? ScriptObject.from(values) : new ScriptObject();
        } catch (IOException e) {
            throw new TextScriptException("Failed to parse " + format + " model", e);
        }
    }

    private static boolean isYaml(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }
}
