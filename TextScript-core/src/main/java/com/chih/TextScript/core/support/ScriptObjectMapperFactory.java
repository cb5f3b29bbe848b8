package com.chih.TextScript.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 模板数据模型使用的 ObjectMapper 工厂
 * <p>
 * JSON 与 YAML 两种映射器采用相同的配置：
 * </p>
 * <ul>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES: false</li>
 *   <li>FAIL_ON_EMPTY_BEANS: false</li>
 *   <li>WRITE_DATES_AS_TIMESTAMPS: disabled，日期按 ISO-8601 输出</li>
 *   <li>USE_BIG_DECIMAL_FOR_FLOATS: enabled，小数在模板中按原样输出</li>
 * </ul>
 *
 * @since 2025/12/16
 */
public class ScriptObjectMapperFactory {

    private ScriptObjectMapperFactory() {
    }

    /**
     * 创建 YAML 映射器，常用于读取模板的数据文件
     *
     * @return 线程安全、可重用的映射器
     */
    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    /**
     * 创建 JSON 映射器
     *
     * @return 线程安全、可重用的映射器
     */
    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        /* LocalDate / LocalDateTime 等时间类型 */
        mapper.registerModule(new JavaTimeModule());

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
