package com.chih.TextScript.core.support;

import com.chih.TextScript.core.exception.TextScriptException;
import com.chih.TextScript.core.runtime.ScriptArray;
import com.chih.TextScript.core.runtime.ScriptObject;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * 数据模型读取与 ObjectMapper 配置
 */
@DisplayName("ScriptObjects 测试")
class ScriptObjectsTest {

    public record Invoice(String number, LocalDate date) {
    }

    @Test
    @DisplayName("ObjectMapper 配置验证")
    void testMapperConfiguration() {
        ObjectMapper yaml = ScriptObjectMapperFactory.createYamlMapper();
        ObjectMapper json = ScriptObjectMapperFactory.createJsonMapper();

        assertThat(yaml.getFactory()).isInstanceOf(YAMLFactory.class);
        assertThat(json.getFactory()).isNotInstanceOf(YAMLFactory.class);
        for (ObjectMapper mapper : new ObjectMapper[]{yaml, json}) {
            assertThat(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)).isFalse();
            assertThat(mapper.isEnabled(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)).isTrue();
            assertThat(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)).isFalse();
        }
    }

    @Test
    @DisplayName("JSON 嵌套结构转为 ScriptObject / ScriptArray")
    void testFromJson() {
        String json = """
                {"user": {"name": "Ann", "tags": ["a", "b"]}, "price": 9.90}
                """;

        ScriptObject model = ScriptObjects.fromJson(json);

        ScriptObject user = (ScriptObject) model.getValue("user");
        assertThat(user.getValue("name")).isEqualTo("Ann");
        assertThat(user.getValue("tags")).isInstanceOf(ScriptArray.class);
        assertThat(model.getValue("price")).isEqualTo(new BigDecimal("9.90"));
    }

    @Test
    @DisplayName("YAML 文档")
    void testFromYaml() {
        String yaml = """
                site:
                  title: Home
                  pages:
                    - index
                    - about
                """;

        ScriptObject model = ScriptObjects.fromYaml(yaml);

        ScriptObject site = (ScriptObject) model.getValue("site");
        assertThat(site.getValue("title")).isEqualTo("Home");
        assertThat((ScriptArray) site.getValue("pages")).containsExactly("index", "about");
    }

    @Test
    @DisplayName("空文本得到空对象")
    void testBlankText() {
        assertThat(ScriptObjects.fromJson("  ")).isEmpty();
        assertThat(ScriptObjects.fromYaml(null)).isEmpty();
    }

    @Test
    @DisplayName("格式错误时抛出 TextScriptException")
    void testInvalidJson() {
        assertThatThrownBy(() -> ScriptObjects.fromJson("{broken"))
                .isInstanceOf(TextScriptException.class)
                .hasMessageContaining("JSON");
    }

    @Test
    @DisplayName("按扩展名读取数据文件")
    void testFromFile(@TempDir Path tempDir) throws IOException {
        Path yamlFile = tempDir.resolve("model.yml");
        Files.writeString(yamlFile, "name: yaml\n");
        Path jsonFile = tempDir.resolve("model.json");
        Files.writeString(jsonFile, "{\"name\": \"json\"}");

        assertThat(ScriptObjects.fromFile(yamlFile).getValue("name")).isEqualTo("yaml");
        assertThat(ScriptObjects.fromFile(jsonFile).getValue("name")).isEqualTo("json");
        assertThatThrownBy(() -> ScriptObjects.fromFile(tempDir.resolve("missing.json")))
                .isInstanceOf(TextScriptException.class);
    }

    @Test
    @DisplayName("POJO 展开为独立的 ScriptObject，日期按 ISO-8601")
    void testFromObject() {
        ScriptObject model = ScriptObjects.fromObject(new Invoice("N-1", LocalDate.of(2025, 12, 7)));

        assertThat(model.getValue("number")).isEqualTo("N-1");
        assertThat(model.getValue("date")).isEqualTo("2025-12-07");
        assertThat(ScriptObjects.fromObject(null)).isEmpty();
    }
}
