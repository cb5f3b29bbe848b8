package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.exception.TextScriptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ScriptObject 测试")
class ScriptObjectTest {

    public record Point(int x, int y) {
    }

    @Test
    @DisplayName("from 递归转换嵌套的 Map 与 List")
    void testFromConvertsNestedValues() {
        // Given
        Map<String, Object> source = Map.of(
                "user", Map.of("name", "Ann"),
                "tags", List.of("a", Map.of("k", 1)));

        // When
        ScriptObject object = ScriptObject.from(source);

        // Then
        assertThat(object.getValue("user")).isInstanceOf(ScriptObject.class);
        assertThat(((ScriptObject) object.getValue("user")).getValue("name")).isEqualTo("Ann");
        assertThat(object.getValue("tags")).isInstanceOf(ScriptArray.class);
        assertThat(((ScriptArray) object.getValue("tags")).get(1)).isInstanceOf(ScriptObject.class);
    }

    @Test
    @DisplayName("只读成员不能通过 trySetValue 或 put 修改")
    void testReadOnlyMember() {
        ScriptObject object = new ScriptObject();
        object.setValue("a", 1, true);

        assertThat(object.canWrite("a")).isFalse();
        assertThat(object.trySetValue("a", 2)).isFalse();
        assertThatThrownBy(() -> object.put("a", 3)).isInstanceOf(TextScriptException.class);
        assertThat(object.getValue("a")).isEqualTo(1);

        object.setReadOnly("a", false);
        assertThat(object.trySetValue("a", 2)).isTrue();
        assertThat(object.getValue("a")).isEqualTo(2);
    }

    @Test
    @DisplayName("只读对象拒绝任何写入")
    void testReadOnlyObject() {
        ScriptObject object = ScriptObject.from(Map.of("a", 1));
        object.setReadOnly(true);

        assertThat(object.trySetValue("b", 2)).isFalse();
        assertThatThrownBy(() -> object.setValue("b", 2, false)).isInstanceOf(TextScriptException.class);
        assertThatThrownBy(object::clear).isInstanceOf(TextScriptException.class);
    }

    @Test
    @DisplayName("importObject 导入 ScriptObject 时保留只读标记")
    void testImportScriptObject() {
        ScriptObject source = new ScriptObject();
        source.setValue("fixed", 1, true);
        source.setValue("free", 2, false);
        ScriptObject target = new ScriptObject();

        target.importObject(source);

        assertThat(target.getMembers()).containsExactly("fixed", "free");
        assertThat(target.canWrite("fixed")).isFalse();
        assertThat(target.canWrite("free")).isTrue();
    }

    @Test
    @DisplayName("importObject 导入普通 Java 对象的公开属性")
    void testImportPojo() {
        ScriptObject target = new ScriptObject();

        target.importObject(new Point(3, 4));

        assertThat(target.getValue("x")).isEqualTo(3);
        assertThat(target.getValue("y")).isEqualTo(4);
    }

    @Test
    @DisplayName("深复制不共享嵌套对象")
    void testDeepClone() {
        ScriptObject original = ScriptObject.from(Map.of("inner", Map.of("v", 1)));

        ScriptObject copy = original.clone(true);
        ((ScriptObject) copy.getValue("inner")).setValue("v", 2, false);

        assertThat(((ScriptObject) original.getValue("inner")).getValue("v")).isEqualTo(1);
    }

    @Test
    @DisplayName("ScriptArray 的 size 成员")
    void testArraySizeMember() {
        ScriptArray array = ScriptArray.of(List.of(1, 2, 3));

        assertThat(array.getValue(ScriptArray.SIZE_MEMBER)).isEqualTo(3);
        assertThat(array.hasMember("size")).isTrue();
        assertThat(array.canWrite("size")).isFalse();
    }

    @Test
    @DisplayName("toString 输出成员")
    void testToString() {
        ScriptObject object = new ScriptObject();
        object.setValue("a", 1, false);

        assertThat(object.toString()).startsWith("{a: ").endsWith("}");
    }
}
