package com.chih.TextScript.core.runtime.accessors;

import com.chih.TextScript.core.runtime.TemplateContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MapAccessor 测试")
class MapAccessorTest {

    private final TemplateContext context = new TemplateContext();

    private final MapAccessor accessor = MapAccessor.INSTANCE;

    @Test
    @DisplayName("可写 Map 直接写入")
    void testSetWritableMap() {
        // Given
        Map<String, Object> map = new HashMap<>();

        // When
        boolean written = accessor.trySetValue(context, null, map, "a", 1);

        // Then
        assertThat(written).isTrue();
        assertThat(map).containsEntry("a", 1);
        assertThat(accessor.hasMember(context, null, map, "a")).isTrue();
        assertThat(accessor.getValue(context, null, map, "a")).isEqualTo(1);
    }

    @Test
    @DisplayName("JDK 不可变 Map 按类型识别为只读")
    void testJdkReadOnlyMaps() {
        assertThat(MapAccessor.isReadOnly(Map.of())).isTrue();
        assertThat(MapAccessor.isReadOnly(Map.of("a", 1))).isTrue();
        assertThat(MapAccessor.isReadOnly(Map.of("a", 1, "b", 2, "c", 3))).isTrue();
        assertThat(MapAccessor.isReadOnly(Map.copyOf(new HashMap<>(Map.of("a", 1))))).isTrue();
        assertThat(MapAccessor.isReadOnly(Collections.emptyMap())).isTrue();
        assertThat(MapAccessor.isReadOnly(Collections.singletonMap("a", 1))).isTrue();
        assertThat(MapAccessor.isReadOnly(Collections.unmodifiableMap(new HashMap<>()))).isTrue();
        assertThat(MapAccessor.isReadOnly(Collections.unmodifiableSortedMap(new TreeMap<>()))).isTrue();
        assertThat(MapAccessor.isReadOnly(new HashMap<>())).isFalse();
        assertThat(MapAccessor.isReadOnly(new TreeMap<>())).isFalse();

        assertThat(accessor.trySetValue(context, null, Map.of("a", 1), "a", 2)).isFalse();
    }

    @Test
    @DisplayName("自定义只读 Map 在写入时识别")
    void testCustomReadOnlyMap() {
        // Given
        Map<String, Object> custom = new AbstractMap<>() {
            @Override
            public Set<Entry<String, Object>> entrySet() {
                return Set.of();
            }
        };

        // When
        boolean written = accessor.trySetValue(context, null, custom, "a", 1);

        // Then
        assertThat(MapAccessor.isReadOnly(custom)).isFalse();
        assertThat(written).isFalse();
    }

    @Test
    @DisplayName("成员名按字符串列出")
    void testMembers() {
        Map<Object, Object> map = new TreeMap<>(Map.of(1, "x", 2, "y"));

        assertThat(accessor.getMembers(context, null, map)).containsExactly("1", "2");
        assertThat(accessor.getMemberCount(context, null, map)).isEqualTo(2);
    }
}
