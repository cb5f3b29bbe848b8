package com.chih.TextScript.core.functions;

import com.chih.TextScript.core.Template;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("math 函数测试")
class MathFunctionsTest {

    private static String render(String text) {
        return Template.parse(text).render(Map.of());
    }

    @Test
    @DisplayName("四则运算与运算符结果一致")
    void testArithmetic() {
        assertThat(render("{{ 1 | math.plus 2 }}")).isEqualTo("3");
        assertThat(render("{{ 5 | math.minus 7 }}")).isEqualTo("-2");
        assertThat(render("{{ 3 | math.times 1.5 }}")).isEqualTo("4.5");
        assertThat(render("{{ 7 | math.modulo 4 }}")).isEqualTo("3");
        assertThat(render("{{ -4 | math.abs }}")).isEqualTo("4");
    }

    @Test
    @DisplayName("divided_by 除数为整数时向下取整")
    void testDividedBy() {
        assertThat(render("{{ 7 | math.divided_by 2 }}")).isEqualTo("3");
        assertThat(render("{{ 7 | math.divided_by 2.0 }}")).isEqualTo("3.5");
    }

    @Test
    @DisplayName("round 使用银行家舍入")
    void testRound() {
        assertThat(render("{{ 2.5 | math.round }}")).isEqualTo("2");
        assertThat(render("{{ 3.14159 | math.round 2 }}")).isEqualTo("3.14");
        assertThat(MathFunctions.round(0.125, 2)).isEqualTo(0.12);
        assertThat(MathFunctions.round(Double.NaN, 2)).isNaN();
    }
}
