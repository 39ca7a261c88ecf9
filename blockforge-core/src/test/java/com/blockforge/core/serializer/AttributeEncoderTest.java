package com.blockforge.core.serializer;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AttributeEncoder}.
 */
class AttributeEncoderTest {

    @Test
    void encode_nullOrEmpty_returnsEmptyString() {
        assertThat(AttributeEncoder.encode(null)).isEmpty();
        assertThat(AttributeEncoder.encode(Map.of())).isEmpty();
    }

    @Test
    void encode_dropsNullAndEmptyStringValues() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("url", null);
        attributes.put("alt", "");
        attributes.put("align", "center");

        assertThat(AttributeEncoder.encode(attributes)).isEqualTo("{\"align\":\"center\"}");
    }

    @Test
    void encode_onlyEmptyValues_returnsEmptyString() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("url", null);
        attributes.put("alt", "");

        assertThat(AttributeEncoder.encode(attributes)).isEmpty();
    }

    @Test
    void encode_keepsFalseAndZero() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("isStackedOnMobile", false);
        attributes.put("dimRatio", 0);

        assertThat(AttributeEncoder.encode(attributes)).isEqualTo("{\"dimRatio\":0,\"isStackedOnMobile\":false}");
    }

    @Test
    void encode_isIndependentOfInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 1);
        first.put("a", Map.of("y", 2, "x", 1));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", Map.of("x", 1, "y", 2));
        second.put("b", 1);

        assertThat(AttributeEncoder.encode(first))
            .isEqualTo(AttributeEncoder.encode(second))
            .isEqualTo("{\"a\":{\"x\":1,\"y\":2},\"b\":1}");
    }

    @Test
    void encode_prunesNestedNulls() {
        Map<String, Object> padding = new HashMap<>();
        padding.put("top", "10px");
        padding.put("bottom", null);

        String json = AttributeEncoder.encode(Map.of(
            "style", Map.of("spacing", Map.of("padding", padding)),
            "list", Arrays.asList("a", null, "b")));

        assertThat(json).isEqualTo("{\"list\":[\"a\",\"b\"],\"style\":{\"spacing\":{\"padding\":{\"top\":\"10px\"}}}}");
    }

    @Test
    void encode_escapesStrings() {
        assertThat(AttributeEncoder.encode(Map.of("text", "Say \"hi\"")))
            .isEqualTo("{\"text\":\"Say \\\"hi\\\"\"}");
    }

    @Test
    void encode_nonJsonValue_usesStringForm() {
        assertThat(AttributeEncoder.encode(Map.of("items", List.of(new StringBuilder("x")))))
            .isEqualTo("{\"items\":[\"x\"]}");
    }
}
