package com.statassist.rag.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextValueTest {

    @Test
    void nullFactoriesCollapseToNullValue() {
        assertThat(ContextValue.of((String) null).isNull()).isTrue();
        assertThat(ContextValue.of((Number) null)).isSameAs(ContextValue.nullValue());
    }

    @Test
    void accessorRejectsWrongKind() {
        ContextValue text = ContextValue.of("abc");

        assertThat(text.getKind()).isEqualTo(ContextValue.Kind.TEXT);
        assertThatThrownBy(text::asNumber).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void serialisesAsPlainJson() throws Exception {
        Map<String, ContextValue> entries = new LinkedHashMap<>();
        entries.put("count", ContextValue.of(3));
        entries.put("strong", ContextValue.of(true));
        entries.put("tags", ContextValue.of(List.of(ContextValue.of("a"), ContextValue.nullValue())));

        String json = new ObjectMapper().writeValueAsString(ContextValue.of(entries));

        assertThat(json).isEqualTo("{\"count\":3,\"strong\":true,\"tags\":[\"a\",null]}");
    }

    @Test
    void numberTableNestsMaps() {
        Map<String, Map<String, Double>> table = Map.of("x", Map.of("x", 1.0));

        ContextValue value = ContextValue.ofNumberTable(table);

        assertThat(value.asMap().get("x").asMap().get("x").asNumber()).isEqualTo(1.0);
    }
}
