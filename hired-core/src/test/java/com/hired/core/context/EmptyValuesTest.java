package com.hired.core.context;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EmptyValues}.
 */
class EmptyValuesTest {

    @Test
    void isEmpty_leafTypes() {
        assertThat(EmptyValues.isEmpty(null)).isTrue();
        assertThat(EmptyValues.isEmpty("")).isTrue();
        assertThat(EmptyValues.isEmpty("   \n")).isTrue();
        assertThat(EmptyValues.isEmpty(Optional.empty())).isTrue();
        assertThat(EmptyValues.isEmpty(Optional.of(" "))).isTrue();
        assertThat(EmptyValues.isEmpty(new String[] {"", null})).isTrue();

        assertThat(EmptyValues.isEmpty("x")).isFalse();
        assertThat(EmptyValues.isEmpty(0)).isFalse();
        assertThat(EmptyValues.isEmpty(false)).isFalse();
    }

    @Test
    void isEmpty_containersOfEmptyValues() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("a", null);
        nested.put("b", List.of(""));
        nested.put("c", Map.of("d", " "));

        assertThat(EmptyValues.isEmpty(List.of())).isTrue();
        assertThat(EmptyValues.isEmpty(Map.of())).isTrue();
        assertThat(EmptyValues.isEmpty(nested)).isTrue();
        assertThat(EmptyValues.isEmpty(List.of(Map.of("x", 1)))).isFalse();
    }

    @Test
    void prune_removesEmptyLeavesAndKeepsOrder() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", "Acme");
        entry.put("url", "");
        entry.put("highlights", Arrays.asList("first", null, " ", "second"));
        entry.put("location", Map.of("city", ""));
        entry.put("remote", false);

        Object pruned = EmptyValues.prune(entry);

        assertThat(pruned).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) pruned;
        assertThat(map.keySet()).containsExactly("name", "highlights", "remote");
        assertThat(map.get("highlights")).isEqualTo(List.of("first", "second"));
    }

    @Test
    void prune_returnsNullWhenNothingRemains() {
        List<Object> items = new ArrayList<>();
        items.add(null);
        items.add(Map.of("a", ""));

        assertThat(EmptyValues.prune(items)).isNull();
        assertThat(EmptyValues.pruneMap(Map.of("a", ""))).isEmpty();
    }

    @Test
    void prune_unwrapsOptionalsAndArrays() {
        assertThat(EmptyValues.prune(Optional.of("kept"))).isEqualTo("kept");
        assertThat(EmptyValues.prune(new Object[] {"a", "", 3})).isEqualTo(List.of("a", 3));
    }
}
