package com.hired.core.context;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Emptiness predicates and recursive pruning of optional resume data.
 *
 * <p>Both operations are total: any input, however nested, produces a result.
 * <ul>
 *   <li>{@code null} is empty</li>
 *   <li>strings are empty when blank</li>
 *   <li>collections, arrays and maps are empty when every element/value is empty</li>
 *   <li>{@link Optional} is empty when absent or wrapping an empty value</li>
 *   <li>any other value (numbers, booleans, dates) is never empty</li>
 * </ul>
 */
public final class EmptyValues {

    private EmptyValues() {
        // Utility class
    }

    /**
     * Tests whether a value carries no renderable content.
     *
     * @param value value to test
     * @return true if the value is absent or contains only empty values
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(EmptyValues::isEmpty).orElse(true);
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().allMatch(EmptyValues::isEmpty);
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().allMatch(EmptyValues::isEmpty);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (!isEmpty(Array.get(value, i))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Recursively removes empty leaves from a value.
     *
     * <p>Maps keep their key order and become {@link LinkedHashMap}s; collections
     * and arrays become lists; {@link Optional}s are unwrapped.
     *
     * @param value value to prune
     * @return pruned value, or {@code null} if nothing remains
     */
    public static Object prune(Object value) {
        if (isEmpty(value)) {
            return null;
        }
        if (value instanceof Optional<?> optional) {
            return prune(optional.orElse(null));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> pruned = new LinkedHashMap<>();
            map.forEach((key, child) -> {
                Object prunedChild = prune(child);
                if (prunedChild != null) {
                    pruned.put(String.valueOf(key), prunedChild);
                }
            });
            return pruned.isEmpty() ? null : pruned;
        }
        if (value instanceof Collection<?> collection) {
            return pruneAll(collection);
        }
        if (value.getClass().isArray()) {
            List<Object> items = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                items.add(Array.get(value, i));
            }
            return pruneAll(items);
        }
        return value;
    }

    /**
     * Prunes a map, returning an empty map rather than {@code null}.
     *
     * @param map map to prune
     * @return pruned map, possibly empty
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> pruneMap(Map<String, ?> map) {
        Object pruned = prune(map);
        return pruned instanceof Map<?, ?> ? (Map<String, Object>) pruned : new LinkedHashMap<>();
    }

    private static List<Object> pruneAll(Collection<?> items) {
        List<Object> pruned = new ArrayList<>();
        for (Object item : items) {
            Object prunedItem = prune(item);
            if (prunedItem != null) {
                pruned.add(prunedItem);
            }
        }
        return pruned.isEmpty() ? null : pruned;
    }
}
