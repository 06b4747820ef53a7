package org.Aayush.gridopt.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Map;

/**
 * Immutable key mapper backed by a fastutil open hash map.
 * Safe for concurrent readers once constructed.
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;

    /**
     * Builds the mapper, requiring dense 0-indexed ids and non-blank unique keys.
     */
    public FastUtilIDMapper(Map<String, Integer> mappings) {
        if (mappings == null) {
            throw new IllegalArgumentException("Mappings cannot be null");
        }
        int size = mappings.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        String[] reverse = new String[size];

        for (Map.Entry<String, Integer> entry : mappings.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Node keys must be non-blank");
            }
            int value = checkedValue(entry, size, reverse);
            forward.put(key, value);
            reverse[value] = key;
        }
        forward.trim();
    }

    private static int checkedValue(Map.Entry<String, Integer> entry, int size, String[] reverse) {
        Integer boxed = entry.getValue();
        if (boxed == null) {
            throw new IllegalArgumentException("Node id missing for key: " + entry.getKey());
        }
        int value = boxed;
        if (value < 0 || value >= size) {
            throw new IllegalArgumentException(
                    "Node ids must be dense and 0-indexed. Found out of bounds: " + value
            );
        }
        if (reverse[value] != null) {
            throw new IllegalArgumentException("Duplicate node id detected in input map: " + value);
        }
        return value;
    }

    @Override
    public int toInternal(String key) throws UnknownKeyException {
        int id = forward.getInt(key);
        if (id == MISSING) {
            throw new UnknownKeyException("Node key not found: " + key);
        }
        return id;
    }
}
