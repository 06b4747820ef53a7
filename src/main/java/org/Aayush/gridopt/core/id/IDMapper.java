package org.Aayush.gridopt.core.id;

import lombok.experimental.StandardException;

import java.util.Map;

/**
 * Mapping from stable node keys (for example {@code north-plant}) to dense integer node ids.
 */
public interface IDMapper {

    /**
     * Converts a node key to its dense id.
     * @param key The stable node key.
     * @return The dense node id.
     * @throws UnknownKeyException If the key is not mapped.
     */
    int toInternal(String key) throws UnknownKeyException;

    /**
     * Exception thrown when a node key cannot be found in the mapping.
     */
    @StandardException
    class UnknownKeyException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation.
     *
     * @param mappings key to id, ids must be a dense range from 0 to size-1.
     * @return an immutable mapper.
     */
    static IDMapper createImmutable(Map<String, Integer> mappings) {
        return new FastUtilIDMapper(mappings);
    }
}
