package work.lcod.rlm.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Key-value scratch memory that survives across iterations. Values are restricted to what the state file can
 * hold (null, booleans, numbers, strings, lists and string-keyed maps of those) and are deep-copied on the way
 * in and out, so a stored value only changes through {@link #put}.
 */
public final class ScratchMemory {
    private static final int MAX_DEPTH = 64;

    private final Map<String, Object> values = new LinkedHashMap<>();

    public static ScratchMemory fromPersisted(Map<?, ?> persisted) {
        ScratchMemory memory = new ScratchMemory();
        if (persisted != null) {
            persisted.forEach((k, v) -> memory.put(String.valueOf(k), v));
        }
        return memory;
    }

    public Object get(String key) {
        return copy(values.get(key), 0);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public void put(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("memory keys must be strings");
        }
        values.put(key, copy(value, 0));
    }

    public boolean remove(String key) {
        if (!values.containsKey(key)) {
            return false;
        }
        values.remove(key);
        return true;
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /** Deep copy suitable for serialization. */
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k, copy(v, 0)));
        return copy;
    }

    /**
     * Deep-copies a JSON-compatible value, rejecting anything the state file could not round-trip.
     */
    static Object copy(Object value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("memory value nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Double
            || value instanceof BigInteger || value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("memory maps must use string keys");
                }
                copy.put(key, copy(entry.getValue(), depth + 1));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copy(item, depth + 1));
            }
            return copy;
        }
        throw new IllegalArgumentException(
            "memory values must be JSON-compatible, got " + value.getClass().getSimpleName()
        );
    }
}
