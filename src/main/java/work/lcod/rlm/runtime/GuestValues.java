package work.lcod.rlm.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;

/**
 * Conversions between guest (JavaScript) values and the JSON-compatible Java values kept in runtime state.
 */
final class GuestValues {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_DEPTH = 64;

    private GuestValues() {}

    static Object toJava(Value value) {
        return toJava(value, 0);
    }

    private static Object toJava(Value value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("value nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isProxyObject() && value.asProxyObject() instanceof MemoryProxy memory) {
            return memory.snapshot();
        }
        if (value.canExecute()) {
            throw new IllegalArgumentException("functions cannot be stored or finalized");
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toJava(value.getArrayElement(i), depth + 1));
            }
            return list;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                Value member = value.getMember(key);
                if (member != null && member.canExecute()) {
                    continue;
                }
                map.put(key, toJava(member, depth + 1));
            }
            return map;
        }
        return value.toString();
    }

    /**
     * Builds a plain guest value (object, array or primitive) from a JSON-compatible Java value, so step code
     * never receives host objects.
     */
    static Value toGuest(Context context, Object value) {
        if (value == null) {
            return context.eval("js", "null");
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Number) {
            return context.asValue(value);
        }
        try {
            String serialized = JSON.writeValueAsString(value);
            return context.eval("js", "JSON").getMember("parse").execute(serialized);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("value is not JSON-compatible: " + ex.getOriginalMessage(), ex);
        }
    }
}
