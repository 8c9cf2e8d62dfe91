package work.lcod.rlm.subcall;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of the subcall cache log.
 */
public record CacheEntry(
    String requestHash,
    String provider,
    String prompt,
    String responseHash,
    String responseText,
    String cachedAt
) {
    Map<String, Object> toRecord() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("prompt", prompt);
        request.put("provider", provider);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("cached_at", cachedAt);
        record.put("provider", provider);
        record.put("request", request);
        record.put("request_hash", requestHash);
        record.put("response_hash", responseHash);
        record.put("response_text", responseText);
        return record;
    }

    static CacheEntry fromRecord(Map<String, Object> record) {
        Object hash = record.get("request_hash");
        Object text = record.get("response_text");
        if (!(hash instanceof String requestHash) || requestHash.isBlank() || !(text instanceof String responseText)) {
            return null;
        }
        String prompt = null;
        if (record.get("request") instanceof Map<?, ?> request && request.get("prompt") instanceof String value) {
            prompt = value;
        }
        return new CacheEntry(
            requestHash,
            record.get("provider") == null ? null : String.valueOf(record.get("provider")),
            prompt,
            record.get("response_hash") == null ? null : String.valueOf(record.get("response_hash")),
            responseText,
            record.get("cached_at") == null ? null : String.valueOf(record.get("cached_at"))
        );
    }
}
