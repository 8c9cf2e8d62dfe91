package work.lcod.rlm.bundle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record of the chunk stream.
 */
public record Chunk(String chunkId, String source, int lineStart, int lineEnd, String text, int charCount, String hash) {
    public Chunk {
        Objects.requireNonNull(chunkId, "chunkId");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(text, "text");
    }

    public Map<String, Object> range() {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("line_end", lineEnd);
        range.put("line_start", lineStart);
        return range;
    }

    Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("char_count", charCount);
        record.put("chunk_id", chunkId);
        record.put("hash", hash);
        record.put("range", range());
        record.put("source", source);
        record.put("text", text);
        return record;
    }

    static Chunk fromRecord(Map<String, Object> record, int ordinal) {
        Object rawId = record.get("chunk_id");
        String chunkId = rawId == null ? BundleBuilder.formatChunkId(ordinal) : String.valueOf(rawId);
        String text = record.get("text") == null ? "" : String.valueOf(record.get("text"));
        int lineStart = 0;
        int lineEnd = 0;
        if (record.get("range") instanceof Map<?, ?> range) {
            lineStart = asInt(range.get("line_start"));
            lineEnd = asInt(range.get("line_end"));
        }
        Object charCount = record.get("char_count");
        return new Chunk(
            chunkId,
            record.get("source") == null ? "" : String.valueOf(record.get("source")),
            lineStart,
            lineEnd,
            text,
            charCount instanceof Number n ? n.intValue() : text.codePointCount(0, text.length()),
            record.get("hash") == null ? null : String.valueOf(record.get("hash"))
        );
    }

    private static int asInt(Object raw) {
        return raw instanceof Number number ? number.intValue() : 0;
    }
}
