package work.lcod.rlm.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical (sorted-key) JSON reading and writing for every persisted file of a run.
 */
public final class JsonFiles {
    public static final ObjectMapper CANONICAL = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();
    private static final ObjectWriter PRETTY = CANONICAL.writerWithDefaultPrettyPrinter();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonFiles() {}

    /** Pretty, sorted JSON followed by a newline. */
    public static String toPrettyJson(Object value) {
        try {
            return PRETTY.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    /** Compact, sorted JSON on a single line (no trailing newline). */
    public static String toLine(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    public static void writePretty(Path path, Object value) {
        try {
            createParents(path);
            Files.writeString(path, toPrettyJson(value), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write " + path, ex);
        }
    }

    /**
     * Writes the whole document to a sibling temp file and moves it into place, so readers never observe a
     * half-written state file.
     */
    public static void writeAtomically(Path path, Object value) {
        try {
            createParents(path);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, toPrettyJson(value), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write " + path, ex);
        }
    }

    public static void appendLine(Path path, Object value) {
        try {
            createParents(path);
            Files.writeString(
                path,
                toLine(value) + "\n",
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to append to " + path, ex);
        }
    }

    public static Map<String, Object> readObject(Path path) {
        try {
            Object parsed = CANONICAL.readValue(path.toFile(), Object.class);
            if (!(parsed instanceof Map<?, ?> map)) {
                throw new IllegalStateException("Expected JSON object in " + path);
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + path, ex);
        }
    }

    /** Reads a newline-delimited JSON file, skipping blank lines and non-object rows. */
    public static List<Map<String, Object>> readLines(Path path) {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                Object parsed = CANONICAL.readValue(trimmed, Object.class);
                if (parsed instanceof Map<?, ?>) {
                    rows.add(CANONICAL.convertValue(parsed, MAP_TYPE));
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + path, ex);
        }
        return rows;
    }

    private static void createParents(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
