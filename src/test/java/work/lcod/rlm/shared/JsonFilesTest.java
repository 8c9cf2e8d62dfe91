package work.lcod.rlm.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonFilesTest {
    @Test
    void keysAreSorted() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("zeta", 1);
        value.put("alpha", Map.of("b", 2, "a", 1));
        assertEquals("{\"alpha\":{\"a\":1,\"b\":2},\"zeta\":1}", JsonFiles.toLine(value));
    }

    @Test
    void atomicWriteLeavesNoTempFile() throws Exception {
        Path dir = Files.createTempDirectory("rlm-json");
        Path target = dir.resolve("nested/state.json");

        JsonFiles.writeAtomically(target, Map.of("iteration", 3));

        assertEquals(3, JsonFiles.readObject(target).get("iteration"));
        assertFalse(Files.exists(dir.resolve("nested/state.json.tmp")));
    }

    @Test
    void readLinesSkipsBlankAndNonObjectRows() throws Exception {
        Path file = Files.createTempDirectory("rlm-json").resolve("rows.jsonl");
        Files.writeString(file, "{\"a\":1}\n\n[1,2]\n{\"a\":2}\n");

        List<Map<String, Object>> rows = JsonFiles.readLines(file);

        assertEquals(2, rows.size());
        assertEquals(2, rows.get(1).get("a"));
    }

    @Test
    void readObjectRejectsArrays() throws Exception {
        Path file = Files.createTempDirectory("rlm-json").resolve("array.json");
        Files.writeString(file, "[]");
        assertThrows(IllegalStateException.class, () -> JsonFiles.readObject(file));
    }

    @Test
    void sha256IsLowerHex() {
        assertEquals(
            "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
            Hashing.sha256("")
        );
    }
}
