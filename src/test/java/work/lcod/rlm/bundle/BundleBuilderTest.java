package work.lcod.rlm.bundle;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.rlm.shared.JsonFiles;
import work.lcod.rlm.support.RlmTestSupport;
import work.lcod.rlm.task.Task;
import work.lcod.rlm.task.TaskLoader;

final class BundleBuilderTest {
    @Test
    void buildsSortedFilteredBundle() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Task task = parse(RlmTestSupport.task("demo", "baseline", List.of()));

        BuildSummary summary = BundleBuilder.build(task, workspace, workspace.resolve("bundles"));

        assertEquals(2, summary.sourceCount());
        assertEquals(5, summary.chunkCount());
        Bundle bundle = Bundle.load(summary.bundleDir());
        assertEquals(List.of("docs/alpha.md", "docs/beta.md"), bundle.sources());
        assertEquals("00000001", bundle.chunks().get(0).chunkId());
        assertEquals("# Alpha\n", bundle.chunks().get(0).text());
        assertEquals(3, bundle.chunk("00000003").lineStart());
        assertEquals("demo", bundle.taskId());
        assertTrue(Files.isRegularFile(summary.bundleDir().resolve(BundleBuilder.META_FILE)));
    }

    @Test
    void rebuildIsByteIdentical() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Task task = parse(RlmTestSupport.task("demo", "baseline", List.of()));

        BuildSummary first = BundleBuilder.build(task, workspace, workspace.resolve("bundles"));
        byte[] manifest = Files.readAllBytes(first.bundleDir().resolve(BundleBuilder.MANIFEST_FILE));
        byte[] chunks = Files.readAllBytes(first.bundleDir().resolve(BundleBuilder.CHUNKS_FILE));
        String fingerprint = Bundle.fingerprint(first.bundleDir());

        BuildSummary second = BundleBuilder.build(task, workspace, workspace.resolve("bundles"));

        assertArrayEquals(manifest, Files.readAllBytes(second.bundleDir().resolve(BundleBuilder.MANIFEST_FILE)));
        assertArrayEquals(chunks, Files.readAllBytes(second.bundleDir().resolve(BundleBuilder.CHUNKS_FILE)));
        assertEquals(fingerprint, Bundle.fingerprint(second.bundleDir()));
        assertEquals(first.manifestSha256(), second.manifestSha256());
    }

    @Test
    void fingerprintChangesWithSourceContent() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Task task = parse(RlmTestSupport.task("demo", "baseline", List.of()));
        String before = Bundle.fingerprint(BundleBuilder.build(task, workspace, workspace.resolve("b")).bundleDir());

        Files.writeString(workspace.resolve("docs/beta.md"), "# Beta\nchanged\n");
        String after = Bundle.fingerprint(BundleBuilder.build(task, workspace, workspace.resolve("b")).bundleDir());

        assertFalse(before.equals(after));
    }

    @Test
    void overlappingSourcesAreDeduplicated() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        Map<String, Object> file = new LinkedHashMap<>();
        file.put("type", "file");
        file.put("path", "docs/alpha.md");
        castList(raw.get("context_sources")).add(file);

        BuildSummary summary = BundleBuilder.build(parse(raw), workspace, workspace.resolve("bundles"));

        assertEquals(2, summary.sourceCount());
    }

    @Test
    void excludeWinsOverInclude() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        Map<String, Object> source = castMap(castList(raw.get("context_sources")).get(0));
        source.put("include", List.of("*"));
        source.put("exclude", List.of("*.md"));

        BuildSummary summary = BundleBuilder.build(parse(raw), workspace, workspace.resolve("bundles"));

        assertEquals(List.of("docs/notes.txt"), Bundle.load(summary.bundleDir()).sources());
    }

    @Test
    void emptyFileYieldsOneEmptyChunk() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Files.writeString(workspace.resolve("docs/empty.md"), "");
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        castMap(castList(raw.get("context_sources")).get(0)).put("include", List.of("*empty.md"));

        Bundle bundle = Bundle.load(BundleBuilder.build(parse(raw), workspace, workspace.resolve("b")).bundleDir());

        assertEquals(1, bundle.chunks().size());
        assertEquals("", bundle.chunks().get(0).text());
        assertEquals(1, bundle.chunks().get(0).lineStart());
    }

    @Test
    void undecodableBytesAreReplaced() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Files.write(workspace.resolve("docs/latin1.md"), new byte[] {'c', 'a', 'f', (byte) 0xE9, '\n'});
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        castMap(castList(raw.get("context_sources")).get(0)).put("include", List.of("*latin1.md"));

        Bundle bundle = Bundle.load(BundleBuilder.build(parse(raw), workspace, workspace.resolve("b")).bundleDir());

        assertEquals("caf\uFFFD\n", bundle.chunks().get(0).text());
    }

    @Test
    void longLinesAreWindowed() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Files.writeString(workspace.resolve("docs/long.md"), "abcdefghij\n");
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        castMap(castList(raw.get("context_sources")).get(0)).put("include", List.of("*long.md"));
        castMap(raw.get("bundle")).put("max_chars", 4);

        Bundle bundle = Bundle.load(BundleBuilder.build(parse(raw), workspace, workspace.resolve("b")).bundleDir());

        assertEquals(List.of("abcd", "efgh", "ij\n"), bundle.chunks().stream().map(Chunk::text).toList());
        assertTrue(bundle.chunks().stream().allMatch(chunk -> chunk.lineStart() == 1 && chunk.lineEnd() == 1));
    }

    @Test
    void unknownStrategyFailsBeforeTouchingDisk() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        castMap(raw.get("bundle")).put("chunking_strategy", "by_tokens");
        Path output = workspace.resolve("bundles");

        var ex = assertThrows(BundleException.class, () -> BundleBuilder.build(parse(raw), workspace, output));

        assertTrue(ex.getMessage().contains("by_tokens"));
        assertFalse(Files.exists(output));
    }

    @Test
    void zeroResolvedFilesIsAnError() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        castMap(castList(raw.get("context_sources")).get(0)).put("include", List.of("*.rst"));

        assertThrows(BundleException.class, () -> BundleBuilder.build(parse(raw), workspace, workspace.resolve("b")));
    }

    @Test
    void missingSourceDirectoryIsAnError() throws Exception {
        Path workspace = RlmTestSupport.workspace();
        Map<String, Object> raw = RlmTestSupport.task("demo", "baseline", List.of());
        castMap(castList(raw.get("context_sources")).get(0)).put("path", "nowhere");

        assertThrows(BundleException.class, () -> BundleBuilder.build(parse(raw), workspace, workspace.resolve("b")));
    }

    private static Task parse(Map<String, Object> raw) {
        return TaskLoader.parse(JsonFiles.toPrettyJson(raw), false, "test.json");
    }

    @SuppressWarnings("unchecked")
    private static List<Object> castList(Object value) {
        return (List<Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }
}
