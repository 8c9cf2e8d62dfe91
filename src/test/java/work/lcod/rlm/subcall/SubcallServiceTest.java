package work.lcod.rlm.subcall;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.rlm.api.CacheMode;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.support.RecordingProvider;
import work.lcod.rlm.task.Limits;
import work.lcod.rlm.task.ProviderPolicy;
import work.lcod.rlm.trace.TraceLog;

final class SubcallServiceTest {
    private static final ProviderPolicy POLICY = new ProviderPolicy(
        "openai",
        List.of("openai", "anthropic", "google"),
        List.of("anthropic"),
        2
    );

    private Path dir;
    private SubcallCache cache;
    private TraceLog trace;
    private SubcallCounters counters;
    private RecordingProvider openai;
    private RecordingProvider anthropic;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("rlm-subcalls");
        cache = SubcallCache.open(dir.resolve("cache.jsonl"));
        trace = new TraceLog(dir.resolve("trace.jsonl"), dir.resolve("run"));
        counters = new SubcallCounters();
        counters.startIteration(1);
        openai = new RecordingProvider("openai");
        anthropic = new RecordingProvider("anthropic");
        registry = new ProviderRegistry().register("openai", openai).register("anthropic", anthropic);
    }

    @Test
    void primaryAnswerIsCached() {
        SubcallService service = service(CacheMode.READWRITE, 4, 2, false);

        Map<String, Object> response = service.query("summarize", null);

        assertEquals("openai", response.get("provider"));
        assertEquals("openai: summarize", response.get("text"));
        assertEquals(SubcallService.CACHE_MISS, response.get("cache"));
        assertEquals(Hashing.sha256("openai: summarize"), response.get("response_hash"));
        assertEquals(1, cache.size());
        assertEquals(1, counters.total());
        assertEquals(List.of(Hashing.sha256("openai: summarize")), counters.responseHashes());
        assertEquals(1, openai.requests().get(0).attempt());
    }

    @Test
    void readonlyHitSkipsProviders() {
        cache.store("summarize", "openai", "from cache");
        SubcallService service = service(CacheMode.READONLY, 4, 2, false);

        Map<String, Object> response = service.query("summarize", null);

        assertEquals(SubcallService.CACHE_HIT, response.get("cache"));
        assertEquals("from cache", response.get("text"));
        assertEquals(0, openai.calls());
        assertEquals(1, counters.total());
    }

    @Test
    void cacheHitFollowsCandidateOrder() {
        cache.store("summarize", "anthropic", "fallback answer");
        SubcallService service = service(CacheMode.READWRITE, 4, 2, false);

        Map<String, Object> response = service.query("summarize", null);

        assertEquals("anthropic", response.get("provider"));
        assertEquals(0, openai.calls());
    }

    @Test
    void readonlyMissNeverCallsProviders() {
        SubcallService service = service(CacheMode.READONLY, 4, 2, false);

        var ex = assertThrows(SubcallException.class, () -> service.query("summarize", null));

        assertEquals(SubcallException.Reason.CACHE_MISS, ex.reason());
        assertEquals(0, openai.calls());
        assertEquals(0, anthropic.calls());
        assertEquals(0, counters.total());
        Map<String, Object> event = trace.read().get(0);
        assertTrue(String.valueOf(event.get("error")).startsWith("CACHE_MISS: "));
        assertEquals(SubcallCache.requestHash("summarize", "openai"), event.get("request_hash"));
    }

    @Test
    void fallsBackAfterRetriesAndCachesOnlyTheWinner() {
        openai.failAlways();
        anthropic.answer("backup");
        SubcallService service = service(CacheMode.READWRITE, 4, 2, false);

        Map<String, Object> response = service.query("summarize", null);

        assertEquals("anthropic", response.get("provider"));
        assertEquals("backup", response.get("text"));
        assertEquals(3, response.get("attempts"));
        assertEquals(2, openai.calls());
        assertEquals(2, openai.requests().get(1).attempt());
        assertTrue(cache.lookup(SubcallCache.requestHash("summarize", "anthropic")).isPresent());
        assertTrue(cache.lookup(SubcallCache.requestHash("summarize", "openai")).isEmpty());
    }

    @Test
    void retrySucceedsOnSameProvider() {
        openai.fail("timeout").answer("second try");
        SubcallService service = service(CacheMode.OFF, 4, 2, false);

        Map<String, Object> response = service.query("summarize", null);

        assertEquals("openai", response.get("provider"));
        assertEquals("second try", response.get("text"));
        assertEquals(SubcallService.CACHE_BYPASS, response.get("cache"));
        assertEquals(0, anthropic.calls());
        assertEquals(0, cache.size());
    }

    @Test
    void uncheckedTransportFailureFallsBackAndIsTraced() {
        openai.crash(new IllegalStateException("connection reset")).crash(new IllegalStateException("connection reset"));
        anthropic.answer("backup");
        SubcallService service = service(CacheMode.READWRITE, 4, 2, false);

        Map<String, Object> response = service.query("summarize", null);

        assertEquals("anthropic", response.get("provider"));
        assertEquals("backup", response.get("text"));
        assertEquals(2, openai.calls());
        List<Map<String, Object>> events = trace.read();
        assertEquals(1, events.size());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> attempts = (List<Map<String, Object>>) events.get(0).get("attempts");
        assertEquals("IllegalStateException: connection reset", attempts.get(0).get("error"));
        assertNull(events.get(0).get("error"));
    }

    @Test
    void cacheWriteFailureStillAppendsTraceEvent() throws Exception {
        Path blocker = Files.writeString(dir.resolve("blocker"), "not a directory");
        cache = SubcallCache.open(blocker.resolve("cache.jsonl"));
        SubcallService service = service(CacheMode.READWRITE, 4, 2, false);

        assertThrows(UncheckedIOException.class, () -> service.query("summarize", null));

        List<Map<String, Object>> events = trace.read();
        assertEquals(1, events.size());
        assertTrue(String.valueOf(events.get(0).get("error")).startsWith("UncheckedIOException: "));
    }

    @Test
    void taskTimeoutReachesTransport() {
        SubcallService service = new SubcallService(
            POLICY, new Limits(8, 0, 4, 2, 45, 4000), CacheMode.OFF, cache, registry, counters, trace, false
        );

        service.query("summarize", null);

        assertEquals(Duration.ofSeconds(45), openai.requests().get(0).timeout());
    }

    @Test
    void missingTransportCountsAsFailedCandidate() {
        registry = new ProviderRegistry().register("anthropic", anthropic);
        SubcallService service = service(CacheMode.OFF, 4, 2, false);

        Map<String, Object> response = service.query("summarize", null);

        assertEquals("anthropic", response.get("provider"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> attempts = (List<Map<String, Object>>) trace.read().get(0).get("attempts");
        assertEquals("no transport registered", attempts.get(0).get("error"));
        assertEquals(0, attempts.get(0).get("attempt"));
    }

    @Test
    void namedProviderMustBeAllowed() {
        RecordingProvider triton = new RecordingProvider("triton");
        registry.register("triton", triton);
        SubcallService service = service(CacheMode.OFF, 4, 2, false);

        var ex = assertThrows(SubcallException.class, () -> service.query("summarize", "Triton"));

        assertEquals(SubcallException.Reason.PROVIDER_NOT_ALLOWED, ex.reason());
        assertEquals(0, triton.calls());
    }

    @Test
    void namedProviderSkipsFallback() {
        openai.failAlways();
        SubcallService service = service(CacheMode.OFF, 4, 2, false);

        var ex = assertThrows(SubcallException.class, () -> service.query("summarize", "openai"));

        assertEquals(SubcallException.Reason.PROVIDERS_EXHAUSTED, ex.reason());
        assertEquals(0, anthropic.calls());
    }

    @Test
    void exhaustedCandidatesReportEveryProvider() {
        openai.failAlways();
        anthropic.failAlways();
        SubcallService service = service(CacheMode.READWRITE, 4, 2, false);

        var ex = assertThrows(SubcallException.class, () -> service.query("summarize", null));

        assertEquals(SubcallException.Reason.PROVIDERS_EXHAUSTED, ex.reason());
        assertTrue(ex.getMessage().contains("openai"));
        assertTrue(ex.getMessage().contains("anthropic"));
        assertTrue(ex.getMessage().contains("google"));
        assertEquals(0, cache.size());
        assertEquals(1, trace.read().size());
    }

    @Test
    void iterationBudgetIsCheckedBeforeTheCache() {
        cache.store("summarize", "openai", "cached");
        SubcallService service = service(CacheMode.READONLY, 4, 1, false);
        service.query("summarize", null);

        var ex = assertThrows(SubcallException.class, () -> service.query("summarize", null));
        assertEquals(SubcallException.Reason.BUDGET, ex.reason());

        counters.startIteration(2);
        assertEquals("cached", service.query("summarize", null).get("text"));
    }

    @Test
    void zeroBudgetBlocksEverything() {
        cache.store("summarize", "openai", "cached");
        SubcallService service = service(CacheMode.READONLY, 4, 0, false);

        var ex = assertThrows(SubcallException.class, () -> service.query("summarize", null));

        assertEquals(SubcallException.Reason.BUDGET, ex.reason());
        assertEquals(0, counters.total());
    }

    @Test
    void totalBudgetSpansIterations() {
        SubcallService service = service(CacheMode.OFF, 1, 1, false);
        service.query("one", null);
        counters.startIteration(2);

        var ex = assertThrows(SubcallException.class, () -> service.query("two", null));

        assertEquals(SubcallException.Reason.BUDGET, ex.reason());
        assertEquals(1, openai.calls());
    }

    @Test
    void oneTraceEventPerQuery() {
        SubcallService service = service(CacheMode.READWRITE, 4, 4, false);
        service.query("a", null);
        service.query("a", null);
        assertThrows(SubcallException.class, () -> service.query("b", "mystery"));

        List<Map<String, Object>> events = trace.read();

        assertEquals(3, events.size());
        assertEquals(List.of("miss", "hit", "off"), events.stream().map(e -> e.get("cache")).toList());
        assertEquals(1, events.get(0).get("iteration"));
        assertEquals(Hashing.sha256("a"), events.get(0).get("prompt_sha256"));
        assertFalse(events.get(0).containsKey("prompt"));
        assertNull(events.get(2).get("response_hash"));
    }

    @Test
    void recordsTextWhenAllowed() {
        SubcallService service = service(CacheMode.OFF, 4, 2, true);
        service.query("secret question", null);

        Map<String, Object> event = trace.read().get(0);

        assertEquals("secret question", event.get("prompt"));
        assertEquals("openai: secret question", event.get("response_text"));
    }

    @Test
    void readingModesNeedACache() {
        assertThrows(IllegalArgumentException.class, () -> new SubcallService(
            POLICY, limits(1, 1), CacheMode.READONLY, null, registry, counters, trace, false
        ));
    }

    private SubcallService service(CacheMode mode, int total, int perIteration, boolean recordText) {
        return new SubcallService(POLICY, limits(total, perIteration), mode, cache, registry, counters, trace, recordText);
    }

    private static Limits limits(int total, int perIteration) {
        return new Limits(8, 0, total, perIteration, 30, 4000);
    }
}
