package work.lcod.rlm.subcall;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.rlm.api.CacheMode;
import work.lcod.rlm.runtime.SubcallHandler;
import work.lcod.rlm.shared.Hashing;
import work.lcod.rlm.task.Limits;
import work.lcod.rlm.task.ProviderPolicy;
import work.lcod.rlm.trace.TraceEvents;
import work.lcod.rlm.trace.TraceLog;

/**
 * Answers {@code subcall(prompt, provider?)} from step code: enforces the subcall budgets, consults the cache
 * according to the run's {@link CacheMode}, walks the provider candidates with per-candidate retries, and
 * appends exactly one trace event per query whatever the outcome.
 */
public final class SubcallService implements SubcallHandler {
    private static final Logger log = LoggerFactory.getLogger(SubcallService.class);

    public static final String CACHE_HIT = "hit";
    public static final String CACHE_MISS = "miss";
    public static final String CACHE_BYPASS = "off";

    private final ProviderPolicy policy;
    private final Limits limits;
    private final CacheMode cacheMode;
    private final SubcallCache cache;
    private final ProviderRegistry providers;
    private final SubcallCounters counters;
    private final TraceLog trace;
    private final boolean recordText;

    public SubcallService(
        ProviderPolicy policy,
        Limits limits,
        CacheMode cacheMode,
        SubcallCache cache,
        ProviderRegistry providers,
        SubcallCounters counters,
        TraceLog trace,
        boolean recordText
    ) {
        if (cacheMode.reads() && cache == null) {
            throw new IllegalArgumentException("cache mode " + cacheMode.wireName() + " requires a cache log");
        }
        this.policy = policy;
        this.limits = limits;
        this.cacheMode = cacheMode;
        this.cache = cache;
        this.providers = providers;
        this.counters = counters;
        this.trace = trace;
        this.recordText = recordText;
    }

    @Override
    public Map<String, Object> query(String prompt, String provider) {
        Attempt call = new Attempt(prompt, provider);
        try {
            Map<String, Object> response = call.run();
            call.record(null);
            return response;
        } catch (SubcallException ex) {
            call.record(ex.reason().name() + ": " + ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            call.record(ex.getClass().getSimpleName() + ": " + ex.getMessage());
            throw ex;
        }
    }

    /** Mutable bookkeeping of one query, turned into its trace event at the end. */
    private final class Attempt {
        private final String prompt;
        private final String requested;
        private final List<Map<String, Object>> attempts = new ArrayList<>();
        private String resolvedProvider;
        private String requestHash;
        private String cacheStatus = CACHE_BYPASS;
        private String responseHash;
        private String responseText;

        Attempt(String prompt, String requested) {
            this.prompt = prompt == null ? "" : prompt;
            this.requested = requested == null || requested.isBlank() ? null : ProviderPolicy.normalize(requested);
        }

        Map<String, Object> run() {
            if (counters.inIteration() >= limits.maxSubcallsPerIter()) {
                throw new SubcallException(
                    SubcallException.Reason.BUDGET,
                    "per-iteration subcall budget exhausted (max_subcalls_per_iter=" + limits.maxSubcallsPerIter() + ")"
                );
            }
            if (counters.total() >= limits.maxSubcallsTotal()) {
                throw new SubcallException(
                    SubcallException.Reason.BUDGET,
                    "run subcall budget exhausted (max_subcalls_total=" + limits.maxSubcallsTotal() + ")"
                );
            }

            List<String> candidates = policy.candidates(requested);
            if (candidates.isEmpty()) {
                throw new SubcallException(
                    SubcallException.Reason.PROVIDER_NOT_ALLOWED,
                    "provider '" + requested + "' is not in provider_policy.allowed " + policy.allowed()
                );
            }

            if (cacheMode.reads()) {
                for (String candidate : candidates) {
                    Optional<CacheEntry> hit = cache.lookup(SubcallCache.requestHash(prompt, candidate));
                    if (hit.isPresent()) {
                        CacheEntry entry = hit.get();
                        cacheStatus = CACHE_HIT;
                        log.debug("Subcall cache hit for provider {}", candidate);
                        return succeed(candidate, entry.requestHash(), entry.responseText());
                    }
                }
                cacheStatus = CACHE_MISS;
                log.debug("Subcall cache miss for {} candidate(s)", candidates.size());
                if (!cacheMode.writes()) {
                    requestHash = SubcallCache.requestHash(prompt, candidates.get(0));
                    throw new SubcallException(
                        SubcallException.Reason.CACHE_MISS,
                        "readonly cache has no entry for this request (candidates " + candidates + ")"
                    );
                }
            }

            Duration timeout = Duration.ofSeconds(limits.timeoutSeconds());
            Map<String, String> lastErrors = new LinkedHashMap<>();
            for (String candidate : candidates) {
                Optional<ProviderClient> client = providers.lookup(candidate);
                if (client.isEmpty()) {
                    lastErrors.put(candidate, "no transport registered");
                    attempts.add(attemptRecord(candidate, 0, "no transport registered"));
                    continue;
                }
                ProviderConfig config = providers.settings().config(candidate);
                for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
                    String text;
                    try {
                        text = client.get().complete(new ProviderRequest(prompt, config, attempt, timeout));
                        if (text == null) {
                            throw new ProviderException("provider returned no text");
                        }
                    } catch (ProviderException | RuntimeException ex) {
                        String message = failureMessage(ex);
                        lastErrors.put(candidate, message);
                        attempts.add(attemptRecord(candidate, attempt, message));
                        log.warn("Provider {} attempt {}/{} failed: {}", candidate, attempt, policy.maxAttempts(), message);
                        continue;
                    }
                    attempts.add(attemptRecord(candidate, attempt, null));
                    String hash = SubcallCache.requestHash(prompt, candidate);
                    if (cacheMode.writes()) {
                        cache.store(prompt, candidate, text);
                    }
                    return succeed(candidate, hash, text);
                }
            }
            throw new SubcallException(
                SubcallException.Reason.PROVIDERS_EXHAUSTED,
                "all provider candidates failed: " + lastErrors
            );
        }

        private Map<String, Object> succeed(String provider, String hash, String text) {
            resolvedProvider = provider;
            requestHash = hash;
            responseText = text;
            responseHash = Hashing.sha256(text);
            counters.recordSuccess(responseHash);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("attempts", attempts.size());
            response.put("cache", cacheStatus);
            response.put("provider", provider);
            response.put("request_hash", hash);
            response.put("response_hash", responseHash);
            response.put("text", text);
            return response;
        }

        void record(String error) {
            Map<String, Object> event = TraceEvents.subcall(
                counters.currentIteration(),
                requested,
                resolvedProvider,
                requestHash,
                Hashing.sha256(prompt),
                cacheStatus,
                attempts,
                responseHash,
                error
            );
            if (recordText) {
                event.put("prompt", prompt);
                event.put("response_text", responseText);
            }
            trace.append(event);
        }

        private String failureMessage(Exception ex) {
            if (ex instanceof ProviderException) {
                return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            }
            // Unchecked transport failures keep their type so the trace shows what broke.
            return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getClass().getSimpleName() + ": " + ex.getMessage();
        }

        private Map<String, Object> attemptRecord(String provider, int attempt, String error) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("attempt", attempt);
            record.put("error", error);
            record.put("provider", provider);
            return record;
        }
    }
}
