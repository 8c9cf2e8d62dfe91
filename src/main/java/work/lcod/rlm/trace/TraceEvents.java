package work.lcod.rlm.trace;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.rlm.runtime.StepResult;

/**
 * Builders for the three trace event kinds.
 */
public final class TraceEvents {
    public static final String EVENT = "event";
    public static final String ITERATION = "iteration";
    public static final String SUBCALL = "subcall";
    public static final String STOP = "stop";

    private TraceEvents() {}

    public static Map<String, Object> iteration(StepResult result, int programIndex) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(EVENT, ITERATION);
        event.put("code_sha256", result.codeSha256());
        event.put("error", result.error() == null ? null : result.error().render());
        event.put("finalized", result.finalized());
        event.put("iteration", result.iteration());
        event.put("program_index", programIndex);
        event.put("stdout_chars", result.stdoutChars());
        event.put("stdout_sha256", result.stdoutSha256());
        event.put("stdout_truncated", result.stdoutTruncated());
        return event;
    }

    public static Map<String, Object> stop(String status, String stopReason, boolean finalized, int iteration) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(EVENT, STOP);
        event.put("finalized", finalized);
        event.put("iteration", iteration);
        event.put("status", status);
        event.put("stop_reason", stopReason);
        return event;
    }

    /**
     * One subcall attempt. {@code responseHash} is null and {@code error} set when the call failed;
     * {@code prompt} and {@code responseText} are only written when the run records text.
     */
    public static Map<String, Object> subcall(
        int iteration,
        String requestedProvider,
        String provider,
        String requestHash,
        String promptSha256,
        String cacheStatus,
        List<Map<String, Object>> attempts,
        String responseHash,
        String error
    ) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(EVENT, SUBCALL);
        event.put("attempts", attempts);
        event.put("cache", cacheStatus);
        event.put("error", error);
        event.put("iteration", iteration);
        event.put("prompt_sha256", promptSha256);
        event.put("provider", provider);
        event.put("request_hash", requestHash);
        event.put("requested_provider", requestedProvider);
        event.put("response_hash", responseHash);
        return event;
    }

    public static boolean isKind(Map<String, Object> event, String kind) {
        return kind.equals(event.get(EVENT));
    }
}
