package work.lcod.rlm.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@link StepRuntime#step} call. Either {@code error} is null (the code ran to completion) or
 * it describes the failure; side effects made before the failure are kept either way.
 */
public record StepResult(
    StepError error,
    String stdout,
    boolean stdoutTruncated,
    boolean finalized,
    Object finalPayload,
    int iteration,
    String codeSha256,
    int stdoutChars,
    String stdoutSha256
) {
    public boolean ok() {
        return error == null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error", error == null ? null : error.render());
        map.put("final_payload", finalPayload);
        map.put("finalized", finalized);
        map.put("iteration", iteration);
        map.put("stdout", stdout);
        map.put("stdout_truncated", stdoutTruncated);
        return map;
    }
}
