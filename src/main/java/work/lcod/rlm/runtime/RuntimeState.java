package work.lcod.rlm.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted iteration state of a {@link StepRuntime} ({@code state.json}).
 */
final class RuntimeState {
    static final int RUNTIME_VERSION = 1;

    private final String bundleDir;
    private final String bundleFingerprint;
    private final int maxStdoutChars;
    private int iteration;
    private boolean finalized;
    private Object finalPayload;
    private final List<Map<String, Object>> events;
    private final ScratchMemory memory;

    private RuntimeState(
        String bundleDir,
        String bundleFingerprint,
        int maxStdoutChars,
        int iteration,
        boolean finalized,
        Object finalPayload,
        List<Map<String, Object>> events,
        ScratchMemory memory
    ) {
        this.bundleDir = bundleDir;
        this.bundleFingerprint = bundleFingerprint;
        this.maxStdoutChars = maxStdoutChars;
        this.iteration = iteration;
        this.finalized = finalized;
        this.finalPayload = finalPayload;
        this.events = events;
        this.memory = memory;
    }

    static RuntimeState fresh(String bundleDir, String bundleFingerprint, int maxStdoutChars) {
        return new RuntimeState(bundleDir, bundleFingerprint, maxStdoutChars, 0, false, null, new ArrayList<>(), new ScratchMemory());
    }

    /**
     * Restores persisted state, refusing it when any immutable field differs from the current invocation.
     */
    static RuntimeState restore(Map<String, Object> payload, String bundleDir, String bundleFingerprint, int maxStdoutChars) {
        String persistedFingerprint = payload.get("bundle_fingerprint") == null
            ? ""
            : String.valueOf(payload.get("bundle_fingerprint")).strip();
        if (!persistedFingerprint.equals(bundleFingerprint)) {
            throw new RuntimeStateException(
                "State bundle fingerprint does not match current bundle contents; resume would be ambiguous."
            );
        }
        Object persistedMax = payload.get("max_stdout_chars");
        if (!(persistedMax instanceof Number number) || number.longValue() != maxStdoutChars) {
            throw new RuntimeStateException(
                "State max_stdout_chars does not match requested runtime settings; resume would be ambiguous."
            );
        }
        Object version = payload.get("runtime_version");
        if (!(version instanceof Number v) || v.intValue() != RUNTIME_VERSION) {
            throw new RuntimeStateException(
                "State runtime_version " + version + " does not match runtime version " + RUNTIME_VERSION
                    + "; resume would be ambiguous."
            );
        }

        Object iteration = payload.get("iteration");
        if (!(iteration instanceof Integer count) || count < 0) {
            throw new RuntimeStateException("State field 'iteration' must be an integer >= 0.");
        }
        Object finalized = payload.get("finalized");
        if (!(finalized instanceof Boolean done)) {
            throw new RuntimeStateException("State field 'finalized' must be true or false.");
        }
        Object rawEvents = payload.get("events");
        if (rawEvents != null && !(rawEvents instanceof List<?>)) {
            throw new RuntimeStateException("State field 'events' must be a list.");
        }
        Object rawMemory = payload.get("memory");
        if (rawMemory != null && !(rawMemory instanceof Map<?, ?>)) {
            throw new RuntimeStateException("State field 'memory' must be an object.");
        }

        List<Map<String, Object>> events = new ArrayList<>();
        if (rawEvents instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    Map<String, Object> event = new LinkedHashMap<>();
                    map.forEach((key, value) -> event.put(String.valueOf(key), value));
                    events.add(event);
                }
            }
        }
        return new RuntimeState(
            bundleDir,
            bundleFingerprint,
            maxStdoutChars,
            count,
            done,
            payload.get("final_payload"),
            events,
            ScratchMemory.fromPersisted((Map<?, ?>) rawMemory)
        );
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("bundle_dir", bundleDir);
        map.put("bundle_fingerprint", bundleFingerprint);
        map.put("events", events);
        map.put("final_payload", finalPayload);
        map.put("finalized", finalized);
        map.put("iteration", iteration);
        map.put("max_stdout_chars", maxStdoutChars);
        map.put("memory", memory.snapshot());
        map.put("runtime_version", RUNTIME_VERSION);
        return map;
    }

    int iteration() {
        return iteration;
    }

    int nextIteration() {
        return ++iteration;
    }

    boolean finalized() {
        return finalized;
    }

    Object finalPayload() {
        return finalPayload;
    }

    void finalizeWith(Object payload) {
        this.finalized = true;
        this.finalPayload = payload;
    }

    List<Map<String, Object>> events() {
        return events;
    }

    ScratchMemory memory() {
        return memory;
    }

    String bundleFingerprint() {
        return bundleFingerprint;
    }

    int maxStdoutChars() {
        return maxStdoutChars;
    }
}
