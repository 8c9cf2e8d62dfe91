package work.lcod.rlm.subcall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running subcall totals of a run. Only successful queries are counted.
 */
public final class SubcallCounters {
    private int total;
    private int currentIteration;
    private int inIteration;
    private final List<String> responseHashes = new ArrayList<>();

    public void startIteration(int iteration) {
        if (iteration != currentIteration) {
            currentIteration = iteration;
            inIteration = 0;
        }
    }

    void recordSuccess(String responseHash) {
        total++;
        inIteration++;
        responseHashes.add(responseHash);
    }

    public int total() {
        return total;
    }

    public int inIteration() {
        return inIteration;
    }

    public int currentIteration() {
        return currentIteration;
    }

    public List<String> responseHashes() {
        return Collections.unmodifiableList(responseHashes);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("current_iteration", currentIteration);
        map.put("in_iteration", inIteration);
        map.put("response_hashes", new ArrayList<>(responseHashes));
        map.put("total", total);
        return map;
    }

    public static SubcallCounters fromMap(Object raw) {
        SubcallCounters counters = new SubcallCounters();
        if (!(raw instanceof Map<?, ?> map)) {
            return counters;
        }
        counters.total = intValue(map.get("total"));
        counters.currentIteration = intValue(map.get("current_iteration"));
        counters.inIteration = intValue(map.get("in_iteration"));
        if (map.get("response_hashes") instanceof List<?> hashes) {
            hashes.forEach(hash -> counters.responseHashes.add(String.valueOf(hash)));
        }
        return counters;
    }

    private static int intValue(Object raw) {
        return raw instanceof Number number ? number.intValue() : 0;
    }
}
