package work.lcod.rlm.runtime;

import java.util.Map;

/**
 * Bridge from step code to the subcall layer. Returns a JSON-compatible description of the response;
 * failures are thrown and surface as step errors.
 */
@FunctionalInterface
public interface SubcallHandler {
    Map<String, Object> query(String prompt, String provider);
}
