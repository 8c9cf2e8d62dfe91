package work.lcod.rlm.bundle;

import java.util.Map;

/**
 * Lookup of the chunking strategies a bundle may name.
 */
public final class ChunkingStrategies {
    private static final Map<String, ChunkingStrategy> STRATEGIES = Map.of(
        CharWindowChunking.NAME, new CharWindowChunking()
    );

    private ChunkingStrategies() {}

    public static ChunkingStrategy lookup(String name) {
        ChunkingStrategy strategy = name == null ? null : STRATEGIES.get(name);
        if (strategy == null) {
            throw new BundleException(
                "Unsupported chunking_strategy '" + name + "'; supported: " + String.join(", ", STRATEGIES.keySet())
            );
        }
        return strategy;
    }
}
