package work.lcod.rlm.bundle;

import java.util.List;

/**
 * Splits decoded file text into ordered slices. Implementations must be pure: same input, same output.
 */
public interface ChunkingStrategy {
    String name();

    List<ChunkSlice> split(String text, int maxChars);
}
