package work.lcod.rlm.bundle;

/**
 * A piece of one file produced by a {@link ChunkingStrategy}, before IDs and hashes are assigned.
 */
public record ChunkSlice(int lineStart, int lineEnd, String text) {}
