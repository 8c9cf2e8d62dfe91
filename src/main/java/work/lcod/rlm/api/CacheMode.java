package work.lcod.rlm.api;

import java.util.Locale;

/**
 * Describes how the subcall cache is used for a run.
 */
public enum CacheMode {
    /** Never read or write the cache. */
    OFF,
    /** Read only; a miss is a hard failure since no live call is permitted. */
    READONLY,
    /** Read first, call providers on a miss and persist the winning response. */
    READWRITE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean reads() {
        return this != OFF;
    }

    public boolean writes() {
        return this == READWRITE;
    }

    public static CacheMode from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Cache mode must be one of: off, readonly, readwrite");
        }
        try {
            return CacheMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported cache mode: " + value);
        }
    }
}
