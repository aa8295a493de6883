package com.github.nikalon.hijritime;

import java.util.Locale;
import java.util.Optional;

/**
 * Shadow length that starts the Asr prayer, as a multiple of the object length added to its noon shadow.
 */
public enum AsrConvention {
    SHAFII("shafii", 1),
    HANAFI("hanafi", 2);

    public static final AsrConvention DEFAULT = SHAFII;

    private final String key;
    private final int shadowFactor;

    AsrConvention(String key, int shadowFactor) {
        this.key = key;
        this.shadowFactor = shadowFactor;
    }

    public String getKey() {
        return key;
    }

    public int getShadowFactor() {
        return shadowFactor;
    }

    public static Optional<AsrConvention> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (AsrConvention convention : values()) {
            if (convention.key.equals(k)) return Optional.of(convention);
        }
        return Optional.empty();
    }
}
