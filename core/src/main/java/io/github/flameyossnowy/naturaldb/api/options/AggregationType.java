package io.github.flameyossnowy.naturaldb.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Aggregation functions usable in group queries.
 */
public enum AggregationType {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX;

    /** Lower case name used in result keys, e.g. {@code avg_price}. */
    public @NotNull String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public static @NotNull AggregationType fromName(@NotNull String name) {
        for (AggregationType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation: " + name);
    }
}
