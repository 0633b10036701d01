package io.github.flameyossnowy.naturaldb.api.options;

import org.jetbrains.annotations.NotNull;

public enum JoinType {
    INNER,
    LEFT;

    /**
     * @throws IllegalArgumentException for anything but {@code inner} or {@code left}
     */
    public static @NotNull JoinType fromName(@NotNull String name) {
        for (JoinType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown join type: " + name);
    }
}
