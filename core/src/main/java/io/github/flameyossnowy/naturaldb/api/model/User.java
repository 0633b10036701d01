package io.github.flameyossnowy.naturaldb.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Owner of a set of databases. The id names the user's directory.
 */
public record User(@NotNull String id, @NotNull String name) {
    public User {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }

    public static @NotNull User of(@NotNull String id) {
        return new User(id, id);
    }
}
