package io.github.flameyossnowy.naturaldb.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record Database(@NotNull String name) {
    public Database {
        Objects.requireNonNull(name, "name");
    }
}
