package io.github.flameyossnowy.naturaldb.api.model;

import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One stored record. The id lives in the file name; {@code data} is the file content.
 */
public record Document(@NotNull String id, @NotNull JsonObject data) {
    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(data, "data");
    }

    public @Nullable JsonValue get(@NotNull String field) {
        return data.get(field);
    }
}
