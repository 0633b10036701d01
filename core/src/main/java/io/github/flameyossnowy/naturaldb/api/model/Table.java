package io.github.flameyossnowy.naturaldb.api.model;

import io.github.flameyossnowy.naturaldb.api.json.JsonArray;
import io.github.flameyossnowy.naturaldb.api.json.JsonNull;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table declaration: its name, descriptive indexes and optional key fields.
 */
public record Table(@NotNull String name, @NotNull Map<String, Index> indexes, @Nullable List<String> keys) {
    public Table {
        Objects.requireNonNull(name, "name");
        indexes = Collections.unmodifiableMap(new LinkedHashMap<>(indexes));
        keys = keys == null ? null : List.copyOf(keys);
    }

    public static @NotNull Table of(@NotNull String name) {
        return new Table(name, Map.of(), null);
    }

    public @NotNull Table withIndex(@NotNull Index index) {
        Map<String, Index> copy = new LinkedHashMap<>(indexes);
        copy.put(index.name(), index);
        return new Table(name, copy, keys);
    }

    public @NotNull Table withKeys(@NotNull List<String> keys) {
        return new Table(name, indexes, keys);
    }

    /**
     * Metadata document written when the table is created.
     */
    public @NotNull JsonObject toMetadata() {
        JsonValue keyArray = JsonNull.INSTANCE;
        if (keys != null) {
            List<JsonValue> names = new ArrayList<>(keys.size());
            for (String key : keys) {
                names.add(new JsonString(key));
            }
            keyArray = new JsonArray(names);
        }
        JsonObject.Builder indexObject = JsonObject.builder();
        indexes.forEach((indexName, index) -> indexObject.put(indexName, index.toJson()));
        return JsonObject.builder()
            .put("name", name)
            .put("keys", keyArray)
            .put("indexes", indexObject.build())
            .build();
    }
}
