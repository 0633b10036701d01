package io.github.flameyossnowy.naturaldb.api.query;

import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Dot separated path into nested objects, e.g. {@code specs.color}.
 */
public record FieldPath(@NotNull List<String> segments) {
    public FieldPath {
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
    }

    public static @NotNull FieldPath parse(@NotNull String path) {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
        return new FieldPath(List.of(path.split("\\.", -1)));
    }

    /**
     * Reads the value at this path. Returns {@code null} when any segment is missing or an
     * intermediate value is not an object.
     */
    public @Nullable JsonValue get(@NotNull JsonObject root) {
        JsonValue current = root;
        for (String segment : segments) {
            if (!(current instanceof JsonObject object)) {
                return null;
            }
            current = object.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Returns a copy of {@code root} with the value at this path set, creating intermediate
     * objects and replacing intermediate values that are not objects.
     */
    public @NotNull JsonObject set(@NotNull JsonObject root, @NotNull JsonValue value) {
        return set(root, 0, value);
    }

    private JsonObject set(JsonObject object, int index, JsonValue value) {
        String segment = segments.get(index);
        if (index == segments.size() - 1) {
            return object.with(segment, value);
        }
        JsonObject child = object.get(segment) instanceof JsonObject existing ? existing : JsonObject.EMPTY;
        return object.with(segment, set(child, index + 1, value));
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
