package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A JSON object. Member order is the insertion order and is preserved by serialization.
 */
public record JsonObject(@NotNull Map<String, JsonValue> members) implements JsonValue {
    public static final JsonObject EMPTY = new JsonObject(Map.of());

    public JsonObject {
        Map<String, JsonValue> copy = new LinkedHashMap<>(members.size());
        for (Map.Entry<String, JsonValue> entry : members.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "key"), Objects.requireNonNull(entry.getValue(), "value"));
        }
        members = Collections.unmodifiableMap(copy);
    }

    public static @NotNull Builder builder() {
        return new Builder();
    }

    public @NotNull Builder toBuilder() {
        return new Builder().putAll(members);
    }

    /**
     * Returns the member, or {@code null} when the key is absent. A present JSON null is
     * returned as {@link JsonNull#INSTANCE}.
     */
    public @Nullable JsonValue get(@NotNull String key) {
        return members.get(key);
    }

    public @Nullable String getString(@NotNull String key) {
        return members.get(key) instanceof JsonString s ? s.value() : null;
    }

    public @Nullable JsonObject getObject(@NotNull String key) {
        return members.get(key) instanceof JsonObject o ? o : null;
    }

    public @Nullable JsonArray getArray(@NotNull String key) {
        return members.get(key) instanceof JsonArray a ? a : null;
    }

    public boolean containsKey(@NotNull String key) {
        return members.containsKey(key);
    }

    public @NotNull Set<String> keys() {
        return members.keySet();
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Returns a copy with {@code key} set. An existing key keeps its position.
     */
    public @NotNull JsonObject with(@NotNull String key, @NotNull JsonValue value) {
        return toBuilder().put(key, value).build();
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.OBJECT;
    }

    @Override
    public Object toJava() {
        Map<String, Object> map = new LinkedHashMap<>(members.size());
        for (Map.Entry<String, JsonValue> entry : members.entrySet()) {
            map.put(entry.getKey(), entry.getValue().toJava());
        }
        return map;
    }

    @Override
    public String toString() {
        return JsonCodec.serialize(this);
    }

    public static final class Builder {
        private final Map<String, JsonValue> members = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(@NotNull String key, @NotNull JsonValue value) {
            members.put(key, value);
            return this;
        }

        public Builder put(@NotNull String key, @Nullable String value) {
            return put(key, value == null ? JsonNull.INSTANCE : new JsonString(value));
        }

        public Builder put(@NotNull String key, long value) {
            return put(key, JsonNumber.of(value));
        }

        public Builder put(@NotNull String key, double value) {
            return put(key, JsonNumber.of(value));
        }

        public Builder put(@NotNull String key, boolean value) {
            return put(key, JsonBoolean.of(value));
        }

        public Builder putAll(@NotNull Map<String, JsonValue> values) {
            members.putAll(values);
            return this;
        }

        public Builder remove(@NotNull String key) {
            members.remove(key);
            return this;
        }

        public JsonObject build() {
            return new JsonObject(members);
        }
    }
}
