package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.NotNull;

public record JsonBoolean(boolean value) implements JsonValue {
    public static final JsonBoolean TRUE = new JsonBoolean(true);
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    public static @NotNull JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.BOOLEAN;
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
