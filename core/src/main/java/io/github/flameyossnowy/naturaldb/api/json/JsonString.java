package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record JsonString(@NotNull String value) implements JsonValue {
    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.STRING;
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String toString() {
        return JsonCodec.serialize(this);
    }
}
