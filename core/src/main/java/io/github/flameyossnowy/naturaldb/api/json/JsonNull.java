package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.NotNull;

public enum JsonNull implements JsonValue {
    INSTANCE;

    @Override
    public @NotNull Kind kind() {
        return Kind.NULL;
    }

    @Override
    public Object toJava() {
        return null;
    }

    @Override
    public String toString() {
        return "null";
    }
}
