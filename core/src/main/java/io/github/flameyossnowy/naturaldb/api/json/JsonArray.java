package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public record JsonArray(@NotNull List<JsonValue> elements) implements JsonValue, Iterable<JsonValue> {
    public static final JsonArray EMPTY = new JsonArray(List.of());

    public JsonArray {
        elements = List.copyOf(elements);
    }

    public static @NotNull JsonArray of(JsonValue... elements) {
        return new JsonArray(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public @NotNull JsonValue get(int index) {
        return elements.get(index);
    }

    @Override
    public @NotNull Iterator<JsonValue> iterator() {
        return elements.iterator();
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.ARRAY;
    }

    @Override
    public Object toJava() {
        List<Object> list = new ArrayList<>(elements.size());
        for (JsonValue element : elements) {
            list.add(element.toJava());
        }
        return list;
    }

    @Override
    public String toString() {
        return JsonCodec.serialize(this);
    }
}
