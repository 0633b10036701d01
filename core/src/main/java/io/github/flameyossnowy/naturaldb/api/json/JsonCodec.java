package io.github.flameyossnowy.naturaldb.api.json;

import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonParseException;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonProcessException;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Entry point of the hand-written JSON codec.
 *
 * <p>For every value {@code v} returned by {@link #parse(String)},
 * {@code parse(serialize(v))} equals {@code v}: member order, element order and the
 * integer/floating point distinction of numbers all survive.</p>
 */
public final class JsonCodec {
    private JsonCodec() {}

    /**
     * @throws JsonParseException if the text is not a single well-formed JSON value
     */
    public static @NotNull JsonValue parse(@NotNull String text) {
        Objects.requireNonNull(text, "text");
        return new JsonParser(text).parse();
    }

    /**
     * Parses text that must hold a JSON object.
     *
     * @throws JsonParseException if the text is malformed
     * @throws JsonProcessException if the root value is not an object
     */
    public static @NotNull JsonObject parseObject(@NotNull String text) {
        JsonValue value = parse(text);
        if (value instanceof JsonObject object) {
            return object;
        }
        throw new JsonProcessException("Expected a JSON object but found " + value.kind(), JsonLocation.of(text, 0));
    }

    /** Compact form, no whitespace between tokens. */
    public static @NotNull String serialize(@NotNull JsonValue value) {
        return new JsonWriter(0).write(value);
    }

    /**
     * Pretty printed form with {@code indent} spaces per nesting level. An indent of
     * zero gives the compact form.
     *
     * @throws JsonProcessException if the tree holds a NaN or infinite number
     */
    public static @NotNull String serialize(@NotNull JsonValue value, int indent) {
        return new JsonWriter(indent).write(value);
    }
}
