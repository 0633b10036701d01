package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a parsed JSON document.
 *
 * <p>The tree is immutable. Objects keep their insertion order and numbers keep
 * whether they were written as integers or as floating point literals, so a
 * value that went through {@link JsonCodec#parse(String)} serializes back to the
 * same structure.</p>
 */
public sealed interface JsonValue permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    @NotNull
    Kind kind();

    default boolean isNull() {
        return kind() == Kind.NULL;
    }

    /**
     * Converts this value into plain Java objects: {@code null}, {@link Boolean},
     * {@link Long}/{@link BigInteger}/{@link Double}, {@link String}, {@link List}
     * and insertion ordered {@link Map}.
     */
    @Nullable
    Object toJava();

    /**
     * Wraps a plain Java object into a JSON tree.
     *
     * @throws IllegalArgumentException if the object (or something nested in it) has no JSON form
     */
    @Contract("null -> !null")
    static @NotNull JsonValue of(@Nullable Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonValue json) {
            return json;
        }
        if (value instanceof Boolean b) {
            return JsonBoolean.of(b);
        }
        if (value instanceof String s) {
            return new JsonString(s);
        }
        if (value instanceof Character c) {
            return new JsonString(String.valueOf(c));
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return JsonNumber.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return JsonNumber.of(big);
        }
        if (value instanceof BigDecimal decimal) {
            return JsonNumber.of(decimal.doubleValue());
        }
        if (value instanceof Number number) {
            return JsonNumber.of(number.doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, JsonValue> members = new LinkedHashMap<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("JSON object keys must be strings, got: " + entry.getKey());
                }
                members.put(key, of(entry.getValue()));
            }
            return new JsonObject(members);
        }
        if (value instanceof Collection<?> collection) {
            List<JsonValue> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return new JsonArray(elements);
        }
        if (value instanceof Object[] array) {
            List<JsonValue> elements = new ArrayList<>(array.length);
            for (Object element : array) {
                elements.add(of(element));
            }
            return new JsonArray(elements);
        }
        throw new IllegalArgumentException("Unsupported JSON type: " + value.getClass().getName());
    }

    enum Kind {
        NULL,
        BOOLEAN,
        NUMBER,
        STRING,
        ARRAY,
        OBJECT
    }
}
