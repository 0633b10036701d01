package io.github.flameyossnowy.naturaldb.api.json;

import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonProcessException;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.Map;

/**
 * Serializes a {@link JsonValue} tree. An indent of {@code 0} or less produces compact output.
 */
final class JsonWriter {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final StringBuilder out = new StringBuilder();
    private final int indent;

    JsonWriter(int indent) {
        this.indent = Math.max(indent, 0);
    }

    @NotNull String write(@NotNull JsonValue value) {
        writeValue(value, 0);
        return out.toString();
    }

    private void writeValue(JsonValue value, int depth) {
        switch (value.kind()) {
            case NULL -> out.append("null");
            case BOOLEAN -> out.append(((JsonBoolean) value).value());
            case NUMBER -> writeNumber((JsonNumber) value);
            case STRING -> writeString(((JsonString) value).value());
            case ARRAY -> writeArray((JsonArray) value, depth);
            case OBJECT -> writeObject((JsonObject) value, depth);
        }
    }

    private void writeNumber(JsonNumber number) {
        if (!number.isFinite()) {
            throw new JsonProcessException("Cannot serialize non-finite number " + number.value(), JsonLocation.UNKNOWN);
        }
        out.append(number.value());
    }

    private void writeArray(JsonArray array, int depth) {
        if (array.isEmpty()) {
            out.append("[]");
            return;
        }
        out.append('[');
        Iterator<JsonValue> iterator = array.iterator();
        while (iterator.hasNext()) {
            newline(depth + 1);
            writeValue(iterator.next(), depth + 1);
            if (iterator.hasNext()) out.append(',');
        }
        newline(depth);
        out.append(']');
    }

    private void writeObject(JsonObject object, int depth) {
        if (object.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append('{');
        Iterator<Map.Entry<String, JsonValue>> iterator = object.members().entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonValue> entry = iterator.next();
            newline(depth + 1);
            writeString(entry.getKey());
            out.append(indent > 0 ? ": " : ":");
            writeValue(entry.getValue(), depth + 1);
            if (iterator.hasNext()) out.append(',');
        }
        newline(depth);
        out.append('}');
    }

    private void newline(int depth) {
        if (indent == 0) {
            return;
        }
        out.append('\n');
        out.append(" ".repeat(indent * depth));
    }

    private void writeString(String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}
