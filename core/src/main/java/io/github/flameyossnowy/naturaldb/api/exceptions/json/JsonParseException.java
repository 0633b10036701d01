package io.github.flameyossnowy.naturaldb.api.exceptions.json;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a JSON text is malformed. The {@link Kind} says what went wrong and the
 * location says where.
 */
public class JsonParseException extends JsonProcessException {
    private final Kind kind;

    public JsonParseException(@NotNull Kind kind, String message, JsonLocation location) {
        super(message + " at " + location, location);
        this.kind = kind;
    }

    public @NotNull Kind getKind() {
        return kind;
    }

    public enum Kind {
        EMPTY_INPUT,
        UNEXPECTED_CHARACTER,
        UNEXPECTED_END,
        INVALID_LITERAL,
        INVALID_NUMBER,
        INVALID_ESCAPE,
        UNTERMINATED_STRING,
        UNTERMINATED_ARRAY,
        UNTERMINATED_OBJECT,
        TRAILING_COMMA,
        EXPECTED_KEY,
        EXPECTED_COLON,
        TRAILING_CONTENT
    }
}
