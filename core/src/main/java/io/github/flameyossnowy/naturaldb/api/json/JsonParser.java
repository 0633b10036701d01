package io.github.flameyossnowy.naturaldb.api.json;

import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonParseException;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonParseException.Kind;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser producing a {@link JsonValue} tree.
 *
 * <p>Instances are single-use and not thread-safe; go through {@link JsonCodec#parse(String)}.</p>
 */
final class JsonParser {
    private final String text;
    private final int length;
    private int pos;

    JsonParser(@NotNull String text) {
        this.text = text;
        this.length = text.length();
    }

    @NotNull JsonValue parse() {
        skipWhitespace();
        if (pos >= length) {
            throw error(Kind.EMPTY_INPUT, "Empty JSON input");
        }
        JsonValue value = parseValue();
        skipWhitespace();
        if (pos < length) {
            throw error(Kind.TRAILING_CONTENT, "Unexpected content '" + text.charAt(pos) + "' after root value");
        }
        return value;
    }

    private JsonValue parseValue() {
        skipWhitespace();
        if (pos >= length) {
            throw error(Kind.UNEXPECTED_END, "Unexpected end of JSON input");
        }
        char c = text.charAt(pos);
        return switch (c) {
            case '{' -> parseObject();
            case '[' -> parseArray();
            case '"' -> new JsonString(parseString());
            case 't' -> parseLiteral("true", JsonBoolean.TRUE);
            case 'f' -> parseLiteral("false", JsonBoolean.FALSE);
            case 'n' -> parseLiteral("null", JsonNull.INSTANCE);
            default -> {
                if (c == '-' || isDigit(c)) {
                    yield parseNumber();
                }
                throw error(Kind.UNEXPECTED_CHARACTER, "Unexpected character '" + c + "'");
            }
        };
    }

    private JsonObject parseObject() {
        int start = pos;
        pos++; // '{'
        Map<String, JsonValue> members = new LinkedHashMap<>();
        skipWhitespace();
        if (pos < length && text.charAt(pos) == '}') {
            pos++;
            return new JsonObject(members);
        }
        while (true) {
            skipWhitespace();
            if (pos >= length) {
                throw error(Kind.UNTERMINATED_OBJECT, "Unterminated object starting at offset " + start);
            }
            char c = text.charAt(pos);
            if (c == '}') {
                throw error(Kind.TRAILING_COMMA, "Trailing comma in object");
            }
            if (c != '"') {
                throw error(Kind.EXPECTED_KEY, "Expected string key in object");
            }
            String key = parseString();
            skipWhitespace();
            if (pos >= length || text.charAt(pos) != ':') {
                if (pos >= length) {
                    throw error(Kind.UNTERMINATED_OBJECT, "Unterminated object starting at offset " + start);
                }
                throw error(Kind.EXPECTED_COLON, "Expected ':' after object key \"" + key + '"');
            }
            pos++;
            members.put(key, parseValue());
            skipWhitespace();
            if (pos >= length) {
                throw error(Kind.UNTERMINATED_OBJECT, "Unterminated object starting at offset " + start);
            }
            c = text.charAt(pos);
            if (c == '}') {
                pos++;
                return new JsonObject(members);
            }
            if (c != ',') {
                throw error(Kind.UNEXPECTED_CHARACTER, "Expected ',' or '}' in object but found '" + c + "'");
            }
            pos++;
        }
    }

    private JsonArray parseArray() {
        int start = pos;
        pos++; // '['
        List<JsonValue> elements = new ArrayList<>();
        skipWhitespace();
        if (pos < length && text.charAt(pos) == ']') {
            pos++;
            return new JsonArray(elements);
        }
        while (true) {
            skipWhitespace();
            if (pos >= length) {
                throw error(Kind.UNTERMINATED_ARRAY, "Unterminated array starting at offset " + start);
            }
            if (text.charAt(pos) == ']') {
                throw error(Kind.TRAILING_COMMA, "Trailing comma in array");
            }
            elements.add(parseValue());
            skipWhitespace();
            if (pos >= length) {
                throw error(Kind.UNTERMINATED_ARRAY, "Unterminated array starting at offset " + start);
            }
            char c = text.charAt(pos);
            if (c == ']') {
                pos++;
                return new JsonArray(elements);
            }
            if (c != ',') {
                throw error(Kind.UNEXPECTED_CHARACTER, "Expected ',' or ']' in array but found '" + c + "'");
            }
            pos++;
        }
    }

    private String parseString() {
        int start = pos;
        pos++; // opening quote
        StringBuilder builder = new StringBuilder();
        while (pos < length) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return builder.toString();
            }
            if (c != '\\') {
                builder.append(c);
                continue;
            }
            if (pos >= length) {
                break;
            }
            char escaped = text.charAt(pos++);
            switch (escaped) {
                case '"' -> builder.append('"');
                case '\\' -> builder.append('\\');
                case '/' -> builder.append('/');
                case 'b' -> builder.append('\b');
                case 'f' -> builder.append('\f');
                case 'n' -> builder.append('\n');
                case 'r' -> builder.append('\r');
                case 't' -> builder.append('\t');
                case 'u' -> builder.append(parseUnicodeEscape());
                default -> {
                    pos--;
                    throw error(Kind.INVALID_ESCAPE, "Invalid escape sequence '\\" + escaped + "'");
                }
            }
        }
        throw new JsonParseException(Kind.UNTERMINATED_STRING, "Unterminated string", JsonLocation.of(text, start));
    }

    private char parseUnicodeEscape() {
        if (pos + 4 > length) {
            throw error(Kind.INVALID_ESCAPE, "Incomplete unicode escape");
        }
        int code = 0;
        for (int i = 0; i < 4; i++) {
            int digit = Character.digit(text.charAt(pos + i), 16);
            if (digit < 0) {
                throw error(Kind.INVALID_ESCAPE, "Invalid unicode escape");
            }
            code = (code << 4) | digit;
        }
        pos += 4;
        return (char) code;
    }

    private JsonNumber parseNumber() {
        int start = pos;
        boolean floating = false;
        if (text.charAt(pos) == '-') {
            pos++;
        }
        if (pos >= length || !isDigit(text.charAt(pos))) {
            throw numberError(start);
        }
        if (text.charAt(pos) == '0') {
            pos++;
        } else {
            while (pos < length && isDigit(text.charAt(pos))) pos++;
        }
        if (pos < length && text.charAt(pos) == '.') {
            floating = true;
            pos++;
            if (pos >= length || !isDigit(text.charAt(pos))) {
                throw numberError(start);
            }
            while (pos < length && isDigit(text.charAt(pos))) pos++;
        }
        if (pos < length && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            floating = true;
            pos++;
            if (pos < length && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= length || !isDigit(text.charAt(pos))) {
                throw numberError(start);
            }
            while (pos < length && isDigit(text.charAt(pos))) pos++;
        }
        // "123.456.789", "01" and "1e5e5" must not parse as a shorter number followed by junk
        if (pos < length && isNumberChar(text.charAt(pos))) {
            throw numberError(start);
        }

        String literal = text.substring(start, pos);
        if (floating) {
            double value = Double.parseDouble(literal);
            if (!Double.isFinite(value)) {
                throw new JsonParseException(Kind.INVALID_NUMBER,
                    "Number '" + literal + "' is outside the double range", JsonLocation.of(text, start));
            }
            return JsonNumber.of(value);
        }
        return JsonNumber.of(new BigInteger(literal));
    }

    private JsonValue parseLiteral(String literal, JsonValue value) {
        if (!text.startsWith(literal, pos)) {
            throw error(Kind.INVALID_LITERAL, "Expected '" + literal + "'");
        }
        pos += literal.length();
        return value;
    }

    private void skipWhitespace() {
        while (pos < length) {
            char c = text.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                return;
            }
            pos++;
        }
    }

    private JsonParseException numberError(int start) {
        int end = pos;
        while (end < length && isNumberChar(text.charAt(end))) end++;
        return new JsonParseException(Kind.INVALID_NUMBER,
            "Invalid number '" + text.substring(start, end) + "'", JsonLocation.of(text, start));
    }

    private JsonParseException error(Kind kind, String message) {
        return new JsonParseException(kind, message, JsonLocation.of(text, pos));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNumberChar(char c) {
        return isDigit(c) || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
    }
}
