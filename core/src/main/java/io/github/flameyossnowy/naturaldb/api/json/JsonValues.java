package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

/**
 * Value semantics shared by filtering, grouping, sorting and joining.
 *
 * <p>{@code null} (an absent field) and {@link JsonNull} both mean "no value". Numbers are
 * compared by magnitude, so {@code 1} and {@code 1.0} are equal here even though the
 * codec keeps them apart.</p>
 */
public final class JsonValues {
    /**
     * Total order over present values: numbers, then strings, then booleans, then arrays,
     * then objects. Inside a kind the natural order applies; arrays and objects compare
     * element by element.
     */
    public static final Comparator<JsonValue> NATURAL_ORDER = JsonValues::compare;

    private JsonValues() {}

    public static boolean isMissing(@Nullable JsonValue value) {
        return value == null || value.isNull();
    }

    /**
     * Equality used by filters and join keys. Two missing values are equal.
     */
    public static boolean equivalent(@Nullable JsonValue left, @Nullable JsonValue right) {
        if (isMissing(left) || isMissing(right)) {
            return isMissing(left) && isMissing(right);
        }
        if (left instanceof JsonNumber a && right instanceof JsonNumber b) {
            return a.numericallyEquals(b);
        }
        if (left instanceof JsonArray a && right instanceof JsonArray b) {
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!equivalent(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        if (left instanceof JsonObject a && right instanceof JsonObject b) {
            if (!a.keys().equals(b.keys())) return false;
            for (Map.Entry<String, JsonValue> entry : a.members().entrySet()) {
                if (!equivalent(entry.getValue(), b.get(entry.getKey()))) return false;
            }
            return true;
        }
        return left.equals(right);
    }

    /**
     * Canonical form used as a hash key: missing becomes {@link JsonNull#INSTANCE} and
     * integral floating point numbers become integers, recursively.
     */
    public static @NotNull JsonValue normalize(@Nullable JsonValue value) {
        if (isMissing(value)) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonNumber number) {
            return number.normalized();
        }
        if (value instanceof JsonArray array) {
            JsonValue[] elements = new JsonValue[array.size()];
            for (int i = 0; i < elements.length; i++) {
                elements[i] = normalize(array.get(i));
            }
            return JsonArray.of(elements);
        }
        if (value instanceof JsonObject object) {
            JsonObject.Builder builder = JsonObject.builder();
            object.members().forEach((key, member) -> builder.put(key, normalize(member)));
            return builder.build();
        }
        return value;
    }

    /**
     * String form used by the {@code contains} operator: strings as-is, everything else in
     * compact JSON.
     */
    public static @NotNull String stringForm(@NotNull JsonValue value) {
        if (value instanceof JsonString s) {
            return s.value();
        }
        return JsonCodec.serialize(value);
    }

    public static boolean sameKind(@NotNull JsonValue left, @NotNull JsonValue right) {
        return left.kind() == right.kind();
    }

    public static int compare(@NotNull JsonValue left, @NotNull JsonValue right) {
        int rank = Integer.compare(rank(left), rank(right));
        if (rank != 0) {
            return rank;
        }
        if (left instanceof JsonNumber a && right instanceof JsonNumber b) {
            return a.compareNumeric(b);
        }
        if (left instanceof JsonString a && right instanceof JsonString b) {
            return a.value().compareTo(b.value());
        }
        if (left instanceof JsonBoolean a && right instanceof JsonBoolean b) {
            return Boolean.compare(a.value(), b.value());
        }
        if (left instanceof JsonArray a && right instanceof JsonArray b) {
            return compareSequences(a.iterator(), b.iterator());
        }
        if (left instanceof JsonObject a && right instanceof JsonObject b) {
            return compareObjects(a, b);
        }
        return 0;
    }

    private static int compareSequences(Iterator<JsonValue> left, Iterator<JsonValue> right) {
        while (left.hasNext() && right.hasNext()) {
            int cmp = compare(left.next(), right.next());
            if (cmp != 0) return cmp;
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    }

    private static int compareObjects(JsonObject left, JsonObject right) {
        Iterator<Map.Entry<String, JsonValue>> a = left.members().entrySet().iterator();
        Iterator<Map.Entry<String, JsonValue>> b = right.members().entrySet().iterator();
        while (a.hasNext() && b.hasNext()) {
            Map.Entry<String, JsonValue> x = a.next();
            Map.Entry<String, JsonValue> y = b.next();
            int cmp = x.getKey().compareTo(y.getKey());
            if (cmp != 0) return cmp;
            cmp = compare(x.getValue(), y.getValue());
            if (cmp != 0) return cmp;
        }
        return Boolean.compare(a.hasNext(), b.hasNext());
    }

    private static int rank(JsonValue value) {
        return switch (value.kind()) {
            case NUMBER -> 0;
            case STRING -> 1;
            case BOOLEAN -> 2;
            case ARRAY -> 3;
            case OBJECT -> 4;
            case NULL -> 5;
        };
    }
}
