package io.github.flameyossnowy.naturaldb.api.query;

import io.github.flameyossnowy.naturaldb.api.json.JsonNull;
import io.github.flameyossnowy.naturaldb.api.json.JsonNumber;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.json.JsonValues;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.options.AggregationType;
import io.github.flameyossnowy.naturaldb.api.options.Operator;
import io.github.flameyossnowy.naturaldb.api.options.SortOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Stateless operations over in-memory record lists. None of them modify their input.
 */
public final class QueryOperations {
    private QueryOperations() {}

    public static @NotNull List<Document> filter(@NotNull List<Document> records, @NotNull Predicate<Document> condition) {
        List<Document> result = new ArrayList<>();
        for (Document record : records) {
            if (condition.test(record)) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * Keeps the records whose (possibly nested) field matches {@code value} under {@code operator}.
     */
    public static @NotNull List<Document> filterByField(@NotNull List<Document> records, @NotNull String field,
                                                        @Nullable JsonValue value, @NotNull Operator operator) {
        FieldPath path = FieldPath.parse(field);
        return filter(records, record -> matches(path.get(record.data()), value, operator));
    }

    public static @NotNull List<Document> filterByField(@NotNull List<Document> records, @NotNull String field,
                                                        @Nullable JsonValue value, @NotNull String operator) {
        return filterByField(records, field, value, Operator.fromName(operator));
    }

    /**
     * Evaluates one comparison. A {@code null} or JSON null on either side is "no value":
     * it equals only another missing value and never satisfies an ordering or {@code contains}.
     */
    public static boolean matches(@Nullable JsonValue actual, @Nullable JsonValue expected, @NotNull Operator operator) {
        return switch (operator) {
            case EQ -> JsonValues.equivalent(actual, expected);
            case NE -> !JsonValues.equivalent(actual, expected);
            case GT -> compareComparable(actual, expected) > 0;
            case GTE -> {
                int cmp = compareComparable(actual, expected);
                yield cmp != Integer.MIN_VALUE && cmp >= 0;
            }
            case LT -> {
                int cmp = compareComparable(actual, expected);
                yield cmp != Integer.MIN_VALUE && cmp < 0;
            }
            case LTE -> {
                int cmp = compareComparable(actual, expected);
                yield cmp != Integer.MIN_VALUE && cmp <= 0;
            }
            case CONTAINS -> !JsonValues.isMissing(actual) && !JsonValues.isMissing(expected)
                && JsonValues.stringForm(actual).contains(JsonValues.stringForm(expected));
        };
    }

    // Integer.MIN_VALUE when the two values cannot be ordered against each other
    private static int compareComparable(@Nullable JsonValue actual, @Nullable JsonValue expected) {
        if (JsonValues.isMissing(actual) || JsonValues.isMissing(expected)) {
            return Integer.MIN_VALUE;
        }
        if (!JsonValues.sameKind(actual, expected)) {
            return Integer.MIN_VALUE;
        }
        return switch (actual.kind()) {
            case NUMBER, STRING, BOOLEAN -> Integer.signum(JsonValues.compare(actual, expected));
            default -> Integer.MIN_VALUE;
        };
    }

    /**
     * Builds, per record, an object holding only the requested paths at the depth they were
     * addressed. Missing paths are present with a JSON null value.
     */
    public static @NotNull List<JsonObject> project(@NotNull List<Document> records, @NotNull List<String> fields) {
        List<FieldPath> paths = new ArrayList<>(fields.size());
        for (String field : fields) {
            paths.add(FieldPath.parse(field));
        }
        List<JsonObject> result = new ArrayList<>(records.size());
        for (Document record : records) {
            JsonObject projected = JsonObject.EMPTY;
            for (FieldPath path : paths) {
                JsonValue value = path.get(record.data());
                projected = path.set(projected, value == null ? JsonNull.INSTANCE : value);
            }
            result.add(projected);
        }
        return result;
    }

    /**
     * Partitions records by the field's value. Keys are normalized so that {@code 1} and
     * {@code 1.0} share a bucket; a missing field lands under {@link JsonNull#INSTANCE}.
     * Buckets appear in first-seen order.
     */
    public static @NotNull Map<JsonValue, List<Document>> groupBy(@NotNull List<Document> records, @NotNull String field) {
        FieldPath path = FieldPath.parse(field);
        Map<JsonValue, List<Document>> groups = new LinkedHashMap<>();
        for (Document record : records) {
            JsonValue key = JsonValues.normalize(path.get(record.data()));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    /**
     * Reduces the field's values over {@code records}.
     *
     * <p>{@code COUNT} is the number of records. {@code SUM} and {@code AVG} use the numeric
     * values only; {@code MIN} and {@code MAX} use every present value. When nothing is left
     * to aggregate the result is {@link JsonNull#INSTANCE}.</p>
     *
     * @throws IllegalArgumentException if {@code MIN}/{@code MAX} meet values of different kinds
     */
    public static @NotNull JsonValue aggregate(@NotNull List<Document> records, @NotNull String field,
                                               @NotNull AggregationType type) {
        if (type == AggregationType.COUNT) {
            return JsonNumber.of(records.size());
        }
        FieldPath path = FieldPath.parse(field);
        List<JsonValue> values = new ArrayList<>(records.size());
        for (Document record : records) {
            JsonValue value = path.get(record.data());
            if (!JsonValues.isMissing(value)) {
                values.add(value);
            }
        }
        if (values.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        return switch (type) {
            case SUM -> sumNumbers(values);
            case AVG -> avgNumbers(values);
            case MIN -> extreme(values, field, false);
            case MAX -> extreme(values, field, true);
            case COUNT -> JsonNumber.of(records.size());
        };
    }

    public static @NotNull JsonValue aggregate(@NotNull List<Document> records, @NotNull String field, @NotNull String type) {
        return aggregate(records, field, AggregationType.fromName(type));
    }

    private static JsonValue sumNumbers(List<JsonValue> values) {
        BigInteger integral = BigInteger.ZERO;
        double sum = 0d;
        boolean seen = false;
        boolean floating = false;
        for (JsonValue value : values) {
            if (value instanceof JsonNumber number) {
                seen = true;
                if (number.isIntegral() && !floating) {
                    integral = integral.add(number.toBigDecimal().toBigInteger());
                } else {
                    if (!floating) {
                        sum = integral.doubleValue();
                        floating = true;
                    }
                    sum += number.doubleValue();
                }
            }
        }
        if (!seen) {
            return JsonNull.INSTANCE;
        }
        return floating ? JsonNumber.of(sum) : JsonNumber.of(integral);
    }

    private static JsonValue avgNumbers(List<JsonValue> values) {
        double sum = 0d;
        long count = 0;
        for (JsonValue value : values) {
            if (value instanceof JsonNumber number) {
                sum += number.doubleValue();
                count++;
            }
        }
        return count == 0 ? JsonNull.INSTANCE : JsonNumber.of(sum / count);
    }

    private static JsonValue extreme(List<JsonValue> values, String field, boolean max) {
        JsonValue best = values.get(0);
        for (JsonValue value : values) {
            if (!JsonValues.sameKind(best, value)) {
                throw new IllegalArgumentException("Cannot compute " + (max ? "max" : "min") + " of '" + field
                    + "': mixes " + best.kind() + " and " + value.kind() + " values");
            }
            int cmp = JsonValues.compare(value, best);
            if (max ? cmp > 0 : cmp < 0) {
                best = value;
            }
        }
        return best;
    }

    /**
     * Stable sort on the field. Records without a value for it come last in both directions.
     */
    public static @NotNull List<Document> sort(@NotNull List<Document> records, @NotNull String field, boolean ascending) {
        return sort(records, field, SortOrder.of(ascending));
    }

    public static @NotNull List<Document> sort(@NotNull List<Document> records, @NotNull String field, @NotNull SortOrder order) {
        List<Document> sorted = new ArrayList<>(records);
        sorted.sort(createComparator(FieldPath.parse(field), order));
        return sorted;
    }

    static @NotNull Comparator<Document> createComparator(@NotNull FieldPath path, @NotNull SortOrder order) {
        Comparator<JsonValue> values = order == SortOrder.DESCENDING
            ? JsonValues.NATURAL_ORDER.reversed()
            : JsonValues.NATURAL_ORDER;
        return (left, right) -> {
            JsonValue a = path.get(left.data());
            JsonValue b = path.get(right.data());
            boolean aMissing = JsonValues.isMissing(a);
            boolean bMissing = JsonValues.isMissing(b);
            if (aMissing || bMissing) {
                return Boolean.compare(aMissing, bMissing);
            }
            return values.compare(a, b);
        };
    }

    /**
     * Returns the slice {@code [offset, offset + count)}, clipped to the list.
     *
     * @throws IllegalArgumentException if {@code count} or {@code offset} is negative
     */
    public static @NotNull List<Document> limit(@NotNull List<Document> records, int count, int offset) {
        if (count < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative: count=" + count + ", offset=" + offset);
        }
        Objects.requireNonNull(records, "records");
        int from = Math.min(offset, records.size());
        int to = (int) Math.min((long) from + count, records.size());
        return new ArrayList<>(records.subList(from, to));
    }

    public static @NotNull List<Document> limit(@NotNull List<Document> records, int count) {
        return limit(records, count, 0);
    }
}
