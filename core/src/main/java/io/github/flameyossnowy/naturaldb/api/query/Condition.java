package io.github.flameyossnowy.naturaldb.api.query;

import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.options.Operator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One field comparison, usable as a record predicate.
 */
public record Condition(@NotNull String field, @NotNull Operator operator, @Nullable JsonValue value) implements Predicate<Document> {
    public Condition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
    }

    public static @NotNull Condition eq(@NotNull String field, @Nullable JsonValue value) {
        return new Condition(field, Operator.EQ, value);
    }

    public static @NotNull Condition of(@NotNull String field, @NotNull String operator, @Nullable Object value) {
        return new Condition(field, Operator.fromName(operator), JsonValue.of(value));
    }

    @Override
    public boolean test(@NotNull Document record) {
        return QueryOperations.matches(FieldPath.parse(field).get(record.data()), value, operator);
    }
}
