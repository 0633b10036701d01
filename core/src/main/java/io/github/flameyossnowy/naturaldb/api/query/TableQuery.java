package io.github.flameyossnowy.naturaldb.api.query;

import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.options.AggregationType;
import io.github.flameyossnowy.naturaldb.api.options.Operator;
import io.github.flameyossnowy.naturaldb.api.options.SortOrder;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Chainable query over a snapshot of records.
 *
 * <p>Every non-terminal call returns a new {@code TableQuery} and leaves the receiver
 * untouched, so a partially built query can be reused as the base of several others.</p>
 *
 * <pre>{@code
 * List<Document> adults = engine.table("users")
 *     .where("age", JsonNumber.of(18), Operator.GTE)
 *     .orderBy("name")
 *     .limit(10)
 *     .all();
 * }</pre>
 */
public final class TableQuery {
    private final List<Document> records;

    private TableQuery(List<Document> records) {
        this.records = records;
    }

    @Contract("_ -> new")
    public static @NotNull TableQuery of(@NotNull List<Document> records) {
        return new TableQuery(List.copyOf(records));
    }

    public @NotNull TableQuery filter(@NotNull Predicate<Document> condition) {
        return new TableQuery(QueryOperations.filter(records, condition));
    }

    public @NotNull TableQuery filterBy(@NotNull String field, @Nullable JsonValue value, @NotNull Operator operator) {
        return new TableQuery(QueryOperations.filterByField(records, field, value, operator));
    }

    public @NotNull TableQuery filterBy(@NotNull String field, @Nullable Object value, @NotNull String operator) {
        return filterBy(field, JsonValue.of(value), Operator.fromName(operator));
    }

    public @NotNull TableQuery filterBy(@NotNull String field, @Nullable Object value) {
        return filterBy(field, JsonValue.of(value), Operator.EQ);
    }

    public @NotNull TableQuery where(@NotNull String field, @Nullable JsonValue value, @NotNull Operator operator) {
        return filterBy(field, value, operator);
    }

    public @NotNull TableQuery where(@NotNull String field, @Nullable Object value, @NotNull String operator) {
        return filterBy(field, value, operator);
    }

    public @NotNull TableQuery where(@NotNull String field, @Nullable Object value) {
        return filterBy(field, value);
    }

    public @NotNull TableQuery sort(@NotNull String field, boolean ascending) {
        return new TableQuery(QueryOperations.sort(records, field, ascending));
    }

    public @NotNull TableQuery sort(@NotNull String field) {
        return sort(field, true);
    }

    public @NotNull TableQuery orderBy(@NotNull String field, @NotNull SortOrder order) {
        return new TableQuery(QueryOperations.sort(records, field, order));
    }

    public @NotNull TableQuery orderBy(@NotNull String field, boolean ascending) {
        return sort(field, ascending);
    }

    public @NotNull TableQuery orderBy(@NotNull String field) {
        return sort(field, true);
    }

    public @NotNull TableQuery limit(int count, int offset) {
        return new TableQuery(QueryOperations.limit(records, count, offset));
    }

    public @NotNull TableQuery limit(int count) {
        return limit(count, 0);
    }

    public @NotNull TableQuery skip(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("skip offset must not be negative: " + offset);
        }
        return new TableQuery(QueryOperations.limit(records, Integer.MAX_VALUE, offset));
    }

    public @NotNull List<Document> all() {
        return records;
    }

    public @NotNull List<Document> execute() {
        return all();
    }

    public @NotNull Optional<Document> first() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    public @NotNull Optional<Document> last() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    public int count() {
        return records.size();
    }

    public @NotNull List<JsonObject> project(@NotNull List<String> fields) {
        return QueryOperations.project(records, fields);
    }

    public @NotNull List<JsonObject> select(@NotNull List<String> fields) {
        return project(fields);
    }

    public @NotNull List<JsonObject> select(@NotNull String... fields) {
        return project(List.of(fields));
    }

    public @NotNull Map<JsonValue, List<Document>> groupBy(@NotNull String field) {
        return QueryOperations.groupBy(records, field);
    }

    public @NotNull JsonValue aggregate(@NotNull String field, @NotNull AggregationType type) {
        return QueryOperations.aggregate(records, field, type);
    }

    /** The data objects of the current records, in order. */
    public @NotNull List<JsonObject> toDict() {
        List<JsonObject> result = new ArrayList<>(records.size());
        for (Document record : records) {
            result.add(record.data());
        }
        return result;
    }
}
