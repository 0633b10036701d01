package io.github.flameyossnowy.naturaldb.api.query;

import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.json.JsonValues;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.options.JoinType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash joins over two record lists.
 *
 * <p>Rows are flattened: every field of the left record is copied under
 * {@code leftPrefix + key}, then every field of the right record under
 * {@code rightPrefix + key}, so on a name collision the right side wins. Records whose
 * join field is absent or null never match.</p>
 */
public final class JoinOperations {
    private JoinOperations() {}

    public static @NotNull List<JsonObject> innerJoin(@NotNull List<Document> left, @NotNull List<Document> right,
                                                      @NotNull String leftField, @NotNull String rightField,
                                                      @NotNull String leftPrefix, @NotNull String rightPrefix) {
        return join(left, right, leftField, rightField, JoinType.INNER, leftPrefix, rightPrefix);
    }

    public static @NotNull List<JsonObject> innerJoin(@NotNull List<Document> left, @NotNull List<Document> right,
                                                      @NotNull String leftField, @NotNull String rightField) {
        return innerJoin(left, right, leftField, rightField, "", "");
    }

    public static @NotNull List<JsonObject> leftJoin(@NotNull List<Document> left, @NotNull List<Document> right,
                                                     @NotNull String leftField, @NotNull String rightField,
                                                     @NotNull String leftPrefix, @NotNull String rightPrefix) {
        return join(left, right, leftField, rightField, JoinType.LEFT, leftPrefix, rightPrefix);
    }

    public static @NotNull List<JsonObject> leftJoin(@NotNull List<Document> left, @NotNull List<Document> right,
                                                     @NotNull String leftField, @NotNull String rightField) {
        return leftJoin(left, right, leftField, rightField, "", "");
    }

    public static @NotNull List<JsonObject> join(@NotNull List<Document> left, @NotNull List<Document> right,
                                                 @NotNull String leftField, @NotNull String rightField,
                                                 @NotNull JoinType type,
                                                 @NotNull String leftPrefix, @NotNull String rightPrefix) {
        FieldPath leftPath = FieldPath.parse(leftField);
        FieldPath rightPath = FieldPath.parse(rightField);

        Map<JsonValue, List<Document>> lookup = new HashMap<>();
        for (Document record : right) {
            JsonValue key = rightPath.get(record.data());
            if (JsonValues.isMissing(key)) {
                continue;
            }
            lookup.computeIfAbsent(JsonValues.normalize(key), k -> new ArrayList<>()).add(record);
        }

        List<JsonObject> rows = new ArrayList<>();
        for (Document record : left) {
            JsonValue key = leftPath.get(record.data());
            List<Document> matches = JsonValues.isMissing(key) ? null : lookup.get(JsonValues.normalize(key));
            if (matches != null) {
                for (Document match : matches) {
                    rows.add(merge(record.data(), leftPrefix, match.data(), rightPrefix));
                }
            } else if (type == JoinType.LEFT) {
                rows.add(merge(record.data(), leftPrefix, JsonObject.EMPTY, rightPrefix));
            }
        }
        return rows;
    }

    private static JsonObject merge(JsonObject left, String leftPrefix, JsonObject right, String rightPrefix) {
        JsonObject.Builder row = JsonObject.builder();
        left.members().forEach((key, value) -> row.put(leftPrefix + key, value));
        right.members().forEach((key, value) -> row.put(rightPrefix + key, value));
        return row.build();
    }
}
