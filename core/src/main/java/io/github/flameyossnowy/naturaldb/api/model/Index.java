package io.github.flameyossnowy.naturaldb.api.model;

import io.github.flameyossnowy.naturaldb.api.json.JsonArray;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared index. Indexes are written to table metadata and are never consulted by queries.
 */
public record Index(@NotNull String name, @NotNull List<String> fields) {
    public Index {
        fields = List.copyOf(fields);
    }

    public @NotNull JsonObject toJson() {
        List<JsonValue> names = new ArrayList<>(fields.size());
        for (String field : fields) {
            names.add(new JsonString(field));
        }
        return JsonObject.builder()
            .put("name", name)
            .put("fields", new JsonArray(names))
            .build();
    }
}
