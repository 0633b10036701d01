package io.github.flameyossnowy.naturaldb.file.engine;

import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.NaturalDbException;
import io.github.flameyossnowy.naturaldb.api.json.JsonArray;
import io.github.flameyossnowy.naturaldb.api.json.JsonBoolean;
import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonNumber;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.json.JsonValues;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.model.Index;
import io.github.flameyossnowy.naturaldb.api.model.Table;
import io.github.flameyossnowy.naturaldb.api.operation.OperationResult;
import io.github.flameyossnowy.naturaldb.api.options.AggregationType;
import io.github.flameyossnowy.naturaldb.api.options.JoinType;
import io.github.flameyossnowy.naturaldb.api.options.Operator;
import io.github.flameyossnowy.naturaldb.api.query.Condition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Hand-written table of the {@link QueryEngine} operations exposed to callers that speak
 * JSON: an HTTP layer, a command line or a language model issuing function calls.
 *
 * <p>Each entry has a name, a description, a parameter schema, a sensitive flag and a
 * handler. Sensitive operations ({@code update}, {@code delete}, {@code drop_table}) only
 * run when a {@link ConfirmationCallback} approves them.</p>
 */
public final class OperationRegistry {
    private final QueryEngine engine;
    private final Map<String, OperationSpec> operations = new LinkedHashMap<>();

    public OperationRegistry(@NotNull QueryEngine engine) {
        this.engine = engine;
        registerAll();
    }

    public @NotNull Optional<OperationSpec> find(@NotNull String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public @NotNull Collection<OperationSpec> operations() {
        return Collections.unmodifiableCollection(operations.values());
    }

    public boolean isSensitive(@NotNull String name) {
        OperationSpec spec = operations.get(name);
        return spec != null && spec.sensitive();
    }

    /**
     * Renders every operation as a function-calling tool definition.
     */
    public @NotNull JsonArray schema() {
        List<JsonValue> tools = new ArrayList<>(operations.size());
        for (OperationSpec spec : operations.values()) {
            tools.add(spec.toSchema());
        }
        return new JsonArray(tools);
    }

    public @NotNull OperationResult<JsonValue> invoke(@NotNull String name, @NotNull JsonObject arguments) {
        return invoke(name, arguments, null);
    }

    /**
     * Runs one operation.
     *
     * @throws IllegalArgumentException for an unknown operation or a missing or mistyped argument
     */
    public @NotNull OperationResult<JsonValue> invoke(@NotNull String name, @NotNull JsonObject arguments,
                                                      @Nullable ConfirmationCallback confirmation) {
        OperationSpec spec = operations.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown operation: " + name);
        }
        if (spec.sensitive()) {
            if (confirmation == null) {
                return OperationResult.failure(new NaturalDbException(ErrorCode.OPERATION_REJECTED,
                    "Confirmation required for " + name + " operation"));
            }
            if (!confirmation.confirm(name, arguments)) {
                return OperationResult.failure(new NaturalDbException(ErrorCode.OPERATION_REJECTED,
                    "Operation " + name + " cancelled by user"));
            }
        }
        for (Parameter parameter : spec.parameters()) {
            if (parameter.required() && !arguments.containsKey(parameter.name())) {
                throw new IllegalArgumentException("Missing argument '" + parameter.name() + "' for " + name);
            }
        }
        return spec.handler().apply(arguments);
    }

    private void registerAll() {
        register("create_table", "Create a new table in the database", false,
            List.of(TABLE_NAME,
                Parameter.optional("indexes", "object", "Index name to list of indexed fields"),
                Parameter.optional("keys", "array", "Key field names")),
            args -> {
                Table table = Table.of(string(args, "table_name"));
                JsonObject indexes = args.getObject("indexes");
                if (indexes != null) {
                    for (Map.Entry<String, JsonValue> index : indexes.members().entrySet()) {
                        table = table.withIndex(new Index(index.getKey(), strings(index.getValue(), "indexes." + index.getKey())));
                    }
                }
                if (args.containsKey("keys") && !args.get("keys").isNull()) {
                    table = table.withKeys(strings(args.get("keys"), "keys"));
                }
                return engine.createTable(table).map(JsonBoolean::of);
            });

        register("drop_table", "Delete a table and all of its records", true,
            List.of(TABLE_NAME),
            args -> engine.dropTable(string(args, "table_name")).map(JsonBoolean::of));

        register("list_tables", "List the tables of the database", false,
            List.of(),
            args -> engine.listTables().map(OperationRegistry::stringArray));

        register("insert", "Insert a record, replacing any record with the same id", false,
            List.of(TABLE_NAME, RECORD_ID, Parameter.required("data", "object", "The record data")),
            args -> engine.insert(string(args, "table_name"), string(args, "record_id"), object(args, "data"))
                .map(JsonBoolean::of));

        register("find_by_id", "Find a record by its id", false,
            List.of(TABLE_NAME, RECORD_ID),
            args -> engine.findById(string(args, "table_name"), string(args, "record_id"))
                .map(OperationRegistry::document));

        register("find_all", "Return every record of a table", false,
            List.of(TABLE_NAME),
            args -> engine.findAll(string(args, "table_name")).map(OperationRegistry::documents));

        register("update", "Replace the data of an existing record", true,
            List.of(TABLE_NAME, RECORD_ID, Parameter.required("data", "object", "The new record data")),
            args -> engine.update(string(args, "table_name"), string(args, "record_id"), object(args, "data"))
                .map(JsonBoolean::of));

        register("delete", "Delete a record by its id", true,
            List.of(TABLE_NAME, RECORD_ID),
            args -> engine.delete(string(args, "table_name"), string(args, "record_id")).map(JsonBoolean::of));

        register("filter", "Find the records whose field compares to a value", false,
            List.of(TABLE_NAME, FIELD_NAME,
                Parameter.required("value", null, "The value to compare against"),
                Parameter.optional("operator", "string", "One of eq, ne, gt, gte, lt, lte, contains (default eq)")),
            args -> engine.filter(string(args, "table_name"), string(args, "field_name"), args.get("value"),
                    operator(args)).map(OperationRegistry::documents));

        register("project", "Return only the given fields of each record, optionally filtered", false,
            List.of(TABLE_NAME,
                Parameter.required("fields", "array", "Dot-notation field paths to keep"),
                Parameter.optional("conditions", "object", "Field name to a value or to {\"operator\", \"value\"}")),
            args -> engine.project(string(args, "table_name"), strings(args.get("fields"), "fields"), conditions(args))
                .map(OperationRegistry::objects));

        register("group_by", "Group records by a field, counting or aggregating each group", false,
            List.of(TABLE_NAME, FIELD_NAME,
                Parameter.optional("aggregations", "object", "Field name to one of count, sum, avg, min, max")),
            args -> {
                String table = string(args, "table_name");
                String field = string(args, "field_name");
                JsonObject aggregations = args.getObject("aggregations");
                if (aggregations == null || aggregations.isEmpty()) {
                    return engine.groupBy(table, field).map(counts -> {
                        Map<JsonValue, String> names = groupKeys(counts.keySet());
                        JsonObject.Builder result = JsonObject.builder();
                        counts.forEach((key, count) -> result.put(names.get(key), count));
                        return result.build();
                    });
                }
                Map<String, AggregationType> types = new LinkedHashMap<>();
                aggregations.members().forEach((name, type) -> types.put(name, AggregationType.fromName(text(type, "aggregations." + name))));
                return engine.groupBy(table, field, types).map(groups -> {
                    Map<JsonValue, String> names = groupKeys(groups.keySet());
                    JsonObject.Builder result = JsonObject.builder();
                    groups.forEach((key, row) -> result.put(names.get(key), row));
                    return result.build();
                });
            });

        register("sort", "Sort the records of a table by a field", false,
            List.of(TABLE_NAME, FIELD_NAME,
                Parameter.optional("ascending", "boolean", "Sort direction (default true)"),
                Parameter.optional("limit", "integer", "Keep only this many records")),
            args -> {
                JsonValue limit = args.get("limit");
                Integer max = JsonValues.isMissing(limit) ? null : clampToInt(number(limit, "limit"));
                return engine.sort(string(args, "table_name"), string(args, "field_name"), bool(args, "ascending", true), max)
                    .map(OperationRegistry::documents);
            });

        register("join", "Join two tables on matching field values", false,
            List.of(
                Parameter.required("left_table", "string", "The left table"),
                Parameter.required("right_table", "string", "The right table"),
                Parameter.required("left_field", "string", "Join field of the left table"),
                Parameter.required("right_field", "string", "Join field of the right table"),
                Parameter.optional("join_type", "string", "inner or left (default inner)"),
                Parameter.optional("left_prefix", "string", "Prefix for the left table's fields"),
                Parameter.optional("right_prefix", "string", "Prefix for the right table's fields")),
            args -> engine.join(string(args, "left_table"), string(args, "right_table"),
                    string(args, "left_field"), string(args, "right_field"),
                    JoinType.fromName(optionalString(args, "join_type", "inner")),
                    optionalString(args, "left_prefix", ""), optionalString(args, "right_prefix", ""))
                .map(OperationRegistry::objects));

        register("count", "Count the records of a table", false,
            List.of(TABLE_NAME),
            args -> engine.count(string(args, "table_name")).map(count -> JsonNumber.of(count)));

        register("import_from_json_file", "Import records from a JSON file holding an object or an array", false,
            List.of(TABLE_NAME, Parameter.required("file_path", "string", "Path of the JSON file")),
            args -> engine.importFromJsonFile(string(args, "table_name"), Path.of(string(args, "file_path")))
                .map(count -> JsonNumber.of(count)));

        register("export_to_json_file", "Export every record of a table to a JSON file", false,
            List.of(TABLE_NAME, Parameter.required("file_path", "string", "Path of the JSON file"),
                Parameter.optional("pretty", "boolean", "Indent the output (default true)")),
            args -> engine.exportToJsonFile(string(args, "table_name"), Path.of(string(args, "file_path")),
                    bool(args, "pretty", true))
                .map(count -> JsonNumber.of(count)));
    }

    private void register(String name, String description, boolean sensitive, List<Parameter> parameters,
                          Function<JsonObject, OperationResult<JsonValue>> handler) {
        operations.put(name, new OperationSpec(name, description, parameters, sensitive, handler));
    }

    private static final Parameter TABLE_NAME = Parameter.required("table_name", "string", "Name of the table");
    private static final Parameter RECORD_ID = Parameter.required("record_id", "string", "Id of the record");
    private static final Parameter FIELD_NAME = Parameter.required("field_name", "string", "Field name, dot-notation for nested fields");

    private static String string(JsonObject args, String name) {
        return text(args.get(name), name);
    }

    private static String optionalString(JsonObject args, String name, String fallback) {
        JsonValue value = args.get(name);
        return JsonValues.isMissing(value) ? fallback : text(value, name);
    }

    // numbers are accepted where ids are expected, as in {"record_id": 3}
    private static String text(@Nullable JsonValue value, String name) {
        if (value instanceof JsonString s) {
            return s.value();
        }
        if (value instanceof JsonNumber n && n.isIntegral()) {
            return n.toString();
        }
        throw new IllegalArgumentException("Argument '" + name + "' must be a string");
    }

    private static JsonObject object(JsonObject args, String name) {
        if (args.get(name) instanceof JsonObject object) {
            return object;
        }
        throw new IllegalArgumentException("Argument '" + name + "' must be an object");
    }

    private static long number(JsonValue value, String name) {
        if (value instanceof JsonNumber n && n.isIntegral()) {
            return n.longValue();
        }
        throw new IllegalArgumentException("Argument '" + name + "' must be an integer");
    }

    // saturating, so an oversized limit keeps every record
    private static int clampToInt(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private static boolean bool(JsonObject args, String name, boolean fallback) {
        JsonValue value = args.get(name);
        if (JsonValues.isMissing(value)) {
            return fallback;
        }
        if (value instanceof JsonBoolean b) {
            return b.value();
        }
        throw new IllegalArgumentException("Argument '" + name + "' must be a boolean");
    }

    private static List<String> strings(@Nullable JsonValue value, String name) {
        if (!(value instanceof JsonArray array)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an array of strings");
        }
        List<String> result = new ArrayList<>(array.size());
        for (JsonValue element : array) {
            result.add(text(element, name));
        }
        return result;
    }

    private static Operator operator(JsonObject args) {
        return Operator.fromName(optionalString(args, "operator", "eq"));
    }

    private static List<Condition> conditions(JsonObject args) {
        JsonObject conditions = args.getObject("conditions");
        if (conditions == null) {
            return List.of();
        }
        List<Condition> result = new ArrayList<>(conditions.size());
        for (Map.Entry<String, JsonValue> entry : conditions.members().entrySet()) {
            if (entry.getValue() instanceof JsonObject spec && spec.containsKey("value")) {
                result.add(new Condition(entry.getKey(), Operator.fromName(optionalString(spec, "operator", "eq")), spec.get("value")));
            } else {
                result.add(Condition.eq(entry.getKey(), entry.getValue()));
            }
        }
        return result;
    }

    /**
     * Object member names for group keys. Keys render in their plain string form; when a string
     * key would share its name with a key of another kind (the string {@code "1"} and the
     * number {@code 1}) the string key is rendered as quoted JSON instead.
     */
    static @NotNull Map<JsonValue, String> groupKeys(@NotNull Collection<JsonValue> keys) {
        Map<String, Integer> uses = new HashMap<>();
        for (JsonValue key : keys) {
            uses.merge(plainName(key), 1, Integer::sum);
        }
        Map<JsonValue, String> names = new LinkedHashMap<>();
        for (JsonValue key : keys) {
            String name = plainName(key);
            names.put(key, key instanceof JsonString && uses.get(name) > 1 ? JsonCodec.serialize(key) : name);
        }
        return names;
    }

    private static String plainName(JsonValue key) {
        return key.isNull() ? "null" : JsonValues.stringForm(key);
    }

    private static JsonValue document(Document record) {
        return JsonObject.builder().put("id", record.id()).put("data", record.data()).build();
    }

    private static JsonValue documents(List<Document> records) {
        List<JsonValue> result = new ArrayList<>(records.size());
        for (Document record : records) {
            result.add(document(record));
        }
        return new JsonArray(result);
    }

    private static JsonValue objects(List<JsonObject> objects) {
        return new JsonArray(new ArrayList<>(objects));
    }

    private static JsonValue stringArray(List<String> values) {
        List<JsonValue> result = new ArrayList<>(values.size());
        for (String value : values) {
            result.add(new JsonString(value));
        }
        return new JsonArray(result);
    }

    /**
     * Approves or rejects a sensitive operation before it runs.
     */
    @FunctionalInterface
    public interface ConfirmationCallback {
        boolean confirm(@NotNull String operation, @NotNull JsonObject arguments);
    }

    /**
     * One parameter of an operation. A {@code null} type accepts any JSON value.
     */
    public record Parameter(@NotNull String name, @Nullable String type, boolean required, @NotNull String description) {
        static Parameter required(String name, @Nullable String type, String description) {
            return new Parameter(name, type, true, description);
        }

        static Parameter optional(String name, @Nullable String type, String description) {
            return new Parameter(name, type, false, description);
        }
    }

    public record OperationSpec(@NotNull String name, @NotNull String description, @NotNull List<Parameter> parameters,
                                boolean sensitive, @NotNull Function<JsonObject, OperationResult<JsonValue>> handler) {
        public OperationSpec {
            parameters = List.copyOf(parameters);
        }

        @NotNull JsonObject toSchema() {
            JsonObject.Builder properties = JsonObject.builder();
            List<JsonValue> required = new ArrayList<>();
            for (Parameter parameter : parameters) {
                JsonObject.Builder property = JsonObject.builder();
                if (parameter.type() != null) {
                    property.put("type", parameter.type());
                }
                property.put("description", parameter.description());
                properties.put(parameter.name(), property.build());
                if (parameter.required()) {
                    required.add(new JsonString(parameter.name()));
                }
            }
            return JsonObject.builder()
                .put("type", "function")
                .put("name", name)
                .put("description", description)
                .put("parameters", JsonObject.builder()
                    .put("type", "object")
                    .put("properties", properties.build())
                    .put("required", new JsonArray(required))
                    .build())
                .build();
        }
    }
}
