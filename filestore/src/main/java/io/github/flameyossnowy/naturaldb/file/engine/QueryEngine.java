package io.github.flameyossnowy.naturaldb.file.engine;

import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.NaturalDbException;
import io.github.flameyossnowy.naturaldb.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.naturaldb.api.exceptions.StorageException;
import io.github.flameyossnowy.naturaldb.api.exceptions.TableNotFoundException;
import io.github.flameyossnowy.naturaldb.api.exceptions.ValidationException;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.naturaldb.api.json.JsonArray;
import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.json.JsonValues;
import io.github.flameyossnowy.naturaldb.api.model.Database;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.model.Table;
import io.github.flameyossnowy.naturaldb.api.model.User;
import io.github.flameyossnowy.naturaldb.api.operation.OperationResult;
import io.github.flameyossnowy.naturaldb.api.options.AggregationType;
import io.github.flameyossnowy.naturaldb.api.options.JoinType;
import io.github.flameyossnowy.naturaldb.api.options.Operator;
import io.github.flameyossnowy.naturaldb.api.query.Condition;
import io.github.flameyossnowy.naturaldb.api.query.JoinOperations;
import io.github.flameyossnowy.naturaldb.api.query.QueryOperations;
import io.github.flameyossnowy.naturaldb.api.query.TableQuery;
import io.github.flameyossnowy.naturaldb.api.utils.Logging;
import io.github.flameyossnowy.naturaldb.file.io.FileSystem;
import io.github.flameyossnowy.naturaldb.file.path.StoragePaths;
import io.github.flameyossnowy.naturaldb.file.storage.DatabaseStorage;
import io.github.flameyossnowy.naturaldb.file.storage.Storage;
import io.github.flameyossnowy.naturaldb.file.storage.TableStorage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * CRUD and query operations over the tables of one user's database.
 *
 * <p>Every operation returns an {@link OperationResult}. Storage errors, missing tables and
 * missing records become failed results carrying the cause; invalid arguments such as an
 * unknown operator are thrown as {@link IllegalArgumentException}. Queries load the whole
 * table into memory.</p>
 */
public class QueryEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);

    private final User user;
    private final Database database;
    private final DatabaseStorage databaseStorage;
    private final FileSystem fileSystem;
    private final StoragePaths paths;

    public QueryEngine(@NotNull Storage storage, @NotNull FileSystem fileSystem, @NotNull User user,
                       @NotNull Database database) {
        this.user = user;
        this.database = database;
        this.fileSystem = fileSystem;
        this.paths = storage.paths();
        this.databaseStorage = storage.createDatabase(user, database);
    }

    public @NotNull User user() {
        return user;
    }

    public @NotNull Database database() {
        return database;
    }

    public @NotNull OperationResult<Boolean> createTable(@NotNull String table) {
        return createTable(Table.of(table));
    }

    /**
     * Creates the table with its metadata. Succeeds with {@code false} if it already exists.
     */
    public @NotNull OperationResult<Boolean> createTable(@NotNull Table table) {
        return execute("createTable", table.name(), () -> {
            if (databaseStorage.tableExists(table.name())) {
                return false;
            }
            databaseStorage.createTable(table);
            Logging.info(() -> "Created table " + table.name() + " in " + database.name());
            return true;
        });
    }

    public @NotNull OperationResult<Boolean> dropTable(@NotNull String table) {
        return execute("dropTable", table, () -> {
            requireTable(table);
            return databaseStorage.deleteTable(table);
        });
    }

    public @NotNull OperationResult<List<String>> listTables() {
        return execute("listTables", null, databaseStorage::listTables);
    }

    public boolean tableExists(@NotNull String table) {
        return databaseStorage.tableExists(table);
    }

    /**
     * Stores the record, replacing any record with the same id. A missing table is created.
     */
    public @NotNull OperationResult<Boolean> insert(@NotNull String table, @NotNull String id, @NotNull JsonObject data) {
        return insert(table, new Document(id, data));
    }

    public @NotNull OperationResult<Boolean> insert(@NotNull String table, @NotNull Document record) {
        return execute("insert", table, () -> {
            openOrCreate(table).saveRecord(record);
            return true;
        });
    }

    public @NotNull OperationResult<Document> findById(@NotNull String table, @NotNull String id) {
        return execute("findById", table, () -> requireTable(table).loadRecord(id));
    }

    public @NotNull OperationResult<List<Document>> findAll(@NotNull String table) {
        return execute("findAll", table, () -> loadAll(table));
    }

    /**
     * Replaces the data of an existing record. Fails with {@link RecordNotFoundException} if
     * there is nothing to update.
     */
    public @NotNull OperationResult<Boolean> update(@NotNull String table, @NotNull String id, @NotNull JsonObject data) {
        return execute("update", table, () -> {
            TableStorage storage = requireTable(table);
            if (!storage.recordExists(id)) {
                throw new RecordNotFoundException(table, id);
            }
            storage.saveRecord(new Document(id, data));
            return true;
        });
    }

    public @NotNull OperationResult<Boolean> delete(@NotNull String table, @NotNull String id) {
        return execute("delete", table, () -> {
            if (!requireTable(table).deleteRecord(id)) {
                throw new RecordNotFoundException(table, id);
            }
            return true;
        });
    }

    public @NotNull OperationResult<List<Document>> filter(@NotNull String table, @NotNull String field,
                                                          @Nullable JsonValue value, @NotNull Operator operator) {
        return execute("filter", table, () -> QueryOperations.filterByField(loadAll(table), field, value, operator));
    }

    public @NotNull OperationResult<List<Document>> filter(@NotNull String table, @NotNull String field,
                                                          @Nullable Object value, @NotNull String operator) {
        return filter(table, field, JsonValue.of(value), Operator.fromName(operator));
    }

    public @NotNull OperationResult<List<JsonObject>> project(@NotNull String table, @NotNull List<String> fields) {
        return project(table, fields, List.of());
    }

    /**
     * Projects the records that satisfy every condition.
     */
    public @NotNull OperationResult<List<JsonObject>> project(@NotNull String table, @NotNull List<String> fields,
                                                              @NotNull List<Condition> conditions) {
        return execute("project", table, () -> {
            List<Document> records = loadAll(table);
            for (Condition condition : conditions) {
                records = QueryOperations.filter(records, condition);
            }
            return QueryOperations.project(records, fields);
        });
    }

    /**
     * Number of records per distinct value of {@code field}.
     */
    public @NotNull OperationResult<Map<JsonValue, Integer>> groupBy(@NotNull String table, @NotNull String field) {
        return execute("groupBy", table, () -> {
            Map<JsonValue, Integer> counts = new LinkedHashMap<>();
            QueryOperations.groupBy(loadAll(table), field).forEach((key, bucket) -> counts.put(key, bucket.size()));
            return counts;
        });
    }

    /**
     * Per distinct value of {@code field}, an object {@code {"count": n, "<op>_<field>": value}}
     * with one entry per requested aggregation.
     */
    public @NotNull OperationResult<Map<JsonValue, JsonObject>> groupBy(@NotNull String table, @NotNull String field,
                                                                       @NotNull Map<String, AggregationType> aggregations) {
        return execute("groupBy", table, () -> {
            Map<JsonValue, JsonObject> result = new LinkedHashMap<>();
            QueryOperations.groupBy(loadAll(table), field).forEach((key, bucket) -> {
                JsonObject.Builder row = JsonObject.builder().put("count", bucket.size());
                aggregations.forEach((aggregated, type) ->
                    row.put(type.key() + '_' + aggregated, QueryOperations.aggregate(bucket, aggregated, type)));
                result.put(key, row.build());
            });
            return result;
        });
    }

    public @NotNull OperationResult<List<Document>> sort(@NotNull String table, @NotNull String field, boolean ascending) {
        return sort(table, field, ascending, null);
    }

    /**
     * @param limit keep only the first {@code limit} records, or {@code null} for all
     */
    public @NotNull OperationResult<List<Document>> sort(@NotNull String table, @NotNull String field, boolean ascending,
                                                        @Nullable Integer limit) {
        return execute("sort", table, () -> {
            List<Document> sorted = QueryOperations.sort(loadAll(table), field, ascending);
            return limit == null ? sorted : QueryOperations.limit(sorted, limit);
        });
    }

    public @NotNull OperationResult<List<JsonObject>> join(@NotNull String leftTable, @NotNull String rightTable,
                                                          @NotNull String leftField, @NotNull String rightField,
                                                          @NotNull JoinType type) {
        return join(leftTable, rightTable, leftField, rightField, type, "", "");
    }

    public @NotNull OperationResult<List<JsonObject>> join(@NotNull String leftTable, @NotNull String rightTable,
                                                          @NotNull String leftField, @NotNull String rightField,
                                                          @NotNull JoinType type,
                                                          @NotNull String leftPrefix, @NotNull String rightPrefix) {
        return execute("join", leftTable + "," + rightTable, () -> JoinOperations.join(
            loadAll(leftTable), loadAll(rightTable), leftField, rightField, type, leftPrefix, rightPrefix));
    }

    public @NotNull OperationResult<Integer> count(@NotNull String table) {
        return execute("count", table, () -> requireTable(table).size());
    }

    /**
     * Starts a chainable query over the table's current records.
     */
    public @NotNull OperationResult<TableQuery> table(@NotNull String table) {
        return execute("table", table, () -> TableQuery.of(loadAll(table)));
    }

    /**
     * Imports a JSON file holding either one object or an array of objects. Objects without
     * an {@code id} get one: {@code "1"} for a single object, the 1-based position in an array.
     *
     * @return the number of records written
     */
    public @NotNull OperationResult<Integer> importFromJsonFile(@NotNull String table, @NotNull Path file) {
        return execute("importFromJsonFile", table, () -> {
            String text = fileSystem.readFile(file).orElseThrow(() ->
                new StorageException(ErrorCode.IO_FAILURE, "Import file does not exist").withPath(file.toString()));
            JsonValue root = JsonCodec.parse(text);

            List<Document> records = new ArrayList<>();
            if (root instanceof JsonArray array) {
                for (int i = 0; i < array.size(); i++) {
                    if (!(array.get(i) instanceof JsonObject object)) {
                        throw new ValidationException(ErrorCode.INVALID_DATA,
                            "Import element " + i + " is " + array.get(i).kind() + ", expected an object");
                    }
                    records.add(withDefaultId(object, String.valueOf(i + 1)));
                }
            } else if (root instanceof JsonObject object) {
                records.add(withDefaultId(object, "1"));
            } else {
                throw new ValidationException(ErrorCode.INVALID_DATA, "Import root must be an object or an array, found " + root.kind());
            }

            // every id must map to a record file before anything is written
            Path tableDirectory = paths.tableDirectory(databaseStorage.directory(), table);
            for (Document record : records) {
                paths.recordFile(tableDirectory, record.id());
            }

            TableStorage storage = openOrCreate(table);
            for (Document record : records) {
                storage.saveRecord(record);
            }
            Logging.info(() -> "Imported " + records.size() + " records into " + table);
            return records.size();
        });
    }

    /**
     * Writes every record's data of the table as one JSON array.
     *
     * @param pretty indent with two spaces instead of writing compact JSON
     * @return the number of records exported
     */
    public @NotNull OperationResult<Integer> exportToJsonFile(@NotNull String table, @NotNull Path file, boolean pretty) {
        return execute("exportToJsonFile", table, () -> {
            List<JsonValue> data = new ArrayList<>();
            for (Document record : loadAll(table)) {
                data.add(record.data());
            }
            fileSystem.createFile(file, JsonCodec.serialize(new JsonArray(data), pretty ? 2 : 0), true);
            return data.size();
        });
    }

    private static Document withDefaultId(JsonObject object, String fallback) {
        JsonValue id = object.get("id");
        if (JsonValues.isMissing(id)) {
            return new Document(fallback, object.with("id", new JsonString(fallback)));
        }
        return new Document(JsonValues.stringForm(id), object);
    }

    private TableStorage requireTable(String table) {
        if (!databaseStorage.tableExists(table)) {
            throw new TableNotFoundException(table);
        }
        return databaseStorage.table(table);
    }

    private TableStorage openOrCreate(String table) {
        if (databaseStorage.tableExists(table)) {
            return databaseStorage.table(table);
        }
        Logging.info(() -> "Table " + table + " does not exist, creating it");
        return databaseStorage.createTable(Table.of(table));
    }

    private List<Document> loadAll(String table) {
        return new ArrayList<>(requireTable(table).loadAllRecords().values());
    }

    private <T> OperationResult<T> execute(String operation, @Nullable String table, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (NaturalDbException | JsonProcessException | UncheckedIOException e) {
            LOGGER.warn("{} failed (user={}, database={}, table={}): {}", operation, user.id(), database.name(), table, e.getMessage(), e);
            return OperationResult.failure(e);
        }
    }
}
