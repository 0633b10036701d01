import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.NaturalDbException;
import io.github.flameyossnowy.naturaldb.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.naturaldb.api.json.JsonArray;
import io.github.flameyossnowy.naturaldb.api.json.JsonBoolean;
import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonNumber;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.model.Database;
import io.github.flameyossnowy.naturaldb.api.model.User;
import io.github.flameyossnowy.naturaldb.api.operation.OperationResult;
import io.github.flameyossnowy.naturaldb.file.NaturalDB;
import io.github.flameyossnowy.naturaldb.file.engine.OperationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OperationRegistryTest {
    @TempDir
    Path dir;

    OperationRegistry registry;

    @BeforeEach
    void setup() {
        registry = NaturalDB.open(dir).operations(User.of("alice"), new Database("shop"));
    }

    static JsonObject args(String json) {
        return JsonCodec.parseObject(json);
    }

    JsonValue call(String operation, String json) {
        return registry.invoke(operation, args(json), (name, arguments) -> true).expect(operation);
    }

    @Test
    void schemaListsEveryOperation() {
        JsonArray schema = registry.schema();
        Set<String> names = new HashSet<>();
        for (JsonValue tool : schema) {
            JsonObject object = (JsonObject) tool;
            assertEquals("function", object.getString("type"));
            assertEquals("object", object.getObject("parameters").getString("type"));
            names.add(object.getString("name"));
        }
        assertEquals(Set.of("create_table", "drop_table", "list_tables", "insert", "find_by_id", "find_all",
            "update", "delete", "filter", "project", "group_by", "sort", "join", "count",
            "import_from_json_file", "export_to_json_file"), names);
    }

    @Test
    void insertSchemaDescribesRequiredParameters() {
        JsonObject insert = (JsonObject) registry.schema().get(3);
        assertEquals("insert", insert.getString("name"));
        JsonObject parameters = insert.getObject("parameters");
        assertEquals(JsonCodec.parse("[\"table_name\",\"record_id\",\"data\"]"), parameters.get("required"));
        assertEquals("object", parameters.getObject("properties").getObject("data").getString("type"));
    }

    @Test
    void onlyWritesThatDestroyDataAreSensitive() {
        List<String> sensitive = new ArrayList<>();
        for (OperationRegistry.OperationSpec spec : registry.operations()) {
            if (spec.sensitive()) {
                sensitive.add(spec.name());
            }
        }
        assertEquals(List.of("drop_table", "update", "delete"), sensitive);
        assertTrue(registry.isSensitive("delete"));
        assertFalse(registry.isSensitive("insert"));
        assertFalse(registry.isSensitive("unknown"));
    }

    @Test
    void insertFindAndFilterThroughJsonArguments() {
        assertEquals(JsonBoolean.TRUE, call("insert", "{\"table_name\":\"Products\",\"record_id\":\"1\",\"data\":{\"price\":899}}"));
        call("insert", "{\"table_name\":\"Products\",\"record_id\":\"2\",\"data\":{\"price\":799}}");
        call("insert", "{\"table_name\":\"Products\",\"record_id\":3,\"data\":{\"price\":1199}}");

        assertEquals(args("{\"id\":\"1\",\"data\":{\"price\":899}}"),
            call("find_by_id", "{\"table_name\":\"Products\",\"record_id\":\"1\"}"));
        assertEquals(JsonCodec.parse("[{\"id\":\"3\",\"data\":{\"price\":1199}}]"),
            call("filter", "{\"table_name\":\"Products\",\"field_name\":\"price\",\"value\":900,\"operator\":\"gt\"}"));
        assertEquals(JsonNumber.of(3), call("count", "{\"table_name\":\"Products\"}"));
    }

    @Test
    void groupByRendersKeysAsStrings() {
        call("insert", "{\"table_name\":\"p\",\"record_id\":\"1\",\"data\":{\"c\":\"A\",\"n\":2}}");
        call("insert", "{\"table_name\":\"p\",\"record_id\":\"2\",\"data\":{\"c\":\"A\",\"n\":3}}");
        call("insert", "{\"table_name\":\"p\",\"record_id\":\"3\",\"data\":{\"c\":\"B\",\"n\":5}}");

        assertEquals(args("{\"A\":2,\"B\":1}"), call("group_by", "{\"table_name\":\"p\",\"field_name\":\"c\"}"));
        assertEquals(args("{\"A\":{\"count\":2,\"max_n\":3},\"B\":{\"count\":1,\"max_n\":5}}"),
            call("group_by", "{\"table_name\":\"p\",\"field_name\":\"c\",\"aggregations\":{\"n\":\"max\"}}"));
    }

    @Test
    void groupByKeepsStringAndNumberKeysApart() {
        call("insert", "{\"table_name\":\"k\",\"record_id\":\"1\",\"data\":{\"c\":1}}");
        call("insert", "{\"table_name\":\"k\",\"record_id\":\"2\",\"data\":{\"c\":\"1\"}}");
        call("insert", "{\"table_name\":\"k\",\"record_id\":\"3\",\"data\":{\"c\":\"1\"}}");
        call("insert", "{\"table_name\":\"k\",\"record_id\":\"4\",\"data\":{\"c\":\"x\"}}");

        assertEquals(args("{\"1\":1,\"\\\"1\\\"\":2,\"x\":1}"),
            call("group_by", "{\"table_name\":\"k\",\"field_name\":\"c\"}"));
    }

    @Test
    void sortLimitBeyondIntRange() {
        call("insert", "{\"table_name\":\"s\",\"record_id\":\"1\",\"data\":{\"n\":2}}");
        call("insert", "{\"table_name\":\"s\",\"record_id\":\"2\",\"data\":{\"n\":1}}");

        JsonArray all = (JsonArray) call("sort", "{\"table_name\":\"s\",\"field_name\":\"n\",\"limit\":9999999999}");
        assertEquals(2, all.size());
        assertThrows(IllegalArgumentException.class, () -> registry.invoke("sort",
            args("{\"table_name\":\"s\",\"field_name\":\"n\",\"limit\":-9999999999}")));
    }

    @Test
    void sensitiveOperationsNeedConfirmation() {
        call("insert", "{\"table_name\":\"t\",\"record_id\":\"1\",\"data\":{}}");
        JsonObject delete = args("{\"table_name\":\"t\",\"record_id\":\"1\"}");

        OperationResult<JsonValue> unconfirmed = registry.invoke("delete", delete);
        assertTrue(unconfirmed.isFailure());
        assertEquals(ErrorCode.OPERATION_REJECTED, ((NaturalDbException) unconfirmed.error().orElseThrow()).getErrorCode());

        List<String> asked = new ArrayList<>();
        OperationResult<JsonValue> declined = registry.invoke("delete", delete, (name, arguments) -> {
            asked.add(name + ":" + arguments.getString("record_id"));
            return false;
        });
        assertTrue(declined.isFailure());
        assertEquals(List.of("delete:1"), asked);
        assertEquals(JsonNumber.of(1), call("count", "{\"table_name\":\"t\"}"));

        assertEquals(JsonBoolean.TRUE, call("delete", "{\"table_name\":\"t\",\"record_id\":\"1\"}"));
        assertEquals(JsonNumber.of(0), call("count", "{\"table_name\":\"t\"}"));
    }

    @Test
    void failuresKeepTheirCause() {
        call("create_table", "{\"table_name\":\"t\"}");
        OperationResult<JsonValue> result = registry.invoke("update",
            args("{\"table_name\":\"t\",\"record_id\":\"9\",\"data\":{}}"), (name, arguments) -> true);
        assertInstanceOf(RecordNotFoundException.class, result.error().orElseThrow());
    }

    @Test
    void badArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.invoke("explode", JsonObject.EMPTY));
        assertThrows(IllegalArgumentException.class, () -> registry.invoke("count", JsonObject.EMPTY));
        assertThrows(IllegalArgumentException.class, () -> registry.invoke("count", args("{\"table_name\":[1]}")));
        assertThrows(IllegalArgumentException.class,
            () -> registry.invoke("insert", args("{\"table_name\":\"t\",\"record_id\":\"1\",\"data\":5}")));
    }

    @Test
    void createTableWithIndexesAndJoin() {
        assertEquals(JsonBoolean.TRUE, call("create_table",
            "{\"table_name\":\"users\",\"indexes\":{\"by_name\":[\"name\"]},\"keys\":[\"uid\"]}"));
        call("insert", "{\"table_name\":\"users\",\"record_id\":\"1\",\"data\":{\"uid\":1,\"name\":\"Ann\"}}");
        call("insert", "{\"table_name\":\"orders\",\"record_id\":\"a\",\"data\":{\"user\":1,\"total\":5}}");

        assertEquals(JsonCodec.parse("[\"orders\",\"users\"]"), call("list_tables", "{}"));
        assertEquals(JsonCodec.parse("[{\"l.uid\":1,\"l.name\":\"Ann\",\"r.user\":1,\"r.total\":5}]"),
            call("join", "{\"left_table\":\"users\",\"right_table\":\"orders\",\"left_field\":\"uid\","
                + "\"right_field\":\"user\",\"join_type\":\"inner\",\"left_prefix\":\"l.\",\"right_prefix\":\"r.\"}"));
    }

    @Test
    void exportAndImportThroughFilePaths() throws Exception {
        call("insert", "{\"table_name\":\"t\",\"record_id\":\"1\",\"data\":{\"v\":1}}");
        Path file = dir.resolve("t.json");
        String path = JsonCodec.serialize(new JsonString(file.toString()));

        assertEquals(JsonNumber.of(1), call("export_to_json_file",
            "{\"table_name\":\"t\",\"file_path\":" + path + ",\"pretty\":false}"));
        assertEquals("[{\"v\":1}]", Files.readString(file));
        assertEquals(JsonNumber.of(1), call("import_from_json_file", "{\"table_name\":\"copy\",\"file_path\":" + path + "}"));
    }
}
