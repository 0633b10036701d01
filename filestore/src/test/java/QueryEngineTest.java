import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.NaturalDbException;
import io.github.flameyossnowy.naturaldb.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.naturaldb.api.exceptions.StorageException;
import io.github.flameyossnowy.naturaldb.api.exceptions.TableNotFoundException;
import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonNumber;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.model.Database;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.model.User;
import io.github.flameyossnowy.naturaldb.api.operation.OperationResult;
import io.github.flameyossnowy.naturaldb.api.options.AggregationType;
import io.github.flameyossnowy.naturaldb.api.options.JoinType;
import io.github.flameyossnowy.naturaldb.api.options.Operator;
import io.github.flameyossnowy.naturaldb.api.query.Condition;
import io.github.flameyossnowy.naturaldb.file.NaturalDB;
import io.github.flameyossnowy.naturaldb.file.engine.QueryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {
    @TempDir
    Path dir;

    QueryEngine engine;

    @BeforeEach
    void setup() {
        engine = NaturalDB.open(dir).openDatabase(User.of("alice"), new Database("shop"));
    }

    static JsonObject json(String text) {
        return JsonCodec.parseObject(text);
    }

    static List<String> ids(OperationResult<List<Document>> result) {
        List<String> ids = new ArrayList<>();
        for (Document record : result.expect("query failed")) {
            ids.add(record.id());
        }
        return ids;
    }

    void insertProducts() {
        engine.insert("Products", "1", json("{\"name\":\"Laptop\",\"price\":899,\"category\":\"Electronics\"}"));
        engine.insert("Products", "2", json("{\"name\":\"Phone\",\"price\":799,\"category\":\"Electronics\"}"));
        engine.insert("Products", "3", json("{\"name\":\"Desktop\",\"price\":1199,\"category\":\"Computers\"}"));
        engine.insert("Products", "4", json("{\"name\":\"Monitor\",\"price\":299,\"category\":\"Computers\"}"));
    }

    @Test
    void filterGreaterThanReturnsOnlyExpensiveRecord() {
        engine.insert("Products", "1", json("{\"id\":1,\"price\":899}"));
        engine.insert("Products", "2", json("{\"id\":2,\"price\":799}"));
        engine.insert("Products", "3", json("{\"id\":3,\"price\":1199}"));

        OperationResult<List<Document>> result = engine.filter("Products", "price", 900, "gt");
        assertEquals(List.of("3"), ids(result));
        assertEquals(JsonNumber.of(3), result.expect("filter").get(0).get("id"));
    }

    @Test
    void groupBySplitsIntoBuckets() {
        insertProducts();
        Map<JsonValue, Integer> groups = engine.groupBy("Products", "category").expect("groupBy");

        assertEquals(2, groups.size());
        assertEquals(2, groups.get(new JsonString("Electronics")));
        assertEquals(2, groups.get(new JsonString("Computers")));
    }

    @Test
    void groupByWithAggregations() {
        insertProducts();
        Map<String, AggregationType> aggregations = new LinkedHashMap<>();
        aggregations.put("price", AggregationType.SUM);
        Map<JsonValue, JsonObject> groups = engine.groupBy("Products", "category", aggregations).expect("groupBy");

        assertEquals(json("{\"count\":2,\"sum_price\":1698}"), groups.get(new JsonString("Electronics")));
        assertEquals(json("{\"count\":2,\"sum_price\":1498}"), groups.get(new JsonString("Computers")));
    }

    @Test
    void sortDescendingIgnoresInsertionOrder() {
        engine.insert("People", "a", json("{\"age\":35}"));
        engine.insert("People", "b", json("{\"age\":30}"));
        engine.insert("People", "c", json("{\"age\":25}"));
        assertEquals(List.of("a", "b", "c"), ids(engine.sort("People", "age", false)));

        engine.insert("Reversed", "a", json("{\"age\":25}"));
        engine.insert("Reversed", "b", json("{\"age\":30}"));
        engine.insert("Reversed", "c", json("{\"age\":35}"));
        List<JsonValue> ages = new ArrayList<>();
        for (Document record : engine.sort("Reversed", "age", false).expect("sort")) {
            ages.add(record.get("age"));
        }
        assertEquals(List.of(JsonNumber.of(35), JsonNumber.of(30), JsonNumber.of(25)), ages);
        assertEquals(List.of("c"), ids(engine.sort("Reversed", "age", false, 1)));
    }

    @Test
    void insertThenFindReturnsSameData() {
        JsonObject data = json("{\"name\":\"Ann\",\"tags\":[\"a\",1,2.5,null,true],\"address\":{\"city\":\"Oslo\"}}");
        assertTrue(engine.insert("users", "u1", data).expect("insert"));

        Document found = engine.findById("users", "u1").expect("find");
        assertEquals("u1", found.id());
        assertEquals(data, found.data());
    }

    @Test
    void insertReplacesExistingRecord() {
        engine.insert("users", "u1", json("{\"v\":1}"));
        engine.insert("users", "u1", json("{\"v\":2}"));
        assertEquals(json("{\"v\":2}"), engine.findById("users", "u1").expect("find").data());
        assertEquals(1, engine.count("users").expect("count"));
    }

    @Test
    void updateOfMissingRecordFailsAndLeavesTableUnchanged() {
        engine.insert("users", "u1", json("{\"v\":1}"));

        OperationResult<Boolean> result = engine.update("users", "ghost", json("{\"v\":9}"));
        assertTrue(result.isFailure());
        assertFalse(result.orElse(false));
        assertInstanceOf(RecordNotFoundException.class, result.error().orElseThrow());
        assertEquals(List.of("u1"), ids(engine.findAll("users")));

        assertTrue(engine.update("users", "u1", json("{\"v\":2}")).expect("update"));
        assertEquals(json("{\"v\":2}"), engine.findById("users", "u1").expect("find").data());
    }

    @Test
    void deleteThenFindIsNotFound() {
        engine.insert("users", "u1", json("{\"v\":1}"));
        assertTrue(engine.delete("users", "u1").expect("delete"));

        OperationResult<Document> found = engine.findById("users", "u1");
        assertTrue(found.isFailure());
        assertNull(found.orElse(null));
        assertInstanceOf(RecordNotFoundException.class, found.error().orElseThrow());

        OperationResult<Boolean> again = engine.delete("users", "u1");
        assertFalse(again.orElse(false));
        assertInstanceOf(RecordNotFoundException.class, again.error().orElseThrow());
    }

    @Test
    void missingTableIsReportedAsTableNotFound() {
        for (OperationResult<?> result : List.of(
            engine.findAll("nope"),
            engine.findById("nope", "1"),
            engine.filter("nope", "a", 1, "eq"),
            engine.count("nope"),
            engine.dropTable("nope"),
            engine.table("nope"))) {
            assertTrue(result.isFailure());
            Throwable error = result.error().orElseThrow();
            assertInstanceOf(TableNotFoundException.class, error);
            assertEquals(ErrorCode.TABLE_NOT_FOUND, ((NaturalDbException) error).getErrorCode());
        }
    }

    @Test
    void invalidArgumentsAreThrown() {
        insertProducts();
        assertThrows(IllegalArgumentException.class, () -> engine.filter("Products", "price", 1, "between"));
        assertThrows(IllegalArgumentException.class, () -> engine.sort("Products", "price", true, -1));
    }

    @Test
    void reservedRecordIdFails() {
        OperationResult<Boolean> result = engine.insert("users", "metadata", json("{}"));
        assertTrue(result.isFailure());
        assertEquals(ErrorCode.INVALID_IDENTIFIER, ((NaturalDbException) result.error().orElseThrow()).getErrorCode());
    }

    @Test
    void corruptedRecordFailsTheQuery() throws Exception {
        engine.insert("users", "u1", json("{\"v\":1}"));
        Files.writeString(dir.resolve("alice").resolve("shop").resolve("users").resolve("u2.json"), "{not json");

        OperationResult<List<Document>> result = engine.findAll("users");
        assertTrue(result.isFailure());
        StorageException error = assertInstanceOf(StorageException.class, result.error().orElseThrow());
        assertEquals(ErrorCode.RECORD_CORRUPTED, error.getErrorCode());
    }

    @Test
    void tableLifecycle() {
        assertTrue(engine.createTable("users").expect("create"));
        assertFalse(engine.createTable("users").expect("create again"));
        engine.createTable("orders");
        assertTrue(engine.tableExists("users"));
        assertEquals(List.of("orders", "users"), engine.listTables().expect("list"));

        assertTrue(engine.dropTable("users").expect("drop"));
        assertFalse(engine.tableExists("users"));
        assertEquals(List.of("orders"), engine.listTables().expect("list"));
    }

    @Test
    void filterOperatorLaws() {
        insertProducts();
        engine.insert("Products", "5", json("{\"name\":\"Cable\",\"category\":\"Accessories\"}"));
        JsonValue pivot = JsonNumber.of(799);

        Set<String> gt = new HashSet<>(ids(engine.filter("Products", "price", pivot, Operator.GT)));
        Set<String> eq = new HashSet<>(ids(engine.filter("Products", "price", pivot, Operator.EQ)));
        Set<String> lt = new HashSet<>(ids(engine.filter("Products", "price", pivot, Operator.LT)));
        Set<String> gte = new HashSet<>(ids(engine.filter("Products", "price", pivot, Operator.GTE)));
        Set<String> ne = new HashSet<>(ids(engine.filter("Products", "price", pivot, Operator.NE)));

        Set<String> union = new HashSet<>(gt);
        union.addAll(eq);
        assertEquals(union, gte);

        Set<String> all = Set.of("1", "2", "3", "4", "5");
        Set<String> complement = new HashSet<>(all);
        complement.removeAll(eq);
        assertEquals(complement, ne);

        Set<String> comparable = new HashSet<>(gt);
        comparable.addAll(eq);
        comparable.addAll(lt);
        assertEquals(Set.of("1", "2", "3", "4"), comparable);
        assertEquals(4, gt.size() + eq.size() + lt.size());
    }

    @Test
    void projectWithConditions() {
        insertProducts();
        List<JsonObject> rows = engine.project("Products", List.of("name"),
            List.of(Condition.of("category", "eq", "Computers"), Condition.of("price", "gt", 500))).expect("project");
        assertEquals(List.of(json("{\"name\":\"Desktop\"}")), rows);
    }

    @Test
    void joinsTwoTables() {
        engine.insert("users", "1", json("{\"uid\":1,\"name\":\"Ann\"}"));
        engine.insert("users", "2", json("{\"uid\":2,\"name\":\"Bob\"}"));
        engine.insert("orders", "a", json("{\"user\":1,\"total\":10}"));
        engine.insert("orders", "b", json("{\"user\":1,\"total\":20}"));

        List<JsonObject> inner = engine.join("users", "orders", "uid", "user", JoinType.INNER).expect("join");
        assertEquals(List.of(
            json("{\"uid\":1,\"name\":\"Ann\",\"user\":1,\"total\":10}"),
            json("{\"uid\":1,\"name\":\"Ann\",\"user\":1,\"total\":20}")), inner);

        List<JsonObject> left = engine.join("users", "orders", "uid", "user", JoinType.LEFT, "u_", "o_").expect("join");
        assertEquals(3, left.size());
        assertEquals(json("{\"u_uid\":2,\"u_name\":\"Bob\"}"), left.get(2));
    }

    @Test
    void enginesOverTheSameStoreSeeEachOther() {
        NaturalDB db = NaturalDB.open(dir);
        QueryEngine first = db.openDatabase(User.of("bob"), new Database("crm"));
        QueryEngine second = db.openDatabase(User.of("bob"), new Database("crm"));

        first.insert("leads", "1", json("{\"v\":1}"));
        assertEquals(json("{\"v\":1}"), second.findById("leads", "1").expect("find").data());
        assertTrue(engine.listTables().expect("list").isEmpty());
    }
}
