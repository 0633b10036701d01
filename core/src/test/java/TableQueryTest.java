import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonNumber;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.options.AggregationType;
import io.github.flameyossnowy.naturaldb.api.options.Operator;
import io.github.flameyossnowy.naturaldb.api.options.SortOrder;
import io.github.flameyossnowy.naturaldb.api.query.TableQuery;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableQueryTest {
    private final TableQuery people = TableQuery.of(List.of(
        doc("1", "{\"name\":\"Ann\",\"age\":35,\"city\":\"Oslo\"}"),
        doc("2", "{\"name\":\"Bob\",\"age\":30,\"city\":\"Rome\"}"),
        doc("3", "{\"name\":\"Cid\",\"age\":25,\"city\":\"Oslo\"}"),
        doc("4", "{\"name\":\"Dee\",\"city\":\"Rome\"}")
    ));

    static Document doc(String id, String json) {
        return new Document(id, JsonCodec.parseObject(json));
    }

    static List<String> ids(List<Document> records) {
        List<String> ids = new ArrayList<>();
        for (Document record : records) ids.add(record.id());
        return ids;
    }

    @Test
    void chainsFilterSortAndLimit() {
        List<Document> result = people
            .where("age", 26, "gte")
            .orderBy("age")
            .limit(1)
            .all();
        assertEquals(List.of("2"), ids(result));
    }

    @Test
    void eachStepReturnsAFreshQuery() {
        TableQuery oslo = people.filterBy("city", "Oslo");
        TableQuery older = oslo.filterBy("age", JsonNumber.of(30), Operator.GT);

        assertEquals(4, people.count());
        assertEquals(2, oslo.count());
        assertEquals(1, older.count());
    }

    @Test
    void skipAndOffset() {
        assertEquals(List.of("3", "4"), ids(people.skip(2).execute()));
        assertEquals(List.of("2", "3"), ids(people.limit(2, 1).all()));
        assertThrows(IllegalArgumentException.class, () -> people.skip(-1));
    }

    @Test
    void firstAndLast() {
        TableQuery sorted = people.orderBy("age", SortOrder.DESCENDING);
        assertEquals("1", sorted.first().orElseThrow().id());
        assertEquals("4", sorted.last().orElseThrow().id());
        assertTrue(people.where("city", "Paris").first().isEmpty());
    }

    @Test
    void terminalProjectionsAndGroups() {
        List<JsonObject> names = people.where("city", "Rome").select("name");
        assertEquals(List.of(JsonCodec.parseObject("{\"name\":\"Bob\"}"), JsonCodec.parseObject("{\"name\":\"Dee\"}")), names);

        Map<JsonValue, List<Document>> byCity = people.groupBy("city");
        assertEquals(List.of(new JsonString("Oslo"), new JsonString("Rome")), List.copyOf(byCity.keySet()));

        assertEquals(JsonNumber.of(30.0), people.aggregate("age", AggregationType.AVG));
    }

    @Test
    void customPredicate() {
        List<JsonObject> data = people.filter(record -> record.id().compareTo("2") > 0).toDict();
        assertEquals(2, data.size());
        assertEquals(new JsonString("Cid"), data.get(0).get("name"));
    }

    @Test
    void sortDescendingReordersInsertion() {
        TableQuery reversed = TableQuery.of(List.of(
            doc("c", "{\"age\":25}"), doc("b", "{\"age\":30}"), doc("a", "{\"age\":35}")));
        assertEquals(List.of("a", "b", "c"), ids(reversed.sort("age", false).all()));
    }
}
