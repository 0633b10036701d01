import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonNumber;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.api.options.JoinType;
import io.github.flameyossnowy.naturaldb.api.query.JoinOperations;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JoinOperationsTest {
    private final List<Document> users = List.of(
        doc("1", "{\"user_id\":1,\"name\":\"Ada\"}"),
        doc("2", "{\"user_id\":2,\"name\":\"Linus\"}"),
        doc("3", "{\"user_id\":3,\"name\":\"Grace\"}"),
        doc("4", "{\"name\":\"Nobody\"}")
    );

    private final List<Document> orders = List.of(
        doc("o1", "{\"user_id\":1,\"total\":10}"),
        doc("o2", "{\"user_id\":1.0,\"total\":25}"),
        doc("o3", "{\"user_id\":2,\"total\":7}"),
        doc("o4", "{\"user_id\":null,\"total\":99}"),
        doc("o5", "{\"total\":1}")
    );

    static Document doc(String id, String json) {
        return new Document(id, JsonCodec.parseObject(json));
    }

    @Test
    void innerJoinEmitsEveryMatchingPair() {
        List<JsonObject> rows = JoinOperations.innerJoin(users, orders, "user_id", "user_id", "user_", "order_");

        assertEquals(3, rows.size());
        assertEquals(new JsonString("Ada"), rows.get(0).get("user_name"));
        assertEquals(JsonNumber.of(10), rows.get(0).get("order_total"));
        assertEquals(JsonNumber.of(25), rows.get(1).get("order_total"));
        assertEquals(new JsonString("Linus"), rows.get(2).get("user_name"));
    }

    @Test
    void leftJoinKeepsUnmatchedLeftRecords() {
        List<JsonObject> rows = JoinOperations.join(users, orders, "user_id", "user_id", JoinType.LEFT, "u.", "o.");

        assertEquals(5, rows.size());
        JsonObject grace = rows.get(3);
        assertEquals(JsonCodec.parseObject("{\"u.user_id\":3,\"u.name\":\"Grace\"}"), grace);
        JsonObject nobody = rows.get(4);
        assertEquals(JsonCodec.parseObject("{\"u.name\":\"Nobody\"}"), nobody);
    }

    @Test
    void missingAndNullKeysNeverMatch() {
        List<Document> left = List.of(doc("x", "{\"k\":null}"), doc("y", "{}"));
        List<Document> right = List.of(doc("a", "{\"k\":null}"), doc("b", "{}"));

        assertTrue(JoinOperations.innerJoin(left, right, "k", "k").isEmpty());
        assertEquals(2, JoinOperations.leftJoin(left, right, "k", "k").size());
    }

    @Test
    void rightSideWinsOnCollisionWithoutPrefixes() {
        List<JsonObject> rows = JoinOperations.innerJoin(users.subList(0, 1), orders.subList(0, 1), "user_id", "user_id");
        assertEquals(JsonCodec.parseObject("{\"user_id\":1,\"name\":\"Ada\",\"total\":10}"), rows.get(0));
    }

    @Test
    void joinsOnNestedFields() {
        List<Document> left = List.of(doc("1", "{\"ref\":{\"id\":\"p1\"}}"));
        List<Document> right = List.of(doc("p1", "{\"meta\":{\"sku\":\"p1\"},\"price\":5}"));

        List<JsonObject> rows = JoinOperations.innerJoin(left, right, "ref.id", "meta.sku");
        assertEquals(1, rows.size());
        assertEquals(JsonNumber.of(5), rows.get(0).get("price"));
    }

    @Test
    void unknownJoinTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JoinType.fromName("outer"));
        assertEquals(JoinType.LEFT, JoinType.fromName("left"));
    }
}
