import io.github.flameyossnowy.simpledb.api.codec.BooleanCodec;
import io.github.flameyossnowy.simpledb.api.codec.FieldKind;
import io.github.flameyossnowy.simpledb.api.codec.NumberCodec;
import io.github.flameyossnowy.simpledb.api.codec.TimestampCodec;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.meta.FieldDescriptor;
import io.github.flameyossnowy.simpledb.api.meta.RecordSchema;
import io.github.flameyossnowy.simpledb.api.meta.SchemaRegistry;
import io.github.flameyossnowy.simpledb.api.model.Item;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordSchemaTest {
    private static final LocalDateTime JOINED = LocalDateTime.of(2010, 1, 25, 15, 1, 28);

    private static RecordSchema users() {
        return RecordSchema.builder("users")
            .itemName("id")
            .field("age", new NumberCodec(3, 100))
            .field("active", BooleanCodec.INSTANCE).defaultValue(() -> true)
            .field("joined", new TimestampCodec()).required()
            .build();
    }

    @Test
    void toAttributes_encodesAndAppliesDefaults() {
        Map<String, Object> record = new HashMap<>();
        record.put("id", "u1");
        record.put("age", -5);
        record.put("joined", JOINED);
        record.put("tags", List.of("a", "b"));

        Map<String, List<String>> attributes = users().toAttributes(record);

        assertEquals(List.of("095"), attributes.get("age"));
        assertEquals(List.of("1"), attributes.get("active"));
        assertEquals(List.of("2010-01-25T15:01:28"), attributes.get("joined"));
        assertEquals(List.of("a", "b"), attributes.get("tags"));
        assertFalse(attributes.containsKey("id"));
    }

    @Test
    void toAttributes_requiresRequiredFields() {
        ValidationException e = assertThrows(ValidationException.class, () -> users().toAttributes(Map.of("age", 3)));
        assertTrue(e.getMessage().contains("joined"));
    }

    @Test
    void fromItem_decodesInDeclarationOrder() {
        Item item = Item.builder("u1")
            .add("joined", "2010-01-25T15:01:28")
            .add("age", "130")
            .add("active", "0")
            .add("nickname", "al")
            .build();

        Map<String, Object> record = users().fromItem(item);

        assertEquals(List.of("id", "age", "active", "joined", "nickname"), List.copyOf(record.keySet()));
        assertEquals("u1", record.get("id"));
        assertEquals(30.0, ((Number) record.get("age")).doubleValue());
        assertEquals(false, record.get("active"));
        assertEquals(JOINED, record.get("joined"));
        assertEquals("al", record.get("nickname"));
        assertEquals(JOINED, item.value("joined", new TimestampCodec()));
        assertEquals(List.of(false), item.values("active", BooleanCodec.INSTANCE));
    }

    @Test
    void build_rejectsDuplicatesAndSecondItemName() {
        assertThrows(ValidationException.class, () -> RecordSchema.builder("d")
            .field("a", BooleanCodec.INSTANCE)
            .field("a", BooleanCodec.INSTANCE)
            .build());

        assertThrows(ValidationException.class, () -> RecordSchema.builder("d")
            .itemName("id")
            .itemName("key")
            .build());

        assertThrows(ValidationException.class, () -> RecordSchema.builder("d").itemName("id").defaultValue(() -> "x"));
        assertThrows(ValidationException.class, () -> RecordSchema.builder(" "));
    }

    @Test
    void descriptors_exposeKinds() {
        RecordSchema schema = users();

        FieldDescriptor id = schema.nameField();
        assertNotNull(id);
        assertEquals("id", id.name());
        assertEquals(FieldKind.NUMBER, schema.field("age").kind());
        assertEquals(FieldKind.TIMESTAMP, schema.field("joined").kind());
        assertTrue(schema.field("joined").required());
        assertNull(schema.codec("id"));
    }

    @Test
    void registry_routesByDomain() {
        SchemaRegistry registry = SchemaRegistry.of(users());

        assertNotNull(registry.schema("users"));
        assertNull(registry.schema("logs"));
        assertEquals(1, registry.schemas().size());

        assertEquals("105", registry.encode("users", "age", 5));
        assertEquals("5", registry.encode("logs", "age", 5));
        assertEquals("7", registry.decode("logs", "age", "7"));
        assertThrows(ValidationException.class, () -> SchemaRegistry.of(users(), users()));
    }
}
