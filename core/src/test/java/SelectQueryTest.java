import io.github.flameyossnowy.simpledb.api.SimpleDBOperations;
import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.codec.NumberCodec;
import io.github.flameyossnowy.simpledb.api.codec.OpaqueCodec;
import io.github.flameyossnowy.simpledb.api.exceptions.ItemNotFoundException;
import io.github.flameyossnowy.simpledb.api.exceptions.ProtocolException;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.meta.RecordSchema;
import io.github.flameyossnowy.simpledb.api.meta.SchemaRegistry;
import io.github.flameyossnowy.simpledb.api.model.Item;
import io.github.flameyossnowy.simpledb.api.options.ItemNameQuery;
import io.github.flameyossnowy.simpledb.api.options.Query;
import io.github.flameyossnowy.simpledb.api.options.SelectQuery;
import io.github.flameyossnowy.simpledb.api.options.SortOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SelectQueryTest {
    private static final RecordSchema USERS = RecordSchema.builder("users")
        .itemName("id")
        .field("name", OpaqueCodec.INSTANCE)
        .field("age", new NumberCodec(6, 10000))
        .build();

    private SimpleDBOperations operations;

    @BeforeEach
    void setup() {
        operations = mock(SimpleDBOperations.class);
        when(operations.encoder()).thenReturn(SchemaRegistry.of(USERS));
    }

    private SelectQuery users() {
        return SelectQuery.of("users", operations.encoder(), operations);
    }

    private static Item item(String name, String... attributes) {
        Item.Builder builder = Item.builder(name);
        for (int i = 0; i < attributes.length; i += 2) {
            builder.add(attributes[i], attributes[i + 1]);
        }
        return builder.build();
    }

    @Test
    void compile_fullQuery() {
        String expression = Query.select("users", SchemaRegistry.of(USERS))
            .values("name", "age")
            .filter(Query.where("age__lt", 25))
            .orderBy("-age")
            .limit(10)
            .compile();

        assertEquals("SELECT name, age FROM `users` WHERE age < '010025' ORDER BY age DESC LIMIT 10", expression);
    }

    @Test
    void compile_defaultsToAllAttributes() {
        assertEquals("SELECT * FROM `users`", Query.select("users").compile());
    }

    @Test
    void compile_chainedFiltersJoinWithAnd() {
        String expression = Query.select("users", USERS)
            .filter("age__gte", 18)
            .filter(Query.where("name", "a").or(Query.where("name", "b")))
            .orderBy("name", SortOrder.ASCENDING)
            .compile();

        assertEquals("SELECT * FROM `users` WHERE age >= '010018' AND (name = 'a' OR name = 'b') ORDER BY name ASC", expression);
    }

    @Test
    void compile_quotesReservedProjectionAndOrder() {
        String expression = Query.select("events").values("order", "itemName()").orderBy("-order").compile();

        assertEquals("SELECT `order`, itemName() FROM `events` ORDER BY `order` DESC", expression);
    }

    @Test
    void builders_neverMutateTheReceiver() {
        SelectQuery base = Query.select("users").limit(5);
        SelectQuery filtered = base.filter("a", 1);
        SelectQuery projected = filtered.values("a");

        assertEquals("SELECT * FROM `users` LIMIT 5", base.compile());
        assertEquals("SELECT * FROM `users` WHERE a = '1' LIMIT 5", filtered.compile());
        assertEquals("SELECT a FROM `users` WHERE a = '1' LIMIT 5", projected.compile());
    }

    @Test
    void limit_mustBePositive() {
        assertThrows(ValidationException.class, () -> Query.select("users").limit(0));
        assertThrows(ValidationException.class, () -> Query.select("users").limit(-3));
    }

    @Test
    void itemNames_rejectsProjection() {
        assertThrows(ValidationException.class, () -> Query.select("users").values("name").itemNames());

        ItemNameQuery names = Query.select("users").filter("age__gt", 3).itemNames().limit(2);
        assertEquals("SELECT itemName() FROM `users` WHERE age > '3' LIMIT 2", names.compile());
    }

    @Test
    void unboundQuery_cannotBeEvaluated() {
        assertThrows(IllegalStateException.class, () -> Query.select("users").toList());
    }

    @Test
    void evaluation_runsOnce() {
        when(operations.select(anyString())).thenReturn(List.of(item("u1", "name", "a"), item("u2", "name", "b")));

        SelectQuery query = users().filter("name__like", "%");
        List<String> names = new ArrayList<>();
        for (Item item : query) {
            names.add(item.name());
        }

        assertEquals(List.of("u1", "u2"), names);
        assertEquals(2, query.size());
        assertEquals("u2", query.get(1).name());
        assertEquals(2, query.count());
        verify(operations, times(1)).select("SELECT * FROM `users` WHERE name like '%'");
    }

    @Test
    void evaluation_isSingleFlightAcrossThreads() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(operations.select(anyString())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of(item("u1"));
        });

        SelectQuery query = users();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> sizes = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                sizes.add(executor.submit(query::size));
            }
            release.countDown();
            for (Future<Integer> size : sizes) {
                assertEquals(1, size.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        verify(operations, times(1)).select(anyString());
    }

    @Test
    void derivedQuery_doesNotShareCache() {
        when(operations.select(anyString())).thenReturn(List.of(item("u1")));

        SelectQuery query = users();
        query.toList();
        query.limit(1).toList();

        verify(operations).select("SELECT * FROM `users`");
        verify(operations).select("SELECT * FROM `users` LIMIT 1");
    }

    @Test
    void get_onUnevaluatedQueryLimitsRows() {
        when(operations.select(anyString())).thenReturn(List.of(item("u1"), item("u2"), item("u3")));

        assertEquals("u3", users().get(2).name());
        verify(operations).select("SELECT * FROM `users` LIMIT 3");
        assertThrows(IndexOutOfBoundsException.class, () -> users().get(-1));
    }

    @Test
    void get_neverReadsPastTheQueryLimit() {
        when(operations.select(anyString())).thenReturn(List.of(item("u1"), item("u2")));

        SelectQuery limited = users().limit(2);
        assertThrows(IndexOutOfBoundsException.class, () -> limited.get(5));
        verify(operations, never()).select(anyString());

        assertEquals("u2", limited.get(1).name());
        verify(operations).select("SELECT * FROM `users` LIMIT 2");
    }

    @Test
    void get_atMaximumIndexFetchesWithoutLimit() {
        when(operations.select(anyString())).thenReturn(List.of(item("u1")));

        assertThrows(IndexOutOfBoundsException.class, () -> users().get(Integer.MAX_VALUE));
        verify(operations).select("SELECT * FROM `users`");
    }

    @Test
    void count_readsCountAttribute() {
        when(operations.select("SELECT count(*) FROM `users` WHERE age > '010030'"))
            .thenReturn(List.of(item("Domain", "Count", "42")));

        SelectQuery query = users().filter("age__gt", 30);
        assertEquals(42, query.count());
        assertEquals(42, query.count());
        verify(operations, times(1)).select(anyString());
    }

    @Test
    void count_withoutCountAttributeIsProtocolError() {
        when(operations.select(anyString())).thenReturn(List.of(item("Domain", "Other", "1")));

        assertThrows(ProtocolException.class, () -> users().count());
    }

    @Test
    void getItem_raisesWhenMissing() {
        when(operations.select("SELECT * FROM `users` WHERE itemName() = 'u1'")).thenReturn(List.of(item("u1", "name", "a")));
        when(operations.select("SELECT * FROM `users` WHERE itemName() = 'nope'")).thenReturn(List.of());

        assertEquals("a", users().getItem("u1").value("name"));
        assertTrue(users().findItem("nope").isEmpty());

        ItemNotFoundException e = assertThrows(ItemNotFoundException.class, () -> users().getItem("nope"));
        assertEquals("nope", e.getItemName());
    }

    @Test
    void itemNameQuery_iteratesNames() {
        when(operations.select(anyString())).thenReturn(List.of(item("u1"), item("u2")));

        ItemNameQuery names = users().itemNames();
        assertEquals(List.of("u1", "u2"), names.toList());
        assertEquals("u1", names.get(0));
        verify(operations).select("SELECT itemName() FROM `users`");
    }

    @Test
    void identityEncoder_passesValuesThrough() {
        SelectQuery query = Query.select("users", AttributeEncoder.identity()).filter("age__lt", 25);

        assertEquals("SELECT * FROM `users` WHERE age < '25'", query.compile());
    }
}
