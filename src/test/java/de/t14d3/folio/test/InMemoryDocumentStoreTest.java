package de.t14d3.folio.test;

import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.ClassDescriptionRegistry;
import de.t14d3.folio.store.InMemoryDocumentStore;
import de.t14d3.folio.test.entities.Customer;
import de.t14d3.folio.test.entities.Vehicle;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryDocumentStoreTest {
    private InMemoryDocumentStore store;
    private ClassDescriptionRegistry registry;

    @BeforeEach
    void setup() {
        store = new InMemoryDocumentStore();
        registry = new ClassDescriptionRegistry();
    }

    private static Map<String, Object> data(String name) {
        Map<String, Object> data = new HashMap<>();
        data.put("name", name);
        return data;
    }

    @Test
    void testSequenceSkipsTakenIdentifiers() {
        ClassDescription customer = registry.describe(Customer.class);
        store.insert("customers", 1L, data("taken"));
        store.insert("customers", 2L, data("taken too"));

        assertEquals(3L, store.nextIdentifier(customer));
        assertEquals(4L, store.nextIdentifier(customer));
    }

    @Test
    void testStringIdentifiersAreUuids() {
        ClassDescription vehicle = registry.describe(Vehicle.class);

        Object id = store.nextIdentifier(vehicle);

        assertInstanceOf(String.class, id);
        assertDoesNotThrow(() -> UUID.fromString((String) id));
        assertNotEquals(id, store.nextIdentifier(vehicle));
    }

    @Test
    void testDuplicateInsertFails() {
        store.insert("customers", 1L, data("first"));

        assertThrows(FolioException.class, () -> store.insert("customers", 1L, data("second")));
        assertEquals("first", store.findRaw("customers", 1L).get("name"));
    }

    @Test
    void testDataIsCopied() {
        Map<String, Object> data = data("original");
        List<Object> tags = new ArrayList<>(List.of("a"));
        data.put("tags", tags);
        store.insert("customers", 1L, data);

        data.put("name", "changed");
        tags.add("b");
        assertEquals("original", store.findRaw("customers", 1L).get("name"));
        assertEquals(List.of("a"), store.findRaw("customers", 1L).get("tags"));

        store.findRaw("customers", 1L).put("name", "changed again");
        assertEquals("original", store.findRaw("customers", 1L).get("name"));
    }

    @Test
    void testUpdateMergesFields() {
        Map<String, Object> data = data("before");
        data.put("mail", "a@example.com");
        store.insert("customers", 1L, data);

        assertTrue(store.update("customers", 1L, data("after")));
        assertFalse(store.update("customers", 2L, data("missing")));

        Map<String, Object> stored = store.findRaw("customers", 1L);
        assertEquals("after", stored.get("name"));
        assertEquals("a@example.com", stored.get("mail"));
    }

    @Test
    void testDeleteAndContains() {
        store.insert("customers", 1L, data("gone soon"));
        assertTrue(store.contains("customers", 1L));
        assertFalse(store.contains("customers", null));

        assertTrue(store.delete("customers", 1L));
        assertFalse(store.delete("customers", 1L));
        assertFalse(store.contains("customers", 1L));
        assertNull(store.findRaw("customers", 1L));
        assertNull(store.findRaw("customers", null));
    }

    @Test
    void testFindAllKeepsInsertionOrder() {
        store.insert("customers", 5L, data("five"));
        store.insert("customers", 1L, data("one"));

        List<Map<String, Object>> all = store.findAllRaw("customers");

        assertEquals(2, all.size());
        assertEquals("five", all.get(0).get("name"));
        assertEquals("one", all.get(1).get("name"));
    }

    @Test
    void testCountAndClear() {
        ClassDescription customer = registry.describe(Customer.class);
        store.insert("customers", store.nextIdentifier(customer), data("a"));
        store.insert("customers", store.nextIdentifier(customer), data("b"));
        store.insert("orders", 1L, data("c"));

        assertEquals(2, store.count("customers"));
        assertTrue(store.getCollectionNames().containsAll(List.of("customers", "orders")));

        store.clear();
        assertEquals(0, store.count("customers"));
        assertEquals(1L, store.nextIdentifier(customer));
    }
}
