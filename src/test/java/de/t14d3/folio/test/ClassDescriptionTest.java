package de.t14d3.folio.test;

import de.t14d3.folio.annotations.CascadeType;
import de.t14d3.folio.annotations.Document;
import de.t14d3.folio.annotations.EmbeddedDocument;
import de.t14d3.folio.annotations.Id;
import de.t14d3.folio.annotations.LifecycleCallback;
import de.t14d3.folio.annotations.Property;
import de.t14d3.folio.annotations.ReferenceMany;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.exceptions.MappingException;
import de.t14d3.folio.mapping.ChangeTrackingPolicy;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.ClassDescriptionRegistry;
import de.t14d3.folio.mapping.FieldMapping;
import de.t14d3.folio.test.entities.Address;
import de.t14d3.folio.test.entities.Car;
import de.t14d3.folio.test.entities.Customer;
import de.t14d3.folio.test.entities.Note;
import de.t14d3.folio.test.entities.Order;
import de.t14d3.folio.test.entities.OrderLine;
import de.t14d3.folio.test.entities.Ticket;
import de.t14d3.folio.test.entities.Vehicle;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ClassDescriptionTest {
    static class NotAnnotated {
        Long id;
    }

    @Document
    static class WithoutId {
        @Property
        String name;
    }

    @EmbeddedDocument
    static class EmbeddedWithId {
        @Id
        Long id;
    }

    @Document
    static class SetCollection {
        @Id
        Long id;
        @ReferenceMany(targetDocument = Customer.class)
        Set<Customer> customers;
    }

    @Document
    static class CallbackWithParameter {
        @Id
        Long id;

        @LifecycleCallback(LifecycleEvent.PRE_PERSIST)
        void onPersist(String unexpected) {
        }
    }

    @Document
    static class NoDefaultConstructor {
        @Id
        Long id;

        NoDefaultConstructor(Long id) {
            this.id = id;
        }
    }

    @Document
    static class PrivateConstructor {
        @Id
        Long id;

        private PrivateConstructor() {
        }
    }

    private ClassDescriptionRegistry registry;

    @BeforeEach
    void setup() {
        registry = new ClassDescriptionRegistry();
    }

    private static List<String> names(List<FieldMapping> mappings) {
        List<String> names = new ArrayList<>();
        for (FieldMapping mapping : mappings) {
            names.add(mapping.name());
        }
        return names;
    }

    @Test
    void testReadsDocumentAnnotations() {
        ClassDescription customer = registry.describe(Customer.class);

        assertEquals("customers", customer.getCollectionName());
        assertEquals("id", customer.getIdentifier().name());
        assertEquals(Long.class, customer.getIdentifierType());
        assertTrue(customer.isIdentifierGenerated());
        assertFalse(customer.isEmbedded());
        assertEquals(List.of("name", "email", "address", "card"), names(customer.getFieldMappings()));
        assertEquals(List.of("address", "card"), names(customer.getAssociationMappings()));
        assertEquals("mail", customer.getFieldMapping("email").storedName());
        assertNull(customer.getChangeTrackingPolicy());
    }

    @Test
    void testReadsAssociations() {
        ClassDescription customer = registry.describe(Customer.class);
        FieldMapping card = customer.getFieldMapping("card");
        assertEquals(FieldMapping.Kind.REF_ONE, card.kind());
        assertTrue(card.isCascade(CascadeType.PERSIST));
        assertTrue(card.isCascade(CascadeType.REMOVE));
        assertTrue(card.orphanRemoval());
        assertFalse(card.isRequiredReference());
        assertEquals(Address.class, customer.getFieldMapping("address").targetType());

        ClassDescription order = registry.describe(Order.class);
        FieldMapping owner = order.getFieldMapping("customer");
        assertTrue(owner.isRequiredReference());
        assertTrue(owner.isCascade(CascadeType.PERSIST));
        assertFalse(owner.isCascade(CascadeType.REMOVE));
        assertEquals(FieldMapping.Kind.EMBED_MANY, order.getFieldMapping("lines").kind());
        assertEquals(OrderLine.class, order.getFieldMapping("lines").targetType());
    }

    @Test
    void testReadsInheritance() {
        ClassDescription car = registry.describe(Car.class);

        assertEquals(Vehicle.class, car.getRootType());
        assertEquals(Vehicle.class.getName(), car.getRootName());
        assertEquals(Car.class.getName(), car.getName());
        assertEquals("vehicles", car.getCollectionName());
        assertEquals("plate", car.getIdentifier().name());
        assertFalse(car.isIdentifierGenerated());
        assertEquals(List.of("wheels", "model"), names(car.getFieldMappings()));
    }

    @Test
    void testReadsEmbeddedDocument() {
        ClassDescription address = registry.describe(Address.class);

        assertTrue(address.isEmbedded());
        assertNull(address.getIdentifier());
        assertNull(address.getIdentifierValue(new Address("a", "b")));
        assertThrows(MappingException.class, () -> address.setIdentifierValue(new Address(), 1L));
    }

    @Test
    void testReadsCallbacksAndPolicy() {
        ClassDescription ticket = registry.describe(Ticket.class);
        assertFalse(ticket.hasField("callbacks"));
        assertTrue(ticket.hasLifecycleCallbacks(LifecycleEvent.PRE_PERSIST));
        assertTrue(ticket.hasLifecycleCallbacks(LifecycleEvent.POST_LOAD));
        assertFalse(ticket.hasLifecycleCallbacks(LifecycleEvent.PRE_LOAD));

        Ticket instance = (Ticket) ticket.newInstance();
        ticket.invokeLifecycleCallbacks(LifecycleEvent.POST_LOAD, instance);
        assertEquals(List.of(LifecycleEvent.POST_LOAD), instance.getCallbacks());

        assertEquals(ChangeTrackingPolicy.DEFERRED_EXPLICIT, registry.describe(Note.class).getChangeTrackingPolicy());
    }

    @Test
    void testInvalidClassesAreRejected() {
        assertThrows(MappingException.class, () -> registry.describe(NotAnnotated.class));
        assertThrows(MappingException.class, () -> registry.describe(WithoutId.class));
        assertThrows(MappingException.class, () -> registry.describe(EmbeddedWithId.class));
        assertThrows(MappingException.class, () -> registry.describe(SetCollection.class));
        assertThrows(MappingException.class, () -> registry.describe(CallbackWithParameter.class));
    }

    @Test
    void testMissingConstructorFailsOnInstantiation() {
        ClassDescription description = registry.describe(NoDefaultConstructor.class);

        assertThrows(MappingException.class, description::newInstance);
    }

    @Test
    void testAnnotatedDescriptionInstantiates() {
        Object customer = registry.describe(Customer.class).newInstance();
        Object hidden = registry.describe(PrivateConstructor.class).newInstance();

        assertInstanceOf(Customer.class, customer);
        assertInstanceOf(PrivateConstructor.class, hidden);
        assertNotSame(hidden, registry.describe(PrivateConstructor.class).newInstance());
    }

    @Test
    void testBuilderCallbackReceivesDocument() {
        List<String> seen = new ArrayList<>();
        ClassDescription description = ClassDescription.builder(Customer.class)
                .identifier("id", Long.class, Customer::getId, (c, v) -> c.setId((Long) v))
                .callback(LifecycleEvent.PRE_PERSIST, customer -> seen.add(customer.getName()))
                .build();

        description.invokeLifecycleCallbacks(LifecycleEvent.PRE_PERSIST, new Customer("callback"));

        assertEquals(List.of("callback"), seen);
    }

    @Test
    void testUnknownFieldMapping() {
        ClassDescription customer = registry.describe(Customer.class);

        assertFalse(customer.hasField("nickname"));
        assertThrows(MappingException.class, () -> customer.getFieldMapping("nickname"));
    }

    @Test
    void testDuplicateFieldIsRejected() {
        ClassDescription.Builder<Customer> builder = ClassDescription.builder(Customer.class)
                .identifier("id", Long.class, Customer::getId, (c, v) -> c.setId((Long) v))
                .property("name", Customer::getName, (c, v) -> c.setName((String) v))
                .property("name", Customer::getName, (c, v) -> c.setName((String) v));

        assertThrows(MappingException.class, builder::build);
    }

    @Test
    void testBuilderRegistrationWins() {
        ClassDescription explicit = ClassDescription.builder(Customer.class)
                .collection("clients")
                .identifier("id", Long.class, Customer::getId, (c, v) -> c.setId((Long) v))
                .property("name", Customer::getName, (c, v) -> c.setName((String) v))
                .changeTracking(ChangeTrackingPolicy.NOTIFY)
                .instantiator(Customer::new)
                .build();
        registry.register(explicit);

        assertTrue(registry.isRegistered(Customer.class));
        assertSame(explicit, registry.describe(Customer.class));
        assertSame(explicit, registry.describe(Customer.class.getName()));
        assertEquals("clients", explicit.getCollectionName());
        assertEquals(List.of("name"), names(explicit.getFieldMappings()));

        Customer customer = (Customer) explicit.newInstance();
        explicit.setIdentifierValue(customer, 7L);
        explicit.getFieldMapping("name").setValue(customer, "built");
        assertEquals(7L, customer.getId());
        assertEquals("built", customer.getName());
    }

    @Test
    void testBuilderDefaults() {
        ClassDescription description = ClassDescription.builder(Note.class)
                .identifier("id", Long.class, Note::getId, (n, v) -> {})
                .build();

        assertEquals("note", description.getCollectionName());
        assertEquals(Note.class, description.getRootType());
        assertTrue(description.isIdentifierGenerated());
        assertNull(description.getChangeTrackingPolicy());
        assertThrows(MappingException.class, description::newInstance);
    }

    @Test
    void testDescribeByName() {
        ClassDescription byName = registry.describe(Order.class.getName());

        assertEquals(Order.class, byName.getType());
        assertSame(byName, registry.describe(Order.class));
        assertThrows(MappingException.class, () -> registry.describe("com.example.DoesNotExist"));
    }
}
