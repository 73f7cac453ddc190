package de.t14d3.folio.test;

import de.t14d3.folio.core.ChangeSet;
import de.t14d3.folio.core.DocumentManager;
import de.t14d3.folio.core.UnitOfWork;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.exceptions.UnitOfWorkException;
import de.t14d3.folio.store.DocumentReference;
import de.t14d3.folio.test.entities.Address;
import de.t14d3.folio.test.entities.Author;
import de.t14d3.folio.test.entities.Book;
import de.t14d3.folio.test.entities.Customer;
import de.t14d3.folio.test.entities.Employee;
import de.t14d3.folio.test.entities.LoyaltyCard;
import de.t14d3.folio.test.entities.Order;
import de.t14d3.folio.test.entities.OrderLine;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for commit ordering, the reference update pass and failure handling.
 */
public class UnitOfWorkCommitTest {
    private RecordingDocumentStore store;
    private DocumentManager dm;
    private UnitOfWork uow;

    @BeforeEach
    void setup() {
        store = new RecordingDocumentStore();
        dm = DocumentManager.create(store);
        uow = dm.getUnitOfWork();
    }

    @AfterEach
    void teardown() {
        dm.close();
    }

    @Test
    void testCustomerIsInsertedBeforeOrder() {
        Customer customer = new Customer("alice");
        Order order = new Order("A-1", customer);

        // only the order is persisted; the customer follows through cascade
        dm.persist(order);
        dm.flush();

        assertEquals(List.of("insert:Customer", "insert:Order"), store.getCalls());
        assertNotNull(customer.getId());
        assertNotNull(order.getId());

        Map<String, Object> raw = store.findRaw("orders", order.getId());
        assertEquals(new DocumentReference(Customer.class, customer.getId()), raw.get("customer"));
    }

    @Test
    void testSecondCommitWithoutChangesWritesNothing() {
        Customer customer = new Customer("bob");
        customer.setAddress(new Address("Main St 1", "Springfield"));
        dm.persist(new Order("B-1", customer));
        dm.flush();
        store.resetCalls();

        dm.flush();
        dm.flush();

        assertTrue(store.getCalls().isEmpty());
        assertTrue(uow.getScheduledDocumentUpdates().isEmpty());
    }

    @Test
    void testInsertChangeSetContainsEveryField() {
        Customer customer = new Customer("carol");
        customer.setEmail("carol@example.com");
        dm.persist(customer);

        uow.computeChangeSets();
        ChangeSet changeSet = uow.getDocumentChangeSet(customer);

        assertEquals(Set.of("name", "email", "address", "card"), changeSet.fieldNames());
        assertNull(changeSet.get("name").oldValue());
        assertEquals("carol", changeSet.get("name").newValue());
        assertEquals("carol@example.com", changeSet.get("email").newValue());
        assertNull(changeSet.get("address").newValue());
    }

    @Test
    void testUpdateWritesOnlyChangedFields() {
        Customer customer = new Customer("dave");
        customer.setEmail("dave@example.com");
        dm.persist(customer);
        dm.flush();
        store.resetCalls();

        customer.setName("david");
        dm.flush();

        assertEquals(List.of("update:Customer"), store.getCalls());
        ChangeSet changeSet = store.getUpdates().get(0);
        assertEquals(Set.of("name"), changeSet.fieldNames());
        assertEquals("dave", changeSet.get("name").oldValue());
        assertEquals("david", store.findRaw("customers", customer.getId()).get("name"));
        assertEquals("dave@example.com", store.findRaw("customers", customer.getId()).get("mail"));
    }

    @Test
    void testDeletionsRunInReverseCommitOrder() {
        Customer customer = new Customer("erin");
        Order order = new Order("E-1", customer);
        dm.persist(order);
        dm.flush();
        store.resetCalls();

        dm.remove(customer);
        dm.remove(order);
        dm.flush();

        assertEquals(List.of("delete:Order", "delete:Customer"), store.getCalls());
        assertEquals(0, store.count("orders"));
        assertEquals(0, store.count("customers"));
    }

    @Test
    void testOptionalCycleIsResolvedWithReferenceUpdates() {
        Author author = new Author("Le Guin");
        author.addBook(new Book("The Dispossessed"));
        author.addBook(new Book("The Lathe of Heaven"));

        dm.persist(author);
        dm.flush();

        assertEquals(List.of("insert:Author", "insert:Book", "insert:Book", "references:Author"), store.getCalls());

        List<?> storedBooks = (List<?>) store.findRaw("authors", author.getId()).get("books");
        assertEquals(List.of(
                new DocumentReference(Book.class, author.getBooks().get(0).getId()),
                new DocumentReference(Book.class, author.getBooks().get(1).getId())), storedBooks);
        for (Book book : author.getBooks()) {
            assertEquals(new DocumentReference(Author.class, author.getId()),
                    store.findRaw("books", book.getId()).get("author"));
        }
    }

    @Test
    void testSelfReferenceWithinOneBatch() {
        Employee boss = new Employee("boss", null);
        Employee clerk = new Employee("clerk", boss);

        dm.persist(clerk);
        dm.flush();

        assertEquals(List.of("insert:Employee", "insert:Employee", "references:Employee"), store.getCalls());
        assertEquals(new DocumentReference(Employee.class, boss.getId()),
                store.findRaw("employees", clerk.getId()).get("manager"));
    }

    @Test
    void testPreUpdateCallbackChangesAreWritten() {
        Order order = new Order("F-1", new Customer("frank"));
        dm.persist(order);
        dm.flush();
        assertEquals(0, order.getRevision());

        order.setNumber("F-2");
        dm.flush();

        assertEquals(1, order.getRevision());
        ChangeSet written = store.getUpdates().get(0);
        assertTrue(written.contains("number"));
        assertTrue(written.contains("revision"));
        assertEquals(1, store.findRaw("orders", order.getId()).get("revision"));
    }

    @Test
    void testChangedEmbeddedDocumentUpdatesOwner() {
        Customer customer = new Customer("grace");
        customer.setAddress(new Address("Elm St 5", "Shelbyville"));
        dm.persist(customer);
        dm.flush();
        store.resetCalls();

        customer.getAddress().setCity("Capital City");
        dm.flush();

        assertEquals(List.of("update:Customer"), store.getCalls());
        assertTrue(store.getUpdates().get(0).contains("address"));
        Map<?, ?> address = (Map<?, ?>) store.findRaw("customers", customer.getId()).get("address");
        assertEquals("Capital City", address.get("city"));
        assertEquals(Address.class.getName(), address.get("_class"));
    }

    @Test
    void testAddedEmbeddedElementIsWritten() {
        Order order = new Order("G-1", new Customer("gina"));
        order.addLine(new OrderLine("tea", 2));
        dm.persist(order);
        dm.flush();
        store.resetCalls();

        order.addLine(new OrderLine("milk", 1));
        dm.flush();

        assertEquals(List.of("update:Order"), store.getCalls());
        List<?> lines = (List<?>) store.findRaw("orders", order.getId()).get("lines");
        assertEquals(2, lines.size());
        assertEquals("milk", ((Map<?, ?>) lines.get(1)).get("product"));
    }

    @Test
    void testOrphanIsRemovedOnNextCommit() {
        Customer customer = new Customer("heidi");
        LoyaltyCard card = new LoyaltyCard("4711");
        customer.setCard(card);
        dm.persist(customer);
        dm.flush();
        assertEquals(1, store.count("cards"));
        store.resetCalls();

        customer.setCard(null);
        dm.flush();

        assertEquals(List.of("update:Customer", "delete:LoyaltyCard"), store.getCalls());
        assertEquals(0, store.count("cards"));
        assertFalse(dm.contains(card));
    }

    @Test
    void testRemovedDocumentStillReferencedFailsCommit() {
        Employee boss = new Employee("boss", null);
        Employee clerk = new Employee("clerk", boss);
        dm.persist(clerk);
        dm.flush();

        dm.remove(boss);

        UnitOfWorkException e = assertThrows(UnitOfWorkException.class, () -> dm.flush());
        assertEquals(UnitOfWorkException.Kind.REMOVED_DOCUMENT_IN_COLLECTION, e.getKind());
    }

    @Test
    void testFailedCommitKeepsRemainingWorkQueued() {
        Customer customer = new Customer("ivan");
        Order order = new Order("I-1", customer);
        RuntimeException boom = new IllegalStateException("disk full");
        store.failOn("insert:Order", boom);

        dm.persist(order);
        FolioException e = assertThrows(FolioException.class, () -> dm.flush());
        assertSame(boom, e.getCause());
        assertTrue(e.getMessage().contains("insert"));

        // the customer batch completed, the order batch did not
        assertFalse(uow.isScheduledForInsert(customer));
        assertTrue(uow.isScheduledForInsert(order));
        assertEquals(1, store.count("customers"));

        store.resetCalls();
        dm.flush();
        assertEquals(List.of("insert:Order"), store.getCalls());
        assertEquals(1, store.count("orders"));
    }

    @Test
    void testRetryWritesReferencesOfAlreadyInsertedDocuments() {
        Author author = new Author("Butler");
        Book book = new Book("Kindred");
        author.addBook(book);
        store.failOn("insert:Author", new IllegalStateException("connection lost"));

        dm.persist(book);
        assertThrows(FolioException.class, () -> dm.flush());
        assertEquals(List.of("insert:Book", "insert:Author"), store.getCalls());
        assertNull(store.findRaw("books", book.getId()).get("author"));

        store.resetCalls();
        dm.flush();

        assertEquals(List.of("insert:Author", "references:Book"), store.getCalls());
        assertEquals(new DocumentReference(Author.class, author.getId()),
                store.findRaw("books", book.getId()).get("author"));

        // written once, not again
        store.resetCalls();
        dm.flush();
        assertTrue(store.getCalls().isEmpty());
    }

    @Test
    void testFailedReferenceUpdateIsRetried() {
        Author author = new Author("Jemisin");
        author.addBook(new Book("The Fifth Season"));
        store.failOn("references:Author", new IllegalStateException("timeout"));

        dm.persist(author);
        assertThrows(FolioException.class, () -> dm.flush());
        assertEquals(List.of(), store.findRaw("authors", author.getId()).get("books"));

        store.resetCalls();
        dm.flush();

        assertEquals("references:Author", store.getCalls().get(0));
        assertEquals(List.of(new DocumentReference(Book.class, author.getBooks().get(0).getId())),
                store.findRaw("authors", author.getId()).get("books"));

        store.resetCalls();
        dm.flush();
        assertTrue(store.getCalls().isEmpty());
    }

    @Test
    void testDeletionForgetsEmbeddedDocuments() {
        Customer customer = new Customer("hank");
        Address address = new Address("Oak Ave 9", "Springfield");
        customer.setAddress(address);
        dm.persist(customer);
        dm.flush();
        assertNotNull(uow.getIdentityMap().findHandle(address));

        dm.remove(customer);
        dm.flush();

        assertNull(uow.getIdentityMap().findHandle(customer));
        assertNull(uow.getIdentityMap().findHandle(address));
    }

    @Test
    void testReplacedEmbeddedDocumentsAreForgotten() {
        Customer customer = new Customer("lou");
        Address first = new Address("Pine Rd 1", "Springfield");
        customer.setAddress(first);
        Order order = new Order("L-1", customer);
        OrderLine kept = new OrderLine("milk", 1);
        OrderLine dropped = new OrderLine("eggs", 12);
        order.addLine(kept);
        order.addLine(dropped);
        dm.persist(order);
        dm.flush();

        Address second = new Address("Pine Rd 2", "Springfield");
        customer.setAddress(second);
        order.getLines().remove(dropped);
        dm.flush();

        assertNull(uow.getIdentityMap().findHandle(first));
        assertNotNull(uow.getIdentityMap().findHandle(second));
        assertNull(uow.getIdentityMap().findHandle(dropped));
        assertNotNull(uow.getIdentityMap().findHandle(kept));
    }

    @Test
    void testReentrantCommitIsRejected() {
        dm.withListener(LifecycleEvent.ON_FLUSH, args -> args.getDocumentManager().flush());
        dm.persist(new Customer("judy"));

        UnitOfWorkException e = assertThrows(UnitOfWorkException.class, () -> dm.flush());
        assertEquals(UnitOfWorkException.Kind.COMMIT_ALREADY_IN_PROGRESS, e.getKind());
    }

    @Test
    void testDocumentIsInAtMostOneQueue() {
        Customer customer = new Customer("kim");
        dm.persist(customer);
        dm.flush();

        customer.setName("kimberly");
        uow.computeChangeSets();
        assertTrue(uow.isScheduledForUpdate(customer));

        dm.remove(customer);
        assertTrue(uow.isScheduledForDelete(customer));
        assertFalse(uow.isScheduledForUpdate(customer));
        assertFalse(uow.isScheduledForInsert(customer));

        UnitOfWorkException e = assertThrows(UnitOfWorkException.class, () -> uow.scheduleForInsert(customer));
        assertEquals(UnitOfWorkException.Kind.DUPLICATE_SCHEDULE, e.getKind());
        e = assertThrows(UnitOfWorkException.class, () -> uow.scheduleForUpdate(customer));
        assertEquals(UnitOfWorkException.Kind.DUPLICATE_SCHEDULE, e.getKind());
    }

    @Test
    void testRemovingUnflushedDocumentCancelsInsert() {
        Customer customer = new Customer("leo");
        dm.persist(customer);
        dm.remove(customer);
        dm.flush();

        assertTrue(store.getCalls().isEmpty());
        assertFalse(uow.isDocumentScheduled(customer));
    }

    @Test
    void testDeletedDocumentStartsOverWhenPersistedAgain() {
        Customer customer = new Customer("mia");
        dm.persist(customer);
        dm.flush();
        Long firstId = customer.getId();

        dm.remove(customer);
        dm.flush();
        assertNull(store.findRaw("customers", firstId));

        dm.persist(customer);
        assertTrue(uow.isScheduledForInsert(customer));
        dm.flush();
        assertNotNull(store.findRaw("customers", customer.getId()));
    }
}
