package de.t14d3.folio.test;

import de.t14d3.folio.core.DocumentManager;
import de.t14d3.folio.core.PersistentCollection;
import de.t14d3.folio.exceptions.DocumentManagerClosedException;
import de.t14d3.folio.exceptions.FolioException;
import de.t14d3.folio.store.InMemoryDocumentStore;
import de.t14d3.folio.test.entities.Author;
import de.t14d3.folio.test.entities.Book;
import de.t14d3.folio.test.entities.Car;
import de.t14d3.folio.test.entities.Customer;
import de.t14d3.folio.test.entities.Vehicle;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentManagerTest {
    private InMemoryDocumentStore store;
    private DocumentManager dm;

    @BeforeEach
    void setup() {
        store = new InMemoryDocumentStore();
        dm = DocumentManager.create(store);
    }

    @AfterEach
    void teardown() {
        dm.close();
    }

    private DocumentManager secondManager() {
        return DocumentManager.create(store);
    }

    @Test
    void testFindReturnsManagedInstance() {
        Customer customer = new Customer("Homer");
        customer.setEmail("homer@example.com");
        dm.persist(customer);
        dm.flush();

        assertSame(customer, dm.find(Customer.class, customer.getId()));

        DocumentManager other = secondManager();
        Customer loaded = other.find(Customer.class, customer.getId());
        assertNotSame(customer, loaded);
        assertEquals("Homer", loaded.getName());
        assertEquals("homer@example.com", loaded.getEmail());
        assertSame(loaded, other.find(Customer.class, customer.getId()));
        assertEquals(1, other.getUnitOfWork().size());
        other.close();
    }

    @Test
    void testFindMissingDocument() {
        assertNull(dm.find(Customer.class, 12345L));
        assertNull(dm.find(Customer.class, null));
    }

    @Test
    void testFindHonoursStoredSubclass() {
        dm.persist(new Car("HH-AB-1", "Golf"));
        dm.persist(new Vehicle("HH-AB-2", 2));
        dm.flush();

        DocumentManager other = secondManager();
        Vehicle vehicle = other.find(Vehicle.class, "HH-AB-1");
        assertInstanceOf(Car.class, vehicle);
        assertEquals("Golf", ((Car) vehicle).getModel());
        assertEquals(4, vehicle.getWheels());
        assertSame(vehicle, other.find(Car.class, "HH-AB-1"));

        assertNull(other.find(Car.class, "HH-AB-2"));
        assertNotNull(other.find(Vehicle.class, "HH-AB-2"));
        other.close();
    }

    @Test
    void testSubclassesShareRootCollection() {
        dm.persist(new Car("M-CD-3", "Polo"));
        dm.flush();

        assertEquals(1, store.count("vehicles"));
        assertEquals(Car.class.getName(), store.findRaw("vehicles", "M-CD-3").get("_class"));
    }

    @Test
    void testAssignedIdentifierIsRequired() {
        dm.persist(new Vehicle(null, 3));

        assertThrows(FolioException.class, () -> dm.flush());
    }

    @Test
    void testAssignedIdentifierEntersIdentityMapOnPersist() {
        Vehicle vehicle = new Vehicle("B-EF-4", 2);

        dm.persist(vehicle);

        assertSame(vehicle, dm.find(Vehicle.class, "B-EF-4"));
    }

    @Test
    void testGetReferenceDoesNotLoad() {
        Customer customer = new Customer("Marge");
        customer.setEmail("marge@example.com");
        dm.persist(customer);
        dm.flush();

        DocumentManager other = secondManager();
        Customer reference = other.getReference(Customer.class, customer.getId());

        assertEquals(customer.getId(), reference.getId());
        assertNull(reference.getName());
        assertTrue(other.contains(reference));
        assertSame(reference, other.find(Customer.class, customer.getId()));
        assertSame(reference, other.getReference(Customer.class, customer.getId()));

        // only what was set on the reference is written
        reference.setName("Marjorie");
        other.flush();
        assertEquals("Marjorie", store.findRaw("customers", customer.getId()).get("name"));
        assertEquals("marge@example.com", store.findRaw("customers", customer.getId()).get("mail"));
        other.close();
    }

    @Test
    void testGetReferenceRequiresIdentifier() {
        assertThrows(IllegalArgumentException.class, () -> dm.getReference(Customer.class, null));
    }

    @Test
    void testContains() {
        Customer customer = new Customer("Lisa");
        assertFalse(dm.contains(customer));

        dm.persist(customer);
        assertTrue(dm.contains(customer));

        dm.flush();
        assertTrue(dm.contains(customer));

        dm.remove(customer);
        assertFalse(dm.contains(customer));
    }

    @Test
    void testLazyCollectionInFreshManager() {
        Author author = new Author("Adams");
        author.addBook(new Book("Mostly Harmless"));
        author.addBook(new Book("So Long"));
        dm.persist(author);
        dm.flush();

        DocumentManager other = secondManager();
        Author loaded = other.find(Author.class, author.getId());

        PersistentCollection<?> books = (PersistentCollection<?>) loaded.getBooks();
        assertFalse(books.isInitialized());
        assertEquals(2, books.getReferences().size());

        assertEquals(2, loaded.getBooks().size());
        assertTrue(books.isInitialized());
        assertEquals("Mostly Harmless", loaded.getBooks().get(0).getTitle());
        for (Book book : loaded.getBooks()) {
            assertSame(loaded, book.getAuthor());
        }
        other.close();
    }

    @Test
    void testAddingToLazyCollectionIsWritten() {
        Author author = new Author("Gaiman");
        author.addBook(new Book("Neverwhere"));
        dm.persist(author);
        dm.flush();

        DocumentManager other = secondManager();
        Author loaded = other.find(Author.class, author.getId());
        loaded.addBook(new Book("Stardust"));
        assertFalse(((PersistentCollection<?>) loaded.getBooks()).isInitialized());
        other.flush();
        other.close();

        DocumentManager third = secondManager();
        Author reloaded = third.find(Author.class, author.getId());
        assertEquals(2, reloaded.getBooks().size());
        assertEquals("Stardust", reloaded.getBooks().get(1).getTitle());
        third.close();
    }

    @Test
    void testClearDropsEverything() {
        Customer stored = new Customer("Bart");
        dm.persist(stored);
        dm.flush();
        Customer pending = new Customer("Maggie");
        dm.persist(pending);

        dm.clear();
        dm.flush();

        assertFalse(dm.contains(stored));
        assertFalse(dm.contains(pending));
        assertEquals(0, dm.getUnitOfWork().size());
        assertEquals(1, store.count("customers"));
        assertNotSame(stored, dm.find(Customer.class, stored.getId()));
    }

    @Test
    void testClosedManagerRejectsCalls() {
        dm.close();

        assertFalse(dm.isOpen());
        assertThrows(DocumentManagerClosedException.class, () -> dm.persist(new Customer("Ned")));
        assertThrows(DocumentManagerClosedException.class, () -> dm.flush());
        assertThrows(DocumentManagerClosedException.class, () -> dm.find(Customer.class, 1L));
        // closing twice is fine
        dm.close();
    }

    @Test
    void testNullArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DocumentManager.create(null));
        assertThrows(IllegalArgumentException.class, () -> dm.persist(null));
        assertThrows(IllegalArgumentException.class, () -> dm.remove(null));
        assertThrows(IllegalArgumentException.class, () -> dm.merge(null));
        assertThrows(IllegalArgumentException.class, () -> dm.detach(null));
        assertThrows(IllegalArgumentException.class, () -> dm.refresh(null));
    }

    @Test
    void testRepositoryIsCachedPerClass() {
        assertSame(dm.getRepository(Customer.class), dm.getRepository(Customer.class));
        assertNotSame(dm.getRepository(Customer.class), dm.getRepository(Author.class));
    }
}
