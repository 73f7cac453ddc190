package de.t14d3.folio.test;

import de.t14d3.folio.core.DocumentManager;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.event.LifecycleEventArgs;
import de.t14d3.folio.event.LifecycleListener;
import de.t14d3.folio.event.PreLoadEventArgs;
import de.t14d3.folio.event.PreUpdateEventArgs;
import de.t14d3.folio.store.InMemoryDocumentStore;
import de.t14d3.folio.test.entities.Ticket;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class LifecycleEventsTest {
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

    @Test
    void testPersistCallbacks() {
        Ticket ticket = new Ticket("printer on fire");

        dm.persist(ticket);
        assertEquals(List.of(LifecycleEvent.PRE_PERSIST), ticket.getCallbacks());

        dm.flush();
        assertEquals(List.of(LifecycleEvent.PRE_PERSIST, LifecycleEvent.POST_PERSIST), ticket.getCallbacks());
    }

    @Test
    void testUpdateCallbacks() {
        Ticket ticket = new Ticket("slow network");
        dm.persist(ticket);
        dm.flush();
        ticket.getCallbacks().clear();

        ticket.setSubject("very slow network");
        dm.flush();

        assertEquals(List.of(LifecycleEvent.PRE_UPDATE, LifecycleEvent.POST_UPDATE), ticket.getCallbacks());
    }

    @Test
    void testNoUpdateCallbacksWithoutChanges() {
        Ticket ticket = new Ticket("quiet");
        dm.persist(ticket);
        dm.flush();
        ticket.getCallbacks().clear();

        dm.flush();

        assertTrue(ticket.getCallbacks().isEmpty());
    }

    @Test
    void testRemoveCallbacks() {
        Ticket ticket = new Ticket("duplicate");
        dm.persist(ticket);
        dm.flush();
        ticket.getCallbacks().clear();

        dm.remove(ticket);
        assertEquals(List.of(LifecycleEvent.PRE_REMOVE), ticket.getCallbacks());

        dm.flush();
        assertEquals(List.of(LifecycleEvent.PRE_REMOVE, LifecycleEvent.POST_REMOVE), ticket.getCallbacks());
    }

    @Test
    void testLoadCallback() {
        Ticket ticket = new Ticket("stored");
        dm.persist(ticket);
        dm.flush();

        DocumentManager other = DocumentManager.create(store);
        Ticket loaded = other.find(Ticket.class, ticket.getId());

        assertNotSame(ticket, loaded);
        assertEquals(List.of(LifecycleEvent.POST_LOAD), loaded.getCallbacks());
        other.close();
    }

    @Test
    void testListenersSeeDocuments() {
        List<String> seen = new ArrayList<>();
        dm.withListener(LifecycleEvent.PRE_PERSIST, args -> seen.add("pre:" + ((Ticket) args.getDocument()).getId()))
                .withListener(LifecycleEvent.POST_PERSIST, args -> seen.add("post:" + ((Ticket) args.getDocument()).getId()));

        Ticket ticket = new Ticket("listened");
        dm.persist(ticket);
        dm.flush();

        assertEquals(List.of("pre:null", "post:" + ticket.getId()), seen);
    }

    @Test
    void testCallbacksRunBeforeListeners() {
        List<Object> order = new ArrayList<>();
        Ticket ticket = new Ticket("ordering");
        dm.withListener(LifecycleEvent.PRE_PERSIST, args -> order.addAll(ticket.getCallbacks()));

        dm.persist(ticket);

        assertEquals(List.of(LifecycleEvent.PRE_PERSIST), order);
    }

    @Test
    void testOnFlushOncePerCommit() {
        AtomicInteger flushes = new AtomicInteger();
        dm.withListener(LifecycleEvent.ON_FLUSH, args -> {
            assertNull(args.getDocument());
            assertSame(dm, args.getDocumentManager());
            flushes.incrementAndGet();
        });

        dm.persist(new Ticket("one"));
        dm.persist(new Ticket("two"));
        dm.flush();
        assertEquals(1, flushes.get());

        // nothing to write, no event
        dm.flush();
        assertEquals(1, flushes.get());
    }

    @Test
    void testPreUpdateArgsExposeChangeSet() {
        List<String> changes = new ArrayList<>();
        dm.withListener(LifecycleEvent.PRE_UPDATE, args -> {
            PreUpdateEventArgs update = (PreUpdateEventArgs) args;
            if (update.hasChangedField("subject")) {
                changes.add(update.getChangeSet().get("subject").oldValue() + " -> "
                        + update.getChangeSet().get("subject").newValue());
            }
        });
        Ticket ticket = new Ticket("before");
        dm.persist(ticket);
        dm.flush();

        ticket.setSubject("after");
        dm.flush();

        assertEquals(List.of("before -> after"), changes);
    }

    @Test
    void testPreLoadListenerMayPatchData() {
        Ticket ticket = new Ticket("raw");
        dm.persist(ticket);
        dm.flush();

        DocumentManager other = DocumentManager.create(store)
                .withListener(LifecycleEvent.PRE_LOAD, args -> ((PreLoadEventArgs) args).getData().put("subject", "patched"));
        Ticket loaded = other.find(Ticket.class, ticket.getId());

        assertEquals("patched", loaded.getSubject());
        assertEquals("raw", store.findRaw("tickets", ticket.getId()).get("subject"));
        other.close();
    }

    @Test
    void testRemovedListenerIsNotCalled() {
        AtomicInteger calls = new AtomicInteger();
        LifecycleListener listener = args -> calls.incrementAndGet();
        dm.withListener(LifecycleEvent.PRE_PERSIST, listener);

        assertTrue(dm.getEventManager().removeListener(LifecycleEvent.PRE_PERSIST, listener));
        dm.persist(new Ticket("unheard"));

        assertEquals(0, calls.get());
        assertFalse(dm.getEventManager().hasListeners(LifecycleEvent.PRE_PERSIST));
    }

    @Test
    void testEventArgsCarryEvent() {
        List<LifecycleEventArgs> received = new ArrayList<>();
        dm.withListener(LifecycleEvent.POST_REMOVE, received::add);
        Ticket ticket = new Ticket("bye");
        dm.persist(ticket);
        dm.flush();

        dm.remove(ticket);
        dm.flush();

        assertEquals(1, received.size());
        assertEquals(LifecycleEvent.POST_REMOVE, received.get(0).getEvent());
        assertSame(ticket, received.get(0).getDocument());
    }
}
