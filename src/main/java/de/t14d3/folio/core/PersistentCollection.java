package de.t14d3.folio.core;

import de.t14d3.folio.mapping.FieldMapping;
import de.t14d3.folio.store.DocumentReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A list of related documents that loads lazily and remembers what it looked like
 * at the last commit.
 * <p>
 * Reading operations initialize the collection. {@link #add(Object)} does not: it
 * appends to the wrapped storage and marks the collection dirty, so elements can be
 * added without reading the collection first. Diffs against the snapshot compare
 * elements by identity.
 *
 * @param <E> element type
 */
public class PersistentCollection<E> extends AbstractList<E> {
    private static final Logger LOG = LoggerFactory.getLogger(PersistentCollection.class);

    private final List<E> storage;
    private final List<DocumentReference> references;
    private final CollectionLoader loader;
    private List<E> snapshot = new ArrayList<>();
    private Object owner;
    private FieldMapping mapping;
    private boolean initialized;
    private boolean dirty;

    /**
     * An initialized collection wrapping the given storage.
     */
    public PersistentCollection(List<E> storage) {
        this.storage = storage;
        this.references = new ArrayList<>();
        this.loader = null;
        this.initialized = true;
    }

    /**
     * An uninitialized collection that loads the referenced documents on first read.
     */
    public PersistentCollection(CollectionLoader loader, List<DocumentReference> references) {
        this.storage = new ArrayList<>();
        this.references = new ArrayList<>(references);
        this.loader = loader;
        this.initialized = false;
    }

    /**
     * Loads the referenced documents. Elements added before initialization are
     * appended after the loaded ones and stay part of the insert diff.
     */
    public void initialize() {
        if (initialized) {
            return;
        }
        List<E> added = new ArrayList<>(storage);
        storage.clear();

        if (!references.isEmpty()) {
            LOG.debug("Initializing collection {} with {} references", describe(), references.size());
            Map<Class<?>, List<Object>> idsByType = new LinkedHashMap<>();
            for (DocumentReference reference : references) {
                idsByType.computeIfAbsent(reference.type(), t -> new ArrayList<>()).add(reference.id());
            }
            Map<Class<?>, Map<Object, Object>> loaded = new LinkedHashMap<>();
            idsByType.forEach((type, ids) -> loaded.put(type, loader.loadAll(type, ids)));
            for (DocumentReference reference : references) {
                Object element = loaded.get(reference.type()).get(reference.id());
                if (element != null) {
                    @SuppressWarnings("unchecked")
                    E typed = (E) element;
                    storage.add(typed);
                }
            }
        }

        // additions that were already committed belong to the snapshot
        Set<Object> committed = identitySet(snapshot);
        List<E> loadedSnapshot = new ArrayList<>(storage);
        boolean pendingAdditions = false;
        for (E element : added) {
            if (committed.contains(element)) {
                loadedSnapshot.add(element);
            } else {
                pendingAdditions = true;
            }
        }
        storage.addAll(added);
        snapshot = loadedSnapshot;
        references.clear();
        initialized = true;
        if (pendingAdditions) {
            dirty = true;
        }
    }

    @Override
    public E get(int index) {
        initialize();
        return storage.get(index);
    }

    @Override
    public int size() {
        initialize();
        return storage.size();
    }

    @Override
    public boolean add(E element) {
        storage.add(element);
        modCount++;
        changed();
        return true;
    }

    @Override
    public void add(int index, E element) {
        initialize();
        storage.add(index, element);
        modCount++;
        changed();
    }

    @Override
    public E set(int index, E element) {
        initialize();
        E previous = storage.set(index, element);
        changed();
        return previous;
    }

    @Override
    public E remove(int index) {
        initialize();
        E removed = storage.remove(index);
        modCount++;
        changed();
        return removed;
    }

    @Override
    public boolean contains(Object element) {
        initialize();
        return storage.contains(element);
    }

    @Override
    public Iterator<E> iterator() {
        initialize();
        return super.iterator();
    }

    @Override
    public void clear() {
        initialize();
        if (storage.isEmpty()) {
            return;
        }
        storage.clear();
        modCount++;
        changed();
    }

    /**
     * The wrapped storage, without initializing. Before initialization it holds
     * only the elements added since.
     */
    public List<E> unwrap() {
        return storage;
    }

    /**
     * References still to be loaded; empty once initialized.
     */
    public List<DocumentReference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public void takeSnapshot() {
        snapshot = new ArrayList<>(storage);
        dirty = false;
    }

    public List<E> getSnapshot() {
        return Collections.unmodifiableList(snapshot);
    }

    /**
     * Elements of the snapshot that are no longer in the collection.
     */
    public List<E> getDeleteDiff() {
        return identityDiff(snapshot, storage);
    }

    /**
     * Elements of the collection that are not in the snapshot.
     */
    public List<E> getInsertDiff() {
        return identityDiff(storage, snapshot);
    }

    public boolean isDirty() {
        return dirty;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public void setOwner(Object owner, FieldMapping mapping) {
        this.owner = owner;
        this.mapping = mapping;
    }

    public Object getOwner() {
        return owner;
    }

    public FieldMapping getMapping() {
        return mapping;
    }

    private void changed() {
        dirty = true;
    }

    private String describe() {
        if (owner == null || mapping == null) {
            return "<unowned>";
        }
        return owner.getClass().getSimpleName() + "." + mapping.name();
    }

    private static <T> List<T> identityDiff(List<T> from, List<T> without) {
        Set<Object> excluded = identitySet(without);
        List<T> diff = new ArrayList<>();
        for (T element : from) {
            if (!excluded.contains(element)) {
                diff.add(element);
            }
        }
        return diff;
    }

    private static Set<Object> identitySet(List<?> elements) {
        Set<Object> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(elements);
        return set;
    }
}
