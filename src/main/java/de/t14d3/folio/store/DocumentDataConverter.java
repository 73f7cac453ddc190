package de.t14d3.folio.store;

import de.t14d3.folio.core.PersistentCollection;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.ClassDescriptionRegistry;
import de.t14d3.folio.mapping.FieldMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts documents into the raw data maps kept by the {@link InMemoryDocumentStore}.
 * <p>
 * A raw document holds {@code _id}, {@code _class} and one entry per mapped field
 * under its stored name. References become {@link DocumentReference}s, embedded
 * documents nested maps with their own {@code _class}. A reference to a document
 * that has no identifier yet is written as null.
 */
public class DocumentDataConverter {
    public static final String ID_KEY = "_id";
    public static final String CLASS_KEY = "_class";

    private final ClassDescriptionRegistry registry;

    public DocumentDataConverter(ClassDescriptionRegistry registry) {
        this.registry = registry;
    }

    public Map<String, Object> toData(ClassDescription description, Object document) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (!description.isEmbedded()) {
            data.put(ID_KEY, description.getIdentifierValue(document));
        }
        data.put(CLASS_KEY, document.getClass().getName());
        for (FieldMapping mapping : description.getFieldMappings()) {
            data.put(mapping.storedName(), toValue(mapping, mapping.getValue(document)));
        }
        return data;
    }

    /**
     * Stored form of one field value.
     */
    public Object toValue(FieldMapping mapping, Object value) {
        if (value == null) {
            return null;
        }
        switch (mapping.kind()) {
            case SCALAR:
                return copy(value);
            case REF_ONE:
                return toReference(value);
            case REF_MANY: {
                List<Object> references = new ArrayList<>();
                if (value instanceof PersistentCollection<?> collection && !collection.isInitialized()) {
                    references.addAll(collection.getReferences());
                    for (Object element : collection.unwrap()) {
                        addReference(references, element);
                    }
                } else {
                    for (Object element : elements(value)) {
                        addReference(references, element);
                    }
                }
                return references;
            }
            case EMBED_ONE:
                return toData(registry.describe(value.getClass()), value);
            case EMBED_MANY: {
                List<Object> embedded = new ArrayList<>();
                for (Object element : elements(value)) {
                    if (element != null) {
                        embedded.add(toData(registry.describe(element.getClass()), element));
                    }
                }
                return embedded;
            }
            default:
                throw new IllegalStateException("Unknown field kind " + mapping.kind());
        }
    }

    private DocumentReference toReference(Object document) {
        Object id = registry.describe(document.getClass()).getIdentifierValue(document);
        return id == null ? null : new DocumentReference(document.getClass(), id);
    }

    private void addReference(List<Object> references, Object document) {
        if (document == null) {
            return;
        }
        DocumentReference reference = toReference(document);
        if (reference != null) {
            references.add(reference);
        }
    }

    private static Collection<?> elements(Object value) {
        if (value instanceof PersistentCollection<?> collection) {
            return collection.unwrap();
        }
        return (Collection<?>) value;
    }

    /**
     * Deep copy of raw data, so callers never share mutable state with the store.
     */
    public static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, element) -> copy.put(key, copy(element)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>();
            for (Object element : collection) {
                copy.add(copy(element));
            }
            return copy;
        }
        return value;
    }

    /**
     * Converts a generated sequence value or UUID to the identifier type of the class.
     */
    public static Object convertIdentifier(Object value, Class<?> targetType) {
        if (value == null || targetType == null) {
            return value;
        }
        if (targetType == Long.class || targetType == long.class) {
            if (value instanceof Number number) return number.longValue();
        } else if (targetType == Integer.class || targetType == int.class) {
            if (value instanceof Number number) return number.intValue();
        } else if (targetType == UUID.class) {
            if (value instanceof String string) return UUID.fromString(string);
        } else if (targetType == String.class) {
            return value.toString();
        }
        return value;
    }
}
