package de.t14d3.folio.core;

import de.t14d3.folio.exceptions.MappingException;
import de.t14d3.folio.mapping.ClassDescription;
import de.t14d3.folio.mapping.FieldMapping;
import de.t14d3.folio.store.DocumentDataConverter;
import de.t14d3.folio.store.DocumentReference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills documents from stored data.
 * <p>
 * Stored data is a map keyed by stored field name. References are
 * {@link DocumentReference}s, embedded documents nested maps carrying their class
 * under {@code _class}. Single references are resolved eagerly, reference lists
 * become uninitialized {@link PersistentCollection}s.
 */
class DocumentHydrator {
    static final String ID_KEY = DocumentDataConverter.ID_KEY;
    static final String CLASS_KEY = DocumentDataConverter.CLASS_KEY;

    private final UnitOfWork unitOfWork;
    private final IdentityMap identityMap;

    DocumentHydrator(UnitOfWork unitOfWork, IdentityMap identityMap) {
        this.unitOfWork = unitOfWork;
        this.identityMap = identityMap;
    }

    /**
     * Sets every mapped field of the document from the data.
     *
     * @return the hydrated values keyed by field name, to be used as original data
     */
    Map<String, Object> hydrate(ClassDescription description, Object document, Map<String, Object> data) {
        Map<String, Object> hydrated = new LinkedHashMap<>();
        for (FieldMapping mapping : description.getFieldMappings()) {
            Object value = hydrateValue(document, mapping, data.get(mapping.storedName()));
            mapping.setValue(document, value);
            hydrated.put(mapping.name(), value);
        }
        return hydrated;
    }

    private Object hydrateValue(Object document, FieldMapping mapping, Object raw) {
        switch (mapping.kind()) {
            case SCALAR:
                return raw;
            case REF_ONE:
                return raw == null ? null : unitOfWork.resolveReference((DocumentReference) raw);
            case REF_MANY: {
                List<DocumentReference> references = new ArrayList<>();
                if (raw != null) {
                    for (Object reference : (List<?>) raw) {
                        references.add((DocumentReference) reference);
                    }
                }
                PersistentCollection<Object> collection =
                        new PersistentCollection<>(unitOfWork.getCollectionLoader(), references);
                collection.setOwner(document, mapping);
                return collection;
            }
            case EMBED_ONE:
                return raw == null ? null : hydrateEmbedded(mapping, asData(raw));
            case EMBED_MANY: {
                List<Object> embedded = new ArrayList<>();
                if (raw != null) {
                    for (Object element : (List<?>) raw) {
                        embedded.add(hydrateEmbedded(mapping, asData(element)));
                    }
                }
                PersistentCollection<Object> collection = new PersistentCollection<>(embedded);
                collection.setOwner(document, mapping);
                collection.takeSnapshot();
                return collection;
            }
            default:
                throw new IllegalStateException("Unknown field kind " + mapping.kind());
        }
    }

    private Object hydrateEmbedded(FieldMapping mapping, Map<String, Object> data) {
        ClassDescription description = describeStored(data, mapping.targetType());
        Object embedded = description.newInstance();
        Map<String, Object> original = hydrate(description, embedded, data);
        identityMap.registerManaged(embedded, null, original);
        return embedded;
    }

    /**
     * The description of the class named in the data, falling back to the declared type.
     */
    ClassDescription describeStored(Map<String, Object> data, Class<?> declaredType) {
        Object storedClass = data.get(CLASS_KEY);
        if (storedClass == null || storedClass.equals(declaredType.getName())) {
            return unitOfWork.describe(declaredType);
        }
        ClassDescription description = unitOfWork.describe(storedClass.toString());
        if (!declaredType.isAssignableFrom(description.getType())) {
            throw new MappingException("Stored class " + storedClass + " is not a " + declaredType.getName());
        }
        return description;
    }

    private static Map<String, Object> asData(Object raw) {
        Map<String, Object> data = new LinkedHashMap<>();
        ((Map<?, ?>) raw).forEach((key, value) -> data.put(String.valueOf(key), value));
        return data;
    }
}
