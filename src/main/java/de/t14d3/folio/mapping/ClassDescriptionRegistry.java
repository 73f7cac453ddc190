package de.t14d3.folio.mapping;

import de.t14d3.folio.exceptions.MappingException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed cache of class descriptions. A description registered explicitly
 * wins over one read from annotations; unknown classes are read on first use.
 */
public class ClassDescriptionRegistry {
    private final Map<Class<?>, ClassDescription> descriptions = new ConcurrentHashMap<>();
    private final Map<String, ClassDescription> descriptionsByName = new ConcurrentHashMap<>();
    private final AnnotationDescriptionReader reader;

    public ClassDescriptionRegistry() {
        this(new AnnotationDescriptionReader());
    }

    public ClassDescriptionRegistry(AnnotationDescriptionReader reader) {
        this.reader = reader;
    }

    public ClassDescription describe(Class<?> type) {
        ClassDescription description = descriptions.computeIfAbsent(type, reader::read);
        descriptionsByName.putIfAbsent(type.getName(), description);
        return description;
    }

    /**
     * Looks a description up by fully qualified class name, loading the class if
     * it has not been described yet.
     */
    public ClassDescription describe(String typeName) {
        ClassDescription description = descriptionsByName.get(typeName);
        if (description != null) {
            return description;
        }
        try {
            return describe(Class.forName(typeName));
        } catch (ClassNotFoundException e) {
            throw new MappingException("Unknown document class " + typeName, e);
        }
    }

    public void register(ClassDescription description) {
        descriptions.put(description.getType(), description);
        descriptionsByName.put(description.getName(), description);
    }

    public boolean isRegistered(Class<?> type) {
        return descriptions.containsKey(type);
    }

    public Collection<ClassDescription> getDescriptions() {
        return Collections.unmodifiableCollection(descriptions.values());
    }
}
