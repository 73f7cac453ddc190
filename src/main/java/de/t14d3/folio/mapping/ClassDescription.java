package de.t14d3.folio.mapping;

import de.t14d3.folio.annotations.CascadeType;
import de.t14d3.folio.event.LifecycleEvent;
import de.t14d3.folio.exceptions.MappingException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything the unit of work needs to know about a document class: identifier,
 * mapped fields, relationships, change tracking policy and lifecycle callbacks.
 * <p>
 * Descriptions are immutable and built once per class, either from annotations by
 * {@link AnnotationDescriptionReader} or explicitly through {@link #builder(Class)},
 * and then looked up through the {@link ClassDescriptionRegistry}.
 */
public final class ClassDescription {
    private final Class<?> type;
    private final Class<?> rootType;
    private final String collectionName;
    private final boolean embedded;
    private final FieldMapping identifier;
    private final boolean identifierGenerated;
    private final List<FieldMapping> fieldMappings;
    private final List<FieldMapping> associationMappings;
    private final Map<String, FieldMapping> fieldMappingsByName;
    private final ChangeTrackingPolicy changeTrackingPolicy;
    private final Map<LifecycleEvent, List<Consumer<Object>>> lifecycleCallbacks;
    private final Supplier<Object> instantiator;

    private ClassDescription(Builder<?> builder) {
        this.type = builder.type;
        this.rootType = builder.rootType != null ? builder.rootType : builder.type;
        this.collectionName = builder.collectionName != null
                ? builder.collectionName
                : rootType.getSimpleName().toLowerCase();
        this.embedded = builder.embedded;
        this.identifier = builder.identifier;
        this.identifierGenerated = builder.identifierGenerated;
        this.changeTrackingPolicy = builder.changeTrackingPolicy;
        this.instantiator = builder.instantiator;

        Map<String, FieldMapping> byName = new LinkedHashMap<>();
        List<FieldMapping> associations = new ArrayList<>();
        for (FieldMapping mapping : builder.fieldMappings) {
            if (byName.put(mapping.name(), mapping) != null
                    || (identifier != null && identifier.name().equals(mapping.name()))) {
                throw MappingException.duplicateFieldMapping(type, mapping.name());
            }
            if (mapping.kind().isAssociation()) {
                associations.add(mapping);
            }
        }
        this.fieldMappings = List.copyOf(byName.values());
        this.associationMappings = List.copyOf(associations);
        this.fieldMappingsByName = Collections.unmodifiableMap(byName);

        Map<LifecycleEvent, List<Consumer<Object>>> callbacks = new EnumMap<>(LifecycleEvent.class);
        builder.lifecycleCallbacks.forEach((event, list) -> callbacks.put(event, List.copyOf(list)));
        this.lifecycleCallbacks = Collections.unmodifiableMap(callbacks);

        if (!embedded && identifier == null) {
            throw MappingException.identifierRequired(type);
        }
        if (embedded && identifier != null) {
            throw new MappingException("Embedded document " + type.getName() + " must not declare an identifier");
        }
    }

    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    public Class<?> getType() {
        return type;
    }

    public String getName() {
        return type.getName();
    }

    /**
     * The topmost mapped class of the hierarchy; documents are keyed by it in the identity map.
     */
    public Class<?> getRootType() {
        return rootType;
    }

    public String getRootName() {
        return rootType.getName();
    }

    public String getCollectionName() {
        return collectionName;
    }

    public boolean isEmbedded() {
        return embedded;
    }

    /**
     * Identifier mapping, or null for embedded documents.
     */
    public FieldMapping getIdentifier() {
        return identifier;
    }

    public boolean isIdentifierGenerated() {
        return identifierGenerated;
    }

    /**
     * All mapped fields except the identifier, in declaration order.
     */
    public List<FieldMapping> getFieldMappings() {
        return fieldMappings;
    }

    /**
     * Embedded and referenced fields, in declaration order.
     */
    public List<FieldMapping> getAssociationMappings() {
        return associationMappings;
    }

    public FieldMapping getFieldMapping(String name) {
        FieldMapping mapping = fieldMappingsByName.get(name);
        if (mapping == null) {
            throw MappingException.mappingNotFound(type, name);
        }
        return mapping;
    }

    public boolean hasField(String name) {
        return fieldMappingsByName.containsKey(name);
    }

    /**
     * Policy declared for this class, or null when the configured default applies.
     */
    public ChangeTrackingPolicy getChangeTrackingPolicy() {
        return changeTrackingPolicy;
    }

    public Object getIdentifierValue(Object document) {
        return identifier == null ? null : identifier.getValue(document);
    }

    public void setIdentifierValue(Object document, Object id) {
        if (identifier == null) {
            throw new MappingException("Embedded document " + type.getName() + " has no identifier");
        }
        identifier.setValue(document, id);
    }

    public Class<?> getIdentifierType() {
        return identifier == null ? null : identifier.targetType();
    }

    public boolean hasLifecycleCallbacks(LifecycleEvent event) {
        return lifecycleCallbacks.containsKey(event);
    }

    public void invokeLifecycleCallbacks(LifecycleEvent event, Object document) {
        List<Consumer<Object>> callbacks = lifecycleCallbacks.get(event);
        if (callbacks == null) {
            return;
        }
        for (Consumer<Object> callback : callbacks) {
            callback.accept(document);
        }
    }

    public Object newInstance() {
        if (instantiator == null) {
            throw new MappingException("Cannot find parameterless constructor for document " + type.getName());
        }
        return instantiator.get();
    }

    @Override
    public String toString() {
        return "ClassDescription{" + type.getSimpleName() + (embedded ? ", embedded" : "") + "}";
    }

    /**
     * Explicit registration of a class description with lambda accessors.
     *
     * <pre>{@code
     * ClassDescription description = ClassDescription.builder(Order.class)
     *         .identifier("id", Long.class, Order::getId, (o, v) -> o.setId((Long) v))
     *         .property("number", Order::getNumber, (o, v) -> o.setNumber((String) v))
     *         .referenceOne("customer", Customer.class, Order::getCustomer,
     *                 (o, v) -> o.setCustomer((Customer) v), false, CascadeType.PERSIST)
     *         .instantiator(Order::new)
     *         .build();
     * }</pre>
     */
    public static final class Builder<T> {
        private final Class<T> type;
        private Class<?> rootType;
        private String collectionName;
        private boolean embedded;
        private FieldMapping identifier;
        private boolean identifierGenerated = true;
        private final List<FieldMapping> fieldMappings = new ArrayList<>();
        private ChangeTrackingPolicy changeTrackingPolicy;
        private final Map<LifecycleEvent, List<Consumer<Object>>> lifecycleCallbacks = new EnumMap<>(LifecycleEvent.class);
        private Supplier<Object> instantiator;

        private Builder(Class<T> type) {
            if (type == null) {
                throw new IllegalArgumentException("type must not be null");
            }
            this.type = type;
        }

        public Builder<T> root(Class<?> rootType) {
            this.rootType = rootType;
            return this;
        }

        public Builder<T> collection(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public Builder<T> embedded() {
            this.embedded = true;
            return this;
        }

        public Builder<T> identifier(String name, Class<?> idType, Function<T, Object> getter, BiConsumer<T, Object> setter) {
            return identifier(name, idType, true, getter, setter);
        }

        public Builder<T> identifier(String name, Class<?> idType, boolean generated,
                                     Function<T, Object> getter, BiConsumer<T, Object> setter) {
            this.identifier = new FieldMapping(name, "_id", FieldMapping.Kind.SCALAR, idType, null, false, false,
                    accessor(getter, setter));
            this.identifierGenerated = generated;
            return this;
        }

        public Builder<T> property(String name, Function<T, Object> getter, BiConsumer<T, Object> setter) {
            fieldMappings.add(FieldMapping.scalar(name, accessor(getter, setter)));
            return this;
        }

        public Builder<T> referenceOne(String name, Class<?> targetType, Function<T, Object> getter,
                                       BiConsumer<T, Object> setter, boolean nullable, CascadeType... cascade) {
            fieldMappings.add(new FieldMapping(name, name, FieldMapping.Kind.REF_ONE, targetType,
                    cascadeSet(cascade), nullable, false, accessor(getter, setter)));
            return this;
        }

        public Builder<T> referenceMany(String name, Class<?> targetType, Function<T, Object> getter,
                                        BiConsumer<T, Object> setter, CascadeType... cascade) {
            fieldMappings.add(FieldMapping.association(name, FieldMapping.Kind.REF_MANY, targetType,
                    Arrays.asList(cascade), accessor(getter, setter)));
            return this;
        }

        public Builder<T> embedOne(String name, Class<?> targetType, Function<T, Object> getter, BiConsumer<T, Object> setter) {
            fieldMappings.add(FieldMapping.association(name, FieldMapping.Kind.EMBED_ONE, targetType,
                    null, accessor(getter, setter)));
            return this;
        }

        public Builder<T> embedMany(String name, Class<?> targetType, Function<T, Object> getter, BiConsumer<T, Object> setter) {
            fieldMappings.add(FieldMapping.association(name, FieldMapping.Kind.EMBED_MANY, targetType,
                    null, accessor(getter, setter)));
            return this;
        }

        /**
         * Adds a fully specified mapping, for options the shorthand methods do not cover.
         */
        public Builder<T> mapping(FieldMapping mapping) {
            fieldMappings.add(mapping);
            return this;
        }

        Builder<T> identifierMapping(FieldMapping mapping, boolean generated) {
            this.identifier = mapping;
            this.identifierGenerated = generated;
            return this;
        }

        public Builder<T> changeTracking(ChangeTrackingPolicy policy) {
            this.changeTrackingPolicy = policy;
            return this;
        }

        public Builder<T> callback(LifecycleEvent event, Consumer<T> callback) {
            lifecycleCallbacks.computeIfAbsent(event, e -> new ArrayList<>())
                    .add(document -> callback.accept(type.cast(document)));
            return this;
        }

        public Builder<T> instantiator(Supplier<? extends T> instantiator) {
            this.instantiator = instantiator::get;
            return this;
        }

        public ClassDescription build() {
            return new ClassDescription(this);
        }

        private FieldAccessor accessor(Function<T, Object> getter, BiConsumer<T, Object> setter) {
            return new FieldAccessor() {
                @Override
                public Object get(Object document) {
                    return getter.apply(type.cast(document));
                }

                @Override
                public void set(Object document, Object value) {
                    setter.accept(type.cast(document), value);
                }
            };
        }

        private static Set<CascadeType> cascadeSet(CascadeType[] cascade) {
            Set<CascadeType> set = EnumSet.noneOf(CascadeType.class);
            set.addAll(Arrays.asList(cascade));
            return set;
        }
    }
}
