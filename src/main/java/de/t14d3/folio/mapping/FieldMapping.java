package de.t14d3.folio.mapping;

import de.t14d3.folio.annotations.CascadeType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Describes one mapped field of a document: its kind, the related type for
 * associations and the operations cascaded along it.
 */
public record FieldMapping(String name, String storedName, Kind kind, Class<?> targetType,
                           Set<CascadeType> cascade, boolean nullable, boolean orphanRemoval,
                           FieldAccessor accessor) {

    public enum Kind {
        SCALAR, EMBED_ONE, EMBED_MANY, REF_ONE, REF_MANY;

        public boolean isReference() {
            return this == REF_ONE || this == REF_MANY;
        }

        public boolean isEmbedded() {
            return this == EMBED_ONE || this == EMBED_MANY;
        }

        public boolean isAssociation() {
            return this != SCALAR;
        }

        public boolean isCollection() {
            return this == EMBED_MANY || this == REF_MANY;
        }
    }

    public FieldMapping {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Field mapping needs a name");
        }
        if (kind == null || accessor == null) {
            throw new IllegalArgumentException("Field mapping '" + name + "' needs a kind and an accessor");
        }
        if (kind.isAssociation() && targetType == null) {
            throw new IllegalArgumentException("Association '" + name + "' needs a target type");
        }
        storedName = (storedName == null || storedName.isEmpty()) ? name : storedName;
        cascade = (cascade == null || cascade.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(cascade));
    }

    public static FieldMapping scalar(String name, FieldAccessor accessor) {
        return new FieldMapping(name, name, Kind.SCALAR, null, null, true, false, accessor);
    }

    public static FieldMapping association(String name, Kind kind, Class<?> targetType,
                                           Collection<CascadeType> cascade, FieldAccessor accessor) {
        Set<CascadeType> cascadeSet = (cascade == null || cascade.isEmpty())
                ? EnumSet.noneOf(CascadeType.class)
                : EnumSet.copyOf(cascade);
        return new FieldMapping(name, name, kind, targetType, cascadeSet, true, false, accessor);
    }

    /**
     * Whether the given operation cascades along this field. {@link CascadeType#ALL} implies every operation.
     */
    public boolean isCascade(CascadeType type) {
        return cascade.contains(type) || cascade.contains(CascadeType.ALL);
    }

    /**
     * A single reference that must point to a document, which makes the target
     * type a hard dependency when ordering writes.
     */
    public boolean isRequiredReference() {
        return kind == Kind.REF_ONE && !nullable;
    }

    public Object getValue(Object document) {
        return accessor.get(document);
    }

    public void setValue(Object document, Object value) {
        accessor.set(document, value);
    }

    @Override
    public String toString() {
        return "FieldMapping{" + name + ", " + kind + (targetType != null ? " -> " + targetType.getSimpleName() : "") + "}";
    }
}
