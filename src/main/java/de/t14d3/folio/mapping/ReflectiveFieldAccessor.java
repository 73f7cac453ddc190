package de.t14d3.folio.mapping;

import de.t14d3.folio.exceptions.MappingException;

import java.lang.reflect.Field;

/**
 * {@link FieldAccessor} backed by a {@link Field} that was made accessible once when
 * the class description was read.
 */
final class ReflectiveFieldAccessor implements FieldAccessor {
    private final Field field;

    ReflectiveFieldAccessor(Field field) {
        field.setAccessible(true);
        this.field = field;
    }

    @Override
    public Object get(Object document) {
        try {
            return field.get(document);
        } catch (IllegalAccessException e) {
            throw new MappingException("Cannot access field " + field.getName(), e);
        }
    }

    @Override
    public void set(Object document, Object value) {
        if (value == null && field.getType().isPrimitive()) {
            // primitives keep their default
            return;
        }
        try {
            field.set(document, value);
        } catch (IllegalAccessException e) {
            throw new MappingException("Cannot set field " + field.getName(), e);
        }
    }

    Field getField() {
        return field;
    }
}
