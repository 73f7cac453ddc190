package de.t14d3.folio.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a single embedded document.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EmbedOne {
    /**
     * The embedded document class. Defaults to the declared field type.
     */
    Class<?> targetDocument() default void.class;
}
