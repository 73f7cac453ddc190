package de.t14d3.folio.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a single reference to another document.
 * The annotated field holds the referenced document instance.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ReferenceOne {
    /**
     * The referenced document class. Defaults to the declared field type.
     */
    Class<?> targetDocument() default void.class;

    /**
     * Operations cascaded to the referenced document.
     */
    CascadeType[] cascade() default {};

    /**
     * Whether the reference may be null. A non-nullable reference forces the
     * referenced type to be written first, and a cycle of non-nullable
     * references between types cannot be committed.
     */
    boolean nullable() default true;

    /**
     * Whether a document that is no longer referenced is removed on the next commit.
     */
    boolean orphanRemoval() default false;
}
