package de.t14d3.folio.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a list of references to other documents.
 * <p>
 * The annotated field must be declared as {@link java.util.List}. Once the owner
 * is managed the list is replaced by a lazily loaded
 * {@link de.t14d3.folio.core.PersistentCollection}.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ReferenceMany {
    /**
     * The referenced document class.
     */
    Class<?> targetDocument();

    /**
     * Operations cascaded to every referenced document.
     */
    CascadeType[] cascade() default {};
}
