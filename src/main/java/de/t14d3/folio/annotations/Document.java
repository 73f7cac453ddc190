package de.t14d3.folio.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a document that is stored on its own and has an identity.
 * <p>
 * A document class needs exactly one field annotated with {@link Id} and a
 * parameterless constructor. Subclasses of a document class that are annotated
 * as well share the identity map of their topmost mapped ancestor.
 *
 * @see EmbeddedDocument
 * @see Property
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Document {
    /**
     * Name of the collection the documents are stored in. Defaults to the
     * lower-cased simple class name.
     */
    String collection() default "";
}
