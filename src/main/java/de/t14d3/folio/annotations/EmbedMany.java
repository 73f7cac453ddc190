package de.t14d3.folio.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a list of embedded documents. The field must be declared as {@link java.util.List}.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EmbedMany {
    /**
     * The embedded document class.
     */
    Class<?> targetDocument();
}
