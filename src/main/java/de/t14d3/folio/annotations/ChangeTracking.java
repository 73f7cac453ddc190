package de.t14d3.folio.annotations;

import de.t14d3.folio.mapping.ChangeTrackingPolicy;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Selects how the unit of work finds changed documents of this class.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ChangeTracking {
    ChangeTrackingPolicy value();
}
