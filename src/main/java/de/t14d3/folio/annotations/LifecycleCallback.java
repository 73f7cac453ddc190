package de.t14d3.folio.annotations;

import de.t14d3.folio.event.LifecycleEvent;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a parameterless method of a document class to be invoked on the given
 * lifecycle events. {@link LifecycleEvent#ON_FLUSH} is not a per-document event
 * and is ignored here.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LifecycleCallback {
    LifecycleEvent[] value();
}
