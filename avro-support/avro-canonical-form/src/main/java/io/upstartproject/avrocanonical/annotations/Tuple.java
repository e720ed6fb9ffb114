package io.upstartproject.avrocanonical.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Gives the canonicalizer's value types a positional {@code of} factory and no builder.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Value.Style(allParameters = true, defaults = @Value.Immutable(builder = false))
public @interface Tuple {
}
