package io.deephaven.spines.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The style shared by the option objects of this library ({@code SpineSpecs}, {@code SequenceOptions}). The generated
 * implementation classes are package-private and are reached only through the static {@code builder()} methods.
 */
@Target({ElementType.TYPE, ElementType.PACKAGE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE,
        defaults = @Value.Immutable(copy = false), strictBuilder = false, jdkOnly = true)
public @interface BuildableStyle {
}
