package io.deephaven.spines;

import io.deephaven.spines.annotations.BuildableStyle;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;

/**
 * Filters for the track sequence queries of a document. All filters are off by default.
 */
@Immutable
@BuildableStyle
public abstract class SequenceOptions {
    /**
     * The Builder for the SequenceOptions class.
     */
    public interface Builder {
        /**
         * Leave out null data tokens ({@code .}).
         *
         * @param excludeNulls The excludeNulls property.
         * @return self after modifying the excludeNulls property.
         */
        Builder excludeNulls(boolean excludeNulls);

        /**
         * Leave out split, merge, exchange and add tokens and null interpretations. Exclusive interpretations and
         * terminators are kept regardless.
         *
         * @param excludeManipulators The excludeManipulators property.
         * @return self after modifying the excludeManipulators property.
         */
        Builder excludeManipulators(boolean excludeManipulators);

        /**
         * Interleave the lines that have no spines (global records and empty lines) with the track's tokens, by line
         * position, including those before the first and after the last token of the sequence.
         *
         * @param includeGlobals The includeGlobals property.
         * @return self after modifying the includeGlobals property.
         */
        Builder includeGlobals(boolean includeGlobals);

        /**
         * Build the SequenceOptions object.
         *
         * @return The built object.
         */
        SequenceOptions build();
    }

    /**
     * Creates a builder for {@link SequenceOptions}.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return ImmutableSequenceOptions.builder();
    }

    /**
     * No filtering: every token of the track, no global lines.
     *
     * @return The default options.
     */
    public static SequenceOptions defaults() {
        return builder().build();
    }

    /** See {@link Builder#excludeNulls}. */
    @Default
    public boolean excludeNulls() {
        return false;
    }

    /** See {@link Builder#excludeManipulators}. */
    @Default
    public boolean excludeManipulators() {
        return false;
    }

    /** See {@link Builder#includeGlobals}. */
    @Default
    public boolean includeGlobals() {
        return false;
    }
}
