package io.deephaven.spines;

import io.deephaven.spines.annotations.BuildableStyle;
import io.deephaven.spines.util.Renderer;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;

import java.util.ArrayList;
import java.util.List;

/**
 * A specification object for reading spine documents.
 */
@Immutable
@BuildableStyle
public abstract class SpineSpecs {
    /**
     * The Builder for the SpineSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(SpineSpecs specs);

        /**
         * The field delimiter character (the character that separates one spine's field from the next). Must be 7-bit
         * ASCII. The default is a tab.
         *
         * @param delimiter The delimiter property.
         * @return self after modifying the delimiter property.
         */
        Builder delimiter(char delimiter);

        /**
         * Whether fields may be quoted in the comma-separated-value manner, as in
         *
         * <pre>
         * 4c,"!! comment, with a comma",*
         * </pre>
         *
         * When set, a field beginning with {@link #quote} runs to the matching closing quote, and a doubled quote inside
         * it stands for one literal quote. The writer applies the inverse quoting. The default is false.
         *
         * @param quotedFields The quotedFields property.
         * @return self after modifying the quotedFields property.
         */
        Builder quotedFields(boolean quotedFields);

        /**
         * The quote character. Must be 7-bit ASCII and differ from the delimiter. It is an error to set this parameter
         * if {@link #quotedFields} is false. The default is '{@value #defaultQuote}'.
         *
         * @param quote The quote property.
         * @return self after modifying the quote property.
         */
        Builder quote(char quote);

        /**
         * Whether spines still open at the end of the input make the document invalid. The default is true.
         *
         * @param requireTerminators The requireTerminators property.
         * @return self after modifying the requireTerminators property.
         */
        Builder requireTerminators(boolean requireTerminators);

        /**
         * Whether the reader should finish by resolving the nearest non-null data tokens of every token. Callers can
         * also request the resolution later on the document itself. The default is false.
         *
         * @param resolveNonNullTokens The resolveNonNullTokens property.
         * @return self after modifying the resolveNonNullTokens property.
         */
        Builder resolveNonNullTokens(boolean resolveNonNullTokens);

        /**
         * Build the SpineSpecs object.
         *
         * @return The built object.
         */
        SpineSpecs build();
    }

    /**
     * Creates a builder for {@link SpineSpecs}.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return ImmutableSpineSpecs.builder();
    }

    /**
     * The tab-separated format. Equivalent to {@code builder().build()}.
     *
     * @return The SpineSpecs for the specified format.
     */
    public static SpineSpecs tsv() {
        return builder().build();
    }

    /**
     * The comma-separated variant. Equivalent to {@code builder().delimiter(',').quotedFields(true).build()}.
     *
     * @return The SpineSpecs for the specified format.
     */
    public static SpineSpecs csv() {
        return builder().delimiter(',').quotedFields(true).build();
    }

    /**
     * Validates the {@link SpineSpecs}.
     */
    @Check
    void check() {
        final List<String> problems = new ArrayList<>();
        check7BitAscii("delimiter", delimiter(), problems);
        check7BitAscii("quote", quote(), problems);
        if (delimiter() == '\n' || delimiter() == '\r') {
            problems.add("delimiter cannot be a line terminator");
        }
        if (quotedFields()) {
            if (quote() == delimiter()) {
                problems.add(String.format("quote and delimiter are both set to '%c'", quote()));
            }
        } else if (quote() != defaultQuote) {
            problems.add("Incompatible parameters: can't set quote when quotedFields is false");
        }
        if (problems.isEmpty()) {
            return;
        }
        final String message =
                "SpineSpecs failed validation for the following reasons: " + Renderer.renderList(problems);
        throw new RuntimeException(message);
    }

    private static final char defaultDelimiter = '\t';

    /**
     * See {@link Builder#delimiter}.
     *
     * @return The caller-specified delimiter.
     */
    @Default
    public char delimiter() {
        return defaultDelimiter;
    }

    /**
     * See {@link Builder#quotedFields}.
     *
     * @return Whether fields may be quoted.
     */
    @Default
    public boolean quotedFields() {
        return false;
    }

    private static final char defaultQuote = '"';

    /**
     * See {@link Builder#quote}.
     *
     * @return The caller-specified quote character.
     */
    @Default
    public char quote() {
        return defaultQuote;
    }

    /**
     * See {@link Builder#requireTerminators}.
     *
     * @return Whether open spines at the end of input are an error.
     */
    @Default
    public boolean requireTerminators() {
        return true;
    }

    /**
     * See {@link Builder#resolveNonNullTokens}.
     *
     * @return Whether the reader resolves non-null tokens.
     */
    @Default
    public boolean resolveNonNullTokens() {
        return false;
    }

    private static void check7BitAscii(String what, char c, List<String> problems) {
        if (c > 0x7f) {
            final String message = String.format("%s is set to '%c' but is required to be 7-bit ASCII",
                    what, c);
            problems.add(message);
        }
    }
}
