package io.deephaven.spines;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SpineSpecsTest {

    @Test
    void builderFrom() {
        checkFromEquality(SpineSpecs.tsv());
        checkFromEquality(SpineSpecs.csv());
        checkFromEquality(SpineSpecs.builder().requireTerminators(false).resolveNonNullTokens(true).build());
    }

    @Test
    void defaults() {
        final SpineSpecs specs = SpineSpecs.tsv();
        assertThat(specs.delimiter()).isEqualTo('\t');
        assertThat(specs.quotedFields()).isFalse();
        assertThat(specs.requireTerminators()).isTrue();
        assertThat(specs.resolveNonNullTokens()).isFalse();

        final SpineSpecs csv = SpineSpecs.csv();
        assertThat(csv.delimiter()).isEqualTo(',');
        assertThat(csv.quotedFields()).isTrue();
        assertThat(csv.quote()).isEqualTo('"');
    }

    @Test
    void validates() {
        final String lengthyMessage = "SpineSpecs failed validation for the following reasons: "
                + "delimiter is set to '€' but is required to be 7-bit ASCII, "
                + "Incompatible parameters: can't set quote when quotedFields is false";
        Assertions
                .assertThatThrownBy(() -> SpineSpecs.builder().delimiter('€').quote('\'').build())
                .hasMessage(lengthyMessage);
    }

    @Test
    void quoteMustDifferFromDelimiter() {
        Assertions
                .assertThatThrownBy(() -> SpineSpecs.builder().quotedFields(true).delimiter('"').build())
                .hasMessageContaining("quote and delimiter are both set to '\"'");
    }

    @Test
    void delimiterCannotEndLines() {
        Assertions
                .assertThatThrownBy(() -> SpineSpecs.builder().delimiter('\n').build())
                .hasMessageContaining("delimiter cannot be a line terminator");
    }

    @Test
    void sequenceOptionsDefaults() {
        final SequenceOptions options = SequenceOptions.defaults();
        assertThat(options.excludeNulls()).isFalse();
        assertThat(options.excludeManipulators()).isFalse();
        assertThat(options.includeGlobals()).isFalse();
        assertThat(SequenceOptions.builder().excludeNulls(true).build().excludeNulls()).isTrue();
    }

    private static void checkFromEquality(SpineSpecs specs) {
        assertThat(SpineSpecs.builder().from(specs).build()).isEqualTo(specs);
    }
}
