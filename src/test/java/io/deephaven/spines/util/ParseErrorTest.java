package io.deephaven.spines.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ParseErrorTest {
    @Test
    public void linesCountFromOne() {
        final ParseError error =
                new ParseError(ErrorKind.PREMATURE_DATA, 0, "Data found before exclusive interpretation");
        assertThat(error).hasToString("PREMATURE_DATA on line 1: Data found before exclusive interpretation");
    }

    @Test
    public void withoutLine() {
        final ParseError error = new ParseError(ErrorKind.UNREADABLE_SOURCE, ParseError.NO_LINE, "gone");
        assertThat(error).hasToString("UNREADABLE_SOURCE: gone");
    }

    @Test
    public void equality() {
        final ParseError a = new ParseError(ErrorKind.STRUCTURAL_DESYNC, 3, "x");
        assertThat(a).isEqualTo(new ParseError(ErrorKind.STRUCTURAL_DESYNC, 3, "x"));
        assertThat(a).hasSameHashCodeAs(new ParseError(ErrorKind.STRUCTURAL_DESYNC, 3, "x"));
        assertThat(a).isNotEqualTo(new ParseError(ErrorKind.STRUCTURAL_DESYNC, 4, "x"));
    }

    @Test
    public void exceptionCarriesError() {
        final ParseError error = new ParseError(ErrorKind.MALFORMED_MANIPULATOR, 2, "lonely");
        final SpineReaderException exception = new SpineReaderException(error);
        assertThat(exception.parseError()).isSameAs(error);
        assertThat(exception).hasMessage("MALFORMED_MANIPULATOR on line 3: lonely");
    }
}
