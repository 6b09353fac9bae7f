package io.deephaven.spines.util;

import org.jetbrains.annotations.NotNull;

/** The standard Exception class for callers who prefer exceptions over checking document validity. */
public class SpineReaderException extends Exception {
    private final ParseError parseError;

    /**
     * Constructor.
     *
     * @param parseError The error recorded on the document.
     */
    public SpineReaderException(@NotNull ParseError parseError) {
        super(parseError.toString());
        this.parseError = parseError;
    }

    /** The document error behind this exception. */
    public ParseError parseError() {
        return parseError;
    }
}
