package io.deephaven.spines.util;

/**
 * The categories of fault that can leave a document invalid.
 */
public enum ErrorKind {
    /**
     * Field counts disagree across a manipulator boundary or between two plain lines, or spines remain open at the end
     * of the input.
     */
    STRUCTURAL_DESYNC,
    /**
     * A spine-bearing line appeared before the first exclusive interpretation line.
     */
    PREMATURE_DATA,
    /**
     * An unmatched exchange, a merge of a single column, an add that is not followed by an exclusive interpretation,
     * an exclusive interpretation in a column that was not prepared by an add, or a link index out of bounds.
     */
    MALFORMED_MANIPULATOR,
    /**
     * The input could not be opened or read.
     */
    UNREADABLE_SOURCE
}
