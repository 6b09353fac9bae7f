package io.deephaven.spines.graph;

/**
 * The classification of a line, decided by the leading characters of its first field.
 */
public enum LineKind {
    /** A line with no text at all. */
    EMPTY(false),
    /** {@code !!...}: a global comment or, with {@code !!!}, a reference record. Not bound to any spine. */
    GLOBAL(false),
    /** {@code !...}: a comment with one field per spine. */
    LOCAL_COMMENT(true),
    /** {@code **...}: the line opening the spines. */
    EXCLUSIVE(true),
    /** {@code *...}: interpretations, including the spine manipulators. */
    INTERPRETATION(true),
    /** Anything else: one data token per spine. */
    DATA(true);

    private final boolean hasSpines;

    LineKind(boolean hasSpines) {
        this.hasSpines = hasSpines;
    }

    /**
     * Whether lines of this kind carry one field per active spine and take part in the token graph.
     *
     * @return true for local comments, interpretations and data.
     */
    public boolean hasSpines() {
        return hasSpines;
    }

    /**
     * Classify a line by its first field.
     *
     * @param lineText The whole text of the line. Only an empty text makes an {@link #EMPTY} line.
     * @param firstField The text of the first field of the line.
     * @return The kind of the line. A non-empty line whose first field is empty is {@link #DATA}.
     */
    public static LineKind classify(String lineText, String firstField) {
        if (lineText.isEmpty()) {
            return EMPTY;
        }
        if (firstField.isEmpty()) {
            return DATA;
        }
        if (firstField.startsWith("!!")) {
            return GLOBAL;
        }
        if (firstField.charAt(0) == '!') {
            return LOCAL_COMMENT;
        }
        if (firstField.startsWith("**")) {
            return EXCLUSIVE;
        }
        if (firstField.charAt(0) == '*') {
            return INTERPRETATION;
        }
        return DATA;
    }
}
