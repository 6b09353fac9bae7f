package io.deephaven.spines.util;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The single outstanding error of a document. Documents keep the first error they encounter; every later analysis
 * stage is skipped once one is recorded.
 */
public final class ParseError {
    /** Line index used when the error is not tied to a particular line. */
    public static final int NO_LINE = -1;

    private final ErrorKind kind;
    private final int lineIndex;
    private final String message;

    /**
     * Constructor.
     *
     * @param kind The category of the error.
     * @param lineIndex The 0-based index of the offending line, or {@link #NO_LINE}.
     * @param message A human-readable description.
     */
    public ParseError(@NotNull ErrorKind kind, int lineIndex, @NotNull String message) {
        this.kind = Objects.requireNonNull(kind);
        this.lineIndex = lineIndex;
        this.message = Objects.requireNonNull(message);
    }

    /** The category of the error. */
    public ErrorKind kind() {
        return kind;
    }

    /** The 0-based index of the offending line, or {@link #NO_LINE}. */
    public int lineIndex() {
        return lineIndex;
    }

    /** The description of the error. */
    public String message() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParseError)) {
            return false;
        }
        final ParseError other = (ParseError) o;
        return kind == other.kind && lineIndex == other.lineIndex && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, lineIndex, message);
    }

    @Override
    public String toString() {
        if (lineIndex == NO_LINE) {
            return kind + ": " + message;
        }
        // Humans count lines from 1.
        return kind + " on line " + (lineIndex + 1) + ": " + message;
    }
}
