package io.deephaven.spines.util;

/**
 * Receives structural faults from the analysis stages. Stages return whatever {@link #report} returns, so that a
 * failing stage reads as {@code return reporter.report(...)}.
 */
@FunctionalInterface
public interface ErrorReporter {
    /**
     * Record an error.
     *
     * @param kind The category of the error.
     * @param lineIndex The 0-based index of the offending line, or {@link ParseError#NO_LINE}.
     * @param message The description.
     * @return Always false.
     */
    boolean report(ErrorKind kind, int lineIndex, String message);
}
