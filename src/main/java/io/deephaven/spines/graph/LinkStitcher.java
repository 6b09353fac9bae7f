package io.deephaven.spines.graph;

import io.deephaven.spines.util.ErrorKind;
import io.deephaven.spines.util.ErrorReporter;

import java.util.List;

/**
 * Builds the forward and backward links between the tokens of consecutive spine-bearing lines. Global records and
 * empty lines are skipped, as are local comments that precede the first exclusive interpretation line. Every forward
 * link is created together with its reciprocal backward link.
 */
final class LinkStitcher {
    private LinkStitcher() {}

    /**
     * Link every pair of consecutive spine-bearing lines.
     *
     * @param lines The lines of the document, in order.
     * @param reporter Receives the first error.
     * @return true on success.
     */
    static boolean stitch(List<Line> lines, ErrorReporter reporter) {
        Line previous = null;
        for (Line line : lines) {
            if (!line.hasSpines()) {
                continue;
            }
            if (previous == null) {
                if (line.isExclusive()) {
                    previous = line;
                }
                continue;
            }
            if (!stitchLines(previous, line, reporter)) {
                return false;
            }
            previous = line;
        }
        return true;
    }

    /**
     * Link {@code previous} to {@code next}. If {@code previous} holds no manipulators, columns are linked one to one.
     * Otherwise each column of {@code previous} consumes columns of {@code next} according to its manipulator:
     *
     * <ul>
     * <li>plain token or exclusive interpretation: one column.
     * <li>split: two columns, both linked from the split token.
     * <li>run of merges: one column, linked from every token in the run.
     * <li>exchange pair: two columns, linked crosswise.
     * <li>terminator: no column.
     * <li>add: two columns. The add token links to the first; the second must be an exclusive interpretation, which
     * starts a track and has no backward link.
     * </ul>
     */
    static boolean stitchLines(Line previous, Line next, ErrorReporter reporter) {
        final int prevCount = previous.fieldCount();
        final int nextCount = next.fieldCount();
        if (!previous.isManipulator()) {
            if (prevCount != nextCount) {
                return reporter.report(ErrorKind.STRUCTURAL_DESYNC, next.index(),
                        String.format("Lines %d and %d are not the same length (%d and %d fields)",
                                previous.index() + 1, next.index() + 1, prevCount, nextCount));
            }
            for (int ii = 0; ii != prevCount; ++ii) {
                previous.token(ii).linkTo(next.token(ii));
            }
            return true;
        }

        int jj = 0;
        for (int ii = 0; ii < prevCount; ++ii) {
            final Token token = previous.token(ii);
            final int needed = columnsConsumed(previous, ii);
            if (jj + needed > nextCount) {
                return reportAlignment(previous, next, reporter);
            }
            if (token.isSplit()) {
                token.linkTo(next.token(jj++));
                token.linkTo(next.token(jj++));
            } else if (token.isMerge()) {
                final Token target = next.token(jj++);
                while (ii < prevCount && previous.token(ii).isMerge()) {
                    previous.token(ii).linkTo(target);
                    ++ii;
                }
                --ii;
            } else if (token.isExchange()) {
                if (ii + 1 >= prevCount || !previous.token(ii + 1).isExchange()) {
                    return reporter.report(ErrorKind.MALFORMED_MANIPULATOR, previous.index(),
                            String.format("Exchange at spine index %d has no partner", ii));
                }
                previous.token(ii + 1).linkTo(next.token(jj++));
                token.linkTo(next.token(jj++));
                ++ii;
            } else if (token.isTerminator()) {
                // Nothing continues a terminated spine.
            } else if (token.isAdd()) {
                final Token added = next.token(jj + 1);
                if (!added.isExclusive()) {
                    return reporter.report(ErrorKind.MALFORMED_MANIPULATOR, next.index(),
                            String.format("Expected exclusive interpretation at spine index %d but got %s",
                                    jj + 1, added.text()));
                }
                token.linkTo(next.token(jj));
                jj += 2;
            } else {
                token.linkTo(next.token(jj++));
            }
        }

        if (jj != nextCount) {
            return reportAlignment(previous, next, reporter);
        }
        return true;
    }

    /** The number of columns of the next line consumed by the column at {@code index} of a manipulator line. */
    private static int columnsConsumed(Line line, int index) {
        final Token token = line.token(index);
        if (token.isSplit() || token.isAdd()) {
            return 2;
        }
        if (token.isExchange()) {
            return index + 1 < line.fieldCount() && line.token(index + 1).isExchange() ? 2 : 0;
        }
        if (token.isTerminator()) {
            return 0;
        }
        return 1;
    }

    private static boolean reportAlignment(Line previous, Line next, ErrorReporter reporter) {
        return reporter.report(ErrorKind.STRUCTURAL_DESYNC, next.index(),
                String.format("Cannot stitch lines together due to alignment problem: line %d (%d fields): %s,"
                        + " line %d (%d fields): %s",
                        previous.index() + 1, previous.fieldCount(), previous.text(),
                        next.index() + 1, next.fieldCount(), next.text()));
    }
}
