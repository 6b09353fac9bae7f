package io.deephaven.spines.graph;

import io.deephaven.spines.util.ErrorKind;
import io.deephaven.spines.util.ErrorReporter;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The data type and path label of every active spine column at one point of the forward pass. Instances are
 * immutable; {@link #next} computes the state that follows a manipulator line.
 */
final class SpineState {
    private final String[] dataTypes;
    private final String[] pathLabels;

    SpineState(String[] dataTypes, String[] pathLabels) {
        if (dataTypes.length != pathLabels.length) {
            throw new IllegalArgumentException(String.format("%d data types but %d path labels",
                    dataTypes.length, pathLabels.length));
        }
        this.dataTypes = dataTypes;
        this.pathLabels = pathLabels;
    }

    /** The number of active columns. */
    int size() {
        return dataTypes.length;
    }

    String dataType(int column) {
        return dataTypes[column];
    }

    String pathLabel(int column) {
        return pathLabels[column];
    }

    List<String> pathLabels() {
        return Arrays.asList(pathLabels.clone());
    }

    /**
     * Apply the manipulators of {@code line} to this state. Columns are processed left to right:
     *
     * <ul>
     * <li>{@code *^} turns one column into two labelled {@code (L)a} and {@code (L)b}.
     * <li>a run of two or more {@code *v} becomes one column with the label from {@link #mergedLabel}.
     * <li>two adjacent {@code *x} swap their data types and labels.
     * <li>{@code *+} keeps its column and inserts a new one after it, reserving a pending track in {@code registry}.
     * <li>{@code *-} drops its column and records the token as an end of its track.
     * <li>{@code **name} binds a pending track to the token and sets the column's data type.
     * <li>anything else leaves its column unchanged.
     * </ul>
     *
     * @param line A manipulator line with exactly {@link #size()} fields.
     * @param registry The track registry of the current analysis run.
     * @param reporter Receives the error if the line is malformed.
     * @return The new state, or null if an error was reported.
     */
    @Nullable
    SpineState next(Line line, TrackRegistry.Builder registry, ErrorReporter reporter) {
        final int count = line.fieldCount();
        if (count != size()) {
            reporter.report(ErrorKind.STRUCTURAL_DESYNC, line.index(),
                    String.format("Expected %d fields, but found %d", size(), count));
            return null;
        }
        final List<String> newTypes = new ArrayList<>(count + 1);
        final List<String> newLabels = new ArrayList<>(count + 1);
        for (int ii = 0; ii < count; ++ii) {
            final Token token = line.token(ii);
            if (token.isSplit()) {
                newTypes.add(dataTypes[ii]);
                newTypes.add(dataTypes[ii]);
                newLabels.add(splitLabel(pathLabels[ii], 'a'));
                newLabels.add(splitLabel(pathLabels[ii], 'b'));
            } else if (token.isMerge()) {
                int end = ii + 1;
                while (end < count && line.token(end).isMerge()) {
                    ++end;
                }
                if (end - ii < 2) {
                    reporter.report(ErrorKind.MALFORMED_MANIPULATOR, line.index(),
                            String.format("Merge at spine index %d has no adjacent merge to join with", ii));
                    return null;
                }
                newTypes.add(dataTypes[ii]);
                newLabels.add(mergedLabel(Arrays.asList(pathLabels).subList(ii, end)));
                ii = end - 1;
            } else if (token.isExchange()) {
                if (ii + 1 >= count || !line.token(ii + 1).isExchange()) {
                    reporter.report(ErrorKind.MALFORMED_MANIPULATOR, line.index(),
                            String.format("Exchange at spine index %d has no partner", ii));
                    return null;
                }
                newTypes.add(dataTypes[ii + 1]);
                newTypes.add(dataTypes[ii]);
                newLabels.add(pathLabels[ii + 1]);
                newLabels.add(pathLabels[ii]);
                ++ii;
            } else if (token.isAdd()) {
                newTypes.add(dataTypes[ii]);
                newLabels.add(pathLabels[ii]);
                final int added = registry.reservePending();
                newTypes.add("");
                newLabels.add(Integer.toString(added));
            } else if (token.isTerminator()) {
                registry.registerEnd(trackOf(pathLabels[ii]), token);
            } else if (token.isExclusive()) {
                final int track = trackOf(pathLabels[ii]);
                if (!registry.bindPending(track, token)) {
                    reporter.report(ErrorKind.MALFORMED_MANIPULATOR, line.index(),
                            String.format("Exclusive interpretation %s at spine index %d was not prepared by *+",
                                    token.text(), ii));
                    return null;
                }
                newTypes.add(token.text());
                newLabels.add(pathLabels[ii]);
            } else {
                newTypes.add(dataTypes[ii]);
                newLabels.add(pathLabels[ii]);
            }
        }
        return new SpineState(newTypes.toArray(new String[0]), newLabels.toArray(new String[0]));
    }

    static String splitLabel(String label, char branch) {
        return "(" + label + ")" + branch;
    }

    /**
     * The label of a column formed by merging {@code labels}. Two labels that differ only in the branch letter of the
     * same split, {@code (L)a} and {@code (L)b}, merge back to {@code L}. Anything else, including every merge of three
     * or more columns, gives the labels joined by spaces.
     */
    static String mergedLabel(List<String> labels) {
        if (labels.size() == 2) {
            final String first = labels.get(0);
            final String second = labels.get(1);
            final int len = first.length();
            if (len == second.length() && len >= 4
                    && first.charAt(0) == '(' && first.charAt(len - 2) == ')'
                    && first.regionMatches(0, second, 0, len - 1)
                    && first.charAt(len - 1) != second.charAt(len - 1)) {
                return first.substring(1, len - 2);
            }
        }
        return String.join(" ", labels);
    }

    /**
     * The track number encoded in a path label: its first run of digits.
     *
     * @return The track number, or 0 if the label holds no digits.
     */
    static int trackOf(String label) {
        int ii = 0;
        final int len = label.length();
        while (ii < len && !Character.isDigit(label.charAt(ii))) {
            ++ii;
        }
        int track = 0;
        while (ii < len && Character.isDigit(label.charAt(ii))) {
            track = track * 10 + (label.charAt(ii) - '0');
            ++ii;
        }
        return track;
    }
}
