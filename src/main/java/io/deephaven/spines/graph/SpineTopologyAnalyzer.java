package io.deephaven.spines.graph;

import gnu.trove.list.array.TIntArrayList;
import io.deephaven.spines.util.ErrorKind;
import io.deephaven.spines.util.ErrorReporter;
import io.deephaven.spines.util.Renderer;

import java.util.List;

/**
 * The forward pass that assigns path labels, data types and track numbers to every spine token, and fills the track
 * registry. The column state starts at the first exclusive interpretation line and is replaced after every
 * manipulator line.
 */
final class SpineTopologyAnalyzer {
    private SpineTopologyAnalyzer() {}

    /**
     * Run the pass.
     *
     * @param lines The lines of the document, in order.
     * @param registry The registry to fill. Left partially filled if an error is reported.
     * @param requireTerminators Whether spines left open at the end are an error.
     * @param reporter Receives the first error.
     * @return true on success.
     */
    static boolean analyze(List<Line> lines, TrackRegistry.Builder registry, boolean requireTerminators,
            ErrorReporter reporter) {
        SpineState state = null;
        int lastSpineLine = -1;
        for (Line line : lines) {
            if (!line.hasSpines()) {
                continue;
            }
            if (state == null) {
                if (line.isLocalComment()) {
                    // Local comments may precede the spines; they are not bound to any track.
                    continue;
                }
                if (!line.isExclusive()) {
                    return reporter.report(ErrorKind.PREMATURE_DATA, line.index(),
                            "Data found before exclusive interpretation: " + line.text());
                }
                state = openSpines(line, registry, reporter);
                if (state == null) {
                    return false;
                }
                lastSpineLine = line.index();
                continue;
            }
            if (line.fieldCount() != state.size()) {
                return reporter.report(ErrorKind.STRUCTURAL_DESYNC, line.index(),
                        String.format("Expected %d fields, but found %d", state.size(), line.fieldCount()));
            }
            labelTokens(line, state);
            lastSpineLine = line.index();
            if (!line.isManipulator()) {
                if (registry.hasPending()) {
                    return reportUnboundAdds(registry.pendingTracks(), line, reporter);
                }
                continue;
            }
            final TIntArrayList pendingBefore = registry.pendingTracks();
            state = state.next(line, registry, reporter);
            if (state == null) {
                return false;
            }
            final TIntArrayList stillPending = new TIntArrayList();
            for (int ii = 0; ii != pendingBefore.size(); ++ii) {
                if (registry.isPending(pendingBefore.get(ii))) {
                    stillPending.add(pendingBefore.get(ii));
                }
            }
            if (!stillPending.isEmpty()) {
                return reportUnboundAdds(stillPending, line, reporter);
            }
        }

        if (registry.hasPending()) {
            return reporter.report(ErrorKind.MALFORMED_MANIPULATOR, lastSpineLine,
                    "Spine added by *+ has no exclusive interpretation before the end of input");
        }
        if (requireTerminators && state != null && state.size() != 0) {
            return reporter.report(ErrorKind.STRUCTURAL_DESYNC, lastSpineLine,
                    "Spines not terminated at end of input: " + Renderer.renderList(state.pathLabels()));
        }
        return true;
    }

    private static SpineState openSpines(Line line, TrackRegistry.Builder registry, ErrorReporter reporter) {
        final int count = line.fieldCount();
        final String[] dataTypes = new String[count];
        final String[] labels = new String[count];
        for (int ii = 0; ii != count; ++ii) {
            final Token token = line.token(ii);
            if (!token.isExclusive()) {
                reporter.report(ErrorKind.PREMATURE_DATA, line.index(),
                        String.format("Spine index %d has %s instead of an exclusive interpretation", ii,
                                token.text()));
                return null;
            }
            final int track = registry.registerStart(token);
            dataTypes[ii] = token.text();
            labels[ii] = Integer.toString(track);
            token.assignSpine(track, labels[ii], dataTypes[ii]);
        }
        return new SpineState(dataTypes, labels);
    }

    private static void labelTokens(Line line, SpineState state) {
        for (int ii = 0; ii != line.fieldCount(); ++ii) {
            final Token token = line.token(ii);
            final String label = state.pathLabel(ii);
            final String dataType = token.isExclusive() ? token.text() : state.dataType(ii);
            token.assignSpine(SpineState.trackOf(label), label, dataType);
        }
    }

    private static boolean reportUnboundAdds(TIntArrayList tracks, Line line, ErrorReporter reporter) {
        return reporter.report(ErrorKind.MALFORMED_MANIPULATOR, line.index(),
                "Expected an exclusive interpretation for the spine added by *+ (track "
                        + tracks.get(0) + ") but got: " + line.text());
    }
}
