package io.deephaven.spines.graph;

import io.deephaven.spines.SequenceOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The filtered track queries behind {@link Document#primaryTrackSequence} and {@link Document#trackSequence}.
 */
final class TrackSequencer {
    private TrackSequencer() {}

    static List<Token> primary(Document document, TrackRegistry tracks, int track, SequenceOptions options) {
        Token current = tracks.startOf(track);
        if (current == null) {
            return Collections.emptyList();
        }
        final List<Token> output = new ArrayList<>();
        // Index of the first line not yet scanned for global lines.
        int globalCursor = 0;
        while (current != null) {
            if (keep(current, options)) {
                if (options.includeGlobals()) {
                    addGlobals(document, globalCursor, current.lineIndex(), output);
                    globalCursor = current.lineIndex() + 1;
                }
                output.add(current);
            }
            current = current.nextToken(0);
        }
        if (options.includeGlobals()) {
            addGlobals(document, globalCursor, document.lineCount(), output);
        }
        return output;
    }

    static List<List<Token>> perLine(Document document, TrackRegistry tracks, int track, SequenceOptions options) {
        if (tracks.startOf(track) == null) {
            return Collections.emptyList();
        }
        final List<List<Token>> output = new ArrayList<>();
        for (int ii = 0; ii != document.lineCount(); ++ii) {
            final Line line = document.line(ii);
            if (!line.hasSpines()) {
                if (options.includeGlobals()) {
                    output.add(Collections.singletonList(line.token(0)));
                }
                continue;
            }
            List<Token> tokens = null;
            for (Token token : line.tokens()) {
                if (token.track() != track || !keep(token, options)) {
                    continue;
                }
                if (tokens == null) {
                    tokens = new ArrayList<>(2);
                }
                tokens.add(token);
            }
            if (tokens != null) {
                output.add(Collections.unmodifiableList(tokens));
            }
        }
        return output;
    }

    private static boolean keep(Token token, SequenceOptions options) {
        if (options.excludeNulls() && token.isNull()) {
            return false;
        }
        if (options.excludeManipulators() && isFilteredManipulator(token)) {
            return false;
        }
        return true;
    }

    /** Exclusive interpretations and terminators mark the ends of a track and survive the manipulator filter. */
    private static boolean isFilteredManipulator(Token token) {
        return token.isSplit() || token.isMerge() || token.isExchange() || token.isAdd()
                || token.isNullInterpretation();
    }

    private static void addGlobals(Document document, int from, int to, List<Token> output) {
        for (int ii = from; ii < to; ++ii) {
            final Line line = document.line(ii);
            if (!line.hasSpines()) {
                output.add(line.token(0));
            }
        }
    }
}
