package io.deephaven.spines.graph;

import gnu.trove.list.array.TIntArrayList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The start and end tokens of every track. Track numbers run from 1 to {@link #trackCount()} in the order the
 * exclusive interpretations appear; track 0 is reserved for tokens that are not on a spine and never has a start or an
 * end. A track has exactly one start, and one end per branch that terminated separately.
 *
 * <p>
 * A registry is produced by a {@link Builder} scoped to a single analysis run and is never patched afterwards;
 * re-analysis builds a new one.
 */
final class TrackRegistry {
    static final TrackRegistry EMPTY = new Builder().build();

    /** Indexed by track number. Entry 0 is always null. */
    private final List<Token> starts;
    /** Indexed by track number. Entry 0 is always empty. */
    private final List<List<Token>> ends;

    private TrackRegistry(List<Token> starts, List<List<Token>> ends) {
        this.starts = starts;
        this.ends = ends;
    }

    int trackCount() {
        return starts.size() - 1;
    }

    @Nullable
    Token startOf(int track) {
        if (track < 1 || track >= starts.size()) {
            return null;
        }
        return starts.get(track);
    }

    int endCount(int track) {
        if (track < 1 || track >= ends.size()) {
            return 0;
        }
        return ends.get(track).size();
    }

    @Nullable
    Token endOf(int track, int branchIndex) {
        if (track < 1 || track >= ends.size()) {
            return null;
        }
        final List<Token> trackEnds = ends.get(track);
        if (branchIndex < 0 || branchIndex >= trackEnds.size()) {
            return null;
        }
        return trackEnds.get(branchIndex);
    }

    /**
     * Accumulates track starts and ends during one forward pass over the document.
     */
    static final class Builder {
        private final List<Token> starts = new ArrayList<>();
        private final List<List<Token>> ends = new ArrayList<>();
        /** Tracks reserved by an add whose exclusive interpretation has not been seen yet. */
        private final TIntArrayList pending = new TIntArrayList();

        Builder() {
            starts.add(null);
            ends.add(new ArrayList<>());
        }

        /**
         * Open a new track whose start is already known.
         *
         * @return The new track number.
         */
        int registerStart(Token start) {
            starts.add(start);
            ends.add(new ArrayList<>());
            return starts.size() - 1;
        }

        /**
         * Reserve the next track number for a spine added by {@code *+}. Its start token is supplied later by
         * {@link #bindPending}.
         *
         * @return The reserved track number.
         */
        int reservePending() {
            final int track = registerStart(null);
            pending.add(track);
            return track;
        }

        boolean isPending(int track) {
            return pending.contains(track);
        }

        boolean hasPending() {
            return !pending.isEmpty();
        }

        /** A copy of the currently pending track numbers. */
        TIntArrayList pendingTracks() {
            return new TIntArrayList(pending);
        }

        /**
         * Supply the start token of a reserved track.
         *
         * @return false if the track was not pending.
         */
        boolean bindPending(int track, Token start) {
            if (!pending.remove(track)) {
                return false;
            }
            starts.set(track, start);
            return true;
        }

        void registerEnd(int track, Token end) {
            if (track < 1 || track >= ends.size()) {
                throw new IllegalStateException("Cannot record an end for unknown track " + track);
            }
            ends.get(track).add(end);
        }

        int trackCount() {
            return starts.size() - 1;
        }

        TrackRegistry build() {
            final List<List<Token>> endsCopy = new ArrayList<>(ends.size());
            for (List<Token> trackEnds : ends) {
                endsCopy.add(Collections.unmodifiableList(new ArrayList<>(trackEnds)));
            }
            return new TrackRegistry(Collections.unmodifiableList(new ArrayList<>(starts)),
                    Collections.unmodifiableList(endsCopy));
        }
    }
}
