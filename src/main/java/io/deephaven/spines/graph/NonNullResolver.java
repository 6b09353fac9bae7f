package io.deephaven.spines.graph;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Finds, for every data token, the nearest non-null data tokens in each direction along the token graph, however many
 * null tokens and topology events lie in between.
 *
 * <p>
 * Each track is walked forward from its start and backward from each of its ends, including the last token of any
 * subspine left open at the end of the input. A walk carries the most recent non-null data tokens it has passed; every
 * data token it reaches receives those as its nearest non-null tokens in the opposite direction of travel, and a
 * non-null data token then replaces them. Where a token has more than one link in the direction of travel, each extra
 * branch is queued on an explicit worklist with its own copy of the carried tokens, so the walk needs no recursion. Results are de-duplicated, and a walk that reaches a token with a carried set already
 * seen there stops, since it could not add anything.
 */
final class NonNullResolver {
    private final Document document;
    private final TrackRegistry tracks;

    NonNullResolver(Document document, TrackRegistry tracks) {
        this.document = document;
        this.tracks = tracks;
    }

    void resolve() {
        for (int ii = 0; ii != document.tokenCount(); ++ii) {
            document.tokenAt(ii).clearNonNull();
        }
        final Set<Visit> forwardVisits = new HashSet<>();
        for (int track = 1; track <= tracks.trackCount(); ++track) {
            final Token start = tracks.startOf(track);
            if (start != null) {
                walk(start, true, forwardVisits);
            }
        }
        final Set<Visit> backwardVisits = new HashSet<>();
        for (int track = 1; track <= tracks.trackCount(); ++track) {
            for (int branch = 0; branch != tracks.endCount(track); ++branch) {
                walk(tracks.endOf(track, branch), false, backwardVisits);
            }
        }
        // Subspines still open at the end of the input have no terminator to start from.
        for (int ii = 0; ii != document.tokenCount(); ++ii) {
            final Token token = document.tokenAt(ii);
            if (isOpenTail(token)) {
                walk(token, false, backwardVisits);
            }
        }
    }

    private void walk(Token origin, boolean forward, Set<Visit> visits) {
        final Deque<Branch> worklist = new ArrayDeque<>();
        worklist.push(new Branch(origin, new TIntArrayList()));
        while (!worklist.isEmpty()) {
            final Branch branch = worklist.pop();
            final TIntArrayList carried = branch.carried;
            Token token = branch.start;
            while (token != null) {
                if (!visits.add(new Visit(token.handle(), carried))) {
                    break;
                }
                if (token.isData()) {
                    addUnique(forward ? token.previousNonNullHandles() : token.nextNonNullHandles(), carried);
                    if (!token.isNull()) {
                        carried.resetQuick();
                        carried.add(token.handle());
                    }
                }
                final int linkCount = forward ? token.nextTokenCount() : token.previousTokenCount();
                // Push in reverse so that branches are popped left to right.
                for (int ii = linkCount - 1; ii >= 1; --ii) {
                    final Token other = forward ? token.nextToken(ii) : token.previousToken(ii);
                    worklist.push(new Branch(other, new TIntArrayList(carried)));
                }
                token = linkCount == 0 ? null : (forward ? token.nextToken(0) : token.previousToken(0));
            }
        }
    }

    private static boolean isOpenTail(Token token) {
        return token.track() != 0 && token.nextTokenCount() == 0 && !token.isTerminator()
                && token.line().hasSpines();
    }

    private static void addUnique(TIntArrayList target, TIntArrayList source) {
        for (int ii = 0; ii != source.size(); ++ii) {
            final int handle = source.get(ii);
            if (!target.contains(handle)) {
                target.add(handle);
            }
        }
    }

    private static final class Branch {
        final Token start;
        final TIntArrayList carried;

        Branch(Token start, TIntArrayList carried) {
            this.start = start;
            this.carried = carried;
        }
    }

    /** A token reached with a particular set of carried tokens. */
    private static final class Visit {
        private final int handle;
        private final int[] carried;

        Visit(int handle, TIntArrayList carried) {
            this.handle = handle;
            this.carried = carried.toArray();
            Arrays.sort(this.carried);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Visit)) {
                return false;
            }
            final Visit other = (Visit) o;
            return handle == other.handle && Arrays.equals(carried, other.carried);
        }

        @Override
        public int hashCode() {
            return 31 * handle + Arrays.hashCode(carried);
        }
    }
}
