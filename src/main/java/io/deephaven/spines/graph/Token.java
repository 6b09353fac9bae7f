package io.deephaven.spines.graph;

import gnu.trove.list.array.TIntArrayList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One field of one line. Tokens are owned by their {@link Document} and identified there by a stable integer handle;
 * the links between tokens on neighbouring lines are stored as handles, never as references.
 *
 * <p>
 * A token has up to two forward links (two only for a split) and up to two backward links (two only after a merge).
 * After {@link Document#resolveNonNullTokens()} it also knows the nearest non-null data tokens in each direction.
 */
public final class Token {
    /** The null data token: "no new value, the previous one continues". */
    public static final String NULL_DATA = ".";
    /** The null interpretation: no change to the spine. */
    public static final String NULL_INTERPRETATION = "*";
    public static final String SPLIT = "*^";
    public static final String MERGE = "*v";
    public static final String EXCHANGE = "*x";
    public static final String ADD = "*+";
    public static final String TERMINATE = "*-";
    public static final String EXCLUSIVE_PREFIX = "**";

    private final Document document;
    private final int handle;
    private final int lineIndex;
    private final int fieldIndex;
    private String text;

    private int track;
    private String pathLabel = "";
    private String dataType = "";

    private final TIntArrayList next = new TIntArrayList(2);
    private final TIntArrayList previous = new TIntArrayList(2);
    private final TIntArrayList nextNonNull = new TIntArrayList(1);
    private final TIntArrayList previousNonNull = new TIntArrayList(1);

    Token(Document document, int handle, int lineIndex, int fieldIndex, String text) {
        this.document = document;
        this.handle = handle;
        this.lineIndex = lineIndex;
        this.fieldIndex = fieldIndex;
        this.text = text;
    }

    /** The handle of this token within its document. */
    public int handle() {
        return handle;
    }

    /** The text of the token. */
    public String text() {
        return text;
    }

    /**
     * Replace the text of the token. The owning line's text is not regenerated until
     * {@link Document#rebuildLinesFromTokens()} is called, and the graph is not re-analyzed.
     *
     * @param text The new text.
     */
    public void setText(@NotNull String text) {
        this.text = text;
    }

    /** The line holding this token. */
    public Line line() {
        return document.line(lineIndex);
    }

    /** The 0-based index of the owning line. */
    public int lineIndex() {
        return lineIndex;
    }

    /** The 0-based field index within the owning line. */
    public int fieldIndex() {
        return fieldIndex;
    }

    /** The track number, or 0 if the token is not on a spine. */
    public int track() {
        return track;
    }

    /**
     * The path label, which records the split and merge lineage of the subspine holding this token, such as
     * {@code 1}, {@code (1)a} or {@code ((2)b)a}. Empty for tokens not on a spine.
     */
    public String pathLabel() {
        return pathLabel;
    }

    /** The exclusive interpretation of the spine holding this token, such as {@code **kern}. */
    public String dataType() {
        return dataType;
    }

    // Classification.

    /** Whether the token is on an interpretation line (exclusive or not) and starts with '*'. */
    public boolean isInterpretation() {
        return line().isInterpretation() && text.startsWith("*");
    }

    /** Whether the token is an exclusive interpretation, {@code **name}. */
    public boolean isExclusive() {
        return isInterpretation() && text.startsWith(EXCLUSIVE_PREFIX);
    }

    /** Whether the token is a split, {@code *^}. */
    public boolean isSplit() {
        return isInterpretation() && text.equals(SPLIT);
    }

    /** Whether the token is a merge, {@code *v}. */
    public boolean isMerge() {
        return isInterpretation() && text.equals(MERGE);
    }

    /** Whether the token is an exchange, {@code *x}. */
    public boolean isExchange() {
        return isInterpretation() && text.equals(EXCHANGE);
    }

    /** Whether the token adds a spine, {@code *+}. */
    public boolean isAdd() {
        return isInterpretation() && text.equals(ADD);
    }

    /** Whether the token terminates its spine, {@code *-}. */
    public boolean isTerminator() {
        return isInterpretation() && text.equals(TERMINATE);
    }

    /** Whether the token is the null interpretation, a bare {@code *}. */
    public boolean isNullInterpretation() {
        return isInterpretation() && text.equals(NULL_INTERPRETATION);
    }

    /**
     * Whether the token changes the spine topology or opens a spine: split, merge, exchange, add, terminate or
     * exclusive interpretation.
     */
    public boolean isManipulator() {
        return isSplit() || isMerge() || isExchange() || isAdd() || isTerminator() || isExclusive();
    }

    /** Whether the token is on a data line. */
    public boolean isData() {
        return line().isData();
    }

    /** Whether the token is the null data token {@code .}. */
    public boolean isNull() {
        return isData() && text.equals(NULL_DATA);
    }

    /** Whether the token is on a local comment line. */
    public boolean isLocalComment() {
        return line().isLocalComment();
    }

    // Links.

    /** The number of forward links: 0, 1, or 2. */
    public int nextTokenCount() {
        return next.size();
    }

    /**
     * A forward link.
     *
     * @param index 0 for the primary successor, 1 for the second branch of a split.
     * @return The linked token, or null if there is no such link.
     */
    @Nullable
    public Token nextToken(int index) {
        return index >= 0 && index < next.size() ? document.tokenAt(next.get(index)) : null;
    }

    /** All forward links, in order. */
    public List<Token> nextTokens() {
        return resolve(next);
    }

    /** The number of backward links: 0, 1, or, after a merge, the number of merged columns. */
    public int previousTokenCount() {
        return previous.size();
    }

    /**
     * A backward link.
     *
     * @param index 0 for the first predecessor, higher indices for the other columns of a merge.
     * @return The linked token, or null if there is no such link.
     */
    @Nullable
    public Token previousToken(int index) {
        return index >= 0 && index < previous.size() ? document.tokenAt(previous.get(index)) : null;
    }

    /** All backward links, in order. */
    public List<Token> previousTokens() {
        return resolve(previous);
    }

    /**
     * The nearest non-null data tokens after this one, one per reachable branch, without duplicates. Empty until
     * {@link Document#resolveNonNullTokens()} has run.
     */
    public List<Token> nextNonNullTokens() {
        return resolve(nextNonNull);
    }

    /**
     * The nearest non-null data tokens before this one, one per reachable branch, without duplicates. Empty until
     * {@link Document#resolveNonNullTokens()} has run.
     */
    public List<Token> previousNonNullTokens() {
        return resolve(previousNonNull);
    }

    private List<Token> resolve(TIntArrayList handles) {
        if (handles.isEmpty()) {
            return Collections.emptyList();
        }
        final List<Token> result = new ArrayList<>(handles.size());
        for (int ii = 0; ii != handles.size(); ++ii) {
            result.add(document.tokenAt(handles.get(ii)));
        }
        return Collections.unmodifiableList(result);
    }

    // Package-private mutators for the analysis stages.

    void assignSpine(int track, String pathLabel, String dataType) {
        this.track = track;
        this.pathLabel = pathLabel;
        this.dataType = dataType;
    }

    /** Link this token forward to {@code successor}, and the successor back to this token. */
    void linkTo(Token successor) {
        // Backward links are not capped: a merge of n columns gives its successor n of them.
        if (next.size() == 2) {
            throw new IllegalStateException("Token '" + this + "' on line " + (lineIndex + 1)
                    + " already has two forward links");
        }
        next.add(successor.handle);
        successor.previous.add(handle);
    }

    TIntArrayList nextNonNullHandles() {
        return nextNonNull;
    }

    TIntArrayList previousNonNullHandles() {
        return previousNonNull;
    }

    void clearNonNull() {
        nextNonNull.resetQuick();
        previousNonNull.resetQuick();
    }

    void clearAnalysis() {
        track = 0;
        pathLabel = "";
        dataType = "";
        next.resetQuick();
        previous.resetQuick();
        clearNonNull();
    }

    @Override
    public String toString() {
        return text;
    }
}
