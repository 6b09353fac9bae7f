package io.deephaven.spines.graph;

import io.deephaven.spines.SequenceOptions;
import io.deephaven.spines.SpineSpecs;
import io.deephaven.spines.tokenization.FieldSplitter;
import io.deephaven.spines.util.ErrorKind;
import io.deephaven.spines.util.ParseError;
import io.deephaven.spines.util.SpineReaderException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed spine document: its lines, the token graph linking them, and the track registry. Typical usage is through
 * {@link io.deephaven.spines.reading.SpineReader}, which appends every input line and then calls {@link #analyze()}:
 *
 * <pre>
 * final Document doc = SpineReader.readString(SpineSpecs.tsv(), "**kern\n4c\n.\n4d\n*-\n");
 * if (!doc.isValid()) {
 *     // doc.parseError() explains why
 * }
 * final List&lt;Token&gt; notes = doc.primaryTrackSequence(1, SequenceOptions.builder().excludeNulls(true).build());
 * </pre>
 *
 * <p>
 * Analysis runs to completion or stops at the first error, which is kept as the document's single
 * {@link #parseError()}. After an error the lines and tokens can still be inspected, but links and tracks may be
 * partial. Appending a line invalidates the graph until {@link #analyze()} runs again, which rebuilds it from scratch.
 *
 * <p>
 * Thread safety: a document must have a single mutator. Concurrent read-only queries are safe once analysis is done.
 */
public final class Document {
    private static final Logger log = LoggerFactory.getLogger(Document.class);

    private final SpineSpecs specs;
    private final FieldSplitter splitter;
    private final List<Line> lines = new ArrayList<>();
    /** All tokens of all lines, indexed by handle. */
    private final List<Token> tokens = new ArrayList<>();

    private TrackRegistry tracks = TrackRegistry.EMPTY;
    @Nullable
    private ParseError parseError;
    private boolean analyzed;
    private boolean nonNullResolved;

    /**
     * Constructor. Creates an empty document.
     *
     * @param specs The options controlling how lines are split and analyzed.
     */
    public Document(@NotNull SpineSpecs specs) {
        this.specs = specs;
        this.splitter = FieldSplitter.forSpecs(specs);
    }

    /**
     * Create an empty document whose source could not be read.
     *
     * @param specs The options the document would have been read with.
     * @param message A description of the failure.
     * @return An invalid document with an {@link ErrorKind#UNREADABLE_SOURCE} error.
     */
    public static Document unreadable(SpineSpecs specs, String message) {
        final Document document = new Document(specs);
        document.fail(ErrorKind.UNREADABLE_SOURCE, ParseError.NO_LINE, message);
        return document;
    }

    /** The options this document was created with. */
    public SpineSpecs specs() {
        return specs;
    }

    /**
     * Add a line at the end of the document. The line is split into tokens immediately. If the document had been
     * analyzed, its links, tracks and non-null resolutions are discarded until {@link #analyze()} runs again.
     *
     * @param text The text of the line, without its line terminator.
     * @return The new line.
     */
    public Line append(@NotNull String text) {
        if (analyzed) {
            resetGraph();
        }
        final int lineIndex = lines.size();
        final List<String> fields = splitter.split(text);
        final Token[] lineTokens = new Token[fields.size()];
        for (int ii = 0; ii != lineTokens.length; ++ii) {
            final Token token = new Token(this, tokens.size(), lineIndex, ii, fields.get(ii));
            tokens.add(token);
            lineTokens[ii] = token;
        }
        final Line line = new Line(lineIndex, text, lineTokens);
        lines.add(line);
        return line;
    }

    /**
     * Run the analysis pipeline over the current lines: spine topology and track registry, then links, then (if
     * {@link SpineSpecs#resolveNonNullTokens()} is set) non-null resolution. Any previous graph is discarded first.
     * Stops at the first error.
     *
     * @return {@link #isValid()}.
     */
    public boolean analyze() {
        if (parseError != null && parseError.kind() == ErrorKind.UNREADABLE_SOURCE) {
            return false;
        }
        resetGraph();
        parseError = null;
        analyzed = true;

        final TrackRegistry.Builder registry = new TrackRegistry.Builder();
        final boolean spinesOk =
                SpineTopologyAnalyzer.analyze(lines, registry, specs.requireTerminators(), this::fail);
        // Keep what was registered even on failure, so that callers can inspect the partial result.
        tracks = registry.build();
        if (!spinesOk) {
            return false;
        }
        log.debug("Analyzed spines of {} lines: {} tracks", lines.size(), tracks.trackCount());

        if (!LinkStitcher.stitch(lines, this::fail)) {
            return false;
        }
        if (specs.resolveNonNullTokens()) {
            resolveNonNullTokens();
        }
        return isValid();
    }

    /**
     * Annotate every data token with its nearest non-null data tokens in both directions. Re-running on an unchanged
     * graph gives the same result.
     *
     * @return false, doing nothing, if the document is not analyzed or not valid.
     */
    public boolean resolveNonNullTokens() {
        if (!analyzed || !isValid()) {
            return false;
        }
        new NonNullResolver(this, tracks).resolve();
        nonNullResolved = true;
        return true;
    }

    /** Whether {@link #resolveNonNullTokens()} has run since the graph was last built. */
    public boolean isNonNullResolved() {
        return nonNullResolved;
    }

    /** Whether the graph reflects the current lines. */
    public boolean isAnalyzed() {
        return analyzed;
    }

    /** Whether the document has no recorded error. */
    public boolean isValid() {
        return parseError == null;
    }

    /** The first error recorded, or null if the document is valid. */
    @Nullable
    public ParseError parseError() {
        return parseError;
    }

    /**
     * Throw if the document has a recorded error.
     *
     * @throws SpineReaderException carrying the {@link #parseError()}.
     */
    public void requireValid() throws SpineReaderException {
        if (parseError != null) {
            throw new SpineReaderException(parseError);
        }
    }

    /** The number of lines. */
    public int lineCount() {
        return lines.size();
    }

    /**
     * A line of the document.
     *
     * @param index The 0-based line index.
     * @return The line.
     * @throws IndexOutOfBoundsException if there is no such line.
     */
    public Line line(int index) {
        return lines.get(index);
    }

    /** The lines of the document, in order. */
    public List<Line> lines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * A token addressed by position.
     *
     * @param lineIndex The 0-based line index. Negative values count back from the end, so -1 is the last line.
     * @param fieldIndex The 0-based field index.
     * @return The token.
     * @throws IndexOutOfBoundsException if there is no such token.
     */
    public Token token(int lineIndex, int fieldIndex) {
        if (lineIndex < 0) {
            lineIndex += lines.size();
        }
        return lines.get(lineIndex).token(fieldIndex);
    }

    /**
     * Regenerate the text of every line from its current tokens, after tokens were edited with
     * {@link Token#setText}. Lines whose tokens are unchanged keep their text.
     */
    public void rebuildLinesFromTokens() {
        for (Line line : lines) {
            line.rebuildText(splitter);
        }
    }

    // Track queries.

    /** The number of tracks, which is also the highest track number. */
    public int maxTrack() {
        return tracks.trackCount();
    }

    /**
     * The exclusive interpretation that opened a track.
     *
     * @param track The track number, from 1 to {@link #maxTrack()}.
     * @return The start token, or null if there is no such track.
     */
    @Nullable
    public Token trackStart(int track) {
        return tracks.startOf(track);
    }

    /**
     * The number of end tokens of a track: one per branch that terminated separately.
     *
     * @param track The track number.
     * @return The number of ends, or 0 if there is no such track.
     */
    public int trackEndCount(int track) {
        return tracks.endCount(track);
    }

    /**
     * An end token of a track.
     *
     * @param track The track number.
     * @param branchIndex From 0 to {@link #trackEndCount} - 1, in the order the terminators appear.
     * @return The terminator token, or null if there is no such track or branch.
     */
    @Nullable
    public Token trackEnd(int track, int branchIndex) {
        return tracks.endOf(track, branchIndex);
    }

    /**
     * The start tokens of all tracks of a given data type.
     *
     * @param dataType The exclusive interpretation, such as {@code **kern}.
     * @return The matching start tokens, in track order.
     */
    public List<Token> spineStarts(String dataType) {
        final List<Token> result = new ArrayList<>();
        for (int track = 1; track <= tracks.trackCount(); ++track) {
            final Token start = tracks.startOf(track);
            if (start != null && start.text().equals(dataType)) {
                result.add(start);
            }
        }
        return result;
    }

    /**
     * The tokens of the first subspine of a track, from its start, following the first forward link at every split.
     *
     * @param track The track number.
     * @param options The filters to apply.
     * @return The tokens in order, or an empty list if there is no such track.
     */
    public List<Token> primaryTrackSequence(int track, SequenceOptions options) {
        return TrackSequencer.primary(this, tracks, track, options);
    }

    /**
     * The tokens of a track line by line, including all of its subspines.
     *
     * @param track The track number.
     * @param options The filters to apply.
     * @return One list per line that has tokens left after filtering (and, with
     *         {@link SequenceOptions#includeGlobals()}, one single-token list per line without spines), or an empty
     *         list if there is no such track.
     */
    public List<List<Token>> trackSequence(int track, SequenceOptions options) {
        return TrackSequencer.perLine(this, tracks, track, options);
    }

    // Package-private support for the analysis stages.

    int tokenCount() {
        return tokens.size();
    }

    Token tokenAt(int handle) {
        return tokens.get(handle);
    }

    private boolean fail(ErrorKind kind, int lineIndex, String message) {
        if (parseError == null) {
            parseError = new ParseError(kind, lineIndex, message);
            log.debug("Document is invalid: {}", parseError);
        }
        return false;
    }

    private void resetGraph() {
        for (Token token : tokens) {
            token.clearAnalysis();
        }
        tracks = TrackRegistry.EMPTY;
        analyzed = false;
        nonNullResolved = false;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (Line line : lines) {
            sb.append(line.text()).append('\n');
        }
        return sb.toString();
    }
}
