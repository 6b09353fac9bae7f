package io.deephaven.spines.graph;

import io.deephaven.spines.tokenization.FieldSplitter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One line of a document: its text, its tokens, and its classification. The index of a line never changes once the
 * line is added. The text can be regenerated from edited tokens by {@link Document#rebuildLinesFromTokens()}.
 */
public final class Line {
    private final int index;
    private final Token[] tokens;
    /** The field texts that {@link #text} was split into or joined from. */
    private final String[] fieldTexts;
    private String text;
    private LineKind kind;

    Line(int index, String text, Token[] tokens) {
        this.index = index;
        this.text = text;
        this.tokens = tokens;
        this.fieldTexts = new String[tokens.length];
        for (int ii = 0; ii != tokens.length; ++ii) {
            fieldTexts[ii] = tokens[ii].text();
        }
        this.kind = LineKind.classify(text, tokens[0].text());
    }

    /** The 0-based position of the line in its document. */
    public int index() {
        return index;
    }

    /** The text of the line, as read or as last rebuilt from its tokens. */
    public String text() {
        return text;
    }

    /** The number of fields (tokens) on the line. Always at least 1. */
    public int fieldCount() {
        return tokens.length;
    }

    /**
     * A token on this line.
     *
     * @param fieldIndex The 0-based field index.
     * @return The token.
     * @throws IndexOutOfBoundsException if there is no such field.
     */
    public Token token(int fieldIndex) {
        return tokens[fieldIndex];
    }

    /** The tokens of the line, left to right. */
    public List<Token> tokens() {
        return Collections.unmodifiableList(Arrays.asList(tokens));
    }

    /** The classification of the line. */
    public LineKind kind() {
        return kind;
    }

    /** Whether the line takes part in the spine structure. False for global records and empty lines. */
    public boolean hasSpines() {
        return kind.hasSpines();
    }

    /** Whether the first field is an exclusive interpretation. */
    public boolean isExclusive() {
        return kind == LineKind.EXCLUSIVE;
    }

    /** Whether the line holds interpretations, exclusive or otherwise. */
    public boolean isInterpretation() {
        return kind == LineKind.EXCLUSIVE || kind == LineKind.INTERPRETATION;
    }

    /**
     * Whether the line is an interpretation line holding at least one token that changes the topology or opens a
     * spine. Interpretation lines made only of null and other plain interpretations are not manipulator lines.
     */
    public boolean isManipulator() {
        if (!isInterpretation()) {
            return false;
        }
        for (Token token : tokens) {
            if (token.isManipulator()) {
                return true;
            }
        }
        return false;
    }

    /** Whether the line holds data tokens. */
    public boolean isData() {
        return kind == LineKind.DATA;
    }

    /** Whether the line is a local comment line. */
    public boolean isLocalComment() {
        return kind == LineKind.LOCAL_COMMENT;
    }

    /** Whether the line is a global comment or reference record. */
    public boolean isGlobal() {
        return kind == LineKind.GLOBAL;
    }

    /** Whether the line is empty. */
    public boolean isEmpty() {
        return kind == LineKind.EMPTY;
    }

    /** Whether the line is a reference record, {@code !!!key: value}. */
    public boolean isReference() {
        final String record = tokens[0].text();
        return isGlobal() && record.startsWith("!!!") && record.indexOf(':') > 3;
    }

    /**
     * The key of a reference record.
     *
     * @return For {@code !!!COM: Bach, Johann Sebastian} this is {@code COM}. Empty if this is not a reference record.
     */
    public String referenceKey() {
        if (!isReference()) {
            return "";
        }
        final String record = tokens[0].text();
        return record.substring(3, record.indexOf(':')).trim();
    }

    /**
     * The value of a reference record.
     *
     * @return For {@code !!!COM: Bach, Johann Sebastian} this is {@code Bach, Johann Sebastian}. Empty if this is
     *         not a reference record.
     */
    public String referenceValue() {
        if (!isReference()) {
            return "";
        }
        final String record = tokens[0].text();
        return record.substring(record.indexOf(':') + 1).trim();
    }

    /**
     * Whether any token's text was edited since the line text was last split or rebuilt.
     *
     * @return true if {@link #text()} no longer reflects the tokens.
     */
    public boolean isModified() {
        for (int ii = 0; ii != tokens.length; ++ii) {
            if (!tokens[ii].text().equals(fieldTexts[ii])) {
                return true;
            }
        }
        return false;
    }

    /** Re-join the text from the tokens if any of them was edited. Unedited lines keep their exact text. */
    void rebuildText(FieldSplitter splitter) {
        if (!isModified()) {
            return;
        }
        final List<String> fields = new ArrayList<>(tokens.length);
        for (int ii = 0; ii != tokens.length; ++ii) {
            fieldTexts[ii] = tokens[ii].text();
            fields.add(fieldTexts[ii]);
        }
        // A global record is never split, so it is never quoted either.
        text = tokens.length == 1 && FieldSplitter.isGlobalRecord(fields.get(0)) ? fields.get(0)
                : splitter.join(fields);
        kind = LineKind.classify(text, tokens[0].text());
    }

    @Override
    public String toString() {
        return text;
    }
}
