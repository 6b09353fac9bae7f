package io.deephaven.spines.writing;

import io.deephaven.spines.SpineSpecs;
import io.deephaven.spines.graph.Document;
import io.deephaven.spines.graph.Line;
import io.deephaven.spines.graph.Token;
import io.deephaven.spines.tokenization.FieldSplitter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Writes documents back out as text, and writes the per-token debug dumps used to verify an analysis. Every method
 * writes one output line per document line, in order, each ended by '\n'.
 */
public final class DocumentWriter {
    /**
     * Utility class. Do not instantiate.
     */
    private DocumentWriter() {}

    /**
     * Write the document's current tokens in the format described by {@code specs}, which need not be the format the
     * document was read in. Global records are written as a single field. When {@code specs} is the document's own
     * format, lines with no edited tokens are written exactly as they were read.
     *
     * @param specs The output format.
     * @param document The document.
     * @param out The destination.
     * @throws IOException If the destination fails.
     */
    public static void write(SpineSpecs specs, Document document, Writer out) throws IOException {
        final FieldSplitter splitter = FieldSplitter.forSpecs(specs);
        final boolean sameFormat = specs.equals(document.specs());
        for (Line line : document.lines()) {
            if (sameFormat && !line.isModified()) {
                out.write(line.text());
            } else {
                out.write(joinFields(line, Token::text, splitter));
            }
            out.write('\n');
        }
        out.flush();
    }

    /**
     * Write the path label of every spine token, tab-separated. Lines without spines are echoed as-is.
     *
     * @param document The document.
     * @param out The destination.
     * @throws IOException If the destination fails.
     */
    public static void writeSpineInfo(Document document, Writer out) throws IOException {
        writeFields(document, out, Token::pathLabel, tabs());
    }

    /**
     * Write the data type of every spine token, tab-separated. Lines without spines are echoed as-is.
     *
     * @param document The document.
     * @param out The destination.
     * @throws IOException If the destination fails.
     */
    public static void writeDataTypeInfo(Document document, Writer out) throws IOException {
        writeFields(document, out, Token::dataType, tabs());
    }

    /**
     * Write the track number of every spine token, tab-separated. Lines without spines are echoed as-is.
     *
     * @param document The document.
     * @param out The destination.
     * @throws IOException If the destination fails.
     */
    public static void writeTrackInfo(Document document, Writer out) throws IOException {
        writeFields(document, out, token -> Integer.toString(token.track()), tabs());
    }

    /**
     * Convenience wrapper for {@link #write} into a string.
     *
     * @param specs The output format.
     * @param document The document.
     * @return The text.
     */
    public static String toText(SpineSpecs specs, Document document) {
        final StringWriter sw = new StringWriter();
        try {
            write(specs, document, sw);
        } catch (IOException ioe) {
            // StringWriter does not throw.
            throw new UncheckedIOException(ioe);
        }
        return sw.toString();
    }

    private static void writeFields(Document document, Writer out, Function<Token, String> field,
            FieldSplitter splitter) throws IOException {
        for (Line line : document.lines()) {
            out.write(line.hasSpines() ? joinFields(line, field, splitter) : line.text());
            out.write('\n');
        }
        out.flush();
    }

    private static String joinFields(Line line, Function<Token, String> field, FieldSplitter splitter) {
        final List<String> fields = new ArrayList<>(line.fieldCount());
        for (Token token : line.tokens()) {
            fields.add(field.apply(token));
        }
        return line.isGlobal() ? fields.get(0) : splitter.join(fields);
    }

    private static FieldSplitter tabs() {
        return FieldSplitter.forSpecs(SpineSpecs.tsv());
    }
}
