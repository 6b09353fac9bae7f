package io.deephaven.spines.reading;

import io.deephaven.spines.SpineSpecs;
import io.deephaven.spines.graph.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A class for reading spine documents. Typical usage is:
 *
 * <ol>
 * <li>Build a {@link SpineSpecs} (or use {@link SpineSpecs#tsv()} / {@link SpineSpecs#csv()}).
 * <li>Call one of the {@code read} methods.
 * <li>Check {@link Document#isValid()} before trusting the track and link queries.
 * </ol>
 *
 * Malformed input never throws: the problem is recorded on the returned document. Input that cannot be read at all
 * produces an empty document with an {@link io.deephaven.spines.util.ErrorKind#UNREADABLE_SOURCE} error.
 */
public final class SpineReader {
    private static final Logger log = LoggerFactory.getLogger(SpineReader.class);

    /**
     * Utility class. Do not instantiate.
     */
    private SpineReader() {}

    /**
     * Read a document from UTF-8 encoded bytes.
     *
     * @param specs A {@link SpineSpecs} object providing options for the parse.
     * @param stream The input data, encoded in UTF-8. Not closed by this method.
     * @return The analyzed document.
     */
    public static Document read(final SpineSpecs specs, final InputStream stream) {
        return read(specs, stream, StandardCharsets.UTF_8);
    }

    /**
     * Read a document from bytes in the given charset. Bytes that are not valid in the charset make the document
     * unreadable rather than being replaced.
     *
     * @param specs A {@link SpineSpecs} object providing options for the parse.
     * @param stream The input data. Not closed by this method.
     * @param charset The encoding of the input data.
     * @return The analyzed document.
     */
    public static Document read(final SpineSpecs specs, final InputStream stream, final Charset charset) {
        final CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return read(specs, new InputStreamReader(stream, decoder));
    }

    /**
     * Read a document from a file.
     *
     * @param specs A {@link SpineSpecs} object providing options for the parse.
     * @param path The file, encoded in UTF-8.
     * @return The analyzed document.
     */
    public static Document read(final SpineSpecs specs, final Path path) {
        try (final InputStream stream = Files.newInputStream(path)) {
            return read(specs, stream);
        } catch (IOException ioe) {
            log.debug("Cannot open {}", path, ioe);
            return Document.unreadable(specs, "Cannot open file " + path + " for reading: " + ioe.getMessage());
        }
    }

    /**
     * Read a document held in a string.
     *
     * @param specs A {@link SpineSpecs} object providing options for the parse.
     * @param contents The text of the document.
     * @return The analyzed document.
     */
    public static Document readString(final SpineSpecs specs, final String contents) {
        return read(specs, new StringReader(contents));
    }

    /**
     * Read a document from characters. Lines may end in "\n", "\r\n" or "\r"; a final line terminator is optional.
     *
     * @param specs A {@link SpineSpecs} object providing options for the parse.
     * @param reader The input. Not closed by this method.
     * @return The analyzed document.
     */
    public static Document read(final SpineSpecs specs, final Reader reader) {
        final Document document = new Document(specs);
        final BufferedReader lineReader =
                reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        try {
            String line;
            while ((line = lineReader.readLine()) != null) {
                document.append(line);
            }
        } catch (IOException ioe) {
            log.debug("Failed reading input after {} lines", document.lineCount(), ioe);
            return Document.unreadable(specs, "Error reading input: " + ioe.getMessage());
        }
        log.debug("Read {} lines", document.lineCount());
        document.analyze();
        return document;
    }
}
