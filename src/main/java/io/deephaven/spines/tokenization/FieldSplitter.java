package io.deephaven.spines.tokenization;

import io.deephaven.spines.SpineSpecs;

import java.util.List;

/**
 * Breaks the text of one line into its field tokens, and joins field tokens back into line text. Splitting is total:
 * every input produces at least one field, and no input is rejected.
 */
public interface FieldSplitter {
    /**
     * Split a line into fields. An empty line yields a single empty field. Global records (lines starting with
     * {@code !!}) are never split; they yield a single field holding the whole line.
     *
     * @param line The line text, without its line terminator.
     * @return The fields, in order. Never empty.
     */
    List<String> split(String line);

    /**
     * The inverse of {@link #split}. For fields produced by {@link #split} from a line in canonical form, the result
     * is the original line.
     *
     * @param fields The fields.
     * @return The line text.
     */
    String join(List<String> fields);

    /**
     * Choose the splitter for the configured format.
     *
     * @param specs The reader options.
     * @return A {@link QuotedFieldSplitter} if {@link SpineSpecs#quotedFields()} is set, otherwise a
     *         {@link DelimitedFieldSplitter}.
     */
    static FieldSplitter forSpecs(SpineSpecs specs) {
        if (specs.quotedFields()) {
            return new QuotedFieldSplitter(specs.delimiter(), specs.quote());
        }
        return new DelimitedFieldSplitter(specs.delimiter());
    }

    /**
     * Whether the line is a global record, which is kept whole as a single field.
     *
     * @param line The line text.
     * @return true if the line starts with {@code !!}.
     */
    static boolean isGlobalRecord(String line) {
        return line.startsWith("!!");
    }
}
