package io.deephaven.spines.tokenization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits comma-separated-value style lines, where a field may be wrapped in quote characters so that it can contain
 * the delimiter, and a doubled quote inside a quoted field stands for one literal quote. A quoted field that is never
 * closed runs to the end of the line.
 */
public final class QuotedFieldSplitter implements FieldSplitter {
    private final char delimiter;
    private final char quote;

    /**
     * Constructor.
     *
     * @param delimiter The field delimiter. Typically ','
     * @param quote The quote character. Typically '"'
     */
    public QuotedFieldSplitter(char delimiter, char quote) {
        this.delimiter = delimiter;
        this.quote = quote;
    }

    @Override
    public List<String> split(String line) {
        if (line.isEmpty()) {
            return Collections.singletonList(line);
        }
        final List<String> fields = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        final int length = line.length();
        int offset = 0;
        while (true) {
            current.setLength(0);
            if (offset < length && line.charAt(offset) == quote) {
                offset = processQuotedField(line, offset + 1, current);
            } else {
                while (offset < length && line.charAt(offset) != delimiter) {
                    current.append(line.charAt(offset++));
                }
            }
            fields.add(current.toString());
            if (offset >= length) {
                break;
            }
            // We are sitting on a delimiter.
            ++offset;
            if (offset == length) {
                // Trailing delimiter means a trailing empty field.
                fields.add("");
                break;
            }
        }
        if (fields.size() > 1 && FieldSplitter.isGlobalRecord(fields.get(0))) {
            // A global record is one field no matter how many delimiters it contains.
            return Collections.singletonList(join(fields));
        }
        return fields;
    }

    /**
     * Consume the body of a quoted field.
     *
     * @return The offset just past the closing quote and any unquoted text that follows it, which is either the
     *         offset of the next delimiter or the end of the line.
     */
    private int processQuotedField(String line, int offset, StringBuilder dest) {
        final int length = line.length();
        while (offset < length) {
            final char ch = line.charAt(offset++);
            if (ch != quote) {
                dest.append(ch);
                continue;
            }
            if (offset < length && line.charAt(offset) == quote) {
                dest.append(quote);
                ++offset;
                continue;
            }
            break;
        }
        // Text between the closing quote and the delimiter is kept as-is.
        while (offset < length && line.charAt(offset) != delimiter) {
            dest.append(line.charAt(offset++));
        }
        return offset;
    }

    @Override
    public String join(List<String> fields) {
        final StringBuilder sb = new StringBuilder();
        for (int ii = 0; ii != fields.size(); ++ii) {
            if (ii != 0) {
                sb.append(delimiter);
            }
            appendField(sb, fields.get(ii));
        }
        return sb.toString();
    }

    private void appendField(StringBuilder sb, String field) {
        final boolean needsQuotes = field.indexOf(delimiter) >= 0
                || (!field.isEmpty() && field.charAt(0) == quote);
        if (!needsQuotes) {
            sb.append(field);
            return;
        }
        sb.append(quote);
        for (int ii = 0; ii != field.length(); ++ii) {
            final char ch = field.charAt(ii);
            if (ch == quote) {
                sb.append(quote);
            }
            sb.append(ch);
        }
        sb.append(quote);
    }
}
