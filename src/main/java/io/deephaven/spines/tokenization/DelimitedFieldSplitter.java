package io.deephaven.spines.tokenization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits on every occurrence of the delimiter. Empty fields are preserved, so that {@link #join} reproduces the line
 * exactly.
 */
public final class DelimitedFieldSplitter implements FieldSplitter {
    private final char delimiter;

    /**
     * Constructor.
     *
     * @param delimiter The field delimiter. Typically a tab.
     */
    public DelimitedFieldSplitter(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public List<String> split(String line) {
        if (line.isEmpty() || FieldSplitter.isGlobalRecord(line)) {
            return Collections.singletonList(line);
        }
        final List<String> fields = new ArrayList<>();
        int begin = 0;
        int end;
        while ((end = line.indexOf(delimiter, begin)) >= 0) {
            fields.add(line.substring(begin, end));
            begin = end + 1;
        }
        fields.add(line.substring(begin));
        return fields;
    }

    @Override
    public String join(List<String> fields) {
        return String.join(String.valueOf(delimiter), fields);
    }
}
