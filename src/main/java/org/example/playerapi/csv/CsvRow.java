package org.example.playerapi.csv;

import java.util.Collections;
import java.util.Map;

/**
 * One data record of a CSV document, keyed by header name.
 */
public class CsvRow {

    private final int lineNumber;
    private final Map<String, String> values;

    public CsvRow(int lineNumber, Map<String, String> values) {
        this.lineNumber = lineNumber;
        this.values = Collections.unmodifiableMap(values);
    }

    /** 1-based line of the document on which the record starts. */
    public int getLineNumber() {
        return lineNumber;
    }

    /** The raw value, or {@code null} when the column is missing from the header or the row. */
    public String get(String column) {
        return values.get(column);
    }

    public Map<String, String> getValues() {
        return values;
    }
}
