package org.example.playerapi.csv;

import java.io.Closeable;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a comma-separated document whose first record names the columns.
 *
 * Quoted fields may contain commas, line breaks and doubled quotes. Blank lines are skipped.
 * A row shorter than the header leaves the trailing columns unset; surplus values are dropped.
 */
public class CsvRowReader implements Closeable {

    private static final char BOM = '\uFEFF';

    private final PushbackReader in;
    private List<String> header;
    private int line = 1;
    private int recordLine;
    private boolean started;

    public CsvRowReader(Reader reader) {
        this.in = new PushbackReader(reader, 1);
    }

    /** Column names in document order; empty for an empty document. */
    public List<String> getHeader() throws IOException {
        if (header == null) {
            List<String> names = readRecord();
            header = new ArrayList<>();
            if (names != null) {
                for (String name : names) {
                    header.add(name.trim());
                }
            }
        }
        return header;
    }

    /**
     * @return the next data row, or {@code null} at end of document
     * @throws IOException on read failure or an unterminated quoted field
     */
    public CsvRow next() throws IOException {
        List<String> columns = getHeader();
        if (columns.isEmpty()) {
            return null;
        }
        List<String> fields = readRecord();
        if (fields == null) {
            return null;
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size() && i < fields.size(); i++) {
            values.put(columns.get(i), fields.get(i));
        }
        return new CsvRow(recordLine, values);
    }

    // next non-blank record, or null at EOF
    private List<String> readRecord() throws IOException {
        while (true) {
            recordLine = line;
            List<String> fields = new ArrayList<>();
            StringBuilder cur = new StringBuilder();
            boolean inQuotes = false;
            boolean fieldStarted = false;
            boolean sawAny = false;
            boolean endOfRecord = false;

            int c;
            while (!endOfRecord && (c = read()) != -1) {
                sawAny = true;
                char ch = (char) c;
                if (inQuotes) {
                    if (ch == '"') {
                        int next = read();
                        if (next == '"') {
                            cur.append('"');
                        } else {
                            inQuotes = false;
                            unread(next);
                        }
                    } else {
                        if (ch == '\n') {
                            line++;
                        }
                        cur.append(ch);
                    }
                } else if (ch == '"' && !fieldStarted) {
                    inQuotes = true;
                    fieldStarted = true;
                } else if (ch == ',') {
                    fields.add(cur.toString());
                    cur.setLength(0);
                    fieldStarted = false;
                } else if (ch == '\r' || ch == '\n') {
                    if (ch == '\r') {
                        int next = read();
                        if (next != '\n') {
                            unread(next);
                        }
                    }
                    line++;
                    endOfRecord = true;
                } else {
                    cur.append(ch);
                    fieldStarted = true;
                }
            }

            if (inQuotes) {
                throw new IOException("Unterminated quoted field starting on line " + recordLine);
            }
            if (!sawAny) {
                return null;
            }
            boolean blank = fields.isEmpty() && cur.length() == 0 && !fieldStarted;
            if (!blank) {
                fields.add(cur.toString());
                return fields;
            }
        }
    }

    private int read() throws IOException {
        int c = in.read();
        if (!started) {
            started = true;
            if (c == BOM) {
                c = in.read();
            }
        }
        return c;
    }

    private void unread(int c) throws IOException {
        if (c != -1) {
            in.unread(c);
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
