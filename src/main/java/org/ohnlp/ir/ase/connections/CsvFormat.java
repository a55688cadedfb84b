package org.ohnlp.ir.ase.connections;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 style CSV handling: quoted fields, doubled quotes, and line breaks inside quotes.
 */
public final class CsvFormat {

    private CsvFormat() {}

    /**
     * Splits CSV content into records. Blank lines are skipped.
     */
    public static List<List<String>> parse(String content, char delimiter) {
        List<List<String>> records = new ArrayList<>();
        try (RecordReader reader = new RecordReader(new StringReader(content), delimiter)) {
            for (List<String> record = reader.next(); record != null; record = reader.next()) {
                records.add(record);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return records;
    }

    public static List<String> parseLine(String line, char delimiter) {
        List<List<String>> records = parse(line, delimiter);
        return records.isEmpty() ? new ArrayList<>() : records.get(0);
    }

    /**
     * Reads one record at a time from a character stream, so that arbitrarily large files can be parsed
     * without holding them in memory. A leading byte order mark is dropped.
     */
    public static final class RecordReader implements Closeable {
        private static final int NONE = -2;

        private final Reader in;
        private final char delimiter;
        private int pending = NONE;
        private boolean started;

        public RecordReader(Reader in, char delimiter) {
            this.in = in instanceof BufferedReader ? in : new BufferedReader(in);
            this.delimiter = delimiter;
        }

        private int read() throws IOException {
            if (pending != NONE) {
                int c = pending;
                pending = NONE;
                return c;
            }
            return in.read();
        }

        /**
         * @return the next non-blank record, or null at the end of input
         * @throws IllegalArgumentException if the input ends inside a quoted field
         */
        public List<String> next() throws IOException {
            if (!started) {
                started = true;
                int first = read();
                if (first != '\uFEFF') {
                    pending = first;
                }
            }
            List<String> record = new ArrayList<>();
            StringBuilder field = new StringBuilder();
            boolean quoted = false;
            boolean fieldStarted = false;
            while (true) {
                int c = read();
                if (c == -1) {
                    if (quoted) {
                        throw new IllegalArgumentException("Unterminated quoted CSV field");
                    }
                    if (fieldStarted || field.length() > 0) {
                        record.add(field.toString());
                        return record;
                    }
                    return null;
                }
                if (quoted) {
                    if (c == '"') {
                        int n = read();
                        if (n == '"') {
                            field.append('"');
                        } else {
                            quoted = false;
                            pending = n;
                        }
                    } else {
                        field.append((char) c);
                    }
                } else if (c == '"') {
                    quoted = true;
                    fieldStarted = true;
                } else if (c == delimiter) {
                    record.add(field.toString());
                    field.setLength(0);
                    fieldStarted = true;
                } else if (c == '\n' || c == '\r') {
                    if (c == '\r') {
                        int n = read();
                        if (n != '\n') {
                            pending = n;
                        }
                    }
                    if (fieldStarted || field.length() > 0) {
                        record.add(field.toString());
                        return record;
                    }
                } else {
                    field.append((char) c);
                    fieldStarted = true;
                }
            }
        }

        @Override
        public void close() throws IOException {
            in.close();
        }
    }

    /**
     * Joins values into one CSV line, quoting those that contain the delimiter, quotes or line breaks.
     * Null values are written as empty fields.
     */
    public static String formatLine(List<String> values, String delimiter) {
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) {
            if (v == null) {
                out.add("");
            } else if (v.contains(delimiter) || v.contains("\"") || v.contains("\n") || v.contains("\r")) {
                out.add('"' + v.replace("\"", "\"\"") + '"');
            } else {
                out.add(v);
            }
        }
        return String.join(delimiter, out);
    }
}
