package org.ohnlp.ir.ase.connections;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.RowCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.io.fs.MatchResult;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.GroupByKey;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.WithKeys;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTimeZone;
import org.joda.time.Instant;
import org.joda.time.ReadableInstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and writes delimited text files, one file per table named {@code <path>/<table>.csv} with a header line.
 */
public class FileBasedDataConnectionImpl implements DataConnection {
    private static final Logger LOG = LoggerFactory.getLogger(FileBasedDataConnectionImpl.class);

    private static final Set<String> NULL_TOKENS = Set.of("na", "nan", "nat", "null", "none");

    private String path;
    private String delimiter = ",";
    private String timezone = "UTC";

    @Override
    public void loadConfig(JsonNode node) {
        if (!node.has("path")) {
            throw new IllegalArgumentException("File based data connection requires a path");
        }
        this.path = node.get("path").asText();
        this.delimiter = node.has("delimiter") ? node.get("delimiter").asText() : this.delimiter;
        this.timezone = node.has("timezone") ? node.get("timezone").asText() : this.timezone;
        if (this.delimiter.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character, got '" + this.delimiter + "'");
        }
        DateTimeZone.forID(this.timezone);
    }

    private String fileFor(String table) {
        return (path.endsWith("/") ? path : path + "/") + table;
    }

    @Override
    public List<String> listColumns(String table) {
        String file = fileFor(table) + ".csv";
        try {
            List<MatchResult.Metadata> matches = FileSystems.match(file, EmptyMatchTreatment.ALLOW).metadata();
            if (matches.isEmpty()) {
                return Collections.emptyList();
            }
            try (CsvFormat.RecordReader reader = new CsvFormat.RecordReader(Channels.newReader(
                    FileSystems.open(matches.get(0).resourceId()), StandardCharsets.UTF_8.name()), delimiter.charAt(0))) {
                List<String> header = reader.next();
                if (header == null) {
                    LOG.warn("{} is empty", file);
                    return Collections.emptyList();
                }
                return header;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read the header of " + file, e);
        }
    }

    @Override
    public PCollection<Row> read(Pipeline pipeline, String table, Schema schema) {
        return pipeline
                .apply("Match " + table, FileIO.match().filepattern(fileFor(table) + ".csv"))
                .apply("Open " + table, FileIO.readMatches())
                .apply("Parse " + table + " from CSV", ParDo.of(new CSVDelimitedFileToRowFn(schema, delimiter, timezone)))
                .setRowSchema(schema);
    }

    @Override
    public void write(String table, PCollection<Row> data) {
        Schema schema = data.getSchema();
        String header = CsvFormat.formatLine(schema.getFieldNames(), delimiter);
        data.apply("Collect " + table, WithKeys.<String, Row>of(table))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), RowCoder.of(schema)))
                .apply("Gather " + table, GroupByKey.create())
                .apply("Format " + table + " to CSV", ParDo.of(new SortedRowsToCSVDelimitedStringSink(schema, delimiter)))
                .apply("Write to " + table, TextIO.write()
                        .to(fileFor(table))
                        .withSuffix(".csv")
                        .withoutSharding()
                        .withHeader(header));
    }

    /**
     * Converts a single CSV cell into the Java value Beam expects for the field type.
     * @throws IllegalArgumentException if the cell cannot be read as that type
     */
    static Object convert(String raw, Schema.Field field, DateTimeZone zone) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        Schema.TypeName type = field.getType().getTypeName();
        if (type == Schema.TypeName.STRING) {
            return value.isEmpty() ? null : value;
        }
        if (value.isEmpty() || NULL_TOKENS.contains(value.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            switch (type) {
                case INT32:
                    return Integer.parseInt(value);
                case INT64:
                    return Long.parseLong(value);
                case FLOAT:
                    return Float.parseFloat(value);
                case DOUBLE:
                    return Double.parseDouble(value);
                case BOOLEAN:
                    return "1".equals(value) || "true".equalsIgnoreCase(value);
                case DATETIME:
                    return Timestamps.parse(value, zone);
                default:
                    throw new UnsupportedOperationException("Unsupported CSV column type " + type);
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Column " + field.getName() + ": cannot read '" + value + "' as " + type, e);
        }
    }

    /**
     * Formats a Row value for CSV output. Times are written as ISO-8601 UTC.
     */
    static String format(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof ReadableInstant) {
            return new Instant(((ReadableInstant) value).getMillis()).toString();
        }
        return value.toString();
    }

    public static class CSVDelimitedFileToRowFn extends DoFn<FileIO.ReadableFile, Row> {
        private final Schema schema;
        private final String delimiter;
        private final String timezone;

        public CSVDelimitedFileToRowFn(Schema schema, String delimiter, String timezone) {
            this.schema = schema;
            this.delimiter = delimiter;
            this.timezone = timezone;
        }

        @ProcessElement
        public void process(ProcessContext pc) throws IOException {
            FileIO.ReadableFile file = pc.element();
            DateTimeZone zone = DateTimeZone.forID(timezone);
            try (CsvFormat.RecordReader reader = new CsvFormat.RecordReader(
                    Channels.newReader(file.open(), StandardCharsets.UTF_8.name()), delimiter.charAt(0))) {
                List<String> header = reader.next();
                if (header == null) {
                    return;
                }
                int[] positions = new int[schema.getFieldCount()];
                for (int i = 0; i < positions.length; i++) {
                    positions[i] = header.indexOf(schema.getField(i).getName());
                }
                long r = 0;
                for (List<String> record = reader.next(); record != null; record = reader.next()) {
                    r++;
                    List<Object> vals = new ArrayList<>(positions.length);
                    for (int i = 0; i < positions.length; i++) {
                        int pos = positions[i];
                        String raw = pos < 0 || pos >= record.size() ? null : record.get(pos);
                        try {
                            vals.add(convert(raw, schema.getField(i), zone));
                        } catch (IllegalArgumentException e) {
                            throw new IllegalArgumentException(file.getMetadata().resourceId() + ", record " + r + ": " + e.getMessage(), e);
                        }
                    }
                    pc.output(Row.withSchema(schema).addValues(vals).build());
                }
            }
        }
    }

    /**
     * Sorts all rows of a table field by field and emits them as a single block of CSV lines, so that
     * identical inputs always produce byte-identical files.
     */
    public static class SortedRowsToCSVDelimitedStringSink extends DoFn<KV<String, Iterable<Row>>, String> {
        private final Schema schema;
        private final String delimiter;

        public SortedRowsToCSVDelimitedStringSink(Schema schema, String delimiter) {
            this.schema = schema;
            this.delimiter = delimiter;
        }

        @ProcessElement
        public void process(ProcessContext pc) {
            List<Row> rows = new ArrayList<>();
            pc.element().getValue().forEach(rows::add);
            rows.sort(rowOrdering(schema));
            List<String> lines = new ArrayList<>(rows.size());
            for (Row in : rows) {
                List<String> out = new ArrayList<>();
                for (Schema.Field f : schema.getFields()) {
                    out.add(format(in.getValue(f.getName())));
                }
                lines.add(CsvFormat.formatLine(out, delimiter));
            }
            if (!lines.isEmpty()) {
                pc.output(String.join("\n", lines));
            }
        }
    }

    static Comparator<Row> rowOrdering(Schema schema) {
        return (a, b) -> {
            for (int i = 0; i < schema.getFieldCount(); i++) {
                int cmp = compareValues(a.getValue(i), b.getValue(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }

    /**
     * Nulls sort first. Values of the same field always share a type.
     */
    static int compareValues(Object x, Object y) {
        if (x == null || y == null) {
            return x == y ? 0 : (x == null ? -1 : 1);
        }
        if (x instanceof ReadableInstant) {
            return Long.compare(((ReadableInstant) x).getMillis(), ((ReadableInstant) y).getMillis());
        }
        if (x instanceof Integer) {
            return Integer.compare((Integer) x, (Integer) y);
        }
        if (x instanceof Long) {
            return Long.compare((Long) x, (Long) y);
        }
        if (x instanceof Number) {
            return Double.compare(((Number) x).doubleValue(), ((Number) y).doubleValue());
        }
        if (x instanceof Boolean) {
            return Boolean.compare((Boolean) x, (Boolean) y);
        }
        return x.toString().compareTo(y.toString());
    }
}
