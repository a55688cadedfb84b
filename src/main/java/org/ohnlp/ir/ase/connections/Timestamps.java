package org.ohnlp.ir.ase.connections;

import org.joda.time.DateTimeZone;
import org.joda.time.Instant;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.DateTimeFormatterBuilder;
import org.joda.time.format.DateTimeParser;
import org.joda.time.format.ISODateTimeFormat;

/**
 * Parsing of the timestamp layouts found in CLIF extracts.
 */
public final class Timestamps {
    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .append(null, new DateTimeParser[]{
                    ISODateTimeFormat.dateTimeParser().getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss.SSSSSSZZ").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss.SSSZZ").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss.SSS").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ssZZ").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm").getParser()
            })
            .toFormatter();

    private Timestamps() {}

    /**
     * @param value A timestamp string; values without an offset are read in the given zone
     * @param zone  The zone for local timestamps
     * @return the instant, or null for blank input
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    public static Instant parse(String value, DateTimeZone zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return FORMATTER.withZone(zone).parseDateTime(value.trim()).toInstant();
    }
}
