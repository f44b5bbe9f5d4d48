/*
* Copyright 2025 Taylor Ketterling
* Line decoder for tab-separated station weather files.
*/
package space.ketterling.wxpipeline.ingest;

import space.ketterling.wxpipeline.model.Observation;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Decodes one {@code DATE\tMAXTEMP\tMINTEMP\tPRECIP} line.
 *
 * <p>
 * The date is {@code yyyyMMdd}; the three numeric fields are integers in tenths
 * of a unit, with {@code -9999} meaning missing. Malformed lines come back as
 * {@link DecodeResult#skipped}; this never throws.
 * </p>
 */
public final class RecordDecoder {
    public static final String MISSING_SENTINEL = "-9999";

    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final int FIELD_COUNT = 4;

    private RecordDecoder() {
    }

    public static DecodeResult decode(String line) {
        if (line == null || line.isBlank())
            return DecodeResult.skipped(SkipReason.BLANK, "blank line");

        String[] parts = line.strip().split("\t", -1);
        if (parts.length != FIELD_COUNT) {
            return DecodeResult.skipped(SkipReason.FIELD_COUNT,
                    "expected " + FIELD_COUNT + " fields, got " + parts.length);
        }

        LocalDate date;
        try {
            date = LocalDate.parse(parts[0].trim(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return DecodeResult.skipped(SkipReason.BAD_DATE, "unparseable date '" + parts[0] + "'");
        }

        Integer maxT;
        Integer minT;
        Integer prcp;
        try {
            maxT = parseTenths(parts[1]);
            minT = parseTenths(parts[2]);
            prcp = parseTenths(parts[3]);
        } catch (NumberFormatException e) {
            return DecodeResult.skipped(SkipReason.NON_NUMERIC, e.getMessage());
        }

        return DecodeResult.decoded(Observation.fromRaw(date, maxT, minT, prcp));
    }

    /**
     * Parses a tenths field; the sentinel maps to null.
     */
    private static Integer parseTenths(String field) {
        String s = field.trim();
        if (MISSING_SENTINEL.equals(s))
            return null;
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("non-numeric field '" + field + "'");
        }
    }
}
