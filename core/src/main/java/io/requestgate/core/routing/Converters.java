package io.requestgate.core.routing;

import io.requestgate.core.spi.Converter;
import java.util.UUID;
import java.util.regex.Pattern;

/** Built-in path segment converters. */
public final class Converters {

    /** Any text, including the empty string. */
    public static final Converter<String> STRING = Converter.of("string", segment -> segment);

    /** A decimal {@code int}, optional leading sign. */
    public static final Converter<Integer> INT = Converter.of("int", Integer::valueOf);

    /** A decimal {@code long}, optional leading sign. */
    public static final Converter<Long> LONG = Converter.of("long", Long::valueOf);

    /** A finite decimal number, optional sign and exponent; no hex or type suffixes. */
    public static final Converter<Double> FLOAT = Converter.of("float", Converters::parseFinite);

    /** A UUID in its canonical 8-4-4-4-12 form. */
    public static final Converter<UUID> UUID_CONVERTER = Converter.of("uuid", Converters::parseUuid);

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Converters() {}

    private static Double parseFinite(String segment) {
        if (!DECIMAL.matcher(segment).matches()) {
            throw new NumberFormatException("not a decimal number: " + segment);
        }
        double value = Double.parseDouble(segment);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("not a finite number: " + segment);
        }
        return value;
    }

    private static UUID parseUuid(String segment) {
        if (segment.length() != 36) {
            throw new IllegalArgumentException("not a canonical UUID: " + segment);
        }
        return UUID.fromString(segment);
    }
}
