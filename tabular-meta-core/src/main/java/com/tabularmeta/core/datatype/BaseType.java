package com.tabularmeta.core.datatype;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.codec.AnyCodec;
import com.tabularmeta.core.datatype.codec.AnyUriCodec;
import com.tabularmeta.core.datatype.codec.BinaryCodec;
import com.tabularmeta.core.datatype.codec.BooleanCodec;
import com.tabularmeta.core.datatype.codec.DateTimeCodec;
import com.tabularmeta.core.datatype.codec.DecimalCodec;
import com.tabularmeta.core.datatype.codec.DurationCodec;
import com.tabularmeta.core.datatype.codec.FloatCodec;
import com.tabularmeta.core.datatype.codec.IntegerCodec;
import com.tabularmeta.core.datatype.codec.JsonCodec;
import com.tabularmeta.core.datatype.codec.StringCodec;

import javax.xml.datatype.Duration;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The CSVW built-in datatypes.
 *
 * <p>The set is fixed. Each constant carries its codec family, the Java class its values map to
 * and an example literal. Names are case-sensitive and match the CSVW vocabulary
 * ({@code dateTime} and {@code datetime} are both accepted).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BaseType type = BaseType.forName("unsignedByte").orElseThrow();
 * Object value = type.parse("255");                   // BigInteger 255
 * DerivedCodec codec = type.derive(TextNode.valueOf("d.M.yyyy"));
 * }</pre>
 */
public enum BaseType {

    ANY("any", Family.ANY, String.class, "anything", AnyCodec::new),
    STRING("string", Family.STRING, String.class, "abc", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    ANY_URI("anyURI", Family.STRING, URI.class, "http://example.org/a%2Fb", AnyUriCodec::new),
    NMTOKEN("NMTOKEN", Family.STRING, String.class, "a-b.c", n -> new StringCodec(n, StringCodec.Kind.NMTOKEN)),
    NORMALIZED_STRING("normalizedString", Family.STRING, String.class, "a b",
        n -> new StringCodec(n, StringCodec.Kind.NORMALIZED)),
    QNAME("QName", Family.STRING, String.class, "ex:a", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    G_DAY("gDay", Family.STRING, String.class, "---01", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    G_MONTH("gMonth", Family.STRING, String.class, "--01", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    G_MONTH_DAY("gMonthDay", Family.STRING, String.class, "--01-31", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    G_YEAR("gYear", Family.STRING, String.class, "2024", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    G_YEAR_MONTH("gYearMonth", Family.STRING, String.class, "2024-01", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    XML("xml", Family.STRING, String.class, "<a>b</a>", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    HTML("html", Family.STRING, String.class, "<p>x</p>", n -> new StringCodec(n, StringCodec.Kind.PLAIN)),
    JSON("json", Family.JSON, JsonNode.class, "{\"a\":[1,2]}", JsonCodec::new),
    BASE64_BINARY("base64Binary", Family.BINARY, byte[].class, "YWJj", n -> new BinaryCodec(n, BinaryCodec.Encoding.BASE64)),
    BINARY("binary", Family.BINARY, byte[].class, "YWJjZA==", n -> new BinaryCodec(n, BinaryCodec.Encoding.BASE64)),
    HEX_BINARY("hexBinary", Family.BINARY, byte[].class, "0fb7", n -> new BinaryCodec(n, BinaryCodec.Encoding.HEX)),
    BOOLEAN("boolean", Family.BOOLEAN, Boolean.class, "true", BooleanCodec::new),
    DECIMAL("decimal", Family.NUMERIC, BigDecimal.class, "-12.50", DecimalCodec::new),
    INTEGER("integer", Family.NUMERIC, BigInteger.class, "42", n -> new IntegerCodec(n, null, null)),
    INT("int", Family.NUMERIC, BigInteger.class, "-2147483648", bounded(-2147483648L, 2147483647L)),
    LONG("long", Family.NUMERIC, BigInteger.class, "9223372036854775807", bounded(Long.MIN_VALUE, Long.MAX_VALUE)),
    SHORT("short", Family.NUMERIC, BigInteger.class, "-300", bounded(Short.MIN_VALUE, Short.MAX_VALUE)),
    BYTE("byte", Family.NUMERIC, BigInteger.class, "-8", bounded(Byte.MIN_VALUE, Byte.MAX_VALUE)),
    UNSIGNED_LONG("unsignedLong", Family.NUMERIC, BigInteger.class, "18446744073709551615",
        n -> new IntegerCodec(n, BigInteger.ZERO, new BigInteger("18446744073709551615"))),
    UNSIGNED_INT("unsignedInt", Family.NUMERIC, BigInteger.class, "4294967295", bounded(0, 4294967295L)),
    UNSIGNED_SHORT("unsignedShort", Family.NUMERIC, BigInteger.class, "65535", bounded(0, 65535)),
    UNSIGNED_BYTE("unsignedByte", Family.NUMERIC, BigInteger.class, "255", bounded(0, 255)),
    NON_NEGATIVE_INTEGER("nonNegativeInteger", Family.NUMERIC, BigInteger.class, "0",
        n -> new IntegerCodec(n, BigInteger.ZERO, null)),
    POSITIVE_INTEGER("positiveInteger", Family.NUMERIC, BigInteger.class, "1",
        n -> new IntegerCodec(n, BigInteger.ONE, null)),
    NON_POSITIVE_INTEGER("nonPositiveInteger", Family.NUMERIC, BigInteger.class, "0",
        n -> new IntegerCodec(n, null, BigInteger.ZERO)),
    NEGATIVE_INTEGER("negativeInteger", Family.NUMERIC, BigInteger.class, "-1",
        n -> new IntegerCodec(n, null, BigInteger.ONE.negate())),
    FLOAT("float", Family.NUMERIC, Double.class, "1.5", FloatCodec::new),
    DOUBLE("double", Family.NUMERIC, Double.class, "-0.25", FloatCodec::new),
    NUMBER("number", Family.NUMERIC, Double.class, "3.75", FloatCodec::new),
    DATETIME("datetime", Family.TEMPORAL, LocalDateTime.class, "2024-01-31T12:30:00",
        n -> new DateTimeCodec(n, DateTimeCodec.Kind.DATETIME)),
    DATE_TIME("dateTime", Family.TEMPORAL, LocalDateTime.class, "2024-01-31T12:30:05.25",
        n -> new DateTimeCodec(n, DateTimeCodec.Kind.DATETIME)),
    DATE("date", Family.TEMPORAL, LocalDate.class, "2024-01-31", n -> new DateTimeCodec(n, DateTimeCodec.Kind.DATE)),
    DATE_TIME_STAMP("dateTimeStamp", Family.TEMPORAL, OffsetDateTime.class, "2024-01-31T12:30:00.123456+01:00",
        n -> new DateTimeCodec(n, DateTimeCodec.Kind.DATETIMESTAMP)),
    TIME("time", Family.TEMPORAL, LocalTime.class, "12:30:00", n -> new DateTimeCodec(n, DateTimeCodec.Kind.TIME)),
    DURATION("duration", Family.DURATION, Duration.class, "P1Y2M3DT4H5M6S",
        n -> new DurationCodec(n, DurationCodec.Kind.ANY)),
    DAY_TIME_DURATION("dayTimeDuration", Family.DURATION, Duration.class, "P1DT2H",
        n -> new DurationCodec(n, DurationCodec.Kind.DAY_TIME)),
    YEAR_MONTH_DURATION("yearMonthDuration", Family.DURATION, Duration.class, "P1Y2M",
        n -> new DurationCodec(n, DurationCodec.Kind.YEAR_MONTH));

    /**
     * Codec family, deciding which constraints a derived datatype may declare.
     */
    public enum Family {
        ANY,
        STRING,
        JSON,
        BINARY,
        BOOLEAN,
        NUMERIC,
        TEMPORAL,
        DURATION
    }

    private static final Map<String, BaseType> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BaseType::getName, Function.identity()));

    private final String name;
    private final Family family;
    private final Class<?> valueType;
    private final String example;
    private final TypeCodec codec;
    private final DerivedCodec canonical;

    BaseType(String name, Family family, Class<?> valueType, String example,
             Function<String, TypeCodec> codecFactory) {
        this.name = name;
        this.family = family;
        this.valueType = valueType;
        this.example = example;
        this.codec = codecFactory.apply(name);
        this.canonical = codec.derive(null);
    }

    private static Function<String, TypeCodec> bounded(long min, long max) {
        return n -> new IntegerCodec(n, BigInteger.valueOf(min), BigInteger.valueOf(max));
    }

    /**
     * Looks up a basetype by its CSVW name.
     *
     * @param name case-sensitive name, e.g. {@code "dateTimeStamp"}
     * @return the basetype, or empty if the name is unknown
     */
    public static Optional<BaseType> forName(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    public String getName() {
        return name;
    }

    public Family getFamily() {
        return family;
    }

    /**
     * @return the Java class values of this type are read into (offset-carrying temporal values
     *         may use the {@code Offset*} variant)
     */
    public Class<?> valueType() {
        return valueType;
    }

    /**
     * @return a lexical value in this type's canonical format
     */
    public String getExample() {
        return example;
    }

    /**
     * Whether bounds ({@code minimum}, {@code maxExclusive}, ...) may be declared.
     */
    public boolean isOrdered() {
        return family == Family.NUMERIC || family == Family.TEMPORAL || family == Family.DURATION;
    }

    /**
     * Whether {@code length}, {@code minLength} and {@code maxLength} may be declared.
     */
    public boolean supportsLength() {
        return family == Family.STRING || family == Family.BINARY;
    }

    /**
     * Derives a codec for the given format.
     *
     * @param format the datatype's {@code format}, or null for the canonical lexical form
     * @return derived codec
     */
    public DerivedCodec derive(JsonNode format) {
        return format == null || format.isNull() ? canonical : codec.derive(format);
    }

    /**
     * Parses a canonical lexical value.
     *
     * @param lexical lexical value
     * @return typed value
     */
    public Object parse(String lexical) {
        return canonical.parse(lexical);
    }

    /**
     * Formats a value in canonical form.
     *
     * @param value typed value
     * @return lexical value
     */
    public String format(Object value) {
        return canonical.format(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
