package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import javax.xml.datatype.DatatypeConfigurationException;
import javax.xml.datatype.DatatypeFactory;
import javax.xml.datatype.Duration;
import java.util.regex.Pattern;

/**
 * XML Schema durations ({@code duration}, {@code dayTimeDuration}, {@code yearMonthDuration}),
 * mapped to {@link Duration}. A {@code format} is a regular expression the value must match.
 */
public class DurationCodec extends StringCodec {

    private static final DatatypeFactory FACTORY = newFactory();

    /**
     * Duration family member.
     */
    public enum Kind {
        ANY,
        DAY_TIME,
        YEAR_MONTH
    }

    private final Kind kind;

    public DurationCodec(String name, Kind kind) {
        super(name, StringCodec.Kind.PLAIN);
        this.kind = kind;
    }

    private static DatatypeFactory newFactory() {
        try {
            return DatatypeFactory.newInstance();
        } catch (DatatypeConfigurationException e) {
            throw new IllegalStateException("No XML datatype factory available", e);
        }
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        Pattern regex = compileFormat(format);
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                String text = parseString(lexical.strip(), regex);
                try {
                    return switch (kind) {
                        case ANY -> FACTORY.newDuration(text);
                        case DAY_TIME -> FACTORY.newDurationDayTime(text);
                        case YEAR_MONTH -> FACTORY.newDurationYearMonth(text);
                    };
                } catch (IllegalArgumentException | UnsupportedOperationException e) {
                    throw invalid(lexical, "not a " + name, e);
                }
            }

            @Override
            public String format(Object value) {
                return value.toString();
            }
        };
    }
}
