package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * {@code anyURI}: values map to {@link URI}.
 *
 * <p>Formatting normalizes the URI (RFC 3986 path normalization), so round-tripping the lexical
 * form is not guaranteed.
 */
public class AnyUriCodec extends StringCodec {

    public AnyUriCodec(String name) {
        super(name, Kind.PLAIN);
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        Pattern regex = compileFormat(format);
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                String text = parseString(lexical, regex);
                try {
                    return new URI(text);
                } catch (URISyntaxException e) {
                    throw invalid(lexical, e.getReason(), e);
                }
            }

            @Override
            public String format(Object value) {
                URI uri = value instanceof URI u ? u : URI.create(String.valueOf(value));
                return uri.normalize().toString();
            }
        };
    }
}
