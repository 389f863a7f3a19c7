package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

/**
 * {@code any}: values are kept as text.
 */
public class AnyCodec extends AbstractCodec {

    public AnyCodec(String name) {
        super(name);
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                return lexical;
            }

            @Override
            public String format(Object value) {
                return String.valueOf(value);
            }
        };
    }
}
