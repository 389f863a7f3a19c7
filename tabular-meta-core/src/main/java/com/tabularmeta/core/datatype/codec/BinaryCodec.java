package com.tabularmeta.core.datatype.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabularmeta.core.datatype.DerivedCodec;

import java.util.Base64;
import java.util.HexFormat;

/**
 * Binary datatypes: values map to {@code byte[]}.
 *
 * <p>Decoding is strict: base64 input must be padded to a multiple of four characters, hex input
 * must have an even number of hex digits. Hex output is upper case, so lower-case input does not
 * round-trip.
 */
public class BinaryCodec extends AbstractCodec {

    /**
     * Text encoding of the bytes.
     */
    public enum Encoding {
        BASE64,
        HEX
    }

    private static final HexFormat HEX_UPPER = HexFormat.of().withUpperCase();

    private final Encoding encoding;

    public BinaryCodec(String name, Encoding encoding) {
        super(name);
        this.encoding = encoding;
    }

    @Override
    public DerivedCodec derive(JsonNode format) {
        return new DerivedCodec() {
            @Override
            public Object parse(String lexical) {
                return encoding == Encoding.BASE64 ? decodeBase64(lexical) : decodeHex(lexical);
            }

            @Override
            public String format(Object value) {
                byte[] bytes = (byte[]) value;
                return encoding == Encoding.BASE64
                    ? Base64.getEncoder().encodeToString(bytes)
                    : HEX_UPPER.formatHex(bytes);
            }
        };
    }

    private byte[] decodeBase64(String lexical) {
        String compact = lexical.replace("\n", "").replace("\r", "");
        if (compact.length() % 4 != 0) {
            throw invalid(abbreviate(lexical), "invalid base64 encoding");
        }
        try {
            return Base64.getDecoder().decode(compact);
        } catch (IllegalArgumentException e) {
            throw invalid(abbreviate(lexical), "invalid base64 encoding", e);
        }
    }

    private byte[] decodeHex(String lexical) {
        try {
            return HexFormat.of().parseHex(lexical);
        } catch (IllegalArgumentException e) {
            throw invalid(abbreviate(lexical), "invalid hexBinary encoding", e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() > 10 ? s.substring(0, 10) : s;
    }
}
