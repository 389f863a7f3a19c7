package com.tabularmeta.core.error;

/**
 * A cell value that cannot be mapped to, or does not satisfy the constraints of, its datatype.
 */
public class InvalidLexicalValueException extends CsvwException {

    private final String datatype;
    private final String lexicalValue;

    public InvalidLexicalValueException(String datatype, String lexicalValue) {
        this(datatype, lexicalValue, null, null);
    }

    public InvalidLexicalValueException(String datatype, String lexicalValue, String detail) {
        this(datatype, lexicalValue, detail, null);
    }

    public InvalidLexicalValueException(String datatype, String lexicalValue, String detail, Throwable cause) {
        super(message(datatype, lexicalValue, detail), cause);
        this.datatype = datatype;
        this.lexicalValue = lexicalValue;
    }

    private static String message(String datatype, String lexicalValue, String detail) {
        String base = "invalid lexical value for " + datatype + ": " + lexicalValue;
        return detail == null ? base : base + " (" + detail + ")";
    }

    /**
     * @return name of the datatype the value was checked against
     */
    public String getDatatype() {
        return datatype;
    }

    /**
     * @return the offending text
     */
    public String getLexicalValue() {
        return lexicalValue;
    }
}
