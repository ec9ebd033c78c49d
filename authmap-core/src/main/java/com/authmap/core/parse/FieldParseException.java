package com.authmap.core.parse;

/** A failure confined to one field (or one entry of it) of the mapping document. */
public class FieldParseException extends RuntimeException {
    private final String field;

    public FieldParseException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public FieldParseException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
