package com.authmap.core.parse;

import java.util.List;

/**
 * Aggregate of every field failure seen while parsing one mapping document, in encounter order.
 */
public class MappingParseException extends RuntimeException {
    private final List<FieldParseException> errors;

    public MappingParseException(List<FieldParseException> errors) {
        super("error parsing mapping document: " + describe(errors));
        this.errors = List.copyOf(errors);
        this.errors.forEach(this::addSuppressed);
    }

    public List<FieldParseException> errors() {
        return errors;
    }

    private static String describe(List<FieldParseException> errors) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < errors.size(); i++) {
            if (i > 0) sb.append("; ");
            sb.append(errors.get(i).getMessage());
        }
        return sb.append(']').toString();
    }
}
