package com.moviz.pipeline;

/**
 * A field value could not be parsed. Recovered locally by rejecting the record.
 */
public class MalformedFieldException extends Exception {
    private final String field;
    private final String value;

    public MalformedFieldException(String field, String value) {
        super(String.format("Cannot parse %s value '%s'", field, value));
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
