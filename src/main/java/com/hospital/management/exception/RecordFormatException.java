package com.hospital.management.exception;

/**
 * A decoded record carried an id token that is not an integer.
 */
public class RecordFormatException extends HospitalDataException {

    private final String token;

    public RecordFormatException(String field, String token, Throwable cause) {
        super("Malformed " + field + ": '" + token + "'", cause);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
