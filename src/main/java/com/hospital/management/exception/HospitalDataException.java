package com.hospital.management.exception;

/**
 * Base type for every failure raised by the records store and the scheduler.
 */
public class HospitalDataException extends RuntimeException {

    public HospitalDataException(String message) {
        super(message);
    }

    public HospitalDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
