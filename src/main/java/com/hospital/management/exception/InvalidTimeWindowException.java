package com.hospital.management.exception;

public class InvalidTimeWindowException extends HospitalDataException {

    public InvalidTimeWindowException(String start) {
        super("Start time '" + start + "' is outside working hours");
    }
}
