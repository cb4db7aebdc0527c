package com.hospital.management.exception;

public class RecordNotFoundException extends HospitalDataException {

    private final int id;

    public RecordNotFoundException(String message, int id) {
        super(message);
        this.id = id;
    }

    public int getId() {
        return id;
    }
}
