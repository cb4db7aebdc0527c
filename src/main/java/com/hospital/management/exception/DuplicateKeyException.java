package com.hospital.management.exception;

public class DuplicateKeyException extends HospitalDataException {

    private final int id;

    public DuplicateKeyException(String kind, int id) {
        super(kind + " id " + id + " is already in use");
        this.id = id;
    }

    public int getId() {
        return id;
    }
}
