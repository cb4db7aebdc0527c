package com.hospital.management.exception;

public class DoctorNotFoundException extends RecordNotFoundException {

    public DoctorNotFoundException(int doctorId) {
        super("No doctor with id " + doctorId, doctorId);
    }
}
