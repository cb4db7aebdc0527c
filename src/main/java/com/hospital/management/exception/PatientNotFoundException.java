package com.hospital.management.exception;

public class PatientNotFoundException extends RecordNotFoundException {

    public PatientNotFoundException(int patientId) {
        super("No patient with id " + patientId, patientId);
    }
}
