package com.hospital.management.exception;

/**
 * No doctor holds an appointment for the given patient id.
 */
public class AppointmentNotFoundException extends RecordNotFoundException {

    public AppointmentNotFoundException(int patientId) {
        super("No appointment for patient " + patientId, patientId);
    }
}
