package com.hospital.management.exception;

import com.hospital.management.entity.Appointment;

/**
 * The requested start falls inside [existing.start, existing.end) of another appointment
 * on the same doctor.
 */
public class AppointmentConflictException extends HospitalDataException {

    private final Appointment existing;

    public AppointmentConflictException(int doctorId, String start, Appointment existing) {
        super("Doctor " + doctorId + " is already booked at " + start
                + " (" + existing.start() + "-" + existing.end() + ")");
        this.existing = existing;
    }

    public Appointment getExisting() {
        return existing;
    }
}
