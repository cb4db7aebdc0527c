package com.hospital.management.entity;

/**
 * A booked session on a doctor's line.
 *
 * @param patientId unvalidated reference; the patient may no longer exist
 * @param start     time token compared as text, e.g. "14:00"
 * @param end       time token, exclusive bound of the session
 */
public record Appointment(int patientId, String start, String end) implements DoctorEntry {

    public Appointment {
        start = start == null ? "" : start;
        end = end == null ? "" : end;
    }

    public Appointment reschedule(String newStart, String newEnd) {
        return new Appointment(patientId, newStart, newEnd);
    }
}
