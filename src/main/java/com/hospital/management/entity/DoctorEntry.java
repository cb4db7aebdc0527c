package com.hospital.management.entity;

/**
 * A positional entry of a doctor line: the header first, then zero or more appointments.
 * Callers tell the two apart by variant, never by inspecting field values.
 */
public sealed interface DoctorEntry permits DoctorInfo, Appointment {
}
