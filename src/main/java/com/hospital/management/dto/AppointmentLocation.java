package com.hospital.management.dto;

/**
 * Where an appointment sits: the owning doctor and its index in that doctor's appointment list.
 */
public record AppointmentLocation(int doctorId, int index) {
}
