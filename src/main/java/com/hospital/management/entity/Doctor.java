package com.hospital.management.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A doctor line: identity header plus the appointments the doctor owns, in booking order.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Doctor {

    private final int id;
    private final DoctorInfo info;
    private final List<Appointment> appointments;

    public Doctor(int id, DoctorInfo info) {
        this(id, info, List.of());
    }

    public Doctor(int id, DoctorInfo info, List<Appointment> appointments) {
        this.id = id;
        this.info = info;
        this.appointments = new ArrayList<>(appointments);
    }

    public List<Appointment> getAppointments() {
        return Collections.unmodifiableList(appointments);
    }

    /**
     * Header followed by every appointment, the layout of one doctor line on disk.
     */
    public List<DoctorEntry> entries() {
        List<DoctorEntry> entries = new ArrayList<>(appointments.size() + 1);
        entries.add(info);
        entries.addAll(appointments);
        return entries;
    }

    public void addAppointment(Appointment appointment) {
        appointments.add(appointment);
    }

    public void replaceAppointment(int index, Appointment appointment) {
        appointments.set(index, appointment);
    }

    public Appointment removeAppointment(int index) {
        return appointments.remove(index);
    }
}
