package com.hospital.management.service;

import com.hospital.management.component.HospitalDataStore;
import com.hospital.management.entity.Appointment;
import com.hospital.management.entity.Doctor;
import com.hospital.management.entity.DoctorEntry;
import com.hospital.management.entity.DoctorInfo;
import com.hospital.management.entity.Patient;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only views for the public side of the console.
 */
@Service
public class HospitalDirectoryService {

    /**
     * One department per doctor, in doctor order. Departments shared by several doctors repeat.
     */
    public List<String> departments(HospitalDataStore store) {
        return store.doctors().values().stream()
                .map(d -> d.getInfo().getDepartment())
                .toList();
    }

    public List<DoctorInfo> doctors(HospitalDataStore store) {
        return store.doctors().values().stream()
                .map(Doctor::getInfo)
                .toList();
    }

    public List<Patient> residents(HospitalDataStore store) {
        return List.copyOf(store.patients().values());
    }

    public Patient patientDetails(HospitalDataStore store, int patientId) {
        return store.getPatient(patientId);
    }

    /**
     * The appointments on a doctor's line, header excluded.
     */
    public List<Appointment> appointmentsOf(HospitalDataStore store, int doctorId) {
        List<Appointment> appointments = new ArrayList<>();
        for (DoctorEntry entry : store.getDoctor(doctorId).entries()) {
            if (entry instanceof Appointment appointment) {
                appointments.add(appointment);
            }
        }
        return appointments;
    }
}
