package com.hospital.management.component;

import com.hospital.management.entity.Doctor;
import com.hospital.management.entity.DoctorField;
import com.hospital.management.entity.DoctorInfo;
import com.hospital.management.entity.Patient;
import com.hospital.management.entity.PatientField;
import com.hospital.management.exception.DoctorNotFoundException;
import com.hospital.management.exception.DuplicateKeyException;
import com.hospital.management.exception.PatientNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The patient and doctor collections of one session iteration.
 * Not thread-safe: a store is built from the files, mutated by one caller, then written back.
 */
public class HospitalDataStore {

    private static final Logger log = LoggerFactory.getLogger(HospitalDataStore.class);

    private final Map<Integer, Patient> patients;
    private final Map<Integer, Doctor> doctors;

    public HospitalDataStore() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public HospitalDataStore(Map<Integer, Patient> patients, Map<Integer, Doctor> doctors) {
        this.patients = new LinkedHashMap<>(patients);
        this.doctors = new LinkedHashMap<>(doctors);
    }

    public Map<Integer, Patient> patients() {
        return Collections.unmodifiableMap(patients);
    }

    public Map<Integer, Doctor> doctors() {
        return Collections.unmodifiableMap(doctors);
    }

    // --- patients ---

    public boolean containsPatient(int id) {
        return patients.containsKey(id);
    }

    public Patient createPatient(Patient patient) {
        if (patients.containsKey(patient.getId())) {
            throw new DuplicateKeyException("Patient", patient.getId());
        }
        patients.put(patient.getId(), patient);
        log.info("Added patient {} ({})", patient.getId(), patient.getName());
        return patient;
    }

    public Patient getPatient(int id) {
        Patient patient = patients.get(id);
        if (patient == null) {
            throw new PatientNotFoundException(id);
        }
        return patient;
    }

    public Patient updatePatientField(int id, PatientField field, String value) {
        Patient patient = getPatient(id);
        field.set(patient, value);
        log.info("Patient {} {} changed", id, field.getLabel());
        return patient;
    }

    /**
     * Appointments booked for the patient stay on their doctors' lines.
     */
    public Patient deletePatient(int id) {
        Patient removed = patients.remove(id);
        if (removed == null) {
            throw new PatientNotFoundException(id);
        }
        log.info("Deleted patient {}", id);
        return removed;
    }

    // --- doctors ---

    public boolean containsDoctor(int id) {
        return doctors.containsKey(id);
    }

    public Doctor createDoctor(int id, DoctorInfo info) {
        if (doctors.containsKey(id)) {
            throw new DuplicateKeyException("Doctor", id);
        }
        Doctor doctor = new Doctor(id, info);
        doctors.put(id, doctor);
        log.info("Added doctor {} ({})", id, info.getName());
        return doctor;
    }

    public Doctor getDoctor(int id) {
        Doctor doctor = doctors.get(id);
        if (doctor == null) {
            throw new DoctorNotFoundException(id);
        }
        return doctor;
    }

    public Doctor updateDoctorField(int id, DoctorField field, String value) {
        Doctor doctor = getDoctor(id);
        field.set(doctor.getInfo(), value);
        log.info("Doctor {} {} changed", id, field.getLabel());
        return doctor;
    }

    /**
     * Removes the doctor together with every appointment on their line.
     */
    public Doctor deleteDoctor(int id) {
        Doctor removed = doctors.remove(id);
        if (removed == null) {
            throw new DoctorNotFoundException(id);
        }
        log.info("Deleted doctor {} and {} appointments", id, removed.getAppointments().size());
        return removed;
    }
}
