package com.hospital.management.service;

import com.hospital.management.component.HospitalDataStore;
import com.hospital.management.repository.DoctorRepository;
import com.hospital.management.repository.PatientRepository;
import org.springframework.stereotype.Service;

/**
 * Builds a fresh store from both files and writes a store back over them.
 */
@Service
public class RecordsService {

    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;

    public RecordsService(PatientRepository patientRepository, DoctorRepository doctorRepository) {
        this.patientRepository = patientRepository;
        this.doctorRepository = doctorRepository;
    }

    public HospitalDataStore load() {
        return new HospitalDataStore(patientRepository.loadPatients(), doctorRepository.loadDoctors());
    }

    public void save(HospitalDataStore store) {
        patientRepository.savePatients(store.patients());
        doctorRepository.saveDoctors(store.doctors());
    }
}
