package com.hospital.management.repository;

import com.hospital.management.codec.PatientRecordCodec;
import com.hospital.management.config.HospitalProperties;
import com.hospital.management.entity.Patient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.Map;

@Repository
public class PatientRepository extends FlatFileRepository<Patient> {

    @Autowired
    public PatientRepository(PatientRecordCodec codec, HospitalProperties properties) {
        this(codec, Path.of(properties.getFiles().getPatients()));
    }

    public PatientRepository(PatientRecordCodec codec, Path file) {
        super(codec, file, "patient");
    }

    public Map<Integer, Patient> loadPatients() {
        return load();
    }

    public void savePatients(Map<Integer, Patient> patients) {
        save(patients);
    }
}
