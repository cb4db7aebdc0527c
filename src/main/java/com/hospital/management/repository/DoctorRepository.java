package com.hospital.management.repository;

import com.hospital.management.codec.DoctorRecordCodec;
import com.hospital.management.config.HospitalProperties;
import com.hospital.management.entity.Doctor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.Map;

@Repository
public class DoctorRepository extends FlatFileRepository<Doctor> {

    @Autowired
    public DoctorRepository(DoctorRecordCodec codec, HospitalProperties properties) {
        this(codec, Path.of(properties.getFiles().getDoctors()));
    }

    public DoctorRepository(DoctorRecordCodec codec, Path file) {
        super(codec, file, "doctor");
    }

    public Map<Integer, Doctor> loadDoctors() {
        return load();
    }

    public void saveDoctors(Map<Integer, Doctor> doctors) {
        save(doctors);
    }
}
