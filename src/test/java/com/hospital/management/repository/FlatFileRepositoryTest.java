package com.hospital.management.repository;

import com.hospital.management.codec.DoctorRecordCodec;
import com.hospital.management.codec.PatientRecordCodec;
import com.hospital.management.entity.Appointment;
import com.hospital.management.entity.Doctor;
import com.hospital.management.entity.DoctorInfo;
import com.hospital.management.entity.Patient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FlatFileRepositoryTest {

    @TempDir
    Path dir;

    @Test
    public void missingFilesLoadAsEmptyCollections() {
        var patients = new PatientRepository(new PatientRecordCodec(), dir.resolve("Patients_DataBase.csv"));
        var doctors = new DoctorRepository(new DoctorRecordCodec(), dir.resolve("Doctors_DataBase.csv"));

        assertTrue(patients.loadPatients().isEmpty());
        assertTrue(doctors.loadDoctors().isEmpty());
    }

    @Test
    public void saveRewritesTheWholeFile() throws Exception {
        Path file = dir.resolve("Patients_DataBase.csv");
        Files.writeString(file, "1;A;B;C;D;E;F;G\n2;A;B;C;D;E;F;G\n", StandardCharsets.UTF_8);
        var repository = new PatientRepository(new PatientRecordCodec(), file);

        Map<Integer, Patient> patients = repository.loadPatients();
        patients.remove(1);
        repository.savePatients(patients);

        assertEquals("2;A;B;C;D;E;F;G\n", Files.readString(file, StandardCharsets.UTF_8));
        try (var listing = Files.list(dir)) {
            assertEquals(List.of(file), listing.toList());
        }
    }

    @Test
    public void windowsLineEndingsLoadLikeNewlines() throws Exception {
        Path patientsFile = dir.resolve("Patients_DataBase.csv");
        Path doctorsFile = dir.resolve("Doctors_DataBase.csv");
        Files.writeString(patientsFile, "1;ER;Dr. C;Ali;20;M;Addr;101\r\n2;ER;Dr. C;Omar;61;M;Lane;\r", StandardCharsets.UTF_8);
        Files.writeString(doctorsFile, "7;Cardiology;Dr. A;123 St;5;09:00;09:30;\r\n", StandardCharsets.UTF_8);
        var patients = new PatientRepository(new PatientRecordCodec(), patientsFile).loadPatients();
        var doctors = new DoctorRepository(new DoctorRecordCodec(), doctorsFile).loadDoctors();

        assertEquals("101", patients.get(1).getRoomNumber());
        assertEquals("", patients.get(2).getRoomNumber());
        assertEquals(List.of(new Appointment(5, "09:00", "09:30")), doctors.get(7).getAppointments());
    }

    @Test
    public void lineEndingNormalisation() {
        assertEquals("a\nb\nc\n\n", FlatFileRepository.normalizeLineEndings("a\r\nb\rc\n\r\n"));
    }

    @Test
    public void savedDoctorsLoadBack() {
        Path file = dir.resolve("nested").resolve("Doctors_DataBase.csv");
        var repository = new DoctorRepository(new DoctorRecordCodec(), file);
        Map<Integer, Doctor> doctors = new LinkedHashMap<>();
        doctors.put(7, new Doctor(7, new DoctorInfo("Cardiology", "Dr. A", "123 St"),
                List.of(new Appointment(5, "09:00", "09:30"))));

        repository.saveDoctors(doctors);

        assertTrue(Files.exists(file));
        assertEquals(doctors, repository.loadDoctors());
    }
}
