package com.hospital.management.shell;

import com.hospital.management.codec.DoctorRecordCodec;
import com.hospital.management.codec.PatientRecordCodec;
import com.hospital.management.component.ConsolePhrases;
import com.hospital.management.repository.DoctorRepository;
import com.hospital.management.repository.PatientRepository;
import com.hospital.management.service.HospitalDirectoryService;
import com.hospital.management.service.RecordsService;
import com.hospital.management.service.SchedulingService;
import com.hospital.management.service.TimeComparison;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HospitalShellTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private Path patientsFile() {
        return dir.resolve("Patients_DataBase.csv");
    }

    private Path doctorsFile() {
        return dir.resolve("Doctors_DataBase.csv");
    }

    private void run(String... lines) {
        String script = String.join("\n", lines) + "\n";
        ConsoleIO io = new ConsoleIO(new ByteArrayInputStream(script.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
        RecordsService records = new RecordsService(
                new PatientRepository(new PatientRecordCodec(), patientsFile()),
                new DoctorRepository(new DoctorRecordCodec(), doctorsFile()));
        HospitalShell shell = new HospitalShell(records,
                new SchedulingService(List.of("11", "12"), TimeComparison.LEXICOGRAPHIC),
                new HospitalDirectoryService(), new ConsolePhrases(), io);
        shell.run();
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void firstRunAddsRecordsAndBooks() throws Exception {
        run("1",
                "2", "1", "7", "Cardiology", "Dr. A", "123 St",
                "1", "1", "abc", "5", "Cardiology", "Dr. A", "Sara", "34", "F", "12 Main St", "101",
                "3", "1", "7", "1", "5", "11:30", "14:00", "15:00",
                "B",
                "Q");

        assertEquals("5;Cardiology;Dr. A;Sara;34;F;12 Main St;101\n",
                Files.readString(patientsFile(), StandardCharsets.UTF_8));
        assertEquals("7;Cardiology;Dr. A;123 St;5;14:00;15:00;\n",
                Files.readString(doctorsFile(), StandardCharsets.UTF_8));
        assertTrue(printed().contains("Patient ID should be an integer number"));
        assertTrue(printed().contains("Appointments should be between"));
    }

    @Test
    public void editCancelAndFieldEditAreSaved() throws Exception {
        Files.writeString(patientsFile(), "5;Cardiology;Dr. A;Sara;34;F;12 Main St;101\n", StandardCharsets.UTF_8);
        Files.writeString(doctorsFile(), "7;Cardiology;Dr. A;123 St;5;09:00;09:30;9;10:00;10:30;\n",
                StandardCharsets.UTF_8);

        run("1",
                "3", "2", "5", "09:00", "13:00", "13:30",
                "3", "3", "5",
                "3", "3", "5",
                "1", "4", "5", "3", "Mona", "B",
                "B",
                "Q");

        assertEquals("7;Cardiology;Dr. A;123 St;9;10:00;10:30;\n",
                Files.readString(doctorsFile(), StandardCharsets.UTF_8));
        assertEquals("5;Cardiology;Dr. A;Mona;34;F;12 Main St;101\n",
                Files.readString(patientsFile(), StandardCharsets.UTF_8));
        assertTrue(printed().contains("This appointment is already booked"));
        assertTrue(printed().contains("No Appointment for this patient"));
        assertTrue(printed().contains("Current name : Sara"));
    }

    @Test
    public void doctorFieldEditShowsCurrentValue() throws Exception {
        Files.writeString(doctorsFile(), "3;Surgery;Dr. B;Side Rd;\n", StandardCharsets.UTF_8);

        run("1", "2", "4", "3", "3", "Hill St", "B", "B", "Q");

        assertTrue(printed().contains("Current address : Side Rd"));
        assertEquals("3;Surgery;Dr. B;Hill St;\n", Files.readString(doctorsFile(), StandardCharsets.UTF_8));
    }

    @Test
    public void bookingForNewPatientCopiesDoctorHeader() throws Exception {
        Files.writeString(doctorsFile(), "3;Surgery;Dr. B;Side Rd;\n", StandardCharsets.UTF_8);

        run("1", "3", "1", "3", "2", "6", "Omar", "61", "M", "Hill St", "13:00", "13:30", "B", "Q");

        assertEquals("6;Surgery;Dr. B;Omar;61;M;Hill St;\n", Files.readString(patientsFile(), StandardCharsets.UTF_8));
        assertEquals("3;Surgery;Dr. B;Side Rd;6;13:00;13:30;\n", Files.readString(doctorsFile(), StandardCharsets.UTF_8));
    }

    @Test
    public void userModeListsAppointmentsAndLeavesFilesAlone() throws Exception {
        String doctors = "7;Cardiology;Dr. A;123 St;5;09:00;09:30;\n";
        Files.writeString(doctorsFile(), doctors, StandardCharsets.UTF_8);

        run("2", "5", "x", "7", "1", "B");

        assertTrue(printed().contains("Dr. A has appointments :"));
        assertTrue(printed().contains("\tfrom : 09:00    to : 09:30"));
        assertTrue(printed().contains("\tCardiology"));
        assertEquals(doctors, Files.readString(doctorsFile(), StandardCharsets.UTF_8));
        assertFalse(Files.exists(patientsFile()));
    }
}
