package com.hospital.management.shell;

import com.hospital.management.component.ConsolePhrases;
import com.hospital.management.component.HospitalDataStore;
import com.hospital.management.dto.AppointmentLocation;
import com.hospital.management.entity.Appointment;
import com.hospital.management.entity.DoctorField;
import com.hospital.management.entity.DoctorInfo;
import com.hospital.management.entity.Patient;
import com.hospital.management.entity.PatientField;
import com.hospital.management.exception.AppointmentConflictException;
import com.hospital.management.exception.AppointmentNotFoundException;
import com.hospital.management.exception.HospitalDataException;
import com.hospital.management.exception.InvalidTimeWindowException;
import com.hospital.management.service.HospitalDirectoryService;
import com.hospital.management.service.RecordsService;
import com.hospital.management.service.SchedulingService;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.IntPredicate;

/**
 * Menu loop over the records files. Every iteration reloads both files into a new store;
 * every admin action is followed by a full rewrite of both files.
 * Re-prompting on bad input happens here; the store and the scheduler never retry.
 */
@Component
@ConditionalOnProperty(prefix = "hospital.shell", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HospitalShell implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(HospitalShell.class);

    private static final String BACK = "B";

    private final RecordsService recordsService;
    private final SchedulingService schedulingService;
    private final HospitalDirectoryService directoryService;
    private final ConsolePhrases phrases;
    private final ConsoleIO io;

    public HospitalShell(RecordsService recordsService,
                         SchedulingService schedulingService,
                         HospitalDirectoryService directoryService,
                         ConsolePhrases phrases,
                         ConsoleIO io) {
        this.recordsService = recordsService;
        this.schedulingService = schedulingService;
        this.directoryService = directoryService;
        this.phrases = phrases;
        this.io = io;
    }

    @Override
    public void run(String... args) {
        io.println(phrases.banner());
        try {
            while (true) {
                HospitalDataStore store = recordsService.load();
                io.println(phrases.modeMenu());
                String mode = choice("Enter your mode : ");
                if ("1".equals(mode)) {
                    adminMode(store);
                } else if ("2".equals(mode)) {
                    userMode(store);
                } else if ("Q".equals(mode)) {
                    return;
                } else {
                    io.println("Please choose just 1, 2 or Q");
                }
            }
        } catch (ConsoleIO.InputClosedException e) {
            log.info("Console input closed, leaving the shell");
        }
    }

    // =========================================================
    // ADMIN
    // =========================================================
    private void adminMode(HospitalDataStore store) {
        while (true) {
            io.println(phrases.adminMenu());
            String option = choice(phrases.choicePrompt());
            try {
                switch (option) {
                    case "1" -> patientActions(store);
                    case "2" -> doctorActions(store);
                    case "3" -> appointmentActions(store);
                    case BACK -> {
                        return;
                    }
                    default -> io.println(phrases.invalidChoice());
                }
            } catch (HospitalDataException e) {
                log.warn("Admin action failed: {}", e.getMessage());
                io.println(e.getMessage());
            }
            recordsService.save(store);
        }
    }

    private void patientActions(HospitalDataStore store) {
        io.println(phrases.patientMenu());
        switch (choice(phrases.choicePrompt())) {
            case "1" -> {
                int id = readNewId("Enter patient ID : ", "Patient", store::containsPatient);
                Patient patient = Patient.builder()
                        .id(id)
                        .department(io.readLine("Enter patient department                : "))
                        .attendingDoctorName(io.readLine("Enter name of doctor following the case : "))
                        .name(io.readLine("Enter patient name                      : "))
                        .age(io.readLine("Enter patient age                       : "))
                        .gender(io.readLine("Enter patient gender                    : "))
                        .address(io.readLine("Enter patient address                   : "))
                        .roomNumber(io.readLine("Enter patient room number               : "))
                        .build();
                store.createPatient(patient);
                io.println(phrases.done("Patient added"));
            }
            case "2" -> {
                int id = readExistingId("Enter patient ID : ", "Patient", store::containsPatient);
                io.println(phrases.patientDetails(store.getPatient(id)));
            }
            case "3" -> {
                int id = readExistingId("Enter patient ID : ", "Patient", store::containsPatient);
                store.deletePatient(id);
                io.println(phrases.done("Patient data deleted"));
            }
            case "4" -> {
                int id = readExistingId("Enter patient ID : ", "Patient", store::containsPatient);
                editFields(PatientField.values(), PatientField::getLabel, "patient",
                        field -> field.get(store.getPatient(id)),
                        (field, value) -> store.updatePatientField(id, field, value));
            }
            case BACK -> {
            }
            default -> io.println(phrases.invalidChoice());
        }
    }

    private void doctorActions(HospitalDataStore store) {
        io.println(phrases.doctorMenu());
        switch (choice(phrases.choicePrompt())) {
            case "1" -> {
                int id = readNewId("Enter doctor ID : ", "Doctor", store::containsDoctor);
                DoctorInfo info = DoctorInfo.builder()
                        .department(io.readLine("Enter Doctor department : "))
                        .name(io.readLine("Enter Doctor name       : "))
                        .address(io.readLine("Enter Doctor address    : "))
                        .build();
                store.createDoctor(id, info);
                io.println(phrases.done("Doctor added"));
            }
            case "2" -> {
                int id = readExistingId("Enter doctor ID : ", "Doctor", store::containsDoctor);
                io.println(phrases.doctorDetails(store.getDoctor(id).getInfo()));
            }
            case "3" -> {
                int id = readExistingId("Enter doctor ID : ", "Doctor", store::containsDoctor);
                store.deleteDoctor(id);
                io.println(phrases.done("Doctor data deleted"));
            }
            case "4" -> {
                int id = readExistingId("Enter doctor ID : ", "Doctor", store::containsDoctor);
                editFields(DoctorField.values(), DoctorField::getLabel, "doctor's",
                        field -> field.get(store.getDoctor(id).getInfo()),
                        (field, value) -> store.updateDoctorField(id, field, value));
            }
            case BACK -> {
            }
            default -> io.println(phrases.invalidChoice());
        }
    }

    private void appointmentActions(HospitalDataStore store) {
        io.println(phrases.appointmentMenu());
        switch (choice(phrases.choicePrompt())) {
            case "1" -> bookAppointment(store);
            case "2" -> editAppointment(store);
            case "3" -> {
                int patientId = readExistingId("Enter patient ID : ", "Patient", store::containsPatient);
                try {
                    schedulingService.cancelAppointment(store, patientId);
                    io.println(phrases.done("appointment canceled"));
                } catch (AppointmentNotFoundException e) {
                    io.println(phrases.noAppointment());
                }
            }
            case BACK -> {
            }
            default -> io.println(phrases.invalidChoice());
        }
    }

    private void bookAppointment(HospitalDataStore store) {
        int doctorId = readExistingId("Enter the ID of doctor : ", "Doctor", store::containsDoctor);
        io.println(phrases.bookingPatientMenu());
        String who = choice(phrases.choicePrompt());
        if ("1".equals(who)) {
            int patientId = readExistingId("Enter patient ID : ", "Patient", store::containsPatient);
            String start = readStart(store, doctorId, phrases.startPrompt());
            String end = io.readLine(phrases.endPrompt());
            schedulingService.bookAppointment(store, doctorId, patientId, start, end);
        } else if ("2".equals(who)) {
            int patientId = readNewId("Enter patient ID : ", "Patient", store::containsPatient);
            Patient details = Patient.builder()
                    .id(patientId)
                    .name(io.readLine("Enter patient name    : "))
                    .age(io.readLine("Enter patient age     : "))
                    .gender(io.readLine("Enter patient gender  : "))
                    .address(io.readLine("Enter patient address : "))
                    .build();
            String start = readStart(store, doctorId, phrases.startPrompt());
            String end = io.readLine(phrases.endPrompt());
            schedulingService.bookForNewPatient(store, doctorId, details, start, end);
        } else {
            if (!BACK.equals(who)) {
                io.println(phrases.invalidChoice());
            }
            return;
        }
        io.println(phrases.done("Appointment booked"));
    }

    private void editAppointment(HospitalDataStore store) {
        int patientId = readExistingId("Enter patient ID : ", "Patient", store::containsPatient);
        AppointmentLocation location;
        try {
            location = schedulingService.findAppointmentByPatient(store, patientId);
        } catch (AppointmentNotFoundException e) {
            io.println(phrases.noAppointment());
            return;
        }
        String start = readStart(store, location.doctorId(), "Please enter the new start time : ");
        String end = io.readLine("Please enter the new end time : ");
        schedulingService.editAppointment(store, patientId, start, end);
        io.println(phrases.done("appointment edited"));
    }

    // =========================================================
    // USER
    // =========================================================
    private void userMode(HospitalDataStore store) {
        while (true) {
            io.println(phrases.userMenu());
            switch (choice(phrases.choicePrompt())) {
                case "1" -> {
                    io.println("Hospital's departments :");
                    directoryService.departments(store).forEach(d -> io.println("\t" + d));
                }
                case "2" -> {
                    io.println("Hospital's doctors :");
                    directoryService.doctors(store).forEach(d -> io.println(phrases.doctorLine(d)));
                }
                case "3" -> directoryService.residents(store).forEach(p -> io.println(phrases.residentLine(p)));
                case "4" -> {
                    int id = readExistingId("Enter patient's ID : ", "Patient", store::containsPatient);
                    io.println(phrases.patientDetails(directoryService.patientDetails(store, id)));
                }
                case "5" -> {
                    int id = readExistingId("Enter doctor's ID : ", "Doctor", store::containsDoctor);
                    io.println(store.getDoctor(id).getInfo().getName() + " has appointments :");
                    for (Appointment a : directoryService.appointmentsOf(store, id)) {
                        io.println(phrases.appointmentLine(a));
                    }
                }
                case BACK -> {
                    return;
                }
                default -> io.println(phrases.invalidChoice());
            }
        }
    }

    // =========================================================
    // INPUT HELPERS
    // =========================================================
    private String choice(String prompt) {
        return StringUtils.upperCase(StringUtils.strip(io.readLine(prompt)));
    }

    private int readInt(String prompt, String what) {
        while (true) {
            String raw = io.readLine(prompt);
            try {
                return Integer.parseInt(StringUtils.strip(raw));
            } catch (NumberFormatException e) {
                io.println(phrases.notAnInteger(what));
            }
        }
    }

    private int readNewId(String prompt, String what, IntPredicate taken) {
        int id = readInt(prompt, what);
        while (taken.test(id)) {
            id = readInt(phrases.idUnavailable(), what);
        }
        return id;
    }

    private int readExistingId(String prompt, String what, IntPredicate exists) {
        int id = readInt(prompt, what);
        while (!exists.test(id)) {
            id = readInt(phrases.idIncorrect(StringUtils.lowerCase(what)), what);
        }
        return id;
    }

    private String readStart(HospitalDataStore store, int doctorId, String prompt) {
        String start = io.readLine(prompt);
        while (true) {
            try {
                schedulingService.validateStart(store, doctorId, start);
                return start;
            } catch (InvalidTimeWindowException e) {
                start = io.readLine(phrases.outsideWorkingHours());
            } catch (AppointmentConflictException e) {
                start = io.readLine(phrases.alreadyBooked());
            }
        }
    }

    private <F extends Enum<F>> void editFields(F[] fields, Function<F, String> label, String what,
                                                Function<F, String> current, BiConsumer<F, String> update) {
        List<String> labels = Arrays.stream(fields).map(label).toList();
        while (true) {
            io.println(phrases.fieldMenu(what, labels));
            String option = choice(phrases.choicePrompt());
            if (BACK.equals(option)) {
                return;
            }
            int index = NumberUtils.toInt(option, 0) - 1;
            if (index < 0 || index >= fields.length) {
                io.println(phrases.invalidChoice());
                continue;
            }
            io.println(phrases.currentValue(labels.get(index), current.apply(fields[index])));
            try {
                update.accept(fields[index], io.readLine("Enter " + what + " " + labels.get(index) + " : "));
                io.println(phrases.done(labels.get(index) + " edited"));
            } catch (HospitalDataException e) {
                log.warn("Edit failed: {}", e.getMessage());
                io.println(e.getMessage());
            }
        }
    }
}
