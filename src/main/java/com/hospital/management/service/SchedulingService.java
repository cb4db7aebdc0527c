package com.hospital.management.service;

import com.hospital.management.component.HospitalDataStore;
import com.hospital.management.config.HospitalProperties;
import com.hospital.management.dto.AppointmentLocation;
import com.hospital.management.entity.Appointment;
import com.hospital.management.entity.Doctor;
import com.hospital.management.entity.Patient;
import com.hospital.management.exception.AppointmentConflictException;
import com.hospital.management.exception.AppointmentNotFoundException;
import com.hospital.management.exception.DuplicateKeyException;
import com.hospital.management.exception.InvalidTimeWindowException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Booking, editing and cancelling appointments on a {@link HospitalDataStore}.
 * <p>
 * Only the start time is checked: it must not begin with a rejected hour prefix and must not
 * fall inside [start, end) of an appointment already on the doctor's line. The end time is
 * taken as given. Patient ids are not checked against the patient collection.
 */
@Service
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    private final List<String> rejectedStartPrefixes;
    private final TimeComparison timeComparison;

    @Autowired
    public SchedulingService(HospitalProperties properties) {
        this(properties.getScheduling().getRejectedStartPrefixes(), properties.getScheduling().getTimeComparison());
    }

    public SchedulingService(List<String> rejectedStartPrefixes, TimeComparison timeComparison) {
        this.rejectedStartPrefixes = List.copyOf(rejectedStartPrefixes);
        this.timeComparison = timeComparison;
    }

    // =========================================================
    // BOOK
    // =========================================================
    public Appointment bookAppointment(HospitalDataStore store, int doctorId, int patientId, String start, String end) {
        Doctor doctor = validateStart(store, doctorId, start);
        Appointment appointment = new Appointment(patientId, start, end);
        doctor.addAppointment(appointment);
        log.info("Booked patient {} with doctor {} from {} to {}", patientId, doctorId, start, end);
        return appointment;
    }

    /**
     * Books for a patient who is not on file yet. The new patient is an outpatient: department
     * and attending doctor come from the doctor's header, room number is empty.
     */
    public Appointment bookForNewPatient(HospitalDataStore store, int doctorId, Patient details, String start, String end) {
        if (store.containsPatient(details.getId())) {
            throw new DuplicateKeyException("Patient", details.getId());
        }
        Doctor doctor = validateStart(store, doctorId, start);
        Patient outpatient = details.toBuilder()
                .department(doctor.getInfo().getDepartment())
                .attendingDoctorName(doctor.getInfo().getName())
                .roomNumber("")
                .build();
        store.createPatient(outpatient);
        return bookAppointment(store, doctorId, outpatient.getId(), start, end);
    }

    /**
     * Runs the booking checks for a start time without booking anything, so a caller can ask
     * again for the start before asking for the end.
     *
     * @return the doctor the start time was checked against
     */
    public Doctor validateStart(HospitalDataStore store, int doctorId, String start) {
        Doctor doctor = store.getDoctor(doctorId);
        String token = StringUtils.defaultString(start);
        checkWorkingHours(token);
        checkConflicts(doctor, token);
        return doctor;
    }

    // =========================================================
    // LOOKUP
    // =========================================================

    /**
     * First appointment held for the patient, scanning doctors in collection order and each
     * doctor's appointments in booking order. When a patient is booked with several doctors,
     * which one is found depends on that order alone.
     */
    public AppointmentLocation findAppointmentByPatient(HospitalDataStore store, int patientId) {
        for (Map.Entry<Integer, Doctor> entry : store.doctors().entrySet()) {
            List<Appointment> appointments = entry.getValue().getAppointments();
            for (int i = 0; i < appointments.size(); i++) {
                if (appointments.get(i).patientId() == patientId) {
                    return new AppointmentLocation(entry.getKey(), i);
                }
            }
        }
        throw new AppointmentNotFoundException(patientId);
    }

    // =========================================================
    // EDIT
    // =========================================================

    /**
     * The new start is checked against every appointment of the owning doctor, the one being
     * edited included.
     */
    public Appointment editAppointment(HospitalDataStore store, int patientId, String newStart, String newEnd) {
        AppointmentLocation location = findAppointmentByPatient(store, patientId);
        Doctor doctor = validateStart(store, location.doctorId(), newStart);
        Appointment updated = doctor.getAppointments().get(location.index()).reschedule(newStart, newEnd);
        doctor.replaceAppointment(location.index(), updated);
        log.info("Moved appointment of patient {} with doctor {} to {}-{}",
                patientId, location.doctorId(), newStart, newEnd);
        return updated;
    }

    // =========================================================
    // CANCEL
    // =========================================================
    public Appointment cancelAppointment(HospitalDataStore store, int patientId) {
        AppointmentLocation location = findAppointmentByPatient(store, patientId);
        Appointment removed = store.getDoctor(location.doctorId()).removeAppointment(location.index());
        log.info("Cancelled appointment of patient {} with doctor {} ({}-{})",
                patientId, location.doctorId(), removed.start(), removed.end());
        return removed;
    }

    private void checkWorkingHours(String start) {
        for (String prefix : rejectedStartPrefixes) {
            if (StringUtils.startsWith(start, prefix)) {
                log.debug("Rejected start {} (prefix {})", start, prefix);
                throw new InvalidTimeWindowException(start);
            }
        }
    }

    private void checkConflicts(Doctor doctor, String start) {
        for (Appointment existing : doctor.getAppointments()) {
            if (timeComparison.within(start, existing.start(), existing.end())) {
                log.debug("Start {} collides with {}-{} on doctor {}",
                        start, existing.start(), existing.end(), doctor.getId());
                throw new AppointmentConflictException(doctor.getId(), start, existing);
            }
        }
    }
}
