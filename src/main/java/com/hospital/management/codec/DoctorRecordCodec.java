package com.hospital.management.codec;

import com.hospital.management.entity.Appointment;
import com.hospital.management.entity.Doctor;
import com.hospital.management.entity.DoctorEntry;
import com.hospital.management.entity.DoctorInfo;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Doctors file: one line per doctor, {@code id;department;name;address;} followed by any number
 * of {@code patientId;start;end;} triples.
 */
@Component
public class DoctorRecordCodec implements RecordCodec<Doctor> {

    private static final Logger log = LoggerFactory.getLogger(DoctorRecordCodec.class);

    private static final String DOUBLED_SEPARATOR = ";;";
    private static final String SEPARATOR = ";";

    @Override
    public Map<Integer, Doctor> decode(String raw) {
        String text = collapseDoubledSeparators(raw);
        Map<Integer, Doctor> doctors = new LinkedHashMap<>();
        LineScanner line = new LineScanner(doctors);

        for (int i = 0; i < text.length(); i++) {
            line.accept(text.charAt(i));
        }

        if (!line.isAtLineStart()) {
            log.debug("Doctors file does not end with a newline (stopped in {})", line.state);
        }
        return doctors;
    }

    @Override
    public String encode(Map<Integer, Doctor> doctors) {
        StringBuilder out = new StringBuilder();
        for (Map.Entry<Integer, Doctor> entry : doctors.entrySet()) {
            RecordTokens.appendFields(out, entry.getKey());
            for (DoctorEntry item : entry.getValue().entries()) {
                if (item instanceof DoctorInfo info) {
                    RecordTokens.appendFields(out, info.getDepartment(), info.getName(), info.getAddress());
                } else if (item instanceof Appointment appointment) {
                    RecordTokens.appendFields(out, appointment.patientId(), appointment.start(), appointment.end());
                }
            }
            out.append(RECORD_TERMINATOR);
        }
        return out.toString();
    }

    /**
     * Replaces ";;" with ";" until none is left. Two adjacent empty columns therefore merge
     * into one, which shifts every following column of the line.
     */
    static String collapseDoubledSeparators(String text) {
        String collapsed = text;
        while (collapsed.contains(DOUBLED_SEPARATOR)) {
            collapsed = StringUtils.replace(collapsed, DOUBLED_SEPARATOR, SEPARATOR);
        }
        return collapsed;
    }

    /**
     * Scanner state for the line currently being read.
     */
    private static final class LineScanner {

        private final Map<Integer, Doctor> doctors;
        private final StringBuilder buffer = new StringBuilder();

        private DoctorParseState state = DoctorParseState.DOCTOR_ID;
        private String doctorId;
        private String department;
        private String name;
        private Doctor current;
        private String patientId;
        private String start;

        LineScanner(Map<Integer, Doctor> doctors) {
            this.doctors = doctors;
        }

        void accept(char c) {
            if (c == RECORD_TERMINATOR && state.acceptsEndOfLine()) {
                endOfLine();
                return;
            }
            if (c != FIELD_SEPARATOR) {
                buffer.append(c);
                return;
            }
            String value = RecordTokens.take(buffer);
            switch (state) {
                case DOCTOR_ID -> {
                    doctorId = value;
                    state = DoctorParseState.DEPARTMENT;
                }
                case DEPARTMENT -> {
                    department = value;
                    state = DoctorParseState.NAME;
                }
                case NAME -> {
                    name = value;
                    state = DoctorParseState.ADDRESS;
                }
                case ADDRESS -> {
                    commitHeader(value);
                    state = DoctorParseState.PATIENT_ID;
                }
                case PATIENT_ID -> {
                    patientId = value;
                    state = DoctorParseState.START;
                }
                case START -> {
                    start = value;
                    state = DoctorParseState.END;
                }
                case END -> {
                    current.addAppointment(new Appointment(
                            RecordTokens.parseId("appointment patient id", patientId), start, value));
                    patientId = null;
                    start = null;
                    state = DoctorParseState.PATIENT_ID;
                }
            }
        }

        boolean isAtLineStart() {
            return state == DoctorParseState.DOCTOR_ID && buffer.length() == 0;
        }

        private void commitHeader(String address) {
            int id = RecordTokens.parseId("doctor id", doctorId);
            current = new Doctor(id, DoctorInfo.builder()
                    .department(department)
                    .name(name)
                    .address(address)
                    .build());
            doctors.put(id, current);
        }

        /**
         * A triple cut short by the newline is dropped with the rest of the line state.
         */
        private void endOfLine() {
            if (state == DoctorParseState.END || buffer.length() > 0) {
                log.debug("Dropping incomplete appointment at end of line for doctor {}",
                        current == null ? doctorId : current.getId());
            }
            buffer.setLength(0);
            doctorId = null;
            department = null;
            name = null;
            current = null;
            patientId = null;
            start = null;
            state = DoctorParseState.DOCTOR_ID;
        }
    }
}
