package com.hospital.management.codec;

import com.hospital.management.entity.Patient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Patients file: one record per line, eight columns
 * {@code id;department;doctorName;name;age;gender;address;roomNumber\n}.
 */
@Component
public class PatientRecordCodec implements RecordCodec<Patient> {

    private static final Logger log = LoggerFactory.getLogger(PatientRecordCodec.class);

    @Override
    public Map<Integer, Patient> decode(String text) {
        Map<Integer, Patient> patients = new LinkedHashMap<>();
        PatientParseState state = PatientParseState.PATIENT_ID;
        StringBuilder buffer = new StringBuilder();
        List<String> columns = new ArrayList<>(PatientParseState.values().length);

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!state.isTerminatedBy(c)) {
                buffer.append(c);
                continue;
            }
            columns.add(RecordTokens.take(buffer));
            if (state.isLast()) {
                Patient patient = assemble(columns);
                patients.put(patient.getId(), patient);
                columns.clear();
            }
            state = state.next();
        }

        if (state != PatientParseState.PATIENT_ID || buffer.length() > 0) {
            log.debug("Dropping unterminated trailing patient record (stopped in {})", state);
        }
        return patients;
    }

    @Override
    public String encode(Map<Integer, Patient> patients) {
        StringBuilder out = new StringBuilder();
        for (Map.Entry<Integer, Patient> entry : patients.entrySet()) {
            Patient p = entry.getValue();
            RecordTokens.appendFields(out, entry.getKey(), p.getDepartment(), p.getAttendingDoctorName(),
                    p.getName(), p.getAge(), p.getGender(), p.getAddress());
            out.append(p.getRoomNumber()).append(RECORD_TERMINATOR);
        }
        return out.toString();
    }

    private static Patient assemble(List<String> columns) {
        return Patient.builder()
                .id(RecordTokens.parseId("patient id", columns.get(0)))
                .department(columns.get(1))
                .attendingDoctorName(columns.get(2))
                .name(columns.get(3))
                .age(columns.get(4))
                .gender(columns.get(5))
                .address(columns.get(6))
                .roomNumber(columns.get(7))
                .build();
    }
}
