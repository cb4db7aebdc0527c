package com.hospital.management.codec;

/**
 * States of the patients file scanner, one per column.
 * Every column ends on ';' except the room number, which runs to the end of the line.
 */
public enum PatientParseState {
    PATIENT_ID,
    DEPARTMENT,
    DOCTOR_NAME,
    NAME,
    AGE,
    GENDER,
    ADDRESS,
    ROOM_NUMBER;

    public boolean isTerminatedBy(char c) {
        return this == ROOM_NUMBER ? c == RecordCodec.RECORD_TERMINATOR : c == RecordCodec.FIELD_SEPARATOR;
    }

    public boolean isLast() {
        return this == ROOM_NUMBER;
    }

    public PatientParseState next() {
        return isLast() ? PATIENT_ID : values()[ordinal() + 1];
    }
}
