package com.hospital.management.codec;

/**
 * States of the doctors file scanner.
 * The four header columns are followed by a repeating patient id / start / end triple.
 */
public enum DoctorParseState {
    DOCTOR_ID,
    DEPARTMENT,
    NAME,
    ADDRESS,
    PATIENT_ID,
    START,
    END;

    /**
     * Only the states where a new triple may begin or where one may end can close a line;
     * anywhere else a newline is kept as part of the value.
     */
    public boolean acceptsEndOfLine() {
        return this == PATIENT_ID || this == END;
    }
}
