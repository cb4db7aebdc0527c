package com.hospital.management.entity;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Editable patient columns, in file order after the id.
 */
public enum PatientField {
    DEPARTMENT("department", Patient::getDepartment, Patient::setDepartment),
    ATTENDING_DOCTOR_NAME("doctor following the case", Patient::getAttendingDoctorName, Patient::setAttendingDoctorName),
    NAME("name", Patient::getName, Patient::setName),
    AGE("age", Patient::getAge, Patient::setAge),
    GENDER("gender", Patient::getGender, Patient::setGender),
    ADDRESS("address", Patient::getAddress, Patient::setAddress),
    ROOM_NUMBER("room number", Patient::getRoomNumber, Patient::setRoomNumber);

    private final String label;
    private final Function<Patient, String> getter;
    private final BiConsumer<Patient, String> setter;

    PatientField(String label, Function<Patient, String> getter, BiConsumer<Patient, String> setter) {
        this.label = label;
        this.getter = getter;
        this.setter = setter;
    }

    public String getLabel() {
        return label;
    }

    public String get(Patient patient) {
        return getter.apply(patient);
    }

    public void set(Patient patient, String value) {
        setter.accept(patient, value);
    }
}
