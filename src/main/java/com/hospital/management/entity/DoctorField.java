package com.hospital.management.entity;

import java.util.function.BiConsumer;
import java.util.function.Function;

public enum DoctorField {
    DEPARTMENT("department", DoctorInfo::getDepartment, DoctorInfo::setDepartment),
    NAME("name", DoctorInfo::getName, DoctorInfo::setName),
    ADDRESS("address", DoctorInfo::getAddress, DoctorInfo::setAddress);

    private final String label;
    private final Function<DoctorInfo, String> getter;
    private final BiConsumer<DoctorInfo, String> setter;

    DoctorField(String label, Function<DoctorInfo, String> getter, BiConsumer<DoctorInfo, String> setter) {
        this.label = label;
        this.getter = getter;
        this.setter = setter;
    }

    public String getLabel() {
        return label;
    }

    public String get(DoctorInfo info) {
        return getter.apply(info);
    }

    public void set(DoctorInfo info, String value) {
        setter.accept(info, value);
    }
}
