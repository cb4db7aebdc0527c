package com.hospital.management.entity;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public final class DoctorInfo implements DoctorEntry {

    @Builder.Default
    private String department = "";

    @Builder.Default
    private String name = "";

    @Builder.Default
    private String address = "";
}
