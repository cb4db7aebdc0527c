package com.hospital.management.entity;

import lombok.*;

/**
 * One line of the patients file. Age is kept verbatim as text.
 * The attending doctor is a free-text name, not a reference to a doctor id.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class Patient {

    @Setter(AccessLevel.NONE)
    private int id;

    @Builder.Default
    private String department = "";

    @Builder.Default
    private String attendingDoctorName = "";

    @Builder.Default
    private String name = "";

    @Builder.Default
    private String age = "";

    @Builder.Default
    private String gender = "";

    @Builder.Default
    private String address = "";

    /** Empty for outpatients. */
    @Builder.Default
    private String roomNumber = "";
}
