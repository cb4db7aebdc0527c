package com.hospital.management.config;

import com.hospital.management.service.TimeComparison;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "hospital")
public class HospitalProperties {

    private Files files = new Files();
    private Scheduling scheduling = new Scheduling();
    private Shell shell = new Shell();

    @Data
    public static class Files {
        private String patients = "Patients_DataBase.csv";
        private String doctors = "Doctors_DataBase.csv";
    }

    @Data
    public static class Scheduling {
        /** Start times beginning with one of these are refused (plain prefix test). */
        private List<String> rejectedStartPrefixes = new ArrayList<>(List.of("11", "12"));
        private TimeComparison timeComparison = TimeComparison.LEXICOGRAPHIC;
    }

    @Data
    public static class Shell {
        private boolean enabled = true;
    }
}
