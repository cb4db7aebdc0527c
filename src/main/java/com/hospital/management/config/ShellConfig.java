package com.hospital.management.config;

import com.hospital.management.shell.ConsoleIO;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ShellConfig {

    @Bean
    ConsoleIO consoleIO() {
        return new ConsoleIO(System.in, System.out);
    }
}
