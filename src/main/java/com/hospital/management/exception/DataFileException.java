package com.hospital.management.exception;

import java.io.IOException;
import java.nio.file.Path;

public class DataFileException extends HospitalDataException {

    public DataFileException(String action, Path file, IOException cause) {
        super("Could not " + action + " " + file + ": " + cause.getMessage(), cause);
    }
}
