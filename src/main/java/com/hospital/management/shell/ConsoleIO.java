package com.hospital.management.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented console used by the shell. Tests drive it with scripted input.
 */
public class ConsoleIO {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleIO(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    public void println(String text) {
        out.println(text);
    }

    /**
     * @throws InputClosedException when the input has no more lines
     */
    public String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (line == null) {
            throw new InputClosedException();
        }
        return line;
    }

    public static class InputClosedException extends RuntimeException {
        public InputClosedException() {
            super("Console input closed");
        }
    }
}
