package com.calc.console;

import com.calc.exception.CalculatorException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Console backed by standard streams.
 */
public class TerminalConsole implements Console {

    private final BufferedReader reader;
    private final PrintStream out;

    public TerminalConsole() {
        this(System.in, System.out);
    }

    public TerminalConsole(InputStream in, PrintStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public String readLine() {
        // Prompt is printed without a newline
        out.flush();
        try {
            String line = reader.readLine();
            return line == null ? null : line.trim();
        } catch (IOException e) {
            throw new CalculatorException("Failed to read from console", e);
        }
    }

    @Override
    public void print(String text) {
        out.print(text);
    }

    @Override
    public void println(String text) {
        out.println(text);
    }
}
