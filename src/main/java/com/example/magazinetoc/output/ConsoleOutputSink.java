package com.example.magazinetoc.output;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes reports to a console stream as UTF-8, whatever the platform charset is,
 * so bullets and dashes survive a C/POSIX locale.
 */
public class ConsoleOutputSink implements OutputSink {

    private final PrintStream out;

    public ConsoleOutputSink(OutputStream out) {
        this.out = new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    @Override
    public void write(String content) {
        out.print(content);
        out.flush();
    }

    @Override
    public String describe() {
        return "stdout";
    }
}
