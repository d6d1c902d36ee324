package com.example.magazinetoc.output;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleOutputSinkTest {

    @Test
    void writesUtf8EvenThroughAnAsciiStream() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream asciiConsole = new PrintStream(bytes, true, StandardCharsets.US_ASCII);

        new ConsoleOutputSink(asciiConsole).write("• Transitions (p. 20) — James Marcus\n");

        assertThat(bytes.toByteArray())
                .isEqualTo("• Transitions (p. 20) — James Marcus\n".getBytes(StandardCharsets.UTF_8));
    }
}
