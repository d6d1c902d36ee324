package com.example.magazinetoc.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes reports to a file: the first write of a run truncates it, later ones append.
 */
public class FileOutputSink implements OutputSink {

    private final Path target;
    private boolean started;

    public FileOutputSink(Path target) {
        this.target = target;
    }

    @Override
    public void write(String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (started) {
            Files.writeString(target, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else {
            Files.writeString(target, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            started = true;
        }
    }

    @Override
    public String describe() {
        return target.toString();
    }
}
