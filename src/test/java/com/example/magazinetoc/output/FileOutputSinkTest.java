package com.example.magazinetoc.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileOutputSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void firstWriteTruncatesLaterWritesAppend() throws Exception {
        Path target = tempDir.resolve("reports/toc.txt");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "old");

        FileOutputSink sink = new FileOutputSink(target);
        sink.write("one\n");
        sink.write("two\n");

        assertThat(Files.readString(target)).isEqualTo("one\ntwo\n");
    }

    @Test
    void createsMissingParentDirectories() throws Exception {
        Path target = tempDir.resolve("a/b/toc.json");

        new FileOutputSink(target).write("[]\n");

        assertThat(Files.readString(target)).isEqualTo("[]\n");
    }
}
