package com.example.magazinetoc.output;

import java.io.IOException;

/**
 * Destination of the rendered reports of a run.
 */
public interface OutputSink {

    void write(String content) throws IOException;

    String describe();
}
