package com.q2galaxy.writer;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Opens the output a generated tool is written to. The stream is closed by {@link ToolWriter}.
 */
@FunctionalInterface
public interface ToolSink {

    OutputStream open() throws IOException;
}
