package com.q2galaxy.writer;

import com.q2galaxy.config.GalaxyConfig;
import com.q2galaxy.tooltree.ToolNode;
import com.q2galaxy.tooltree.order.CanonicalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Writes assembled tool documents to files. Single attempt: I/O failures propagate unchanged and a partially
 * written file is left as the stream's close left it.
 */
public final class ToolWriter {

    private static final Logger log = LoggerFactory.getLogger(ToolWriter.class);

    private final ToolDocumentAssembler assembler;
    private final ToolMetadata metadata;
    private final Path outputDir;

    /** Writer whose file names resolve against the working directory. */
    public ToolWriter(ToolDocumentAssembler assembler, ToolMetadata metadata) {
        this(assembler, metadata, Path.of(""));
    }

    public ToolWriter(ToolDocumentAssembler assembler, ToolMetadata metadata, Path outputDir) {
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    /** Writer using the metadata, indentation and output directory from {@code config} and the system clock. */
    public static ToolWriter fromConfig(GalaxyConfig config) {
        return new ToolWriter(
                new ToolDocumentAssembler(CanonicalOrder.TOOL, Clock.systemDefaultZone(), config.getIndent()),
                ToolMetadata.fromConfig(config),
                Path.of(config.getOutputDir()));
    }

    public ToolMetadata getMetadata() {
        return metadata;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Writes {@code tool} to {@code fileName} inside the output directory. The directory is not created.
     *
     * @return the path written
     * @throws IllegalArgumentException if {@code fileName} resolves outside the output directory
     * @throws IOException if the file cannot be opened or written
     */
    public Path write(ToolNode tool, String fileName) throws IOException {
        Objects.requireNonNull(fileName, "fileName");
        Path base = outputDir.toAbsolutePath().normalize();
        Path target = base.resolve(fileName).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new IllegalArgumentException("File name must name a file inside " + outputDir + ": " + fileName);
        }
        write(tool, target);
        return target;
    }

    /**
     * Assembles {@code tool} and writes it to {@code path}, creating or truncating the file.
     *
     * @throws IOException if the file cannot be opened or written
     */
    public void write(ToolNode tool, Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        log.info("Writing tool {} to {}", tool.getAttribute("id"), path);
        write(tool, () -> Files.newOutputStream(path));
    }

    /**
     * Assembles {@code tool} and writes it to the stream opened by {@code sink}; the stream is closed on every path.
     * Nothing is opened when assembly fails.
     *
     * @throws IOException from opening, writing or closing the stream
     */
    public void write(ToolNode tool, ToolSink sink) throws IOException {
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(sink, "sink");
        byte[] bytes = assembler.assemble(tool, metadata);
        try (OutputStream out = sink.open()) {
            out.write(bytes);
        }
        log.debug("Wrote {} bytes for tool {}", bytes.length, tool.getAttribute("id"));
    }
}
