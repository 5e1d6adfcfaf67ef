package com.q2galaxy.writer;

import com.q2galaxy.config.GalaxyConfig;
import com.q2galaxy.tooltree.ToolNode;
import com.q2galaxy.tooltree.order.CanonicalOrder;
import com.q2galaxy.tooltree.order.UnknownSectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolWriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2021-06-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final ToolWriter writer = new ToolWriter(
            new ToolDocumentAssembler(CanonicalOrder.TOOL, CLOCK, 4),
            ToolMetadata.of("2021.8.0", "2021.8.0"));

    private static ToolNode tool() {
        return ToolNode.builder("tool")
                .attribute("id", "qiime2__demo__action")
                .child(ToolNode.of("inputs", null, Map.of("name", "x")))
                .child(ToolNode.of("description", "Do a thing", Map.of()))
                .build();
    }

    @Test
    void write_createsFileWithAssembledBytes() throws Exception {
        Path file = tempDir.resolve("qiime2__demo__action.xml");

        writer.write(tool(), file);

        String xml = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<!--\nCopyright (c) 2021"), xml);
        assertTrue(xml.indexOf("<description>") < xml.indexOf("<inputs"));
        assertTrue(xml.contains("<tool id=\"qiime2__demo__action\" profile=\"20.09\" license=\"BSD-3-Clause\">"), xml);
    }

    @Test
    void write_overwritesExistingFile() throws Exception {
        Path file = tempDir.resolve("tool.xml");
        Files.writeString(file, "stale content that is longer than nothing".repeat(100));

        writer.write(tool(), file);

        assertFalse(Files.readString(file).contains("stale"));
    }

    @Test
    void write_missingDirectoryPropagatesIoException() {
        Path file = tempDir.resolve("missing").resolve("tool.xml");

        assertThrows(NoSuchFileException.class, () -> writer.write(tool(), file));
    }

    @Test
    void write_closesStreamWhenWriteFails() {
        AtomicBoolean closed = new AtomicBoolean();
        IOException failure = new IOException("disk full");
        OutputStream failing = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw failure;
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                throw failure;
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };

        IOException thrown = assertThrows(IOException.class, () -> writer.write(tool(), () -> failing));

        assertSame(failure, thrown);
        assertTrue(closed.get());
    }

    @Test
    void write_doesNotOpenSinkWhenAssemblyFails() {
        AtomicBoolean opened = new AtomicBoolean();
        ToolNode bad = ToolNode.builder("tool").child(ToolNode.builder("foobar").build()).build();

        assertThrows(UnknownSectionException.class, () -> writer.write(bad, () -> {
            opened.set(true);
            return new ByteArrayOutputStream();
        }));
        assertFalse(opened.get());
    }

    @Test
    void write_fileNameResolvesAgainstOutputDir() throws Exception {
        ToolWriter inDir = new ToolWriter(
                new ToolDocumentAssembler(CanonicalOrder.TOOL, CLOCK, 4),
                ToolMetadata.of("2021.8.0", "2021.8.0"),
                tempDir);

        Path written = inDir.write(tool(), "qiime2__demo__action.xml");

        assertEquals(tempDir.toAbsolutePath().normalize().resolve("qiime2__demo__action.xml"), written);
        assertTrue(Files.readString(written).contains("<tool id=\"qiime2__demo__action\""));
    }

    @Test
    void write_fileNameOutsideOutputDirIsRejected() {
        ToolWriter inDir = new ToolWriter(
                new ToolDocumentAssembler(CanonicalOrder.TOOL, CLOCK, 4),
                ToolMetadata.of("2021.8.0", "2021.8.0"),
                tempDir.resolve("tools"));

        assertThrows(IllegalArgumentException.class, () -> inDir.write(tool(), "../escaped.xml"));
        assertFalse(Files.exists(tempDir.resolve("escaped.xml")));
    }

    @Test
    void fromConfig_writesIntoConfiguredOutputDir() throws Exception {
        Path outputDir = Files.createDirectory(tempDir.resolve("galaxy-tools"));
        GalaxyConfig config = GalaxyConfig.fromMap(Map.of("Q2GALAXY_OUTPUT_DIR", outputDir.toString()));
        ToolWriter configured = ToolWriter.fromConfig(config);

        Path written = configured.write(tool(), "tool.xml");

        assertEquals(outputDir, configured.getOutputDir());
        assertTrue(Files.exists(outputDir.resolve("tool.xml")));
        assertEquals(outputDir.toAbsolutePath().normalize().resolve("tool.xml"), written);
    }

    @Test
    void fromConfig_usesConfiguredMetadataAndIndent() throws Exception {
        GalaxyConfig config = GalaxyConfig.fromMap(Map.of(
                "Q2GALAXY_VERSION", "2022.2.0",
                "Q2GALAXY_TARGET_VERSION", "2022.2.1",
                "Q2GALAXY_INDENT", "2"));
        ToolWriter configured = ToolWriter.fromConfig(config);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        configured.write(tool(), () -> out);

        String xml = out.toString(StandardCharsets.UTF_8);
        assertEquals("2022.2.0", configured.getMetadata().generatorVersion());
        assertTrue(xml.contains("    q2galaxy (version: 2022.2.0)\nfor:\n    qiime2 (version: 2022.2.1)\n"), xml);
        assertTrue(xml.contains("\n  <description>Do a thing</description>"), xml);
    }
}
