package com.raditha.livediff.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for error handling, exit codes and help generation.
 */
class ErrorHandlingTest {

    private static final String MASTER = "src/test/resources/dumps/debug_master.txt";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testUnknownOption() {
        int exitCode = LiveDiffCLI.execute("--invalid-option", MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
        String errorOutput = errContent.toString();
        assertTrue(errorOutput.contains("Unknown option") || errorOutput.contains("Unmatched argument"),
                "Error message should indicate unknown option");
    }

    @Test
    void testMissingPositional() {
        int exitCode = LiveDiffCLI.execute(MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
        assertTrue(errContent.toString().contains("Missing required parameter"));
    }

    @Test
    void testInvalidNumber() {
        int exitCode = LiveDiffCLI.execute("--max-changed-vars-per-block", "lots", MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
        assertTrue(errContent.toString().contains("lots"));
    }

    @Test
    void testNegativeCap() {
        int exitCode = LiveDiffCLI.execute("--max-changed-vars-per-block", "-5", MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
        assertTrue(errContent.toString().contains("Configuration error"));
    }

    @Test
    void testMinusOneCapIsRejected() {
        int exitCode = LiveDiffCLI.execute("--max-changed-vars-per-block", "-1", MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
        assertTrue(errContent.toString().contains("max-changed-vars-per-block must be >= 0, got: -1"));
        assertEquals("", outContent.toString());

        errContent.reset();
        assertEquals(LiveDiffCLI.EXIT_USAGE, LiveDiffCLI.execute("--max-only-vars", "-1", MASTER, MASTER));
        assertTrue(errContent.toString().contains("max-only-vars must be >= 0, got: -1"));
    }

    @Test
    void testInvalidFormat() {
        int exitCode = LiveDiffCLI.execute("--format", "xml", MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
    }

    @Test
    void testInvalidExportFormat() {
        int exitCode = LiveDiffCLI.execute("--export", "xml", MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
        assertTrue(errContent.toString().contains("Export format"));
    }

    @Test
    void testMissingConfigFile() {
        int exitCode = LiveDiffCLI.execute("--config-file", tempDir.resolve("nope.yml").toString(), MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
        assertTrue(errContent.toString().contains("Config file not found"));
    }

    @Test
    void testMissingInputFile() {
        int exitCode = LiveDiffCLI.execute(MASTER, tempDir.resolve("debug_missing.txt").toString());

        assertEquals(LiveDiffCLI.EXIT_IO, exitCode);
        assertTrue(errContent.toString().contains("I/O error"));
        assertEquals("", outContent.toString(), "No partial report on unreadable input");
    }

    @Test
    void testMalformedConfigFile() throws Exception {
        Path config = tempDir.resolve("bad.yml");
        Files.writeString(config, "live_dump_diff:\n  max_only_vars_shown: many\n");

        int exitCode = LiveDiffCLI.execute("--config-file", config.toString(), MASTER, MASTER);

        assertEquals(LiveDiffCLI.EXIT_USAGE, exitCode);
    }

    @Test
    void testHelp() {
        int exitCode = LiveDiffCLI.execute("--help");

        assertEquals(0, exitCode);
        String helpOutput = outContent.toString();
        assertTrue(helpOutput.contains("Usage: livediff"));
        assertTrue(helpOutput.contains("--max-changed-vars-per-block"));
        assertTrue(helpOutput.contains("--format"));
    }

    @Test
    void testVersion() {
        int exitCode = LiveDiffCLI.execute("--version");

        assertEquals(0, exitCode);
        assertTrue(outContent.toString().contains("livediff v1.0.0"));
    }
}
