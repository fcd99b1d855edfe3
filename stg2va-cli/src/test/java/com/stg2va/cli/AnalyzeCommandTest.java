package com.stg2va.cli;

import com.stg2va.Stg2VaCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@code analyze} command.
 */
@DisplayName("stg2va analyze")
class AnalyzeCommandTest {

    private static final String CHOICE = """
        .model choice
        .inputs a
        .outputs b c
        .graph
        p0 a+/1 a+/2
        a+/1 b+
        a+/2 c+
        b+ a-/1
        c+ a-/2
        a-/1 b-
        a-/2 c-
        b- p0
        c- p0
        .marking { p0 }
        .end
        """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;
    private Path input;
    private Path missingConfig;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new Stg2VaCLI());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        input = tempDir.resolve("choice.g");
        Files.writeString(input, CHOICE);
        missingConfig = tempDir.resolve("no-config.yaml");
    }

    @Test
    @DisplayName("Should print the phase report to standard output")
    void analyze_withoutOutput_printsReport() {
        int exitCode = commandLine.execute("analyze", input.toString(), "-c", missingConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("# choice - Phase Report")
            .contains("## Phase Transition Table")
            .contains("## Non-deterministic Entries")
            .contains("| 0 | `a+` | 1, 2 |");
    }

    @Test
    @DisplayName("Should write the phase report to a file with -o")
    void analyze_withOutput_writesReport() throws IOException {
        Path output = tempDir.resolve("report.md");

        int exitCode = commandLine.execute("analyze", input.toString(), "-o", output.toString(),
            "-c", missingConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).startsWith("# choice - Phase Report");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should report a missing input file")
    void analyze_missingInput_fails() {
        int exitCode = commandLine.execute("analyze", tempDir.resolve("absent.g").toString(),
            "-c", missingConfig.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("error: cannot read");
    }
}
