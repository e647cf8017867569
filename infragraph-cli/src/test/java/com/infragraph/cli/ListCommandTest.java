package com.infragraph.cli;

import com.infragraph.InfraGraphCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void list_withoutType_listsParsersAndGenerators() {
        int exitCode = InfraGraphCLI.commandLine().execute("list");

        assertThat(exitCode).isZero();
        assertThat(output.toString(StandardCharsets.UTF_8))
            .contains("Available Parsers:")
            .contains("(ID: terraform)")
            .contains("Files: *.bicep")
            .contains("Available Generators:")
            .contains("(ID: mermaid)")
            .contains("File Extension: .dot");
    }

    @Test
    void list_generators_listsOnlyGenerators() {
        int exitCode = InfraGraphCLI.commandLine().execute("list", "generators");

        assertThat(exitCode).isZero();
        assertThat(output.toString(StandardCharsets.UTF_8))
            .contains("(ID: json)")
            .doesNotContain("Available Parsers:");
    }

    @Test
    void list_unknownType_fails() {
        int exitCode = InfraGraphCLI.commandLine().execute("list", "renderers");

        assertThat(exitCode).isEqualTo(1);
    }
}
