package com.formwright.dispatch.cli;

import com.formwright.core.spec.SpecReader;
import com.formwright.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the CLI through picocli without a Spring context, against the rehearsal surface.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final String SPEC = """
            code: CPC-CLI
            title: CLI activity
            sections:
              - title: Part A
                fields:
                  - type: paragraph
                    key: intro
                    title: Welcome
                  - type: short_answer
                    key: name
                    properties:
                      required: true
            """;

    @TempDir
    Path dir;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
    }

    private CommandLine.IFactory createFactory() {
        var reader = new SpecReader();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == BuildCommand.class) {
                    return (K) new BuildCommand(reader, fixture.controller, fixture.eventBus, fixture.properties);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(reader, fixture.capabilities);
                }
                if (cls == TypesCommand.class) {
                    return (K) new TypesCommand(fixture.capabilities);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new FormwrightCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private String write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content).toString();
    }

    @Nested
    @DisplayName("help")
    class Help {

        @Test
        @DisplayName("lists every subcommand")
        void listsSubcommands() {
            var result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("build"));
            assertTrue(result.output().contains("validate"));
            assertTrue(result.output().contains("types"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommand() {
            var result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: formwright"));
        }
    }

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("builds a specification and exits 0")
        void buildsSpec() throws IOException {
            var result = execute("build", "--run-id", "RUN-CLI", write("a.yml", SPEC));

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("CPC-CLI"));
            assertEquals(2, fixture.surface.layout("CPC-CLI").get("Part A").size());
        }

        @Test
        @DisplayName("watch mode prints build events")
        void watchMode() throws IOException {
            var result = execute("build", "--watch", write("a.yml", SPEC));

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("CPC-CLI"));
        }

        @Test
        @DisplayName("exits 1 when an activity fails")
        void failedActivity() throws IOException {
            fixture.surface.failShellFor("CPC-CLI");

            var result = execute("build", write("a.yml", SPEC));

            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("exits 2 without files or with an unreadable specification")
        void inputErrors() throws IOException {
            assertEquals(2, execute("build").exitCode());
            assertEquals(2, execute("build", write("bad.yml", "code: CPC-X\nsectons: []\n")).exitCode());
            assertEquals(2, execute("build", dir.resolve("absent.yml").toString()).exitCode());
            assertEquals(0, fixture.surface.mutationCount());
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        private static final String WITH_WARNINGS = """
                code: CPC-V
                sections:
                  - title: Part A
                    fields:
                      - type: hologram
                        key: h
                      - type: long_answer
                        key: essay
                        properties:
                          rows: 5
                """;

        @Test
        @DisplayName("a clean specification validates with exit 0")
        void clean() throws IOException {
            var result = execute("validate", "--strict", write("a.yml", SPEC));

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("intro [paragraph]"));
        }

        @Test
        @DisplayName("warnings fail only under --strict")
        void warnings() throws IOException {
            String path = write("w.yml", WITH_WARNINGS);

            var relaxed = execute("validate", path);
            var strict = execute("validate", "--strict", path);

            assertEquals(0, relaxed.exitCode());
            assertEquals(1, strict.exitCode());
            assertTrue(relaxed.output().contains("unknown field type 'hologram'"));
            assertTrue(relaxed.output().contains("no 'rows' control"));
        }

        @Test
        @DisplayName("an unreadable specification exits 2")
        void unreadable() {
            assertEquals(2, execute("validate", dir.resolve("absent.yml").toString()).exitCode());
        }
    }

    @Test
    @DisplayName("types lists field types with their controls")
    void types() {
        var result = execute("types");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("interactive_table"));
        assertTrue(result.output().contains("header_row"));
    }
}
