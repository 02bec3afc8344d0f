package com.formwright.core.spec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpecReaderTest {

    private SpecReader reader;

    @BeforeEach
    void setUp() {
        reader = new SpecReader();
    }

    @Nested
    @DisplayName("well-formed documents")
    class WellFormed {

        @Test
        @DisplayName("reads a list of activities with sections and fields in order")
        void readsActivityList() {
            var specs = reader.parse("""
                    activities:
                      - code: CPC-A1
                        title: Unit 1 assessment
                        sections:
                          - title: Part A
                            fields:
                              - type: short_answer
                                key: name
                                properties:
                                  label: Your name
                                  required: true
                              - type: paragraph
                          - title: Part B
                      - code: CPC-A2
                    """, "inline");

            assertEquals(2, specs.size());
            var first = specs.get(0);
            assertEquals("CPC-A1", first.code());
            assertEquals("Unit 1 assessment", first.title());
            assertEquals(List.of("Part A", "Part B"), first.sections().stream().map(s -> s.title()).toList());

            var fields = first.sections().get(0).fields();
            assertEquals("name", fields.get(0).key());
            assertEquals(Map.of("label", "Your name", "required", "true"), fields.get(0).properties());
            assertEquals("paragraph-1", fields.get(1).key());
            assertEquals(1, fields.get(1).ordinal());

            assertEquals("CPC-A2", specs.get(1).title());
            assertTrue(specs.get(1).sections().isEmpty());
        }

        @Test
        @DisplayName("a document without 'activities' is one activity")
        void readsSingleActivity() {
            var specs = reader.parse("""
                    code: CPC-S1
                    locked: true
                    sections:
                      - title: Only
                        fields:
                          - type: checkbox
                    """, "single.yml");

            assertEquals(1, specs.size());
            assertEquals("single.yml", specs.get(0).source());
            assertEquals(1, specs.get(0).fieldCount());
        }
    }

    @Nested
    @DisplayName("rejected documents")
    class Rejected {

        @Test
        @DisplayName("unknown keys fail the read")
        void rejectsUnknownKeys() {
            var e = assertThrows(SpecParseException.class, () -> reader.parse("""
                    code: CPC-X
                    sections:
                      - title: Part A
                        feilds: []
                    """, "typo.yml"));

            assertTrue(e.getMessage().contains("feilds"));
            assertTrue(e.getMessage().startsWith("typo.yml"));
        }

        @Test
        @DisplayName("duplicate section titles within an activity are rejected")
        void rejectsDuplicateSectionTitles() {
            assertThrows(SpecParseException.class, () -> reader.parse("""
                    code: CPC-X
                    sections:
                      - title: Part A
                      - title: "  part a "
                    """, "dup.yml"));
        }

        @Test
        @DisplayName("property values must be scalars")
        void rejectsNonScalarProperties() {
            var e = assertThrows(SpecParseException.class, () -> reader.parse("""
                    code: CPC-X
                    sections:
                      - title: Part A
                        fields:
                          - type: dropdown
                            properties:
                              options: [a, b]
                    """, "props.yml"));

            assertTrue(e.getMessage().contains("options"));
        }

        @Test
        @DisplayName("a field without a type is rejected")
        void rejectsMissingType() {
            assertThrows(SpecParseException.class, () -> reader.parse("""
                    code: CPC-X
                    sections:
                      - title: Part A
                        fields:
                          - key: q1
                    """, "type.yml"));
        }

        @Test
        @DisplayName("empty and malformed documents are rejected")
        void rejectsEmptyAndMalformed() {
            assertThrows(SpecParseException.class, () -> reader.parse("", "empty.yml"));
            assertThrows(SpecParseException.class, () -> reader.parse("- just\n- a list\n", "list.yml"));
            assertThrows(SpecParseException.class, () -> reader.parse("code: [unclosed", "bad.yml"));
            assertThrows(SpecParseException.class, () -> reader.parse("activities: []\n", "none.yml"));
        }
    }

    @Nested
    @DisplayName("files")
    class FromFiles {

        @TempDir
        Path dir;

        @Test
        @DisplayName("reads several files and keeps their order")
        void readsSeveralFiles() throws IOException {
            var a = Files.writeString(dir.resolve("a.yml"), "code: CPC-1\n");
            var b = Files.writeString(dir.resolve("b.yml"), "activities:\n  - code: CPC-2\n  - code: CPC-3\n");

            var specs = reader.read(List.of(a, b));

            assertEquals(List.of("CPC-1", "CPC-2", "CPC-3"), specs.stream().map(s -> s.code()).toList());
        }

        @Test
        @DisplayName("an activity code repeated across files is rejected")
        void rejectsDuplicateCodesAcrossFiles() throws IOException {
            var a = Files.writeString(dir.resolve("a.yml"), "code: CPC-1\n");
            var b = Files.writeString(dir.resolve("b.yml"), "code: CPC-1\n");

            var e = assertThrows(SpecParseException.class, () -> reader.read(List.of(a, b)));
            assertTrue(e.getMessage().contains("CPC-1"));
        }

        @Test
        @DisplayName("a missing file is reported as a parse failure")
        void missingFile() {
            assertThrows(SpecParseException.class, () -> reader.read(dir.resolve("absent.yml")));
        }
    }
}
