package com.formwright.surface.rehearsal;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.model.ActivitySpec;
import com.formwright.support.ManualPollingClock;
import com.formwright.surface.EntityKind;
import com.formwright.surface.ObservationScope;
import com.formwright.surface.TargetRef;
import com.formwright.surface.TemplateStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RehearsalSurfaceTest {

    private FormwrightProperties.Rehearsal config;
    private ManualPollingClock clock;
    private RehearsalSurface surface;

    @BeforeEach
    void setUp() {
        config = new FormwrightProperties.Rehearsal();
        clock = new ManualPollingClock();
        surface = new RehearsalSurface(config, clock);
    }

    private String openWithSection() {
        var template = surface.seedTemplate("CPC-1", "Unit 1", TemplateStatus.INACTIVE, false);
        surface.openBuilder(template.templateId());
        surface.click(TargetRef.createSection());
        return surface.observe(ObservationScope.canvas()).ofKind(EntityKind.SECTION).get(0).id();
    }

    private List<String> fieldIds(String sectionId) {
        return surface.observe(ObservationScope.section(sectionId)).ids(EntityKind.FIELD).stream().toList();
    }

    @Nested
    @DisplayName("templates")
    class Templates {

        @Test
        @DisplayName("a submitted shell appears as an inactive unlocked template")
        void submitShell() {
            assertTrue(surface.submitShell(new ActivitySpec("CPC-9", "Nine", List.of())).performed());

            var match = surface.find("CPC-9", TemplateStatus.INACTIVE);
            assertTrue(match.isPresent());
            assertFalse(match.get().locked());
            assertTrue(surface.find("CPC-9", TemplateStatus.ACTIVE).isEmpty());
        }

        @Test
        @DisplayName("a failing shell is accepted but never created")
        void failingShell() {
            surface.failShellFor("CPC-9");

            assertTrue(surface.submitShell(new ActivitySpec("CPC-9", "Nine", List.of())).performed());
            assertTrue(surface.template("CPC-9").isEmpty());
        }

        @Test
        @DisplayName("opening an unknown template fails")
        void openUnknown() {
            assertFalse(surface.openBuilder("tpl-404").performed());
            assertTrue(surface.observe(ObservationScope.canvas()).entities().isEmpty());
        }
    }

    @Nested
    @DisplayName("sections")
    class Sections {

        @Test
        @DisplayName("a created section is untitled and displayed")
        void createSection() {
            String sectionId = openWithSection();

            assertEquals(Optional.of(sectionId), surface.readValue(TargetRef.canvasRoot(), "section-id"));
            assertEquals(Optional.of(RehearsalSurface.UNTITLED_SECTION),
                    surface.readValue(TargetRef.sectionItem(sectionId), "title"));
        }

        @Test
        @DisplayName("ignored creates do nothing")
        void ignoredCreate() {
            var template = surface.seedTemplate("CPC-1", "Unit 1", TemplateStatus.INACTIVE, false);
            surface.openBuilder(template.templateId());
            surface.ignoreSectionCreates(1);

            surface.click(TargetRef.createSection());

            assertTrue(surface.observe(ObservationScope.canvas()).ofKind(EntityKind.SECTION).isEmpty());
        }

        @Test
        @DisplayName("fields of a section that is not displayed are not rendered")
        void hiddenSectionFields() {
            String first = openWithSection();
            surface.setValue(TargetRef.sectionItem(first), "title", "Part A");
            surface.drag(TargetRef.toolboxCard("paragraph"), TargetRef.dropZone(first));
            surface.click(TargetRef.createSection());

            assertTrue(fieldIds(first).isEmpty());
            assertEquals(List.of("paragraph"), surface.layout("CPC-1").get("Part A"));
        }

        @Test
        @DisplayName("selection lags by the configured number of reads")
        void alignmentLag() {
            config.setAlignmentLagReads(1);
            String first = openWithSection();
            surface.click(TargetRef.createSection());
            var second = surface.readValue(TargetRef.canvasRoot(), "section-id").orElseThrow();

            surface.select(TargetRef.sectionItem(first));

            assertEquals(Optional.of(second), surface.readValue(TargetRef.canvasRoot(), "section-id"));
            assertEquals(Optional.of(first), surface.readValue(TargetRef.canvasRoot(), "section-id"));
        }
    }

    @Nested
    @DisplayName("drops")
    class Drops {

        @Test
        @DisplayName("drops land at the end, at the top or after an anchor")
        void placement() {
            String sectionId = openWithSection();
            surface.drag(TargetRef.toolboxCard("paragraph"), TargetRef.dropZone(sectionId));
            String a = fieldIds(sectionId).get(0);
            surface.drag(TargetRef.toolboxCard("signature"), TargetRef.dropZone(sectionId));
            surface.drag(TargetRef.toolboxCard("date_field"), TargetRef.dropZoneAfter(sectionId, null));
            surface.drag(TargetRef.toolboxCard("file_upload"), TargetRef.dropZoneAfter(sectionId, a));

            assertEquals(List.of("date_field", "paragraph", "file_upload", "signature"),
                    surface.layout("CPC-1").get(RehearsalSurface.UNTITLED_SECTION));
        }

        @Test
        @DisplayName("an unrendered anchor fails the drop without mutating")
        void unrenderedAnchor() {
            String sectionId = openWithSection();

            assertFalse(surface.drag(TargetRef.toolboxCard("paragraph"),
                    TargetRef.dropZoneAfter(sectionId, "fld-404")).performed());
            assertTrue(surface.layout("CPC-1").get(RehearsalSurface.UNTITLED_SECTION).isEmpty());
        }

        @Test
        @DisplayName("a lagged drop renders once its delay has passed")
        void laggedDrop() {
            String sectionId = openWithSection();
            surface.scriptDrops(DropBehavior.LAGGED);

            surface.drag(TargetRef.toolboxCard("paragraph"), TargetRef.dropZone(sectionId));
            assertTrue(fieldIds(sectionId).isEmpty());

            clock.advance(config.getLagDelay().minusMillis(1));
            assertTrue(fieldIds(sectionId).isEmpty());
            clock.advance(Duration.ofMillis(1));
            assertEquals(1, fieldIds(sectionId).size());
        }

        @Test
        @DisplayName("refresh renders everything still pending")
        void refreshRendersPending() {
            String sectionId = openWithSection();
            surface.scriptDrops(DropBehavior.LAGGED_DOUBLE);
            surface.drag(TargetRef.toolboxCard("paragraph"), TargetRef.dropZone(sectionId));

            surface.refresh();

            assertEquals(2, fieldIds(sectionId).size());
        }

        @Test
        @DisplayName("silent and double drops")
        void silentAndDouble() {
            String sectionId = openWithSection();
            surface.scriptDrops(DropBehavior.SILENT, DropBehavior.DOUBLE);

            surface.drag(TargetRef.toolboxCard("paragraph"), TargetRef.dropZone(sectionId));
            assertTrue(fieldIds(sectionId).isEmpty());
            surface.drag(TargetRef.toolboxCard("paragraph"), TargetRef.dropZone(sectionId));
            assertEquals(2, fieldIds(sectionId).size());
        }
    }

    @Nested
    @DisplayName("properties panel")
    class Panel {

        @Test
        @DisplayName("clicking a field binds the panel and writes land on it")
        void bindAndWrite() {
            String sectionId = openWithSection();
            surface.drag(TargetRef.toolboxCard("short_answer"), TargetRef.dropZone(sectionId));
            String fieldId = fieldIds(sectionId).get(0);

            surface.click(TargetRef.field(fieldId));
            surface.setValue(TargetRef.propertiesPanel(), "title", "Name");

            assertEquals(Optional.of(fieldId), surface.boundFieldId(TargetRef.propertiesPanel()));
            assertEquals("Name", surface.fieldProperties(fieldId).get("title"));
            assertEquals(Optional.of("Name"), surface.readValue(TargetRef.propertiesPanel(), "title"));
        }

        @Test
        @DisplayName("a misbind binds a neighbour and selecting a section unbinds")
        void misbind() {
            String sectionId = openWithSection();
            surface.drag(TargetRef.toolboxCard("paragraph"), TargetRef.dropZone(sectionId));
            surface.drag(TargetRef.toolboxCard("signature"), TargetRef.dropZone(sectionId));
            var ids = fieldIds(sectionId);
            surface.misbindNext(1);

            surface.click(TargetRef.field(ids.get(1)));
            assertEquals(Optional.of(ids.get(0)), surface.boundFieldId(TargetRef.propertiesPanel()));

            surface.select(TargetRef.sectionItem(sectionId));
            assertTrue(surface.boundFieldId(TargetRef.propertiesPanel()).isEmpty());
            assertFalse(surface.setValue(TargetRef.propertiesPanel(), "title", "x").performed());
        }
    }

    @Test
    @DisplayName("every mutating action is logged")
    void actionLog() {
        String sectionId = openWithSection();
        surface.select(TargetRef.sectionItem(sectionId));

        assertEquals(List.of("open-builder template[tpl-1]", "click create_section",
                "select section_item[" + sectionId + "]"), surface.actionLog());
        assertEquals(3, surface.mutationCount());
    }
}
