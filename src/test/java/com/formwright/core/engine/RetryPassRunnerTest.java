package com.formwright.core.engine;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.model.ActivitySpec;
import com.formwright.core.model.FailureKind;
import com.formwright.core.model.FailureRecord;
import com.formwright.core.model.FieldSpec;
import com.formwright.core.model.Reasons;
import com.formwright.core.model.SectionSpec;
import com.formwright.core.registry.Field;
import com.formwright.core.registry.Section;
import com.formwright.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetryPassRunnerTest {

    private static final ActivitySpec SPEC = new ActivitySpec("ACT-1", "Activity", List.of(
            new SectionSpec("Part A", List.of(new FieldSpec("short_answer", 0), new FieldSpec("paragraph", 1),
                    new FieldSpec("signature", 2))),
            new SectionSpec("Part B", List.of(new FieldSpec("date_field", 0), new FieldSpec("file_upload", 1)))));

    private BuildContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new BuildContext("RUN-1", "ACT-1", null, 3, 0L);
        ctx.registry().register(new Section("sec-a", "Part A", 0));
        ctx.registry().register(new Section("sec-b", "Part B", 1));
    }

    private static FailureRecord failure(int fieldIndex, FailureKind kind, boolean retryable, String fieldId) {
        var slot = RetryPassRunner.flatten(SPEC).get(fieldIndex);
        return new FailureRecord("ACT-1", kind, Reasons.FIELD_ABSENT_AFTER_RESYNC, retryable, slot.field().key(),
                slot.field().typeKey(), slot.section().title(), fieldIndex, fieldId, 2);
    }

    @Nested
    @DisplayName("anchorFor")
    class Anchor {

        @Test
        @DisplayName("anchors after the nearest preceding confirmed field of the same section")
        void nearestPredecessor() {
            ctx.registry().register(Field.confirmed("fld-1", "short_answer", "sec-a", 0));
            ctx.recordConfirmedField(0, "fld-1");

            var placement = RetryPassRunner.anchorFor(ctx, RetryPassRunner.flatten(SPEC), 2, "sec-a");

            assertEquals(Placement.after("fld-1"), placement);
        }

        @Test
        @DisplayName("goes to the top when no predecessor in the section was confirmed")
        void topOfSection() {
            var placement = RetryPassRunner.anchorFor(ctx, RetryPassRunner.flatten(SPEC), 1, "sec-a");
            assertEquals(Placement.top(), placement);
        }

        @Test
        @DisplayName("never anchors on a field from the previous section")
        void stopsAtSectionBoundary() {
            ctx.registry().register(Field.confirmed("fld-3", "signature", "sec-a", 0));
            ctx.recordConfirmedField(2, "fld-3");

            var placement = RetryPassRunner.anchorFor(ctx, RetryPassRunner.flatten(SPEC), 3, "sec-b");

            assertEquals(Placement.top(), placement);
        }

        @Test
        @DisplayName("ignores a confirmed predecessor the registry no longer knows")
        void ignoresForgottenPredecessor() {
            ctx.recordConfirmedField(0, "fld-gone");
            var placement = RetryPassRunner.anchorFor(ctx, RetryPassRunner.flatten(SPEC), 1, "sec-a");
            assertEquals(Placement.top(), placement);
        }
    }

    @Nested
    @DisplayName("against the rehearsal surface")
    class Rehearsed {

        @Test
        @DisplayName("a confirmed field whose alignment failed is finished in place, not added twice")
        void confirmedFieldIsNotDuplicated() {
            var fixture = new EngineFixture();
            fixture.openFreshTemplate("ACT-R");
            var spec = new ActivitySpec("ACT-R", "Activity", List.of(
                    new SectionSpec("Part A", List.of(new FieldSpec("intro", "paragraph", "Read first", 0, Map.of())))));
            var context = fixture.newContext("ACT-R");
            var section = fixture.sectionAssembler.ensureSection(context, spec.sections().get(0));
            assertTrue(section.isReady());
            var fieldSpec = spec.sections().get(0).fields().get(0);
            assertTrue(fixture.pipeline.place(context, section.section().id(), "Part A", fieldSpec, 0,
                    Placement.append()).isEmpty());
            String fieldId = context.confirmedFieldId(0).orElseThrow();
            context.recordFailure(new FailureRecord("ACT-R", FailureKind.ALIGNMENT, Reasons.ALIGNMENT_EXHAUSTED, true,
                    fieldSpec.key(), fieldSpec.typeKey(), "Part A", 0, fieldId, 0));

            assertEquals(1, fixture.retryRunner.run(context, spec));

            assertEquals(List.of("paragraph"), fixture.surface.layout("ACT-R").get("Part A"));
            assertEquals("Read first", fixture.surface.fieldProperties(fieldId).get("title"));
            assertTrue(context.failures().isEmpty());
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        private FieldPipeline pipeline;
        private FormwrightProperties properties;
        private RetryPassRunner runner;

        @BeforeEach
        void setUp() {
            pipeline = mock(FieldPipeline.class);
            properties = new FormwrightProperties();
            runner = new RetryPassRunner(pipeline, properties);
        }

        @Test
        @DisplayName("re-places add failures and counts recoveries")
        void recoversAddFailures() {
            ctx.recordFailure(failure(1, FailureKind.ADD, true, null));
            when(pipeline.place(any(), eq("sec-a"), eq("Part A"), any(), eq(1), any())).thenReturn(Optional.empty());

            assertEquals(1, runner.run(ctx, SPEC));
            assertTrue(ctx.failures().isEmpty());
            assertEquals(1, ctx.count(BuildCounters.RETRY_PASSES));
        }

        @Test
        @DisplayName("finishes a bind failure in place instead of adding again")
        void finishesBindFailureInPlace() {
            ctx.registry().register(Field.confirmed("fld-7", "paragraph", "sec-a", 0));
            ctx.recordFailure(failure(1, FailureKind.BIND, true, "fld-7"));
            when(pipeline.finish(any(), any(), anyString(), any(), anyInt())).thenReturn(Optional.empty());

            assertEquals(1, runner.run(ctx, SPEC));
            verify(pipeline, never()).place(any(), anyString(), anyString(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("finishes an alignment failure of a confirmed field in place")
        void finishesAlignmentFailureOfConfirmedField() {
            ctx.registry().register(Field.confirmed("fld-8", "paragraph", "sec-a", 0));
            ctx.recordFailure(failure(1, FailureKind.ALIGNMENT, true, "fld-8"));
            when(pipeline.finish(any(), any(), anyString(), any(), anyInt())).thenReturn(Optional.empty());

            assertEquals(1, runner.run(ctx, SPEC));
            verify(pipeline).finish(any(), eq(ctx.registry().field("fld-8").orElseThrow()), eq("Part A"), any(), eq(1));
            verify(pipeline, never()).place(any(), anyString(), anyString(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("leaves non-retryable failures alone by default")
        void skipsNonRetryable() {
            ctx.recordFailure(failure(0, FailureKind.ADD, false, null));

            assertEquals(0, runner.run(ctx, SPEC));
            assertEquals(1, ctx.failures().size());
            assertEquals(0, ctx.count(BuildCounters.RETRY_PASSES));
        }

        @Test
        @DisplayName("retries non-retryable failures when told to")
        void retriesEverythingWhenConfigured() {
            properties.getRetry().setRetryableOnly(false);
            ctx.recordFailure(failure(0, FailureKind.ADD, false, null));
            when(pipeline.place(any(), anyString(), anyString(), any(), anyInt(), any())).thenReturn(Optional.empty());

            assertEquals(1, runner.run(ctx, SPEC));
        }

        @Test
        @DisplayName("a pass that recovers nothing ends the retries")
        void stopsWhenNothingRecovered() {
            var stillFailing = failure(0, FailureKind.ADD, true, null);
            ctx.recordFailure(stillFailing);
            when(pipeline.place(any(), anyString(), anyString(), any(), anyInt(), any()))
                    .thenReturn(Optional.of(stillFailing));

            assertEquals(0, runner.run(ctx, SPEC));
            assertEquals(1, ctx.count(BuildCounters.RETRY_PASSES));
            assertEquals(1, ctx.failures().size());
        }

        @Test
        @DisplayName("a failure streak stops the pass and keeps the untried records")
        void streakStopsPass() {
            properties.getRetry().setFailureThreshold(2);
            for (int i = 0; i < 4; i++) {
                ctx.recordFailure(failure(i, FailureKind.ADD, true, null));
            }
            when(pipeline.place(any(), anyString(), anyString(), any(), anyInt(), any()))
                    .thenAnswer(inv -> Optional.of(failure(inv.getArgument(4), FailureKind.ADD, true, null)));

            assertEquals(0, runner.run(ctx, SPEC));
            verify(pipeline, times(2)).place(any(), anyString(), anyString(), any(), anyInt(), any());
            assertEquals(4, ctx.failures().size());
        }

        @Test
        @DisplayName("passes process failures in specification order")
        void ordersBySpecPosition() {
            ctx.recordFailure(failure(3, FailureKind.ADD, true, null));
            ctx.recordFailure(failure(0, FailureKind.ADD, true, null));
            when(pipeline.place(any(), anyString(), anyString(), any(), anyInt(), any())).thenReturn(Optional.empty());

            runner.run(ctx, SPEC);

            var order = inOrder(pipeline);
            order.verify(pipeline).place(any(), eq("sec-a"), anyString(), any(), eq(0), any());
            order.verify(pipeline).place(any(), eq("sec-b"), anyString(), any(), eq(3), any());
        }
    }
}
