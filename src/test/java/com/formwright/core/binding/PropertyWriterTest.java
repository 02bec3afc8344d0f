package com.formwright.core.binding;

import com.formwright.core.engine.BuildContext;
import com.formwright.core.engine.BuildCounters;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.support.ManualPollingClock;
import com.formwright.surface.ActionResult;
import com.formwright.surface.BindingProbe;
import com.formwright.surface.ReadBack;
import com.formwright.surface.TargetRef;
import com.formwright.surface.UiActions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PropertyWriterTest {

    private UiActions actions;
    private ReadBack readBack;
    private BindingProbe probe;
    private BuildContext ctx;
    private PropertyWriter writer;

    @BeforeEach
    void setUp() {
        actions = mock(UiActions.class);
        readBack = mock(ReadBack.class);
        probe = mock(BindingProbe.class);
        var clock = new ManualPollingClock();
        var protocol = new VerificationProtocol(clock, Duration.ofMillis(100), Duration.ofSeconds(1));
        ctx = new BuildContext("RUN-1", "ACT-1", null, 3, clock.nowMillis());
        writer = new PropertyWriter(ctx, "fld-1", actions, readBack, probe, protocol, Duration.ofMillis(500));
        when(actions.setValue(any(), anyString(), anyString())).thenReturn(ActionResult.ok());
    }

    @Test
    @DisplayName("never writes while the panel is bound to another field")
    void noWriteWhenMisbound() {
        when(probe.boundFieldId(any())).thenReturn(Optional.of("fld-2"));

        var result = writer.write("title", "Name");

        assertEquals(WriteResult.REFUSED, result);
        verify(actions, never()).setValue(any(), anyString(), anyString());
        assertEquals(1, ctx.count(BuildCounters.BINDING_REFUSALS));
    }

    @Test
    @DisplayName("never writes while the panel is bound to nothing")
    void noWriteWhenUnbound() {
        when(probe.boundFieldId(any())).thenReturn(Optional.empty());

        assertEquals(WriteResult.REFUSED, writer.write("title", "Name"));
        verify(actions, never()).setValue(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("writes once and confirms by read-back when bound")
    void writesWhenBound() {
        when(probe.boundFieldId(any())).thenReturn(Optional.of("fld-1"));
        when(readBack.readValue(any(), eq("title"))).thenReturn(Optional.empty(), Optional.of("Name"));

        assertEquals(WriteResult.CONFIRMED, writer.write("title", "Name"));
        verify(actions, times(1)).setValue(TargetRef.propertiesPanel(), "title", "Name");
    }

    @Test
    @DisplayName("reports unconfirmed when the value never reads back")
    void unconfirmedWithoutReadBack() {
        when(probe.boundFieldId(any())).thenReturn(Optional.of("fld-1"));
        when(readBack.readValue(any(), eq("title"))).thenReturn(Optional.of("Other"));

        assertEquals(WriteResult.UNCONFIRMED, writer.write("title", "Name"));
        verify(actions, times(2)).setValue(TargetRef.propertiesPanel(), "title", "Name");
    }
}
