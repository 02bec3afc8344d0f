package com.formwright.core.binding;

import com.formwright.core.engine.BuildContext;
import com.formwright.core.engine.BuildCounters;
import com.formwright.core.verify.FailurePolicy;
import com.formwright.core.verify.Outcome;
import com.formwright.core.verify.Verification;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.surface.BindingProbe;
import com.formwright.surface.ReadBack;
import com.formwright.surface.TargetRef;
import com.formwright.surface.UiActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Writes properties through the properties panel for exactly one field.
 * <p>
 * Before every write the panel's binding is probed again; a write is never issued while
 * the panel reports any other field (or none). Obtained from {@link PropertiesBinder#bind}.
 */
public class PropertyWriter {

    private static final Logger log = LoggerFactory.getLogger(PropertyWriter.class);

    private final BuildContext ctx;
    private final String fieldId;
    private final UiActions actions;
    private final ReadBack readBack;
    private final BindingProbe probe;
    private final VerificationProtocol protocol;
    private final Duration writeTimeout;

    PropertyWriter(BuildContext ctx, String fieldId, UiActions actions, ReadBack readBack,
                   BindingProbe probe, VerificationProtocol protocol, Duration writeTimeout) {
        this.ctx = ctx;
        this.fieldId = fieldId;
        this.actions = actions;
        this.readBack = readBack;
        this.probe = probe;
        this.protocol = protocol;
        this.writeTimeout = writeTimeout;
    }

    public String fieldId() {
        return fieldId;
    }

    public WriteResult write(String property, String value) {
        var panel = TargetRef.propertiesPanel();
        Outcome<String> outcome = ctx.account(protocol.run(Verification.named("write-" + property)
                .precondition(() -> isBound() && matches(property, value))
                .guard(this::isBound)
                .action(() -> actions.setValue(panel, property, value))
                .expectation(() -> readBack.readValue(panel, property).filter(v -> Objects.equals(v, value)))
                .timeout(writeTimeout)
                .maxAttempts(2)
                .onTimeout(FailurePolicy.RETRY)
                .build()));

        return switch (outcome.status()) {
            case CONFIRMED -> {
                if (!outcome.wasFastPath()) {
                    ctx.increment(BuildCounters.PROPERTY_WRITES);
                }
                yield WriteResult.CONFIRMED;
            }
            case REFUSED -> {
                ctx.increment(BuildCounters.BINDING_REFUSALS);
                log.warn("Refused to write {} on field {}: panel bound to {}", property, fieldId,
                        probe.boundFieldId(panel).orElse("nothing"));
                yield WriteResult.REFUSED;
            }
            default -> {
                log.warn("Write of {} on field {} not read back", property, fieldId);
                yield WriteResult.UNCONFIRMED;
            }
        };
    }

    private boolean isBound() {
        return probe.boundFieldId(TargetRef.propertiesPanel()).map(fieldId::equals).orElse(false);
    }

    private boolean matches(String property, String value) {
        return readBack.readValue(TargetRef.propertiesPanel(), property).map(value::equals).orElse(false);
    }
}
