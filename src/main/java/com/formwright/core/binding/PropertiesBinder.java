package com.formwright.core.binding;

import com.formwright.config.FormwrightProperties;
import com.formwright.core.engine.BuildContext;
import com.formwright.core.registry.Field;
import com.formwright.core.verify.FailurePolicy;
import com.formwright.core.verify.Verification;
import com.formwright.core.verify.VerificationProtocol;
import com.formwright.surface.BindingProbe;
import com.formwright.surface.ReadBack;
import com.formwright.surface.TargetRef;
import com.formwright.surface.UiActions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Opens the properties panel for a confirmed field and proves it is bound to that field
 * before anything is configured.
 */
@Component
public class PropertiesBinder {

    private static final Logger log = LoggerFactory.getLogger(PropertiesBinder.class);

    private final UiActions actions;
    private final ReadBack readBack;
    private final BindingProbe probe;
    private final VerificationProtocol protocol;
    private final FormwrightProperties properties;

    public PropertiesBinder(UiActions actions, ReadBack readBack, BindingProbe probe,
                            VerificationProtocol protocol, FormwrightProperties properties) {
        this.actions = actions;
        this.readBack = readBack;
        this.probe = probe;
        this.protocol = protocol;
        this.properties = properties;
    }

    public BindResult bind(BuildContext ctx, Field field) {
        var panel = TargetRef.propertiesPanel();
        var config = properties.getBinding();
        var outcome = ctx.account(protocol.run(Verification.named("bind-field")
                .precondition(() -> boundTo(field.id()).isPresent())
                .action(() -> actions.click(TargetRef.field(field.id())))
                .expectation(() -> boundTo(field.id()))
                .timeout(config.getTimeout())
                .maxAttempts(config.getMaxAttempts())
                .onTimeout(FailurePolicy.RETRY)
                .build()));

        if (!outcome.isConfirmed()) {
            log.warn("Properties panel never bound to field {} after {} click(s), last bound to {}",
                    field.id(), outcome.actions(), probe.boundFieldId(panel).orElse("nothing"));
            return new BindResult(null, outcome.actions());
        }
        ctx.registry().markBound(field.id());
        return new BindResult(new PropertyWriter(ctx, field.id(), actions, readBack, probe, protocol,
                config.getWriteTimeout()), outcome.actions());
    }

    private Optional<String> boundTo(String fieldId) {
        return probe.boundFieldId(TargetRef.propertiesPanel()).filter(fieldId::equals);
    }
}
