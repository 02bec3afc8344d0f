package com.formwright.core.engine;

import com.formwright.core.alignment.SectionAlignmentGuard;
import com.formwright.core.binding.PropertiesBinder;
import com.formwright.core.capability.FieldConfigurator;
import com.formwright.core.logging.MdcContext;
import com.formwright.core.model.FailureKind;
import com.formwright.core.model.FailureRecord;
import com.formwright.core.model.FieldSpec;
import com.formwright.core.model.Reasons;
import com.formwright.core.registry.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * One field, start to finish: align the section, add the field, prove the properties panel
 * is bound to it, configure it. Used by the main pass and by retry passes alike.
 * <p>
 * A failure at any step skips only this field and is returned as a {@link FailureRecord};
 * the caller decides what to do with it.
 */
@Component
public class FieldPipeline {

    private static final Logger log = LoggerFactory.getLogger(FieldPipeline.class);

    private final SectionAlignmentGuard alignmentGuard;
    private final FieldAdder fieldAdder;
    private final PropertiesBinder binder;
    private final FieldConfigurator configurator;

    public FieldPipeline(SectionAlignmentGuard alignmentGuard, FieldAdder fieldAdder,
                         PropertiesBinder binder, FieldConfigurator configurator) {
        this.alignmentGuard = alignmentGuard;
        this.fieldAdder = fieldAdder;
        this.binder = binder;
        this.configurator = configurator;
    }

    public Optional<FailureRecord> place(BuildContext ctx, String sectionId, String sectionTitle,
                                         FieldSpec spec, int fieldIndex, Placement placement) {
        MdcContext.setField(sectionTitle, spec.key(), fieldIndex);
        try {
            var alignment = alignmentGuard.ensureAligned(ctx, sectionId);
            if (!alignment.aligned()) {
                return Optional.of(skip(ctx, FailureKind.ALIGNMENT, alignment.reason(), true,
                        spec, sectionTitle, fieldIndex, null, 0));
            }

            var added = fieldAdder.add(ctx, sectionId, spec, placement);
            if (!added.isAdded()) {
                return Optional.of(skip(ctx, FailureKind.ADD, added.reason(), added.retryable(),
                        spec, sectionTitle, fieldIndex, null, added.attempts()));
            }
            ctx.recordConfirmedField(fieldIndex, added.field().id());
            return complete(ctx, added.field(), sectionTitle, spec, fieldIndex);
        } finally {
            MdcContext.clearField();
        }
    }

    /**
     * Binds and configures a field that is already confirmed.
     */
    public Optional<FailureRecord> finish(BuildContext ctx, Field field, String sectionTitle,
                                          FieldSpec spec, int fieldIndex) {
        MdcContext.setField(sectionTitle, spec.key(), fieldIndex);
        try {
            var alignment = alignmentGuard.ensureAligned(ctx, field.sectionId());
            if (!alignment.aligned()) {
                return Optional.of(skip(ctx, FailureKind.ALIGNMENT, alignment.reason(), true,
                        spec, sectionTitle, fieldIndex, field.id(), 0));
            }
            return complete(ctx, field, sectionTitle, spec, fieldIndex);
        } finally {
            MdcContext.clearField();
        }
    }

    private Optional<FailureRecord> complete(BuildContext ctx, Field field, String sectionTitle,
                                             FieldSpec spec, int fieldIndex) {
        var bind = binder.bind(ctx, field);
        if (!bind.isBound()) {
            return Optional.of(skip(ctx, FailureKind.BIND, Reasons.BINDING_UNPROVEN, true,
                    spec, sectionTitle, fieldIndex, field.id(), bind.attempts()));
        }

        var configured = configurator.configure(spec, bind.writer());
        if (!configured.configured()) {
            return Optional.of(skip(ctx, FailureKind.CONFIGURE, configured.reason(), true,
                    spec, sectionTitle, fieldIndex, field.id(), bind.attempts()));
        }

        ctx.emit("field.confirmed", Map.of("fieldId", field.id(), "fieldKey", spec.key(),
                "typeKey", spec.typeKey(), "fieldIndex", fieldIndex));
        return Optional.empty();
    }

    private FailureRecord skip(BuildContext ctx, FailureKind kind, String reason, boolean retryable,
                               FieldSpec spec, String sectionTitle, int fieldIndex, String fieldId, int attempts) {
        var record = new FailureRecord(ctx.activityCode(), kind, reason, retryable, spec.key(), spec.typeKey(),
                sectionTitle, fieldIndex, fieldId, attempts);
        log.warn("Skipping field {} ({}): {} failed with {}{}", spec.key(), spec.typeKey(),
                kind.name().toLowerCase(), reason, retryable ? ", retryable" : "");
        ctx.emit("field.skipped", Map.of("fieldKey", spec.key(), "kind", kind.name(), "reason", reason,
                "retryable", retryable));
        return record;
    }
}
