package com.formwright.core.capability;

import com.formwright.core.binding.PropertyWriter;
import com.formwright.core.binding.WriteResult;
import com.formwright.core.model.FieldSpec;
import com.formwright.core.model.Reasons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.TreeMap;

/**
 * Writes a field's title and requested properties one by one through the gated writer,
 * skipping controls the field type does not offer.
 */
@Component
public class PropertyFieldConfigurator implements FieldConfigurator {

    private static final Logger log = LoggerFactory.getLogger(PropertyFieldConfigurator.class);

    private final CapabilityTable capabilities;

    public PropertyFieldConfigurator(CapabilityTable capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public ConfigureResult configure(FieldSpec spec, PropertyWriter writer) {
        var requested = new LinkedHashMap<String, String>();
        if (spec.title() != null && !spec.title().isBlank()) {
            requested.put("title", spec.title());
        }
        requested.putAll(new TreeMap<>(spec.properties()));

        var written = new ArrayList<String>();
        var unsupported = new ArrayList<String>();
        for (var entry : requested.entrySet()) {
            String control = entry.getKey();
            if (!capabilities.supports(spec.typeKey(), control)) {
                unsupported.add(control);
                log.warn("Field type {} has no '{}' control; not configured", spec.typeKey(), control);
                continue;
            }
            var result = writer.write(control, entry.getValue());
            if (result == WriteResult.REFUSED) {
                return ConfigureResult.failed(Reasons.BINDING_UNPROVEN, written, unsupported);
            }
            if (result == WriteResult.UNCONFIRMED) {
                return ConfigureResult.failed(Reasons.CONFIGURE_FAILED, written, unsupported);
            }
            written.add(control);
        }
        return ConfigureResult.ok(written, unsupported);
    }
}
