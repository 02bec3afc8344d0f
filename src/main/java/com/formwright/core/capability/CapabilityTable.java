package com.formwright.core.capability;

import com.formwright.config.FormwrightProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which configuration controls each field type offers.
 * <p>
 * Consulted only by the configurator; the build engine passes type keys through without
 * interpreting them. Entries under {@code formwright.capabilities} replace the built-in
 * entry for the same type key.
 */
@Component
public class CapabilityTable {

    static final Map<String, List<String>> DEFAULTS = defaults();

    private final Map<String, Set<String>> controls = new LinkedHashMap<>();

    public CapabilityTable(FormwrightProperties properties) {
        this(properties.getCapabilities());
    }

    public CapabilityTable(Map<String, List<String>> overrides) {
        DEFAULTS.forEach((type, list) -> controls.put(type, new LinkedHashSet<>(list)));
        if (overrides != null) {
            overrides.forEach((type, list) -> controls.put(type, new LinkedHashSet<>(list)));
        }
    }

    public boolean supports(String typeKey, String control) {
        var set = controls.get(typeKey);
        return set != null && set.contains(control);
    }

    public boolean isKnownType(String typeKey) {
        return controls.containsKey(typeKey);
    }

    public Set<String> controls(String typeKey) {
        return Set.copyOf(controls.getOrDefault(typeKey, Set.of()));
    }

    public Map<String, Set<String>> asMap() {
        var copy = new LinkedHashMap<String, Set<String>>();
        controls.forEach((k, v) -> copy.put(k, new LinkedHashSet<>(v)));
        return copy;
    }

    private static Map<String, List<String>> defaults() {
        var m = new LinkedHashMap<String, List<String>>();
        m.put("paragraph", List.of("title", "body"));
        m.put("long_answer", List.of("title", "required", "placeholder", "max_length"));
        m.put("short_answer", List.of("title", "required", "placeholder", "max_length"));
        m.put("file_upload", List.of("title", "required", "allowed_types", "max_files"));
        m.put("interactive_table", List.of("title", "rows", "columns", "header_row"));
        m.put("signature", List.of("title", "required", "signer_role"));
        m.put("date_field", List.of("title", "required", "default_today"));
        m.put("single_choice", List.of("title", "required", "options", "layout"));
        return Collections.unmodifiableMap(m);
    }
}
