package com.formwright.core.capability;

import com.formwright.core.binding.PropertyWriter;
import com.formwright.core.model.FieldSpec;

/**
 * Content configuration for a confirmed, bound field. Only ever handed a writer whose
 * binding has been proven.
 */
public interface FieldConfigurator {

    ConfigureResult configure(FieldSpec spec, PropertyWriter writer);
}
