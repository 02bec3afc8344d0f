package com.formwright.surface;

import java.util.Optional;

/**
 * Reports which field a configuration panel is currently bound to.
 */
@FunctionalInterface
public interface BindingProbe {

    Optional<String> boundFieldId(TargetRef panelScope);
}
