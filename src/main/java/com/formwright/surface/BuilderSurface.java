package com.formwright.surface;

/**
 * Convenience aggregate for adapters that implement every surface capability.
 */
public interface BuilderSurface extends UiObserver, UiActions, ReadBack, BindingProbe,
        TemplateDirectory, ActivityShells {
}
