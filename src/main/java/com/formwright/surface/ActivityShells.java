package com.formwright.surface;

import com.formwright.core.model.ActivitySpec;

/**
 * Creates empty activity shells and opens them in the builder.
 * <p>
 * Both operations are single best-effort actions; the caller proves their effect
 * through the {@link TemplateDirectory} and a read-back of {@link TargetRef#builderRoot()}.
 */
public interface ActivityShells {

    ActionResult submitShell(ActivitySpec spec);

    ActionResult openBuilder(String templateId);
}
