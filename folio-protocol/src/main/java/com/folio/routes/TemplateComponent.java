package com.folio.routes;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Reference to a compiled, renderable template: the template name and where its compiled artifact
 * is expected. The artifact is not required to exist at bootstrap.
 */
public record TemplateComponent(String name, Path artifact) {

    public TemplateComponent {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(artifact, "artifact");
    }
}
