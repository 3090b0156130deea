package org.rostilos.reviewpipe.analysisengine.stage;

/**
 * Configured stage entry. Order of definitions is execution order.
 *
 * @param name    unique stage name, also used as report section key
 * @param enabled disabled stages are not instantiated
 * @param focus   what the stage should look for, passed to its review service
 */
public record StageDefinition(
        String name,
        boolean enabled,
        String focus
) {
}
