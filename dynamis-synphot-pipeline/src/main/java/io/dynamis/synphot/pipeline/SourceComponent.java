package io.dynamis.synphot.pipeline;

/**
 * One additive emission component of a source, e.g. the bulge of a galaxy.
 *
 * @param name            key under which the component's batch is supplied
 * @param applyExtinction redden the component with its per-object Av
 * @param applyRedshift   shift the component with its per-object redshift
 */
public record SourceComponent(String name, boolean applyExtinction, boolean applyRedshift) {

    public SourceComponent {
        if (name == null) {
            throw new NullPointerException("name");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("component name must not be blank");
        }
    }
}
