/**
 * Configuration loading and object wiring.
 * <p><strong>Role:</strong> Turns defaults, YAML and CLI settings into {@link ca.gc.cra.tether.config.PipelineConfig}
 * and builds pipelines from it.</p>
 */
package ca.gc.cra.tether.config;
