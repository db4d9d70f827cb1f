/**
 * OpenTelemetry implementation of {@link ca.gc.cra.tether.application.port.MetricsPort}.
 * <p><strong>Role:</strong> Infrastructure adapter selected by {@code CompositionRoot} from configuration.</p>
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent; updates arrive from pipeline, callback and
 * caller threads.</p>
 */
package ca.gc.cra.tether.infrastructure.metrics;
