/**
 * <strong>Purpose:</strong> Ports the pipeline core drives: transport, metrics and clock.
 * <p><strong>Pipeline role:</strong> Adapters implement these interfaces to integrate concrete protocols and
 * telemetry backends.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tether.application.port;
