/**
 * Event model: occurrences raised by the transport or by stages that flow up towards the caller.
 * <p><strong>Concurrency:</strong> Immutable records; raised and propagated on the pipeline thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tether.domain.event;
