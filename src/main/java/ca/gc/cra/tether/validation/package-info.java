/**
 * Input validation helpers shared by operation constructors, configuration loaders and CLIs.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe from any thread.</p>
 * <p><strong>Security:</strong> Rejects control characters before identifiers reach topics or logs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tether.validation;
