/**
 * Stages of the default device client chain.
 * <p><strong>Role:</strong> Credential resolution, retries, provisioning registration, connection management and
 * the transport adapter, in that order from head to tail.</p>
 * <p><strong>Concurrency:</strong> Stage state is confined to the pipeline thread.</p>
 */
package ca.gc.cra.tether.application.stage;
