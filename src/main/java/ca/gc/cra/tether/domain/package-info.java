/**
 * Core domain model for TETHER device pipelines: operations, events, credential sources and results.
 * <p><strong>Role:</strong> Domain layer without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; operations complete atomically.</p>
 * <p><strong>Security:</strong> Credential-bearing types redact secrets from their string forms.</p>
 */
package ca.gc.cra.tether.domain;
