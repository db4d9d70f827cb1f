/**
 * Operation model: the closed set of work items that travel down a TETHER pipeline.
 * <p><strong>Role:</strong> Domain layer. Caller-facing kinds (credentials, telemetry, method responses,
 * registration) are translated by stages into the transport vocabulary (connect, disconnect, send, subscribe,
 * connection arguments, credential token, client certificate).</p>
 * <p><strong>Concurrency:</strong> Payloads are immutable; completion is atomic and happens exactly once.</p>
 * <p><strong>Security:</strong> Credential-bearing operations never render secrets in {@code toString()}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tether.domain.op;
