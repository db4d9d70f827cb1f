/**
 * Credential source contracts consumed by the security client stage.
 * <p><strong>Role:</strong> Domain boundary; token signing and certificate parsing live outside TETHER.</p>
 * <p><strong>Security:</strong> Types carry secrets; their {@code toString()} implementations redact them.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tether.domain.security;
