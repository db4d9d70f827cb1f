/**
 * Provisioning service results surfaced to callers of registration operations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tether.domain.provisioning;
