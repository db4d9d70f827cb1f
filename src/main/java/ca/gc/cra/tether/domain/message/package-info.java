/**
 * Message payload value objects carried by caller-facing operations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tether.domain.message;
