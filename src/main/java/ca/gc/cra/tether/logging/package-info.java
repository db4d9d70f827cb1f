/**
 * Logging helpers: runtime level changes and credential-safe formatting.
 */
package ca.gc.cra.tether.logging;
