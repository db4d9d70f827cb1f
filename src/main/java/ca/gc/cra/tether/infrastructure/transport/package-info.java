/**
 * Transport adapters implementing {@link ca.gc.cra.tether.application.port.TransportPort}.
 */
package ca.gc.cra.tether.infrastructure.transport;
