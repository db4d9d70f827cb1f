/**
 * Command-line entry points. {@link ca.gc.cra.tether.api.Main} dispatches to the {@code provision} and
 * {@code telemetry} commands, which build a pipeline over the loopback transport and map outcomes to
 * {@link ca.gc.cra.tether.api.ExitCode} values.
 */
package ca.gc.cra.tether.api;
