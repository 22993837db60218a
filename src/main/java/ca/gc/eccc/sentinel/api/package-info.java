/**
 * Command-line entry points for SENTINEL.
 * <p><strong>Role:</strong> Driving adapters: parse {@code key=value} arguments and flags, load configuration,
 * run the use case, and map failures to {@link ca.gc.eccc.sentinel.api.ExitCode}.</p>
 * <p><strong>Output:</strong> Human-facing results go to stdout through {@code CliPrinter}; diagnostics go
 * through SLF4J.</p>
 */
package ca.gc.eccc.sentinel.api;
