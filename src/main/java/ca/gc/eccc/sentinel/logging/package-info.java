/**
 * Logging helpers shared by the CLI and the workflow: runtime level control for the Logback backend
 * and formatting of long free text for log lines.
 */
package ca.gc.eccc.sentinel.logging;
