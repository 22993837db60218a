/**
 * Audit sinks: the JSON-lines incident data log, its reader, and an in-memory sink for dry runs.
 * <p><strong>Format:</strong> one JSON object per line, see {@link ca.gc.eccc.sentinel.infrastructure.audit.AuditRecordJson}.</p>
 */
package ca.gc.eccc.sentinel.infrastructure.audit;
