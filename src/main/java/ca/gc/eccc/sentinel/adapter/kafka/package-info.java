/**
 * Kafka adapters publishing alerts and audit records.
 * <p><strong>Role:</strong> Adapter layer; implements {@link ca.gc.eccc.sentinel.application.port.Notifier}
 * and {@link ca.gc.eccc.sentinel.application.port.AuditSink} on Kafka topics.</p>
 * <p><strong>Ordering:</strong> Records are keyed by incident id so every record of one incident lands on
 * the same partition in append order.</p>
 * <p><strong>Security:</strong> Assumes Kafka credentials provided via configuration; no secrets logged.</p>
 */
package ca.gc.eccc.sentinel.adapter.kafka;
