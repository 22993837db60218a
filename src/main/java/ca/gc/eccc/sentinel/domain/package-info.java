/**
 * <strong>Purpose:</strong> Immutable domain model for severe weather incidents.
 * <p><strong>Pipeline role:</strong> Observations feed assessments; incidents track one observation through
 * classification, severity gating, optional human approval, and alert dispatch.
 * <p><strong>Concurrency:</strong> Records and enums only; safe to share across workflow threads.
 * <p><strong>Observability:</strong> Audit records carry payload snapshots suitable for replay.
 *
 * @since 0.1.0
 */
package ca.gc.eccc.sentinel.domain;
