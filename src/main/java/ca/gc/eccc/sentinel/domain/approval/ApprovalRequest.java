package ca.gc.eccc.sentinel.domain.approval;

import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Request for a human decision on whether an incident's alert may be dispatched.
 * <p><strong>Why:</strong> Medium and low severity judgments are held back until an operator confirms them.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; resolution produces a new instance.</p>
 *
 * @param requestId unique request identifier; never blank
 * @param incidentId incident awaiting the decision; never {@code null}
 * @param requestedAt creation instant
 * @param deadline instant after which the request expires
 * @param resolution current resolution; {@link ApprovalResolution#PENDING} until resolved
 * @param resolvedAt resolution instant; {@code null} while pending
 * @param resolvedBy operator name, {@code expiry-timer} for expirations; empty while pending
 * @since 0.1.0
 */
public record ApprovalRequest(
    String requestId,
    IncidentId incidentId,
    Instant requestedAt,
    Instant deadline,
    ApprovalResolution resolution,
    Instant resolvedAt,
    String resolvedBy) {

  public ApprovalRequest {
    requestId = Objects.requireNonNull(requestId, "requestId");
    incidentId = Objects.requireNonNull(incidentId, "incidentId");
    requestedAt = Objects.requireNonNull(requestedAt, "requestedAt");
    deadline = Objects.requireNonNull(deadline, "deadline");
    resolution = Objects.requireNonNull(resolution, "resolution");
    resolvedBy = resolvedBy == null ? "" : resolvedBy;
    if (deadline.isBefore(requestedAt)) {
      throw new IllegalArgumentException("deadline must not precede requestedAt");
    }
    if (resolution.isFinal() && resolvedAt == null) {
      throw new IllegalArgumentException("resolved requests require resolvedAt");
    }
  }

  /**
   * Creates a pending request.
   *
   * @param requestId identifier
   * @param incidentId incident awaiting the decision
   * @param requestedAt creation instant
   * @param deadline expiry instant
   * @return pending request
   */
  public static ApprovalRequest pending(
      String requestId, IncidentId incidentId, Instant requestedAt, Instant deadline) {
    return new ApprovalRequest(
        requestId, incidentId, requestedAt, deadline, ApprovalResolution.PENDING, null, "");
  }

  public boolean isPending() {
    return resolution == ApprovalResolution.PENDING;
  }

  /**
   * Returns a copy carrying a final resolution.
   *
   * @param outcome final resolution; must not be {@link ApprovalResolution#PENDING}
   * @param at resolution instant
   * @param by operator or timer name
   * @return resolved copy
   */
  public ApprovalRequest resolve(ApprovalResolution outcome, Instant at, String by) {
    if (!outcome.isFinal()) {
      throw new IllegalArgumentException("outcome must be final");
    }
    return new ApprovalRequest(requestId, incidentId, requestedAt, deadline, outcome, at, by);
  }
}
