package ca.gc.eccc.sentinel.application.port;

import ca.gc.eccc.sentinel.domain.approval.ApprovalRequest;
import ca.gc.eccc.sentinel.domain.incident.Incident;

/**
 * Publishes approval requests to human operators and withdraws them once resolved.
 *
 * @since 0.1.0
 */
public interface ApprovalNoticePort {
  /**
   * Announces a new pending request.
   *
   * @param request pending request
   * @param incident incident snapshot awaiting the decision
   */
  void requested(ApprovalRequest request, Incident incident);

  /**
   * Signals that a request has reached its final resolution.
   *
   * @param request resolved request
   */
  void resolved(ApprovalRequest request);

  /** Notice port that publishes nothing. */
  ApprovalNoticePort NONE = new ApprovalNoticePort() {
    @Override public void requested(ApprovalRequest request, Incident incident) {}

    @Override public void resolved(ApprovalRequest request) {}
  };
}
