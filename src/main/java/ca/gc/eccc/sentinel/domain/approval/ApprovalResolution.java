package ca.gc.eccc.sentinel.domain.approval;

/**
 * Lifecycle of an {@link ApprovalRequest}. Only {@link #PENDING} may change, and only once.
 *
 * @since 0.1.0
 */
public enum ApprovalResolution {
  PENDING,
  APPROVED,
  REJECTED,
  EXPIRED;

  public boolean isFinal() {
    return this != PENDING;
  }
}
