package ca.gc.eccc.sentinel.domain.approval;

import java.util.Locale;

/**
 * Decision submitted by a human operator for a pending approval request.
 *
 * @since 0.1.0
 */
public enum ApprovalDecision {
  APPROVE,
  REJECT;

  /**
   * Maps the decision onto the resolution it produces.
   *
   * @return {@link ApprovalResolution#APPROVED} or {@link ApprovalResolution#REJECTED}
   */
  public ApprovalResolution resolution() {
    return this == APPROVE ? ApprovalResolution.APPROVED : ApprovalResolution.REJECTED;
  }

  /**
   * Parses operator input such as {@code approve}, {@code approved}, {@code reject} or {@code rejected}.
   *
   * @param raw operator text
   * @return parsed decision
   * @throws IllegalArgumentException when the text is not a recognized decision
   */
  public static ApprovalDecision parse(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("decision must not be null");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "approve", "approved", "yes" -> APPROVE;
      case "reject", "rejected", "no" -> REJECT;
      default -> throw new IllegalArgumentException("decision must be approve or reject (was " + raw + ")");
    };
  }
}
