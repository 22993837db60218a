package ca.gc.eccc.sentinel.domain.alert;

import java.util.Objects;

/**
 * Acknowledgement returned by a notifier after a successful send.
 *
 * @param reference transport-specific reference (file name, topic offset, log marker)
 * @since 0.1.0
 */
public record DeliveryReceipt(String reference) {
  public DeliveryReceipt {
    reference = Objects.requireNonNull(reference, "reference");
  }
}
