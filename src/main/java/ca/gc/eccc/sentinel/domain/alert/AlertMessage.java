package ca.gc.eccc.sentinel.domain.alert;

import java.util.List;
import java.util.Objects;

/**
 * Formatted alert handed to a notifier.
 *
 * @param incidentId identifier of the incident the alert belongs to; used as delivery key
 * @param recipients recipient addresses; never empty
 * @param subject one-line subject
 * @param body plain-text body
 * @since 0.1.0
 */
public record AlertMessage(String incidentId, List<String> recipients, String subject, String body) {

  public AlertMessage {
    incidentId = Objects.requireNonNull(incidentId, "incidentId");
    recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
    if (recipients.isEmpty()) {
      throw new IllegalArgumentException("recipients must not be empty");
    }
    subject = Objects.requireNonNull(subject, "subject");
    body = Objects.requireNonNull(body, "body");
  }
}
