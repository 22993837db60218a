package ca.gc.eccc.sentinel.infrastructure.notify;

import ca.gc.eccc.sentinel.application.port.DeliveryException;
import ca.gc.eccc.sentinel.application.port.Notifier;
import ca.gc.eccc.sentinel.domain.alert.AlertMessage;
import ca.gc.eccc.sentinel.domain.alert.DeliveryReceipt;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Notifier} that writes alerts to the {@value #ALERT_LOGGER} logger. Default transport for dry runs
 * and local operation.
 *
 * @since 0.1.0
 */
public final class LoggingAlertNotifier implements Notifier {
  /** Logger receiving dispatched alerts. */
  public static final String ALERT_LOGGER = "ca.gc.eccc.sentinel.alerts";

  private static final Logger alerts = LoggerFactory.getLogger(ALERT_LOGGER);

  @Override
  public DeliveryReceipt send(AlertMessage message, Duration timeout) throws DeliveryException {
    Recipients.requireAddressable(message.recipients());
    alerts.info("ALERT to {}\nSubject: {}\n{}", String.join(", ", message.recipients()),
        message.subject(), message.body());
    return new DeliveryReceipt("log:" + message.incidentId());
  }
}
