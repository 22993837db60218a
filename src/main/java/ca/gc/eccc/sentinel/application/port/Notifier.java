package ca.gc.eccc.sentinel.application.port;

import ca.gc.eccc.sentinel.domain.alert.AlertMessage;
import ca.gc.eccc.sentinel.domain.alert.DeliveryReceipt;
import java.time.Duration;

/**
 * <strong>What:</strong> Port delivering a formatted alert to its recipients.
 * <p><strong>Why:</strong> Decouples dispatch from the transport (log, file drop, Kafka topic).</p>
 * <p><strong>Role:</strong> Capability port implemented by {@code LoggingAlertNotifier},
 * {@code FileAlertNotifier} and {@code KafkaAlertNotifier}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent sends.</p>
 * <p><strong>Observability:</strong> The workflow counts every attempt as {@code dispatch.attempts}.</p>
 *
 * @since 0.1.0
 */
public interface Notifier {
  /** Capability name used in failures, logs and audit payloads. */
  String CAPABILITY = "notifier";

  /**
   * Sends one alert.
   *
   * @param message alert to deliver; never {@code null}
   * @param timeout call budget
   * @return acknowledgement
   * @throws DeliveryException classified as transient or terminal
   */
  DeliveryReceipt send(AlertMessage message, Duration timeout) throws DeliveryException;
}
