package ca.gc.eccc.sentinel.infrastructure.notify;

import ca.gc.eccc.sentinel.application.port.DeliveryException;
import ca.gc.eccc.sentinel.application.port.Notifier;
import ca.gc.eccc.sentinel.domain.alert.AlertMessage;
import ca.gc.eccc.sentinel.domain.alert.DeliveryReceipt;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Notifier} that drops each alert as a mail-style text file ({@code <incidentId>.alert.txt}) for a
 * downstream mail relay to pick up.
 *
 * <p>Files are written to a temporary name and moved into place, so the relay never sees a partial alert.
 * Delivery is keyed by incident: a second send for an incident that already has a file keeps the first
 * file and reports success. I/O errors are transient.</p>
 *
 * @since 0.1.0
 */
public final class FileAlertNotifier implements Notifier {
  private static final Logger log = LoggerFactory.getLogger(FileAlertNotifier.class);
  static final String EXTENSION = ".alert.txt";

  private final Path outputDirectory;

  public FileAlertNotifier(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  @Override
  public synchronized DeliveryReceipt send(AlertMessage message, Duration timeout) throws DeliveryException {
    Objects.requireNonNull(message, "message");
    Recipients.requireAddressable(message.recipients());
    Path target = outputDirectory.resolve(sanitize(message.incidentId()) + EXTENSION);
    if (Files.exists(target)) {
      log.info("Alert for {} already delivered to {}", message.incidentId(), target);
      return new DeliveryReceipt(target.toString());
    }
    Path temp = null;
    try {
      Files.createDirectories(outputDirectory);
      temp = Files.createTempFile(outputDirectory, ".alert-", ".tmp");
      Files.writeString(temp, render(message), StandardCharsets.UTF_8);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, target);
      }
      log.info("Alert for {} written to {}", message.incidentId(), target);
      return new DeliveryReceipt(target.toString());
    } catch (IOException ex) {
      deleteQuietly(temp);
      throw DeliveryException.transientFailure("io-error",
          "unable to write alert for " + message.incidentId() + ": " + ex.getMessage(), ex);
    }
  }

  static String render(AlertMessage message) {
    return "To: " + String.join(", ", message.recipients()) + "\n"
        + "Subject: " + message.subject() + "\n"
        + "X-Sentinel-Incident: " + message.incidentId() + "\n"
        + "\n"
        + message.body() + "\n";
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      log.debug("Unable to delete temporary alert file {}", temp, ex);
    }
  }

  private static String sanitize(String id) {
    StringBuilder sb = new StringBuilder(id.length());
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      sb.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' ? c : '_');
    }
    return sb.length() == 0 ? "alert" : sb.toString();
  }
}
