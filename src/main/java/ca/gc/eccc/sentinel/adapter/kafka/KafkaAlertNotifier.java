package ca.gc.eccc.sentinel.adapter.kafka;

import ca.gc.eccc.sentinel.application.port.DeliveryException;
import ca.gc.eccc.sentinel.application.port.FailureKind;
import ca.gc.eccc.sentinel.application.port.Notifier;
import ca.gc.eccc.sentinel.domain.alert.AlertMessage;
import ca.gc.eccc.sentinel.domain.alert.DeliveryReceipt;
import ca.gc.eccc.sentinel.infrastructure.notify.Recipients;
import ca.gc.eccc.sentinel.validation.Strings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.RetriableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Notifier} publishing each alert as a JSON record to a Kafka topic.
 * <p><strong>Why:</strong> Lets a downstream mail or paging service fan alerts out to recipients.</p>
 * <p><strong>Delivery:</strong> {@link #send(AlertMessage, Duration)} waits for the broker acknowledgement
 * within the call budget. Retriable broker errors and timeouts are transient; every other producer error is
 * terminal.</p>
 * <p><strong>Thread-safety:</strong> Delegates to the provided {@link Producer}; the default
 * {@link KafkaProducer} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class KafkaAlertNotifier implements Notifier, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(KafkaAlertNotifier.class);

  private final Producer<String, String> producer;
  private final String topic;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Builds a notifier backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic destination topic
   * @param sendBound longest time the producer may block or wait for delivery of one alert
   */
  public KafkaAlertNotifier(String bootstrapServers, String topic, Duration sendBound) {
    this(KafkaProducers.create(bootstrapServers, "sentinel-alerts", sendBound), topic);
  }

  KafkaAlertNotifier(Producer<String, String> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaAlertsTopic", topic);
  }

  @Override
  public DeliveryReceipt send(AlertMessage message, Duration timeout) throws DeliveryException {
    Objects.requireNonNull(message, "message");
    Recipients.requireAddressable(message.recipients());
    long deadline = System.nanoTime() + timeout.toNanos();
    Future<RecordMetadata> ack;
    try {
      ack = producer.send(new ProducerRecord<>(topic, message.incidentId(), toJson(message)));
    } catch (RetriableException ex) {
      throw DeliveryException.transientFailure("kafka-retriable", ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      throw new DeliveryException(
          FailureKind.TERMINAL, "kafka-error", ex.getMessage(), ex);
    }
    try {
      RecordMetadata metadata = ack.get(Math.max(1L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      String reference = metadata.topic() + "-" + metadata.partition() + "@" + metadata.offset();
      log.info("Alert for {} published to {}", message.incidentId(), reference);
      return new DeliveryReceipt(reference);
    } catch (TimeoutException ex) {
      ack.cancel(true);
      throw DeliveryException.transientFailure("timeout",
          "no broker acknowledgement within " + timeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw DeliveryException.transientFailure("interrupted", "interrupted awaiting acknowledgement", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof RetriableException) {
        throw DeliveryException.transientFailure("kafka-retriable", cause.getMessage(), cause);
      }
      throw new DeliveryException(
          FailureKind.TERMINAL, "kafka-error", cause.getMessage(), cause);
    }
  }

  @Override
  public void close() {
    try {
      producer.flush();
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }

  String toJson(AlertMessage message) {
    StringWriter out = new StringWriter(message.body().length() + 256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("incidentId", message.incidentId());
      gen.writeArrayFieldStart("recipients");
      for (String recipient : message.recipients()) {
        gen.writeString(recipient);
      }
      gen.writeEndArray();
      gen.writeStringField("subject", message.subject());
      gen.writeStringField("body", message.body());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("unable to encode alert", ex);
    }
    return out.toString();
  }
}
