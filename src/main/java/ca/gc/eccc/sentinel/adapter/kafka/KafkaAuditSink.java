package ca.gc.eccc.sentinel.adapter.kafka;

import ca.gc.eccc.sentinel.application.port.AuditSink;
import ca.gc.eccc.sentinel.application.port.AuditSinkException;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import ca.gc.eccc.sentinel.infrastructure.audit.AuditRecordJson;
import ca.gc.eccc.sentinel.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;

/**
 * {@link AuditSink} publishing audit records to a Kafka topic, keyed by incident id.
 *
 * <p>Each append waits for the broker acknowledgement so an unreachable cluster surfaces as
 * {@link AuditSinkException} instead of silently buffering. Values use the same JSON shape as the
 * JSON-lines audit log, so a consumer can write the topic to a file that {@code sentinel replay} reads.</p>
 *
 * @since 0.1.0
 */
public final class KafkaAuditSink implements AuditSink {

  private final Producer<String, String> producer;
  private final String topic;
  private final Duration ackTimeout;
  private final AuditRecordJson codec = new AuditRecordJson();

  /**
   * Builds a sink backed by a new producer.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic audit topic
   * @param appendTimeout upper bound on one append, blocking send included
   */
  public KafkaAuditSink(String bootstrapServers, String topic, Duration appendTimeout) {
    this(KafkaProducers.create(bootstrapServers, "sentinel-audit", appendTimeout), topic, appendTimeout);
  }

  KafkaAuditSink(Producer<String, String> producer, String topic, Duration ackTimeout) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaAuditTopic", topic);
    this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
  }

  @Override
  public void append(AuditRecord record) throws AuditSinkException {
    Objects.requireNonNull(record, "record");
    String key = record.incidentId().value();
    long deadline = System.nanoTime() + ackTimeout.toNanos();
    try {
      Future<RecordMetadata> ack = producer.send(new ProducerRecord<>(topic, key, codec.encode(record)));
      // time spent blocked in send counts against the same budget
      ack.get(Math.max(1L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      throw new AuditSinkException("no acknowledgement from " + topic + " within " + ackTimeout.toMillis()
          + " ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AuditSinkException("interrupted publishing audit record", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new AuditSinkException("unable to publish audit record to " + topic + ": " + cause.getMessage(), cause);
    } catch (KafkaException ex) {
      throw new AuditSinkException("unable to publish audit record to " + topic + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() throws AuditSinkException {
    try {
      producer.flush();
    } catch (KafkaException ex) {
      throw new AuditSinkException("unable to flush audit topic " + topic, ex);
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }
}
