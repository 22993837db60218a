package ca.gc.eccc.sentinel.adapter.kafka;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;

/** Producer construction shared by the Kafka adapters. */
final class KafkaProducers {
  static final int LINGER_MS = 5;

  private KafkaProducers() {}

  static Producer<String, String> create(String bootstrapServers, String clientId, Duration sendBound) {
    return new KafkaProducer<>(properties(bootstrapServers, clientId, sendBound));
  }

  /**
   * Producer settings. {@code sendBound} caps how long {@code send} may block on metadata or a full
   * buffer and how long a record may wait for delivery, so an unreachable cluster fails fast.
   */
  static Properties properties(String bootstrapServers, String clientId, Duration sendBound) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    Objects.requireNonNull(sendBound, "sendBound");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    if (sendBound.isZero() || sendBound.isNegative()) {
      throw new IllegalArgumentException("sendBound must be positive");
    }
    int boundMillis = (int) Math.min(Integer.MAX_VALUE - LINGER_MS, Math.max(1L, sendBound.toMillis()));
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.LINGER_MS_CONFIG, LINGER_MS);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, (long) boundMillis);
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, boundMillis);
    // delivery.timeout.ms must be at least linger.ms + request.timeout.ms
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, boundMillis + LINGER_MS);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return props;
  }
}
