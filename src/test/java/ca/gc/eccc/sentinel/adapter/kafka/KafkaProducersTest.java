package ca.gc.eccc.sentinel.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Properties;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;

class KafkaProducersTest {

  @Test
  void sendBoundCapsBlockingAndDelivery() {
    Properties props = KafkaProducers.properties(" broker:9092 ", "sentinel-audit", Duration.ofSeconds(2));

    assertEquals("broker:9092", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals(2_000L, props.get(ProducerConfig.MAX_BLOCK_MS_CONFIG));
    assertEquals(2_000, props.get(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG));
    assertEquals(2_000 + KafkaProducers.LINGER_MS, props.get(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG));
    assertEquals("all", props.get(ProducerConfig.ACKS_CONFIG));
  }

  @Test
  void rejectsBlankServersAndNonPositiveBound() {
    assertThrows(IllegalArgumentException.class,
        () -> KafkaProducers.properties("  ", "sentinel-audit", Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> KafkaProducers.properties("broker:9092", "sentinel-audit", Duration.ZERO));
  }
}
