package ca.gc.eccc.sentinel.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.eccc.sentinel.application.port.DeliveryException;
import ca.gc.eccc.sentinel.domain.alert.AlertMessage;
import ca.gc.eccc.sentinel.domain.alert.DeliveryReceipt;
import ca.gc.eccc.sentinel.infrastructure.json.JsonTree;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.NotEnoughReplicasException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.junit.jupiter.api.Test;

class KafkaAlertNotifierTest {
  private static final AlertMessage MESSAGE = new AlertMessage("toronto-1-1000",
      List.of("ops@example.org", "duty@example.org"),
      "Weather Alert: High severity weather event in Toronto", "Line one\nLine \"two\"");

  @Test
  void publishesAlertKeyedByIncident() throws Exception {
    MockProducer<String, String> producer = MockProducerFactory.acknowledging();
    KafkaAlertNotifier notifier = new KafkaAlertNotifier(producer, "sentinel.alerts");

    DeliveryReceipt receipt = notifier.send(MESSAGE, Duration.ofSeconds(1));

    assertEquals("sentinel.alerts-0@0", receipt.reference());
    List<ProducerRecord<String, String>> history = producer.history();
    assertEquals(1, history.size());
    ProducerRecord<String, String> record = history.get(0);
    assertEquals("sentinel.alerts", record.topic());
    assertEquals("toronto-1-1000", record.key());
    Map<String, Object> json = new JsonTree().parseObject(record.value());
    assertEquals(List.of("ops@example.org", "duty@example.org"), json.get("recipients"));
    assertEquals("Line one\nLine \"two\"", json.get("body"));
    assertEquals(MESSAGE.subject(), json.get("subject"));
  }

  @Test
  void missingAcknowledgementIsTransientTimeout() {
    KafkaAlertNotifier notifier = new KafkaAlertNotifier(MockProducerFactory.manual(), "sentinel.alerts");

    DeliveryException ex =
        assertThrows(DeliveryException.class, () -> notifier.send(MESSAGE, Duration.ofMillis(50)));

    assertEquals("timeout", ex.code());
    assertTrue(ex.isTransient());
  }

  @Test
  void retriableBrokerErrorIsTransient() throws Exception {
    MockProducer<String, String> producer = MockProducerFactory.manual();
    KafkaAlertNotifier notifier = new KafkaAlertNotifier(producer, "sentinel.alerts");
    Thread failer = MockProducerFactory.failPendingSend(producer, new NotEnoughReplicasException("isr shrank"));

    DeliveryException ex =
        assertThrows(DeliveryException.class, () -> notifier.send(MESSAGE, Duration.ofSeconds(5)));
    failer.join(5_000);

    assertEquals("kafka-retriable", ex.code());
    assertTrue(ex.isTransient());
  }

  @Test
  void nonRetriableBrokerErrorIsTerminal() throws Exception {
    MockProducer<String, String> producer = MockProducerFactory.manual();
    KafkaAlertNotifier notifier = new KafkaAlertNotifier(producer, "sentinel.alerts");
    Thread failer = MockProducerFactory.failPendingSend(producer, new RecordTooLargeException("too big"));

    DeliveryException ex =
        assertThrows(DeliveryException.class, () -> notifier.send(MESSAGE, Duration.ofSeconds(5)));
    failer.join(5_000);

    assertEquals("kafka-error", ex.code());
    assertFalse(ex.isTransient());
  }

  @Test
  void malformedRecipientIsRejectedBeforePublishing() {
    MockProducer<String, String> producer = MockProducerFactory.acknowledging();
    KafkaAlertNotifier notifier = new KafkaAlertNotifier(producer, "sentinel.alerts");
    AlertMessage bad = new AlertMessage("x-1-1", List.of("two words"), "s", "b");

    assertThrows(DeliveryException.class, () -> notifier.send(bad, Duration.ofSeconds(1)));
    assertTrue(producer.history().isEmpty());
  }

  @Test
  void rejectsInvalidTopicName() {
    assertThrows(IllegalArgumentException.class,
        () -> new KafkaAlertNotifier(MockProducerFactory.acknowledging(), "alerts topic"));
  }

  @Test
  void closeFlushesAndClosesProducer() {
    MockProducer<String, String> producer = MockProducerFactory.acknowledging();
    KafkaAlertNotifier notifier = new KafkaAlertNotifier(producer, "sentinel.alerts");

    notifier.close();

    assertTrue(producer.closed());
  }
}
