package ca.gc.eccc.sentinel.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.eccc.sentinel.application.port.AuditSinkException;
import ca.gc.eccc.sentinel.domain.audit.AuditEventKind;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import ca.gc.eccc.sentinel.infrastructure.audit.AuditRecordJson;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.Test;

class KafkaAuditSinkTest {
  private static final AuditRecord RECORD = new AuditRecord(new IncidentId("calgary-3-1000"), "Calgary", 2,
      AuditEventKind.CLASSIFIED, IncidentState.CLASSIFIED, Instant.parse("2026-03-01T12:00:00Z"),
      Map.of("severity", "HIGH"));

  @Test
  void publishesRecordKeyedByIncident() throws Exception {
    MockProducer<String, String> producer = MockProducerFactory.acknowledging();
    KafkaAuditSink sink = new KafkaAuditSink(producer, "sentinel.audit", Duration.ofSeconds(1));

    sink.append(RECORD);

    ProducerRecord<String, String> published = producer.history().get(0);
    assertEquals("sentinel.audit", published.topic());
    assertEquals("calgary-3-1000", published.key());
    assertEquals(RECORD, new AuditRecordJson().decode(published.value()));
  }

  @Test
  void missingAcknowledgementFailsAppend() {
    KafkaAuditSink sink = new KafkaAuditSink(MockProducerFactory.manual(), "sentinel.audit", Duration.ofMillis(50));

    AuditSinkException ex = assertThrows(AuditSinkException.class, () -> sink.append(RECORD));
    assertTrue(ex.getMessage().contains("no acknowledgement"));
  }

  @Test
  void blockedSendCountsAgainstTheAppendTimeout() {
    KafkaAuditSink sink = new KafkaAuditSink(
        MockProducerFactory.blockingThenPending(Duration.ofMillis(600)), "sentinel.audit", Duration.ofMillis(700));

    long started = System.nanoTime();
    AuditSinkException ex = assertThrows(AuditSinkException.class, () -> sink.append(RECORD));
    long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;

    assertTrue(ex.getMessage().contains("no acknowledgement"));
    assertTrue(elapsedMillis < 1_200L, "append took " + elapsedMillis + " ms");
  }

  @Test
  void producerFailureFailsAppend() {
    MockProducer<String, String> producer = MockProducerFactory.acknowledging();
    producer.sendException = new KafkaException("producer fenced");
    KafkaAuditSink sink = new KafkaAuditSink(producer, "sentinel.audit", Duration.ofSeconds(1));

    assertThrows(AuditSinkException.class, () -> sink.append(RECORD));
  }

  @Test
  void closeReleasesProducer() throws Exception {
    MockProducer<String, String> producer = MockProducerFactory.acknowledging();
    KafkaAuditSink sink = new KafkaAuditSink(producer, "sentinel.audit", Duration.ofSeconds(1));

    sink.close();

    assertTrue(producer.closed());
  }
}
