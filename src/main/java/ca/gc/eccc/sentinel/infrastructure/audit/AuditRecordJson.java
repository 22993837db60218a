package ca.gc.eccc.sentinel.infrastructure.audit;

import ca.gc.eccc.sentinel.domain.audit.AuditEventKind;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import ca.gc.eccc.sentinel.infrastructure.json.JsonTree;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-line JSON form of an {@link AuditRecord}.
 *
 * <pre>{"incidentId":"ottawa-1-1700000000000","location":"Ottawa","sequence":1,"kind":"OBSERVED",
 * "state":"OBSERVED","timestamp":"2024-01-01T00:00:00Z","payload":{"attempts":"1"}}</pre>
 *
 * @since 0.1.0
 */
public final class AuditRecordJson {
  private final JsonFactory factory = new JsonFactory();
  private final JsonTree tree = new JsonTree(factory);

  /**
   * Encodes a record as one line of JSON (no trailing newline).
   *
   * @param record record to encode
   * @return JSON text
   */
  public String encode(AuditRecord record) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("incidentId", record.incidentId().value());
      gen.writeStringField("location", record.location());
      gen.writeNumberField("sequence", record.sequence());
      gen.writeStringField("kind", record.kind().name());
      gen.writeStringField("state", record.state().name());
      gen.writeStringField("timestamp", record.timestamp().toString());
      gen.writeObjectFieldStart("payload");
      for (Map.Entry<String, String> entry : record.payload().entrySet()) {
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("unable to encode audit record", ex);
    }
    return out.toString();
  }

  /**
   * Decodes one JSON line.
   *
   * @param line JSON text
   * @return decoded record
   * @throws IllegalArgumentException when the line is not a valid audit record
   */
  public AuditRecord decode(String line) {
    Map<String, Object> doc = tree.parseObject(line);
    try {
      Map<String, String> payload = new LinkedHashMap<>();
      Object rawPayload = doc.get("payload");
      if (rawPayload instanceof Map<?, ?> map) {
        map.forEach((k, v) -> payload.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
      }
      return new AuditRecord(
          new IncidentId(required(doc, "incidentId")),
          required(doc, "location"),
          (long) JsonTree.readDouble(doc, "sequence"),
          AuditEventKind.valueOf(required(doc, "kind")),
          IncidentState.valueOf(required(doc, "state")),
          Instant.parse(required(doc, "timestamp")),
          payload);
    } catch (DateTimeParseException | NullPointerException ex) {
      throw new IllegalArgumentException("invalid audit record: " + ex.getMessage(), ex);
    }
  }

  private static String required(Map<String, Object> doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      throw new IllegalArgumentException("audit record missing " + field);
    }
    return String.valueOf(value);
  }
}
