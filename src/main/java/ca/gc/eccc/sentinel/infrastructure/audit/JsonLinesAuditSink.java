package ca.gc.eccc.sentinel.infrastructure.audit;

import ca.gc.eccc.sentinel.application.port.AuditSink;
import ca.gc.eccc.sentinel.application.port.AuditSinkException;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link AuditSink} appending one JSON object per line to a file.
 * <p><strong>Why:</strong> The file is the durable incident data log; {@code sentinel replay} reads it back.</p>
 * <p><strong>Thread-safety:</strong> {@link #append(AuditRecord)} is synchronized and flushes each line, so
 * concurrent incidents never interleave partial lines.</p>
 * <p><strong>Recovery:</strong> after a write failure the writer is discarded and reopened on the next
 * append, so a transient outage does not disable the sink for the rest of the run.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesAuditSink implements AuditSink {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditSink.class);

  private final Path file;
  private final AuditRecordJson codec = new AuditRecordJson();
  private BufferedWriter writer;
  private boolean closed;

  public JsonLinesAuditSink(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public synchronized void append(AuditRecord record) throws AuditSinkException {
    Objects.requireNonNull(record, "record");
    if (closed) {
      throw new AuditSinkException("audit log " + file + " is closed");
    }
    String line = codec.encode(record);
    try {
      BufferedWriter out = writer();
      out.write(line);
      out.newLine();
      out.flush();
    } catch (IOException ex) {
      discardWriter();
      throw new AuditSinkException("unable to append to audit log " + file + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public synchronized void close() throws AuditSinkException {
    closed = true;
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } catch (IOException ex) {
      throw new AuditSinkException("unable to close audit log " + file, ex);
    } finally {
      writer = null;
    }
  }

  public Path file() {
    return file;
  }

  private BufferedWriter writer() throws IOException {
    if (writer == null) {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
      log.debug("Opened audit log {}", file);
    }
    return writer;
  }

  private void discardWriter() {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } catch (IOException ex) {
      log.debug("Ignoring close failure on broken audit writer", ex);
    }
    writer = null;
  }
}
