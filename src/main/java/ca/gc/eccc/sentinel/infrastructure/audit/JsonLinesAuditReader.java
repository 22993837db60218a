package ca.gc.eccc.sentinel.infrastructure.audit;

import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads audit records written by {@link JsonLinesAuditSink}.
 *
 * @since 0.1.0
 */
public final class JsonLinesAuditReader {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditReader.class);

  private final AuditRecordJson codec = new AuditRecordJson();

  /**
   * Records read from a file, plus the number of lines that could not be decoded.
   *
   * @param records decoded records in file order
   * @param malformedLines lines skipped because they were not valid records
   */
  public record Result(List<AuditRecord> records, int malformedLines) {
    public Result {
      records = List.copyOf(records);
    }
  }

  /**
   * Reads every record in the file. Blank lines are ignored; malformed lines are skipped and counted.
   *
   * @param file audit log
   * @return records and malformed line count
   * @throws IOException when the file cannot be read
   */
  public Result read(Path file) throws IOException {
    List<AuditRecord> records = new ArrayList<>();
    int malformed = 0;
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        try {
          records.add(codec.decode(line));
        } catch (IllegalArgumentException ex) {
          malformed++;
          log.warn("Skipping malformed audit line {} in {}: {}", lineNumber, file, ex.getMessage());
        }
      }
    }
    return new Result(records, malformed);
  }
}
