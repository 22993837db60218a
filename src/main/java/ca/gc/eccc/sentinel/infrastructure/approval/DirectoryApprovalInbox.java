package ca.gc.eccc.sentinel.infrastructure.approval;

import ca.gc.eccc.sentinel.application.port.ApprovalNoticePort;
import ca.gc.eccc.sentinel.application.workflow.ApprovalGate;
import ca.gc.eccc.sentinel.application.workflow.InvalidStateException;
import ca.gc.eccc.sentinel.domain.alert.ResponsePlan;
import ca.gc.eccc.sentinel.domain.approval.ApprovalDecision;
import ca.gc.eccc.sentinel.domain.approval.ApprovalRequest;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.incident.Incident;
import ca.gc.eccc.sentinel.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> File-based operator surface for approval requests.
 * <p><strong>Why:</strong> Operators approve or reject suspended incidents without a network service:
 * each pending request appears as {@code <requestId>.pending} in the inbox directory and a decision is
 * submitted by dropping {@code <requestId>.decision} next to it.</p>
 * <p><strong>Decision file:</strong> first non-blank line {@code approve} or {@code reject}; an optional
 * {@code operator=NAME} line names the operator. Lines starting with {@code #} are ignored.</p>
 * <p><strong>Thread-safety:</strong> polling runs on the supplied scheduler; {@link #pollOnce()} is
 * synchronized so a manual poll never races the scheduled one.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryApprovalInbox implements ApprovalNoticePort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DirectoryApprovalInbox.class);

  public static final String PENDING_SUFFIX = ".pending";
  public static final String DECISION_SUFFIX = ".decision";
  public static final String PROCESSED_SUFFIX = ".processed";
  public static final String IGNORED_SUFFIX = ".ignored";
  static final String DEFAULT_OPERATOR = "inbox";

  private final Path directory;
  private final ApprovalGate gate;
  private final ScheduledExecutorService scheduler;
  private final Duration pollInterval;
  private ScheduledFuture<?> polling;

  /**
   * Creates an inbox.
   *
   * @param directory inbox directory; created on {@link #start()} when missing
   * @param gate gate that receives decisions
   * @param scheduler scheduler running the poll loop
   * @param pollInterval delay between polls
   */
  public DirectoryApprovalInbox(
      Path directory, ApprovalGate gate, ScheduledExecutorService scheduler, Duration pollInterval) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
  }

  /**
   * Creates the directory and starts polling for decision files.
   *
   * @throws IOException when the directory cannot be created
   */
  public synchronized void start() throws IOException {
    if (polling != null) {
      return;
    }
    Files.createDirectories(directory);
    long millis = pollInterval.toMillis();
    polling = scheduler.scheduleWithFixedDelay(this::pollSafely, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Approval inbox {} polling every {} ms", directory, millis);
  }

  @Override
  public void requested(ApprovalRequest request, Incident incident) {
    Path target = directory.resolve(request.requestId() + PENDING_SUFFIX);
    try {
      writeAtomically(target, renderNotice(request, incident));
      log.info("Approval request {} awaiting decision in {}", request.requestId(), target);
    } catch (IOException ex) {
      log.warn("Unable to publish approval request {} to {}: {}", request.requestId(), directory,
          ex.getMessage());
    }
  }

  @Override
  public void resolved(ApprovalRequest request) {
    try {
      Files.deleteIfExists(directory.resolve(request.requestId() + PENDING_SUFFIX));
    } catch (IOException ex) {
      log.warn("Unable to withdraw approval notice {}: {}", request.requestId(), ex.getMessage());
    }
  }

  /**
   * Applies every decision file currently in the inbox.
   *
   * @return number of decisions accepted by the gate
   */
  public synchronized int pollOnce() {
    List<Path> decisions = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + DECISION_SUFFIX)) {
      stream.forEach(decisions::add);
    } catch (IOException ex) {
      log.warn("Unable to scan approval inbox {}: {}", directory, ex.getMessage());
      return 0;
    }
    decisions.sort(null);
    int accepted = 0;
    for (Path file : decisions) {
      if (apply(file)) {
        accepted++;
      }
    }
    return accepted;
  }

  @Override
  public synchronized void close() {
    if (polling != null) {
      polling.cancel(false);
      polling = null;
    }
  }

  public Path directory() {
    return directory;
  }

  /**
   * Writes a decision file for a request.
   *
   * @param directory inbox directory
   * @param requestId request identifier
   * @param decision approve or reject
   * @param operator operator name; blank for none
   * @return written file
   * @throws IOException when the file cannot be written
   */
  public static Path writeDecision(Path directory, String requestId, ApprovalDecision decision, String operator)
      throws IOException {
    Objects.requireNonNull(decision, "decision");
    String id = Strings.requireIdentifier("request", requestId);
    StringBuilder sb = new StringBuilder();
    sb.append(decision == ApprovalDecision.APPROVE ? "approve" : "reject").append('\n');
    if (operator != null && !operator.isBlank()) {
      sb.append("operator=").append(operator.trim()).append('\n');
    }
    Files.createDirectories(directory);
    Path target = directory.resolve(id + DECISION_SUFFIX);
    writeAtomically(target, sb.toString());
    return target;
  }

  /**
   * Parsed decision file.
   *
   * @param decision operator decision
   * @param operator operator name
   */
  record DecisionFile(ApprovalDecision decision, String operator) {
    static DecisionFile parse(String content) {
      ApprovalDecision decision = null;
      String operator = DEFAULT_OPERATOR;
      for (String raw : content.split("\\R")) {
        String line = raw.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        if (line.startsWith("operator=")) {
          String value = line.substring("operator=".length()).trim();
          if (!value.isEmpty()) {
            operator = value;
          }
        } else if (decision == null) {
          decision = ApprovalDecision.parse(line);
        } else {
          throw new IllegalArgumentException("unexpected line in decision file: " + line);
        }
      }
      if (decision == null) {
        throw new IllegalArgumentException("decision file does not name approve or reject");
      }
      return new DecisionFile(decision, operator);
    }
  }

  static String renderNotice(ApprovalRequest request, Incident incident) {
    StringBuilder sb = new StringBuilder(512);
    sb.append("request=").append(request.requestId()).append('\n');
    sb.append("incident=").append(incident.id()).append('\n');
    sb.append("location=").append(incident.location()).append('\n');
    Assessment assessment = incident.assessment();
    if (assessment != null) {
      sb.append("disasterType=").append(assessment.disasterType()).append('\n');
      sb.append("severity=").append(assessment.severity().label()).append('\n');
      if (assessment.severityDefaulted()) {
        sb.append("reportedSeverity=").append(assessment.reportedSeverity()).append('\n');
      }
      sb.append("rationale=").append(oneLine(assessment.rationale())).append('\n');
    }
    if (incident.department() != null) {
      sb.append("department=").append(incident.department().displayName()).append('\n');
    }
    sb.append("requestedAt=").append(request.requestedAt()).append('\n');
    sb.append("deadline=").append(request.deadline()).append('\n');
    ResponsePlan plan = incident.plan();
    if (plan != null) {
      sb.append('\n').append("Response plan:").append('\n').append(plan.text()).append('\n');
    }
    sb.append('\n')
        .append("# To decide, write ").append(request.requestId()).append(DECISION_SUFFIX)
        .append(" containing 'approve' or 'reject' and optionally 'operator=NAME'.").append('\n');
    return sb.toString();
  }

  private boolean apply(Path file) {
    String name = file.getFileName().toString();
    String requestId = name.substring(0, name.length() - DECISION_SUFFIX.length());
    DecisionFile parsed;
    try {
      parsed = DecisionFile.parse(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      log.warn("Unable to read decision file {}: {}", file, ex.getMessage());
      return false;
    } catch (IllegalArgumentException ex) {
      log.warn("Ignoring decision file {}: {}", file, ex.getMessage());
      retire(file, IGNORED_SUFFIX);
      return false;
    }
    try {
      gate.resolve(requestId, parsed.decision(), parsed.operator());
      retire(file, PROCESSED_SUFFIX);
      return true;
    } catch (InvalidStateException | IllegalArgumentException ex) {
      log.warn("Decision {} for {} not applied: {}", parsed.decision(), requestId, ex.getMessage());
      retire(file, IGNORED_SUFFIX);
      return false;
    }
  }

  private void retire(Path file, String suffix) {
    String name = file.getFileName().toString();
    Path target = file.resolveSibling(name.substring(0, name.length() - DECISION_SUFFIX.length()) + suffix);
    try {
      Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      log.warn("Unable to rename decision file {} to {}: {}", file, target, ex.getMessage());
    }
  }

  private void pollSafely() {
    try {
      pollOnce();
    } catch (RuntimeException ex) {
      log.error("Approval inbox poll failed", ex);
    }
  }

  private static void writeAtomically(Path target, String content) throws IOException {
    Path temp = Files.createTempFile(target.getParent(), ".inbox-", ".tmp");
    try {
      Files.writeString(temp, content, StandardCharsets.UTF_8);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static String oneLine(String text) {
    return text == null ? "" : text.replaceAll("\\s+", " ").trim();
  }
}
