package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.application.port.ClockPort;
import ca.gc.eccc.sentinel.application.port.MetricsPort;
import ca.gc.eccc.sentinel.domain.approval.ApprovalDecision;
import ca.gc.eccc.sentinel.domain.approval.ApprovalRequest;
import ca.gc.eccc.sentinel.domain.approval.ApprovalResolution;
import ca.gc.eccc.sentinel.domain.incident.Incident;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Store of approval requests that suspends incidents until a human decides or the
 * deadline passes.
 * <p><strong>Why:</strong> Medium and low severity alerts must be confirmed by an operator, but the engine
 * must never wait forever for that confirmation.</p>
 * <p><strong>Thread-safety:</strong> Create, resolve and expire are mutually exclusive under the gate's
 * monitor; the first final resolution wins. Listeners run outside the monitor on the resolving thread
 * (operator thread or expiry timer).</p>
 *
 * <p>Each incident gets at most one request, ever. Once resolved or expired a request cannot be resolved
 * again and is never re-opened. Requests dropped by {@link #forget(IncidentId)} are retained as
 * final resolutions, up to {@value #RETIRED_CAPACITY} of them, so late decisions still fail with
 * {@link InvalidStateException}.</p>
 *
 * @since 0.1.0
 */
public final class ApprovalGate implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

  /** Operator name recorded for timer expirations. */
  public static final String EXPIRY_ACTOR = "expiry-timer";

  /** Number of forgotten requests whose final resolution is remembered. */
  public static final int RETIRED_CAPACITY = 4096;

  /** Callback fired exactly once when a request reaches its final resolution. */
  @FunctionalInterface
  public interface Listener {
    void onResolved(ApprovalRequest request);
  }

  private final ClockPort clock;
  private final Duration timeout;
  private final ScheduledExecutorService timer;
  private final MetricsPort metrics;

  private final Map<String, ApprovalRequest> requests = new HashMap<>();
  private final Map<IncidentId, String> requestByIncident = new HashMap<>();
  private final Map<String, Listener> listeners = new HashMap<>();
  private final Map<String, ScheduledFuture<?>> expiryTasks = new HashMap<>();
  private final Map<String, ApprovalRequest> retired = new LinkedHashMap<>(16, 0.75f, false) {
    @Override
    protected boolean removeEldestEntry(Map.Entry<String, ApprovalRequest> eldest) {
      return size() > RETIRED_CAPACITY;
    }
  };

  /**
   * Creates a gate.
   *
   * @param clock clock used for request timestamps and deadline checks
   * @param timeout time a request stays pending before it expires
   * @param timer scheduler that fires expiry tasks
   * @param metrics receives {@code approval.requested} and {@code approval.expired}
   */
  public ApprovalGate(
      ClockPort clock, Duration timeout, ScheduledExecutorService timer, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.timer = Objects.requireNonNull(timer, "timer");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
  }

  /**
   * Creates the approval request for an incident, or returns the one it already has.
   *
   * @param incident incident to suspend
   * @param listener notified once when the request is resolved or expires; ignored when a request exists
   * @return the incident's request
   */
  public ApprovalRequest requestApproval(Incident incident, Listener listener) {
    Objects.requireNonNull(incident, "incident");
    synchronized (this) {
      String existingId = requestByIncident.get(incident.id());
      if (existingId != null) {
        return requests.get(existingId);
      }
      String requestId = requestIdFor(incident.id());
      ApprovalRequest finished = retired.get(requestId);
      if (finished != null) {
        return finished;
      }
      Instant now = clock.now();
      ApprovalRequest request =
          ApprovalRequest.pending(requestId, incident.id(), now, now.plus(timeout));
      requests.put(requestId, request);
      requestByIncident.put(incident.id(), requestId);
      if (listener != null) {
        listeners.put(requestId, listener);
      }
      scheduleExpiry(requestId);
      metrics.increment("approval.requested");
      log.info("Approval requested {} for incident {} (deadline {})",
          requestId, incident.id(), request.deadline());
      return request;
    }
  }

  /**
   * Applies an operator decision.
   *
   * @param requestId request identifier
   * @param decision approve or reject
   * @param operator operator name recorded on the request
   * @return resolved request
   * @throws IllegalArgumentException when the request id is unknown
   * @throws InvalidStateException when the request is already resolved or expired
   */
  public ApprovalRequest resolve(String requestId, ApprovalDecision decision, String operator) {
    Objects.requireNonNull(decision, "decision");
    ApprovalRequest resolved;
    Listener listener;
    ApprovalRequest expired = null;
    Listener expiredListener = null;
    ApprovalResolution finalResolution;
    synchronized (this) {
      ApprovalRequest current = requests.get(requestId);
      if (current == null) {
        current = retired.get(requestId);
      }
      if (current == null) {
        throw new IllegalArgumentException("unknown approval request: " + requestId);
      }
      if (current.isPending() && !clock.now().isBefore(current.deadline())) {
        expired = expireLocked(current);
        expiredListener = listeners.remove(requestId);
        current = expired;
      }
      finalResolution = current.resolution();
      if (!current.isPending()) {
        resolved = null;
        listener = null;
      } else {
        resolved = current.resolve(decision.resolution(), clock.now(), operator);
        requests.put(requestId, resolved);
        cancelExpiry(requestId);
        listener = listeners.remove(requestId);
      }
    }
    if (expired != null) {
      notifyListener(expiredListener, expired);
    }
    if (resolved == null) {
      throw new InvalidStateException(
          "approval request " + requestId + " already " + finalResolution);
    }
    log.info("Approval request {} resolved {} by {}", requestId, resolved.resolution(),
        resolved.resolvedBy());
    notifyListener(listener, resolved);
    return resolved;
  }

  /**
   * Expires a pending request. Called by the expiry timer; the timer firing is authoritative.
   *
   * @param requestId request identifier
   * @return {@code true} when the request was pending and is now expired
   */
  public boolean expire(String requestId) {
    ApprovalRequest expired;
    Listener listener;
    synchronized (this) {
      ApprovalRequest current = requests.get(requestId);
      if (current == null || !current.isPending()) {
        return false;
      }
      expired = expireLocked(current);
      listener = listeners.remove(requestId);
    }
    notifyListener(listener, expired);
    return true;
  }

  /**
   * Expires every pending request whose deadline has passed according to the clock.
   *
   * @return number of requests expired
   */
  public int expireOverdue() {
    List<String> overdue = new ArrayList<>();
    synchronized (this) {
      Instant now = clock.now();
      for (ApprovalRequest request : requests.values()) {
        if (request.isPending() && !now.isBefore(request.deadline())) {
          overdue.add(request.requestId());
        }
      }
    }
    int count = 0;
    for (String requestId : overdue) {
      if (expire(requestId)) {
        count++;
      }
    }
    return count;
  }

  public synchronized Optional<ApprovalRequest> find(String requestId) {
    ApprovalRequest request = requests.get(requestId);
    return Optional.ofNullable(request != null ? request : retired.get(requestId));
  }

  public synchronized Optional<ApprovalRequest> findByIncident(IncidentId incidentId) {
    String requestId = requestByIncident.get(incidentId);
    return requestId == null ? Optional.empty() : Optional.ofNullable(requests.get(requestId));
  }

  /**
   * Lists requests still awaiting a decision.
   *
   * @return snapshot of pending requests
   */
  public synchronized List<ApprovalRequest> pending() {
    List<ApprovalRequest> result = new ArrayList<>();
    for (ApprovalRequest request : requests.values()) {
      if (request.isPending()) {
        result.add(request);
      }
    }
    return result;
  }

  /**
   * Moves the resolved request of a finished incident to the bounded set of retired requests.
   *
   * @param incidentId finished incident
   */
  public synchronized void forget(IncidentId incidentId) {
    String requestId = requestByIncident.get(incidentId);
    if (requestId != null && !requests.get(requestId).isPending()) {
      requestByIncident.remove(incidentId);
      retired.put(requestId, requests.remove(requestId));
    }
  }

  /** Cancels outstanding expiry tasks. Pending requests stay pending. */
  @Override
  public synchronized void close() {
    expiryTasks.values().forEach(task -> task.cancel(false));
    expiryTasks.clear();
  }

  private ApprovalRequest expireLocked(ApprovalRequest current) {
    ApprovalRequest expired =
        current.resolve(ApprovalResolution.EXPIRED, clock.now(), EXPIRY_ACTOR);
    requests.put(current.requestId(), expired);
    cancelExpiry(current.requestId());
    metrics.increment("approval.expired");
    log.info("Approval request {} expired at {}", current.requestId(), expired.resolvedAt());
    return expired;
  }

  private void scheduleExpiry(String requestId) {
    try {
      ScheduledFuture<?> task =
          timer.schedule(() -> expire(requestId), timeout.toMillis(), TimeUnit.MILLISECONDS);
      expiryTasks.put(requestId, task);
    } catch (RejectedExecutionException ex) {
      log.warn("Expiry timer unavailable for {}; request expires on next sweep or resolve", requestId);
    }
  }

  private void cancelExpiry(String requestId) {
    ScheduledFuture<?> task = expiryTasks.remove(requestId);
    if (task != null) {
      task.cancel(false);
    }
  }

  static String requestIdFor(IncidentId incidentId) {
    return "apr-" + incidentId.value();
  }

  private static void notifyListener(Listener listener, ApprovalRequest request) {
    if (listener == null) {
      return;
    }
    try {
      listener.onResolved(request);
    } catch (RuntimeException ex) {
      log.error("Approval listener failed for {}", request.requestId(), ex);
    }
  }
}
