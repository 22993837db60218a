package ca.gc.eccc.sentinel.application.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void defaultsAllowFourAttempts() {
    RetryPolicy policy = RetryPolicy.defaults();

    assertEquals(4, policy.maxAttempts());
    assertEquals(Duration.ZERO, policy.backoffBefore(1));
    assertEquals(Duration.ofMillis(500), policy.backoffBefore(2));
    assertEquals(Duration.ofMillis(1000), policy.backoffBefore(3));
    assertEquals(Duration.ofMillis(2000), policy.backoffBefore(4));
  }

  @Test
  void backoffIsCappedAtMaximum() {
    RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), 3.0d, Duration.ofSeconds(5));

    assertEquals(Duration.ofSeconds(3), policy.backoffBefore(3));
    assertEquals(Duration.ofSeconds(5), policy.backoffBefore(4));
    assertEquals(Duration.ofSeconds(5), policy.backoffBefore(10));
  }

  @Test
  void noneMeansSingleAttempt() {
    assertEquals(1, RetryPolicy.none().maxAttempts());
  }

  @Test
  void rejectsInvalidParameters() {
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(-1, Duration.ZERO, 1.0d, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ZERO, 0.5d, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ofMillis(-1), 1.0d, Duration.ZERO));
  }
}
