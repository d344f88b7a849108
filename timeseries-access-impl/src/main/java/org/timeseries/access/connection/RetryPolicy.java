package org.timeseries.access.connection;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.ConfigUtils;

/** Bounded retry with exponential backoff, used by adapters when opening a session. */
@Slf4j
@Value
@Builder
public class RetryPolicy {
  private static final String CONFIG_PATH_MAX_ATTEMPTS = "max-attempts";
  private static final String CONFIG_PATH_INITIAL_DELAY = "initial-delay";
  private static final String CONFIG_PATH_BACKOFF_FACTOR = "backoff-factor";

  @Builder.Default int maxAttempts = 3;
  @Builder.Default Duration initialDelay = Duration.ofMillis(100);
  @Builder.Default double backoffFactor = 2.0;
  @Builder.Default Sleeper sleeper = Thread::sleep;

  public static RetryPolicy defaults() {
    return RetryPolicy.builder().build();
  }

  public static RetryPolicy noRetry() {
    return RetryPolicy.builder().maxAttempts(1).build();
  }

  public static RetryPolicy fromConfig(Config config) {
    RetryPolicy defaults = defaults();
    return RetryPolicy.builder()
        .maxAttempts(ConfigUtils.getInt(config, CONFIG_PATH_MAX_ATTEMPTS, defaults.maxAttempts))
        .initialDelay(
            ConfigUtils.getDuration(config, CONFIG_PATH_INITIAL_DELAY, defaults.initialDelay))
        .backoffFactor(
            ConfigUtils.optionallyGet(config, CONFIG_PATH_BACKOFF_FACTOR, Config::getDouble)
                .orElse(defaults.backoffFactor))
        .build();
  }

  /**
   * Runs {@code attempt} until it returns true or the attempts are exhausted. Returns false when
   * every attempt failed or the thread was interrupted while waiting.
   */
  public boolean run(String operation, BooleanSupplier attempt) {
    Preconditions.checkArgument(maxAttempts > 0, "maxAttempts must be positive");
    long delayMillis = initialDelay.toMillis();
    for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
      if (attempt.getAsBoolean()) {
        return true;
      }
      if (attemptNumber == maxAttempts) {
        break;
      }
      log.debug(
          "{} failed (attempt {}/{}), retrying in {}ms",
          operation,
          attemptNumber,
          maxAttempts,
          delayMillis);
      try {
        sleeper.sleep(delayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
      delayMillis = (long) (delayMillis * backoffFactor);
    }
    log.warn("{} failed after {} attempts", operation, maxAttempts);
    return false;
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}
