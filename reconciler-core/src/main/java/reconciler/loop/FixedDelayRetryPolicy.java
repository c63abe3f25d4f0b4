package reconciler.loop;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries after the same delay no matter how many cycles have failed.
 */
public final class FixedDelayRetryPolicy implements RetryPolicy {

  /** Default delay after a failed cycle. */
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(60);

  private final long delayMs;

  public FixedDelayRetryPolicy() {
    this(DEFAULT_DELAY);
  }

  public FixedDelayRetryPolicy(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative() || delay.isZero()) {
      throw new IllegalArgumentException("delay must be positive, got: " + delay);
    }
    this.delayMs = delay.toMillis();
  }

  @Override
  public long computeDelayMs(int failures) {
    return failures <= 0 ? 0L : delayMs;
  }
}
