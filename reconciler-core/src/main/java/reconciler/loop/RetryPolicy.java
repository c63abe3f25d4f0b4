package reconciler.loop;

/**
 * Strategy for computing the delay before the next reconciliation cycle after the
 * event-store fetch failed.
 *
 * @see FixedDelayRetryPolicy
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param failures the number of consecutive failed cycles so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int failures);
}
