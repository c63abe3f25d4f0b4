package reconciler.execute;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts consecutive failed cycles per intent so persistent failures can be surfaced
 * once, after a threshold, instead of on every retry.
 *
 * <p>This class is thread-safe.
 */
public final class FailureTracker {
  private final Map<String, Integer> streaks = new ConcurrentHashMap<>();

  /**
   * Records one more failure for {@code intentId}.
   *
   * @return the length of the current streak, starting at 1
   */
  public int recordFailure(String intentId) {
    return streaks.merge(intentId, 1, Integer::sum);
  }

  public int streak(String intentId) {
    return streaks.getOrDefault(intentId, 0);
  }

  public void reset(String intentId) {
    streaks.remove(intentId);
  }
}
