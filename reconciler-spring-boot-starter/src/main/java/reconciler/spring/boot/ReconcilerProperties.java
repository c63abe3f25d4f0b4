package reconciler.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the deletion reconciler, bound from {@code reconciler.*}.
 *
 * @see ReconcilerAutoConfiguration
 */
@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {

  /**
   * Whether the reconciler is created at all.
   */
  private boolean enabled = true;

  private final Loop loop = new Loop();
  private final Intent intent = new Intent();
  private final Notify notify = new Notify();
  private final Confirmation confirmation = new Confirmation();
  private final Metrics metrics = new Metrics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Loop getLoop() {
    return loop;
  }

  public Intent getIntent() {
    return intent;
  }

  public Notify getNotify() {
    return notify;
  }

  public Confirmation getConfirmation() {
    return confirmation;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Loop {
    /**
     * Time between two successful reconciliation cycles.
     */
    private Duration checkInterval = Duration.ofMinutes(5);
    /**
     * Delay before the next cycle after a failed fetch.
     */
    private Duration retryDelay = Duration.ofSeconds(60);
    /**
     * How long shutdown waits for an in-flight cycle.
     */
    private Duration gracePeriod = Duration.ofSeconds(30);
    /**
     * Timeout applied to every collaborator call.
     */
    private Duration callTimeout = Duration.ofSeconds(30);
    /**
     * Consecutive transient delete failures before the failure is announced.
     */
    private int failureNotifyThreshold = 3;

    public Duration getCheckInterval() {
      return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
      this.checkInterval = checkInterval;
    }

    public Duration getRetryDelay() {
      return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
    }

    public Duration getGracePeriod() {
      return gracePeriod;
    }

    public void setGracePeriod(Duration gracePeriod) {
      this.gracePeriod = gracePeriod;
    }

    public Duration getCallTimeout() {
      return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
    }

    public int getFailureNotifyThreshold() {
      return failureNotifyThreshold;
    }

    public void setFailureNotifyThreshold(int failureNotifyThreshold) {
      this.failureNotifyThreshold = failureNotifyThreshold;
    }
  }

  public static class Intent {
    /**
     * How long before the deletion time the reminder goes out.
     */
    private Duration reminderWindow = Duration.ofHours(24);
    /**
     * Whole days from scheduling to deletion.
     */
    private Duration deletionDelay = Duration.ofDays(2);

    public Duration getReminderWindow() {
      return reminderWindow;
    }

    public void setReminderWindow(Duration reminderWindow) {
      this.reminderWindow = reminderWindow;
    }

    public Duration getDeletionDelay() {
      return deletionDelay;
    }

    public void setDeletionDelay(Duration deletionDelay) {
      this.deletionDelay = deletionDelay;
    }
  }

  public static class Notify {
    /**
     * Chat channel receiving reminders, completions and scheduling notices.
     */
    private String broadcastChannel = "#proxmox";

    public String getBroadcastChannel() {
      return broadcastChannel;
    }

    public void setBroadcastChannel(String broadcastChannel) {
      this.broadcastChannel = broadcastChannel;
    }
  }

  public static class Confirmation {
    /**
     * Age after which an unanswered confirmation is evicted.
     */
    private Duration maxAge = Duration.ofHours(1);
    /**
     * Time between two eviction runs.
     */
    private Duration cleanupInterval = Duration.ofMinutes(5);

    public Duration getMaxAge() {
      return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
      this.maxAge = maxAge;
    }

    public Duration getCleanupInterval() {
      return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
      this.cleanupInterval = cleanupInterval;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "reconciler";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
