package reconciler;

import reconciler.model.DeletionIntent;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * User-visible message texts. Times are rendered as {@code yyyy-MM-dd HH:mm} UTC.
 */
public final class Messages {

  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

  private Messages() {
  }

  public static String formatTime(Instant instant) {
    return TIME_FORMAT.format(instant);
  }

  public static String mention(String userId) {
    return "<@" + userId + ">";
  }

  public static String reminder(DeletionIntent intent) {
    StringBuilder text = new StringBuilder()
        .append("Reminder: resource ").append(intent.describeResource())
        .append(" will be deleted on ").append(formatTime(intent.executeAt()))
        .append(" UTC.");
    if (intent.hasRequestor()) {
      text.append(" Scheduled by ").append(mention(intent.requestor())).append('.');
    }
    return text.toString();
  }

  public static String deleted(DeletionIntent intent) {
    return "Resource " + intent.describeResource() + " has been deleted as scheduled.";
  }

  public static String alreadyGone(DeletionIntent intent) {
    return "Resource " + intent.describeResource()
        + " no longer existed at its scheduled deletion time; the schedule has been cleared.";
  }

  public static String deletionFailed(DeletionIntent intent, Throwable failure, int attempts) {
    String reason = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    String text = "Failed to delete resource " + intent.describeResource() + ": " + reason + ".";
    if (attempts > 1) {
      text += " Failed " + attempts + " cycles in a row; it will keep being retried.";
    } else {
      text += " It will be retried on the next check.";
    }
    return text;
  }

  public static String scheduled(String describedResource, Instant executeAt, String broadcastChannel) {
    return "Resource " + describedResource + " will be deleted on " + formatTime(executeAt)
        + " UTC. You and " + broadcastChannel + " will be notified one day before.";
  }

  public static String scheduledNotice(String describedResource, Instant executeAt, String requestor) {
    String text = "Resource " + describedResource + " is scheduled for deletion on "
        + formatTime(executeAt) + " UTC";
    if (requestor != null && !requestor.isBlank()) {
      text += " (requested by " + mention(requestor) + ")";
    }
    return text + ".";
  }

  public static String confirmationPrompt(String action, String confirmationId) {
    return action + "\nReply 'yes' to confirm or 'no' to cancel (confirmation " + confirmationId + ").";
  }
}
