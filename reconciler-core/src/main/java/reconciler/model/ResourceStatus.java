package reconciler.model;

import java.util.Locale;

public enum ResourceStatus {
  RUNNING,
  STOPPED,
  UNKNOWN;

  /**
   * Maps a collaborator status string ({@code "running"}, {@code "stopped"}, ...) to a
   * status, falling back to {@link #UNKNOWN}.
   */
  public static ResourceStatus parse(String raw) {
    if (raw == null) {
      return UNKNOWN;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "running" -> RUNNING;
      case "stopped" -> STOPPED;
      default -> UNKNOWN;
    };
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
