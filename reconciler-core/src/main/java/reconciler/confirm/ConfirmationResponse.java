package reconciler.confirm;

import java.util.Locale;
import java.util.Set;

/**
 * A user's answer to a confirmation prompt.
 */
public enum ConfirmationResponse {
  CONFIRM,
  CANCEL;

  private static final Set<String> AFFIRMATIVE = Set.of("yes", "y", "confirm");

  /**
   * Parses a free-text reply. {@code yes}, {@code y} and {@code confirm} confirm, in any
   * case and surrounding whitespace; anything else, {@code null} included, cancels.
   */
  public static ConfirmationResponse parse(String text) {
    if (text == null) {
      return CANCEL;
    }
    return AFFIRMATIVE.contains(text.trim().toLowerCase(Locale.ROOT)) ? CONFIRM : CANCEL;
  }
}
