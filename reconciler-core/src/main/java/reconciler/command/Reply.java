package reconciler.command;

import java.util.Objects;
import java.util.Optional;

/**
 * Text sent back to the user, plus the id of the confirmation it asks for, if any.
 */
public record Reply(String text, String confirmationId) {

  public Reply {
    Objects.requireNonNull(text, "text");
  }

  public static Reply of(String text) {
    return new Reply(text, null);
  }

  public static Reply awaitingConfirmation(String text, String confirmationId) {
    return new Reply(text, Objects.requireNonNull(confirmationId, "confirmationId"));
  }

  public Optional<String> pendingConfirmation() {
    return Optional.ofNullable(confirmationId);
  }
}
