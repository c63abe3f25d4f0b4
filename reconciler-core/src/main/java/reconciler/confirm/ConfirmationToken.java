package reconciler.confirm;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A pending human confirmation for a disruptive action.
 *
 * @param confirmationId 8 lowercase hex characters, unique for the registry's lifetime
 * @param actionKind     what will be done on confirm, e.g. {@code stop_resource}
 * @param parameters     action arguments, opaque to the registry
 * @param userId         the user who asked for the action and may confirm it
 * @param issuedAt       when the token was created
 */
public record ConfirmationToken(
    String confirmationId,
    String actionKind,
    Map<String, String> parameters,
    String userId,
    Instant issuedAt
) {

  public ConfirmationToken {
    Objects.requireNonNull(confirmationId, "confirmationId");
    Objects.requireNonNull(actionKind, "actionKind");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(issuedAt, "issuedAt");
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }

  public String parameter(String name) {
    return parameters.get(name);
  }

  /**
   * Returns whether the token is strictly older than {@code maxAge} at {@code now}.
   */
  public boolean isExpired(Instant now, Duration maxAge) {
    return Duration.between(issuedAt, now).compareTo(maxAge) > 0;
  }
}
