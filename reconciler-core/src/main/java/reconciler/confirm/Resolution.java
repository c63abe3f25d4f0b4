package reconciler.confirm;

import java.util.Objects;

/**
 * Result of {@link ConfirmationRegistry#resolve}.
 */
public sealed interface Resolution
    permits Resolution.Confirmed, Resolution.Cancelled, Resolution.NotFound {

  /** The token was consumed and the action should run. */
  record Confirmed(ConfirmationToken token) implements Resolution {
    public Confirmed {
      Objects.requireNonNull(token, "token");
    }
  }

  /** The token was consumed and the action was declined. */
  record Cancelled(ConfirmationToken token) implements Resolution {
    public Cancelled {
      Objects.requireNonNull(token, "token");
    }
  }

  /** No pending token with that id: never issued, already resolved, or expired. */
  record NotFound(String confirmationId) implements Resolution {
  }
}
