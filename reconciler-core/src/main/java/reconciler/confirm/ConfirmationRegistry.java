package reconciler.confirm;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Short-lived, process-local store of pending confirmations.
 *
 * <p>A token is created once, then either consumed exactly once by
 * {@link #resolve(String, ConfirmationResponse)} or evicted by {@link #cleanup(Duration)}
 * once older than the max age. Tokens do not survive a restart; an unanswered prompt
 * simply has to be asked again.
 *
 * <p>All operations are guarded by one lock, so a token can never be resolved twice or
 * resolved and evicted concurrently. Ids combine a random per-registry salt with a
 * counter and are unique for the first 2<sup>32</sup> tokens issued.
 */
public final class ConfirmationRegistry {
  private static final Logger logger = Logger.getLogger(ConfirmationRegistry.class.getName());

  /** Default age after which an unanswered token is evicted. */
  public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(1);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, ConfirmationToken> pending = new HashMap<>();
  private final Clock clock;
  private final int salt;
  private int counter;

  public ConfirmationRegistry() {
    this(Clock.systemUTC());
  }

  public ConfirmationRegistry(Clock clock) {
    this(clock, ThreadLocalRandom.current().nextInt());
  }

  ConfirmationRegistry(Clock clock, int salt) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.salt = salt;
  }

  /**
   * Registers a pending confirmation.
   *
   * @return the new confirmation id
   */
  public String create(String actionKind, Map<String, String> parameters, String userId) {
    Objects.requireNonNull(actionKind, "actionKind");
    Objects.requireNonNull(userId, "userId");
    lock.lock();
    try {
      String id = String.format("%08x", salt + counter++);
      pending.put(id, new ConfirmationToken(id, actionKind, parameters, userId, clock.instant()));
      logger.log(Level.FINE, "Created confirmation {0} for {1} by {2}", new Object[]{id, actionKind, userId});
      return id;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Atomically removes the token and reports how it was answered.
   *
   * @return {@link Resolution.Confirmed} or {@link Resolution.Cancelled} with the consumed
   *     token, or {@link Resolution.NotFound} if there is no pending token with that id
   */
  public Resolution resolve(String confirmationId, ConfirmationResponse response) {
    Objects.requireNonNull(response, "response");
    lock.lock();
    try {
      ConfirmationToken token = confirmationId == null ? null : pending.remove(confirmationId);
      if (token == null) {
        return new Resolution.NotFound(confirmationId);
      }
      return response == ConfirmationResponse.CONFIRM
          ? new Resolution.Confirmed(token)
          : new Resolution.Cancelled(token);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the pending token without consuming it.
   */
  public Optional<ConfirmationToken> peek(String confirmationId) {
    lock.lock();
    try {
      return Optional.ofNullable(confirmationId == null ? null : pending.get(confirmationId));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Evicts every token strictly older than {@code maxAge}.
   *
   * @return the number of evicted tokens
   */
  public int cleanup(Duration maxAge) {
    Objects.requireNonNull(maxAge, "maxAge");
    lock.lock();
    try {
      Instant now = clock.instant();
      int evicted = 0;
      Iterator<ConfirmationToken> it = pending.values().iterator();
      while (it.hasNext()) {
        if (it.next().isExpired(now, maxAge)) {
          it.remove();
          evicted++;
        }
      }
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }
}
