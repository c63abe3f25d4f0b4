package reconciler.spi;

import java.util.Objects;

/**
 * Recipient of a {@link Notifier} message: a broadcast channel or a single user.
 */
public sealed interface Audience permits Audience.Channel, Audience.User {

  static Channel channel(String name) {
    return new Channel(name);
  }

  static User user(String userId) {
    return new User(userId);
  }

  /**
   * A shared channel, e.g. {@code "#proxmox"}.
   */
  record Channel(String name) implements Audience {
    public Channel {
      Objects.requireNonNull(name, "name");
    }
  }

  /**
   * A direct message to one user.
   */
  record User(String userId) implements Audience {
    public User {
      Objects.requireNonNull(userId, "userId");
    }
  }
}
