package reconciler.spi;

/**
 * Chat notification API.
 */
@FunctionalInterface
public interface Notifier {

  /**
   * Sends {@code text} to {@code audience}.
   *
   * @throws reconciler.TransientCollaboratorException if the message could not be delivered
   */
  void notify(Audience audience, String text);
}
