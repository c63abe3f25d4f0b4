package reconciler;

/**
 * The target of a collaborator call (a resource or an event) does not exist.
 *
 * <p>For idempotent operations this is treated as "already resolved": deleting a
 * resource that is gone counts as a successful delete, and updating an event that is
 * gone means the intent was cancelled.
 */
public class NotFoundException extends ReconcilerException {

  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
