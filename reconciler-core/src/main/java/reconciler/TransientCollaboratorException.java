package reconciler;

/**
 * A collaborator call failed for a reason expected to clear up on its own: a network
 * error, a timeout, a 5xx response.
 *
 * <p>The reconciler never retries inline. The next poll cycle re-derives the same
 * decision and tries again, so a transient failure only becomes visible to a human
 * once it has persisted for several consecutive cycles.
 */
public class TransientCollaboratorException extends ReconcilerException {

  public TransientCollaboratorException(String message) {
    super(message);
  }

  public TransientCollaboratorException(String message, Throwable cause) {
    super(message, cause);
  }
}
