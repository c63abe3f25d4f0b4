package reconciler;

/**
 * Base unchecked exception for failures reported by the reconciler or its collaborators.
 *
 * @see TransientCollaboratorException
 * @see NotFoundException
 * @see ConfigurationException
 */
public class ReconcilerException extends RuntimeException {

  public ReconcilerException(String message) {
    super(message);
  }

  public ReconcilerException(String message, Throwable cause) {
    super(message, cause);
  }
}
