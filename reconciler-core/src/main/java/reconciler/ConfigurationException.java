package reconciler;

/**
 * A required collaborator or setting is missing. Only thrown while building or
 * starting the reconciler, never from a poll cycle.
 */
public final class ConfigurationException extends ReconcilerException {

  public ConfigurationException(String message) {
    super(message);
  }
}
