package reconciler.command;

import java.util.Objects;

/**
 * A user request, already classified. The classifier that turns free text into one of
 * these is out of scope; everything downstream works on this closed set only.
 */
public sealed interface Command permits Command.ListResources, Command.StartResource,
    Command.StopResource, Command.ScheduleDeletion, Command.ListScheduled {

  static Command listResources() {
    return new ListResources();
  }

  static Command listScheduled() {
    return new ListScheduled();
  }

  record ListResources() implements Command {
  }

  record StartResource(String resourceId) implements Command {
    public StartResource {
      Objects.requireNonNull(resourceId, "resourceId");
    }
  }

  /** Disruptive: runs only after the requesting user confirms. */
  record StopResource(String resourceId) implements Command {
    public StopResource {
      Objects.requireNonNull(resourceId, "resourceId");
    }
  }

  record ScheduleDeletion(String resourceId) implements Command {
    public ScheduleDeletion {
      Objects.requireNonNull(resourceId, "resourceId");
    }
  }

  record ListScheduled() implements Command {
  }
}
