package reconciler.command;

import reconciler.Messages;
import reconciler.confirm.ConfirmationRegistry;
import reconciler.confirm.ConfirmationResponse;
import reconciler.confirm.ConfirmationToken;
import reconciler.confirm.Resolution;
import reconciler.execute.ActionExecutor;
import reconciler.execute.TimedCalls;
import reconciler.model.DeletionIntent;
import reconciler.model.IntentMetadata;
import reconciler.model.ResourceInfo;
import reconciler.model.ResourceStatus;
import reconciler.model.StoredEvent;
import reconciler.spi.Audience;
import reconciler.spi.EventStore;
import reconciler.spi.Notifier;
import reconciler.spi.ResourceControl;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Turns a classified {@link Command} into collaborator calls and a {@link Reply}.
 *
 * <p>Stopping a resource is gated by a confirmation: {@link #handle} registers a token
 * and asks, {@link #handleConfirmation} performs or drops the action. Scheduling a
 * deletion only creates the event; everything after that is driven by the
 * reconciliation loop.
 *
 * <p>Collaborator failures never escape: they are logged under a short error id that is
 * also quoted in the reply.
 */
public final class CommandHandler {
  private static final Logger logger = Logger.getLogger(CommandHandler.class.getName());

  /** Action kind of the confirmation registered for {@link Command.StopResource}. */
  public static final String STOP_RESOURCE = "stop_resource";

  /** Default time from scheduling to deletion, counted in whole days. */
  public static final Duration DEFAULT_DELETION_DELAY = Duration.ofDays(2);

  private static final LocalTime DELETION_TIME_OF_DAY = LocalTime.of(23, 59, 59);
  private static final String RESOURCE_ID = "resource_id";

  private final EventStore eventStore;
  private final ResourceControl resourceControl;
  private final Notifier notifier;
  private final ConfirmationRegistry confirmations;
  private final TimedCalls calls;
  private final Clock clock;
  private final Duration deletionDelay;
  private final String broadcastChannel;

  private CommandHandler(Builder builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.resourceControl = Objects.requireNonNull(builder.resourceControl, "resourceControl");
    this.notifier = Objects.requireNonNull(builder.notifier, "notifier");
    this.confirmations = Objects.requireNonNull(builder.confirmations, "confirmations");
    this.calls = Objects.requireNonNull(builder.calls, "calls");
    this.broadcastChannel = Objects.requireNonNull(builder.broadcastChannel, "broadcastChannel");
    Duration deletionDelay = Objects.requireNonNull(builder.deletionDelay, "deletionDelay");
    if (deletionDelay.toDays() < 1) {
      throw new IllegalArgumentException("deletionDelay must be at least one day");
    }
    this.deletionDelay = deletionDelay;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Handles a command issued by {@code userId}.
   */
  public Reply handle(Command command, String userId) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(userId, "userId");
    if (command instanceof Command.ListResources) {
      return listResources();
    }
    if (command instanceof Command.StartResource start) {
      return startResource(start.resourceId());
    }
    if (command instanceof Command.StopResource stop) {
      return requestStop(stop.resourceId(), userId);
    }
    if (command instanceof Command.ScheduleDeletion schedule) {
      return scheduleDeletion(schedule.resourceId(), userId);
    }
    return listScheduled();
  }

  /**
   * Applies a user's answer to a pending confirmation. Only the user who asked for the
   * action may answer; anyone else is refused and the confirmation stays pending.
   */
  public Reply handleConfirmation(String confirmationId, String responseText, String userId) {
    Objects.requireNonNull(userId, "userId");
    Optional<ConfirmationToken> pending = confirmations.peek(confirmationId);
    if (pending.isEmpty()) {
      return Reply.of("There is no pending confirmation " + confirmationId + ".");
    }
    if (!pending.get().userId().equals(userId)) {
      logger.log(Level.WARNING, "User {0} tried to answer confirmation {1} owned by {2}",
          new Object[]{userId, confirmationId, pending.get().userId()});
      return Reply.of("Confirmation " + confirmationId + " was requested by someone else.");
    }

    Resolution resolution = confirmations.resolve(confirmationId, ConfirmationResponse.parse(responseText));
    if (resolution instanceof Resolution.Confirmed confirmed) {
      return perform(confirmed.token());
    }
    if (resolution instanceof Resolution.Cancelled cancelled) {
      logger.log(Level.INFO, "Confirmation {0} cancelled by {1}", new Object[]{confirmationId, userId});
      return Reply.of("Cancelled. Resource " + cancelled.token().parameter(RESOURCE_ID) + " was left as is.");
    }
    return Reply.of("There is no pending confirmation " + confirmationId + ".");
  }

  private Reply perform(ConfirmationToken token) {
    if (STOP_RESOURCE.equals(token.actionKind())) {
      return stopResource(token.parameter(RESOURCE_ID));
    }
    logger.log(Level.WARNING, "Confirmed unknown action {0}", token.actionKind());
    return Reply.of("I don't know how to perform " + token.actionKind() + ".");
  }

  // ── List resources ───────────────────────────────────────────────

  private Reply listResources() {
    try {
      List<ResourceInfo> resources = calls.call("list", resourceControl::list);
      if (resources.isEmpty()) {
        return Reply.of("No resources found.");
      }
      String listing = resources.stream()
          .map(r -> r.resourceId() + " (" + r.name() + ", " + r.status().label() + ")")
          .collect(Collectors.joining(", "));
      return Reply.of("Here are the current resources:\n" + listing);
    } catch (RuntimeException e) {
      return failure("list the resources", e);
    }
  }

  // ── Start / stop ─────────────────────────────────────────────────

  private Reply startResource(String resourceId) {
    try {
      Optional<Reply> precheck = checkTransition(resourceId, ResourceStatus.RUNNING);
      if (precheck.isPresent()) {
        return precheck.get();
      }
      calls.run("start(" + resourceId + ")", () -> resourceControl.start(resourceId));
      logger.log(Level.INFO, "Started resource {0}", resourceId);
      return Reply.of("Resource " + describe(resourceId) + " is being started.");
    } catch (RuntimeException e) {
      return failure("start resource " + resourceId, e);
    }
  }

  private Reply requestStop(String resourceId, String userId) {
    try {
      Optional<Reply> precheck = checkTransition(resourceId, ResourceStatus.STOPPED);
      if (precheck.isPresent()) {
        return precheck.get();
      }
    } catch (RuntimeException e) {
      return failure("stop resource " + resourceId, e);
    }
    String confirmationId = confirmations.create(STOP_RESOURCE, Map.of(RESOURCE_ID, resourceId), userId);
    return Reply.awaitingConfirmation(
        Messages.confirmationPrompt("Stop resource " + describe(resourceId) + "?", confirmationId),
        confirmationId);
  }

  private Reply stopResource(String resourceId) {
    try {
      // state may have changed while the confirmation was pending
      Optional<Reply> precheck = checkTransition(resourceId, ResourceStatus.STOPPED);
      if (precheck.isPresent()) {
        return precheck.get();
      }
      calls.run("stop(" + resourceId + ")", () -> resourceControl.stop(resourceId));
      logger.log(Level.INFO, "Stopped resource {0}", resourceId);
      return Reply.of("Resource " + describe(resourceId) + " is being stopped.");
    } catch (RuntimeException e) {
      return failure("stop resource " + resourceId, e);
    }
  }

  private Optional<Reply> checkTransition(String resourceId, ResourceStatus target) {
    if (!calls.call("exists(" + resourceId + ")", () -> resourceControl.exists(resourceId))) {
      return Optional.of(Reply.of("Resource " + resourceId + " does not exist."));
    }
    ResourceStatus status = calls.call("status(" + resourceId + ")", () -> resourceControl.status(resourceId));
    if (status == target) {
      return Optional.of(Reply.of("Resource " + describe(resourceId) + " is already " + target.label() + "."));
    }
    return Optional.empty();
  }

  // ── Schedule deletion ────────────────────────────────────────────

  private Reply scheduleDeletion(String resourceId, String userId) {
    try {
      if (!calls.call("exists(" + resourceId + ")", () -> resourceControl.exists(resourceId))) {
        return Reply.of("Resource " + resourceId + " does not exist.");
      }
      Optional<DeletionIntent> existing = openIntents().stream()
          .filter(intent -> intent.resourceId().equals(resourceId))
          .min(Comparator.comparing(DeletionIntent::executeAt));
      if (existing.isPresent()) {
        return Reply.of("Resource " + existing.get().describeResource() + " is already scheduled for deletion on "
            + Messages.formatTime(existing.get().executeAt()) + " UTC.");
      }

      String name = lookup(resourceId).map(ResourceInfo::name).orElse(null);
      Instant executeAt = deletionTime();
      String intentId = calls.call("create event", () -> eventStore.create(
          IntentMetadata.newIntentEvent(resourceId, name, userId, executeAt)));
      String described = name == null || name.isBlank() ? resourceId : resourceId + " (" + name + ")";
      logger.log(Level.INFO, "Scheduled resource {0} for deletion at {1} (intent {2})",
          new Object[]{resourceId, executeAt, intentId});

      try {
        calls.run("notify(" + broadcastChannel + ")", () -> notifier.notify(
            Audience.channel(broadcastChannel), Messages.scheduledNotice(described, executeAt, userId)));
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to announce scheduled deletion of resource " + resourceId, e);
      }
      return Reply.of(Messages.scheduled(described, executeAt, broadcastChannel));
    } catch (RuntimeException e) {
      return failure("schedule resource " + resourceId + " for deletion", e);
    }
  }

  /**
   * Returns the deletion time for an intent created now: the configured number of days
   * from today, at 23:59:59 UTC.
   */
  Instant deletionTime() {
    LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    return today.plusDays(deletionDelay.toDays()).atTime(DELETION_TIME_OF_DAY).toInstant(ZoneOffset.UTC);
  }

  // ── List scheduled ───────────────────────────────────────────────

  private Reply listScheduled() {
    try {
      List<DeletionIntent> intents = new ArrayList<>(openIntents());
      if (intents.isEmpty()) {
        return Reply.of("No resources are currently scheduled for deletion.");
      }
      intents.sort(Comparator.comparing(DeletionIntent::executeAt));
      StringBuilder text = new StringBuilder("The following resources are scheduled for deletion:");
      for (DeletionIntent intent : intents) {
        text.append('\n').append(intent.describeResource())
            .append(" (deletes ").append(Messages.formatTime(intent.executeAt()));
        if (intent.hasRequestor()) {
          text.append(", requested by ").append(Messages.mention(intent.requestor()));
        }
        text.append(')');
      }
      return Reply.of(text.toString());
    } catch (RuntimeException e) {
      return failure("list scheduled deletions", e);
    }
  }

  // ── Helpers ──────────────────────────────────────────────────────

  private List<DeletionIntent> openIntents() {
    List<StoredEvent> events = calls.call("listOpen", () -> eventStore.listOpen(IntentMetadata.TAG));
    List<DeletionIntent> intents = new ArrayList<>(events.size());
    for (StoredEvent event : events) {
      IntentMetadata.decode(event).ifPresent(intents::add);
    }
    return intents;
  }

  private Optional<ResourceInfo> lookup(String resourceId) {
    try {
      return calls.call("list", resourceControl::list).stream()
          .filter(r -> r.resourceId().equals(resourceId))
          .findFirst();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Could not look up the name of resource " + resourceId, e);
      return Optional.empty();
    }
  }

  private String describe(String resourceId) {
    return lookup(resourceId)
        .filter(r -> !r.name().isBlank())
        .map(r -> resourceId + " (" + r.name() + ")")
        .orElse(resourceId);
  }

  private Reply failure(String what, RuntimeException e) {
    String errorId = String.format("%08x", ThreadLocalRandom.current().nextInt());
    logger.log(Level.SEVERE, "[" + errorId + "] Failed to " + what, e);
    return Reply.of("I'm sorry, I couldn't " + what + ". Error id: " + errorId + ".");
  }

  /**
   * Builder for {@link CommandHandler}.
   */
  public static final class Builder {
    private EventStore eventStore;
    private ResourceControl resourceControl;
    private Notifier notifier;
    private ConfirmationRegistry confirmations;
    private TimedCalls calls;
    private Clock clock;
    private Duration deletionDelay = DEFAULT_DELETION_DELAY;
    private String broadcastChannel = ActionExecutor.DEFAULT_BROADCAST_CHANNEL;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder resourceControl(ResourceControl resourceControl) {
      this.resourceControl = resourceControl;
      return this;
    }

    /** <b>Required.</b> */
    public Builder notifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /** <b>Required.</b> Usually shared with a {@link reconciler.confirm.ConfirmationCleanupScheduler}. */
    public Builder confirmations(ConfirmationRegistry confirmations) {
      this.confirmations = confirmations;
      return this;
    }

    /** <b>Required.</b> */
    public Builder calls(TimedCalls calls) {
      this.calls = calls;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how many days after scheduling the deletion happens. Only whole days count.
     *
     * <p>Optional. Defaults to 2 days. Must be at least one day.
     */
    public Builder deletionDelay(Duration deletionDelay) {
      this.deletionDelay = deletionDelay;
      return this;
    }

    /** Optional. Defaults to {@value ActionExecutor#DEFAULT_BROADCAST_CHANNEL}. */
    public Builder broadcastChannel(String broadcastChannel) {
      this.broadcastChannel = broadcastChannel;
      return this;
    }

    public CommandHandler build() {
      return new CommandHandler(this);
    }
  }
}
