package reconciler.demo;

import reconciler.Reconciler;
import reconciler.command.Command;
import reconciler.command.CommandHandler;
import reconciler.command.Reply;
import reconciler.loop.IterationReport;
import reconciler.model.ResourceStatus;
import reconciler.spi.Audience;
import reconciler.spi.Notifier;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.logging.LogManager;

/**
 * Walks one deletion through its whole life without any external service: schedule,
 * reminder, deletion. Cycles are driven by hand while a fake clock jumps ahead.
 *
 * Run with: mvn -pl samples/reconciler-demo exec:java
 */
public final class ReconcilerDemo {

  public static void main(String[] args) throws Exception {
    configureLogging();

    // 1. Collaborators
    DemoClock clock = new DemoClock(Instant.parse("2025-03-10T09:30:00Z"));
    InMemoryEventStore calendar = new InMemoryEventStore(clock);
    InMemoryResourceControl hypervisor = new InMemoryResourceControl()
        .add("101", "web", ResourceStatus.RUNNING)
        .add("102", "db", ResourceStatus.RUNNING)
        .add("103", "scratch", ResourceStatus.STOPPED);
    Notifier chat = (audience, text) -> System.out.println("[" + label(audience) + "] " + text);

    System.out.println("=== Deletion Reconciler Demo ===\n");

    try (Reconciler reconciler = Reconciler.builder()
        .eventStore(calendar)
        .resourceControl(hypervisor)
        .notifier(chat)
        .clock(clock)
        .checkInterval(Duration.ofHours(1))
        .build()) {
      CommandHandler commands = reconciler.commands();

      // 2. Chat commands
      print(commands.handle(Command.listResources(), "U42"));
      print(commands.handle(new Command.ScheduleDeletion("103"), "U42"));
      print(commands.handle(Command.listScheduled(), "U42"));

      Reply stop = commands.handle(new Command.StopResource("102"), "U42");
      print(stop);
      print(commands.handleConfirmation(stop.confirmationId(), "no", "U42"));

      // 3. Nothing due yet
      report("now", reconciler.loop().runOnce());

      // 4. Inside the reminder window
      clock.set(Instant.parse("2025-03-12T10:00:00Z"));
      report("day before", reconciler.loop().runOnce());

      // 5. Past the deletion time
      clock.set(Instant.parse("2025-03-13T00:05:00Z"));
      report("after deletion time", reconciler.loop().runOnce());

      print(commands.handle(Command.listResources(), "U42"));
      System.out.println("Open intents left in calendar: " + calendar.size());
    }

    System.out.println("\nDemo complete.");
  }

  private static void configureLogging() throws IOException {
    try (InputStream in = ReconcilerDemo.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    }
  }

  private static String label(Audience audience) {
    if (audience instanceof Audience.Channel channel) {
      return channel.name();
    }
    return "DM " + ((Audience.User) audience).userId();
  }

  private static void print(Reply reply) {
    System.out.println("> " + reply.text().replace("\n", "\n  ") + "\n");
  }

  private static void report(String when, IterationReport report) {
    System.out.printf("[cycle %s] open=%d reminders=%d executions=%d failures=%d%n%n",
        when, report.openIntents(), report.reminders(), report.executions(), report.failures());
  }

  private static final class DemoClock extends Clock {
    private volatile Instant now;

    DemoClock(Instant now) {
      this.now = now;
    }

    void set(Instant now) {
      this.now = now;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
