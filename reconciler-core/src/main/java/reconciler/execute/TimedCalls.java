package reconciler.execute;

import reconciler.TransientCollaboratorException;
import reconciler.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking collaborator calls under a per-call timeout.
 *
 * <p>Each call runs on a pooled daemon thread while the caller waits up to
 * {@code timeout}. A call that does not finish in time is interrupted and reported as
 * a {@link TransientCollaboratorException}, so a hung remote API can stall one action
 * but never the whole loop. Unchecked exceptions thrown by the call are rethrown as-is;
 * checked ones are wrapped as transient.
 *
 * <p>This class is thread-safe.
 */
public final class TimedCalls implements AutoCloseable {

  /** Default per-call timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final ExecutorService executor;
  private final long timeoutMs;

  public TimedCalls() {
    this(DEFAULT_TIMEOUT);
  }

  public TimedCalls(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.timeoutMs = timeout.toMillis();
    this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("reconciler-call-"));
  }

  public Duration timeout() {
    return Duration.ofMillis(timeoutMs);
  }

  /**
   * Runs {@code call} and returns its result.
   *
   * @param description what is being called, used in failure messages
   * @throws TransientCollaboratorException on timeout, interruption or a checked failure
   */
  public <T> T call(String description, Callable<T> call) {
    Objects.requireNonNull(call, "call");
    Future<T> future;
    try {
      future = executor.submit(call);
    } catch (RejectedExecutionException e) {
      throw new TransientCollaboratorException(description + " rejected: call executor is shut down", e);
    }
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TransientCollaboratorException(description + " timed out after " + timeoutMs + " ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new TransientCollaboratorException(description + " interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new TransientCollaboratorException(description + " failed", cause);
    }
  }

  /**
   * Runs {@code call} for its side effect.
   *
   * @see #call(String, Callable)
   */
  public void run(String description, Runnable call) {
    Objects.requireNonNull(call, "call");
    call(description, () -> {
      call.run();
      return null;
    });
  }

  /** Interrupts in-flight calls and stops the worker threads. */
  @Override
  public void close() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
