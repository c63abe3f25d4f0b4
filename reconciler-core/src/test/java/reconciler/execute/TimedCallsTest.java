package reconciler.execute;

import reconciler.NotFoundException;
import reconciler.TransientCollaboratorException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimedCallsTest {

  private final TimedCalls calls = new TimedCalls(Duration.ofMillis(200));

  @AfterEach
  void tearDown() {
    calls.close();
  }

  @Test
  void returnsResult() {
    assertEquals("ok", calls.call("test", () -> "ok"));
  }

  @Test
  void timeoutBecomesTransient() throws InterruptedException {
    CountDownLatch interrupted = new CountDownLatch(1);

    TransientCollaboratorException e = assertThrows(TransientCollaboratorException.class, () ->
        calls.run("slow", () -> {
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException ie) {
            interrupted.countDown();
          }
        }));

    assertTrue(e.getMessage().contains("timed out"));
    assertTrue(interrupted.await(2, TimeUnit.SECONDS), "hung call should be interrupted");
  }

  @Test
  void uncheckedExceptionsPassThrough() {
    NotFoundException failure = new NotFoundException("gone");

    NotFoundException thrown = assertThrows(NotFoundException.class, () ->
        calls.run("missing", () -> {
          throw failure;
        }));

    assertSame(failure, thrown);
  }

  @Test
  void checkedExceptionsBecomeTransient() {
    TransientCollaboratorException e = assertThrows(TransientCollaboratorException.class, () ->
        calls.call("io", () -> {
          throw new IOException("connection reset");
        }));

    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  void closedRunnerRejectsAsTransient() {
    calls.close();

    assertThrows(TransientCollaboratorException.class, () -> calls.call("late", () -> "x"));
  }

  @Test
  void nonPositiveTimeout_throwsIAE() {
    assertThrows(IllegalArgumentException.class, () -> new TimedCalls(Duration.ZERO));
  }
}
