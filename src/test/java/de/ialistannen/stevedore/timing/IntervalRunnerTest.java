package de.ialistannen.stevedore.timing;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class IntervalRunnerTest {

  @AfterEach
  void clearInterrupt() {
    // Interrupting tests leave the flag set on the test thread
    Thread.interrupted();
  }

  @Test
  void keepsRunningAfterFailures() {
    AtomicInteger runs = new AtomicInteger();
    AtomicBoolean stopped = new AtomicBoolean();
    List<Duration> sleeps = new ArrayList<>();

    IntervalRunner runner = new IntervalRunner(
      "test",
      Duration.ofSeconds(60),
      duration -> {
        sleeps.add(duration);
        if (sleeps.size() == 3) {
          stopped.set(true);
        }
      },
      () -> {
        runs.incrementAndGet();
        throw new IllegalStateException("boom");
      }
    );

    runner.runUntilStopped(stopped::get);

    assertThat(runs).hasValue(3);
    assertThat(sleeps).containsOnly(Duration.ofSeconds(60));
  }

  @Test
  void interruptWhileSleepingEndsTheLoop() {
    AtomicInteger runs = new AtomicInteger();

    IntervalRunner runner = new IntervalRunner(
      "test",
      Duration.ofSeconds(60),
      duration -> {
        throw new InterruptedException();
      },
      runs::incrementAndGet
    );

    runner.runUntilStopped(() -> false);

    assertThat(runs).hasValue(1);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  void interruptWhileRunningEndsTheLoop() {
    AtomicInteger sleeps = new AtomicInteger();

    IntervalRunner runner = new IntervalRunner(
      "test",
      Duration.ofSeconds(60),
      duration -> sleeps.incrementAndGet(),
      () -> {
        throw new InterruptedException();
      }
    );

    runner.runUntilStopped(() -> false);

    assertThat(sleeps).hasValue(0);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  void stoppedRunnerDoesNothing() {
    AtomicInteger runs = new AtomicInteger();

    new IntervalRunner("test", Duration.ofSeconds(1), duration -> {
    }, runs::incrementAndGet).runUntilStopped(() -> true);

    assertThat(runs).hasValue(0);
  }

  @Test
  void formatsDurations() {
    assertThat(IntervalRunner.formatDurationHuman(Duration.ofSeconds(60))).isEqualTo("1 minutes");
    assertThat(IntervalRunner.formatDurationHuman(Duration.ofSeconds(3725))).isEqualTo("1 hours, 2 minutes, 5 seconds");
  }
}
