package de.ialistannen.stevedore.timing;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an action, sleeps a fixed interval and repeats. Failures of the action are logged and never end the loop.
 */
public class IntervalRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(IntervalRunner.class);

  private final String name;
  private final Duration interval;
  private final Sleeper sleeper;
  private final ExceptionalRunnable action;

  public IntervalRunner(String name, Duration interval, Sleeper sleeper, ExceptionalRunnable action) {
    this.name = name;
    this.interval = interval;
    this.sleeper = sleeper;
    this.action = action;
  }

  /**
   * Runs the stored action until the thread is interrupted or {@code stopped} returns true.
   *
   * @param stopped checked before every run
   */
  public void runUntilStopped(BooleanSupplier stopped) {
    while (!stopped.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
      try {
        action.run();
      } catch (InterruptedException e) {
        LOGGER.debug("'{}' was interrupted while running", name);
        Thread.currentThread().interrupt();
        return;
      } catch (Exception e) {
        LOGGER.error("Error running '{}'", name, e);
      }

      if (stopped.getAsBoolean()) {
        return;
      }

      LOGGER.debug("'{}' sleeping for {}", name, formatDurationHuman(interval));
      try {
        sleeper.sleep(interval);
      } catch (InterruptedException e) {
        LOGGER.debug("'{}' was interrupted while sleeping", name);
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  static String formatDurationHuman(Duration duration) {
    String result = "";
    if (duration.toHoursPart() > 0) {
      result += duration.toHoursPart() + " hours";
    }
    if (duration.toMinutesPart() > 0) {
      result += ", " + duration.toMinutesPart() + " minutes";
    }
    if (duration.toSecondsPart() > 0) {
      result += ", " + duration.toSecondsPart() + " seconds";
    }

    return result.replaceFirst("^, ", "");
  }
}
