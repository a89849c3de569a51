package de.ialistannen.stevedore.timing;

import java.time.Duration;

/**
 * Waits between two runs. Exchanged in tests to not actually wait.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
