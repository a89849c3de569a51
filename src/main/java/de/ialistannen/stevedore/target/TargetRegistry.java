package de.ialistannen.stevedore.target;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the controllers of all targets. Each controller polls on its own thread.
 */
public class TargetRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(TargetRegistry.class);

  private final Function<Target, TargetController> controllerFactory;
  private final ExecutorService executor;
  private final ReentrantLock lock;
  private final Map<String, TargetController> controllers;
  // Stopped controllers whose loop may still be running, until it ended
  private final Map<String, TargetController> retiring;

  public TargetRegistry(Function<Target, TargetController> controllerFactory) {
    this.controllerFactory = controllerFactory;
    this.executor = Executors.newCachedThreadPool(
      new ThreadFactoryBuilder()
        .setNameFormat("target-%d")
        .setDaemon(true)
        .build()
    );
    this.lock = new ReentrantLock();
    this.controllers = new HashMap<>();
    this.retiring = new HashMap<>();
  }

  /**
   * Starts polling a target. An existing target with the same name is stopped and replaced. The new target only
   * starts polling once the loop of any earlier target with the same name has ended, including targets that were
   * already stopped.
   *
   * @param target the target to start
   * @return the controller of the new target
   */
  public TargetController start(Target target) {
    TargetController controller = controllerFactory.apply(target);

    lock.lock();
    try {
      TargetController replaced = controllers.put(target.name(), controller);
      if (replaced != null) {
        LOGGER.info("Replacing target '{}'", target.name());
        replaced.stop();
      }
      // A stopped controller only finishes after its own predecessor, so waiting for the latest one is enough
      TargetController stillRunning = retiring.remove(target.name());
      Optional<TargetController> previous = Optional.ofNullable(replaced != null ? replaced : stillRunning);

      executor.submit(() -> {
        controller.runAfter(previous);
        retire(target.name(), controller);
      });
    } finally {
      lock.unlock();
    }

    return controller;
  }

  /**
   * Stops a target. Stopping an unknown target does nothing.
   *
   * @param name the name of the target
   */
  public void stop(String name) {
    lock.lock();
    try {
      TargetController controller = controllers.remove(name);
      if (controller != null) {
        LOGGER.info("Stopping target '{}'", name);
        controller.stop();
        retiring.put(name, controller);
      }
    } finally {
      lock.unlock();
    }
  }

  private void retire(String name, TargetController controller) {
    lock.lock();
    try {
      retiring.remove(name, controller);
    } finally {
      lock.unlock();
    }
  }

  /**
   * @param name the name of the target
   * @return the last snapshot of the target
   * @throws TargetNotFoundException if there is no such target
   */
  public TargetSnapshot snapshot(String name) {
    return controller(name)
      .map(TargetController::snapshot)
      .orElseThrow(() -> new TargetNotFoundException(name));
  }

  /**
   * @param name the name of the target
   * @return the running controller for the target, if any
   */
  public Optional<TargetController> controller(String name) {
    lock.lock();
    try {
      return Optional.ofNullable(controllers.get(name));
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return the names of all running targets, sorted
   */
  public List<String> names() {
    lock.lock();
    try {
      List<String> names = new ArrayList<>(controllers.keySet());
      names.sort(String::compareTo);
      return names;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops all targets and waits a short time for their loops to end.
   *
   * @param timeout how long to wait
   * @throws InterruptedException if interrupted while waiting
   */
  public void shutdown(Duration timeout) throws InterruptedException {
    lock.lock();
    try {
      controllers.values().forEach(TargetController::stop);
      controllers.clear();
      retiring.clear();
    } finally {
      lock.unlock();
    }
    executor.shutdownNow();
    if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      LOGGER.warn("Some targets did not stop within {}", timeout);
    }
  }
}
