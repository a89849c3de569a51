package de.ialistannen.stevedore.target;

import com.google.common.util.concurrent.Uninterruptibles;
import de.ialistannen.stevedore.cache.CacheIntersector;
import de.ialistannen.stevedore.cache.CachedImage;
import de.ialistannen.stevedore.cache.ClusterNode;
import de.ialistannen.stevedore.cluster.Cluster;
import de.ialistannen.stevedore.cluster.ClusterException;
import de.ialistannen.stevedore.cluster.PullJobNotFoundException;
import de.ialistannen.stevedore.cluster.PullJobSpec;
import de.ialistannen.stevedore.cluster.PullJobStatus;
import de.ialistannen.stevedore.strategy.DesiredImage;
import de.ialistannen.stevedore.strategy.DesiredImageStrategy;
import de.ialistannen.stevedore.strategy.DesiredImages;
import de.ialistannen.stevedore.timing.IntervalRunner;
import de.ialistannen.stevedore.timing.Sleeper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the desired images of a single target cached on its nodes. At most one pull job per target exists at any
 * time, and it always pulls the most important missing image.
 */
public class TargetController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TargetController.class);

  private final Target target;
  private final Cluster cluster;
  private final CacheIntersector intersector;
  private final IntervalRunner runner;
  private final CountDownLatch finished;

  private volatile TargetSnapshot snapshot;
  private volatile boolean stopped;
  private volatile Thread runnerThread;
  private PullState state;

  public TargetController(
    Target target,
    Cluster cluster,
    CacheIntersector intersector,
    Duration interval,
    Sleeper sleeper
  ) {
    this.target = target;
    this.cluster = cluster;
    this.intersector = intersector;
    this.runner = new IntervalRunner("target " + target.name(), interval, sleeper, this::tick);
    this.finished = new CountDownLatch(1);
    this.snapshot = TargetSnapshot.initial(target);
    this.state = PullState.IDLE;
  }

  public Target target() {
    return target;
  }

  /**
   * @return the state after the last successful poll
   */
  public TargetSnapshot snapshot() {
    return snapshot;
  }

  /**
   * Polls the cluster and the strategies once, advances the pull job and publishes a new snapshot.
   *
   * @throws ClusterException if the cluster could not be queried
   * @throws IOException if a strategy failed to fetch its images
   * @throws InterruptedException if interrupted
   */
  public synchronized void tick() throws ClusterException, IOException, InterruptedException {
    List<ClusterNode> nodes = cluster.listNodes();
    List<CachedImage> commonCache = intersector.intersect(nodes, target.selector());
    // Pull jobs never run on unschedulable nodes, so only the schedulable ones decide what to pull next
    List<ClusterNode> pullNodes = nodes.stream()
      .filter(ClusterNode::acceptsPullJobs)
      .filter(node -> target.selector().matches(node.labels()))
      .toList();
    List<CachedImage> pullCache = intersector.intersect(pullNodes, target.selector());
    LOGGER.debug("Common cache of '{}': {}", target.name(), commonCache);

    List<DesiredImage> desired = new ArrayList<>();
    List<DesiredImage> all = new ArrayList<>();
    for (DesiredImageStrategy strategy : target.strategies()) {
      DesiredImages images = strategy.desiredImages(commonCache);
      desired.addAll(images.priority());
      all.addAll(images.all());
    }

    List<DesiredImage> available = new ArrayList<>();
    List<DesiredImage> missing = new ArrayList<>();
    List<DesiredImage> toPull = new ArrayList<>();
    for (DesiredImage image : desired) {
      if (isCached(commonCache, image)) {
        available.add(image);
      } else {
        missing.add(image);
      }
      if (!isCached(pullCache, image)) {
        toPull.add(image);
      }
    }

    if (!pullNodes.isEmpty()) {
      advancePullJob(toPull);
    } else if (!missing.isEmpty()) {
      LOGGER.warn("No schedulable nodes match {} for target '{}', not pulling", target.selector(), target.name());
    }

    snapshot = new TargetSnapshot(
      target.name(),
      target.selector().labels(),
      commonCache,
      available,
      desired,
      all,
      missing,
      state
    );
  }

  private static boolean isCached(List<CachedImage> cache, DesiredImage image) {
    return cache.stream().anyMatch(it -> it.matches(image.imageUrl(), image.digest()));
  }

  private void advancePullJob(List<DesiredImage> missing) throws ClusterException {
    if (state == PullState.PULLING) {
      Optional<PullJobStatus> status = findPullJob();
      if (status.isPresent() && !status.get().isFinished()) {
        LOGGER.debug("Pull job for '{}' still running: {}", target.name(), status.get());
        return;
      }
      if (status.isPresent()) {
        LOGGER.info(
          "Pulled '{}' onto {} nodes of '{}'",
          status.get().imageUrl(),
          status.get().availableNodes(),
          target.name()
        );
        cluster.deletePullJob(target.name());
      }
      state = PullState.IDLE;
      return;
    }

    if (missing.isEmpty()) {
      return;
    }

    Optional<PullJobStatus> leftover = findPullJob();
    if (leftover.isPresent()) {
      if (leftover.get().isFinished()) {
        LOGGER.info("Deleting finished pull job for '{}'", target.name());
        cluster.deletePullJob(target.name());
      } else {
        LOGGER.info("Found running pull job for '{}' pulling '{}'", target.name(), leftover.get().imageUrl());
        state = PullState.PULLING;
      }
      return;
    }

    DesiredImage next = missing.get(0);
    LOGGER.info("Pulling '{}' onto nodes of '{}' ({} missing)", next.imageUrl(), target.name(), missing.size());
    cluster.createPullJob(new PullJobSpec(target.name(), next.imageUrl(), target.selector().labels()));
    state = PullState.PULLING;
  }

  private Optional<PullJobStatus> findPullJob() throws ClusterException {
    try {
      return Optional.of(cluster.pullJobStatus(target.name()));
    } catch (PullJobNotFoundException e) {
      LOGGER.debug("No pull job for '{}'", target.name());
      return Optional.empty();
    }
  }

  /**
   * Polls until {@link #stop()} is called. Waits for the predecessor to finish first, so two controllers for the same
   * target never run at the same time. This controller only counts as finished once its predecessor has finished
   * too, even if it was stopped before it ever polled.
   *
   * @param predecessor the controller this one replaces, if any
   */
  public void runAfter(Optional<TargetController> predecessor) {
    runnerThread = Thread.currentThread();
    try {
      if (predecessor.isPresent() && !stopped) {
        predecessor.get().awaitFinished();
      }
      if (!stopped) {
        LOGGER.info("Started target '{}' for nodes matching {}", target.name(), target.selector());
        runner.runUntilStopped(() -> stopped);
      }
    } catch (InterruptedException e) {
      LOGGER.debug("Target '{}' was interrupted before it started", target.name());
      Thread.currentThread().interrupt();
    } finally {
      predecessor.ifPresent(TargetController::awaitFinishedUninterruptibly);
      LOGGER.info("Stopped target '{}'", target.name());
      finished.countDown();
    }
  }

  /**
   * Stops the polling loop, interrupting any running poll. Calling it more than once has no further effect.
   */
  public void stop() {
    stopped = true;
    Thread thread = runnerThread;
    if (thread != null) {
      thread.interrupt();
    }
  }

  public boolean isStopped() {
    return stopped;
  }

  /**
   * Waits until the polling loop has ended.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitFinished() throws InterruptedException {
    finished.await();
  }

  private void awaitFinishedUninterruptibly() {
    Uninterruptibles.awaitUninterruptibly(finished);
  }

  /**
   * @param timeout the maximum time to wait
   * @return true if the loop ended in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitFinished(Duration timeout) throws InterruptedException {
    return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }
}
