package de.ialistannen.stevedore.strategy;

import de.ialistannen.stevedore.cache.CachedImage;
import java.io.IOException;
import java.util.List;

/**
 * Decides which images should be cached on the nodes of a target.
 */
public interface DesiredImageStrategy {

  /**
   * Computes the wanted images. Implementations must not modify the passed cache and must return the same result for
   * the same registry state.
   *
   * @param commonCache the images currently cached on all nodes of the target
   * @return the desired images
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   */
  DesiredImages desiredImages(List<CachedImage> commonCache) throws IOException, InterruptedException;
}
