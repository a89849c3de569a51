package de.ialistannen.stevedore.cluster;

/**
 * The progress of a pull job.
 *
 * @param imageUrl the image the job pulls
 * @param desiredNodes the amount of nodes the job should run on
 * @param availableNodes the amount of nodes that pulled the image and are running it
 */
public record PullJobStatus(String imageUrl, int desiredNodes, int availableNodes) {

  /**
   * @return true if the image was pulled on all nodes
   */
  public boolean isFinished() {
    return desiredNodes == availableNodes;
  }
}
