package de.ialistannen.stevedore.cluster;

import de.ialistannen.stevedore.cache.ClusterNode;
import java.util.List;

/**
 * The cluster whose nodes should cache images.
 */
public interface Cluster {

  /**
   * @return all nodes of the cluster
   * @throws ClusterException if the nodes could not be listed
   */
  List<ClusterNode> listNodes() throws ClusterException;

  /**
   * Starts a pull job. There must be no other job with the same name.
   *
   * @param spec the job to start
   * @throws ClusterException if the job could not be created
   */
  void createPullJob(PullJobSpec spec) throws ClusterException;

  /**
   * @param name the name of the job
   * @return the current status of the job
   * @throws PullJobNotFoundException if there is no job with that name
   * @throws ClusterException if the status could not be fetched
   */
  PullJobStatus pullJobStatus(String name) throws ClusterException;

  /**
   * Deletes a pull job. Deleting a job that does not exist is not an error.
   *
   * @param name the name of the job
   * @throws ClusterException if the job could not be deleted
   */
  void deletePullJob(String name) throws ClusterException;
}
