package de.ialistannen.stevedore.cluster;

import de.ialistannen.stevedore.cache.ClusterNode;
import de.ialistannen.stevedore.cache.ClusterNode.Taint;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Capabilities;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerImage;
import io.kubernetes.client.openapi.models.V1DaemonSet;
import io.kubernetes.client.openapi.models.V1DaemonSetSpec;
import io.kubernetes.client.openapi.models.V1DaemonSetStatus;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1LocalObjectReference;
import io.kubernetes.client.openapi.models.V1Node;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import io.kubernetes.client.openapi.models.V1PodSecurityContext;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1SecurityContext;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Cluster} backed by the kubernetes API. Pull jobs are daemon sets whose single container sleeps, so the
 * image stays in use until the job is deleted.
 */
public class KubernetesCluster implements Cluster {

  private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesCluster.class);

  static final String CONTAINER_NAME = "stevedore";
  private static final long UNPRIVILEGED_ID = 1000L;
  private static final int NOT_FOUND = 404;

  private final CoreV1Api coreApi;
  private final AppsV1Api appsApi;
  private final String namespace;
  private final Optional<String> pullSecret;
  private final PodInfo podInfo;
  private final Duration pullSleep;

  /**
   * @param coreApi the core api
   * @param appsApi the apps api
   * @param namespace the namespace to create pull jobs in
   * @param pullSecret the name of the secret to use for pulling images, if any
   * @param podInfo information about the pod this service runs in
   * @param pullSleep how long the pull job containers sleep. Daemon sets always restart their pods, so this must
   *   be long enough for the job to be deleted before.
   */
  public KubernetesCluster(
    CoreV1Api coreApi,
    AppsV1Api appsApi,
    String namespace,
    Optional<String> pullSecret,
    PodInfo podInfo,
    Duration pullSleep
  ) {
    this.coreApi = coreApi;
    this.appsApi = appsApi;
    this.namespace = namespace;
    this.pullSecret = pullSecret;
    this.podInfo = podInfo;
    this.pullSleep = pullSleep;
  }

  @Override
  public List<ClusterNode> listNodes() throws ClusterException {
    try {
      return coreApi.listNode().execute().getItems().stream()
        .map(KubernetesCluster::toClusterNode)
        .toList();
    } catch (ApiException e) {
      throw new ClusterException("Could not list nodes: " + describe(e), e);
    }
  }

  @Override
  public void createPullJob(PullJobSpec spec) throws ClusterException {
    LOGGER.info("Creating pull job '{}' for '{}' on nodes {}", spec.name(), spec.imageUrl(), spec.nodeSelector());
    try {
      appsApi.createNamespacedDaemonSet(namespace, buildDaemonSet(spec)).execute();
    } catch (ApiException e) {
      throw new ClusterException("Could not create pull job '" + spec.name() + "': " + describe(e), e);
    }
  }

  @Override
  public PullJobStatus pullJobStatus(String name) throws ClusterException {
    LOGGER.debug("Checking on status for pull job '{}'", name);
    V1DaemonSet daemonSet;
    try {
      daemonSet = appsApi.readNamespacedDaemonSetStatus(name, namespace).execute();
    } catch (ApiException e) {
      if (e.getCode() == NOT_FOUND) {
        throw new PullJobNotFoundException(name);
      }
      throw new ClusterException("Could not read status of pull job '" + name + "': " + describe(e), e);
    }

    String imageUrl = Optional.ofNullable(daemonSet.getSpec())
      .map(V1DaemonSetSpec::getTemplate)
      .map(V1PodTemplateSpec::getSpec)
      .map(V1PodSpec::getContainers)
      .filter(containers -> !containers.isEmpty())
      .map(containers -> containers.get(0).getImage())
      .orElse("<unknown>");
    V1DaemonSetStatus status = daemonSet.getStatus();
    int desired = status == null ? 0 : Objects.requireNonNullElse(status.getDesiredNumberScheduled(), 0);
    int available = status == null ? 0 : Objects.requireNonNullElse(status.getNumberAvailable(), 0);

    LOGGER.debug("Pull job '{}' for '{}': {} / {}", name, imageUrl, available, desired);
    return new PullJobStatus(imageUrl, desired, available);
  }

  @Override
  public void deletePullJob(String name) throws ClusterException {
    LOGGER.info("Deleting pull job '{}'", name);
    try {
      appsApi.deleteNamespacedDaemonSet(name, namespace).execute();
    } catch (ApiException e) {
      if (e.getCode() == NOT_FOUND) {
        LOGGER.debug("Pull job '{}' was already gone", name);
        return;
      }
      throw new ClusterException("Could not delete pull job '" + name + "': " + describe(e), e);
    }
  }

  /**
   * Builds the daemon set pulling the image of the given job.
   *
   * @param spec the job
   * @return the daemon set
   */
  public V1DaemonSet buildDaemonSet(PullJobSpec spec) {
    V1Container container = new V1Container()
      .name(CONTAINER_NAME)
      .image(spec.imageUrl())
      .imagePullPolicy("Always")
      .command(List.of("/bin/sh", "-c", "sleep " + pullSleep.toSeconds()))
      .securityContext(
        new V1SecurityContext()
          .allowPrivilegeEscalation(false)
          .capabilities(new V1Capabilities().drop(List.of("ALL")))
          .readOnlyRootFilesystem(true)
      );

    Map<String, String> labels = new HashMap<>(podInfo.labels());
    // Used by network policies
    labels.put("stevedore", "pull");
    // Ties the pods to this job, matches the selector below
    labels.put("app", spec.name());

    V1PodSpec podSpec = new V1PodSpec()
      .automountServiceAccountToken(false)
      .containers(List.of(container))
      .imagePullSecrets(pullSecret.map(it -> List.of(new V1LocalObjectReference().name(it))).orElse(List.of()))
      .nodeSelector(spec.nodeSelector())
      .securityContext(
        new V1PodSecurityContext()
          .runAsNonRoot(true)
          .runAsUser(UNPRIVILEGED_ID)
          .runAsGroup(UNPRIVILEGED_ID)
      );

    V1ObjectMeta metadata = new V1ObjectMeta()
      .name(spec.name())
      .labels(labels)
      .annotations(podInfo.annotations());
    if (podInfo.isOwnerKnown()) {
      metadata.ownerReferences(List.of(
        new V1OwnerReference()
          .apiVersion("v1")
          .kind("Pod")
          .name(podInfo.name().orElseThrow())
          .uid(podInfo.uid().orElseThrow())
      ));
    }

    return new V1DaemonSet()
      .apiVersion("apps/v1")
      .kind("DaemonSet")
      .metadata(metadata)
      .spec(
        new V1DaemonSetSpec()
          .selector(new V1LabelSelector().matchLabels(Map.of("app", spec.name())))
          .template(
            new V1PodTemplateSpec()
              .metadata(new V1ObjectMeta().labels(labels).annotations(podInfo.annotations()))
              .spec(podSpec)
          )
      );
  }

  private static ClusterNode toClusterNode(V1Node node) {
    V1ObjectMeta metadata = Objects.requireNonNull(node.getMetadata(), "node without metadata");

    boolean unschedulable = node.getSpec() != null && Boolean.TRUE.equals(node.getSpec().getUnschedulable());
    List<Taint> taints = Optional.ofNullable(node.getSpec())
      .map(spec -> spec.getTaints())
      .orElse(List.of())
      .stream()
      .map(taint -> new Taint(taint.getKey(), taint.getValue(), String.valueOf(taint.getEffect())))
      .toList();

    List<List<String>> imageNameGroups = Optional.ofNullable(node.getStatus())
      .map(status -> status.getImages())
      .orElse(List.of())
      .stream()
      .map(V1ContainerImage::getNames)
      .filter(Objects::nonNull)
      .toList();

    return new ClusterNode(
      metadata.getName(),
      Objects.requireNonNullElse(metadata.getLabels(), Map.of()),
      unschedulable,
      taints,
      imageNameGroups
    );
  }

  private static String describe(ApiException e) {
    return e.getCode() + " " + Objects.requireNonNullElse(e.getResponseBody(), e.getMessage());
  }
}
