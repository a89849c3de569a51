package de.ialistannen.stevedore.cli;

import java.util.Optional;
import net.jbock.Command;
import net.jbock.Option;

@Command(name = "stevedore", description = "Keeps container images cached on Kubernetes nodes", publicParser = true)
public interface CliArguments {

  @Option(names = "--port", description = "Port of the management API. Default: 8080", paramLabel = "PORT")
  Optional<Integer> port();

  @Option(
    names = "--base-path",
    description = "Path the management API is served under. Default: /stevedore",
    paramLabel = "PATH"
  )
  Optional<String> basePath();

  @Option(
    names = "--namespace",
    description = "Namespace to create pull jobs in. Default: the namespace of the service account or 'default'",
    paramLabel = "NAMESPACE"
  )
  Optional<String> namespace();

  @Option(
    names = "--pull-secret",
    description = "Name of the image pull secret used by pull jobs",
    paramLabel = "SECRET"
  )
  Optional<String> pullSecret();

  @Option(
    names = "--docker-config",
    description = "Path to docker config with registry credentials. Default: /etc/secrets/.dockerconfigjson",
    paramLabel = "PATH"
  )
  Optional<String> dockerConfigPath();

  @Option(
    names = "--pod-info",
    description = "Downward API directory describing this pod. Default: /etc/podinfo",
    paramLabel = "PATH"
  )
  Optional<String> podInfoPath();

  @Option(
    names = "--poll-interval",
    description = "Seconds between two polls of a target. Default: 60",
    paramLabel = "SECONDS"
  )
  Optional<Integer> pollIntervalSeconds();

  @Option(
    names = "--pull-sleep",
    description = "Seconds a pull job container sleeps before it exits. Default: 1200",
    paramLabel = "SECONDS"
  )
  Optional<Integer> pullSleepSeconds();
}
