package de.ialistannen.stevedore.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DockerRegistryAuthTest {

  // user:pass
  private static final String USER_PASS = "dXNlcjpwYXNz";

  @Test
  void loadsAuthsAndSkipsCredentialHelpers(@TempDir Path directory) throws Exception {
    Path config = directory.resolve(".dockerconfigjson");
    Files.writeString(config, """
      {
        "auths": {
          "https://index.docker.io/v1/": {"auth": "%s"},
          "ghcr.io": {"identitytoken": "foo"},
          "localhost:5000": {"auth": "%s"}
        },
        "credHelpers": {"gcr.io": "gcloud"}
      }
      """.formatted(USER_PASS, USER_PASS));

    List<DockerRegistryAuth> auths = DockerRegistryAuth.loadAuthentications(config);

    assertThat(auths).containsExactly(
      new DockerRegistryAuth("https://index.docker.io/v1/", USER_PASS),
      new DockerRegistryAuth("localhost:5000", USER_PASS)
    );
  }

  @Test
  void configWithoutAuthsHasNoCredentials(@TempDir Path directory) throws Exception {
    Path config = directory.resolve("config.json");
    Files.writeString(config, "{\"credsStore\": \"desktop\"}");

    assertThat(DockerRegistryAuth.loadAuthentications(config)).isEmpty();
  }

  @Test
  void matchesHostsInDifferentNotations() {
    DockerRegistryAuth dockerHub = new DockerRegistryAuth("https://registry.hub.docker.com/v1/", USER_PASS);
    DockerRegistryAuth local = new DockerRegistryAuth("localhost:5000", USER_PASS);

    assertThat(dockerHub.matchesHost("registry.hub.docker.com")).isTrue();
    assertThat(dockerHub.matchesHost("ghcr.io")).isFalse();
    assertThat(local.matchesHost("localhost:5000")).isTrue();
    assertThat(local.matchesHost("localhost")).isFalse();
  }

  @Test
  void findsCredentialsForHost() {
    DockerRegistryAuth ghcr = new DockerRegistryAuth("ghcr.io", USER_PASS);
    List<DockerRegistryAuth> auths = List.of(new DockerRegistryAuth("quay.io", USER_PASS), ghcr);

    assertThat(DockerRegistryAuth.forHost(auths, "ghcr.io")).contains(ghcr);
    assertThat(DockerRegistryAuth.forHost(auths, "registry.hub.docker.com")).isEmpty();
  }

  @Test
  void decodesUsername() {
    assertThat(new DockerRegistryAuth("ghcr.io", USER_PASS).username()).isEqualTo("user");
  }
}
