package de.ialistannen.stevedore.api;

import de.ialistannen.stevedore.target.TargetFactory;
import de.ialistannen.stevedore.target.TargetRegistry;
import java.io.IOException;
import java.net.URI;
import javax.ws.rs.core.UriBuilder;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the management API over HTTP.
 */
public class ManagementServer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManagementServer.class);

  private final URI baseUri;
  private final ResourceConfig resourceConfig;
  private HttpServer server;

  public ManagementServer(int port, String basePath, TargetRegistry registry, TargetFactory factory) {
    this.baseUri = UriBuilder.fromUri("http://0.0.0.0/").port(port).path(basePath).build();
    this.resourceConfig = resourceConfig(registry, factory);
  }

  static ResourceConfig resourceConfig(TargetRegistry registry, TargetFactory factory) {
    return new ResourceConfig()
      .register(JacksonFeature.class)
      .register(new TargetResource(registry, factory))
      .register(new HealthResource())
      .register(ClientErrorMappers.TargetNotFoundMapper.class)
      .register(ClientErrorMappers.InvalidTargetMapper.class)
      .register(ClientErrorMappers.UnknownStrategyMapper.class);
  }

  public void start() throws IOException {
    server = GrizzlyHttpServerFactory.createHttpServer(baseUri, resourceConfig, false);
    server.start();
    LOGGER.info("Management API listening on {}", baseUri);
  }

  public void stop() {
    if (server != null) {
      server.shutdownNow();
    }
  }
}
