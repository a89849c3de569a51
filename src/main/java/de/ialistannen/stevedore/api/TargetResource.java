package de.ialistannen.stevedore.api;

import de.ialistannen.stevedore.target.InvalidTargetException;
import de.ialistannen.stevedore.target.Target;
import de.ialistannen.stevedore.target.TargetFactory;
import de.ialistannen.stevedore.target.TargetRegistry;
import de.ialistannen.stevedore.target.TargetSnapshot;
import java.util.List;
import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Path("/targets")
public class TargetResource {

  private static final Logger LOGGER = LoggerFactory.getLogger(TargetResource.class);

  private final TargetRegistry registry;
  private final TargetFactory factory;

  public TargetResource(TargetRegistry registry, TargetFactory factory) {
    this.registry = registry;
    this.factory = factory;
  }

  @GET
  public List<String> listTargets() {
    return registry.names();
  }

  /**
   * Creates a target, replacing any target with the same name.
   *
   * @param request the target definition
   * @return the snapshot of the new target
   */
  @POST
  public TargetSnapshot createTarget(TargetRequest request) {
    if (request == null) {
      throw new InvalidTargetException("Missing request body");
    }
    Target target = factory.create(request.name(), request.labels(), request.strategies());
    LOGGER.info("Creating target '{}' for nodes matching {}", target.name(), target.selector());

    return registry.start(target).snapshot();
  }

  @GET
  @Path("/{name}")
  public TargetSnapshot getTarget(@PathParam("name") String name) {
    return registry.snapshot(name);
  }

  @GET
  @Path("/{name}/available")
  public ImageListResponse getAvailable(@PathParam("name") String name) {
    TargetSnapshot snapshot = registry.snapshot(name);
    return new ImageListResponse(snapshot.available(), snapshot.all());
  }

  @GET
  @Path("/{name}/desired")
  public ImageListResponse getDesired(@PathParam("name") String name) {
    TargetSnapshot snapshot = registry.snapshot(name);
    return new ImageListResponse(snapshot.desired(), snapshot.all());
  }

  /**
   * Stops a target. Succeeds for unknown targets too.
   *
   * @param name the name of the target
   */
  @DELETE
  @Path("/{name}")
  public void deleteTarget(@PathParam("name") String name) {
    registry.stop(name);
  }
}
