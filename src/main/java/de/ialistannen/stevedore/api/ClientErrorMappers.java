package de.ialistannen.stevedore.api;

import de.ialistannen.stevedore.strategy.UnknownStrategyException;
import de.ialistannen.stevedore.target.InvalidTargetException;
import de.ialistannen.stevedore.target.TargetNotFoundException;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.Response.Status;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the exceptions caused by bad requests into JSON error responses.
 */
public final class ClientErrorMappers {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClientErrorMappers.class);

  private ClientErrorMappers() {
    throw new UnsupportedOperationException("No instantiation");
  }

  static Response errorResponse(Status status, Exception e) {
    LOGGER.debug("Answering with {}: {}", status, e.getMessage());
    return Response.status(status)
      .type(MediaType.APPLICATION_JSON_TYPE)
      .entity(new ErrorResponse(e.getMessage()))
      .build();
  }

  @Provider
  public static class TargetNotFoundMapper implements ExceptionMapper<TargetNotFoundException> {

    @Override
    public Response toResponse(TargetNotFoundException exception) {
      return errorResponse(Status.NOT_FOUND, exception);
    }
  }

  @Provider
  public static class InvalidTargetMapper implements ExceptionMapper<InvalidTargetException> {

    @Override
    public Response toResponse(InvalidTargetException exception) {
      return errorResponse(Status.BAD_REQUEST, exception);
    }
  }

  @Provider
  public static class UnknownStrategyMapper implements ExceptionMapper<UnknownStrategyException> {

    @Override
    public Response toResponse(UnknownStrategyException exception) {
      return errorResponse(Status.BAD_REQUEST, exception);
    }
  }
}
