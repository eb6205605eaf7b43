package com.codeheadsystems.sessionkey.server.resource;

import com.codeheadsystems.sessionkey.model.SessionKeyNotFoundException;
import com.codeheadsystems.sessionkey.model.api.CreateSessionKeyRequest;
import com.codeheadsystems.sessionkey.model.api.CreateTierSessionKeyRequest;
import com.codeheadsystems.sessionkey.model.api.ExecuteRequest;
import com.codeheadsystems.sessionkey.model.api.ExecuteResponse;
import com.codeheadsystems.sessionkey.model.api.LimitsResponse;
import com.codeheadsystems.sessionkey.model.api.RevokeRequest;
import com.codeheadsystems.sessionkey.model.api.RevokeResponse;
import com.codeheadsystems.sessionkey.model.api.SessionKeyCreatedResponse;
import com.codeheadsystems.sessionkey.model.api.SessionKeyListResponse;
import com.codeheadsystems.sessionkey.model.api.SessionKeyResponse;
import com.codeheadsystems.sessionkey.model.api.StatisticsResponse;
import com.codeheadsystems.sessionkey.model.api.SummaryResponse;
import com.codeheadsystems.sessionkey.registry.SessionKeyExporter;
import com.codeheadsystems.sessionkey.server.manager.SessionKeyServerManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.UncheckedIOException;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for a wallet's session keys.
 * <p>
 * Endpoints, all under {@code /wallets/{principal}/session-keys}:
 * <ul>
 *   <li>{@code POST /} issue a key with an explicit policy</li>
 *   <li>{@code POST /tier/{tier}} issue a key from a tier preset</li>
 *   <li>{@code GET /} ids of live keys</li>
 *   <li>{@code GET /summary}, {@code GET /export}</li>
 *   <li>{@code GET /{id}}, {@code GET /{id}/limits}, {@code GET /{id}/statistics}</li>
 *   <li>{@code POST /{id}/execute}, {@code POST /{id}/revoke}</li>
 *   <li>{@code POST /emergency-revoke}</li>
 * </ul>
 * Authenticating the wallet in the path is left to the embedding application.
 */
@Singleton
@Path("/wallets/{principal}/session-keys")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SessionKeyResource {

  private static final Logger log = LoggerFactory.getLogger(SessionKeyResource.class);

  private final SessionKeyServerManager manager;

  /**
   * Instantiates a new Session key resource.
   *
   * @param manager the manager
   */
  @Inject
  public SessionKeyResource(final SessionKeyServerManager manager) {
    this.manager = manager;
    log.info("SessionKeyResource({})", manager);
  }

  /**
   * Create session key.
   *
   * @param principal the principal
   * @param request   the request
   * @return the session key created response
   */
  @POST
  public SessionKeyCreatedResponse create(@PathParam("principal") String principal,
                                          CreateSessionKeyRequest request) {
    return call(() -> manager.create(principal, request));
  }

  /**
   * Create from tier.
   *
   * @param principal the principal
   * @param tier      the tier
   * @param request   the request
   * @return the session key created response
   */
  @POST
  @Path("/tier/{tier}")
  public SessionKeyCreatedResponse createForTier(@PathParam("principal") String principal,
                                                 @PathParam("tier") String tier,
                                                 CreateTierSessionKeyRequest request) {
    return call(() -> manager.createForTier(principal, tier, request));
  }

  /**
   * List active.
   *
   * @param principal the principal
   * @return the session key list response
   */
  @GET
  public SessionKeyListResponse listActive(@PathParam("principal") String principal) {
    return call(() -> manager.listActive(principal));
  }

  /**
   * Summary.
   *
   * @param principal the principal
   * @return the summary response
   */
  @GET
  @Path("/summary")
  public SummaryResponse summary(@PathParam("principal") String principal) {
    return call(() -> manager.summary(principal));
  }

  /**
   * Export.
   *
   * @param principal the principal
   * @return the export
   */
  @GET
  @Path("/export")
  public SessionKeyExporter.Export export(@PathParam("principal") String principal) {
    return call(() -> manager.export(principal));
  }

  /**
   * Emergency revoke.
   *
   * @param principal the principal
   * @param request   the request
   * @return the revoke response
   */
  @POST
  @Path("/emergency-revoke")
  public RevokeResponse emergencyRevoke(@PathParam("principal") String principal, RevokeRequest request) {
    return call(() -> manager.emergencyRevoke(principal, request));
  }

  /**
   * Get session key.
   *
   * @param principal the principal
   * @param id        the id
   * @return the session key response
   */
  @GET
  @Path("/{id}")
  public SessionKeyResponse get(@PathParam("principal") String principal, @PathParam("id") String id) {
    return call(() -> manager.get(principal, id));
  }

  /**
   * Limits for a proposed action.
   *
   * @param principal      the principal
   * @param id             the id
   * @param amount         the amount
   * @param targetContract the target contract
   * @param methodName     the method name
   * @return the limits response
   */
  @GET
  @Path("/{id}/limits")
  public LimitsResponse limits(@PathParam("principal") String principal,
                               @PathParam("id") String id,
                               @QueryParam("amount") String amount,
                               @QueryParam("contract") String targetContract,
                               @QueryParam("method") String methodName) {
    return call(() -> manager.limits(principal, id, amount, targetContract, methodName));
  }

  /**
   * Execute.
   *
   * @param principal the principal
   * @param id        the id
   * @param request   the request
   * @return the execute response
   */
  @POST
  @Path("/{id}/execute")
  public ExecuteResponse execute(@PathParam("principal") String principal,
                                 @PathParam("id") String id,
                                 ExecuteRequest request) {
    return call(() -> manager.execute(principal, id, request));
  }

  /**
   * Revoke.
   *
   * @param principal the principal
   * @param id        the id
   * @param request   the request
   * @return the revoke response
   */
  @POST
  @Path("/{id}/revoke")
  public RevokeResponse revoke(@PathParam("principal") String principal,
                               @PathParam("id") String id,
                               RevokeRequest request) {
    return call(() -> manager.revoke(principal, id, request));
  }

  /**
   * Statistics.
   *
   * @param principal the principal
   * @param id        the id
   * @return the statistics response
   */
  @GET
  @Path("/{id}/statistics")
  public StatisticsResponse statistics(@PathParam("principal") String principal, @PathParam("id") String id) {
    return call(() -> manager.statistics(principal, id));
  }

  private static <T> T call(Supplier<T> operation) {
    try {
      return operation.get();
    } catch (SessionKeyNotFoundException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.NOT_FOUND);
    } catch (IllegalArgumentException e) {
      log.debug("Bad request: {}", e.getMessage());
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (IllegalStateException | UncheckedIOException e) {
      log.error("Session key service unavailable", e);
      throw new WebApplicationException("Session key service unavailable", Response.Status.SERVICE_UNAVAILABLE);
    }
  }
}
