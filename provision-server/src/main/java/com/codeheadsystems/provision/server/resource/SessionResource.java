package com.codeheadsystems.provision.server.resource;

import static com.codeheadsystems.provision.server.resource.ResourceSupport.requireBody;

import com.codeheadsystems.provision.model.session.CreateSessionRequest;
import com.codeheadsystems.provision.model.session.CreateSessionResponse;
import com.codeheadsystems.provision.model.session.SessionView;
import com.codeheadsystems.provision.model.session.UpdateSessionStatusRequest;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.manager.SessionManager;
import com.codeheadsystems.provision.server.model.Session;
import com.codeheadsystems.provision.server.model.SessionStatus;
import com.codeheadsystems.provision.server.ratelimit.RateLimitGuard;
import com.codeheadsystems.provision.server.ratelimit.RateLimitedOperation;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Session lifecycle endpoints used by the orchestrator.
 */
@Path("/sessions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SessionResource {

  private final SessionManager sessionManager;
  private final RateLimitGuard rateLimitGuard;

  public SessionResource(SessionManager sessionManager, RateLimitGuard rateLimitGuard) {
    this.sessionManager = sessionManager;
    this.rateLimitGuard = rateLimitGuard;
  }

  @POST
  public Response create(CreateSessionRequest request) {
    requireBody(request);
    Session session = rateLimitGuard.guard(request.userId(), RateLimitedOperation.SESSION_WRITE,
        () -> sessionManager.create(request.userId()));
    return Response.status(Response.Status.CREATED)
        .entity(new CreateSessionResponse(session.id(), session.registrationToken()))
        .build();
  }

  @GET
  @Path("/{sessionId}")
  public SessionView get(@PathParam("sessionId") String sessionId) {
    return WireMapper.toView(sessionManager.get(sessionId));
  }

  @PUT
  @Path("/{sessionId}/status")
  public SessionView updateStatus(@PathParam("sessionId") String sessionId, UpdateSessionStatusRequest request) {
    requireBody(request);
    SessionStatus target;
    try {
      target = SessionStatus.fromWireName(request.status());
    } catch (IllegalArgumentException e) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST, "Unknown session status: " + request.status());
    }
    Session session = rateLimitGuard.guard(sessionId, RateLimitedOperation.SESSION_WRITE,
        () -> sessionManager.transition(sessionId, target));
    return WireMapper.toView(session);
  }
}
