package com.codeheadsystems.provision.server.resource;

import static com.codeheadsystems.provision.server.resource.ResourceSupport.requireBody;

import com.codeheadsystems.provision.model.rotation.BatchRotationResponse;
import com.codeheadsystems.provision.model.rotation.RotateAllRequest;
import com.codeheadsystems.provision.model.rotation.RotateKeyRequest;
import com.codeheadsystems.provision.model.rotation.RotationHistoryEntry;
import com.codeheadsystems.provision.model.rotation.RotationResultView;
import com.codeheadsystems.provision.model.rotation.ScheduleRotationRequest;
import com.codeheadsystems.provision.model.rotation.ScheduleRotationResponse;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.manager.KeyRotationManager;
import com.codeheadsystems.provision.server.model.BatchMode;
import com.codeheadsystems.provision.server.model.ScheduleResult;
import com.codeheadsystems.provision.server.ratelimit.RateLimitGuard;
import com.codeheadsystems.provision.server.ratelimit.RateLimitedOperation;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Key rotation, scheduling and history for a user's credentials.
 */
@Path("/users/{userId}/rotations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RotationResource {

  private final KeyRotationManager rotationManager;
  private final RateLimitGuard rateLimitGuard;

  public RotationResource(KeyRotationManager rotationManager, RateLimitGuard rateLimitGuard) {
    this.rotationManager = rotationManager;
    this.rateLimitGuard = rateLimitGuard;
  }

  @POST
  @Path("/{provider}")
  public RotationResultView rotateOne(@PathParam("userId") String userId,
                                      @PathParam("provider") String provider,
                                      RotateKeyRequest request) {
    Integer target = request == null ? null : request.targetVersion();
    return WireMapper.toView(rateLimitGuard.guard(userId, RateLimitedOperation.ROTATE_KEYS,
        () -> rotationManager.rotateOne(userId, provider, target)));
  }

  @POST
  public BatchRotationResponse rotateAll(@PathParam("userId") String userId, RotateAllRequest request) {
    requireBody(request);
    BatchMode mode;
    try {
      mode = BatchMode.fromWireName(request.mode());
    } catch (IllegalArgumentException e) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST,
          "mode must be best_effort or all_or_nothing");
    }
    return WireMapper.toWire(rateLimitGuard.guard(userId, RateLimitedOperation.ROTATE_KEYS,
        () -> rotationManager.rotateAll(userId, request.providers(), mode)));
  }

  @PUT
  @Path("/{provider}/schedule")
  public ScheduleRotationResponse schedule(@PathParam("userId") String userId,
                                           @PathParam("provider") String provider,
                                           ScheduleRotationRequest request) {
    requireBody(request);
    Instant when;
    try {
      when = Instant.parse(request.scheduledFor());
    } catch (DateTimeParseException | NullPointerException e) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST, "scheduledFor must be an ISO-8601 instant");
    }
    ScheduleResult result = rateLimitGuard.guard(userId, RateLimitedOperation.ROTATE_KEYS,
        () -> rotationManager.scheduleRotation(userId, provider, when, request.targetVersion()));
    return new ScheduleRotationResponse(result.id(), result.created(), result.updated());
  }

  @GET
  @Path("/history")
  public List<RotationHistoryEntry> history(@PathParam("userId") String userId,
                                            @QueryParam("provider") String provider,
                                            @QueryParam("limit") Integer limit) {
    return rotationManager.history(userId, provider, limit).stream()
        .map(WireMapper::toWire)
        .collect(Collectors.toList());
  }
}
