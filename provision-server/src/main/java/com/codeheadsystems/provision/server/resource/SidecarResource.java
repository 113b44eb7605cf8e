package com.codeheadsystems.provision.server.resource;

import static com.codeheadsystems.provision.server.resource.ResourceSupport.bearerToken;
import static com.codeheadsystems.provision.server.resource.ResourceSupport.requireBody;

import com.codeheadsystems.provision.model.sidecar.RefreshKeysRequest;
import com.codeheadsystems.provision.model.sidecar.RefreshKeysResponse;
import com.codeheadsystems.provision.model.sidecar.SidecarRegistrationRequest;
import com.codeheadsystems.provision.model.sidecar.SidecarRegistrationResponse;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.manager.RegistrationManager;
import com.codeheadsystems.provision.server.model.RefreshResult;
import com.codeheadsystems.provision.server.model.RegistrationResult;
import com.codeheadsystems.provision.server.ratelimit.RateLimitGuard;
import com.codeheadsystems.provision.server.ratelimit.RateLimitedOperation;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Endpoints called by sidecars.
 * <ul>
 *   <li>{@code POST /sidecar/register}: one-time registration, returns sealed credentials</li>
 *   <li>{@code POST /sidecar/refresh}: re-delivery, authorized by the sidecar bearer token</li>
 * </ul>
 */
@Path("/sidecar")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SidecarResource {

  private static final Logger log = LoggerFactory.getLogger(SidecarResource.class);

  private final RegistrationManager registrationManager;
  private final RateLimitGuard rateLimitGuard;

  public SidecarResource(RegistrationManager registrationManager, RateLimitGuard rateLimitGuard) {
    this.registrationManager = registrationManager;
    this.rateLimitGuard = rateLimitGuard;
  }

  @POST
  @Path("/register")
  public SidecarRegistrationResponse register(SidecarRegistrationRequest request) {
    log.debug("register({})", request);
    requireBody(request);
    RegistrationResult result = rateLimitGuard.guard(request.sessionId(), RateLimitedOperation.REGISTER_SIDECAR,
        () -> registrationManager.registerSidecar(request.sessionId(), request.registrationToken(),
            request.publicKey(), request.keyId()));
    return new SidecarRegistrationResponse(true, result.sidecarToken(), result.orchestratorPublicKey(),
        result.orchestratorKeyId(), result.sidecarServicePort(), result.credentialCount(),
        WireMapper.toWire(result.sealedPayload()));
  }

  @POST
  @Path("/refresh")
  public RefreshKeysResponse refresh(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                     RefreshKeysRequest request) {
    log.debug("refresh()");
    requireBody(request);
    String token = bearerToken(authorization);
    if (token == null) {
      throw new ProvisioningException(ErrorCode.INVALID_SIDECAR_TOKEN, "Missing sidecar bearer token");
    }
    RefreshResult result = rateLimitGuard.guard(request.sessionId(), RateLimitedOperation.REFRESH_KEYS,
        () -> registrationManager.refreshProviderKeys(request.sessionId(), token, request.providers()));
    return new RefreshKeysResponse(true, result.orchestratorPublicKey(), result.orchestratorKeyId(),
        result.credentialCount(), WireMapper.toWire(result.sealedPayload()));
  }
}
