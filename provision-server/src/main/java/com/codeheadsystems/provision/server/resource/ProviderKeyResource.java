package com.codeheadsystems.provision.server.resource;

import static com.codeheadsystems.provision.server.resource.ResourceSupport.requireBody;

import com.codeheadsystems.provision.model.keys.ProviderKeySummary;
import com.codeheadsystems.provision.model.keys.StoreProviderKeyRequest;
import com.codeheadsystems.provision.model.keys.StoreProviderKeyResponse;
import com.codeheadsystems.provision.server.manager.ProviderSecretManager;
import com.codeheadsystems.provision.server.ratelimit.RateLimitGuard;
import com.codeheadsystems.provision.server.ratelimit.RateLimitedOperation;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Credential management for a user. Responses never include credential values.
 */
@Path("/users/{userId}/provider-keys")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ProviderKeyResource {

  private final ProviderSecretManager secretManager;
  private final RateLimitGuard rateLimitGuard;

  public ProviderKeyResource(ProviderSecretManager secretManager, RateLimitGuard rateLimitGuard) {
    this.secretManager = secretManager;
    this.rateLimitGuard = rateLimitGuard;
  }

  @PUT
  @Path("/{provider}")
  public StoreProviderKeyResponse store(@PathParam("userId") String userId,
                                        @PathParam("provider") String provider,
                                        StoreProviderKeyRequest request) {
    requireBody(request);
    ProviderSecretManager.StoreResult result = rateLimitGuard.guard(userId, RateLimitedOperation.STORE_SECRET,
        () -> secretManager.store(userId, provider, request.key()));
    return new StoreProviderKeyResponse(result.provider(), result.created(), result.keyVersion());
  }

  @GET
  public List<ProviderKeySummary> list(@PathParam("userId") String userId) {
    return secretManager.list(userId).stream().map(WireMapper::toSummary).collect(Collectors.toList());
  }

  @DELETE
  @Path("/{provider}")
  public Response delete(@PathParam("userId") String userId, @PathParam("provider") String provider) {
    rateLimitGuard.check(userId, RateLimitedOperation.STORE_SECRET);
    secretManager.delete(userId, provider);
    return Response.noContent().build();
  }
}
