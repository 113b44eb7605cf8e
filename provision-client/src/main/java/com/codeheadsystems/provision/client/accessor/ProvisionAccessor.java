package com.codeheadsystems.provision.client.accessor;

import com.codeheadsystems.provision.client.config.ProvisionClientConfig;
import com.codeheadsystems.provision.client.exceptions.ProvisionAccessorException;
import com.codeheadsystems.provision.model.common.ErrorResponse;
import com.codeheadsystems.provision.model.sidecar.RefreshKeysRequest;
import com.codeheadsystems.provision.model.sidecar.RefreshKeysResponse;
import com.codeheadsystems.provision.model.sidecar.SidecarRegistrationRequest;
import com.codeheadsystems.provision.model.sidecar.SidecarRegistrationResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the sidecar endpoints of the orchestrator.
 * <p>
 * The endpoint in {@link ProvisionClientConfig} is the <em>base URL</em>; path segments are
 * appended per call. A 401 response is surfaced as a {@link SecurityException}. Other
 * rejections, I/O errors and interruptions become {@link ProvisionAccessorException}.
 */
@Singleton
public class ProvisionAccessor {

  private static final Logger log = LoggerFactory.getLogger(ProvisionAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI baseUri;

  @Inject
  public ProvisionAccessor(final HttpClient httpClient,
                           final ObjectMapper objectMapper,
                           final ProvisionClientConfig config) {
    log.info("ProvisionAccessor({})", config.orchestratorEndpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.baseUri = config.orchestratorEndpoint();
  }

  /**
   * Registers this sidecar with its session.
   *
   * @param request the registration request
   * @return the sealed credentials and the sidecar token
   */
  public SidecarRegistrationResponse register(final SidecarRegistrationRequest request) {
    log.debug("register(sessionId={})", request.sessionId());
    return post(resolve("/sidecar/register"), request, null, SidecarRegistrationResponse.class);
  }

  /**
   * Requests a fresh delivery of credentials.
   *
   * @param request      the refresh request
   * @param sidecarToken the token returned at registration, without the "Bearer " prefix
   * @return the newly sealed credentials
   */
  public RefreshKeysResponse refresh(final RefreshKeysRequest request, final String sidecarToken) {
    log.debug("refresh(sessionId={})", request.sessionId());
    return post(resolve("/sidecar/refresh"), request, sidecarToken, RefreshKeysResponse.class);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI resolve(String path) {
    String base = baseUri.getPath() == null ? "" : baseUri.getPath();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return baseUri.resolve(base + path);
  }

  private <T> T post(URI uri, Object body, String bearerToken, Class<T> responseType) {
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
      if (bearerToken != null) {
        builder.header("Authorization", "Bearer " + bearerToken);
      }
      HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      checkStatus(uri, response);
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new ProvisionAccessorException("HTTP request failed: " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProvisionAccessorException("HTTP request interrupted: " + uri, e);
    }
  }

  private void checkStatus(URI uri, HttpResponse<String> response) {
    int status = response.statusCode();
    if (status == 401) {
      throw new SecurityException("Orchestrator rejected request (401): " + uri);
    }
    if (status >= 400) {
      ErrorResponse error = parseError(response.body());
      String code = error == null || error.error() == null ? null : error.error().code();
      String message = error == null || error.error() == null ? "" : ": " + error.error().message();
      throw new ProvisionAccessorException("Orchestrator returned HTTP " + status
          + (code == null ? "" : " " + code) + message, status, code, null);
    }
  }

  private ErrorResponse parseError(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ErrorResponse.class);
    } catch (JsonProcessingException e) {
      log.debug("Error body is not an error response: {}", e.getOriginalMessage());
      return null;
    }
  }
}
