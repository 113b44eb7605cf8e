package com.codeheadsystems.provision.client.config;

import java.net.URI;
import java.util.function.Function;

/**
 * What a sidecar is started with.
 *
 * @param orchestratorEndpoint base URL of the orchestrator (e.g. {@code http://host:8080})
 * @param sessionId            the session this sidecar belongs to
 * @param registrationToken    the one-time registration token issued with the session
 */
public record ProvisionClientConfig(URI orchestratorEndpoint, String sessionId, String registrationToken) {

  public static final String ENDPOINT_VARIABLE = "SIDECAR_ORCHESTRATOR_URL";
  public static final String SESSION_VARIABLE = "SIDECAR_SESSION_ID";
  public static final String TOKEN_VARIABLE = "SIDECAR_REGISTRATION_TOKEN";

  public ProvisionClientConfig {
    if (orchestratorEndpoint == null) {
      throw new IllegalArgumentException("Orchestrator endpoint is required");
    }
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Session id is required");
    }
    if (registrationToken == null || registrationToken.isBlank()) {
      throw new IllegalArgumentException("Registration token is required");
    }
  }

  /**
   * Reads the configuration from the process environment.
   *
   * @return the config
   * @throws IllegalArgumentException if a variable is missing
   */
  public static ProvisionClientConfig fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  /**
   * Reads the configuration through the given lookup.
   *
   * @param environment variable lookup
   * @return the config
   * @throws IllegalArgumentException if a variable is missing
   */
  public static ProvisionClientConfig fromEnvironment(Function<String, String> environment) {
    String endpoint = environment.apply(ENDPOINT_VARIABLE);
    if (endpoint == null || endpoint.isBlank()) {
      throw new IllegalArgumentException(ENDPOINT_VARIABLE + " is not set");
    }
    return new ProvisionClientConfig(URI.create(endpoint.trim()),
        environment.apply(SESSION_VARIABLE), environment.apply(TOKEN_VARIABLE));
  }

  @Override
  public String toString() {
    return "ProvisionClientConfig{orchestratorEndpoint=" + orchestratorEndpoint + ", sessionId=" + sessionId
        + ", registrationToken=[REDACTED]}";
  }
}
