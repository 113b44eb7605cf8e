package com.codeheadsystems.provision.client.model;

import java.util.Map;

/**
 * Credentials delivered to this sidecar, opened with its own private key.
 *
 * @param secrets           plaintext credentials by provider
 * @param servicePort       port the sidecar's agent service should listen on; 0 on refresh
 * @param orchestratorKeyId key id of the orchestrator key pair that sealed the delivery
 */
public record ProvisionedCredentials(Map<String, String> secrets, int servicePort, String orchestratorKeyId) {

  public ProvisionedCredentials {
    secrets = Map.copyOf(secrets);
  }

  @Override
  public String toString() {
    return "ProvisionedCredentials{providers=" + secrets.keySet() + ", servicePort=" + servicePort
        + ", orchestratorKeyId=" + orchestratorKeyId + "}";
  }
}
