package com.codeheadsystems.provision.client.manager;

import com.codeheadsystems.provision.client.accessor.ProvisionAccessor;
import com.codeheadsystems.provision.client.config.ProvisionClientConfig;
import com.codeheadsystems.provision.client.model.ProvisionedCredentials;
import com.codeheadsystems.provision.crypto.exchange.EphemeralKeyPair;
import com.codeheadsystems.provision.crypto.exchange.KeyExchange;
import com.codeheadsystems.provision.crypto.exchange.SealedDelivery;
import com.codeheadsystems.provision.crypto.exchange.SealedPayload;
import com.codeheadsystems.provision.model.sidecar.EncryptedProviderKeys;
import com.codeheadsystems.provision.model.sidecar.RefreshKeysRequest;
import com.codeheadsystems.provision.model.sidecar.RefreshKeysResponse;
import com.codeheadsystems.provision.model.sidecar.SidecarRegistrationRequest;
import com.codeheadsystems.provision.model.sidecar.SidecarRegistrationResponse;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sidecar side of credential provisioning.
 * <p>
 * <strong>Registration:</strong>
 * <ol>
 *   <li>Generate an ephemeral P-256 key pair; the private key never leaves this process.</li>
 *   <li>Send the public key with the session id and registration token to the orchestrator.</li>
 *   <li>Open the sealed bundle with the private key and the orchestrator's public key.</li>
 * </ol>
 * The sidecar token from registration authorizes later {@link #refresh(List)} calls. Each
 * refresh is sealed under a new orchestrator key, so the public key is taken from every
 * response rather than remembered.
 */
@Singleton
public class SidecarProvisioningManager {

  private static final Logger log = LoggerFactory.getLogger(SidecarProvisioningManager.class);

  private final ProvisionClientConfig config;
  private final ProvisionAccessor accessor;
  private final KeyExchange keyExchange;
  private final SealedDelivery sealedDelivery;

  private volatile Registration registration;

  @Inject
  public SidecarProvisioningManager(final ProvisionClientConfig config,
                                    final ProvisionAccessor accessor,
                                    final KeyExchange keyExchange,
                                    final SealedDelivery sealedDelivery) {
    log.info("SidecarProvisioningManager({})", config);
    this.config = config;
    this.accessor = accessor;
    this.keyExchange = keyExchange;
    this.sealedDelivery = sealedDelivery;
  }

  /**
   * Registers with the orchestrator and opens the delivered credentials.
   *
   * @return the credentials and the service port
   * @throws IllegalStateException if this sidecar already registered
   * @throws SecurityException     if the bundle was sealed for another key
   */
  public synchronized ProvisionedCredentials register() {
    if (registration != null) {
      throw new IllegalStateException("Sidecar is already registered");
    }
    log.debug("register(sessionId={})", config.sessionId());
    EphemeralKeyPair keyPair = keyExchange.generateEphemeralKeyPair();
    SidecarRegistrationResponse response = accessor.register(new SidecarRegistrationRequest(
        config.sessionId(), config.registrationToken(), keyPair.publicKey(), keyPair.keyId()));

    Map<String, String> secrets = open(response.encryptedProviderKeys(), keyPair, response.orchestratorPublicKey());
    registration = new Registration(keyPair, response.sidecarAuthToken());
    log.info("Registered session {} and received {} credential(s)", config.sessionId(), secrets.size());
    return new ProvisionedCredentials(secrets, response.opencodePort(), response.orchestratorKeyId());
  }

  /**
   * Fetches the current credentials again.
   *
   * @param providers optional provider filter; null or empty means all
   * @return the credentials
   * @throws IllegalStateException if {@link #register()} has not succeeded
   */
  public ProvisionedCredentials refresh(final List<String> providers) {
    Registration current = registration;
    if (current == null) {
      throw new IllegalStateException("Sidecar is not registered");
    }
    log.debug("refresh(sessionId={}, providers={})", config.sessionId(), providers);
    RefreshKeysResponse response = accessor.refresh(
        new RefreshKeysRequest(config.sessionId(), providers), current.sidecarToken());
    Map<String, String> secrets = open(response.encryptedProviderKeys(), current.keyPair(),
        response.orchestratorPublicKey());
    return new ProvisionedCredentials(secrets, 0, response.orchestratorKeyId());
  }

  public boolean isRegistered() {
    return registration != null;
  }

  private Map<String, String> open(EncryptedProviderKeys sealed, EphemeralKeyPair keyPair, String senderPublicKey) {
    if (sealed == null || !keyPair.keyId().equals(sealed.recipientKeyId())) {
      throw new SecurityException("Sealed credentials are not addressed to this sidecar");
    }
    SealedPayload payload = new SealedPayload(sealed.ciphertext(), sealed.nonce(), sealed.tag(),
        sealed.recipientKeyId());
    return sealedDelivery.unpackSecrets(payload, keyPair.privateKey(), senderPublicKey);
  }

  private record Registration(EphemeralKeyPair keyPair, String sidecarToken) {
  }
}
