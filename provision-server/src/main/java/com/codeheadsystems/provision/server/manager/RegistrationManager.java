package com.codeheadsystems.provision.server.manager;

import com.codeheadsystems.provision.crypto.exception.ProvisionCryptoException;
import com.codeheadsystems.provision.crypto.exchange.EphemeralKeyPair;
import com.codeheadsystems.provision.crypto.exchange.KeyExchange;
import com.codeheadsystems.provision.crypto.exchange.SealedDelivery;
import com.codeheadsystems.provision.crypto.exchange.SealedPayload;
import com.codeheadsystems.provision.server.auth.SidecarTokenManager;
import com.codeheadsystems.provision.server.exception.CryptoErrors;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.model.DecryptedCredentials;
import com.codeheadsystems.provision.server.model.RefreshResult;
import com.codeheadsystems.provision.server.model.RegistrationResult;
import com.codeheadsystems.provision.server.model.Session;
import com.codeheadsystems.provision.server.model.SessionStatus;
import com.codeheadsystems.provision.server.security.SecurityEventLogger;
import com.codeheadsystems.provision.server.store.SessionStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrator side of the sidecar handshake.
 * <p>
 * A sidecar registers once per session with its ephemeral public key and the one-time
 * registration token. The orchestrator decrypts the owner's stored credentials, seals them
 * for the sidecar under a fresh orchestrator key pair, and moves the session to
 * {@code active} with a single conditional write. Until that write, nothing is persisted.
 * <p>
 * <strong>Exception contract</strong>: every failure is a {@link ProvisioningException}.
 * <ul>
 *   <li>{@code INVALID_KEY_FORMAT}:        malformed sidecar public key or key id</li>
 *   <li>{@code INVALID_SESSION_OR_TOKEN}:  unknown session or wrong token (indistinguishable)</li>
 *   <li>{@code INVALID_STATE}:             session not in the required state</li>
 *   <li>{@code NO_CREDENTIALS}:            the owner has nothing to deliver</li>
 *   <li>{@code ALL_DECRYPT_FAILED}:        every stored credential failed to decrypt</li>
 *   <li>{@code INVALID_SIDECAR_TOKEN}:     refresh token invalid, expired or for another session</li>
 *   <li>{@code CONCURRENT_MODIFICATION}:   lost a race that did not change the status</li>
 * </ul>
 */
@Singleton
public class RegistrationManager {

  /**
   * Qualifier of the port handed to registered sidecars.
   */
  public static final String SERVICE_PORT = "sidecarServicePort";

  private static final Logger log = LoggerFactory.getLogger(RegistrationManager.class);

  private final SessionStore sessionStore;
  private final ProviderSecretManager secretManager;
  private final KeyExchange keyExchange;
  private final SealedDelivery sealedDelivery;
  private final SidecarTokenManager tokenManager;
  private final SecurityEventLogger securityEvents;
  private final Clock clock;
  private final int sidecarServicePort;

  @Inject
  public RegistrationManager(SessionStore sessionStore,
                             ProviderSecretManager secretManager,
                             KeyExchange keyExchange,
                             SealedDelivery sealedDelivery,
                             SidecarTokenManager tokenManager,
                             SecurityEventLogger securityEvents,
                             Clock clock,
                             @Named(SERVICE_PORT) int sidecarServicePort) {
    this.sessionStore = sessionStore;
    this.secretManager = secretManager;
    this.keyExchange = keyExchange;
    this.sealedDelivery = sealedDelivery;
    this.tokenManager = tokenManager;
    this.securityEvents = securityEvents;
    this.clock = clock;
    this.sidecarServicePort = sidecarServicePort;
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Binds a sidecar to its session and delivers the owner's credentials.
   *
   * @param sessionId         the session
   * @param registrationToken the one-time token issued with the session
   * @param sidecarPublicKey  the sidecar's ephemeral public key
   * @param sidecarKeyId      the sidecar's key id
   * @return the sealed credentials, the sidecar token and the orchestrator public key
   */
  public RegistrationResult registerSidecar(String sessionId,
                                            String registrationToken,
                                            String sidecarPublicKey,
                                            String sidecarKeyId) {
    log.debug("registerSidecar(sessionId={})", sessionId);
    try {
      return doRegister(sessionId, registrationToken, sidecarPublicKey, sidecarKeyId);
    } catch (ProvisioningException e) {
      securityEvents.registrationRejected(sessionId, e.code());
      throw e;
    }
  }

  private RegistrationResult doRegister(String sessionId,
                                        String registrationToken,
                                        String sidecarPublicKey,
                                        String sidecarKeyId) {
    if (!keyExchange.validatePublicKey(sidecarPublicKey)) {
      throw new ProvisioningException(ErrorCode.INVALID_KEY_FORMAT,
          "Public key must be a base64url uncompressed P-256 point");
    }
    if (!keyExchange.validateKeyId(sidecarKeyId)) {
      throw new ProvisioningException(ErrorCode.INVALID_KEY_FORMAT, "Key id must be base64url of 16 bytes");
    }

    Session session = sessionStore.load(sessionId)
        .filter(s -> tokenMatches(s.registrationToken(), registrationToken))
        .orElseThrow(() -> new ProvisioningException(ErrorCode.INVALID_SESSION_OR_TOKEN,
            "Invalid session or registration token"));

    if (session.status() != SessionStatus.CREATING) {
      throw invalidState(session);
    }

    DecryptedCredentials decrypted = decryptCredentials(session.userId(), null);
    Map<String, String> secrets = decrypted.secrets();

    EphemeralKeyPair orchestrator = keyExchange.generateEphemeralKeyPair();
    SealedPayload payload = seal(secrets, sidecarPublicKey, orchestrator, sidecarKeyId);
    String sidecarToken = tokenManager.issue(session.id(), sidecarKeyId);

    Session registered = session.withRegistration(sidecarKeyId, sidecarPublicKey,
        orchestrator.publicKey(), orchestrator.keyId(), clock.instant());
    Optional<Session> written = sessionStore.replace(registered, session.version());
    if (written.isEmpty()) {
      Session winner = sessionStore.load(sessionId)
          .orElseThrow(() -> new ProvisioningException(ErrorCode.INVALID_SESSION_OR_TOKEN,
              "Invalid session or registration token"));
      if (winner.status() != SessionStatus.CREATING) {
        throw invalidState(winner);
      }
      throw new ProvisioningException(ErrorCode.CONCURRENT_MODIFICATION, "Session was modified concurrently");
    }

    securityEvents.sidecarRegistered(session.id(), sidecarKeyId, secrets.size(), decrypted.failed());
    return new RegistrationResult(payload, sidecarToken, secrets.size(),
        orchestrator.publicKey(), orchestrator.keyId(), sidecarServicePort);
  }

  // ── Refresh ──────────────────────────────────────────────────────────────

  /**
   * Re-delivers credentials to an already registered sidecar under a brand new
   * orchestrator key pair.
   *
   * @param sessionId    the session
   * @param sidecarToken the token returned at registration
   * @param providers    optional provider filter
   * @return the freshly sealed credentials and the new orchestrator public key
   */
  public RefreshResult refreshProviderKeys(String sessionId, String sidecarToken, List<String> providers) {
    log.debug("refreshProviderKeys(sessionId={})", sessionId);
    SidecarTokenManager.SidecarClaims claims = tokenManager.verify(sidecarToken)
        .filter(c -> c.sessionId().equals(sessionId))
        .orElseThrow(() -> {
          securityEvents.sidecarTokenRejected(sessionId);
          return new ProvisioningException(ErrorCode.INVALID_SIDECAR_TOKEN, "Invalid or expired sidecar token");
        });

    Session session = sessionStore.load(sessionId)
        .orElseThrow(() -> new ProvisioningException(ErrorCode.INVALID_SIDECAR_TOKEN,
            "Invalid or expired sidecar token"));
    if (!session.isRegistered()) {
      throw new ProvisioningException(ErrorCode.INVALID_STATE, "Session has no registered sidecar");
    }
    if (!session.sidecarKeyId().equals(claims.sidecarKeyId())) {
      securityEvents.sidecarTokenRejected(sessionId);
      throw new ProvisioningException(ErrorCode.INVALID_SIDECAR_TOKEN, "Invalid or expired sidecar token");
    }
    if (session.status().isTerminal()) {
      throw invalidState(session);
    }

    Map<String, String> secrets = decryptCredentials(session.userId(), providers).secrets();
    EphemeralKeyPair orchestrator = keyExchange.generateEphemeralKeyPair();
    SealedPayload payload = seal(secrets, session.sidecarPublicKey(), orchestrator, session.sidecarKeyId());

    securityEvents.keysRefreshed(sessionId, secrets.size());
    return new RefreshResult(payload, secrets.size(), orchestrator.publicKey(), orchestrator.keyId());
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private DecryptedCredentials decryptCredentials(String userId, List<String> providers) {
    DecryptedCredentials decrypted = secretManager.decryptForUser(userId, providers);
    if (decrypted.attempted() == 0) {
      throw new ProvisioningException(ErrorCode.NO_CREDENTIALS, "No provider credentials configured");
    }
    if (decrypted.secrets().isEmpty()) {
      throw new ProvisioningException(ErrorCode.ALL_DECRYPT_FAILED,
          "None of the " + decrypted.attempted() + " stored credentials could be decrypted");
    }
    if (decrypted.failed() > 0) {
      log.warn("Skipped {} of {} credentials for user {} that failed to decrypt",
          decrypted.failed(), decrypted.attempted(), userId);
    }
    return decrypted;
  }

  private SealedPayload seal(Map<String, String> secrets,
                             String recipientPublicKey,
                             EphemeralKeyPair orchestrator,
                             String recipientKeyId) {
    try {
      return sealedDelivery.packageSecrets(secrets, recipientPublicKey, orchestrator.privateKey(), recipientKeyId);
    } catch (ProvisionCryptoException e) {
      throw CryptoErrors.translate(e);
    }
  }

  private static ProvisioningException invalidState(Session session) {
    return new ProvisioningException(ErrorCode.INVALID_STATE,
        "Session is in state " + session.status().wireName());
  }

  private static boolean tokenMatches(String expected, String provided) {
    if (expected == null || provided == null) {
      return false;
    }
    return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
  }
}
