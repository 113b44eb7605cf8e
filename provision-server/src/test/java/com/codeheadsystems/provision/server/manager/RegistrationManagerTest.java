package com.codeheadsystems.provision.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.provision.crypto.common.RandomProvider;
import com.codeheadsystems.provision.crypto.envelope.EnvelopeEngine;
import com.codeheadsystems.provision.crypto.envelope.MasterKey;
import com.codeheadsystems.provision.crypto.envelope.MasterKeyRing;
import com.codeheadsystems.provision.crypto.exchange.EphemeralKeyPair;
import com.codeheadsystems.provision.crypto.exchange.KeyExchange;
import com.codeheadsystems.provision.crypto.exchange.SealedDelivery;
import com.codeheadsystems.provision.server.auth.SidecarTokenManager;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.model.RefreshResult;
import com.codeheadsystems.provision.server.model.RegistrationResult;
import com.codeheadsystems.provision.server.model.Session;
import com.codeheadsystems.provision.server.model.SessionStatus;
import com.codeheadsystems.provision.server.security.SecurityEventLogger;
import com.codeheadsystems.provision.server.store.InMemorySecretStore;
import com.codeheadsystems.provision.server.store.InMemorySessionStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RegistrationManagerTest {

  private static final String USER = "user-1";
  private static final String OPENAI_KEY = "sk-proj-0123456789abcdef";
  private static final String ANTHROPIC_KEY = "sk-ant-api03-abcdefghij";
  private static final byte[] TOKEN_SECRET = "sidecar-token-secret-at-least-32-bytes".getBytes();
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

  private InMemorySecretStore secretStore;
  private ProviderSecretManager secretManager;
  private SessionManager sessionManager;
  private KeyExchange keyExchange;
  private SealedDelivery sealedDelivery;
  private SidecarTokenManager tokenManager;
  private RegistrationManager manager;
  private EphemeralKeyPair sidecar;

  @BeforeEach
  void setUp() {
    RandomProvider random = new RandomProvider();
    SecurityEventLogger securityEvents = new SecurityEventLogger();
    InMemorySessionStore sessionStore = new InMemorySessionStore();
    secretStore = new InMemorySecretStore();
    EnvelopeEngine engine = new EnvelopeEngine(new MasterKeyRing(MasterKey.random("mk-1", random)), random);
    secretManager = new ProviderSecretManager(secretStore, engine, securityEvents, CLOCK);
    sessionManager = new SessionManager(sessionStore, random, CLOCK);
    keyExchange = new KeyExchange(random);
    sealedDelivery = new SealedDelivery(keyExchange, random, CLOCK, SealedDelivery.DEFAULT_FRESHNESS_WINDOW);
    tokenManager = new SidecarTokenManager(TOKEN_SECRET, "test", SidecarTokenManager.DEFAULT_TTL, CLOCK);
    manager = new RegistrationManager(sessionStore, secretManager, keyExchange, sealedDelivery, tokenManager,
        securityEvents, CLOCK, 4096);
    sidecar = keyExchange.generateEphemeralKeyPair();
  }

  private RegistrationResult register(Session session) {
    return manager.registerSidecar(session.id(), session.registrationToken(), sidecar.publicKey(), sidecar.keyId());
  }

  // ── Registration ─────────────────────────────────────────────────────────

  @Test
  void register_deliversEveryCredentialSealedToTheSidecar() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    secretManager.store(USER, "anthropic", ANTHROPIC_KEY);
    Session session = sessionManager.create(USER);

    RegistrationResult result = register(session);

    assertThat(result.credentialCount()).isEqualTo(2);
    assertThat(result.sidecarServicePort()).isEqualTo(4096);
    assertThat(result.sealedPayload().recipientKeyId()).isEqualTo(sidecar.keyId());
    assertThat(result.sealedPayload().ciphertext()).doesNotContain("sk-");
    Map<String, String> secrets = sealedDelivery.unpackSecrets(result.sealedPayload(), sidecar.privateKey(),
        result.orchestratorPublicKey());
    assertThat(secrets).containsExactlyInAnyOrderEntriesOf(Map.of("openai", OPENAI_KEY, "anthropic", ANTHROPIC_KEY));

    Session registered = sessionManager.get(session.id());
    assertThat(registered.status()).isEqualTo(SessionStatus.ACTIVE);
    assertThat(registered.sidecarKeyId()).isEqualTo(sidecar.keyId());
    assertThat(registered.orchestratorKeyId()).isEqualTo(result.orchestratorKeyId());
    assertThat(registered.registeredAt()).isEqualTo(CLOCK.instant());
    assertThat(tokenManager.verify(result.sidecarToken()))
        .get()
        .satisfies(c -> {
          assertThat(c.sessionId()).isEqualTo(session.id());
          assertThat(c.sidecarKeyId()).isEqualTo(sidecar.keyId());
        });
  }

  @Test
  void register_secondAttempt_isInvalidState() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);
    register(session);

    assertCode(() -> register(session), ErrorCode.INVALID_STATE);
  }

  @Test
  void register_losingToAnotherSidecar_isInvalidStateAndKeepsTheWinner() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    EphemeralKeyPair rival = keyExchange.generateEphemeralKeyPair();
    RacingSessionStore store = new RacingSessionStore(current -> current.withRegistration(rival.keyId(),
        rival.publicKey(), "rival-orchestrator-key", "rival-orchestrator-id", CLOCK.instant()));
    Session session = new SessionManager(store, new RandomProvider(), CLOCK).create(USER);

    assertCode(() -> managerWith(store).registerSidecar(session.id(), session.registrationToken(),
        sidecar.publicKey(), sidecar.keyId()), ErrorCode.INVALID_STATE);

    Session stored = store.load(session.id()).orElseThrow();
    assertThat(stored.status()).isEqualTo(SessionStatus.ACTIVE);
    assertThat(stored.sidecarKeyId()).isEqualTo(rival.keyId());
    assertThat(stored.version()).isEqualTo(session.version() + 1);
  }

  @Test
  void register_losingToAnUnrelatedWrite_isConcurrentModification() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    RacingSessionStore store = new RacingSessionStore(current -> current);
    Session session = new SessionManager(store, new RandomProvider(), CLOCK).create(USER);

    assertCode(() -> managerWith(store).registerSidecar(session.id(), session.registrationToken(),
        sidecar.publicKey(), sidecar.keyId()), ErrorCode.CONCURRENT_MODIFICATION);

    Session stored = store.load(session.id()).orElseThrow();
    assertThat(stored.status()).isEqualTo(SessionStatus.CREATING);
    assertThat(stored.isRegistered()).isFalse();
  }

  @Test
  void register_wrongTokenOrUnknownSession_isIndistinguishable() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);

    assertCode(() -> manager.registerSidecar(session.id(), "wrong", sidecar.publicKey(), sidecar.keyId()),
        ErrorCode.INVALID_SESSION_OR_TOKEN);
    assertCode(() -> manager.registerSidecar("missing", session.registrationToken(), sidecar.publicKey(),
        sidecar.keyId()), ErrorCode.INVALID_SESSION_OR_TOKEN);
    assertThat(sessionManager.get(session.id()).status()).isEqualTo(SessionStatus.CREATING);
  }

  @Test
  void register_malformedKeyMaterial_isInvalidKeyFormat() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);

    assertCode(() -> manager.registerSidecar(session.id(), session.registrationToken(), "not-a-point",
        sidecar.keyId()), ErrorCode.INVALID_KEY_FORMAT);
    assertCode(() -> manager.registerSidecar(session.id(), session.registrationToken(), sidecar.publicKey(),
        "short"), ErrorCode.INVALID_KEY_FORMAT);
  }

  @Test
  void register_stoppedSession_isInvalidState() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);
    sessionManager.transition(session.id(), SessionStatus.STOPPED);

    assertCode(() -> register(session), ErrorCode.INVALID_STATE);
  }

  @Test
  void register_withoutCredentials_isNoCredentialsAndLeavesSessionCreating() {
    Session session = sessionManager.create(USER);

    assertCode(() -> register(session), ErrorCode.NO_CREDENTIALS);
    assertThat(sessionManager.get(session.id()).status()).isEqualTo(SessionStatus.CREATING);
  }

  @Test
  void register_allCredentialsCorrupted_isAllDecryptFailed() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Tampering.corrupt(secretStore, USER, "openai");
    Session session = sessionManager.create(USER);

    assertCode(() -> register(session), ErrorCode.ALL_DECRYPT_FAILED);
  }

  @Test
  void register_someCredentialsCorrupted_deliversTheRest() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    secretManager.store(USER, "anthropic", ANTHROPIC_KEY);
    Tampering.corrupt(secretStore, USER, "openai");
    Session session = sessionManager.create(USER);

    RegistrationResult result = register(session);

    assertThat(result.credentialCount()).isEqualTo(1);
    assertThat(sealedDelivery.unpackSecrets(result.sealedPayload(), sidecar.privateKey(),
        result.orchestratorPublicKey())).containsOnlyKeys("anthropic");
  }

  @Test
  void register_twoSessions_getDistinctOrchestratorKeys() {
    secretManager.store(USER, "openai", OPENAI_KEY);

    RegistrationResult first = register(sessionManager.create(USER));
    RegistrationResult second = register(sessionManager.create(USER));

    assertThat(first.orchestratorPublicKey()).isNotEqualTo(second.orchestratorPublicKey());
    assertThat(first.orchestratorKeyId()).isNotEqualTo(second.orchestratorKeyId());
  }

  // ── Refresh ──────────────────────────────────────────────────────────────

  @Test
  void refresh_sealsUnderNewOrchestratorKey() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);
    RegistrationResult registration = register(session);
    secretManager.store(USER, "anthropic", ANTHROPIC_KEY);

    RefreshResult refresh = manager.refreshProviderKeys(session.id(), registration.sidecarToken(), null);

    assertThat(refresh.orchestratorPublicKey()).isNotEqualTo(registration.orchestratorPublicKey());
    assertThat(refresh.credentialCount()).isEqualTo(2);
    assertThat(sealedDelivery.unpackSecrets(refresh.sealedPayload(), sidecar.privateKey(),
        refresh.orchestratorPublicKey())).containsEntry("anthropic", ANTHROPIC_KEY);
  }

  @Test
  void refresh_withProviderFilter_returnsSubset() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    secretManager.store(USER, "anthropic", ANTHROPIC_KEY);
    Session session = sessionManager.create(USER);
    RegistrationResult registration = register(session);

    RefreshResult refresh = manager.refreshProviderKeys(session.id(), registration.sidecarToken(),
        List.of("OpenAI"));

    assertThat(sealedDelivery.unpackSecrets(refresh.sealedPayload(), sidecar.privateKey(),
        refresh.orchestratorPublicKey())).containsOnlyKeys("openai");
  }

  @Test
  void refresh_tokenOfAnotherSession_isRejected() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session first = sessionManager.create(USER);
    Session second = sessionManager.create(USER);
    RegistrationResult registration = register(first);
    register(second);

    assertCode(() -> manager.refreshProviderKeys(second.id(), registration.sidecarToken(), null),
        ErrorCode.INVALID_SIDECAR_TOKEN);
    assertCode(() -> manager.refreshProviderKeys(first.id(), "garbage", null), ErrorCode.INVALID_SIDECAR_TOKEN);
  }

  @Test
  void refresh_tokenForDifferentSidecarKey_isRejected() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);
    register(session);
    String foreign = tokenManager.issue(session.id(), keyExchange.generateEphemeralKeyPair().keyId());

    assertCode(() -> manager.refreshProviderKeys(session.id(), foreign, null), ErrorCode.INVALID_SIDECAR_TOKEN);
  }

  @Test
  void refresh_afterStop_isInvalidState() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);
    RegistrationResult registration = register(session);
    sessionManager.transition(session.id(), SessionStatus.STOPPED);

    assertCode(() -> manager.refreshProviderKeys(session.id(), registration.sidecarToken(), null),
        ErrorCode.INVALID_STATE);
  }

  @Test
  void refresh_idleSession_isAllowed() {
    secretManager.store(USER, "openai", OPENAI_KEY);
    Session session = sessionManager.create(USER);
    RegistrationResult registration = register(session);
    sessionManager.transition(session.id(), SessionStatus.IDLE);

    assertThat(manager.refreshProviderKeys(session.id(), registration.sidecarToken(), null).credentialCount())
        .isEqualTo(1);
  }

  private RegistrationManager managerWith(InMemorySessionStore sessionStore) {
    return new RegistrationManager(sessionStore, secretManager, keyExchange, sealedDelivery, tokenManager,
        new SecurityEventLogger(), CLOCK, 4096);
  }

  /**
   * Lets another writer update the session just before the first registration write, which
   * then loses its conditional replace.
   */
  private static class RacingSessionStore extends InMemorySessionStore {

    private final AtomicReference<UnaryOperator<Session>> rival;

    RacingSessionStore(UnaryOperator<Session> rival) {
      this.rival = new AtomicReference<>(rival);
    }

    @Override
    public Optional<Session> replace(Session updated, long expectedVersion) {
      UnaryOperator<Session> write = rival.getAndSet(null);
      if (write != null) {
        Session current = load(updated.id()).orElseThrow();
        super.replace(write.apply(current), current.version());
      }
      return super.replace(updated, expectedVersion);
    }
  }

  private static void assertCode(ThrowingCallable call, ErrorCode code) {
    assertThatThrownBy(call)
        .isInstanceOfSatisfying(ProvisioningException.class, e -> assertThat(e.code()).isEqualTo(code));
  }
}
