package com.codeheadsystems.provision.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.provision.client.accessor.ProvisionAccessor;
import com.codeheadsystems.provision.client.config.ProvisionClientConfig;
import com.codeheadsystems.provision.client.exceptions.ProvisionAccessorException;
import com.codeheadsystems.provision.client.manager.SidecarProvisioningManager;
import com.codeheadsystems.provision.client.model.ProvisionedCredentials;
import com.codeheadsystems.provision.crypto.common.RandomProvider;
import com.codeheadsystems.provision.crypto.exchange.EphemeralKeyPair;
import com.codeheadsystems.provision.crypto.exchange.KeyExchange;
import com.codeheadsystems.provision.crypto.exchange.SealedDelivery;
import com.codeheadsystems.provision.model.common.ErrorResponse;
import com.codeheadsystems.provision.model.keys.ProviderKeySummary;
import com.codeheadsystems.provision.model.keys.StoreProviderKeyRequest;
import com.codeheadsystems.provision.model.keys.StoreProviderKeyResponse;
import com.codeheadsystems.provision.model.rotation.BatchRotationResponse;
import com.codeheadsystems.provision.model.rotation.RotateAllRequest;
import com.codeheadsystems.provision.model.rotation.RotateKeyRequest;
import com.codeheadsystems.provision.model.rotation.RotationHistoryEntry;
import com.codeheadsystems.provision.model.rotation.RotationResultView;
import com.codeheadsystems.provision.model.rotation.ScheduleRotationRequest;
import com.codeheadsystems.provision.model.rotation.ScheduleRotationResponse;
import com.codeheadsystems.provision.model.session.CreateSessionRequest;
import com.codeheadsystems.provision.model.session.CreateSessionResponse;
import com.codeheadsystems.provision.model.session.SessionView;
import com.codeheadsystems.provision.model.session.UpdateSessionStatusRequest;
import com.codeheadsystems.provision.model.sidecar.SidecarRegistrationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.lifecycle.JettyManaged;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.GenericType;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link ProvisionBundle}.
 * <p>
 * Starts a real embedded Jetty server using the test configuration and drives the sidecar
 * side through {@link SidecarProvisioningManager} over real HTTP.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class ProvisionBundleIntegrationTest {

  static final DropwizardAppExtension<ProvisionConfiguration> APP =
      new DropwizardAppExtension<>(
          ProvisionApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String OPENAI_KEY = "sk-live-0123456789abcdef";
  private static final String ANTHROPIC_KEY = "sk-ant-fedcba9876543210";

  private final RandomProvider randomProvider = new RandomProvider();
  private final KeyExchange keyExchange = new KeyExchange(randomProvider);
  private final HttpClient httpClient = HttpClient.newHttpClient();
  private final ObjectMapper objectMapper = new ObjectMapper();

  private String userId;

  @BeforeEach
  void setUp() {
    userId = "user-" + UUID.randomUUID();
  }

  // ── Health check ─────────────────────────────────────────────────────────

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    String body = response.readEntity(String.class);
    assertThat(body).contains("master-key");
    assertThat(body).contains("\"healthy\":true");
  }

  @Test
  void backgroundWorkIsManagedByTheApplication() {
    assertThat(APP.getEnvironment().lifecycle().getManagedObjects())
        .filteredOn(JettyManaged.class::isInstance)
        .extracting(managed -> ((JettyManaged) managed).getManaged())
        .hasAtLeastOneElementOfType(ProvisionLifecycle.class);
  }

  // ── Sidecar registration and refresh ─────────────────────────────────────

  @Test
  void sidecarReceivesStoredCredentials() {
    storeKey("OpenAI", OPENAI_KEY);
    storeKey("anthropic", ANTHROPIC_KEY);
    CreateSessionResponse session = createSession();

    SidecarProvisioningManager sidecar = sidecar(session.sessionId(), session.registrationToken());
    ProvisionedCredentials credentials = sidecar.register();

    assertThat(credentials.secrets())
        .containsExactlyInAnyOrderEntriesOf(Map.of("openai", OPENAI_KEY, "anthropic", ANTHROPIC_KEY));
    assertThat(credentials.servicePort()).isEqualTo(4096);
    assertThat(sidecar.isRegistered()).isTrue();

    SessionView view = APP.client()
        .target(baseUrl() + "/sessions/" + session.sessionId())
        .request(MediaType.APPLICATION_JSON)
        .get(SessionView.class);
    assertThat(view.status()).isEqualTo("active");
    assertThat(view.sidecarKeyId()).isNotEmpty();
    assertThat(view.orchestratorKeyId()).isEqualTo(credentials.orchestratorKeyId());
  }

  @Test
  void refreshDeliversFilteredCredentialsUnderANewOrchestratorKey() {
    storeKey("openai", OPENAI_KEY);
    storeKey("anthropic", ANTHROPIC_KEY);
    CreateSessionResponse session = createSession();
    SidecarProvisioningManager sidecar = sidecar(session.sessionId(), session.registrationToken());
    ProvisionedCredentials registered = sidecar.register();

    ProvisionedCredentials refreshed = sidecar.refresh(List.of("anthropic"));

    assertThat(refreshed.secrets()).containsExactly(Map.entry("anthropic", ANTHROPIC_KEY));
    assertThat(refreshed.orchestratorKeyId()).isNotEqualTo(registered.orchestratorKeyId());
  }

  @Test
  void secondRegistrationIsRejected() {
    storeKey("openai", OPENAI_KEY);
    CreateSessionResponse session = createSession();
    sidecar(session.sessionId(), session.registrationToken()).register();

    EphemeralKeyPair other = keyExchange.generateEphemeralKeyPair();
    Response response = APP.client()
        .target(baseUrl() + "/sidecar/register")
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(new SidecarRegistrationRequest(session.sessionId(), session.registrationToken(),
            other.publicKey(), other.keyId())));

    assertError(response, 409, "INVALID_STATE");
  }

  @Test
  void registrationWithWrongTokenIsUnauthorized() {
    storeKey("openai", OPENAI_KEY);
    CreateSessionResponse session = createSession();

    SidecarProvisioningManager sidecar = sidecar(session.sessionId(), "not-the-token");

    assertThatThrownBy(sidecar::register).isInstanceOf(SecurityException.class);
    assertThat(sidecar.isRegistered()).isFalse();
  }

  @Test
  void registrationWithoutCredentialsIsForbidden() {
    CreateSessionResponse session = createSession();

    assertThatThrownBy(() -> sidecar(session.sessionId(), session.registrationToken()).register())
        .isInstanceOfSatisfying(ProvisionAccessorException.class, e -> {
          assertThat(e.status()).isEqualTo(403);
          assertThat(e.errorCode()).isEqualTo("NO_CREDENTIALS");
        });
  }

  @Test
  void refreshAfterStopIsRejected() {
    storeKey("openai", OPENAI_KEY);
    CreateSessionResponse session = createSession();
    SidecarProvisioningManager sidecar = sidecar(session.sessionId(), session.registrationToken());
    sidecar.register();

    SessionView stopped = APP.client()
        .target(baseUrl() + "/sessions/" + session.sessionId() + "/status")
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new UpdateSessionStatusRequest("stopped")), SessionView.class);
    assertThat(stopped.status()).isEqualTo("stopped");

    assertThatThrownBy(() -> sidecar.refresh(null))
        .isInstanceOfSatisfying(ProvisionAccessorException.class, e -> {
          assertThat(e.status()).isEqualTo(409);
          assertThat(e.errorCode()).isEqualTo("INVALID_STATE");
        });
  }

  @Test
  void refreshIsRateLimitedPerSession() {
    storeKey("openai", OPENAI_KEY);
    CreateSessionResponse session = createSession();
    SidecarProvisioningManager sidecar = sidecar(session.sessionId(), session.registrationToken());
    sidecar.register();

    sidecar.refresh(null);
    sidecar.refresh(null);

    assertThatThrownBy(() -> sidecar.refresh(null))
        .isInstanceOfSatisfying(ProvisionAccessorException.class, e -> {
          assertThat(e.status()).isEqualTo(429);
          assertThat(e.errorCode()).isEqualTo("RATE_LIMITED");
        });
  }

  // ── Sessions ─────────────────────────────────────────────────────────────

  @Test
  void invalidTransitionIsConflict() {
    CreateSessionResponse session = createSession();

    Response response = APP.client()
        .target(baseUrl() + "/sessions/" + session.sessionId() + "/status")
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new UpdateSessionStatusRequest("idle")));

    assertError(response, 409, "INVALID_TRANSITION");
  }

  @Test
  void unknownSessionIsNotFound() {
    Response response = APP.client()
        .target(baseUrl() + "/sessions/" + UUID.randomUUID())
        .request(MediaType.APPLICATION_JSON)
        .get();

    assertError(response, 404, "NOT_FOUND");
  }

  @Test
  void unknownPathKeepsTheErrorShape() {
    Response response = APP.client()
        .target(baseUrl() + "/no-such-resource")
        .request(MediaType.APPLICATION_JSON)
        .get();

    assertError(response, 404, "NOT_FOUND");
  }

  // ── Provider keys ────────────────────────────────────────────────────────

  @Test
  void storeReplaceListAndDelete() {
    StoreProviderKeyResponse created = storeKey("openai", OPENAI_KEY);
    StoreProviderKeyResponse replaced = storeKey("openai", "sk-live-replacement-0001");
    storeKey("anthropic", ANTHROPIC_KEY);

    assertThat(created.created()).isTrue();
    assertThat(replaced.created()).isFalse();

    Response deleted = APP.client()
        .target(baseUrl() + "/users/" + userId + "/provider-keys/anthropic")
        .request()
        .delete();
    assertThat(deleted.getStatus()).isEqualTo(204);

    List<ProviderKeySummary> keys = APP.client()
        .target(baseUrl() + "/users/" + userId + "/provider-keys")
        .request(MediaType.APPLICATION_JSON)
        .get(new GenericType<List<ProviderKeySummary>>() { });
    assertThat(keys).extracting(ProviderKeySummary::provider).containsExactly("openai");
    assertThat(keys.get(0).masterKeyId()).isEqualTo("test-primary");
  }

  @Test
  void weakCredentialIsRejected() {
    Response response = APP.client()
        .target(baseUrl() + "/users/" + userId + "/provider-keys/openai")
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new StoreProviderKeyRequest("test-key-123")));

    assertError(response, 400, "INVALID_SECRET");
  }

  @Test
  void invalidProviderNameIsRejected() {
    Response response = APP.client()
        .target(baseUrl() + "/users/" + userId + "/provider-keys/-bad")
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new StoreProviderKeyRequest(OPENAI_KEY)));

    assertError(response, 400, "INVALID_PROVIDER");
  }

  // ── Rotation ─────────────────────────────────────────────────────────────

  @Test
  void rotatedCredentialIsStillDeliveredAndAudited() {
    storeKey("openai", OPENAI_KEY);

    RotationResultView rotated = APP.client()
        .target(baseUrl() + "/users/" + userId + "/rotations/openai")
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(new RotateKeyRequest(null)), RotationResultView.class);
    assertThat(rotated.success()).isTrue();
    assertThat(rotated.oldVersion()).isEqualTo(1);
    assertThat(rotated.newVersion()).isEqualTo(2);

    CreateSessionResponse session = createSession();
    ProvisionedCredentials credentials = sidecar(session.sessionId(), session.registrationToken()).register();
    assertThat(credentials.secrets()).containsEntry("openai", OPENAI_KEY);

    List<RotationHistoryEntry> history = APP.client()
        .target(baseUrl() + "/users/" + userId + "/rotations/history")
        .queryParam("provider", "openai")
        .request(MediaType.APPLICATION_JSON)
        .get(new GenericType<List<RotationHistoryEntry>>() { });
    assertThat(history).hasSize(1);
    assertThat(history.get(0).success()).isTrue();
    assertThat(history.get(0).newVersion()).isEqualTo(2);
  }

  @Test
  void batchRotationRotatesEveryCredential() {
    storeKey("openai", OPENAI_KEY);
    storeKey("anthropic", ANTHROPIC_KEY);

    BatchRotationResponse batch = APP.client()
        .target(baseUrl() + "/users/" + userId + "/rotations")
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(new RotateAllRequest(null, "all_or_nothing")), BatchRotationResponse.class);

    assertThat(batch.totalKeys()).isEqualTo(2);
    assertThat(batch.successCount()).isEqualTo(2);
    assertThat(batch.rolledBack()).isFalse();
    assertThat(batch.results()).extracting(RotationResultView::newVersion).containsOnly(2);
  }

  @Test
  void batchRotationRequiresMode() {
    storeKey("openai", OPENAI_KEY);

    Response response = APP.client()
        .target(baseUrl() + "/users/" + userId + "/rotations")
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(new RotateAllRequest(null, null)));

    assertError(response, 400, "INVALID_REQUEST");
  }

  @Test
  void schedulingTwiceUpdatesThePendingSchedule() {
    storeKey("openai", OPENAI_KEY);
    String path = baseUrl() + "/users/" + userId + "/rotations/openai/schedule";

    ScheduleRotationResponse first = APP.client().target(path)
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new ScheduleRotationRequest("2099-01-01T00:00:00Z", null)), ScheduleRotationResponse.class);
    ScheduleRotationResponse second = APP.client().target(path)
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new ScheduleRotationRequest("2099-06-01T00:00:00Z", 5)), ScheduleRotationResponse.class);

    assertThat(first.created()).isTrue();
    assertThat(second.updated()).isTrue();
    assertThat(second.id()).isEqualTo(first.id());
  }

  @Test
  void malformedScheduleTimeIsRejected() {
    storeKey("openai", OPENAI_KEY);

    Response response = APP.client()
        .target(baseUrl() + "/users/" + userId + "/rotations/openai/schedule")
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new ScheduleRotationRequest("next tuesday", null)));

    assertError(response, 400, "INVALID_REQUEST");
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private CreateSessionResponse createSession() {
    Response response = APP.client()
        .target(baseUrl() + "/sessions")
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(new CreateSessionRequest(userId)));
    assertThat(response.getStatus()).isEqualTo(201);
    return response.readEntity(CreateSessionResponse.class);
  }

  private StoreProviderKeyResponse storeKey(String provider, String key) {
    return APP.client()
        .target(baseUrl() + "/users/" + userId + "/provider-keys/" + provider)
        .request(MediaType.APPLICATION_JSON)
        .put(Entity.json(new StoreProviderKeyRequest(key)), StoreProviderKeyResponse.class);
  }

  private SidecarProvisioningManager sidecar(String sessionId, String registrationToken) {
    ProvisionClientConfig config = new ProvisionClientConfig(URI.create(baseUrl() + "/"), sessionId,
        registrationToken);
    ProvisionAccessor accessor = new ProvisionAccessor(httpClient, objectMapper, config);
    return new SidecarProvisioningManager(config, accessor, keyExchange,
        new SealedDelivery(keyExchange, randomProvider));
  }

  private static void assertError(Response response, int status, String code) {
    assertThat(response.getStatus()).isEqualTo(status);
    ErrorResponse body = response.readEntity(ErrorResponse.class);
    assertThat(body.success()).isFalse();
    assertThat(body.error().code()).isEqualTo(code);
    assertThat(body.error().message()).isNotBlank();
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
