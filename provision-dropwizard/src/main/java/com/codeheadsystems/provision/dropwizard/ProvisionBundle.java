package com.codeheadsystems.provision.dropwizard;

import com.codeheadsystems.provision.crypto.common.RandomProvider;
import com.codeheadsystems.provision.crypto.envelope.EnvelopeEngine;
import com.codeheadsystems.provision.crypto.envelope.EnvironmentMasterKeyProvider;
import com.codeheadsystems.provision.crypto.envelope.MasterKey;
import com.codeheadsystems.provision.crypto.envelope.MasterKeyRing;
import com.codeheadsystems.provision.crypto.envelope.SecretStrengthPolicy;
import com.codeheadsystems.provision.crypto.exchange.KeyExchange;
import com.codeheadsystems.provision.crypto.exchange.SealedDelivery;
import com.codeheadsystems.provision.dropwizard.health.MasterKeyHealthCheck;
import com.codeheadsystems.provision.server.auth.SidecarTokenManager;
import com.codeheadsystems.provision.server.manager.KeyRotationManager;
import com.codeheadsystems.provision.server.manager.ProviderSecretManager;
import com.codeheadsystems.provision.server.manager.RegistrationManager;
import com.codeheadsystems.provision.server.manager.RotationScheduler;
import com.codeheadsystems.provision.server.manager.SessionManager;
import com.codeheadsystems.provision.server.ratelimit.BucketEvictor;
import com.codeheadsystems.provision.server.ratelimit.RateLimitGuard;
import com.codeheadsystems.provision.server.ratelimit.TokenBucketRateLimiter;
import com.codeheadsystems.provision.server.resource.ProviderKeyResource;
import com.codeheadsystems.provision.server.resource.ProvisioningExceptionMapper;
import com.codeheadsystems.provision.server.resource.RotationResource;
import com.codeheadsystems.provision.server.resource.SessionResource;
import com.codeheadsystems.provision.server.resource.SidecarResource;
import com.codeheadsystems.provision.server.resource.UnexpectedExceptionMapper;
import com.codeheadsystems.provision.server.security.SecurityEventLogger;
import com.codeheadsystems.provision.server.store.AuditStore;
import com.codeheadsystems.provision.server.store.InMemoryAuditStore;
import com.codeheadsystems.provision.server.store.InMemoryRotationScheduleStore;
import com.codeheadsystems.provision.server.store.InMemorySecretStore;
import com.codeheadsystems.provision.server.store.InMemorySessionStore;
import com.codeheadsystems.provision.server.store.RotationScheduleStore;
import com.codeheadsystems.provision.server.store.SecretStore;
import com.codeheadsystems.provision.server.store.SessionStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the provisioning service into an existing Dropwizard application.
 * <p>
 * Registers the sidecar, session, provider key and rotation resources, the exception mappers,
 * the master key health check, and the scheduled rotation poller and rate limit bucket
 * eviction as a managed object.
 * Requires a {@link ProvisionConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new ProvisionBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new ProvisionBundle<>(sessionStore, secretStore, auditStore, scheduleStore));
 * }</pre>
 */
@Singleton
public class ProvisionBundle<C extends ProvisionConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(ProvisionBundle.class);

  private final SessionStore sessionStore;
  private final SecretStore secretStore;
  private final AuditStore auditStore;
  private final RotationScheduleStore scheduleStore;
  private final Clock clock;

  /**
   * Creates a bundle backed by in-memory stores. For dev/test only; every session, credential
   * and audit entry is lost on restart.
   */
  public ProvisionBundle() {
    this(new InMemorySessionStore(), new InMemorySecretStore(), new InMemoryAuditStore(),
        new InMemoryRotationScheduleStore());
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory stores. All sessions,      #
        # credentials and audit entries will be lost on restart.        #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  @Inject
  public ProvisionBundle(SessionStore sessionStore,
                         SecretStore secretStore,
                         AuditStore auditStore,
                         RotationScheduleStore scheduleStore) {
    this(sessionStore, secretStore, auditStore, scheduleStore, Clock.systemUTC());
  }

  /**
   * Creates a bundle with an explicit clock.
   *
   * @param sessionStore  the session store
   * @param secretStore   the credential store
   * @param auditStore    the rotation audit log
   * @param scheduleStore the scheduled rotation store
   * @param clock         time source for tokens, payload timestamps and rate limits
   */
  public ProvisionBundle(SessionStore sessionStore,
                         SecretStore secretStore,
                         AuditStore auditStore,
                         RotationScheduleStore scheduleStore,
                         Clock clock) {
    this.sessionStore = sessionStore;
    this.secretStore = secretStore;
    this.auditStore = auditStore;
    this.scheduleStore = scheduleStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RandomProvider randomProvider = new RandomProvider();
    SecurityEventLogger securityEvents = new SecurityEventLogger();

    EnvelopeEngine envelopeEngine = new EnvelopeEngine(
        buildKeyRing(configuration, randomProvider),
        randomProvider,
        new SecretStrengthPolicy(),
        configuration.getCurrentKeyVersion(),
        configuration.getMinimumSupportedKeyVersion());
    KeyExchange keyExchange = new KeyExchange(randomProvider);
    SealedDelivery sealedDelivery = new SealedDelivery(keyExchange, randomProvider, clock,
        Duration.ofSeconds(configuration.getPayloadFreshnessSeconds()));
    SidecarTokenManager tokenManager = new SidecarTokenManager(
        buildTokenSecret(configuration, randomProvider),
        configuration.getSidecarTokenIssuer(),
        Duration.ofSeconds(configuration.getSidecarTokenTtlSeconds()),
        clock);

    SessionManager sessionManager = new SessionManager(sessionStore, randomProvider, clock);
    ProviderSecretManager secretManager =
        new ProviderSecretManager(secretStore, envelopeEngine, securityEvents, clock);
    RegistrationManager registrationManager = new RegistrationManager(sessionStore, secretManager,
        keyExchange, sealedDelivery, tokenManager, securityEvents, clock,
        configuration.getSidecarServicePort());
    KeyRotationManager rotationManager = new KeyRotationManager(secretStore, auditStore, scheduleStore,
        envelopeEngine, securityEvents, clock, configuration.getRotationConcurrency(),
        Duration.ofSeconds(configuration.getRotationTimeoutSeconds()));
    RotationScheduler rotationScheduler =
        new RotationScheduler(rotationManager, Duration.ofSeconds(configuration.getRotationPollSeconds()));

    TokenBucketRateLimiter rateLimiter = new TokenBucketRateLimiter(configuration.rateLimitPolicies(), clock);
    RateLimitGuard rateLimitGuard = new RateLimitGuard(rateLimiter, securityEvents);
    BucketEvictor bucketEvictor =
        new BucketEvictor(rateLimiter, Duration.ofSeconds(configuration.getRateLimitEvictionSeconds()));

    environment.jersey().register(new SidecarResource(registrationManager, rateLimitGuard));
    environment.jersey().register(new SessionResource(sessionManager, rateLimitGuard));
    environment.jersey().register(new ProviderKeyResource(secretManager, rateLimitGuard));
    environment.jersey().register(new RotationResource(rotationManager, rateLimitGuard));
    environment.jersey().register(new ProvisioningExceptionMapper(clock));
    environment.jersey().register(new UnexpectedExceptionMapper());
    environment.healthChecks().register("master-key", new MasterKeyHealthCheck(envelopeEngine));

    environment.lifecycle().manage(new ProvisionLifecycle(rotationScheduler, rotationManager, bucketEvictor));
  }

  private MasterKeyRing buildKeyRing(C configuration, RandomProvider randomProvider) {
    MasterKey primary;
    String variable = configuration.getMasterKeyEnvironmentVariable();
    String masterKeyHex = configuration.getMasterKeyHex();
    if (variable != null && !variable.isEmpty()) {
      primary = new EnvironmentMasterKeyProvider(variable, System::getenv).load();
    } else if (masterKeyHex == null || masterKeyHex.isEmpty()) {
      log.warn("No master key configured; generating randomly. "
          + "Stored credentials cannot be decrypted after a restart. Do not use in production.");
      primary = MasterKey.random(configuration.getMasterKeyId(), randomProvider);
    } else {
      primary = MasterKey.fromHex(configuration.getMasterKeyId(), masterKeyHex);
    }

    List<MasterKey> retired = new ArrayList<>();
    for (Map.Entry<String, String> entry : configuration.getRetiredMasterKeys().entrySet()) {
      retired.add(MasterKey.fromHex(entry.getKey(), entry.getValue()));
    }
    log.info("Master key ring: primary={}, retired={}", primary.keyId(), retired.size());
    return new MasterKeyRing(primary, retired);
  }

  private byte[] buildTokenSecret(C configuration, RandomProvider randomProvider) {
    String secretHex = configuration.getSidecarTokenSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No sidecar token secret configured; generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      return randomProvider.randomBytes(32);
    }
    return HexFormat.of().parseHex(secretHex);
  }
}
