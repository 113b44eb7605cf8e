package com.codeheadsystems.provision.server.manager;

import static com.codeheadsystems.provision.server.manager.Preconditions.requireField;

import com.codeheadsystems.provision.crypto.envelope.EnvelopeEngine;
import com.codeheadsystems.provision.crypto.envelope.StoredSecret;
import com.codeheadsystems.provision.crypto.exception.IntegrityException;
import com.codeheadsystems.provision.crypto.exception.ProvisionCryptoException;
import com.codeheadsystems.provision.server.exception.CryptoErrors;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.model.BatchMode;
import com.codeheadsystems.provision.server.model.BatchRotationResult;
import com.codeheadsystems.provision.server.model.ProviderSecret;
import com.codeheadsystems.provision.server.model.RotationAuditEntry;
import com.codeheadsystems.provision.server.model.RotationResult;
import com.codeheadsystems.provision.server.model.ScheduleResult;
import com.codeheadsystems.provision.server.model.ScheduleStatus;
import com.codeheadsystems.provision.server.model.ScheduledRotation;
import com.codeheadsystems.provision.server.security.SecurityEventLogger;
import com.codeheadsystems.provision.server.store.AuditStore;
import com.codeheadsystems.provision.server.store.RotationScheduleStore;
import com.codeheadsystems.provision.server.store.SecretStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-wraps stored credentials to new key versions, singly, in batches, or on a schedule.
 * <p>
 * Every attempt appends a {@link RotationAuditEntry}, successful or not. Writes are
 * conditional on the record the rotation started from, so two concurrent rotations of the
 * same credential never both commit.
 * <p>
 * Batch work runs on a fixed pool of {@code concurrency} daemon threads. Each credential is
 * one task, so its own writes are ordered. A task still running when its wait times out is
 * reported as {@link ErrorCode#TIMEOUT}; it is not cancelled and audits itself on completion.
 */
@Singleton
public class KeyRotationManager {

  public static final String CONCURRENCY = "rotationConcurrency";
  public static final String ITEM_TIMEOUT = "rotationItemTimeout";
  public static final int DEFAULT_CONCURRENCY = 5;
  public static final Duration DEFAULT_ITEM_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_HISTORY_LIMIT = 50;
  public static final int MAX_HISTORY_LIMIT = 1000;
  public static final int MAX_DUE_PER_RUN = 100;

  private static final Logger log = LoggerFactory.getLogger(KeyRotationManager.class);

  private final SecretStore secretStore;
  private final AuditStore auditStore;
  private final RotationScheduleStore scheduleStore;
  private final EnvelopeEngine envelopeEngine;
  private final SecurityEventLogger securityEvents;
  private final Clock clock;
  private final Duration itemTimeout;
  private final ExecutorService executor;

  @Inject
  public KeyRotationManager(SecretStore secretStore,
                            AuditStore auditStore,
                            RotationScheduleStore scheduleStore,
                            EnvelopeEngine envelopeEngine,
                            SecurityEventLogger securityEvents,
                            Clock clock,
                            @Named(CONCURRENCY) int concurrency,
                            @Named(ITEM_TIMEOUT) Duration itemTimeout) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("Rotation concurrency must be at least 1");
    }
    this.secretStore = secretStore;
    this.auditStore = auditStore;
    this.scheduleStore = scheduleStore;
    this.envelopeEngine = envelopeEngine;
    this.securityEvents = securityEvents;
    this.clock = clock;
    this.itemTimeout = itemTimeout;
    AtomicInteger threadNumber = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(concurrency, r -> {
      Thread t = new Thread(r, "key-rotation-" + threadNumber.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    log.info("KeyRotationManager(concurrency={}, itemTimeout={})", concurrency, itemTimeout);
  }

  /**
   * Shuts down the batch worker pool.
   * <p>
   * Should be called on application shutdown. In Dropwizard, register it with the
   * lifecycle as a managed object.
   */
  public void shutdown() {
    executor.shutdown();
  }

  // ── Single rotation ───────────────────────────────────────────────────────

  /**
   * Rotates one credential.
   *
   * @param userId        the owner
   * @param provider      the provider
   * @param targetVersion optional target; null means current version plus one
   * @return the outcome; failures are reported in the result
   * @throws ProvisioningException INVALID_REQUEST or INVALID_PROVIDER for malformed input
   */
  public RotationResult rotateOne(String userId, String provider, Integer targetVersion) {
    log.debug("rotateOne(userId={}, provider={}, targetVersion={})", userId, provider, targetVersion);
    requireField(userId, "userId");
    String normalized = ProviderNames.normalize(provider);
    return rotateAndAudit(userId, normalized, targetVersion);
  }

  private RotationResult rotateAndAudit(String userId, String provider, Integer targetVersion) {
    RotationResult result;
    try {
      result = attemptRotation(userId, provider, targetVersion);
    } catch (RuntimeException e) {
      log.error("Unexpected failure rotating {} for user {}", provider, userId, e);
      result = RotationResult.failed(provider, null, ErrorCode.INTERNAL, "Internal error");
    }
    audit(userId, result);
    return result;
  }

  private RotationResult attemptRotation(String userId, String provider, Integer targetVersion) {
    Optional<ProviderSecret> existing = secretStore.load(userId, provider);
    if (existing.isEmpty()) {
      return RotationResult.failed(provider, null, ErrorCode.NOT_FOUND, "No credential stored for " + provider);
    }
    ProviderSecret current = existing.get();
    ProviderSecret rotated;
    try {
      rotated = stage(current, targetVersion);
    } catch (ProvisioningException e) {
      return RotationResult.failed(provider, current.keyVersion(), e.code(), e.getMessage());
    }
    if (!secretStore.replace(current, rotated)) {
      return RotationResult.failed(provider, current.keyVersion(), ErrorCode.CONCURRENT_MODIFICATION,
          "Credential was modified concurrently");
    }
    return RotationResult.succeeded(provider, current.keyVersion(), rotated.keyVersion());
  }

  private ProviderSecret stage(ProviderSecret current, Integer targetVersion) {
    try {
      StoredSecret rotated = targetVersion == null
          ? envelopeEngine.rotate(current.secret())
          : envelopeEngine.rotate(current.secret(), targetVersion);
      return current.withSecret(rotated, clock.instant());
    } catch (IntegrityException e) {
      securityEvents.integrityFailure(current.userId(), current.provider(), "rotate");
      throw CryptoErrors.translate(e);
    } catch (ProvisionCryptoException e) {
      throw CryptoErrors.translate(e);
    }
  }

  // ── Batch rotation ────────────────────────────────────────────────────────

  /**
   * Rotates several credentials of one user.
   *
   * @param userId    the owner
   * @param providers optional provider list; null or empty means every stored credential
   * @param mode      required failure semantics
   * @return per-credential results and totals
   * @throws ProvisioningException INVALID_REQUEST if the mode is missing
   */
  public BatchRotationResult rotateAll(String userId, List<String> providers, BatchMode mode) {
    log.debug("rotateAll(userId={}, providers={}, mode={})", userId, providers, mode);
    requireField(userId, "userId");
    if (mode == null) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST, "Batch mode is required");
    }
    List<String> targets = resolveTargets(userId, providers);
    if (targets.isEmpty()) {
      return BatchRotationResult.of(List.of(), false);
    }
    BatchRotationResult result = mode == BatchMode.BEST_EFFORT
        ? bestEffort(userId, targets)
        : allOrNothing(userId, targets);
    log.info("rotateAll(userId={}, mode={}) total={} succeeded={} failed={} rolledBack={}", userId, mode,
        result.totalKeys(), result.successCount(), result.failureCount(), result.rolledBack());
    return result;
  }

  private List<String> resolveTargets(String userId, List<String> providers) {
    if (providers == null || providers.isEmpty()) {
      return secretStore.listForUser(userId).stream().map(ProviderSecret::provider).collect(Collectors.toList());
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String provider : providers) {
      normalized.add(ProviderNames.normalize(provider));
    }
    return new ArrayList<>(normalized);
  }

  private BatchRotationResult bestEffort(String userId, List<String> targets) {
    List<Future<RotationResult>> futures = new ArrayList<>();
    for (String provider : targets) {
      futures.add(submit(() -> rotateAndAudit(userId, provider, null)));
    }
    List<RotationResult> results = new ArrayList<>();
    for (int i = 0; i < targets.size(); i++) {
      String provider = targets.get(i);
      results.add(await(futures.get(i), provider,
          () -> RotationResult.failed(provider, null, ErrorCode.TIMEOUT,
              "Rotation did not finish within " + itemTimeout.toSeconds() + "s; it may still complete"),
          () -> RotationResult.failed(provider, null, ErrorCode.INTERNAL, "Internal error")));
    }
    return BatchRotationResult.of(results, false);
  }

  private BatchRotationResult allOrNothing(String userId, List<String> targets) {
    // Phase 1: load and re-encrypt everything. Nothing is written.
    List<Future<Staged>> futures = new ArrayList<>();
    for (String provider : targets) {
      futures.add(submit(() -> stageForBatch(userId, provider)));
    }
    List<Staged> staged = new ArrayList<>();
    for (int i = 0; i < targets.size(); i++) {
      String provider = targets.get(i);
      staged.add(await(futures.get(i), provider,
          () -> Staged.failure(provider, RotationResult.failed(provider, null, ErrorCode.TIMEOUT,
              "Staging did not finish within " + itemTimeout.toSeconds() + "s")),
          () -> Staged.failure(provider, RotationResult.failed(provider, null, ErrorCode.INTERNAL,
              "Internal error"))));
    }
    if (staged.stream().anyMatch(Staged::failed)) {
      List<RotationResult> results = staged.stream()
          .map(s -> s.failed() ? s.failure() : aborted(s))
          .collect(Collectors.toList());
      auditAll(userId, results);
      return BatchRotationResult.of(results, true);
    }

    // Phase 2: commit in order; compensate on the first write that is lost or throws.
    List<Staged> committed = new ArrayList<>();
    Staged lost = null;
    RotationResult lostResult = null;
    for (Staged s : staged) {
      try {
        if (secretStore.replace(s.original(), s.rotated())) {
          committed.add(s);
          continue;
        }
        lostResult = RotationResult.failed(s.provider(), s.original().keyVersion(),
            ErrorCode.CONCURRENT_MODIFICATION, "Credential was modified concurrently");
      } catch (RuntimeException e) {
        log.error("Failed to commit rotated {} for user {}", s.provider(), userId, e);
        lostResult = RotationResult.failed(s.provider(), s.original().keyVersion(),
            ErrorCode.INTERNAL, "Failed to write rotated credential");
      }
      lost = s;
      break;
    }
    List<RotationResult> results = new ArrayList<>();
    if (lost == null) {
      for (Staged s : staged) {
        results.add(RotationResult.succeeded(s.provider(), s.original().keyVersion(), s.rotated().keyVersion()));
      }
      auditAll(userId, results);
      return BatchRotationResult.of(results, false);
    }
    for (Staged s : staged) {
      if (committed.contains(s)) {
        results.add(compensate(userId, s));
      } else if (s == lost) {
        results.add(lostResult);
      } else {
        results.add(aborted(s));
      }
    }
    auditAll(userId, results);
    return BatchRotationResult.of(results, true);
  }

  private Staged stageForBatch(String userId, String provider) {
    Integer oldVersion = null;
    try {
      Optional<ProviderSecret> existing = secretStore.load(userId, provider);
      if (existing.isEmpty()) {
        return Staged.failure(provider,
            RotationResult.failed(provider, null, ErrorCode.NOT_FOUND, "No credential stored for " + provider));
      }
      oldVersion = existing.get().keyVersion();
      return new Staged(provider, existing.get(), stage(existing.get(), null), null);
    } catch (ProvisioningException e) {
      return Staged.failure(provider, RotationResult.failed(provider, oldVersion, e.code(), e.getMessage()));
    } catch (RuntimeException e) {
      log.error("Unexpected failure staging {} for user {}", provider, userId, e);
      return Staged.failure(provider, RotationResult.failed(provider, oldVersion, ErrorCode.INTERNAL, "Internal error"));
    }
  }

  private RotationResult compensate(String userId, Staged s) {
    try {
      if (secretStore.replace(s.rotated(), s.original())) {
        return RotationResult.failed(s.provider(), s.original().keyVersion(), ErrorCode.BATCH_ABORTED,
            "Rolled back because another credential in the batch failed to commit");
      }
    } catch (RuntimeException e) {
      log.error("Rollback of {} for user {} threw", s.provider(), userId, e);
    }
    securityEvents.compensationFailed(userId, s.provider());
    return RotationResult.failed(s.provider(), s.original().keyVersion(), ErrorCode.INTERNAL,
        "Rollback failed; credential may be at version " + s.rotated().keyVersion());
  }

  private static RotationResult aborted(Staged s) {
    return RotationResult.failed(s.provider(), s.original().keyVersion(), ErrorCode.BATCH_ABORTED,
        "Not committed because another credential in the batch failed");
  }

  private <T> Future<T> submit(Supplier<T> task) {
    return CompletableFuture.supplyAsync(task, executor);
  }

  private <T> T await(Future<T> future, String provider, Supplier<T> onTimeout, Supplier<T> onFailure) {
    try {
      return future.get(itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Rotation of {} timed out after {}", provider, itemTimeout);
      return onTimeout.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for rotation of {}", provider);
      return onTimeout.get();
    } catch (ExecutionException e) {
      log.error("Rotation task for {} failed", provider, e.getCause());
      return onFailure.get();
    }
  }

  private record Staged(String provider, ProviderSecret original, ProviderSecret rotated, RotationResult failure) {

    static Staged failure(String provider, RotationResult failure) {
      return new Staged(provider, null, null, failure);
    }

    boolean failed() {
      return failure != null;
    }
  }

  // ── Scheduling ────────────────────────────────────────────────────────────

  /**
   * Schedules a rotation. A pending schedule for the same credential is moved rather than
   * duplicated.
   *
   * @param userId        the owner
   * @param provider      the provider
   * @param when          a future instant
   * @param targetVersion optional target version
   * @return the schedule id and whether it was created or updated
   * @throws ProvisioningException INVALID_REQUEST, NOT_FOUND or UNSUPPORTED_VERSION
   */
  public ScheduleResult scheduleRotation(String userId, String provider, Instant when, Integer targetVersion) {
    log.debug("scheduleRotation(userId={}, provider={}, when={})", userId, provider, when);
    requireField(userId, "userId");
    String normalized = ProviderNames.normalize(provider);
    Instant now = clock.instant();
    if (when == null || !when.isAfter(now)) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST, "Scheduled time must be in the future");
    }
    ProviderSecret current = secretStore.load(userId, normalized)
        .orElseThrow(() -> new ProvisioningException(ErrorCode.NOT_FOUND, "No credential stored for " + normalized));
    if (targetVersion != null && targetVersion <= current.keyVersion()) {
      throw new ProvisioningException(ErrorCode.UNSUPPORTED_VERSION,
          "Target version " + targetVersion + " must be greater than current version " + current.keyVersion());
    }
    RotationScheduleStore.Upsert upsert = scheduleStore.upsertPending(new ScheduledRotation(
        UUID.randomUUID().toString(), userId, normalized, when, targetVersion, ScheduleStatus.PENDING, now,
        null, null));
    return new ScheduleResult(upsert.schedule().id(), upsert.created(), !upsert.created());
  }

  /**
   * Runs every pending schedule that is due, up to {@link #MAX_DUE_PER_RUN}.
   *
   * @return the number of schedules processed
   */
  public int runDueRotations() {
    List<ScheduledRotation> due = scheduleStore.findDue(clock.instant(), MAX_DUE_PER_RUN);
    for (ScheduledRotation schedule : due) {
      RotationResult result = rotateAndAudit(schedule.userId(), schedule.provider(), schedule.targetVersion());
      Instant now = clock.instant();
      scheduleStore.update(result.success()
          ? schedule.completed(now)
          : schedule.failed(now, result.errorCode() + ": " + result.error()));
    }
    return due.size();
  }

  // ── Audit ─────────────────────────────────────────────────────────────────

  /**
   * Rotation history, newest first.
   *
   * @param userId   the owner
   * @param provider optional provider filter
   * @param limit    optional maximum, defaults to {@link #DEFAULT_HISTORY_LIMIT}
   * @return the audit entries
   */
  public List<RotationAuditEntry> history(String userId, String provider, Integer limit) {
    requireField(userId, "userId");
    int effective = limit == null ? DEFAULT_HISTORY_LIMIT : limit;
    if (effective < 1 || effective > MAX_HISTORY_LIMIT) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST,
          "Limit must be between 1 and " + MAX_HISTORY_LIMIT);
    }
    if (provider == null || provider.isBlank()) {
      return auditStore.findByUser(userId, effective);
    }
    return auditStore.findByUserAndProvider(userId, ProviderNames.normalize(provider), effective);
  }

  private void auditAll(String userId, List<RotationResult> results) {
    for (RotationResult result : results) {
      try {
        audit(userId, result);
      } catch (RuntimeException e) {
        log.error("Failed to audit rotation of {} for user {}", result.provider(), userId, e);
      }
    }
  }

  private void audit(String userId, RotationResult result) {
    auditStore.append(new RotationAuditEntry(UUID.randomUUID().toString(), userId, result.provider(),
        result.oldVersion(), result.newVersion(), clock.instant(), result.success(),
        result.success() ? null : result.errorCode() + ": " + result.error()));
    securityEvents.rotation(userId, result.provider(), result.oldVersion(), result.newVersion(), result.errorCode());
  }
}
