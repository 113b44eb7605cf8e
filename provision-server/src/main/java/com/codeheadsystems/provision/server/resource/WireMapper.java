package com.codeheadsystems.provision.server.resource;

import com.codeheadsystems.provision.crypto.exchange.SealedPayload;
import com.codeheadsystems.provision.model.keys.ProviderKeySummary;
import com.codeheadsystems.provision.model.rotation.BatchRotationResponse;
import com.codeheadsystems.provision.model.rotation.RotationHistoryEntry;
import com.codeheadsystems.provision.model.rotation.RotationResultView;
import com.codeheadsystems.provision.model.session.SessionView;
import com.codeheadsystems.provision.model.sidecar.EncryptedProviderKeys;
import com.codeheadsystems.provision.server.model.BatchRotationResult;
import com.codeheadsystems.provision.server.model.ProviderSecret;
import com.codeheadsystems.provision.server.model.RotationAuditEntry;
import com.codeheadsystems.provision.server.model.RotationResult;
import com.codeheadsystems.provision.server.model.Session;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Conversions from manager results to wire models.
 */
final class WireMapper {

  private WireMapper() {
  }

  static EncryptedProviderKeys toWire(SealedPayload payload) {
    return new EncryptedProviderKeys(payload.ciphertext(), payload.nonce(), payload.tag(), payload.recipientKeyId());
  }

  static SessionView toView(Session session) {
    return new SessionView(session.id(), session.userId(), session.status().wireName(), session.sidecarKeyId(),
        session.orchestratorKeyId(), iso(session.registeredAt()), iso(session.createdAt()), iso(session.updatedAt()));
  }

  static ProviderKeySummary toSummary(ProviderSecret secret) {
    return new ProviderKeySummary(secret.provider(), secret.keyVersion(), secret.secret().masterKeyId(),
        iso(secret.createdAt()), iso(secret.updatedAt()));
  }

  static RotationResultView toView(RotationResult result) {
    return new RotationResultView(result.provider(), result.success(), result.oldVersion(), result.newVersion(),
        result.errorCode() == null ? null : result.errorCode().name(), result.error());
  }

  static BatchRotationResponse toWire(BatchRotationResult result) {
    return new BatchRotationResponse(result.totalKeys(), result.successCount(), result.failureCount(),
        result.rolledBack(), result.results().stream().map(WireMapper::toView).collect(Collectors.toList()));
  }

  static RotationHistoryEntry toWire(RotationAuditEntry entry) {
    return new RotationHistoryEntry(entry.id(), entry.provider(), entry.oldVersion(), entry.newVersion(),
        iso(entry.timestamp()), entry.success(), entry.error());
  }

  private static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
