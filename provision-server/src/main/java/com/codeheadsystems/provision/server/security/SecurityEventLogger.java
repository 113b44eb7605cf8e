package com.codeheadsystems.provision.server.security;

import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.ratelimit.RateLimitedOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records security-relevant events on a dedicated logger so they can be routed apart from
 * application logs. Never logs secrets, tokens or key material.
 */
public class SecurityEventLogger {

  public static final String LOGGER_NAME = "security";

  private final Logger log;

  public SecurityEventLogger() {
    this(LoggerFactory.getLogger(LOGGER_NAME));
  }

  public SecurityEventLogger(Logger log) {
    this.log = log;
  }

  public void sidecarRegistered(String sessionId, String sidecarKeyId, int credentialCount, int skipped) {
    log.info("event=sidecar_registered sessionId={} sidecarKeyId={} credentials={} skipped={}",
        sessionId, sidecarKeyId, credentialCount, skipped);
  }

  public void registrationRejected(String sessionId, ErrorCode code) {
    log.warn("event=registration_rejected sessionId={} code={}", sessionId, code);
  }

  public void keysRefreshed(String sessionId, int credentialCount) {
    log.info("event=keys_refreshed sessionId={} credentials={}", sessionId, credentialCount);
  }

  public void sidecarTokenRejected(String sessionId) {
    log.warn("event=sidecar_token_rejected sessionId={}", sessionId);
  }

  public void integrityFailure(String userId, String provider, String context) {
    log.error("event=integrity_failure userId={} provider={} context={}", userId, provider, context);
  }

  public void decryptFailure(String userId, String provider, ErrorCode code) {
    log.warn("event=decrypt_failure userId={} provider={} code={}", userId, provider, code);
  }

  public void rateLimited(String identity, RateLimitedOperation operation) {
    log.warn("event=rate_limited identity={} operation={}", identity, operation);
  }

  public void rotation(String userId, String provider, Integer oldVersion, Integer newVersion, ErrorCode failure) {
    if (failure == null) {
      log.info("event=key_rotated userId={} provider={} oldVersion={} newVersion={}",
          userId, provider, oldVersion, newVersion);
    } else {
      log.warn("event=key_rotation_failed userId={} provider={} oldVersion={} code={}",
          userId, provider, oldVersion, failure);
    }
  }

  public void compensationFailed(String userId, String provider) {
    log.error("event=rotation_compensation_failed userId={} provider={}", userId, provider);
  }

  public void credentialStored(String userId, String provider, boolean created) {
    log.info("event=credential_stored userId={} provider={} created={}", userId, provider, created);
  }

  public void credentialDeleted(String userId, String provider) {
    log.info("event=credential_deleted userId={} provider={}", userId, provider);
  }
}
