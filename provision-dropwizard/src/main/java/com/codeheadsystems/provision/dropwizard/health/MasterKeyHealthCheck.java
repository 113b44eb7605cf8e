package com.codeheadsystems.provision.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.provision.crypto.envelope.EnvelopeEngine;
import com.codeheadsystems.provision.crypto.envelope.StoredSecret;

/**
 * Health check that encrypts and decrypts a canary value under the primary master key.
 */
public class MasterKeyHealthCheck extends HealthCheck {

  static final String CANARY = "provision-health-canary";

  private final EnvelopeEngine envelopeEngine;

  public MasterKeyHealthCheck(EnvelopeEngine envelopeEngine) {
    this.envelopeEngine = envelopeEngine;
  }

  @Override
  protected Result check() {
    StoredSecret sealed = envelopeEngine.encrypt(CANARY);
    String opened = envelopeEngine.decrypt(sealed);
    if (!CANARY.equals(opened)) {
      return Result.unhealthy("Canary did not survive an encrypt/decrypt cycle");
    }
    return Result.healthy("masterKeyId=%s keyVersion=%d", sealed.masterKeyId(), sealed.keyVersion());
  }
}
