package com.codeheadsystems.provision.dropwizard;

import com.codeheadsystems.provision.server.ratelimit.RateLimitPolicy;
import com.codeheadsystems.provision.server.ratelimit.RateLimitedOperation;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Dropwizard configuration for the provisioning service.
 * <p>
 * For production, supply {@code masterKeyHex} (or {@code masterKeyEnvironmentVariable}) and
 * {@code sidecarTokenSecretHex}, each a hex-encoded 32-byte random value, so that stored
 * credentials and issued sidecar tokens survive restarts. Omitting them causes random values
 * to be generated on each startup (dev/test only).
 * <p>
 * Generate keys with: {@code openssl rand -hex 32}
 */
public class ProvisionConfiguration extends Configuration {

  /**
   * Identifier of the primary master key. Written into every stored record.
   */
  @NotEmpty
  private String masterKeyId = "primary";

  /**
   * Hex-encoded 32-byte primary master key. Ignored when
   * {@code masterKeyEnvironmentVariable} is set.
   */
  private String masterKeyHex = "";

  /**
   * Name of an environment variable holding the master key in hex or base64. The key id
   * then becomes {@code env:<VARIABLE>}.
   */
  private String masterKeyEnvironmentVariable = "";

  /**
   * Retired master keys (id to hex) kept only to decrypt records written under them.
   */
  @NotNull
  private Map<String, String> retiredMasterKeys = new HashMap<>();

  @Min(1)
  private int currentKeyVersion = 1;

  @Min(1)
  private int minimumSupportedKeyVersion = 1;

  /**
   * Hex-encoded HMAC-SHA256 secret for sidecar tokens, at least 32 bytes.
   * Leave empty for random generation (dev only; tokens become invalid on restart).
   */
  private String sidecarTokenSecretHex = "";

  @NotEmpty
  private String sidecarTokenIssuer = "provision";

  @Min(1)
  private long sidecarTokenTtlSeconds = 86400;

  /**
   * Maximum age of a sealed credential bundle before the sidecar rejects it.
   */
  @Min(1)
  private long payloadFreshnessSeconds = 300;

  /**
   * Port the sidecar is told to serve its workload on.
   */
  @Min(1)
  private int sidecarServicePort = 4096;

  @Min(1)
  private int rotationConcurrency = 5;

  @Min(1)
  private long rotationTimeoutSeconds = 30;

  /**
   * Interval between scans for due scheduled rotations.
   */
  @Min(1)
  private long rotationPollSeconds = 60;

  /**
   * Interval between sweeps that drop refilled rate limit buckets.
   */
  @Min(1)
  private long rateLimitEvictionSeconds = 300;

  /**
   * Per-operation overrides of the default rate limits.
   */
  @Valid
  @NotNull
  private Map<RateLimitedOperation, RateLimitSettings> rateLimits = new EnumMap<>(RateLimitedOperation.class);

  /**
   * Capacity and refill window of one rate limit bucket.
   */
  public static class RateLimitSettings {

    @Min(1)
    private int capacity;

    @Min(1)
    private long windowSeconds;

    @JsonProperty
    public int getCapacity() {
      return capacity;
    }

    @JsonProperty
    public void setCapacity(int capacity) {
      this.capacity = capacity;
    }

    @JsonProperty
    public long getWindowSeconds() {
      return windowSeconds;
    }

    @JsonProperty
    public void setWindowSeconds(long windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    /**
     * Converts to the limiter's policy.
     *
     * @return the policy
     */
    public RateLimitPolicy toPolicy() {
      return new RateLimitPolicy(capacity, Duration.ofSeconds(windowSeconds));
    }
  }

  @JsonProperty
  public String getMasterKeyId() {
    return masterKeyId;
  }

  @JsonProperty
  public void setMasterKeyId(String masterKeyId) {
    this.masterKeyId = masterKeyId;
  }

  @JsonProperty
  public String getMasterKeyHex() {
    return masterKeyHex;
  }

  @JsonProperty
  public void setMasterKeyHex(String masterKeyHex) {
    this.masterKeyHex = masterKeyHex;
  }

  @JsonProperty
  public String getMasterKeyEnvironmentVariable() {
    return masterKeyEnvironmentVariable;
  }

  @JsonProperty
  public void setMasterKeyEnvironmentVariable(String masterKeyEnvironmentVariable) {
    this.masterKeyEnvironmentVariable = masterKeyEnvironmentVariable;
  }

  @JsonProperty
  public Map<String, String> getRetiredMasterKeys() {
    return retiredMasterKeys;
  }

  @JsonProperty
  public void setRetiredMasterKeys(Map<String, String> retiredMasterKeys) {
    this.retiredMasterKeys = retiredMasterKeys;
  }

  @JsonProperty
  public int getCurrentKeyVersion() {
    return currentKeyVersion;
  }

  @JsonProperty
  public void setCurrentKeyVersion(int currentKeyVersion) {
    this.currentKeyVersion = currentKeyVersion;
  }

  @JsonProperty
  public int getMinimumSupportedKeyVersion() {
    return minimumSupportedKeyVersion;
  }

  @JsonProperty
  public void setMinimumSupportedKeyVersion(int minimumSupportedKeyVersion) {
    this.minimumSupportedKeyVersion = minimumSupportedKeyVersion;
  }

  @JsonProperty
  public String getSidecarTokenSecretHex() {
    return sidecarTokenSecretHex;
  }

  @JsonProperty
  public void setSidecarTokenSecretHex(String sidecarTokenSecretHex) {
    this.sidecarTokenSecretHex = sidecarTokenSecretHex;
  }

  @JsonProperty
  public String getSidecarTokenIssuer() {
    return sidecarTokenIssuer;
  }

  @JsonProperty
  public void setSidecarTokenIssuer(String sidecarTokenIssuer) {
    this.sidecarTokenIssuer = sidecarTokenIssuer;
  }

  @JsonProperty
  public long getSidecarTokenTtlSeconds() {
    return sidecarTokenTtlSeconds;
  }

  @JsonProperty
  public void setSidecarTokenTtlSeconds(long sidecarTokenTtlSeconds) {
    this.sidecarTokenTtlSeconds = sidecarTokenTtlSeconds;
  }

  @JsonProperty
  public long getPayloadFreshnessSeconds() {
    return payloadFreshnessSeconds;
  }

  @JsonProperty
  public void setPayloadFreshnessSeconds(long payloadFreshnessSeconds) {
    this.payloadFreshnessSeconds = payloadFreshnessSeconds;
  }

  @JsonProperty
  public int getSidecarServicePort() {
    return sidecarServicePort;
  }

  @JsonProperty
  public void setSidecarServicePort(int sidecarServicePort) {
    this.sidecarServicePort = sidecarServicePort;
  }

  @JsonProperty
  public int getRotationConcurrency() {
    return rotationConcurrency;
  }

  @JsonProperty
  public void setRotationConcurrency(int rotationConcurrency) {
    this.rotationConcurrency = rotationConcurrency;
  }

  @JsonProperty
  public long getRotationTimeoutSeconds() {
    return rotationTimeoutSeconds;
  }

  @JsonProperty
  public void setRotationTimeoutSeconds(long rotationTimeoutSeconds) {
    this.rotationTimeoutSeconds = rotationTimeoutSeconds;
  }

  @JsonProperty
  public long getRotationPollSeconds() {
    return rotationPollSeconds;
  }

  @JsonProperty
  public void setRotationPollSeconds(long rotationPollSeconds) {
    this.rotationPollSeconds = rotationPollSeconds;
  }

  @JsonProperty
  public long getRateLimitEvictionSeconds() {
    return rateLimitEvictionSeconds;
  }

  @JsonProperty
  public void setRateLimitEvictionSeconds(long rateLimitEvictionSeconds) {
    this.rateLimitEvictionSeconds = rateLimitEvictionSeconds;
  }

  @JsonProperty
  public Map<RateLimitedOperation, RateLimitSettings> getRateLimits() {
    return rateLimits;
  }

  @JsonProperty
  public void setRateLimits(Map<RateLimitedOperation, RateLimitSettings> rateLimits) {
    this.rateLimits = rateLimits;
  }

  /**
   * The configured overrides as limiter policies.
   *
   * @return operation to policy, only for operations present in {@code rateLimits}
   */
  public Map<RateLimitedOperation, RateLimitPolicy> rateLimitPolicies() {
    Map<RateLimitedOperation, RateLimitPolicy> policies = new EnumMap<>(RateLimitedOperation.class);
    rateLimits.forEach((operation, settings) -> policies.put(operation, settings.toPolicy()));
    return policies;
  }
}
