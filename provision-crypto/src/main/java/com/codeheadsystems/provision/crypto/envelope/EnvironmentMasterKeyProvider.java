package com.codeheadsystems.provision.crypto.envelope;

import java.util.Base64;
import java.util.HexFormat;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the master key from an environment variable holding either 64 hex characters or
 * the base64 encoding of 32 bytes. The key id is {@code env:<VARIABLE>}.
 */
public class EnvironmentMasterKeyProvider implements MasterKeyProvider {

  public static final String DEFAULT_VARIABLE = "PROVISION_MASTER_KEY";

  private static final Logger log = LoggerFactory.getLogger(EnvironmentMasterKeyProvider.class);

  private final String variable;
  private final Function<String, String> environment;

  public EnvironmentMasterKeyProvider() {
    this(DEFAULT_VARIABLE, System::getenv);
  }

  /**
   * Creates a provider over an arbitrary lookup function.
   *
   * @param variable    the variable name
   * @param environment lookup from variable name to value, returning null when unset
   */
  public EnvironmentMasterKeyProvider(String variable, Function<String, String> environment) {
    this.variable = variable;
    this.environment = environment;
  }

  @Override
  public MasterKey load() {
    String value = environment.apply(variable);
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("Environment variable " + variable + " is not set");
    }
    String trimmed = value.trim();
    byte[] material;
    try {
      material = isHex(trimmed) ? HexFormat.of().parseHex(trimmed) : Base64.getDecoder().decode(trimmed);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Environment variable " + variable + " is neither hex nor base64", e);
    }
    if (material.length != 32) {
      throw new IllegalStateException("Environment variable " + variable + " must hold a 32-byte key, found "
          + material.length + " bytes");
    }
    log.info("Loaded master key from environment variable {}", variable);
    return new MasterKey("env:" + variable, material);
  }

  private static boolean isHex(String value) {
    return value.length() == 64 && value.chars().allMatch(c -> Character.digit(c, 16) >= 0);
  }
}
