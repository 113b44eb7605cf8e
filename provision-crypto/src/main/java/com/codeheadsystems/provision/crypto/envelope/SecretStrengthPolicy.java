package com.codeheadsystems.provision.crypto.envelope;

import com.codeheadsystems.provision.crypto.exception.InvalidSecretException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects empty, short, and well-known placeholder credentials before they are encrypted.
 */
public class SecretStrengthPolicy {

  public static final int DEFAULT_MINIMUM_LENGTH = 8;

  private static final List<Pattern> PLACEHOLDERS = List.of(
      Pattern.compile("^test-?key", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^dummy-?key", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^api-?key$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^secret-?key$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^password$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^123456$"),
      Pattern.compile("^qwerty$", Pattern.CASE_INSENSITIVE));

  private final int minimumLength;

  public SecretStrengthPolicy() {
    this(DEFAULT_MINIMUM_LENGTH);
  }

  public SecretStrengthPolicy(int minimumLength) {
    this.minimumLength = minimumLength;
  }

  /**
   * Checks the secret.
   *
   * @param secret the plaintext credential
   * @throws InvalidSecretException if it is blank, too short or a placeholder
   */
  public void check(String secret) {
    if (secret == null || secret.isBlank()) {
      throw new InvalidSecretException("Secret must not be empty");
    }
    if (secret.length() < minimumLength) {
      throw new InvalidSecretException("Secret must be at least " + minimumLength + " characters");
    }
    for (Pattern placeholder : PLACEHOLDERS) {
      if (placeholder.matcher(secret).find()) {
        throw new InvalidSecretException("Secret looks like a placeholder value");
      }
    }
  }
}
