package com.codeheadsystems.provision.server.manager;

import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Provider name normalization: trimmed, lower-cased, 1 to 50 characters of
 * {@code [a-z0-9_.-]} starting with a letter or digit.
 */
public final class ProviderNames {

  public static final int MAX_LENGTH = 50;

  private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9_.-]*$");

  private ProviderNames() {
  }

  /**
   * Normalizes a provider name.
   *
   * @param provider the raw name
   * @return the normalized name
   * @throws ProvisioningException with {@link ErrorCode#INVALID_PROVIDER} if invalid
   */
  public static String normalize(String provider) {
    if (provider == null || provider.isBlank()) {
      throw new ProvisioningException(ErrorCode.INVALID_PROVIDER, "Provider name is required");
    }
    String trimmed = provider.trim();
    if (trimmed.length() > MAX_LENGTH) {
      throw new ProvisioningException(ErrorCode.INVALID_PROVIDER,
          "Provider name must be at most " + MAX_LENGTH + " characters");
    }
    if (!VALID.matcher(trimmed).matches()) {
      throw new ProvisioningException(ErrorCode.INVALID_PROVIDER,
          "Provider name may contain only letters, digits, '_', '.' and '-'");
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }
}
