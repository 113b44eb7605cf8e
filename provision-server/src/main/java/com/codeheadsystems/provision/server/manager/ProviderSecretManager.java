package com.codeheadsystems.provision.server.manager;

import static com.codeheadsystems.provision.server.manager.Preconditions.requireField;

import com.codeheadsystems.provision.crypto.envelope.EnvelopeEngine;
import com.codeheadsystems.provision.crypto.envelope.StoredSecret;
import com.codeheadsystems.provision.crypto.exception.IntegrityException;
import com.codeheadsystems.provision.crypto.exception.ProvisionCryptoException;
import com.codeheadsystems.provision.server.exception.CryptoErrors;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.model.DecryptedCredentials;
import com.codeheadsystems.provision.server.model.ProviderSecret;
import com.codeheadsystems.provision.server.security.SecurityEventLogger;
import com.codeheadsystems.provision.server.store.SecretStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores, lists and deletes a user's provider credentials, encrypted with the
 * {@link EnvelopeEngine}. Plaintext credentials only leave this class through
 * {@link #decryptForUser(String, Collection)}.
 */
@Singleton
public class ProviderSecretManager {

  public static final int MIN_KEY_LENGTH = 8;
  public static final int MAX_KEY_LENGTH = 1000;

  private static final Logger log = LoggerFactory.getLogger(ProviderSecretManager.class);
  private static final int MAX_WRITE_ATTEMPTS = 3;

  private final SecretStore secretStore;
  private final EnvelopeEngine envelopeEngine;
  private final SecurityEventLogger securityEvents;
  private final Clock clock;

  @Inject
  public ProviderSecretManager(SecretStore secretStore,
                               EnvelopeEngine envelopeEngine,
                               SecurityEventLogger securityEvents,
                               Clock clock) {
    this.secretStore = secretStore;
    this.envelopeEngine = envelopeEngine;
    this.securityEvents = securityEvents;
    this.clock = clock;
  }

  /**
   * Result of {@link #store(String, String, String)}.
   *
   * @param provider   normalized provider name
   * @param created    true if no credential existed before
   * @param keyVersion version of the stored record
   */
  public record StoreResult(String provider, boolean created, int keyVersion) {
  }

  /**
   * Encrypts and stores a credential, replacing any existing one for the provider.
   *
   * @param userId   the owner
   * @param provider the provider name, normalized before use
   * @param key      the plaintext credential, trimmed before use
   * @return what was stored
   * @throws ProvisioningException INVALID_PROVIDER, INVALID_SECRET, INVALID_REQUEST or
   *                               CONCURRENT_MODIFICATION
   */
  public StoreResult store(String userId, String provider, String key) {
    log.debug("store(userId={}, provider={})", userId, provider);
    requireField(userId, "userId");
    String normalized = ProviderNames.normalize(provider);
    String trimmed = key == null ? "" : key.trim();
    if (trimmed.length() < MIN_KEY_LENGTH || trimmed.length() > MAX_KEY_LENGTH) {
      throw new ProvisioningException(ErrorCode.INVALID_SECRET,
          "Credential must be between " + MIN_KEY_LENGTH + " and " + MAX_KEY_LENGTH + " characters");
    }
    StoredSecret encrypted;
    try {
      encrypted = envelopeEngine.encrypt(trimmed);
    } catch (ProvisionCryptoException e) {
      throw CryptoErrors.translate(e);
    }
    for (int attempt = 0; attempt < MAX_WRITE_ATTEMPTS; attempt++) {
      Instant now = clock.instant();
      Optional<ProviderSecret> existing = secretStore.load(userId, normalized);
      if (existing.isEmpty()) {
        if (secretStore.insert(new ProviderSecret(userId, normalized, encrypted, now, now))) {
          securityEvents.credentialStored(userId, normalized, true);
          return new StoreResult(normalized, true, encrypted.keyVersion());
        }
      } else if (secretStore.replace(existing.get(), existing.get().withSecret(encrypted, now))) {
        securityEvents.credentialStored(userId, normalized, false);
        return new StoreResult(normalized, false, encrypted.keyVersion());
      }
    }
    throw new ProvisioningException(ErrorCode.CONCURRENT_MODIFICATION,
        "Credential for " + normalized + " was modified concurrently");
  }

  /**
   * Deletes a credential.
   *
   * @throws ProvisioningException NOT_FOUND if there is none
   */
  public void delete(String userId, String provider) {
    log.debug("delete(userId={}, provider={})", userId, provider);
    requireField(userId, "userId");
    String normalized = ProviderNames.normalize(provider);
    if (!secretStore.delete(userId, normalized)) {
      throw new ProvisioningException(ErrorCode.NOT_FOUND, "No credential stored for " + normalized);
    }
    securityEvents.credentialDeleted(userId, normalized);
  }

  /**
   * Lists the stored credentials of a user, without decrypting them.
   */
  public List<ProviderSecret> list(String userId) {
    requireField(userId, "userId");
    return secretStore.listForUser(userId);
  }

  /**
   * Decrypts a user's credentials. Records that fail to decrypt are skipped and counted;
   * integrity failures are reported as security events.
   *
   * @param userId    the owner
   * @param providers optional filter; null or empty means all
   * @return the plaintext credentials by provider
   */
  public DecryptedCredentials decryptForUser(String userId, Collection<String> providers) {
    Set<String> filter = providers == null || providers.isEmpty()
        ? Set.of()
        : providers.stream().map(ProviderNames::normalize).collect(Collectors.toSet());
    List<ProviderSecret> records = secretStore.listForUser(userId).stream()
        .filter(r -> filter.isEmpty() || filter.contains(r.provider()))
        .collect(Collectors.toList());
    Map<String, String> secrets = new TreeMap<>();
    int failed = 0;
    for (ProviderSecret record : records) {
      try {
        secrets.put(record.provider(), envelopeEngine.decrypt(record.secret()));
      } catch (IntegrityException e) {
        failed++;
        securityEvents.integrityFailure(userId, record.provider(), "decrypt");
      } catch (ProvisionCryptoException e) {
        failed++;
        securityEvents.decryptFailure(userId, record.provider(), CryptoErrors.codeFor(e));
      }
    }
    return new DecryptedCredentials(secrets, records.size(), failed);
  }
}
