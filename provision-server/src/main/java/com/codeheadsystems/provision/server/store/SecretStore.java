package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.ProviderSecret;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for encrypted provider credentials, keyed by (userId, provider).
 * <p>
 * Implementations must be thread-safe and must persist the eight fields of
 * {@link com.codeheadsystems.provision.crypto.envelope.StoredSecret} verbatim.
 */
public interface SecretStore {

  Optional<ProviderSecret> load(String userId, String provider);

  /**
   * Lists every credential of a user, ordered by provider name.
   *
   * @param userId the owner
   * @return the credentials, possibly empty
   */
  List<ProviderSecret> listForUser(String userId);

  /**
   * Inserts a credential if none exists for its (userId, provider).
   *
   * @param secret the credential
   * @return true if inserted
   */
  boolean insert(ProviderSecret secret);

  /**
   * Conditional write: replaces the credential only if the stored record still equals
   * {@code expected}.
   *
   * @param expected the record the caller read
   * @param updated  the new record
   * @return true if replaced
   */
  boolean replace(ProviderSecret expected, ProviderSecret updated);

  /**
   * Deletes a credential.
   *
   * @param userId   the owner
   * @param provider the provider
   * @return true if something was deleted
   */
  boolean delete(String userId, String provider);
}
