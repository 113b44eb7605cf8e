package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.RotationAuditEntry;
import java.util.List;

/**
 * Append-only rotation audit log. Entries are never modified or removed.
 */
public interface AuditStore {

  void append(RotationAuditEntry entry);

  /**
   * Entries of one user, newest first.
   *
   * @param userId the owner
   * @param limit  maximum number of entries
   * @return the entries
   */
  List<RotationAuditEntry> findByUser(String userId, int limit);

  /**
   * Entries of one user and provider, newest first.
   *
   * @param userId   the owner
   * @param provider the provider
   * @param limit    maximum number of entries
   * @return the entries
   */
  List<RotationAuditEntry> findByUserAndProvider(String userId, String provider, int limit);
}
