package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.RotationAuditEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * In-memory {@link AuditStore}. Appends are serialized so insertion order breaks timestamp
 * ties consistently.
 */
public class InMemoryAuditStore implements AuditStore {

  private final List<RotationAuditEntry> entries = new ArrayList<>();

  @Override
  public synchronized void append(RotationAuditEntry entry) {
    entries.add(entry);
  }

  @Override
  public List<RotationAuditEntry> findByUser(String userId, int limit) {
    return newestFirst(e -> e.userId().equals(userId), limit);
  }

  @Override
  public List<RotationAuditEntry> findByUserAndProvider(String userId, String provider, int limit) {
    return newestFirst(e -> e.userId().equals(userId) && e.provider().equals(provider), limit);
  }

  private synchronized List<RotationAuditEntry> newestFirst(Predicate<RotationAuditEntry> filter, int limit) {
    List<RotationAuditEntry> result = new ArrayList<>();
    for (int i = entries.size() - 1; i >= 0 && result.size() < limit; i--) {
      RotationAuditEntry entry = entries.get(i);
      if (filter.test(entry)) {
        result.add(entry);
      }
    }
    result.sort((a, b) -> b.timestamp().compareTo(a.timestamp()));
    return Collections.unmodifiableList(result);
  }
}
