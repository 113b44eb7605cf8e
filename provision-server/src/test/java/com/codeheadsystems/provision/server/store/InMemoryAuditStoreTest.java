package com.codeheadsystems.provision.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.provision.server.model.RotationAuditEntry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryAuditStoreTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private static RotationAuditEntry entry(String id, String userId, String provider, int minutes) {
    return new RotationAuditEntry(id, userId, provider, 1, 2, T0.plusSeconds(60L * minutes), true, null);
  }

  @Test
  void findByUser_newestFirstWithLimit() {
    InMemoryAuditStore store = new InMemoryAuditStore();
    store.append(entry("a", "u1", "openai", 0));
    store.append(entry("b", "u1", "anthropic", 1));
    store.append(entry("c", "u2", "openai", 2));
    store.append(entry("d", "u1", "openai", 3));

    assertThat(store.findByUser("u1", 10)).extracting(RotationAuditEntry::id).containsExactly("d", "b", "a");
    assertThat(store.findByUser("u1", 2)).extracting(RotationAuditEntry::id).containsExactly("d", "b");
  }

  @Test
  void findByUserAndProvider_filtersBoth() {
    InMemoryAuditStore store = new InMemoryAuditStore();
    store.append(entry("a", "u1", "openai", 0));
    store.append(entry("b", "u1", "anthropic", 1));
    store.append(entry("c", "u2", "openai", 2));

    assertThat(store.findByUserAndProvider("u1", "openai", 10))
        .extracting(RotationAuditEntry::id)
        .containsExactly("a");
  }
}
