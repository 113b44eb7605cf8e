package com.codeheadsystems.provision.crypto.envelope;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The primary master key, used for every new wrap, and any retired keys still needed to
 * unwrap records written before the primary changed. Immutable after construction.
 */
public final class MasterKeyRing {

  private final MasterKey primary;
  private final Map<String, MasterKey> byId;

  public MasterKeyRing(MasterKey primary) {
    this(primary, List.of());
  }

  public MasterKeyRing(MasterKey primary, Collection<MasterKey> retired) {
    this.primary = primary;
    Map<String, MasterKey> keys = new LinkedHashMap<>();
    keys.put(primary.keyId(), primary);
    for (MasterKey key : retired) {
      if (keys.putIfAbsent(key.keyId(), key) != null) {
        throw new IllegalArgumentException("Duplicate master key id: " + key.keyId());
      }
    }
    this.byId = Map.copyOf(keys);
  }

  public MasterKey primary() {
    return primary;
  }

  public Optional<MasterKey> find(String keyId) {
    return keyId == null ? Optional.empty() : Optional.ofNullable(byId.get(keyId));
  }

  public int size() {
    return byId.size();
  }
}
