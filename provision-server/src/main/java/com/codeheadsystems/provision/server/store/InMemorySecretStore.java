package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.ProviderSecret;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SecretStore}. Credentials are lost on restart, and with a
 * random master key they could not be decrypted afterwards anyway.
 */
public class InMemorySecretStore implements SecretStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySecretStore.class);

  private final ConcurrentHashMap<Key, ProviderSecret> store = new ConcurrentHashMap<>();

  @Override
  public Optional<ProviderSecret> load(String userId, String provider) {
    return Optional.ofNullable(store.get(new Key(userId, provider)));
  }

  @Override
  public List<ProviderSecret> listForUser(String userId) {
    return store.values().stream()
        .filter(s -> s.userId().equals(userId))
        .sorted(Comparator.comparing(ProviderSecret::provider))
        .collect(Collectors.toList());
  }

  @Override
  public boolean insert(ProviderSecret secret) {
    boolean inserted = store.putIfAbsent(new Key(secret.userId(), secret.provider()), secret) == null;
    log.debug("insert(provider={}) -> {}", secret.provider(), inserted);
    return inserted;
  }

  @Override
  public boolean replace(ProviderSecret expected, ProviderSecret updated) {
    boolean replaced = store.replace(new Key(expected.userId(), expected.provider()), expected, updated);
    log.debug("replace(provider={}, version={} -> {}) -> {}",
        expected.provider(), expected.keyVersion(), updated.keyVersion(), replaced);
    return replaced;
  }

  @Override
  public boolean delete(String userId, String provider) {
    return store.remove(new Key(userId, provider)) != null;
  }

  private record Key(String userId, String provider) {
  }
}
