package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.Session;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * Conditional writes run inside {@link ConcurrentHashMap#computeIfPresent}, which is atomic
 * per key. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Session> store = new ConcurrentHashMap<>();

  @Override
  public boolean insert(Session session) {
    boolean inserted = store.putIfAbsent(session.id(), session) == null;
    log.debug("insert(sessionId={}) -> {}", session.id(), inserted);
    return inserted;
  }

  @Override
  public Optional<Session> load(String sessionId) {
    return sessionId == null ? Optional.empty() : Optional.ofNullable(store.get(sessionId));
  }

  @Override
  public Optional<Session> replace(Session updated, long expectedVersion) {
    AtomicReference<Session> written = new AtomicReference<>();
    store.computeIfPresent(updated.id(), (id, current) -> {
      if (current.version() != expectedVersion) {
        return current;
      }
      Session next = updated.withVersion(expectedVersion + 1);
      written.set(next);
      return next;
    });
    if (written.get() == null) {
      log.debug("replace(sessionId={}, expectedVersion={}) lost", updated.id(), expectedVersion);
    }
    return Optional.ofNullable(written.get());
  }
}
