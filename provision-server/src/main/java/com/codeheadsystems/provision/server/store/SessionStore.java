package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.Session;
import java.util.Optional;

/**
 * Storage abstraction for sidecar sessions.
 * <p>
 * Implementations must be thread-safe, and {@link #replace(Session, long)} must be
 * linearizable per session id: of two writers that read the same version, exactly one wins.
 */
public interface SessionStore {

  /**
   * Inserts a new session.
   *
   * @param session the session, at version 0
   * @return false if a session with the same id already exists
   */
  boolean insert(Session session);

  /**
   * Loads a session by id.
   *
   * @param sessionId the session id
   * @return the session, or empty if not found
   */
  Optional<Session> load(String sessionId);

  /**
   * Conditional write. Stores {@code updated} with version {@code expectedVersion + 1} if
   * and only if the stored version still equals {@code expectedVersion}.
   *
   * @param updated         the new state
   * @param expectedVersion the version the caller read
   * @return the stored session, or empty if the session is missing or the version moved on
   */
  Optional<Session> replace(Session updated, long expectedVersion);
}
