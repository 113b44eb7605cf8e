package com.codeheadsystems.provision.server.manager;

import static com.codeheadsystems.provision.server.manager.Preconditions.requireField;

import com.codeheadsystems.provision.crypto.common.ByteUtils;
import com.codeheadsystems.provision.crypto.common.RandomProvider;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import com.codeheadsystems.provision.server.model.Session;
import com.codeheadsystems.provision.server.model.SessionStatus;
import com.codeheadsystems.provision.server.store.SessionStore;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates sessions and applies lifecycle transitions other than registration.
 * {@code creating -> active} is reserved for {@link RegistrationManager}.
 */
@Singleton
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
  private static final int TOKEN_BYTES = 32;
  private static final int MAX_WRITE_ATTEMPTS = 3;

  private final SessionStore sessionStore;
  private final RandomProvider randomProvider;
  private final Clock clock;

  @Inject
  public SessionManager(SessionStore sessionStore, RandomProvider randomProvider, Clock clock) {
    this.sessionStore = sessionStore;
    this.randomProvider = randomProvider;
    this.clock = clock;
  }

  /**
   * Creates a session in {@code creating} with a fresh one-time registration token.
   *
   * @param userId the owner
   * @return the session, including its registration token
   */
  public Session create(String userId) {
    requireField(userId, "userId");
    String token = ByteUtils.toBase64Url(randomProvider.randomBytes(TOKEN_BYTES));
    Session session = Session.create(UUID.randomUUID().toString(), userId, token, clock.instant());
    if (!sessionStore.insert(session)) {
      throw new ProvisioningException(ErrorCode.INTERNAL, "Session id collision");
    }
    log.info("Created session {} for user {}", session.id(), userId);
    return session;
  }

  /**
   * @throws ProvisioningException NOT_FOUND
   */
  public Session get(String sessionId) {
    return sessionStore.load(sessionId)
        .orElseThrow(() -> new ProvisioningException(ErrorCode.NOT_FOUND, "Session not found"));
  }

  /**
   * Moves a session to a new status. Requesting the current status is a no-op.
   *
   * @param sessionId the session
   * @param target    the new status
   * @return the updated session
   * @throws ProvisioningException NOT_FOUND, INVALID_TRANSITION or CONCURRENT_MODIFICATION
   */
  public Session transition(String sessionId, SessionStatus target) {
    log.debug("transition(sessionId={}, target={})", sessionId, target);
    for (int attempt = 0; attempt < MAX_WRITE_ATTEMPTS; attempt++) {
      Session current = get(sessionId);
      if (current.status() == target) {
        return current;
      }
      if (!current.status().canTransitionTo(target)
          || (current.status() == SessionStatus.CREATING && target == SessionStatus.ACTIVE)) {
        throw new ProvisioningException(ErrorCode.INVALID_TRANSITION,
            "Cannot move session from " + current.status().wireName() + " to " + target.wireName());
      }
      Optional<Session> written = sessionStore.replace(current.withStatus(target, clock.instant()), current.version());
      if (written.isPresent()) {
        log.info("Session {} {} -> {}", sessionId, current.status(), target);
        return written.get();
      }
    }
    throw new ProvisioningException(ErrorCode.CONCURRENT_MODIFICATION, "Session was modified concurrently");
  }
}
