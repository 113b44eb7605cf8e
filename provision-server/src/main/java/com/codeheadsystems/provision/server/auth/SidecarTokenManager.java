package com.codeheadsystems.provision.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the bearer token a sidecar presents on refresh calls.
 * <p>
 * Tokens are HMAC-SHA256 JWTs. The subject is the session id, the {@code sidecarKeyId}
 * claim binds the token to the registered sidecar key, and the JWT id is a random nonce.
 * Age is checked against the injected clock in addition to the {@code exp} claim.
 */
public class SidecarTokenManager {

  public static final Duration DEFAULT_TTL = Duration.ofHours(24);
  static final String SIDECAR_KEY_ID_CLAIM = "sidecarKeyId";

  private static final Logger log = LoggerFactory.getLogger(SidecarTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Duration ttl;
  private final Clock clock;

  /**
   * Creates a new SidecarTokenManager.
   *
   * @param secret HMAC-SHA256 signing secret, at least 32 bytes
   * @param issuer JWT issuer claim
   * @param ttl    token lifetime
   * @param clock  time source for issuing and age checks
   */
  public SidecarTokenManager(byte[] secret, String issuer, Duration ttl, Clock clock) {
    if (secret == null || secret.length < 32) {
      throw new IllegalArgumentException("Sidecar token secret must be at least 32 bytes");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer)).build(clock);
    this.issuer = issuer;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Claims carried by a valid token.
   *
   * @param sessionId    the session the sidecar registered against
   * @param sidecarKeyId the sidecar's key id at registration
   * @param issuedAt     when the token was minted
   * @param nonce        the random JWT id
   */
  public record SidecarClaims(String sessionId, String sidecarKeyId, Instant issuedAt, String nonce) {
  }

  /**
   * Mints a token for a freshly registered sidecar.
   *
   * @param sessionId    the session id
   * @param sidecarKeyId the sidecar key id
   * @return signed JWT string
   */
  public String issue(String sessionId, String sidecarKeyId) {
    String nonce = UUID.randomUUID().toString();
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(nonce)
        .withSubject(sessionId)
        .withClaim(SIDECAR_KEY_ID_CLAIM, sidecarKeyId)
        .withIssuedAt(now)
        .withExpiresAt(now.plus(ttl))
        .sign(algorithm);
    log.debug("Issued sidecar token jti={} for session={}", nonce, sessionId);
    return token;
  }

  /**
   * Verifies signature, issuer, expiry and age.
   *
   * @param token JWT string
   * @return the claims if valid, empty otherwise
   */
  public Optional<SidecarClaims> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      Instant issuedAt = decoded.getIssuedAtAsInstant();
      String sidecarKeyId = decoded.getClaim(SIDECAR_KEY_ID_CLAIM).asString();
      if (issuedAt == null || sidecarKeyId == null || decoded.getSubject() == null) {
        log.debug("Sidecar token jti={} is missing claims", decoded.getId());
        return Optional.empty();
      }
      Duration age = Duration.between(issuedAt, clock.instant());
      if (age.compareTo(ttl) >= 0) {
        log.debug("Sidecar token jti={} is too old ({})", decoded.getId(), age);
        return Optional.empty();
      }
      return Optional.of(new SidecarClaims(decoded.getSubject(), sidecarKeyId, issuedAt, decoded.getId()));
    } catch (JWTVerificationException e) {
      log.debug("Sidecar token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public Duration ttl() {
    return ttl;
  }
}
