package com.codeheadsystems.provision.server.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a sidecar session.
 * <pre>
 *   creating -> active            (registration only)
 *   creating -> stopped | error
 *   active   -> idle | stopped | error
 *   idle     -> active | stopped | error
 *   stopped, error: terminal
 * </pre>
 */
public enum SessionStatus {
  CREATING,
  ACTIVE,
  IDLE,
  STOPPED,
  ERROR;

  public boolean isTerminal() {
    return this == STOPPED || this == ERROR;
  }

  public boolean canTransitionTo(SessionStatus target) {
    return allowedTargets().contains(target);
  }

  private Set<SessionStatus> allowedTargets() {
    switch (this) {
      case CREATING:
        return EnumSet.of(ACTIVE, STOPPED, ERROR);
      case ACTIVE:
        return EnumSet.of(IDLE, STOPPED, ERROR);
      case IDLE:
        return EnumSet.of(ACTIVE, STOPPED, ERROR);
      default:
        return EnumSet.noneOf(SessionStatus.class);
    }
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses the lower-case wire name.
   *
   * @param value the wire name
   * @return the status
   * @throws IllegalArgumentException if unknown
   */
  public static SessionStatus fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Missing status");
    }
    return SessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
