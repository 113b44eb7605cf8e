package com.codeheadsystems.provision.server.model;

import java.time.Instant;

/**
 * A rotation requested for a future instant. At most one {@link ScheduleStatus#PENDING}
 * entry exists per (userId, provider).
 */
public record ScheduledRotation(String id,
                                String userId,
                                String provider,
                                Instant scheduledFor,
                                Integer targetVersion,
                                ScheduleStatus status,
                                Instant createdAt,
                                Instant completedAt,
                                String error) {

  public ScheduledRotation completed(Instant now) {
    return new ScheduledRotation(id, userId, provider, scheduledFor, targetVersion, ScheduleStatus.COMPLETED,
        createdAt, now, null);
  }

  public ScheduledRotation failed(Instant now, String reason) {
    return new ScheduledRotation(id, userId, provider, scheduledFor, targetVersion, ScheduleStatus.FAILED,
        createdAt, now, reason);
  }
}
