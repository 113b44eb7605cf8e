package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.ScheduledRotation;
import java.time.Instant;
import java.util.List;

/**
 * Storage for scheduled rotations.
 */
public interface RotationScheduleStore {

  /**
   * Result of {@link #upsertPending(ScheduledRotation)}.
   *
   * @param schedule the stored pending schedule
   * @param created  true if new, false if an existing pending schedule was updated
   */
  record Upsert(ScheduledRotation schedule, boolean created) {
  }

  /**
   * Creates a pending schedule, or moves the existing pending schedule for the same
   * (userId, provider) to the new time and target while keeping its id.
   *
   * @param schedule the requested schedule, status pending
   * @return the stored schedule and whether it was created
   */
  Upsert upsertPending(ScheduledRotation schedule);

  /**
   * Pending schedules due at or before the instant, oldest first.
   *
   * @param before the cutoff
   * @param limit  maximum number returned
   * @return the due schedules
   */
  List<ScheduledRotation> findDue(Instant before, int limit);

  /**
   * Overwrites a schedule, typically to mark it completed or failed.
   *
   * @param schedule the schedule
   */
  void update(ScheduledRotation schedule);

  List<ScheduledRotation> findByUser(String userId);
}
