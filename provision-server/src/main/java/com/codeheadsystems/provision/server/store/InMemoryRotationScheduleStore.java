package com.codeheadsystems.provision.server.store;

import com.codeheadsystems.provision.server.model.ScheduleStatus;
import com.codeheadsystems.provision.server.model.ScheduledRotation;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory {@link RotationScheduleStore}. All methods are synchronized so the at-most-one
 * pending invariant holds under concurrent upserts.
 */
public class InMemoryRotationScheduleStore implements RotationScheduleStore {

  private final Map<String, ScheduledRotation> byId = new LinkedHashMap<>();

  @Override
  public synchronized Upsert upsertPending(ScheduledRotation schedule) {
    for (ScheduledRotation existing : byId.values()) {
      if (existing.status() == ScheduleStatus.PENDING
          && existing.userId().equals(schedule.userId())
          && existing.provider().equals(schedule.provider())) {
        ScheduledRotation moved = new ScheduledRotation(existing.id(), existing.userId(), existing.provider(),
            schedule.scheduledFor(), schedule.targetVersion(), ScheduleStatus.PENDING, existing.createdAt(),
            null, null);
        byId.put(moved.id(), moved);
        return new Upsert(moved, false);
      }
    }
    byId.put(schedule.id(), schedule);
    return new Upsert(schedule, true);
  }

  @Override
  public synchronized List<ScheduledRotation> findDue(Instant before, int limit) {
    return byId.values().stream()
        .filter(s -> s.status() == ScheduleStatus.PENDING && !s.scheduledFor().isAfter(before))
        .sorted(Comparator.comparing(ScheduledRotation::scheduledFor))
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized void update(ScheduledRotation schedule) {
    byId.put(schedule.id(), schedule);
  }

  @Override
  public synchronized List<ScheduledRotation> findByUser(String userId) {
    return byId.values().stream()
        .filter(s -> s.userId().equals(userId))
        .collect(Collectors.toList());
  }
}
