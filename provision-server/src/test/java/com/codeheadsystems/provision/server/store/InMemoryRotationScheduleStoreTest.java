package com.codeheadsystems.provision.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.provision.server.model.ScheduleStatus;
import com.codeheadsystems.provision.server.model.ScheduledRotation;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryRotationScheduleStoreTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private static ScheduledRotation pending(String id, String provider, Instant when) {
    return new ScheduledRotation(id, "u1", provider, when, null, ScheduleStatus.PENDING, T0, null, null);
  }

  @Test
  void upsertPending_movesExistingPendingScheduleAndKeepsItsId() {
    InMemoryRotationScheduleStore store = new InMemoryRotationScheduleStore();

    RotationScheduleStore.Upsert first = store.upsertPending(pending("id-1", "openai", T0.plusSeconds(60)));
    RotationScheduleStore.Upsert second = store.upsertPending(pending("id-2", "openai", T0.plusSeconds(120)));

    assertThat(first.created()).isTrue();
    assertThat(second.created()).isFalse();
    assertThat(second.schedule().id()).isEqualTo("id-1");
    assertThat(second.schedule().scheduledFor()).isEqualTo(T0.plusSeconds(120));
    assertThat(store.findByUser("u1")).hasSize(1);
  }

  @Test
  void upsertPending_afterCompletion_createsNewSchedule() {
    InMemoryRotationScheduleStore store = new InMemoryRotationScheduleStore();
    ScheduledRotation first = store.upsertPending(pending("id-1", "openai", T0)).schedule();
    store.update(first.completed(T0.plusSeconds(1)));

    RotationScheduleStore.Upsert again = store.upsertPending(pending("id-2", "openai", T0.plusSeconds(60)));

    assertThat(again.created()).isTrue();
    assertThat(store.findByUser("u1")).hasSize(2);
  }

  @Test
  void findDue_onlyPendingAtOrBeforeCutoffOldestFirst() {
    InMemoryRotationScheduleStore store = new InMemoryRotationScheduleStore();
    store.upsertPending(pending("late", "a", T0.plusSeconds(600)));
    store.upsertPending(pending("second", "b", T0.plusSeconds(30)));
    store.upsertPending(pending("first", "c", T0));
    ScheduledRotation done = store.upsertPending(pending("done", "d", T0)).schedule();
    store.update(done.failed(T0, "boom"));

    assertThat(store.findDue(T0.plusSeconds(30), 10))
        .extracting(ScheduledRotation::id)
        .containsExactly("first", "second");
    assertThat(store.findDue(T0.plusSeconds(30), 1)).hasSize(1);
  }
}
