package io.mixforge.track;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryEntityStoreTest {

  private final InMemoryEntityStore store = new InMemoryEntityStore();

  @Test
  void createAssignsSequentialIds() {
    TrackRecord a = store.create("alice", "a.wav", "/data/uploads/a.wav");
    TrackRecord b = store.create("bob", "b.wav", "/data/uploads/b.wav");

    assertEquals(1, a.id());
    assertEquals(2, b.id());
    assertEquals(TrackStatus.UPLOADED, a.status());
    assertEquals(1, a.versionCount());
    assertFalse(a.hasExtendedVersions());
    assertEquals(b, store.get(2).orElseThrow());
  }

  @Test
  void completedUpdatesAppendVersions() {
    TrackRecord t = store.create("alice", "a.wav", "/data/uploads/a.wav");

    store.updateStatus(t.id(), TrackUpdate.completed("/data/results/a_extended_v1.wav", 200.0));
    TrackRecord updated =
        store.updateStatus(t.id(), TrackUpdate.completed("/data/results/a_extended_v2.wav", null))
            .orElseThrow();

    assertEquals(TrackStatus.COMPLETED, updated.status());
    assertEquals(
        List.of("/data/results/a_extended_v1.wav", "/data/results/a_extended_v2.wav"),
        updated.extendedPaths());
    assertEquals(Arrays.asList(200.0, null), updated.extendedDurations());
    assertEquals(3, updated.versionCount());
  }

  @Test
  void statusUpdatesKeepVersionsAndSettings() {
    TrackRecord t = store.create("alice", "a.wav", "/data/uploads/a.wav");
    ProcessingSettings settings = new ProcessingSettings(32, 8, false, BeatDetection.LIBROSA);

    store.updateStatus(t.id(), TrackUpdate.started(TrackStatus.PROCESSING, settings));
    TrackRecord errored =
        store.updateStatus(t.id(), TrackUpdate.status(TrackStatus.ERROR)).orElseThrow();

    assertEquals(TrackStatus.ERROR, errored.status());
    assertEquals(settings, errored.settings());
    assertEquals(1, errored.versionCount());
  }

  @Test
  void unknownTrackIsEmpty() {
    assertTrue(store.get(42).isEmpty());
    assertTrue(store.updateStatus(42, TrackUpdate.status(TrackStatus.ERROR)).isEmpty());
  }
}
