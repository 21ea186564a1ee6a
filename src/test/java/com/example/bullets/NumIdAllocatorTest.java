package com.example.bullets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NumIdAllocator")
class NumIdAllocatorTest {

  private final NumIdAllocator allocator = new NumIdAllocator(BulletEngineConfig.defaults());

  @Test
  @DisplayName("Should start at the base and pair the abstract id with the numId")
  void shouldAllocateFromBase_whenDocumentIsNew() {
    NumberingId id = allocator.allocate("doc-1", "experience", null);

    assertThat(id.numId).isEqualTo(100);
    assertThat(id.abstractNumId).isEqualTo(100);
  }

  @Test
  @DisplayName("Should reuse the numId bound to a style")
  void shouldReuseId_whenStyleAlreadyMapped() {
    NumberingId first = allocator.allocate("doc-1", "styles", "MR_BulletPoint");
    NumberingId second = allocator.allocate("doc-1", "experience", "MR_BulletPoint");

    assertThat(second).isEqualTo(first);
    assertThat(allocator.recordsFor("doc-1")).hasSize(1);
  }

  @Test
  @DisplayName("Should hand out unique ids outside reserved ranges")
  void shouldAllocateUniqueIds_whenCalledRepeatedly() {
    Set<Integer> ids = new HashSet<>();
    for (int i = 0; i < 200; i++) {
      ids.add(allocator.allocate("doc-1", "section-" + i, null).numId);
    }

    assertThat(ids).hasSize(200);
    assertThat(ids).noneMatch(BulletEngineConfig.defaults()::isReserved);
  }

  @Test
  @DisplayName("Should move past ids already present in the document")
  void shouldSkipExistingIds_whenReserved() {
    NumIdAllocator lowBase = new NumIdAllocator(new BulletEngineConfig.Builder().numIdBase(1).build());
    lowBase.reserveExisting("doc-1", List.of(1, 5, 10), List.of(1));

    assertThat(lowBase.allocate("doc-1", "experience", null).numId).isEqualTo(11);
  }

  @Test
  @DisplayName("Should not collide with an abstract id already in the document")
  void shouldPickNextAbstractId_whenPreferredTaken() {
    allocator.reserveExisting("doc-1", List.of(), List.of(100));

    NumberingId id = allocator.allocate("doc-1", "experience", null);

    assertThat(id.numId).isEqualTo(100);
    assertThat(id.abstractNumId).isEqualTo(101);
  }

  @Test
  @DisplayName("Should jump over the legacy reserved range")
  void shouldSkipLegacyRange_whenBaseInsideIt() {
    NumIdAllocator legacy = new NumIdAllocator(new BulletEngineConfig.Builder().numIdBase(999).build());

    assertThat(legacy.allocate("doc-1", "experience", null).numId).isEqualTo(1011);
  }

  @Test
  @DisplayName("Should offset the base by the partition salt")
  void shouldOffsetBase_whenSaltEnabled() {
    BulletEngineConfig salted =
        new BulletEngineConfig.Builder().saltEnabled(true).partitionKey(11).build();

    assertThat(salted.effectiveBase()).isEqualTo(100 + 3 * 500);
    assertThat(new NumIdAllocator(salted).allocate("doc-1", "experience", null).numId)
        .isEqualTo(1600);
  }

  @Test
  @DisplayName("Should fail once the window is used up")
  void shouldThrow_whenNoIdLeftBelowCeiling() {
    NumIdAllocator tiny =
        new NumIdAllocator(new BulletEngineConfig.Builder().numIdBase(100).numIdCeiling(101).build());
    tiny.allocate("doc-1", "a", null);
    tiny.allocate("doc-1", "b", null);

    assertThatThrownBy(() -> tiny.allocate("doc-1", "c", null))
        .isInstanceOf(AllocationExhaustedException.class)
        .hasMessageContaining("doc-1");
  }

  @Test
  @DisplayName("Should release every record and forget style mappings")
  void shouldReleaseRecords_andClearStyleMapping() {
    allocator.allocate("doc-1", "styles", "MR_BulletPoint");
    allocator.allocate("doc-1", "experience", null);

    assertThat(allocator.release("doc-1")).isEqualTo(2);
    assertThat(allocator.recordsFor("doc-1"))
        .extracting(BulletAllocationRecord::getStatus)
        .containsOnly(BulletAllocationRecord.Status.RELEASED);

    allocator.allocate("doc-1", "styles", "MR_BulletPoint");
    assertThat(allocator.recordsFor("doc-1")).hasSize(3);
    assertThat(allocator.release("unknown")).isZero();
  }

  @Test
  @DisplayName("Should report cross-document reuse as informational")
  void shouldReportCrossDocument_whenTwoDocumentsShareId() {
    allocator.allocate("doc-1", "experience", null);
    allocator.allocate("doc-2", "experience", null);

    List<AllocationCollision> found = allocator.detectCollisions();

    assertThat(found).hasSize(1);
    assertThat(found.get(0).kind).isEqualTo(AllocationCollision.Kind.CROSS_DOCUMENT);
    assertThat(found.get(0).documentIds).containsExactlyInAnyOrder("doc-1", "doc-2");
    assertThat(allocator.resolve(found.get(0))).isTrue();
    assertThat(allocator.summary())
        .containsEntry("collisionsDetected", 1L)
        .containsEntry("collisionsResolved", 1L);
  }

  @Test
  @DisplayName("Should validate ids against reserved ranges and live allocations")
  void shouldValidateIds() {
    allocator.allocate("doc-1", "experience", null);

    assertThat(allocator.isValid(5, "doc-1")).isFalse();
    assertThat(allocator.isValid(100, "doc-1")).isFalse();
    assertThat(allocator.isValid(200, "doc-1")).isTrue();
    assertThat(allocator.isValid(100, "doc-2")).isTrue();
  }

  @Test
  @DisplayName("Should drop released records once past retention")
  void shouldCleanupReleasedRecords_whenRetentionPassed() {
    MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    NumIdAllocator timed = new NumIdAllocator(BulletEngineConfig.defaults(), clock);
    timed.allocate("doc-1", "experience", null);
    timed.allocate("doc-2", "experience", null);
    timed.release("doc-1");

    clock.advance(Duration.ofHours(25));

    assertThat(timed.cleanupExpired()).isEqualTo(1);
    assertThat(timed.recordsFor("doc-1")).isEmpty();
    assertThat(timed.recordsFor("doc-2")).hasSize(1);
  }

  @Test
  @DisplayName("Should stay unique under concurrent allocation")
  void shouldAllocateUniqueIds_whenCalledConcurrently() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<List<Integer>>> tasks = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        int worker = t;
        tasks.add(() -> {
          List<Integer> ids = new ArrayList<>();
          for (int i = 0; i < 50; i++) {
            ids.add(allocator.allocate("shared", "w" + worker + "-" + i, null).numId);
          }
          return ids;
        });
      }
      Set<Integer> all = new HashSet<>();
      for (Future<List<Integer>> f : pool.invokeAll(tasks)) {
        all.addAll(f.get());
      }

      assertThat(all).hasSize(400);
      assertThat(allocator.detectCollisions()).isEmpty();
    } finally {
      pool.shutdown();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  /** Clock that tests can move forward. */
  static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
