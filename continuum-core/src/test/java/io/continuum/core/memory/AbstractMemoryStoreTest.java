package io.continuum.core.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import io.continuum.core.codec.PayloadCodec;
import io.continuum.core.error.NotFoundException;
import io.continuum.core.error.ValidationException;
import io.continuum.core.time.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link MemoryStore} backend must share.
 */
abstract class AbstractMemoryStoreTest {

    protected final MutableClock clock = MutableClock.at("2026-03-01T09:00:00Z");
    protected MemoryStore store;

    protected abstract MemoryStore newStore(MutableClock clock) throws IOException;

    @BeforeEach
    void setUpStore() throws IOException {
        store = newStore(clock);
    }

    @Test
    void shouldClampImportanceIntoUnitRange() throws Exception {
        String high = store.storeLongTermMemory("u1", "s1", "high", "v", LongTermMemoryType.FACT, 1.7, null);
        String low = store.storeLongTermMemory("u1", "s1", "low", "v", LongTermMemoryType.FACT, -0.3, null);

        assertThat(store.findLongTermMemory(high)).hasValueSatisfying(m -> assertThat(m.importance()).isEqualTo(1.0));
        assertThat(store.findLongTermMemory(low)).hasValueSatisfying(m -> assertThat(m.importance()).isEqualTo(0.0));
    }

    @Test
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> store.storeLongTermMemory(" ", "s1", "k", "v", LongTermMemoryType.FACT, 0.5, null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.storeLongTermMemory("u1", "s1", "k", "v", LongTermMemoryType.FACT, Double.NaN, null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.storeShortTermMemory("", "k", "v", ShortTermMemoryType.CONTEXT, 1.0))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectNonPositiveShortTermTtl() {
        assertThatThrownBy(() -> store.storeShortTermMemory("s1", "k", "v", ShortTermMemoryType.CONTEXT, 0.0))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.storeShortTermMemory("s1", "k", "v", ShortTermMemoryType.CONTEXT, -2.0))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectTtlPastRepresentableExpiry() throws Exception {
        assertThatThrownBy(() -> store.storeShortTermMemory("s1", "k", "v", ShortTermMemoryType.CONTEXT, 1e15))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.storeLongTermMemory(
            "u1", "s1", "k", "v", LongTermMemoryType.FACT, 0.5, Duration.ofSeconds(Long.MAX_VALUE)))
            .isInstanceOf(ValidationException.class);

        assertThat(store.retrieveShortTermMemories("s1", 10)).isEmpty();
        assertThat(store.retrieveLongTermMemories("u1", 10)).isEmpty();
    }

    @Test
    void shouldExpireShortTermMemoryAndPurgeIt() throws Exception {
        store.storeShortTermMemory("s1", "blink", "gone soon", ShortTermMemoryType.EVENT, 0.0001);
        store.storeShortTermMemory("s1", "stay", "still here", ShortTermMemoryType.CONTEXT, 24.0);

        assertThat(store.retrieveShortTermMemories("s1", 10)).extracting(ShortTermMemory::key)
            .containsExactlyInAnyOrder("blink", "stay");

        clock.advance(Duration.ofSeconds(1));

        assertThat(store.retrieveShortTermMemories("s1", 10)).extracting(ShortTermMemory::key).containsExactly("stay");
        assertThat(store.purgeExpiredShortTermMemories()).isEqualTo(1);
        assertThat(store.purgeExpiredShortTermMemories()).isZero();
        assertThat(store.retrieveShortTermMemories("s1", 10)).extracting(ShortTermMemory::key).containsExactly("stay");
    }

    @Test
    void shouldNotPurgeMemoryStillWithinTtl() throws Exception {
        store.storeShortTermMemory("s1", "edge", "v", ShortTermMemoryType.STATE, 1.0);
        clock.advance(Duration.ofHours(1));

        assertThat(store.purgeExpiredShortTermMemories()).isZero();
        assertThat(store.retrieveShortTermMemories("s1", 10)).hasSize(1);
    }

    @Test
    void shouldNeverExpireLongTermMemoryWithoutTtl() throws Exception {
        String id = store.storeLongTermMemory("u1", "s1", "home", "Lisbon", LongTermMemoryType.FACT, 0.5, null);
        clock.advance(Duration.ofDays(3650));

        assertThat(store.findLongTermMemory(id)).isPresent();
        assertThat(store.retrieveLongTermMemories("u1", 5)).extracting(LongTermMemory::memoryId).containsExactly(id);
    }

    @Test
    void shouldHideExpiredLongTermMemoryButKeepItThroughPurge() throws Exception {
        String id = store.storeLongTermMemory("u1", "s1", "promo", "code", LongTermMemoryType.OTHER, 0.9, Duration.ofHours(1));
        clock.advance(Duration.ofHours(2));

        assertThat(store.retrieveLongTermMemories("u1", 5)).isEmpty();
        assertThat(store.findLongTermMemory(id)).isEmpty();

        store.purgeExpiredShortTermMemories();
        // still on disk: importance can be updated even though retrieval hides it
        assertThat(store.updateImportance(id, 0.1).importance()).isEqualTo(0.1);
    }

    @Test
    void shouldReturnTopKByImportanceAndCountAccess() throws Exception {
        double[] importances = {0.9, 0.9, 0.5, 0.5, 0.5, 0.2, 0.1, 0.0};
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < importances.length; i++) {
            ids.add(store.storeLongTermMemory("u1", "s1", "m" + i, "v" + i, LongTermMemoryType.FACT, importances[i], null));
            clock.advance(Duration.ofSeconds(1));
        }
        // touch m0 so it is the less recently accessed of the two 0.9 entries
        clock.advance(Duration.ofMinutes(1));
        store.queryLongTermMemories(new LongTermMemoryQuery("u1", "m1", null, 0.0, 1));
        clock.advance(Duration.ofMinutes(1));

        List<LongTermMemory> top = store.retrieveLongTermMemories("u1", 5);

        assertThat(top).hasSize(5);
        assertThat(top.get(0).key()).isEqualTo("m1");
        assertThat(top.get(1).key()).isEqualTo("m0");
        assertThat(top.subList(2, 5)).extracting(LongTermMemory::importance).containsOnly(0.5);
        assertThat(top).allSatisfy(memory -> assertThat(memory.accessedAt()).isEqualTo(clock.instant()));
        assertThat(top.get(0).accessCount()).isEqualTo(2);
        assertThat(top.get(1).accessCount()).isEqualTo(1);

        for (String untouched : ids.subList(5, 8)) {
            assertThat(store.findLongTermMemory(untouched))
                .hasValueSatisfying(memory -> assertThat(memory.accessCount()).isZero());
        }
        assertThat(store.findLongTermMemory(ids.get(2)))
            .hasValueSatisfying(memory -> assertThat(memory.accessCount()).isEqualTo(1));
    }

    @Test
    void shouldNotCountPreviewAsUse() throws Exception {
        String id = store.storeLongTermMemory("u1", "s1", "k", "v", LongTermMemoryType.SKILL, 0.4, null);

        store.findLongTermMemory(id);
        store.findLongTermMemory(id);

        assertThat(store.findLongTermMemory(id)).hasValueSatisfying(memory -> {
            assertThat(memory.accessCount()).isZero();
            assertThat(memory.memoryType()).isEqualTo(LongTermMemoryType.SKILL);
        });
    }

    @Test
    void shouldScopeLongTermMemoriesToUser() throws Exception {
        store.storeLongTermMemory("u1", "s1", "mine", "v", LongTermMemoryType.FACT, 0.5, null);
        store.storeLongTermMemory("u2", "s2", "theirs", "v", LongTermMemoryType.FACT, 0.9, null);

        assertThat(store.retrieveLongTermMemories("u1", 5)).extracting(LongTermMemory::key).containsExactly("mine");
    }

    @Test
    void shouldFilterLongTermQuery() throws Exception {
        store.storeLongTermMemory("u1", "s1", "diet", "vegetarian", LongTermMemoryType.PREFERENCE, 0.8, null);
        store.storeLongTermMemory("u1", "s1", "diet", "no nuts", LongTermMemoryType.FACT, 0.6, null);
        store.storeLongTermMemory("u1", "s1", "city", "Porto", LongTermMemoryType.FACT, 0.3, null);

        assertThat(store.queryLongTermMemories(new LongTermMemoryQuery("u1", "diet", null, 0.0, 10)))
            .extracting(LongTermMemory::value).containsExactly("vegetarian", "no nuts");
        assertThat(store.queryLongTermMemories(new LongTermMemoryQuery("u1", null, LongTermMemoryType.FACT, 0.5, 10)))
            .extracting(LongTermMemory::value).containsExactly("no nuts");
        assertThatThrownBy(() -> store.retrieveLongTermMemories("u1", 0)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldReturnShortTermMemoriesNewestFirst() throws Exception {
        store.storeShortTermMemory("s1", "first", "1", ShortTermMemoryType.CONTEXT, 1.0);
        clock.advance(Duration.ofSeconds(1));
        store.storeShortTermMemory("s1", "second", "2", ShortTermMemoryType.CONTEXT, 1.0);
        clock.advance(Duration.ofSeconds(1));
        store.storeShortTermMemory("s1", "third", "3", ShortTermMemoryType.CONTEXT, 1.0);
        store.storeShortTermMemory("s2", "other", "x", ShortTermMemoryType.CONTEXT, 1.0);

        assertThat(store.retrieveShortTermMemories("s1", 2)).extracting(ShortTermMemory::key)
            .containsExactly("third", "second");
    }

    @Test
    void shouldTagMetadataWithSchemaVersion() throws Exception {
        String id = store.storeLongTermMemory("u1", "s1", "k", "{\"a\":1}", LongTermMemoryType.FACT, 0.5, null,
            Map.of("source", "chat"));

        assertThat(store.findLongTermMemory(id)).hasValueSatisfying(memory -> {
            assertThat(memory.metadata()).containsEntry("source", "chat");
            assertThat(memory.metadata()).containsEntry(PayloadCodec.SCHEMA_VERSION_KEY, PayloadCodec.CURRENT_SCHEMA_VERSION);
            assertThat(memory.value()).isEqualTo("{\"a\":1}");
        });
    }

    @Test
    void shouldUpdateImportanceWithClamping() throws Exception {
        String id = store.storeLongTermMemory("u1", "s1", "k", "v", LongTermMemoryType.FACT, 0.5, null);
        clock.advance(Duration.ofMinutes(3));

        LongTermMemory updated = store.updateImportance(id, 3.0);

        assertThat(updated.importance()).isEqualTo(1.0);
        assertThat(updated.updatedAt()).isEqualTo(clock.instant());
        assertThat(store.findLongTermMemory(id))
            .hasValueSatisfying(memory -> assertThat(memory.importance()).isEqualTo(1.0));
        assertThatThrownBy(() -> store.updateImportance("missing", 0.5)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldAssociateIdempotently() throws Exception {
        String m1 = store.storeLongTermMemory("u1", "s1", "a", "v", LongTermMemoryType.FACT, 0.5, null);
        String m2 = store.storeLongTermMemory("u1", "s1", "b", "v", LongTermMemoryType.FACT, 0.5, null);

        store.associateMemories(m1, m2, "related", 0.6);
        store.associateMemories(m1, m2, "related", 0.6);
        store.associateMemories(m2, m1, "related", 0.6);

        List<MemoryAssociation> links = store.listAssociations(m1);
        assertThat(links).hasSize(1);
        assertThat(links.get(0).strength()).isCloseTo(0.6, within(1e-9));
        assertThat(links.get(0).touches(m2)).isTrue();
    }

    @Test
    void shouldUpdateStrengthOnRepeatedAssociation() throws Exception {
        String m1 = store.storeLongTermMemory("u1", "s1", "a", "v", LongTermMemoryType.FACT, 0.5, null);
        String m2 = store.storeShortTermMemory("s1", "b", "v", ShortTermMemoryType.CONTEXT, 1.0);

        store.associateMemories(m1, m2, "related", 0.6);
        Instant firstLinked = clock.instant();
        clock.advance(Duration.ofHours(1));
        store.associateMemories(m2, m1, "related", 0.9);
        store.associateMemories(m1, m2, "caused_by", 0.2);

        assertThat(store.listAssociations(m2))
            .extracting(MemoryAssociation::associationType, MemoryAssociation::strength, MemoryAssociation::createdAt)
            .containsExactly(
                tuple("related", 0.9, firstLinked.plus(Duration.ofHours(1))),
                tuple("caused_by", 0.2, firstLinked.plus(Duration.ofHours(1))));
    }

    @Test
    void shouldValidateAssociations() throws Exception {
        String m1 = store.storeLongTermMemory("u1", "s1", "a", "v", LongTermMemoryType.FACT, 0.5, null);

        assertThatThrownBy(() -> store.associateMemories(m1, m1, "related", 0.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.associateMemories(m1, "ghost", "related", 0.5)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.associateMemories(m1, "ghost", "related", 1.5)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldResolveAssociatedMemoriesAndSkipDanglingOnes() throws Exception {
        String anchor = store.storeLongTermMemory("u1", "s1", "anchor", "v", LongTermMemoryType.FACT, 0.5, null);
        String strong = store.storeLongTermMemory("u1", "s1", "strong", "v", LongTermMemoryType.FACT, 0.5, null);
        String recent = store.storeShortTermMemory("s1", "recent", "v", ShortTermMemoryType.EVENT, 24.0);
        String fleeting = store.storeShortTermMemory("s1", "fleeting", "v", ShortTermMemoryType.EVENT, 0.0001);
        store.associateMemories(anchor, strong, "related", 0.9);
        store.associateMemories(anchor, recent, "related", 0.4);
        store.associateMemories(fleeting, anchor, "related", 0.7);

        clock.advance(Duration.ofSeconds(1));
        store.purgeExpiredShortTermMemories();

        List<AssociatedMemory> related = store.getAssociatedMemories(anchor, "related", 0.0);
        assertThat(related).extracting(associated -> associated.memory().key()).containsExactly("strong", "recent");
        assertThat(related.get(1).memory()).isInstanceOf(ShortTermMemory.class);
        assertThat(store.getAssociatedMemories(anchor, null, 0.5)).extracting(a -> a.memory().key()).containsExactly("strong");
        assertThat(store.getAssociatedMemories(anchor, "caused_by", 0.0)).isEmpty();
        assertThat(store.listAssociations(anchor)).hasSize(3);
    }

    @Test
    void shouldExpireOnlySessionScopedMemories() throws Exception {
        store.storeSessionScopedMemory("s1", "scratch", "v", ShortTermMemoryType.STATE, Map.of());
        store.storeShortTermMemory("s1", "timed", "v", ShortTermMemoryType.EVENT, 24.0);
        store.storeSessionScopedMemory("s2", "other", "v", ShortTermMemoryType.STATE, Map.of());

        assertThat(store.retrieveShortTermMemories("s1", 10)).hasSize(2);
        assertThat(store.purgeExpiredShortTermMemories()).isZero();

        assertThat(store.expireSessionScopedMemories("s1")).isEqualTo(1);
        assertThat(store.retrieveShortTermMemories("s1", 10)).extracting(ShortTermMemory::key).containsExactly("timed");
        assertThat(store.retrieveShortTermMemories("s2", 10)).hasSize(1);
    }
}
