package com.hostscout.core.dedupe;

import com.hostscout.core.model.CanonicalEntity;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DedupStoreTest {

    private static CanonicalEntity e(String key) {
        return new CanonicalEntity(key, URI.create("https://" + key + ".myshopify.com"));
    }

    @Test
    void insert_reports_first_sighting_only() {
        DedupStore s = new DedupStore();
        assertThat(s.insert(e("a"))).isTrue();
        assertThat(s.insert(e("a"))).isFalse();
        assertThat(s.size()).isEqualTo(1);
        assertThat(s.contains("a")).isTrue();
        assertThat(s.contains(null)).isFalse();
    }

    @Test
    void merge_is_commutative_union() {
        DedupStore ab = DedupStore.of(List.of(e("a"), e("b")));
        DedupStore bc = DedupStore.of(List.of(e("b"), e("c")));

        assertThat(ab.merge(bc).keys()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(bc.merge(ab).keys()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(ab.size()).isEqualTo(2);
        assertThat(bc.size()).isEqualTo(2);
    }

    @Test
    void merge_keeps_right_hand_uri_for_same_key() {
        DedupStore left = DedupStore.of(List.of(new CanonicalEntity("a", URI.create("https://old"))));
        DedupStore right = DedupStore.of(List.of(new CanonicalEntity("a", URI.create("https://new"))));
        assertThat(left.merge(right).get("a").orElseThrow().uri()).isEqualTo(URI.create("https://new"));
    }

    @Test
    void merge_all_and_sorted_snapshot() {
        DedupStore all = DedupStore.mergeAll(List.of(
                DedupStore.of(Set.of(e("zeta"))), DedupStore.of(Set.of(e("alpha"), e("mid")))));
        assertThat(all.entities()).extracting(CanonicalEntity::key).containsExactly("alpha", "mid", "zeta");
        assertThat(DedupStore.mergeAll(null).isEmpty()).isTrue();
    }

    @Test
    void concurrent_inserts_count_each_key_once() throws Exception {
        DedupStore s = new DedupStore();
        AtomicInteger fresh = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    if (s.insert(e("k" + i))) fresh.incrementAndGet();
                }
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(s.size()).isEqualTo(500);
        assertThat(fresh.get()).isEqualTo(500);
    }
}
