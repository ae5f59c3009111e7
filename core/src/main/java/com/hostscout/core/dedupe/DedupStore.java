package com.hostscout.core.dedupe;

import com.hostscout.core.model.CanonicalEntity;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * key → CanonicalEntity 집합.
 * - 같은 key 는 하나만 존재(upsert, 마지막 writer 의 uri 가 남음)
 * - 모든 연산은 단건 원자적(ConcurrentHashMap)
 * - merge 는 새 스토어를 만들며 key 기준 합집합이므로 교환/결합 법칙이 성립한다
 */
public final class DedupStore {

    private final ConcurrentHashMap<String, CanonicalEntity> byKey = new ConcurrentHashMap<>();

    public DedupStore() {}

    public static DedupStore of(Collection<CanonicalEntity> entities) {
        DedupStore s = new DedupStore();
        if (entities != null) entities.forEach(s::insert);
        return s;
    }

    /** @return 이 스토어에서 처음 보는 key 면 true */
    public boolean insert(CanonicalEntity entity) {
        Objects.requireNonNull(entity, "entity");
        return byKey.put(entity.key(), entity) == null;
    }

    public boolean contains(String key) {
        return key != null && byKey.containsKey(key);
    }

    public Optional<CanonicalEntity> get(String key) {
        return Optional.ofNullable(key == null ? null : byKey.get(key));
    }

    public int size() { return byKey.size(); }

    public boolean isEmpty() { return byKey.isEmpty(); }

    public Set<String> keys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(byKey.keySet()));
    }

    /** key 오름차순 정렬된 스냅샷 */
    public List<CanonicalEntity> entities() {
        return byKey.values().stream()
                .sorted(Comparator.comparing(CanonicalEntity::key))
                .collect(Collectors.toList());
    }

    public Set<CanonicalEntity> entitySet() {
        return new LinkedHashSet<>(entities());
    }

    public void reset() { byKey.clear(); }

    /** this ∪ other. 같은 key 는 other 쪽 uri 가 남는다. 두 입력은 변경하지 않음 */
    public DedupStore merge(DedupStore other) {
        DedupStore out = new DedupStore();
        out.byKey.putAll(this.byKey);
        if (other != null) out.byKey.putAll(other.byKey);
        return out;
    }

    public static DedupStore mergeAll(Collection<DedupStore> stores) {
        DedupStore acc = new DedupStore();
        if (stores == null) return acc;
        for (DedupStore s : stores) acc = acc.merge(s);
        return acc;
    }

    @Override public String toString() {
        return "DedupStore" + keys();
    }
}
