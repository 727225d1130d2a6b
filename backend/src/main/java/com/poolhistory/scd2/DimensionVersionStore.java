package com.poolhistory.scd2;

import com.poolhistory.model.PoolDimensionVersion;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable view over every version of every pool, grouped by pool id and ordered by validFrom.
 * <p>
 * {@link PoolDimensionVersion} is a mutable document class, so rows are copied on the way in and
 * every public accessor hands out copies. Mutating a returned row never changes the store.
 */
public final class DimensionVersionStore {

    private static final DimensionVersionStore EMPTY = new DimensionVersionStore(new TreeMap<>());

    private final Map<String, List<PoolDimensionVersion>> byPool;
    private final int size;

    private DimensionVersionStore(TreeMap<String, List<PoolDimensionVersion>> byPool) {
        this.byPool = Collections.unmodifiableMap(byPool);
        this.size = byPool.values().stream().mapToInt(List::size).sum();
    }

    public static DimensionVersionStore empty() {
        return EMPTY;
    }

    public static DimensionVersionStore of(Collection<PoolDimensionVersion> rows) {
        TreeMap<String, List<PoolDimensionVersion>> grouped = new TreeMap<>();
        for (PoolDimensionVersion row : rows) {
            if (row.getPoolId() == null) {
                throw new SchemaMismatchException("dimension row without poolId: " + row);
            }
            if (row.getValidFrom() == null || row.getValidTo() == null) {
                throw new SchemaMismatchException("dimension row without validity dates for pool " + row.getPoolId());
            }
            grouped.computeIfAbsent(row.getPoolId(), k -> new ArrayList<>()).add(copy(row));
        }
        grouped.replaceAll((k, list) -> {
            list.sort(Comparator.comparing(PoolDimensionVersion::getValidFrom));
            return Collections.unmodifiableList(list);
        });
        return new DimensionVersionStore(grouped);
    }

    /** All rows, ordered by (poolId, validFrom). */
    public List<PoolDimensionVersion> rows() {
        List<PoolDimensionVersion> out = new ArrayList<>(size);
        byPool.values().forEach(list -> list.forEach(v -> out.add(copy(v))));
        return out;
    }

    public Set<String> poolIds() {
        return byPool.keySet();
    }

    public List<PoolDimensionVersion> versionsOf(String poolId) {
        return sharedVersions(poolId).stream().map(DimensionVersionStore::copy).toList();
    }

    public Optional<PoolDimensionVersion> current(String poolId) {
        return sharedVersions(poolId).stream().filter(PoolDimensionVersion::isCurrent).findFirst()
                .map(DimensionVersionStore::copy);
    }

    /** Version whose [validFrom, validTo) contains the date. */
    public Optional<PoolDimensionVersion> asOf(String poolId, LocalDate date) {
        for (PoolDimensionVersion v : sharedVersions(poolId)) {
            if (v.covers(date)) return Optional.of(copy(v));
        }
        return Optional.empty();
    }

    /** The stored rows themselves, for the read-only hot paths of this package. Never mutate. */
    List<PoolDimensionVersion> sharedVersions(String poolId) {
        return byPool.getOrDefault(poolId, List.of());
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private static PoolDimensionVersion copy(PoolDimensionVersion v) {
        return v.toBuilder()
                .underlyingTokens(v.getUnderlyingTokens() == null ? null : List.copyOf(v.getUnderlyingTokens()))
                .rewardTokens(v.getRewardTokens() == null ? null : List.copyOf(v.getRewardTokens()))
                .build();
    }

    public long currentCount() {
        return byPool.values().stream().flatMap(List::stream).filter(PoolDimensionVersion::isCurrent).count();
    }

    /**
     * Checks per pool: validFrom < validTo, intervals contiguous and non-overlapping,
     * isCurrent iff validTo is the open end, exactly one current row.
     *
     * @return this, for chaining
     */
    public DimensionVersionStore validate() {
        byPool.forEach((poolId, versions) -> {
            int current = 0;
            PoolDimensionVersion prev = null;
            for (PoolDimensionVersion v : versions) {
                if (!v.getValidFrom().isBefore(v.getValidTo())) {
                    throw new VersioningInvariantViolationException(poolId,
                            "empty interval [" + v.getValidFrom() + ", " + v.getValidTo() + ")");
                }
                boolean open = PoolDimensionVersion.OPEN_END.equals(v.getValidTo());
                if (open != v.isCurrent()) {
                    throw new VersioningInvariantViolationException(poolId,
                            "isCurrent=" + v.isCurrent() + " but validTo=" + v.getValidTo());
                }
                if (v.isCurrent()) current++;
                if (prev != null) {
                    if (prev.getValidTo().isAfter(v.getValidFrom())) {
                        throw new VersioningInvariantViolationException(poolId,
                                "overlapping versions starting " + prev.getValidFrom() + " and " + v.getValidFrom());
                    }
                    if (prev.getValidTo().isBefore(v.getValidFrom())) {
                        throw new VersioningInvariantViolationException(poolId,
                                "gap between " + prev.getValidTo() + " and " + v.getValidFrom());
                    }
                }
                prev = v;
            }
            if (current != 1) {
                throw new VersioningInvariantViolationException(poolId, current + " current versions");
            }
        });
        return this;
    }
}
