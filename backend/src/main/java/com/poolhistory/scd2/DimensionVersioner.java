package com.poolhistory.scd2;

import com.poolhistory.model.PoolDimensionVersion;
import com.poolhistory.model.PoolSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Produces the next generation of the SCD2 pool dimension from a full catalog snapshot.
 * <ul>
 *   <li>new pool: opens its first version at the snapshot date;</li>
 *   <li>fingerprint changed: closes the current version at the snapshot date and opens a new one;</li>
 *   <li>fingerprint unchanged, or pool absent from the snapshot: untouched.</li>
 * </ul>
 * If the current version was itself opened on the snapshot date it is rewritten in place
 * (same-day re-snapshot), so no zero-length interval is ever produced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DimensionVersioner {

    private final AttributeHasher hasher;

    public DimensionVersionStore advance(DimensionVersionStore currentStore,
                                         List<PoolSnapshot> snapshot,
                                         LocalDate snapshotDate) {
        Objects.requireNonNull(snapshotDate, "snapshotDate required");
        DimensionVersionStore base = currentStore != null ? currentStore : DimensionVersionStore.empty();

        Map<String, PoolSnapshot> incoming = index(snapshot);
        Map<String, String> hashes = new LinkedHashMap<>(incoming.size());
        incoming.forEach((id, p) -> hashes.put(id, hasher.fingerprint(p)));

        List<PoolDimensionVersion> out = new ArrayList<>(base.size() + incoming.size());
        int changed = 0, rewritten = 0, unchanged = 0, created = 0;

        for (String poolId : base.poolIds()) {
            PoolSnapshot snap = incoming.get(poolId);
            for (PoolDimensionVersion row : base.sharedVersions(poolId)) {
                if (snap == null || !row.isCurrent()) {
                    out.add(row);
                    continue;
                }
                String hash = hashes.get(poolId);
                if (hash.equals(row.getAttribHash())) {
                    out.add(row);
                    unchanged++;
                } else if (snapshotDate.equals(row.getValidFrom())) {
                    // same-day re-snapshot: no version bump, keep the row identity
                    out.add(open(snap, hash, snapshotDate).toBuilder().id(row.getId()).build());
                    rewritten++;
                    log.debug("[scd2-versioner] rewrote same-day version pool={} date={}", poolId, snapshotDate);
                } else if (snapshotDate.isBefore(row.getValidFrom())) {
                    throw new VersioningInvariantViolationException(poolId,
                            "snapshot " + snapshotDate + " is older than current version " + row.getValidFrom());
                } else {
                    out.add(row.toBuilder().validTo(snapshotDate).current(false).build());
                    out.add(open(snap, hash, snapshotDate));
                    changed++;
                    log.debug("[scd2-versioner] pool={} changed {} -> {} at {}", poolId, row.getAttribHash(), hash, snapshotDate);
                }
            }
        }

        for (Map.Entry<String, PoolSnapshot> e : incoming.entrySet()) {
            if (base.sharedVersions(e.getKey()).isEmpty()) {
                out.add(open(e.getValue(), hashes.get(e.getKey()), snapshotDate));
                created++;
            }
        }

        DimensionVersionStore next = DimensionVersionStore.of(out).validate();
        log.info("[scd2-versioner] snapshot {}: {} pools in, {} new, {} changed, {} rewritten, {} unchanged; store {} -> {} rows",
                snapshotDate, incoming.size(), created, changed, rewritten, unchanged, base.size(), next.size());
        return next;
    }

    private PoolDimensionVersion open(PoolSnapshot p, String hash, LocalDate snapshotDate) {
        return PoolDimensionVersion.builder()
                .poolId(p.getPoolId())
                .protocolSlug(p.getProtocolSlug())
                .chain(p.getChain())
                .symbol(p.getSymbol())
                .underlyingTokens(p.getUnderlyingTokens())
                .rewardTokens(p.getRewardTokens())
                .timestamp(p.getTimestamp())
                .tvlUsd(p.getTvlUsd())
                .apy(p.getApy())
                .apyBase(p.getApyBase())
                .apyReward(p.getApyReward())
                .poolOld(p.getPoolOld())
                .validFrom(snapshotDate)
                .validTo(PoolDimensionVersion.OPEN_END)
                .current(true)
                .attribHash(hash)
                .active(true)
                .build();
    }

    private static Map<String, PoolSnapshot> index(List<PoolSnapshot> snapshot) {
        Map<String, PoolSnapshot> byId = new LinkedHashMap<>();
        if (snapshot == null) return byId;
        for (PoolSnapshot p : snapshot) {
            if (p.getPoolId() == null || p.getPoolId().isBlank()) {
                throw new SchemaMismatchException("snapshot row without pool id: " + p);
            }
            if (byId.putIfAbsent(p.getPoolId(), p) != null) {
                throw new SchemaMismatchException("pool " + p.getPoolId() + " appears twice in one snapshot");
            }
        }
        return byId;
    }
}
