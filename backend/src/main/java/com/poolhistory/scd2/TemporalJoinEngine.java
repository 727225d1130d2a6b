package com.poolhistory.scd2;

import com.poolhistory.model.HistoricalFact;
import com.poolhistory.model.PoolDimensionVersion;
import com.poolhistory.model.TvlFact;
import com.poolhistory.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * As-of join of daily facts against the SCD2 pool dimension.
 * <p>
 * Candidates are looked up by pool id, then the version with validFrom <= date < validTo wins.
 * Facts without a covering version are dropped and counted (inner join).
 */
@Component
@Slf4j
public class TemporalJoinEngine {

    private static final Comparator<HistoricalFact> OUTPUT_ORDER =
            Comparator.comparing(HistoricalFact::getDate).thenComparing(HistoricalFact::getPoolId);

    public JoinResult join(List<TvlFact> facts, DimensionVersionStore store) {
        return join(facts, store, null);
    }

    /**
     * @param onlyDate when not null, only facts of that day are joined; the store is never filtered
     */
    public JoinResult join(List<TvlFact> facts, DimensionVersionStore store, LocalDate onlyDate) {
        List<HistoricalFact> rows = new ArrayList<>();
        TreeSet<String> unmatched = new TreeSet<>();
        int considered = 0;

        for (TvlFact fact : facts) {
            if (fact.getPoolId() == null || fact.getDate() == null) {
                throw new SchemaMismatchException("fact without pool id or date: " + fact);
            }
            if (onlyDate != null && !onlyDate.equals(fact.getDate())) continue;
            considered++;

            PoolDimensionVersion match = null;
            for (PoolDimensionVersion v : store.sharedVersions(fact.getPoolId())) {
                if (v.covers(fact.getDate())) {
                    match = v;
                    break;
                }
            }
            if (match == null) {
                unmatched.add(fact.getPoolId());
                continue;
            }
            rows.add(attribute(fact, match));
        }

        rows.sort(OUTPUT_ORDER);
        int dropped = considered - rows.size();
        if (dropped > 0) {
            log.info("[scd2-join] dropped {} of {} facts without a covering version ({} pools){}",
                    dropped, considered, unmatched.size(), onlyDate != null ? " for " + onlyDate : "");
        }
        return new JoinResult(rows, considered, dropped, unmatched);
    }

    static HistoricalFact attribute(TvlFact fact, PoolDimensionVersion dim) {
        return HistoricalFact.builder()
                .date(fact.getDate())
                .poolOldClean(AddressUtil.extractAddress(dim.getPoolOld()))
                .poolId(fact.getPoolId())
                .protocolSlug(dim.getProtocolSlug())
                .chain(dim.getChain())
                .symbol(dim.getSymbol())
                .tvlUsd(fact.getTvlUsd())
                .apy(fact.getApy())
                .apyBase(fact.getApyBase())
                .apyReward(fact.getApyReward())
                .validFrom(dim.getValidFrom())
                .validTo(dim.getValidTo())
                .current(dim.isCurrent())
                .attribHash(dim.getAttribHash())
                .active(dim.isActive())
                .build();
    }
}
