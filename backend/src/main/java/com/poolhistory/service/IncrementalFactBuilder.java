package com.poolhistory.service;

import com.poolhistory.model.TvlFact;
import com.poolhistory.scd2.DimensionVersionStore;
import com.poolhistory.scd2.JoinResult;
import com.poolhistory.scd2.TemporalJoinEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Builds the denormalized historical-facts table, either for the whole history or for one date.
 * The mode is always chosen by the caller; this class never looks at the destination.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IncrementalFactBuilder {

    private final TemporalJoinEngine joinEngine;

    public BuildResult fullLoad(List<TvlFact> facts, DimensionVersionStore store) {
        return build(BuildMode.FULL_LOAD, facts, store, null);
    }

    public BuildResult incremental(List<TvlFact> facts, DimensionVersionStore store, LocalDate targetDate) {
        return build(BuildMode.INCREMENTAL, facts, store, targetDate);
    }

    public BuildResult build(BuildMode mode, List<TvlFact> facts, DimensionVersionStore store, LocalDate targetDate) {
        Objects.requireNonNull(mode, "mode required");
        Objects.requireNonNull(store, "dimension store required");
        List<TvlFact> input = facts == null ? List.of() : facts;

        JoinResult joined;
        LocalDate scope;
        if (mode == BuildMode.INCREMENTAL) {
            if (targetDate == null) {
                throw new IllegalArgumentException("INCREMENTAL build needs a target date");
            }
            joined = joinEngine.join(input, store, targetDate);
            scope = targetDate;
        } else {
            joined = joinEngine.join(input, store);
            scope = null;
        }

        if (joined.rows().isEmpty()) {
            log.warn("[fact-builder] {} build{} produced no rows ({} facts considered, {} unattributed)",
                    mode, scope != null ? " for " + scope : "", joined.consideredFacts(), joined.droppedFacts());
        } else {
            log.info("[fact-builder] {} build{}: {} rows from {} facts, {} unattributed",
                    mode, scope != null ? " for " + scope : "", joined.rows().size(),
                    joined.consideredFacts(), joined.droppedFacts());
        }
        return new BuildResult(mode, scope, joined.rows(), joined.consideredFacts(), joined.droppedFacts());
    }
}
