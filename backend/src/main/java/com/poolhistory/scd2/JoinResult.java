package com.poolhistory.scd2;

import com.poolhistory.model.HistoricalFact;

import java.util.List;
import java.util.Set;

/**
 * Output of an as-of join.
 *
 * @param rows            attributed facts, ordered by (date, poolId)
 * @param consideredFacts facts that passed the date filter
 * @param droppedFacts    considered facts with no covering dimension version
 * @param unmatchedPools  pool ids of the dropped facts
 */
public record JoinResult(List<HistoricalFact> rows,
                         int consideredFacts,
                         int droppedFacts,
                         Set<String> unmatchedPools) {
}
