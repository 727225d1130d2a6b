package com.poolhistory.service;

import com.poolhistory.model.HistoricalFact;

import java.time.LocalDate;
import java.util.List;

/**
 * @param targetDate the only fact date included (INCREMENTAL), or null (FULL_LOAD)
 */
public record BuildResult(BuildMode mode,
                          LocalDate targetDate,
                          List<HistoricalFact> rows,
                          int consideredFacts,
                          int droppedFacts) {

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
