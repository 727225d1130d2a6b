package com.poolhistory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** A single daily TVL/APY observation of one pool. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TvlFact {

    private String poolId;

    /** Observation day (UTC). */
    private LocalDate date;

    private Double tvlUsd;
    private Double apy;
    private Double apyBase;
    private Double apyReward;
}
