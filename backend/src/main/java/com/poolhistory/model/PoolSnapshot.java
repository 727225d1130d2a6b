package com.poolhistory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One pool as observed in a full catalog snapshot.
 * Everything except {@code poolId} and {@code timestamp} feeds the attribute fingerprint.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PoolSnapshot {

    /** Natural key (DeFiLlama pool uuid). */
    private String poolId;

    private String protocolSlug;
    private String chain;
    private String symbol;

    private List<String> underlyingTokens;
    private List<String> rewardTokens;

    /** ISO-8601 timestamp reported by the upstream for this state. Not hashed. */
    private String timestamp;

    private Double tvlUsd;
    private Double apy;
    private Double apyBase;
    private Double apyReward;

    /** Legacy identifier, usually "{address}-{chain}". */
    private String poolOld;
}
