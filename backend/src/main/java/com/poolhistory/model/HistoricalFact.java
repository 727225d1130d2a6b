package com.poolhistory.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Fact row enriched with the pool attributes of the version valid on its date.
 * Serialized with the column names of the destination table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"timestamp", "pool_old_clean", "pool_id", "protocol_slug", "chain", "symbol",
        "tvl_usd", "apy", "apy_base", "apy_reward",
        "valid_from", "valid_to", "is_current", "attrib_hash", "is_active"})
public class HistoricalFact {

    @JsonProperty("timestamp")
    private LocalDate date;

    /** EVM address extracted from pool_old, when there is one. */
    @JsonProperty("pool_old_clean")
    private String poolOldClean;

    @JsonProperty("pool_id")
    private String poolId;

    @JsonProperty("protocol_slug")
    private String protocolSlug;

    @JsonProperty("chain")
    private String chain;

    @JsonProperty("symbol")
    private String symbol;

    @JsonProperty("tvl_usd")
    private Double tvlUsd;

    @JsonProperty("apy")
    private Double apy;

    @JsonProperty("apy_base")
    private Double apyBase;

    @JsonProperty("apy_reward")
    private Double apyReward;

    @JsonProperty("valid_from")
    private LocalDate validFrom;

    @JsonProperty("valid_to")
    private LocalDate validTo;

    @JsonProperty("is_current")
    private boolean current;

    @JsonProperty("attrib_hash")
    private String attribHash;

    @JsonProperty("is_active")
    private boolean active;
}
