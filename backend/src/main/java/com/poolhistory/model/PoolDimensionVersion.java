package com.poolhistory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.util.List;

/**
 * One SCD2 version of a pool: the attribute copy that was valid during [validFrom, validTo).
 * The open version carries {@link #OPEN_END} as validTo and is the only one flagged current.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(PoolDimensionVersion.COLLECTION)
@CompoundIndex(name = "by_pool_valid_from", def = "{'poolId':1,'validFrom':1}")
public class PoolDimensionVersion {

    public static final String COLLECTION = "pool_dim_scd2";

    /** validTo of the open version. */
    public static final LocalDate OPEN_END = LocalDate.of(9999, 12, 31);

    @Id
    private String id;

    private String poolId;

    private String protocolSlug;
    private String chain;
    private String symbol;
    private List<String> underlyingTokens;
    private List<String> rewardTokens;
    private String timestamp;
    private Double tvlUsd;
    private Double apy;
    private Double apyBase;
    private Double apyReward;
    private String poolOld;

    /** Inclusive. */
    private LocalDate validFrom;
    /** Exclusive. */
    private LocalDate validTo;

    private boolean current;
    private String attribHash;

    /** Soft-delete flag, always true for now. */
    private boolean active;

    /** Half-open containment check. */
    public boolean covers(LocalDate date) {
        return !date.isBefore(validFrom) && date.isBefore(validTo);
    }
}
