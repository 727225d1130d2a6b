package com.poolhistory.llama.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * DTO for one entry of the yields "poolsOld" endpoint.
 * Numeric fields are kept as raw strings; coercion happens in the mapper so that a single
 * malformed value does not fail the whole catalog.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlamaPool {
    private String pool;            // uuid
    private String project;         // protocol slug
    private String chain;
    private String symbol;
    private String timestamp;       // ISO-8601
    private String tvlUsd;
    private String apy;
    private String apyBase;
    private String apyReward;
    private List<String> underlyingTokens;
    private List<String> rewardTokens;

    @JsonProperty("pool_old")
    private String poolOld;
}
