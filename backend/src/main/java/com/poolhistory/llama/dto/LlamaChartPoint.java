package com.poolhistory.llama.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One daily point of the yields "chart/{pool}" endpoint. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlamaChartPoint {
    private String timestamp;       // ISO-8601
    private String tvlUsd;
    private String apy;
    private String apyBase;
    private String apyReward;
}
