package com.poolhistory.llama;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolhistory.config.AppProps;
import com.poolhistory.llama.dto.LlamaChartPoint;
import com.poolhistory.llama.dto.LlamaPool;
import com.poolhistory.llama.exception.RetryableHttpException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Blocking client for the DeFiLlama yields API (pool catalog + per-pool daily chart).
 * Retries 429/5xx/transport errors with capped exponential backoff; other 4xx fail fast.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefiLlamaClient {

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(5);

    private static final TypeReference<List<LlamaPool>> POOLS_REF = new TypeReference<>() {};
    private static final TypeReference<List<LlamaChartPoint>> CHART_REF = new TypeReference<>() {};

    private final RestTemplate llamaRestTemplate;
    private final AppProps props;

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Full catalog snapshot of all pools. */
    public List<LlamaPool> fetchPools() {
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getLlama().getBaseUrl())
                .path("/poolsOld")
                .build(true).toUri();
        long started = System.currentTimeMillis();
        String body = executeWithRetry("poolsOld", () -> get(uri));
        List<LlamaPool> pools = decode(body, POOLS_REF);
        log.info("[llama] fetched {} pools in {} ms", pools.size(), System.currentTimeMillis() - started);
        return pools;
    }

    /** Complete daily history of one pool. */
    public List<LlamaChartPoint> fetchChart(String poolId) {
        Assert.hasText(poolId, "poolId required");
        URI uri = UriComponentsBuilder.fromHttpUrl(props.getLlama().getBaseUrl())
                .path("/chart/{pool}")
                .buildAndExpand(poolId).toUri();
        String body = executeWithRetry("chart " + poolId, () -> get(uri));
        return decode(body, CHART_REF);
    }

    /**
     * Charts for many pools, rate limited. A pool whose chart cannot be fetched is logged and skipped.
     */
    public Map<String, List<LlamaChartPoint>> fetchCharts(Collection<String> poolIds) {
        Map<String, List<LlamaChartPoint>> out = new LinkedHashMap<>();
        int i = 0;
        for (String poolId : poolIds) {
            i++;
            try {
                log.debug("[llama] chart {}/{}: {}", i, poolIds.size(), poolId);
                out.put(poolId, fetchChart(poolId));
            } catch (Exception e) {
                log.error("[llama] failed to fetch chart for pool {}: {}", poolId, e.getMessage());
            }
            if (i < poolIds.size()) pause(props.getLlama().getRequestDelayMs());
        }
        log.info("[llama] fetched charts for {}/{} pools", out.size(), poolIds.size());
        return out;
    }

    private String get(URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Void> req = new HttpEntity<>(headers);
        try {
            ResponseEntity<String> resp = llamaRestTemplate.exchange(uri, HttpMethod.GET, req, String.class);
            if (resp.getBody() == null) {
                throw new RetryableHttpException("DeFiLlama empty body from " + uri);
            }
            return resp.getBody();
        } catch (HttpStatusCodeException httpEx) {
            if (isRetryable(httpEx.getStatusCode())) {
                throw new RetryableHttpException("DeFiLlama HTTP " + httpEx.getStatusCode() + " from " + uri, httpEx);
            }
            throw new IllegalStateException("DeFiLlama HTTP error " + httpEx.getStatusCode() + ": "
                    + httpEx.getResponseBodyAsString(), httpEx);
        } catch (ResourceAccessException io) {
            throw new RetryableHttpException("DeFiLlama transport error for " + uri + ": " + io.getMessage(), io);
        }
    }

    <T> T executeWithRetry(String what, Supplier<T> call) {
        int maxAttempts = Math.max(1, props.getLlama().getMaxAttempts());
        long baseBackoff = props.getLlama().getBackoffMs();
        RetryableHttpException last = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RetryableHttpException ex) {
                last = ex;
                log.warn("[llama] {} attempt {}/{} failed: {}", what, attempt + 1, maxAttempts, ex.getMessage());
                if (attempt + 1 < maxAttempts) {
                    long pow = Math.min(attempt, 4);
                    pause(Math.min(baseBackoff * (1L << pow), MAX_BACKOFF.toMillis()));
                }
            }
        }
        throw last;
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.value() == 429 || status.is5xxServerError();
    }

    private static void pause(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting between DeFiLlama calls", e);
        }
    }

    /** Accepts {status, data:[...]} or a bare array. */
    private <T> List<T> decode(String json, TypeReference<List<T>> ref) {
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || root.isNull()) return List.of();
            if (root.isArray()) {
                return mapper.readerFor(ref).readValue(root);
            }
            JsonNode status = root.get("status");
            if (status != null && !"success".equalsIgnoreCase(status.asText())) {
                throw new IllegalStateException("DeFiLlama status=" + status.asText());
            }
            JsonNode data = root.get("data");
            if (data != null && data.isArray()) {
                return mapper.readerFor(ref).readValue(data);
            }
            return List.of();
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("DeFiLlama decode error: " + e.getMessage(), e);
        }
    }
}
