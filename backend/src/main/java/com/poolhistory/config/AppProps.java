package com.poolhistory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Llama llama = new Llama();
    private Dune dune = new Dune();
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Llama {
        private String baseUrl = "https://yields.llama.fi";
        private long timeoutMs = 30_000;
        /** Pause between consecutive chart calls. */
        private long requestDelayMs = 100;
        private int maxAttempts = 3;
        private long backoffMs = 1_000;
    }

    @Data
    public static class Dune {
        private String baseUrl = "https://api.dune.com/api/v1";
        private String apiKey;
        private String namespace;
        private String factsTable = "defillama_historical_facts";
        private boolean privateTable = true;
        private int insertBatchSize = 10_000;
        private long timeoutMs = 60_000;
    }

    @Data
    public static class Pipeline {
        private boolean enabled = true;
        private boolean dryRun = false;
        private ModeSelection mode = ModeSelection.AUTO;
        /** Protocol slugs to keep; empty keeps every pool. */
        private List<String> targetProjects = new ArrayList<>();
        private Polling polling = new Polling();
    }

    @Data
    public static class Polling {
        private String cron = "0 30 1 * * ?";
    }

    /** AUTO probes the upload ledger; the explicit values bypass the probe. */
    public enum ModeSelection {
        AUTO, FULL_LOAD, INCREMENTAL
    }
}
