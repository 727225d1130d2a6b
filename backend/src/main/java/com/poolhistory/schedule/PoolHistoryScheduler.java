package com.poolhistory.schedule;

import com.poolhistory.config.AppProps;
import com.poolhistory.service.PoolHistoryPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Daily trigger of the pipeline for "today" (UTC). Mode comes from app.pipeline.mode.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoolHistoryScheduler {

    private final PoolHistoryPipelineService pipeline;
    private final AppProps props;
    private final Clock clock;

    @Scheduled(cron = "${app.pipeline.polling.cron}", zone = "UTC")
    public void run() {
        if (!props.getPipeline().isEnabled()) {
            log.debug("[pipeline-scheduler] disabled, skipping");
            return;
        }
        LocalDate today = LocalDate.now(clock);
        log.info("[pipeline-scheduler] triggering run for {}", today);
        try {
            pipeline.run(null, today);
        } catch (Exception e) {
            log.error("[pipeline-scheduler] run for {} failed: {}", today, e.getMessage());
        }
    }
}
