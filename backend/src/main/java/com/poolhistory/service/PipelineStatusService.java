package com.poolhistory.service;

import com.poolhistory.config.AppProps;
import com.poolhistory.model.UploadRecord;
import com.poolhistory.repo.UploadRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineStatusService {

    private final PoolHistoryPipelineService pipeline;
    private final UploadRecordRepository uploads;
    private final AppProps props;
    private final Clock clock;

    public PipelineStatus status() {
        String table = props.getDune().getFactsTable();
        UploadRecord lastUpload;
        try {
            lastUpload = uploads.findTopByTableNameOrderByUploadedAtDesc(table).orElse(null);
        } catch (RuntimeException e) {
            log.warn("[pipeline-status] upload ledger unavailable for {}: {}", table, e.getMessage());
            lastUpload = null;
        }
        AppProps.Pipeline cfg = props.getPipeline();
        return new PipelineStatus(
                Instant.now(clock),
                pipeline.isRunning(),
                cfg.isEnabled(),
                cfg.isDryRun(),
                cfg.getMode(),
                List.copyOf(cfg.getTargetProjects()),
                table,
                pipeline.lastRun(),
                lastUpload);
    }
}
