package com.poolhistory.api;

import com.poolhistory.service.BuildMode;
import com.poolhistory.service.PipelineStatus;
import com.poolhistory.service.PipelineStatusService;
import com.poolhistory.service.PoolHistoryPipelineService;
import com.poolhistory.service.RunReport;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Manual trigger of a pipeline run and its status.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PoolHistoryPipelineService pipeline;
    private final PipelineStatusService statusService;
    private final Clock clock;

    /**
     * Runs the pipeline. Without {@code mode} the configured selection applies;
     * without {@code date} the run is for today (UTC).
     */
    @PostMapping("/run")
    public RunReport run(
            @RequestParam(required = false) BuildMode mode,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return pipeline.run(mode, date != null ? date : LocalDate.now(clock));
    }

    /** Configuration, last run of this process and newest upload ledger entry. */
    @GetMapping("/status")
    public PipelineStatus status() {
        return statusService.status();
    }
}
