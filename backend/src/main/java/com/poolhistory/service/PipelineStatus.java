package com.poolhistory.service;

import com.poolhistory.config.AppProps;
import com.poolhistory.model.UploadRecord;

import java.time.Instant;
import java.util.List;

/**
 * @param lastRun    last successful run of this process, null after a restart
 * @param lastUpload newest ledger entry of the facts table, null when nothing was uploaded
 */
public record PipelineStatus(Instant timestamp,
                             boolean running,
                             boolean enabled,
                             boolean dryRun,
                             AppProps.ModeSelection mode,
                             List<String> targetProjects,
                             String factsTable,
                             RunReport lastRun,
                             UploadRecord lastUpload) {
}
