package com.poolhistory.service;

import com.poolhistory.config.AppProps;
import com.poolhistory.repo.UploadRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks FULL_LOAD vs INCREMENTAL for a run.
 * An explicit mode (caller or config) always wins. AUTO consults the local upload ledger,
 * never the remote table, and falls back to INCREMENTAL when the ledger cannot be read:
 * an append never wipes the destination, a full load does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RunModeResolver {

    private final AppProps props;
    private final UploadRecordRepository uploads;

    public BuildMode resolve(BuildMode requested) {
        if (requested != null) return requested;

        AppProps.ModeSelection configured = props.getPipeline().getMode();
        if (configured == AppProps.ModeSelection.FULL_LOAD) return BuildMode.FULL_LOAD;
        if (configured == AppProps.ModeSelection.INCREMENTAL) return BuildMode.INCREMENTAL;

        String table = props.getDune().getFactsTable();
        try {
            boolean loaded = uploads.existsByTableName(table);
            BuildMode mode = loaded ? BuildMode.INCREMENTAL : BuildMode.FULL_LOAD;
            log.info("[run-mode] AUTO: table {} {} -> {}", table, loaded ? "already loaded" : "never loaded", mode);
            return mode;
        } catch (RuntimeException e) {
            log.warn("[run-mode] AUTO probe failed for table {} ({}), defaulting to INCREMENTAL", table, e.getMessage());
            return BuildMode.INCREMENTAL;
        }
    }
}
