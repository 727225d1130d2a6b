package com.poolhistory.service;

import com.poolhistory.config.AppProps;
import com.poolhistory.dune.DuneFactTableUploader;
import com.poolhistory.llama.DefiLlamaClient;
import com.poolhistory.llama.dto.LlamaChartPoint;
import com.poolhistory.model.PoolSnapshot;
import com.poolhistory.model.TvlFact;
import com.poolhistory.scd2.DimensionVersionStore;
import com.poolhistory.scd2.DimensionVersioner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One end-to-end run: snapshot -> SCD2 advance -> facts -> as-of build -> persist dimension -> upload.
 * Everything up to the build is in memory; the dimension store is written only once the build
 * succeeded, and the upload only after the store was written. A failed upload swaps the
 * previous store back in, so a failed run leaves the durable dimension as it found it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolHistoryPipelineService {

    private final DefiLlamaClient llama;
    private final PoolSnapshotMapper mapper;
    private final DimensionVersioner versioner;
    private final DimensionStoreService dimensionStore;
    private final IncrementalFactBuilder factBuilder;
    private final DuneFactTableUploader uploader;
    private final RunModeResolver modeResolver;
    private final AppProps props;

    private final ReentrantLock runLock = new ReentrantLock();

    private volatile RunReport lastRun;

    /**
     * @param requestedMode explicit mode, or null to let {@link RunModeResolver} decide
     * @param runDate       snapshot date for new versions and target date of an incremental build
     */
    public RunReport run(BuildMode requestedMode, LocalDate runDate) {
        Objects.requireNonNull(runDate, "runDate required");
        if (!runLock.tryLock()) {
            throw new IllegalStateException("a pipeline run is already in progress");
        }
        BuildMode mode = null;
        DimensionVersionStore previous = null;
        boolean swapped = false;
        try {
            mode = modeResolver.resolve(requestedMode);
            boolean dryRun = props.getPipeline().isDryRun();
            log.info("[pipeline] run started mode={} date={} dryRun={}", mode, runDate, dryRun);

            List<PoolSnapshot> snapshot = mapper.toSnapshots(llama.fetchPools(), props.getPipeline().getTargetProjects());

            previous = dimensionStore.load();
            DimensionVersionStore next = versioner.advance(previous, snapshot, runDate);

            List<TvlFact> facts = fetchFacts(snapshot);
            BuildResult built = factBuilder.build(mode, facts, next, mode == BuildMode.INCREMENTAL ? runDate : null);

            if (dryRun) {
                log.info("[pipeline] dry run: dimension store ({} versions) not persisted", next.size());
            } else {
                dimensionStore.replace(next);
                swapped = true;
            }
            long uploaded;
            if (mode == BuildMode.FULL_LOAD) {
                uploaded = uploader.replaceAll(built.rows());
            } else {
                uploaded = uploader.appendForDate(runDate, built.rows());
            }

            RunReport report = new RunReport(mode, runDate, snapshot.size(), next.size(), next.currentCount(),
                    facts.size(), built.rows().size(), built.droppedFacts(), uploaded, dryRun);
            log.info("[pipeline] run finished {}", report);
            lastRun = report;
            return report;
        } catch (RuntimeException e) {
            log.error("[pipeline] run failed mode={} date={}: {}", mode, runDate, e.getMessage(), e);
            if (swapped) {
                restore(previous, e);
            }
            throw e;
        } finally {
            runLock.unlock();
        }
    }

    /** Report of the last successful run in this process, or null. */
    public RunReport lastRun() {
        return lastRun;
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    private void restore(DimensionVersionStore previous, RuntimeException cause) {
        try {
            dimensionStore.replace(previous);
            log.warn("[pipeline] dimension store rolled back to {} versions", previous.size());
        } catch (RuntimeException restoreFailure) {
            log.error("[pipeline] rollback of dimension store failed: {}", restoreFailure.getMessage(), restoreFailure);
            cause.addSuppressed(restoreFailure);
        }
    }

    private List<TvlFact> fetchFacts(List<PoolSnapshot> snapshot) {
        List<String> poolIds = snapshot.stream().map(PoolSnapshot::getPoolId).toList();
        Map<String, List<LlamaChartPoint>> charts = llama.fetchCharts(poolIds);
        List<TvlFact> facts = new ArrayList<>();
        charts.forEach((poolId, points) -> facts.addAll(mapper.toFacts(poolId, points)));
        log.info("[pipeline] {} facts for {} pools", facts.size(), charts.size());
        return facts;
    }
}
