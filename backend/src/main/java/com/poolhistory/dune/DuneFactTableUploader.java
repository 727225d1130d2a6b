package com.poolhistory.dune;

import com.poolhistory.config.AppProps;
import com.poolhistory.model.HistoricalFact;
import com.poolhistory.model.UploadRecord;
import com.poolhistory.repo.UploadRecordRepository;
import com.poolhistory.service.BuildMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Writes the historical-facts table to Dune.
 * FULL_LOAD replaces the table; INCREMENTAL appends one date unless the local upload ledger
 * says that date is already in the table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuneFactTableUploader {

    static final List<DuneColumn> FACT_COLUMNS = List.of(
            DuneColumn.of("timestamp", "date"),
            DuneColumn.of("pool_old_clean", "varchar"),
            DuneColumn.of("pool_id", "varchar"),
            DuneColumn.of("protocol_slug", "varchar"),
            DuneColumn.of("chain", "varchar"),
            DuneColumn.of("symbol", "varchar"),
            DuneColumn.of("tvl_usd", "double"),
            DuneColumn.of("apy", "double"),
            DuneColumn.of("apy_base", "double"),
            DuneColumn.of("apy_reward", "double"),
            DuneColumn.of("valid_from", "date"),
            DuneColumn.of("valid_to", "date"),
            DuneColumn.of("is_current", "boolean"),
            DuneColumn.of("attrib_hash", "varchar"),
            DuneColumn.of("is_active", "boolean"));

    private final DuneClient dune;
    private final UploadRecordRepository uploads;
    private final AppProps props;
    private final Clock clock;

    /**
     * Create the table when missing, clear it, insert every row and reset the ledger to this load.
     *
     * @return rows written
     */
    public long replaceAll(List<HistoricalFact> rows) {
        String table = props.getDune().getFactsTable();
        if (props.getPipeline().isDryRun()) {
            log.info("[dune-upload] dry run: would replace {} with {} rows", table, rows.size());
            return 0;
        }
        dune.createTable(table, "DeFiLlama pool TVL/APY history attributed to SCD2 pool versions",
                FACT_COLUMNS, props.getDune().isPrivateTable());
        dune.clearTable(table);
        long written = insertBatched(table, rows);

        uploads.deleteByTableName(table);
        if (!rows.isEmpty()) {
            LocalDate from = rows.stream().map(HistoricalFact::getDate).min(Comparator.naturalOrder()).orElseThrow();
            LocalDate to = rows.stream().map(HistoricalFact::getDate).max(Comparator.naturalOrder()).orElseThrow();
            record(table, BuildMode.FULL_LOAD, from, to, written);
        }
        log.info("[dune-upload] full load of {} finished: {} rows", table, written);
        return written;
    }

    /**
     * Append the rows of one fact date. Skipped when the ledger already covers the date.
     *
     * @return rows written (0 when skipped)
     */
    public long appendForDate(LocalDate date, List<HistoricalFact> rows) {
        String table = props.getDune().getFactsTable();
        if (rows.isEmpty()) {
            log.warn("[dune-upload] no rows for {}, nothing appended to {}", date, table);
            return 0;
        }
        List<HistoricalFact> foreign = rows.stream().filter(r -> !date.equals(r.getDate())).toList();
        if (!foreign.isEmpty()) {
            throw new IllegalArgumentException(foreign.size() + " rows are not dated " + date
                    + " (first: " + foreign.get(0).getDate() + ")");
        }
        if (uploads.existsByTableNameAndFromDateLessThanEqualAndToDateGreaterThanEqual(table, date, date)) {
            log.info("[dune-upload] {} already holds data for {}, skipping {} rows", table, date, rows.size());
            return 0;
        }
        if (props.getPipeline().isDryRun()) {
            log.info("[dune-upload] dry run: would append {} rows for {} to {}", rows.size(), date, table);
            return 0;
        }
        long written = insertBatched(table, rows);
        record(table, BuildMode.INCREMENTAL, date, date, written);
        log.info("[dune-upload] appended {} rows for {} to {}", written, date, table);
        return written;
    }

    private long insertBatched(String table, List<HistoricalFact> rows) {
        int batch = Math.max(1, props.getDune().getInsertBatchSize());
        long written = 0;
        for (int from = 0; from < rows.size(); from += batch) {
            List<HistoricalFact> chunk = rows.subList(from, Math.min(rows.size(), from + batch));
            written += dune.insertRows(table, chunk);
        }
        return written;
    }

    private void record(String table, BuildMode mode, LocalDate from, LocalDate to, long rows) {
        uploads.save(UploadRecord.builder()
                .tableName(table)
                .mode(mode.name())
                .fromDate(from)
                .toDate(to)
                .rows(rows)
                .uploadedAt(Instant.now(clock))
                .build());
    }
}
