package com.poolhistory.service;

import java.time.LocalDate;

/** Counts of one pipeline run. */
public record RunReport(BuildMode mode,
                        LocalDate runDate,
                        int poolsInSnapshot,
                        int dimensionVersions,
                        long currentVersions,
                        int factsFetched,
                        int rowsBuilt,
                        int factsDropped,
                        long rowsUploaded,
                        boolean dryRun) {
}
