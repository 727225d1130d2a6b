package com.poolhistory.service;

/** Scope of one fact-table build. */
public enum BuildMode {
    /** Whole fact history, replaces the destination table. */
    FULL_LOAD,
    /** Facts of one target date, appended to the destination table. */
    INCREMENTAL
}
