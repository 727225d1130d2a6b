package com.poolhistory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Ledger entry for one successful write to the destination fact table.
 * Covers the fact dates [fromDate, toDate], both inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("fact_uploads")
@CompoundIndex(name = "by_table_range", def = "{'tableName':1,'fromDate':1,'toDate':1}")
public class UploadRecord {

    @Id
    private String id;

    private String tableName;

    /** FULL_LOAD or INCREMENTAL. */
    private String mode;

    private LocalDate fromDate;
    private LocalDate toDate;

    private long rows;

    private Instant uploadedAt;
}
