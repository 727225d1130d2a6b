package com.poolhistory.repo;

import com.poolhistory.model.UploadRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Optional;

public interface UploadRecordRepository extends MongoRepository<UploadRecord, String> {

    /** Any successful upload into this table at all. */
    boolean existsByTableName(String tableName);

    /** Has a previous upload into this table already covered the given fact date? */
    boolean existsByTableNameAndFromDateLessThanEqualAndToDateGreaterThanEqual(
            String tableName, LocalDate date, LocalDate sameDate);

    long deleteByTableName(String tableName);

    Optional<UploadRecord> findTopByTableNameOrderByUploadedAtDesc(String tableName);
}
