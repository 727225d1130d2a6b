package com.poolhistory.service;

import com.mongodb.MongoNamespace;
import com.mongodb.client.model.RenameCollectionOptions;
import com.poolhistory.model.PoolDimensionVersion;
import com.poolhistory.repo.PoolDimensionVersionRepo;
import com.poolhistory.scd2.DimensionVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of the SCD2 pool dimension in MongoDB.
 * The store is read wholesale and replaced wholesale: rows go to a staging collection that is
 * then renamed over the live one, so a failed write leaves the previous generation in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DimensionStoreService {

    static final String STAGING_COLLECTION = PoolDimensionVersion.COLLECTION + "_staging";

    private final MongoTemplate mongoTemplate;
    private final PoolDimensionVersionRepo repo;

    public DimensionVersionStore load() {
        List<PoolDimensionVersion> rows = mongoTemplate.findAll(PoolDimensionVersion.class, PoolDimensionVersion.COLLECTION);
        DimensionVersionStore store = DimensionVersionStore.of(rows).validate();
        log.info("[dim-store] loaded {} versions of {} pools", store.size(), store.poolIds().size());
        return store;
    }

    public void replace(DimensionVersionStore store) {
        store.validate();

        if (mongoTemplate.collectionExists(STAGING_COLLECTION)) {
            mongoTemplate.dropCollection(STAGING_COLLECTION);
        }
        mongoTemplate.createCollection(STAGING_COLLECTION);
        List<PoolDimensionVersion> rows = store.rows();
        if (!rows.isEmpty()) {
            mongoTemplate.insert(rows, STAGING_COLLECTION);
        }
        mongoTemplate.indexOps(STAGING_COLLECTION)
                .ensureIndex(new Index().on("poolId", Sort.Direction.ASC).on("validFrom", Sort.Direction.ASC));

        String db = mongoTemplate.getDb().getName();
        mongoTemplate.getCollection(STAGING_COLLECTION).renameCollection(
                new MongoNamespace(db, PoolDimensionVersion.COLLECTION),
                new RenameCollectionOptions().dropTarget(true));
        log.info("[dim-store] replaced dimension with {} versions ({} current)", rows.size(), store.currentCount());
    }

    public List<PoolDimensionVersion> history(String poolId) {
        return repo.findByPoolIdOrderByValidFromAsc(poolId);
    }

    public Optional<PoolDimensionVersion> asOf(String poolId, LocalDate date) {
        return repo.findTopByPoolIdAndValidFromLessThanEqualAndValidToGreaterThanOrderByValidFromDesc(poolId, date, date);
    }
}
