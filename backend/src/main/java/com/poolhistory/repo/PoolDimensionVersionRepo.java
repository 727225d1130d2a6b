package com.poolhistory.repo;

import com.poolhistory.model.PoolDimensionVersion;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PoolDimensionVersionRepo extends MongoRepository<PoolDimensionVersion, String> {

    List<PoolDimensionVersion> findByPoolIdOrderByValidFromAsc(String poolId);

    /**
     * Version of a pool valid on a given date: latest validFrom at or before the date whose validTo is after it.
     */
    Optional<PoolDimensionVersion> findTopByPoolIdAndValidFromLessThanEqualAndValidToGreaterThanOrderByValidFromDesc(
            String poolId, LocalDate validFrom, LocalDate validTo);
}
