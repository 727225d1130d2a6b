package com.poolhistory.api;

import com.poolhistory.model.PoolDimensionVersion;
import com.poolhistory.service.DimensionStoreService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only endpoints over the SCD2 pool dimension.
 */
@RestController
@RequestMapping("/api/v1/dimensions")
@RequiredArgsConstructor
public class DimensionController {

    private final DimensionStoreService store;

    /** Every version of a pool, oldest first. */
    @GetMapping("/{poolId}")
    public List<PoolDimensionVersion> history(@PathVariable String poolId) {
        return store.history(poolId);
    }

    /** Version of a pool valid on a date. */
    @GetMapping("/{poolId}/as-of")
    public ResponseEntity<PoolDimensionVersion> asOf(
            @PathVariable String poolId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.of(store.asOf(poolId, date));
    }
}
