package com.poolhistory.service;

import com.mongodb.MongoNamespace;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.RenameCollectionOptions;
import com.poolhistory.model.PoolDimensionVersion;
import com.poolhistory.repo.PoolDimensionVersionRepo;
import com.poolhistory.scd2.DimensionVersionStore;
import com.poolhistory.scd2.VersioningInvariantViolationException;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.List;

import static com.poolhistory.service.DimensionStoreService.STAGING_COLLECTION;
import static com.poolhistory.support.PoolFixtures.d;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DimensionStoreServiceTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private PoolDimensionVersionRepo repo;

    @Mock
    private MongoDatabase db;

    @Mock
    private MongoCollection<Document> staging;

    @Mock
    private IndexOperations indexOps;

    @Test
    void replaceWritesStagingThenRenamesOverLive() {
        when(mongoTemplate.collectionExists(STAGING_COLLECTION)).thenReturn(true);
        when(mongoTemplate.indexOps(STAGING_COLLECTION)).thenReturn(indexOps);
        when(mongoTemplate.getDb()).thenReturn(db);
        when(db.getName()).thenReturn("poolhistory");
        when(mongoTemplate.getCollection(STAGING_COLLECTION)).thenReturn(staging);
        DimensionVersionStore store = DimensionVersionStore.of(List.of(
                version("p1", "2024-01-01", "2024-06-01", false),
                version("p1", "2024-06-01", null, true)));

        new DimensionStoreService(mongoTemplate, repo).replace(store);

        InOrder order = inOrder(mongoTemplate, staging);
        order.verify(mongoTemplate).dropCollection(STAGING_COLLECTION);
        order.verify(mongoTemplate).createCollection(STAGING_COLLECTION);
        order.verify(mongoTemplate).insert(anyList(), eq(STAGING_COLLECTION));
        ArgumentCaptor<RenameCollectionOptions> options = ArgumentCaptor.forClass(RenameCollectionOptions.class);
        order.verify(staging).renameCollection(eq(new MongoNamespace("poolhistory", PoolDimensionVersion.COLLECTION)),
                options.capture());
        assertThat(options.getValue().isDropTarget()).isTrue();
    }

    @Test
    void invalidStoreIsNeverWritten() {
        DimensionVersionStore twoCurrent = DimensionVersionStore.of(List.of(
                version("p1", "2024-01-01", null, true),
                version("p1", "2024-06-01", null, true)));

        assertThatThrownBy(() -> new DimensionStoreService(mongoTemplate, repo).replace(twoCurrent))
                .isInstanceOf(VersioningInvariantViolationException.class);
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void failedStagingWriteLeavesLiveCollectionAlone() {
        when(mongoTemplate.collectionExists(STAGING_COLLECTION)).thenReturn(false);
        when(mongoTemplate.insert(anyList(), eq(STAGING_COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        DimensionVersionStore store = DimensionVersionStore.of(List.of(version("p1", "2024-06-01", null, true)));

        assertThatThrownBy(() -> new DimensionStoreService(mongoTemplate, repo).replace(store))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(mongoTemplate, never()).getCollection(any());
        verify(mongoTemplate, never()).dropCollection(PoolDimensionVersion.COLLECTION);
    }

    @Test
    void loadValidatesWhatIsRead() {
        when(mongoTemplate.findAll(PoolDimensionVersion.class, PoolDimensionVersion.COLLECTION)).thenReturn(List.of(
                version("p1", "2024-01-01", "2024-03-01", false),
                version("p1", "2024-04-01", null, true)));

        assertThatThrownBy(() -> new DimensionStoreService(mongoTemplate, repo).load())
                .isInstanceOf(VersioningInvariantViolationException.class)
                .hasMessageContaining("gap");
    }

    private static PoolDimensionVersion version(String poolId, String from, String to, boolean current) {
        return PoolDimensionVersion.builder()
                .poolId(poolId)
                .symbol("DAI-USDC")
                .validFrom(d(from))
                .validTo(to == null ? PoolDimensionVersion.OPEN_END : d(to))
                .current(current)
                .attribHash(poolId + from)
                .active(true)
                .build();
    }
}
