package com.poolhistory.service;

import com.poolhistory.config.AppProps;
import com.poolhistory.repo.UploadRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunModeResolverTest {

    @Mock
    private UploadRecordRepository uploads;

    private AppProps props;
    private RunModeResolver resolver;

    @BeforeEach
    void setup() {
        props = new AppProps();
        props.getDune().setFactsTable("facts");
        resolver = new RunModeResolver(props, uploads);
    }

    @Test
    void explicitModeWinsWithoutProbing() {
        assertThat(resolver.resolve(BuildMode.FULL_LOAD)).isEqualTo(BuildMode.FULL_LOAD);
        assertThat(resolver.resolve(BuildMode.INCREMENTAL)).isEqualTo(BuildMode.INCREMENTAL);
        verifyNoInteractions(uploads);
    }

    @Test
    void configuredModeWinsWithoutProbing() {
        props.getPipeline().setMode(AppProps.ModeSelection.INCREMENTAL);

        assertThat(resolver.resolve(null)).isEqualTo(BuildMode.INCREMENTAL);
        verifyNoInteractions(uploads);
    }

    @Test
    void autoStartsWithFullLoadOnNeverLoadedTable() {
        when(uploads.existsByTableName("facts")).thenReturn(false);

        assertThat(resolver.resolve(null)).isEqualTo(BuildMode.FULL_LOAD);
    }

    @Test
    void autoNeverReturnsToFullLoadOnceLoaded() {
        when(uploads.existsByTableName("facts")).thenReturn(true);

        assertThat(resolver.resolve(null)).isEqualTo(BuildMode.INCREMENTAL);
    }

    @Test
    void autoFallsBackToIncrementalWhenLedgerIsUnreadable() {
        when(uploads.existsByTableName("facts")).thenThrow(new IllegalStateException("mongo down"));

        assertThat(resolver.resolve(null)).isEqualTo(BuildMode.INCREMENTAL);
    }
}
