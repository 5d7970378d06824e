package com.jmapmail.service;

import com.jmapmail.mapper.AccountMessageMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MaintenanceService unit tests
 */
@ExtendWith(MockitoExtension.class)
class MaintenanceServiceTest {

    @Mock
    private AccountMessageMapper accountMessageMapper;

    @Mock
    private MessageCleanupService cleanupService;

    @Mock
    private BlobService blobService;

    private MaintenanceService maintenanceService;

    @BeforeEach
    void setUp() {
        maintenanceService = new MaintenanceService(accountMessageMapper, cleanupService, blobService);
    }

    @Test
    @DisplayName("One failing canonical cleanup does not stop the batch")
    void testResumeContinuesAfterFailure() {
        when(accountMessageMapper.findUnreferencedMessageIds(MaintenanceService.BATCH_SIZE))
                .thenReturn(List.of("C1", "C2", "C3"));
        when(cleanupService.cleanupCanonical("C1")).thenThrow(new IllegalStateException("database is locked"));
        when(cleanupService.cleanupCanonical("C2")).thenReturn(true);
        when(cleanupService.cleanupCanonical("C3")).thenReturn(false);

        assertThat(maintenanceService.resumeCanonicalCleanup()).isEqualTo(1);
    }

    @Test
    @DisplayName("Maintenance resumes canonical cleanup then sweeps orphan blobs")
    void testRunMaintenance() {
        when(accountMessageMapper.findUnreferencedMessageIds(MaintenanceService.BATCH_SIZE)).thenReturn(List.of());
        when(blobService.sweepOrphans(MaintenanceService.BATCH_SIZE)).thenReturn(2);

        maintenanceService.runMaintenance();

        verify(blobService).sweepOrphans(MaintenanceService.BATCH_SIZE);
    }
}
