package com.newsintel.curator.scheduler;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.discovery.PatternDiscoveryService;
import com.newsintel.curator.input.UrlStore;
import com.newsintel.curator.pipeline.PipelineExecutionStore;
import com.newsintel.curator.pipeline.PipelineRunner;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineSchedulerTest {

    private final PipelineRunner runner = mock(PipelineRunner.class);
    private final PipelineExecutionStore store = mock(PipelineExecutionStore.class);
    private final CurationProperties properties = new CurationProperties();
    private final PipelineScheduler scheduler = new PipelineScheduler(runner, store, mock(UrlStore.class),
            mock(PatternDiscoveryService.class), properties);

    @Test
    void scheduledRunIsHandedToADriverThread() {
        scheduler.scheduledRun();

        verify(runner).submitInBackground(eq("daily-curation"), any(LocalDate.class));
        verify(runner, never()).submit(anyString(), any());
    }

    @Test
    void reaperClosesAbandonedStagesAndStalledExecutions() {
        when(store.failAbandonedStages(any())).thenReturn(1);
        when(store.failStalledExecutions(any())).thenReturn(1);

        scheduler.reapAbandonedStages();

        LocalDateTime expected = LocalDateTime.now().minus(properties.getPipeline().getLivenessThreshold());
        verify(store).failAbandonedStages(any());
        verify(store).failStalledExecutions(argThat(
                cutoff -> Math.abs(ChronoUnit.SECONDS.between(cutoff, expected)) < 5));
    }

    @Test
    void failingReaperDoesNotEscapeTheScheduledJob() {
        when(store.failAbandonedStages(any())).thenThrow(new IllegalStateException("db down"));

        scheduler.reapAbandonedStages();

        verify(store, never()).failStalledExecutions(any());
    }
}
