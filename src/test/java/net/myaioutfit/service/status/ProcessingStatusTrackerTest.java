package net.myaioutfit.service.status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import net.myaioutfit.domain.wardrobe.ProcessingStatus;
import net.myaioutfit.domain.wardrobe.StatusUpdate;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatusRepository;
import net.myaioutfit.service.storage.StoredObject;
import net.myaioutfit.service.storage.WardrobeImageStorageService;
import net.myaioutfit.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ProcessingStatusTrackerTest {

    private static final UUID ITEM = UUID.fromString("3f2b9c1e-8d4a-4e6f-9a1b-2c3d4e5f6a7b");
    private static final String OWNER = "aaaaaaaa-1111-4111-8111-111111111111";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final StoredObject STORED = new StoredObject(
        "processed/" + OWNER + "/" + ITEM + ".png", "https://cdn.example.com/processed/x.png");

    @Mock
    private WardrobeItemStatusRepository repository;
    @Mock
    private WardrobeImageStorageService storageService;

    private ProcessingStatusTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ProcessingStatusTracker(repository, storageService, new MutableClock(NOW));
    }

    @Test
    void should_StampStartTime_When_MarkingProcessing() {
        when(repository.updateStatus(eq(ITEM), eq(OWNER), any())).thenReturn(1);

        assertThat(tracker.markProcessing(ITEM, OWNER)).isTrue();

        ArgumentCaptor<StatusUpdate> update = ArgumentCaptor.forClass(StatusUpdate.class);
        verify(repository).updateStatus(eq(ITEM), eq(OWNER), update.capture());
        assertThat(update.getValue().status()).isEqualTo(ProcessingStatus.PROCESSING);
        assertThat(update.getValue().startedAt()).isEqualTo(NOW);
        assertThat(update.getValue().completedAt()).isNull();
        assertThat(update.getValue().clearCompletedAt()).isTrue();
        assertThat(update.getValue().imageUrl()).isNull();
    }

    @Test
    void should_CarryFallbackUrl_When_MarkingFailed() {
        when(repository.updateStatus(eq(ITEM), eq(OWNER), any())).thenReturn(1);

        tracker.markFailed(ITEM, OWNER, "https://cdn.example.com/original.jpg");

        ArgumentCaptor<StatusUpdate> update = ArgumentCaptor.forClass(StatusUpdate.class);
        verify(repository).updateStatus(eq(ITEM), eq(OWNER), update.capture());
        assertThat(update.getValue().status()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(update.getValue().completedAt()).isEqualTo(NOW);
        assertThat(update.getValue().imageUrl()).isEqualTo("https://cdn.example.com/original.jpg");
    }

    @Test
    void should_ReportFalse_When_NoRowMatchesOwner() {
        when(repository.updateStatus(eq(ITEM), eq(OWNER), any())).thenReturn(0);

        assertThat(tracker.markCompleted(ITEM, OWNER, STORED.publicUrl())).isFalse();
    }

    @Test
    void should_ReportFalseInsteadOfThrowing_When_ItemStoreFails() {
        when(repository.updateStatus(eq(ITEM), eq(OWNER), any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(tracker.markProcessing(ITEM, OWNER)).isFalse();
    }

    @Test
    void should_WriteCompleted_When_ItemStillPresent() {
        when(repository.existsForOwner(ITEM, OWNER)).thenReturn(true);
        when(repository.updateStatus(eq(ITEM), eq(OWNER), any())).thenReturn(1);

        assertThat(tracker.completeIfPresent(ITEM, OWNER, STORED)).isEqualTo(CompletionOutcome.COMPLETED);

        ArgumentCaptor<StatusUpdate> update = ArgumentCaptor.forClass(StatusUpdate.class);
        verify(repository).updateStatus(eq(ITEM), eq(OWNER), update.capture());
        assertThat(update.getValue().imageUrl()).isEqualTo(STORED.publicUrl());
        verifyNoInteractions(storageService);
    }

    @Test
    void should_RemoveObjectAndSkipWrite_When_ItemDeletedMidPipeline() {
        when(repository.existsForOwner(ITEM, OWNER)).thenReturn(false);

        assertThat(tracker.completeIfPresent(ITEM, OWNER, STORED)).isEqualTo(CompletionOutcome.ASSET_GONE);

        verify(storageService).remove(List.of(STORED.path()));
        verify(repository, never()).updateStatus(any(), any(), any());
    }

    @Test
    void should_ReportWriteFailed_When_FinalWriteRejected() {
        when(repository.existsForOwner(ITEM, OWNER)).thenReturn(true);
        when(repository.updateStatus(eq(ITEM), eq(OWNER), any()))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThat(tracker.completeIfPresent(ITEM, OWNER, STORED)).isEqualTo(CompletionOutcome.WRITE_FAILED);
        verifyNoInteractions(storageService);
    }

    @Test
    void should_ReportWriteFailed_When_PresenceCheckFails() {
        when(repository.existsForOwner(ITEM, OWNER)).thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThat(tracker.completeIfPresent(ITEM, OWNER, STORED)).isEqualTo(CompletionOutcome.WRITE_FAILED);
        verifyNoInteractions(storageService);
    }

    @Test
    void should_PropagateItemStoreErrors_When_CheckingOwnership() {
        when(repository.existsForOwner(ITEM, OWNER)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> tracker.isOwnedBy(ITEM, OWNER))
            .isInstanceOf(DataAccessResourceFailureException.class);
    }
}
