package net.myaioutfit.application.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import net.myaioutfit.adapters.persistence.JdbcWardrobeItemStatusRepository;
import net.myaioutfit.config.ImagePipelineProperties;
import net.myaioutfit.domain.wardrobe.ProcessingStatus;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatus;
import net.myaioutfit.exception.AssetNotFoundException;
import net.myaioutfit.exception.BackgroundRemovalException;
import net.myaioutfit.exception.GenerationException;
import net.myaioutfit.exception.ImagePipelineException;
import net.myaioutfit.exception.ImageStorageException;
import net.myaioutfit.exception.ImageValidationException;
import net.myaioutfit.exception.PipelineErrorCode;
import net.myaioutfit.model.image.ImageFormat;
import net.myaioutfit.model.image.StoragePurpose;
import net.myaioutfit.service.ai.BackgroundRemovalClient;
import net.myaioutfit.service.ai.GeneratedImage;
import net.myaioutfit.service.ai.ImageGenerationClient;
import net.myaioutfit.service.image.DownloadedImage;
import net.myaioutfit.service.image.ImageFormatValidator;
import net.myaioutfit.service.image.ImageResizeService;
import net.myaioutfit.service.image.RemoteImageDownloader;
import net.myaioutfit.service.status.ProcessingStatusTracker;
import net.myaioutfit.service.storage.StoredObject;
import net.myaioutfit.service.storage.WardrobeImageStorageService;
import net.myaioutfit.support.s3.StorageObjectPaths;
import net.myaioutfit.testutil.ImageTestData;
import net.myaioutfit.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

@ExtendWith(MockitoExtension.class)
class WardrobeImagePipelineOrchestratorTest {

    private static final String CDN = "https://cdn.example.com/";
    private static final String OWNER = "aaaaaaaa-1111-4111-8111-111111111111";
    private static final String REMOVAL_RESULT_URL = "https://replicate.delivery/cutout.png";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ImageGenerationClient generationClient;
    @Mock
    private BackgroundRemovalClient backgroundRemovalClient;
    @Mock
    private RemoteImageDownloader imageDownloader;
    @Mock
    private WardrobeImageStorageService storageService;

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcWardrobeItemStatusRepository repository;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private WardrobeImagePipelineOrchestrator orchestrator;
    private UUID itemId;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("schema-h2.sql")
            .build();
        jdbcTemplate = new JdbcTemplate(database);
        repository = new JdbcWardrobeItemStatusRepository(jdbcTemplate);
        clock = new MutableClock(NOW);
        meterRegistry = new SimpleMeterRegistry();

        itemId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO wardrobe_items (id, user_id, name) VALUES (?, ?, ?)",
            itemId, UUID.fromString(OWNER), "Navy blazer");

        lenient().when(storageService.store(any(StoragePurpose.class), anyString(), any(UUID.class),
                any(ImageFormat.class), any(byte[].class)))
            .thenAnswer(invocation -> {
                String path = StorageObjectPaths.forPurpose(invocation.getArgument(0), invocation.getArgument(1),
                    invocation.getArgument(2), clock.millis(), invocation.getArgument(3));
                return new StoredObject(path, CDN + path);
            });

        ProcessingStatusTracker tracker = new ProcessingStatusTracker(repository, storageService, clock);
        orchestrator = new WardrobeImagePipelineOrchestrator(
            new ImageFormatValidator(),
            new ImageResizeService(),
            generationClient,
            backgroundRemovalClient,
            imageDownloader,
            storageService,
            tracker,
            new ImagePipelineProperties(),
            clock,
            meterRegistry);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private WardrobeItemStatus storedStatus() {
        return repository.findStatus(itemId, OWNER).orElseThrow();
    }

    private String originalPath(ImageFormat format) {
        return StorageObjectPaths.original(OWNER, itemId, NOW.toEpochMilli(), format);
    }

    private String processedPath(ImageFormat format) {
        return StorageObjectPaths.processed(OWNER, itemId, format);
    }

    @Test
    void should_ReplaceOriginalWithProcessedImage_When_RemovalSucceeds() {
        byte[] jpeg = ImageTestData.opaqueJpeg(200, 200);
        when(backgroundRemovalClient.removeBackground(CDN + originalPath(ImageFormat.JPEG))).thenReturn(REMOVAL_RESULT_URL);
        when(imageDownloader.download(REMOVAL_RESULT_URL))
            .thenReturn(new DownloadedImage(ImageTestData.transparentPng(200, 200), "image/png"));

        PipelineResult result = orchestrator.processUpload(
            new DirectUploadCommand(itemId, OWNER, jpeg, "image/jpeg", true));

        assertThat(result.imageUrl()).isEqualTo(CDN + processedPath(ImageFormat.PNG));
        assertThat(result.backgroundRemovalStatus()).isEqualTo("completed");
        assertThat(result.message()).isEqualTo("Background removed successfully");
        assertThat(result.processingTimeMs()).isNotNull();

        WardrobeItemStatus status = storedStatus();
        assertThat(status.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(status.imageUrl()).isEqualTo(CDN + processedPath(ImageFormat.PNG));
        assertThat(status.startedAt()).isEqualTo(NOW);
        assertThat(status.completedAt()).isEqualTo(NOW);

        verify(storageService).ensureBucket();
        verify(storageService).remove(List.of(originalPath(ImageFormat.JPEG)));
    }

    @Test
    void should_StoreUploadByteIdenticalWithoutRemoval_When_PngAlreadyHasAlpha() {
        byte[] png = ImageTestData.transparentPng(64, 64);

        PipelineResult result = orchestrator.processUpload(
            new DirectUploadCommand(itemId, OWNER, png, "image/png", true));

        ArgumentCaptor<byte[]> stored = ArgumentCaptor.forClass(byte[].class);
        verify(storageService).store(eq(StoragePurpose.PROCESSED), eq(OWNER), eq(itemId), eq(ImageFormat.PNG), stored.capture());
        assertThat(stored.getValue()).isEqualTo(png);
        assertThat(result.message()).isEqualTo("Image already has transparent background");
        assertThat(result.imageUrl()).isEqualTo(CDN + processedPath(ImageFormat.PNG));
        assertThat(storedStatus().status()).isEqualTo(ProcessingStatus.COMPLETED);
        verifyNoInteractions(backgroundRemovalClient, imageDownloader);
    }

    @Test
    void should_KeepOriginalAndMarkFailed_When_RemovalFailsEveryAttempt() {
        byte[] jpeg = ImageTestData.opaqueJpeg(200, 200);
        when(backgroundRemovalClient.removeBackground(anyString()))
            .thenThrow(new BackgroundRemovalException("Background removal failed: model overloaded"));

        PipelineResult result = orchestrator.processUpload(
            new DirectUploadCommand(itemId, OWNER, jpeg, "image/jpeg", true));

        String originalUrl = CDN + originalPath(ImageFormat.JPEG);
        assertThat(result.imageUrl()).isEqualTo(originalUrl);
        assertThat(result.backgroundRemovalStatus()).isEqualTo("failed");
        assertThat(result.message()).isEqualTo("Image uploaded, background removal failed (original retained)");

        WardrobeItemStatus status = storedStatus();
        assertThat(status.status()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(status.imageUrl()).isEqualTo(originalUrl);
        assertThat(status.completedAt()).isNotNull();
        verify(storageService, never()).remove(any());
        assertThat(meterRegistry.counter("wardrobe.image.pipeline.degraded").count()).isEqualTo(1.0);
    }

    @Test
    void should_DegradeToOriginal_When_RemovalResultIsNotAnImage() {
        when(backgroundRemovalClient.removeBackground(anyString())).thenReturn(REMOVAL_RESULT_URL);
        when(imageDownloader.download(REMOVAL_RESULT_URL))
            .thenReturn(new DownloadedImage("<html>error</html>".getBytes(), "image/png"));

        PipelineResult result = orchestrator.processUpload(
            new DirectUploadCommand(itemId, OWNER, ImageTestData.opaqueJpeg(32, 32), "image/jpeg", true));

        assertThat(result.backgroundRemovalStatus()).isEqualTo("failed");
        assertThat(storedStatus().status()).isEqualTo(ProcessingStatus.FAILED);
    }

    @Test
    void should_CompleteWithOriginal_When_RemovalNotRequested() {
        PipelineResult result = orchestrator.processUpload(
            new DirectUploadCommand(itemId, OWNER, ImageTestData.opaqueJpeg(32, 32), "image/jpeg", false));

        assertThat(result.imageUrl()).isEqualTo(CDN + originalPath(ImageFormat.JPEG));
        assertThat(result.backgroundRemovalStatus()).isEqualTo("completed");
        assertThat(result.message()).isEqualTo("Image uploaded successfully");
        assertThat(storedStatus().status()).isEqualTo(ProcessingStatus.COMPLETED);
        verifyNoInteractions(backgroundRemovalClient);
    }

    @Test
    void should_RejectBeforeAnyExternalCall_When_ContentDoesNotMatchDeclaredType() {
        byte[] png = ImageTestData.opaquePng(32, 32);

        assertThatThrownBy(() -> orchestrator.processUpload(new DirectUploadCommand(itemId, OWNER, png, "image/jpeg", true)))
            .isInstanceOfSatisfying(ImageValidationException.class, ex -> {
                assertThat(ex.getErrorCode()).isEqualTo(PipelineErrorCode.VALIDATION_ERROR);
                assertThat(ex.getMessage()).isEqualTo("File content does not match declared type");
            });

        verifyNoInteractions(storageService, backgroundRemovalClient);
        assertThat(storedStatus().status()).isNull();
    }

    @Test
    void should_RejectOversizeAndUnsupportedUploads() {
        byte[] oversized = new byte[5 * 1024 * 1024 + 1];
        oversized[0] = (byte) 0xFF;
        oversized[1] = (byte) 0xD8;
        oversized[2] = (byte) 0xFF;

        assertThatThrownBy(() -> orchestrator.processUpload(
                new DirectUploadCommand(itemId, OWNER, oversized, "image/jpeg", true)))
            .isInstanceOf(ImageValidationException.class)
            .hasMessage("File too large. Maximum size: 5MB");
        assertThatThrownBy(() -> orchestrator.processUpload(
                new DirectUploadCommand(itemId, OWNER, new byte[] {'G', 'I', 'F', '8'}, "image/gif", true)))
            .isInstanceOf(ImageValidationException.class)
            .hasMessageStartingWith("Invalid file type");
        assertThatThrownBy(() -> orchestrator.processUpload(
                new DirectUploadCommand(itemId, OWNER, new byte[0], "image/jpeg", true)))
            .isInstanceOf(ImageValidationException.class)
            .hasMessage("No image file provided");

        verifyNoInteractions(storageService);
    }

    @Test
    void should_AnswerNotFound_When_ItemBelongsToSomeoneElse() {
        String stranger = "bbbbbbbb-2222-4222-8222-222222222222";

        assertThatThrownBy(() -> orchestrator.processUpload(
                new DirectUploadCommand(itemId, stranger, ImageTestData.opaqueJpeg(8, 8), "image/jpeg", true)))
            .isInstanceOfSatisfying(AssetNotFoundException.class,
                ex -> assertThat(ex.getErrorCode()).isEqualTo(PipelineErrorCode.NOT_FOUND));

        verifyNoInteractions(storageService, backgroundRemovalClient);
    }

    @Test
    void should_StoreSniffedFormatAndReportCost_When_GenerationSucceeds() {
        when(generationClient.generate("navy blazer, product photo"))
            .thenReturn(new GeneratedImage("https://replicate.delivery/blazer.png", Duration.ofSeconds(4)));
        when(backgroundRemovalClient.removeBackground("https://replicate.delivery/blazer.png")).thenReturn(REMOVAL_RESULT_URL);
        when(imageDownloader.download(REMOVAL_RESULT_URL))
            .thenReturn(new DownloadedImage(ImageTestData.webpHeader(), "image/png"));

        PipelineResult result = orchestrator.generateFromPrompt(
            new GenerateImageCommand(itemId, OWNER, "  navy blazer, product photo "));

        assertThat(result.imageUrl()).isEqualTo(CDN + processedPath(ImageFormat.WEBP));
        assertThat(result.storagePath()).isEqualTo(processedPath(ImageFormat.WEBP));
        assertThat(result.generationDurationMs()).isEqualTo(4000L);
        assertThat(result.costUnits()).isEqualTo(5);
        WardrobeItemStatus status = storedStatus();
        assertThat(status.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(status.imageUrl()).isEqualTo(result.imageUrl());
    }

    @Test
    void should_FailHardWithoutImage_When_GeneratedImageRemovalFails() {
        when(generationClient.generate("navy blazer, product photo"))
            .thenReturn(new GeneratedImage("https://replicate.delivery/blazer.png", Duration.ofSeconds(4)));
        when(backgroundRemovalClient.removeBackground(anyString()))
            .thenThrow(new BackgroundRemovalException("Background removal failed: model overloaded"));

        assertThatThrownBy(() -> orchestrator.generateFromPrompt(
                new GenerateImageCommand(itemId, OWNER, "navy blazer, product photo")))
            .isInstanceOfSatisfying(ImagePipelineException.class,
                ex -> assertThat(ex.getErrorCode()).isEqualTo(PipelineErrorCode.BACKGROUND_REMOVAL_FAILED));

        WardrobeItemStatus status = storedStatus();
        assertThat(status.status()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(status.imageUrl()).isNull();
        verify(storageService, never()).store(any(), anyString(), any(), any(), any());
    }

    @Test
    void should_ClearPreviousCompletionTime_When_RegenerationStarts() {
        jdbcTemplate.update(
            "UPDATE wardrobe_items SET bg_removal_status = 'completed', bg_removal_started_at = ?, bg_removal_completed_at = ? WHERE id = ?",
            Timestamp.from(NOW.minusSeconds(3600)), Timestamp.from(NOW.minusSeconds(1100)), itemId);
        AtomicReference<WardrobeItemStatus> duringGeneration = new AtomicReference<>();
        when(generationClient.generate(anyString())).thenAnswer(invocation -> {
            duringGeneration.set(storedStatus());
            return new GeneratedImage("https://replicate.delivery/blazer.png", Duration.ofSeconds(3));
        });
        when(backgroundRemovalClient.removeBackground(anyString())).thenReturn(REMOVAL_RESULT_URL);
        when(imageDownloader.download(REMOVAL_RESULT_URL))
            .thenReturn(new DownloadedImage(ImageTestData.transparentPng(16, 16), "image/png"));

        orchestrator.generateFromPrompt(new GenerateImageCommand(itemId, OWNER, "navy blazer, product photo"));

        assertThat(duringGeneration.get().status()).isEqualTo(ProcessingStatus.PROCESSING);
        assertThat(duringGeneration.get().startedAt()).isEqualTo(NOW);
        assertThat(duringGeneration.get().completedAt()).isNull();
        assertThat(storedStatus().completedAt()).isEqualTo(NOW);
    }

    @Test
    void should_ReportStorageError_When_RemovedImageCannotBeFetched() {
        when(generationClient.generate(anyString()))
            .thenReturn(new GeneratedImage("https://replicate.delivery/blazer.png", Duration.ofSeconds(4)));
        when(backgroundRemovalClient.removeBackground(anyString())).thenReturn(REMOVAL_RESULT_URL);
        when(imageDownloader.download(REMOVAL_RESULT_URL))
            .thenThrow(new BackgroundRemovalException("Failed to download processed image: HTTP 403"));

        assertThatThrownBy(() -> orchestrator.generateFromPrompt(
                new GenerateImageCommand(itemId, OWNER, "navy blazer, product photo")))
            .isInstanceOfSatisfying(ImageStorageException.class, ex -> {
                assertThat(ex.getErrorCode()).isEqualTo(PipelineErrorCode.STORAGE_ERROR);
                assertThat(ex.getHttpStatus().value()).isEqualTo(500);
            });

        WardrobeItemStatus status = storedStatus();
        assertThat(status.status()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(status.imageUrl()).isNull();
        verify(storageService, never()).store(any(), anyString(), any(), any(), any());
    }

    @Test
    void should_KeepRemovalErrorCode_When_RemovedImageIsNotAnImage() {
        when(generationClient.generate(anyString()))
            .thenReturn(new GeneratedImage("https://replicate.delivery/blazer.png", Duration.ofSeconds(4)));
        when(backgroundRemovalClient.removeBackground(anyString())).thenReturn(REMOVAL_RESULT_URL);
        when(imageDownloader.download(REMOVAL_RESULT_URL))
            .thenReturn(new DownloadedImage("<html>busy</html>".getBytes(), "image/png"));

        assertThatThrownBy(() -> orchestrator.generateFromPrompt(new GenerateImageCommand(itemId, OWNER, "scarf")))
            .isInstanceOfSatisfying(BackgroundRemovalException.class,
                ex -> assertThat(ex.getErrorCode()).isEqualTo(PipelineErrorCode.BACKGROUND_REMOVAL_FAILED));

        assertThat(storedStatus().status()).isEqualTo(ProcessingStatus.FAILED);
    }

    @Test
    void should_MarkFailed_When_GenerationFails() {
        when(generationClient.generate(anyString()))
            .thenThrow(new GenerationException("Image generation failed on all models. Last error: HTTP 500", true));

        assertThatThrownBy(() -> orchestrator.generateFromPrompt(new GenerateImageCommand(itemId, OWNER, "scarf")))
            .isInstanceOfSatisfying(GenerationException.class,
                ex -> assertThat(ex.getErrorCode()).isEqualTo(PipelineErrorCode.REPLICATE_ERROR));

        assertThat(storedStatus().status()).isEqualTo(ProcessingStatus.FAILED);
        verifyNoInteractions(backgroundRemovalClient);
    }

    @Test
    void should_DiscardUploadAndAnswerNotFound_When_ItemDeletedMidPipeline() {
        when(generationClient.generate(anyString()))
            .thenReturn(new GeneratedImage("https://replicate.delivery/blazer.png", Duration.ofSeconds(2)));
        when(backgroundRemovalClient.removeBackground(anyString())).thenAnswer(invocation -> {
            jdbcTemplate.update("DELETE FROM wardrobe_items WHERE id = ?", itemId);
            return REMOVAL_RESULT_URL;
        });
        when(imageDownloader.download(REMOVAL_RESULT_URL))
            .thenReturn(new DownloadedImage(ImageTestData.transparentPng(16, 16), "image/png"));

        assertThatThrownBy(() -> orchestrator.generateFromPrompt(new GenerateImageCommand(itemId, OWNER, "scarf")))
            .isInstanceOf(AssetNotFoundException.class);

        verify(storageService).remove(List.of(processedPath(ImageFormat.PNG)));
    }

    @Test
    void should_RejectBlankPrompt() {
        assertThatThrownBy(() -> orchestrator.generateFromPrompt(new GenerateImageCommand(itemId, OWNER, "   ")))
            .isInstanceOf(ImageValidationException.class)
            .hasMessageStartingWith("Missing required fields");

        verifyNoInteractions(generationClient, storageService);
    }
}
