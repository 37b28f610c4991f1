package net.myaioutfit.application.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import net.myaioutfit.config.ImagePipelineProperties;
import net.myaioutfit.exception.AssetNotFoundException;
import net.myaioutfit.exception.BackgroundRemovalException;
import net.myaioutfit.exception.GenerationException;
import net.myaioutfit.exception.ImagePipelineException;
import net.myaioutfit.exception.ImageStorageException;
import net.myaioutfit.exception.ImageValidationException;
import net.myaioutfit.model.image.ImageFormat;
import net.myaioutfit.model.image.StoragePurpose;
import net.myaioutfit.service.ai.BackgroundRemovalClient;
import net.myaioutfit.service.ai.GeneratedImage;
import net.myaioutfit.service.ai.ImageGenerationClient;
import net.myaioutfit.service.image.DownloadedImage;
import net.myaioutfit.service.image.ImageFormatValidator;
import net.myaioutfit.service.image.ImageResizeService;
import net.myaioutfit.service.image.RemoteImageDownloader;
import net.myaioutfit.service.image.ResizedImage;
import net.myaioutfit.service.status.CompletionOutcome;
import net.myaioutfit.service.status.ProcessingStatusTracker;
import net.myaioutfit.service.storage.StoredObject;
import net.myaioutfit.service.storage.WardrobeImageStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Sequences validation, generation, background removal, resizing, storage and status tracking
 * for wardrobe item images.
 *
 * <p>Two entry flows:</p>
 * <ul>
 *   <li>{@link #processUpload}: direct upload. A failed background removal degrades to the
 *       original image; the item ends {@code failed} but keeps a usable {@code image_url}.</li>
 *   <li>{@link #generateFromPrompt}: prompt generation. There is no earlier image to fall back
 *       to, so generation and removal failures are hard failures.</li>
 * </ul>
 * <p>Input, ownership and bucket checks run before any status write or external call. Once an item
 * is marked {@code processing} every exit path leaves it {@code completed} or {@code failed}.</p>
 */
@Service
public class WardrobeImagePipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(WardrobeImagePipelineOrchestrator.class);

    static final String MESSAGE_ALREADY_TRANSPARENT = "Image already has transparent background";
    static final String MESSAGE_REMOVED = "Background removed successfully";
    static final String MESSAGE_DEGRADED = "Image uploaded, background removal failed (original retained)";
    static final String MESSAGE_UPLOADED = "Image uploaded successfully";

    private static final String STATUS_COMPLETED = "completed";
    private static final String STATUS_FAILED = "failed";
    private static final String FLOW_UPLOAD = "upload";
    private static final String FLOW_GENERATE = "generate";

    private final ImageFormatValidator formatValidator;
    private final ImageResizeService resizeService;
    private final ImageGenerationClient generationClient;
    private final BackgroundRemovalClient backgroundRemovalClient;
    private final RemoteImageDownloader imageDownloader;
    private final WardrobeImageStorageService storageService;
    private final ProcessingStatusTracker statusTracker;
    private final ImagePipelineProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Counter degradedRuns;

    public WardrobeImagePipelineOrchestrator(ImageFormatValidator formatValidator,
                                             ImageResizeService resizeService,
                                             ImageGenerationClient generationClient,
                                             BackgroundRemovalClient backgroundRemovalClient,
                                             RemoteImageDownloader imageDownloader,
                                             WardrobeImageStorageService storageService,
                                             ProcessingStatusTracker statusTracker,
                                             ImagePipelineProperties properties,
                                             Clock clock,
                                             MeterRegistry meterRegistry) {
        this.formatValidator = formatValidator;
        this.resizeService = resizeService;
        this.generationClient = generationClient;
        this.backgroundRemovalClient = backgroundRemovalClient;
        this.imageDownloader = imageDownloader;
        this.storageService = storageService;
        this.statusTracker = statusTracker;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.degradedRuns = meterRegistry.counter("wardrobe.image.pipeline.degraded");
    }

    /**
     * Flow A: validates an uploaded image, optionally removes its background, and stores it.
     */
    public PipelineResult processUpload(DirectUploadCommand command) {
        long startedAt = clock.millis();
        Timer.Sample sample = Timer.start(meterRegistry);
        recordRun(FLOW_UPLOAD);
        try {
            PipelineResult result = runUpload(command, startedAt);
            recordOutcome(FLOW_UPLOAD, sample, STATUS_FAILED.equals(result.backgroundRemovalStatus()) ? "degraded" : "completed");
            return result;
        } catch (RuntimeException ex) {
            recordOutcome(FLOW_UPLOAD, sample, "failed");
            throw ex;
        }
    }

    /**
     * Flow B: generates an image from a prompt, removes its background, and stores it.
     */
    public PipelineResult generateFromPrompt(GenerateImageCommand command) {
        Timer.Sample sample = Timer.start(meterRegistry);
        recordRun(FLOW_GENERATE);
        try {
            PipelineResult result = runGeneration(command);
            recordOutcome(FLOW_GENERATE, sample, "completed");
            return result;
        } catch (RuntimeException ex) {
            recordOutcome(FLOW_GENERATE, sample, "failed");
            throw ex;
        }
    }

    private PipelineResult runUpload(DirectUploadCommand command, long startedAt) {
        ImageFormat format = validateUpload(command);
        UUID assetId = command.assetId();
        String ownerId = command.ownerId();
        requireOwnedItem(assetId, ownerId);
        storageService.ensureBucket();

        if (command.removeBackground()
            && format == ImageFormat.PNG
            && formatValidator.hasAlphaChannel(command.imageBytes())) {
            logger.info("Item {}: upload already has an alpha channel; skipping background removal", assetId);
            StoredObject stored = storageService.store(StoragePurpose.PROCESSED, ownerId, assetId, format, command.imageBytes());
            completeOrDiscard(assetId, ownerId, stored);
            return PipelineResult.upload(stored.publicUrl(), stored.path(), STATUS_COMPLETED,
                MESSAGE_ALREADY_TRANSPARENT, clock.millis() - startedAt);
        }

        StoredObject original = storageService.store(StoragePurpose.ORIGINAL, ownerId, assetId, format, command.imageBytes());
        logger.info("Item {}: stored original at {}", assetId, original.path());

        if (!command.removeBackground()) {
            completeOrDiscard(assetId, ownerId, original);
            return PipelineResult.upload(original.publicUrl(), original.path(), STATUS_COMPLETED,
                MESSAGE_UPLOADED, clock.millis() - startedAt);
        }

        statusTracker.markProcessing(assetId, ownerId);
        StoredObject processed;
        try {
            String resultUrl = backgroundRemovalClient.removeBackground(original.publicUrl());
            DownloadedImage downloaded = imageDownloader.download(resultUrl);
            ImageFormat resultFormat = resolveResultFormat(assetId, downloaded);
            ResizedImage resized = resizeBestEffort(assetId, downloaded.bytes(), resultFormat);
            processed = storageService.store(StoragePurpose.PROCESSED, ownerId, assetId, resized.format(), resized.bytes());
        } catch (RuntimeException ex) {
            // Only this branch may turn an error into a partial success
            logger.warn("Item {}: background removal failed, keeping original {}: {}", assetId, original.path(), ex.getMessage());
            degradedRuns.increment();
            statusTracker.markFailed(assetId, ownerId, original.publicUrl());
            return PipelineResult.upload(original.publicUrl(), original.path(), STATUS_FAILED,
                MESSAGE_DEGRADED, clock.millis() - startedAt);
        }

        // The processed object supersedes the original whatever the final status write does
        storageService.remove(List.of(original.path()));
        completeOrDiscard(assetId, ownerId, processed);
        logger.info("Item {}: background removed, processed image at {}", assetId, processed.path());
        return PipelineResult.upload(processed.publicUrl(), processed.path(), STATUS_COMPLETED,
            MESSAGE_REMOVED, clock.millis() - startedAt);
    }

    private PipelineResult runGeneration(GenerateImageCommand command) {
        if (command.assetId() == null || !StringUtils.hasText(command.ownerId()) || !StringUtils.hasText(command.prompt())) {
            throw new ImageValidationException("Missing required fields: wardrobe_item_id, user_id, prompt");
        }
        UUID assetId = command.assetId();
        String ownerId = command.ownerId();
        requireOwnedItem(assetId, ownerId);
        storageService.ensureBucket();

        statusTracker.markProcessing(assetId, ownerId);

        GeneratedImage generated;
        try {
            generated = generationClient.generate(command.prompt().trim());
        } catch (RuntimeException ex) {
            logger.warn("Item {}: image generation failed: {}", assetId, ex.getMessage());
            statusTracker.markFailed(assetId, ownerId, null);
            throw ex instanceof ImagePipelineException ? ex
                : new GenerationException("Image generation failed: " + ex.getMessage(), false, ex);
        }
        logger.info("Item {}: generated image in {}ms", assetId, generated.elapsed().toMillis());

        String resultUrl;
        try {
            resultUrl = backgroundRemovalClient.removeBackground(generated.imageUrl());
        } catch (RuntimeException ex) {
            throw failRemoval(assetId, ownerId, ex);
        }

        // Fetching the finished result is part of storing it
        DownloadedImage downloaded;
        try {
            downloaded = imageDownloader.download(resultUrl);
        } catch (RuntimeException ex) {
            logger.error("Item {}: failed to fetch background-removed image {}: {}", assetId, resultUrl, ex.getMessage());
            statusTracker.markFailed(assetId, ownerId, null);
            boolean retryable = ex instanceof ImagePipelineException pipelineException && pipelineException.isRetryable();
            throw new ImageStorageException("Failed to store generated image: " + ex.getMessage(), retryable, ex);
        }

        ImageFormat resultFormat;
        try {
            resultFormat = resolveResultFormat(assetId, downloaded);
        } catch (RuntimeException ex) {
            throw failRemoval(assetId, ownerId, ex);
        }

        StoredObject stored;
        try {
            stored = storageService.store(StoragePurpose.PROCESSED, ownerId, assetId, resultFormat, downloaded.bytes());
        } catch (RuntimeException ex) {
            logger.error("Item {}: failed to store generated image: {}", assetId, ex.getMessage());
            statusTracker.markFailed(assetId, ownerId, null);
            throw ex;
        }

        completeOrDiscard(assetId, ownerId, stored);
        return PipelineResult.generated(stored.publicUrl(), stored.path(),
            generated.elapsed().toMillis(), properties.getCostUnitsPerGeneration());
    }

    private BackgroundRemovalException failRemoval(UUID assetId, String ownerId, RuntimeException ex) {
        logger.warn("Item {}: background removal of generated image failed: {}", assetId, ex.getMessage());
        statusTracker.markFailed(assetId, ownerId, null);
        return ex instanceof BackgroundRemovalException removalException ? removalException
            : new BackgroundRemovalException("Background removal failed: " + ex.getMessage(), ex);
    }

    private ImageFormat validateUpload(DirectUploadCommand command) {
        if (command.assetId() == null) {
            throw new ImageValidationException("Missing required field: itemId");
        }
        byte[] bytes = command.imageBytes();
        if (bytes == null || bytes.length == 0) {
            throw new ImageValidationException("No image file provided");
        }
        if (bytes.length > properties.getMaxSourceBytes()) {
            throw new ImageValidationException(command.assetId().toString(),
                "File too large. Maximum size: " + (properties.getMaxSourceBytes() / (1024 * 1024)) + "MB");
        }
        String declared = command.declaredMimeType() == null ? ""
            : command.declaredMimeType().trim().toLowerCase(Locale.ROOT);
        ImageFormat format = ImageFormat.fromMimeType(declared)
            .filter(candidate -> properties.getAllowedMimeTypes().contains(candidate.mimeType()))
            .orElseThrow(() -> new ImageValidationException(command.assetId().toString(),
                "Invalid file type. Allowed: " + String.join(", ", properties.getAllowedMimeTypes())));
        if (!formatValidator.matches(bytes, format.mimeType())) {
            logger.warn("Rejected upload for item {} by owner {}: content does not match declared type {}",
                command.assetId(), command.ownerId(), declared);
            throw new ImageValidationException(command.assetId().toString(),
                "File content does not match declared type");
        }
        return format;
    }

    private void requireOwnedItem(UUID assetId, String ownerId) {
        if (!statusTracker.isOwnedBy(assetId, ownerId)) {
            throw new AssetNotFoundException(assetId.toString());
        }
    }

    private void completeOrDiscard(UUID assetId, String ownerId, StoredObject stored) {
        CompletionOutcome outcome = statusTracker.completeIfPresent(assetId, ownerId, stored);
        if (outcome == CompletionOutcome.ASSET_GONE) {
            throw new AssetNotFoundException(assetId.toString());
        }
        if (outcome == CompletionOutcome.WRITE_FAILED) {
            logger.error("Item {}: image stored at {} but the completed status was not recorded", assetId, stored.path());
        }
    }

    /**
     * The sniffed format wins over the declared content type; unrecognisable bytes fail the removal stage.
     */
    private ImageFormat resolveResultFormat(UUID assetId, DownloadedImage downloaded) {
        ImageFormat sniffed = formatValidator.detect(downloaded.bytes())
            .orElseThrow(() -> new BackgroundRemovalException("Background removal returned unrecognized image data"));
        ImageFormat declared = declaredResultFormat(downloaded.contentType());
        if (declared != sniffed) {
            logger.debug("Item {}: result declared as {} but bytes are {}; using {}",
                assetId, declared.mimeType(), sniffed.mimeType(), sniffed.mimeType());
        }
        return sniffed;
    }

    private static ImageFormat declaredResultFormat(String contentType) {
        if (contentType != null) {
            String normalized = contentType.toLowerCase(Locale.ROOT);
            if (normalized.contains("webp")) {
                return ImageFormat.WEBP;
            }
            if (normalized.contains("jpeg") || normalized.contains("jpg")) {
                return ImageFormat.JPEG;
            }
        }
        return ImageFormat.PNG;
    }

    private ResizedImage resizeBestEffort(UUID assetId, byte[] bytes, ImageFormat format) {
        try {
            return resizeService.resize(bytes, format, properties.getResizeMaxDimension());
        } catch (IOException | RuntimeException ex) {
            logger.warn("Item {}: resize skipped, storing unresized {} result: {}", assetId, format.mimeType(), ex.getMessage());
            return new ResizedImage(bytes, format, -1, -1, false);
        }
    }

    private void recordRun(String flow) {
        meterRegistry.counter("wardrobe.image.pipeline.runs", "flow", flow).increment();
    }

    private void recordOutcome(String flow, Timer.Sample sample, String outcome) {
        meterRegistry.counter("wardrobe.image.pipeline.outcomes", "flow", flow, "outcome", outcome).increment();
        sample.stop(meterRegistry.timer("wardrobe.image.pipeline.duration", "flow", flow, "outcome", outcome));
    }
}
