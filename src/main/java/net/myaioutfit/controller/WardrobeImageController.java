package net.myaioutfit.controller;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.myaioutfit.application.pipeline.DirectUploadCommand;
import net.myaioutfit.application.pipeline.GenerateImageCommand;
import net.myaioutfit.application.pipeline.PipelineResult;
import net.myaioutfit.application.pipeline.WardrobeImagePipelineOrchestrator;
import net.myaioutfit.controller.dto.GenerateImageRequest;
import net.myaioutfit.controller.dto.PipelineResponse;
import net.myaioutfit.controller.dto.ProcessingStatusResponse;
import net.myaioutfit.exception.AssetNotFoundException;
import net.myaioutfit.exception.CallerAuthenticationException;
import net.myaioutfit.exception.ImageValidationException;
import net.myaioutfit.service.auth.CallerIdentityResolver;
import net.myaioutfit.service.status.ProcessingStatusTracker;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * HTTP entry points for the wardrobe image pipeline.
 *
 * <p>Every route authenticates the bearer token first; request bodies are only inspected for
 * an authenticated caller.</p>
 */
@RestController
@RequestMapping("/api/wardrobe-images")
@Slf4j
public class WardrobeImageController {

    private static final String BEARER_PREFIX = "bearer ";

    private final WardrobeImagePipelineOrchestrator orchestrator;
    private final ProcessingStatusTracker statusTracker;
    private final CallerIdentityResolver callerIdentityResolver;

    public WardrobeImageController(WardrobeImagePipelineOrchestrator orchestrator,
                                   ProcessingStatusTracker statusTracker,
                                   CallerIdentityResolver callerIdentityResolver) {
        this.orchestrator = orchestrator;
        this.statusTracker = statusTracker;
        this.callerIdentityResolver = callerIdentityResolver;
    }

    /**
     * Flow A: direct upload with optional background removal.
     * {@code removeBackground} is on unless it is the literal {@code false}.
     */
    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PipelineResponse> processUpload(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "itemId", required = false) String itemId,
            @RequestParam(value = "removeBackground", required = false) String removeBackground,
            @RequestParam(value = "userId", required = false) String userId) {
        String callerId = authenticate(authorization);
        requireSameOwner(callerId, userId);

        UUID assetId = parseAssetId(itemId, "itemId");
        byte[] bytes = readUpload(image);
        String declaredType = image == null ? null : image.getContentType();
        boolean removal = !"false".equals(removeBackground);

        log.info("Upload for item {} by {} ({} bytes, type {}, removeBackground={})",
            assetId, callerId, bytes.length, declaredType, removal);
        PipelineResult result = orchestrator.processUpload(
            new DirectUploadCommand(assetId, callerId, bytes, declaredType, removal));
        return ResponseEntity.ok(PipelineResponse.from(result));
    }

    /**
     * Flow B: generate from a text prompt, then remove the background.
     */
    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineResponse> generate(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) GenerateImageRequest request) {
        String callerId = authenticate(authorization);
        if (request == null
            || !StringUtils.hasText(request.wardrobeItemId())
            || !StringUtils.hasText(request.userId())
            || !StringUtils.hasText(request.prompt())) {
            throw new ImageValidationException("Missing required fields: wardrobe_item_id, user_id, prompt");
        }
        requireSameOwner(callerId, request.userId());
        UUID assetId = parseAssetId(request.wardrobeItemId(), "wardrobe_item_id");

        log.info("Generation for item {} by {}", assetId, callerId);
        PipelineResult result = orchestrator.generateFromPrompt(
            new GenerateImageCommand(assetId, callerId, request.prompt()));
        return ResponseEntity.ok(PipelineResponse.from(result));
    }

    @GetMapping("/{itemId}/status")
    public ResponseEntity<ProcessingStatusResponse> status(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String itemId) {
        String callerId = authenticate(authorization);
        UUID assetId = parseAssetId(itemId, "itemId");
        return statusTracker.findStatus(assetId, callerId)
            .map(ProcessingStatusResponse::from)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new AssetNotFoundException(assetId.toString()));
    }

    private String authenticate(String authorization) {
        if (!StringUtils.hasText(authorization)
            || !authorization.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            throw CallerAuthenticationException.unauthenticated("Missing authorization header");
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw CallerAuthenticationException.unauthenticated("Missing authorization header");
        }
        return callerIdentityResolver.resolveCallerId(token);
    }

    private static void requireSameOwner(String callerId, String requestedOwnerId) {
        if (StringUtils.hasText(requestedOwnerId) && !callerId.equals(requestedOwnerId.trim())) {
            log.warn("Caller {} attempted to act for owner {}", callerId, requestedOwnerId);
            throw CallerAuthenticationException.ownerMismatch();
        }
    }

    private static UUID parseAssetId(String rawId, String fieldName) {
        if (!StringUtils.hasText(rawId)) {
            throw new ImageValidationException("Missing required field: " + fieldName);
        }
        try {
            return UUID.fromString(rawId.trim());
        } catch (IllegalArgumentException ex) {
            throw new ImageValidationException("Invalid " + fieldName + ": " + rawId);
        }
    }

    private static byte[] readUpload(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            return new byte[0];
        }
        try {
            return image.getBytes();
        } catch (IOException ex) {
            log.warn("Could not read uploaded file '{}': {}", image.getOriginalFilename(), ex.getMessage());
            throw new ImageValidationException("Unable to read uploaded file");
        }
    }
}
