package net.myaioutfit.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.myaioutfit.controller.support.ErrorResponseUtils;
import net.myaioutfit.exception.ImagePipelineException;
import net.myaioutfit.exception.PipelineErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Renders pipeline failures as {@code {success:false, error, error_code}}.
 */
@RestControllerAdvice
@Slf4j
public class PipelineExceptionHandler {

    @ExceptionHandler(ImagePipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(ImagePipelineException ex) {
        if (ex.getHttpStatus().is5xxServerError()) {
            log.error("Pipeline failure [{}] for asset {}: {}", ex.getErrorCode(), ex.getAssetId(), ex.getMessage(), ex);
        } else {
            log.info("Pipeline request rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ErrorResponseUtils.error(ex.getHttpStatus(), ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ErrorResponseUtils.error("Method not allowed", PipelineErrorCode.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return ErrorResponseUtils.error("File too large", PipelineErrorCode.VALIDATION_ERROR);
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MissingServletRequestPartException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MultipartException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        log.info("Malformed pipeline request: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Invalid request", PipelineErrorCode.VALIDATION_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected pipeline error: {}", ex.getMessage(), ex);
        return ErrorResponseUtils.error("Internal server error", PipelineErrorCode.INTERNAL_ERROR);
    }
}
