package com.pdftranslator.backend.handlers;

import com.pdftranslator.backend.dto.ApiResponse;
import com.pdftranslator.backend.exceptions.BadRequestException;
import com.pdftranslator.backend.exceptions.ConflictException;
import com.pdftranslator.backend.exceptions.ForbiddenException;
import com.pdftranslator.backend.exceptions.InsufficientCreditsException;
import com.pdftranslator.backend.exceptions.JobExpiredException;
import com.pdftranslator.backend.exceptions.ProviderException;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;
import com.pdftranslator.backend.exceptions.UnsupportedDocumentException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private <T> ResponseEntity<ApiResponse<T>> buildResponse(
            HttpStatus status,
            String message,
            List<String> errors
    ) {
        ApiResponse<T> body = ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .timestamp(LocalDateTime.now())
                .errors(errors)
                .build();

        return ResponseEntity.status(status).body(body);
    }

    // 404 - job or stored file not found
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 409 - job not in a state that allows the request
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ConflictException ex) {
        return buildResponse(HttpStatus.CONFLICT, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 410 - retention window over
    @ExceptionHandler(JobExpiredException.class)
    public ResponseEntity<ApiResponse<Void>> handleExpired(JobExpiredException ex) {
        return buildResponse(HttpStatus.GONE, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(BadRequestException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 - unreadable, encrypted or oversized document
    @ExceptionHandler(UnsupportedDocumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnsupportedDocument(UnsupportedDocumentException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 - multipart limit hit before the request reached the controller
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUpload(MaxUploadSizeExceededException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "File is too large", List.of(String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadParameter(Exception ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Invalid request", List.of(String.valueOf(ex.getMessage())));
    }

    // 402
    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ApiResponse<Void>> handleInsufficientCredits(InsufficientCreditsException ex) {
        return buildResponse(HttpStatus.PAYMENT_REQUIRED, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 403 - job owned by someone else
    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiResponse<Void>> handleForbidden(ForbiddenException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 403
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAccessDenied(AccessDeniedException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, "Access denied", List.of(ex.getMessage()));
    }

    // 502 - provider failed while the request was being served
    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiResponse<Void>> handleProvider(ProviderException ex) {
        log.warn("[Http] Provider error provider={}: {}", ex.getProvider(), ex.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY, "Upstream provider error", List.of(ex.getMessage()));
    }

    // 503 - job queue full
    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ApiResponse<Void>> handleQueueFull(TaskRejectedException ex) {
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Job queue is full, try again later", List.of());
    }

    // 400 - @Valid errors
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.toList());

        return buildResponse(HttpStatus.BAD_REQUEST, "Validation failed", errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        String msg = ex.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = "Invalid request";
        }
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(msg));
    }

    // 500
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("[Http] Unhandled error", ex);
        return buildResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal server error",
                List.of(String.valueOf(ex.getMessage()))
        );
    }
}
