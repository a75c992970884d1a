package com.codefarm.shorturl.exception;

import com.codefarm.shorturl.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(ShortcodeConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ShortcodeConflictException ex) {
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(ShortcodeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ShortcodeNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ShortcodeExpiredException.class)
    public ResponseEntity<ErrorResponse> handleExpired(ShortcodeExpiredException ex) {
        return respond(HttpStatus.GONE, ex);
    }

    @ExceptionHandler(ShortcodeAllocationException.class)
    public ResponseEntity<ErrorResponse> handleAllocation(ShortcodeAllocationException ex) {
        log.error("Short code allocation failed: {}", ex.getMessage());
        return internalError();
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableBody(Exception ex) {
        // field-level rejections raised while binding the body arrive wrapped by Jackson
        if (NestedExceptionUtils.getMostSpecificCause(ex) instanceof ValidationException validation) {
            return respond(HttpStatus.BAD_REQUEST, validation);
        }
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Invalid request body", "Request body must be a JSON object"));
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnknownRoute(Exception ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Route not found", "The requested endpoint does not exist"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error while processing request", ex);
        return internalError();
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ShortUrlException ex) {
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getError(), ex.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> internalError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal server error", "An unexpected error occurred"));
    }
}
