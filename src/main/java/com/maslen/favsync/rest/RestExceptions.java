package com.maslen.favsync.rest;

import com.maslen.favsync.exceptions.FavSyncException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class RestExceptions {

    @ExceptionHandler(FavSyncException.class)
    public ResponseEntity<ApiError> handleFavSyncError(FavSyncException error, HttpServletRequest request) {
        log.warn("[API] Error returned by {} {}: {} - {} - {}", request.getMethod(), request.getRequestURI(),
                error.getClass().getSimpleName(), error.getErrorCode(), error.getMessage());
        return ResponseEntity.status(error.getStatus()).body(error.toApiError());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException error,
            HttpServletRequest request) {
        ApiError result = new ApiError(400, "invalid-" + error.getName(), "Invalid value for " + error.getName());
        log.warn("[API] Input error returned by {} {}: {} => {}", request.getMethod(), request.getRequestURI(),
                error.getMessage(), result);
        return ResponseEntity.status(400).body(result);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MissingServletRequestParameterException.class })
    public ResponseEntity<ApiError> handleInputError(Exception error, HttpServletRequest request) {
        log.warn("[API] Input error returned by {} {}: {}", request.getMethod(), request.getRequestURI(),
                error.getMessage());
        return ResponseEntity.status(400).body(new ApiError(400, "invalid-input", "Invalid request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleOtherError(Exception error, HttpServletRequest request) {
        if (error instanceof ErrorResponse framework) {
            int status = framework.getStatusCode().value();
            var body = framework.getBody();
            var result = new ApiError(status, body.getTitle(), body.getDetail());
            log.warn("[API] Framework error returned by {} {}: {} => {}", request.getMethod(),
                    request.getRequestURI(), status, result);
            return ResponseEntity.status(status).body(result);
        }
        log.error("[API] Generic error returned by {} {}: {} - {}", request.getMethod(), request.getRequestURI(),
                error.getClass().getSimpleName(), error.getMessage(), error);
        return ResponseEntity.status(500).body(new ApiError(500, "internal-error", "Internal server error"));
    }
}
