package com.cityhunt.api;

import com.cityhunt.error.ErrorKind;
import com.cityhunt.error.HuntException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class HuntExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(HuntExceptionHandler.class);

    @ExceptionHandler(HuntException.class)
    public ResponseEntity<ErrorResponse> handleHunt(HuntException ex) {
        if (ex.kind() == ErrorKind.INTERNAL) {
            log.error("{} ({})", ex.getMessage(), ex.detail(), ex);
        }
        return body(ex.kind(), ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(ErrorKind.INVALID_ARGUMENT, "Request body is missing or malformed.");
    }

    @ExceptionHandler({HttpRequestMethodNotSupportedException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnsupported(Exception ex) {
        return body(ErrorKind.INVALID_ARGUMENT, ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return body(ErrorKind.NOT_FOUND, "No such operation.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled failure", ex);
        return body(ErrorKind.INTERNAL, "An error occurred while processing your request.");
    }

    private ResponseEntity<ErrorResponse> body(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.status()).body(new ErrorResponse(false, kind.code(), message));
    }

    public record ErrorResponse(boolean success, String error, String message) {}
}
