package com.cityhunt.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    UNAUTHENTICATED("unauthenticated", HttpStatus.UNAUTHORIZED),
    INVALID_ARGUMENT("invalid-argument", HttpStatus.BAD_REQUEST),
    NOT_FOUND("not-found", HttpStatus.NOT_FOUND),
    PERMISSION_DENIED("permission-denied", HttpStatus.FORBIDDEN),
    FAILED_PRECONDITION("failed-precondition", HttpStatus.PRECONDITION_FAILED),
    INTERNAL("internal", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;

    ErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() { return code; }
    public HttpStatus status() { return status; }
}
