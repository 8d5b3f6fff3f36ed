package com.cityhunt.error;

public class HuntException extends RuntimeException {
    private final ErrorKind kind;
    private final String detail;

    public HuntException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.detail = null;
    }

    public HuntException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.detail = cause == null ? null : cause.getMessage();
    }

    public ErrorKind kind() { return kind; }
    public String detail() { return detail; }

    public static HuntException invalidArgument(String message) {
        return new HuntException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static HuntException notFound(String message) {
        return new HuntException(ErrorKind.NOT_FOUND, message);
    }

    public static HuntException permissionDenied(String message) {
        return new HuntException(ErrorKind.PERMISSION_DENIED, message);
    }

    public static HuntException internal(String message, Throwable cause) {
        return new HuntException(ErrorKind.INTERNAL, message, cause);
    }
}
