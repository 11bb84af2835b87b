package dev.newsroom.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced by the admin article API, each bound to the HTTP status it renders as.
 */
public enum ErrorKind {
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "error.unauthorized"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "error.forbidden"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "error.not_found"),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "error.bad_request"),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "error.internal_server_error");

    private final HttpStatus status;
    private final String errorKey;

    ErrorKind(HttpStatus status, String errorKey) {
        this.status = status;
        this.errorKey = errorKey;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorKey() {
        return errorKey;
    }

    /**
     * Authorization failures are never re-wrapped by workflow error handling.
     */
    public boolean isAuthorization() {
        return this == UNAUTHORIZED || this == FORBIDDEN;
    }
}
