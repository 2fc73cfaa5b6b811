package com.orgscope.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Stable error categories exposed to callers. Each kind maps to exactly one HTTP status.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    BUSINESS_RULE(HttpStatus.UNPROCESSABLE_ENTITY),
    UNAUTHORIZED(HttpStatus.FORBIDDEN);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    public static ErrorKind fromStatus(HttpStatus status) {
        for (ErrorKind kind : values()) {
            if (kind.status == status) {
                return kind;
            }
        }
        return null;
    }
}
