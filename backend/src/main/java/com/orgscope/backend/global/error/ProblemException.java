package com.orgscope.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:orgscope:";

    private final ErrorKind kind;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ErrorKind kind, String code) {
        this(kind, code, null);
    }

    public ProblemException(ErrorKind kind, String code, String detail) {
        this(kind.status(), kind, code, detail);
    }

    protected ProblemException(HttpStatus status, ErrorKind kind, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public static ProblemException problem(ErrorKind kind, String code, String detail) {
        return new ProblemException(kind, code, detail);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
