package com.orgscope.backend.global.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        ErrorKind kind
) {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:orgscope:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        return of(httpStatus, ErrorKind.fromStatus(httpStatus), code, detail, instance);
    }

    public static ProblemResponse of(HttpStatus httpStatus, ErrorKind kind, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                DEFAULT_TYPE_PREFIX + normalized,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode,
                kind
        );
    }

    public static ProblemResponse from(ProblemException ex, String instance) {
        HttpStatus status = ex.getKind() != null ? ex.getKind().status() : HttpStatus.valueOf(ex.getStatusCode().value());
        return of(status, ex.getKind(), ex.getCode(), ex.getDetailMessage(), instance);
    }
}
