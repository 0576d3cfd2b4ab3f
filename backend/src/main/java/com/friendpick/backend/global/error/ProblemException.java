package com.friendpick.backend.global.error;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Domain failure with a stable upper-snake code, surfaced to callers as-is.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    /**
     * 유니크/체크 제약 위반을 제약 이름으로 판별해 409 코드로 바꾼다. 다른 위반이면 원래 예외를 돌려준다.
     */
    public static RuntimeException translateConstraint(
            DataIntegrityViolationException ex,
            String constraintName,
            String code
    ) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        if (message != null && message.contains(constraintName)) {
            return new ProblemException(HttpStatus.CONFLICT, code, null, ex);
        }
        return ex;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
