package com.assetdesk.backend.global.error;

import com.assetdesk.backend.global.result.Result;

import org.springframework.http.HttpStatus;

/**
 * Converts business error values into {@link ProblemException}s at the web boundary.
 */
public final class BusinessErrors {

    private BusinessErrors() {
    }

    public static ProblemException toProblem(BusinessError error) {
        HttpStatus status = switch (error.category()) {
            case VALIDATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
        };
        return new ProblemException(status, error.code(), error.detail());
    }

    public static <T, E extends BusinessError> T unwrap(Result<T, E> result) {
        return result.orElseThrow(BusinessErrors::toProblem);
    }
}
