package com.optionsbacktester.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 400),
    NOT_FOUND("NOT_FOUND", 404),
    DATA_GAP("DATA_GAP", 422),
    UNRECOVERABLE_DATA("UNRECOVERABLE_DATA", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    MARKET_DATA_UNAVAILABLE("MARKET_DATA_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
