package com.optionsbacktester.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import lombok.Getter;

/**
 * Success envelope for every JSON endpoint. {@code warnings} carries non-fatal
 * notes about the payload (for example, a backtest that needed estimated
 * valuations) and is omitted when empty.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<String> warnings;

    private final Instant timestamp;

    private ApiResponse(T data, List<String> warnings) {
        this.success = true;
        this.data = data;
        this.warnings = warnings;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, List.of());
    }

    public static <T> ApiResponse<T> withWarnings(T data, List<String> warnings) {
        return new ApiResponse<>(data, warnings != null ? List.copyOf(warnings) : List.of());
    }
}
