package com.moneytrail.insights.controller.dto;

import com.moneytrail.insights.web.RequestContextHolder;
import java.util.Map;

/**
 * Body of every non-2xx analytics response. {@code details} names the offending fields or parameters and is
 * empty when there is nothing more specific to report.
 */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : details;
    }

    /** An error for the request being served, tagged with its trace id when one was assigned. */
    public static ErrorResponseDto forCurrentRequest(String code, String message, Map<String, Object> details) {
        return new ErrorResponseDto(code, message, details, RequestContextHolder.traceId().orElse(null));
    }
}
