package com.shopnest.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Response envelope shared by every endpoint:
 * <pre>
 * { "success": true,  "message": "...", "data": {...} }
 * { "success": false, "error": { "code": "...", "message": "...", "details": ... } }
 * </pre>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;

    /** Human-readable message, success only. */
    private String message;

    private T data;

    private ApiError error;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ApiError(String code, String message, Object details) {
    }

    public static <U> ApiResponse<U> ok(String message, U data) {
        return ApiResponse.<U>builder()
                .success(true)
                .message(message)
                .data(data)
                .build();
    }

    public static ApiResponse<Void> failure(String code, String message, Object details) {
        return ApiResponse.<Void>builder()
                .success(false)
                .error(new ApiError(code, message, details))
                .build();
    }
}
