package com.example.barshift.common;

import java.util.Collections;
import java.util.Map;

/**
 * Common envelope for every JSON endpoint.
 * <p>
 * Callers branch on {@code success} and read the payload from {@code data}; {@code meta}
 * carries counters and other side information about the payload.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }

    public static <T> ApiResponse<T> failure(String message) {
        return new ApiResponse<>(false, message, null, Collections.emptyMap());
    }
}
