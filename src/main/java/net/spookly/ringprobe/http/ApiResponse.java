package net.spookly.ringprobe.http;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON response envelope for the probe API.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiResponse {
    public final boolean ok;
    public final String message;
    public final Object data;

    public static ApiResponse ok(String message, Object data) {
        return new ApiResponse(true, message, data);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse(false, message, null);
    }

    /**
     * Failure that still carries a body, e.g. the counts behind an unhealthy status.
     */
    public static ApiResponse error(String message, Object data) {
        return new ApiResponse(false, message, data);
    }
}
