package com.parkezy.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.parkezy.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope for every API response.
 *
 * @param <T> Type of the payload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private boolean success;
    private String message;
    private T data;
    private String errorCode;
    private Instant timestamp;

    public static <T> BaseResponse<T> success(T data) {
        return success(null, data);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return BaseResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> BaseResponse<T> error(ErrorCode errorCode, String message) {
        return error(errorCode, message, null);
    }

    public static <T> BaseResponse<T> error(ErrorCode errorCode, String message, T details) {
        return BaseResponse.<T>builder()
                .success(false)
                .message(message)
                .data(details)
                .errorCode(errorCode.name())
                .timestamp(Instant.now())
                .build();
    }
}
