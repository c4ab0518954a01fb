package com.tripbooking.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Envelope every trip booking endpoint answers with. Failures carry an error code and, for
 * validation failures, the offending fields as data.
 *
 * @param <T> Type of the response data
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BaseResponse<T> {
    private final boolean success;
    private final String message;
    private final T data;
    private final String errorCode;

    public static <T> BaseResponse<T> success(T data) {
        return new BaseResponse<>(true, null, data, null);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return new BaseResponse<>(true, message, data, null);
    }

    public static <T> BaseResponse<T> error(String message, String errorCode) {
        return error(message, errorCode, null);
    }

    public static <T> BaseResponse<T> error(String message, String errorCode, T data) {
        return new BaseResponse<>(false, message, data, errorCode);
    }
}
