package com.example.salesBack.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Envelope shared by every endpoint: {@code {success, message?, data?, errors?, pagination?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private final boolean success;
    private final String message;
    private final T data;
    private final List<FieldErrorDTO> errors;
    private final PaginationDTO pagination;

    private ApiResponse(boolean success, String message, T data, List<FieldErrorDTO> errors, PaginationDTO pagination) {
        this.success = success;
        this.message = message;
        this.data = data;
        this.errors = errors;
        this.pagination = pagination;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data, null, null);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data, null, null);
    }

    public static <T> ApiResponse<T> message(String message) {
        return new ApiResponse<>(true, message, null, null, null);
    }

    public static <T> ApiResponse<T> page(T data, PaginationDTO pagination) {
        return new ApiResponse<>(true, null, data, null, pagination);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, message, null, null, null);
    }

    public static <T> ApiResponse<T> error(String message, List<FieldErrorDTO> errors) {
        return new ApiResponse<>(false, message, null, errors == null || errors.isEmpty() ? null : errors, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public T getData() {
        return data;
    }

    public List<FieldErrorDTO> getErrors() {
        return errors;
    }

    public PaginationDTO getPagination() {
        return pagination;
    }
}
