package com.example.salesBack.dto;

public record FieldErrorDTO(String field, String message) {
}
