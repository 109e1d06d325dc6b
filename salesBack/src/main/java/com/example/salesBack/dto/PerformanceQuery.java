package com.example.salesBack.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;

/**
 * Query-string filters for listing the caller's own records.
 */
@Getter
@Setter
public class PerformanceQuery {
    @Min(value = 2020, message = "Invalid year")
    @Max(value = 2030, message = "Invalid year")
    private Integer year;

    @Min(value = 1, message = "Invalid month")
    @Max(value = 12, message = "Invalid month")
    private Integer month;

    @Pattern(regexp = "draft|validated", message = "Invalid status")
    private String status;

    @Min(value = 1, message = "Invalid page")
    private int page = 1;

    @Min(value = 1, message = "Invalid limit")
    @Max(value = 100, message = "Invalid limit")
    private int limit = 12;
}
