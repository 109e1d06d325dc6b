package com.example.salesBack.dto;

public record PaginationDTO(int page, int limit, long total, int pages) {
}
