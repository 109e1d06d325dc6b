package com.example.salesBack.dto;

import com.example.salesBack.model.Performance;

/**
 * Outcome of a create-or-update: the stored record and whether it was newly inserted.
 */
public record UpsertResult(Performance performance, boolean created) {
}
