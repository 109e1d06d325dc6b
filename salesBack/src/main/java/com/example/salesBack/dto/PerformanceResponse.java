package com.example.salesBack.dto;

import com.example.salesBack.model.Performance;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * A performance record as returned to clients: the stored fields and derived
 * rates, with the owner's summary in place of the bare user id.
 */
public class PerformanceResponse {
    @JsonUnwrapped
    private final Performance performance;
    private final UserSummaryDTO user;

    public PerformanceResponse(Performance performance, UserSummaryDTO user) {
        this.performance = performance;
        this.user = user;
    }

    public Performance getPerformance() {
        return performance;
    }

    public UserSummaryDTO getUser() {
        return user;
    }
}
