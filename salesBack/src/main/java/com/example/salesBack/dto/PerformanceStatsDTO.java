package com.example.salesBack.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PerformanceStatsDTO {
    private final double totalRevenue;
    private final double totalTarget;
    private final long totalNewClients;
    private final long totalAppointments;
    private final long totalSales;
    private final long totalEvents;
    private final double averageSatisfaction;
    private final long count;
    private final int conversionRate;
    private final int targetAttainmentRate;

    public static PerformanceStatsDTO empty() {
        return new PerformanceStatsDTO(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
