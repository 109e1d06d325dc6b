package com.example.salesBack.service;

import com.example.salesBack.dto.PerformanceStatsDTO;
import com.example.salesBack.exception.ValidationException;
import com.example.salesBack.model.Performance;
import com.example.salesBack.model.PerformanceStatus;
import com.example.salesBack.repository.PerformanceRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Summary statistics over a user's validated records for a year, or a single month of it.
 */
@Service
public class PerformanceStatsService {

    private final PerformanceRepository performanceRepository;

    public PerformanceStatsService(PerformanceRepository performanceRepository) {
        this.performanceRepository = performanceRepository;
    }

    public PerformanceStatsDTO summarize(String userId, int year, Integer month) {
        if (month != null && (month < 1 || month > 12)) {
            throw new ValidationException("month", "Invalid month");
        }

        List<Performance> performances = month == null
                ? performanceRepository.findByUserIdAndPeriodYearAndStatus(userId, year, PerformanceStatus.VALIDATED)
                : performanceRepository.findByUserIdAndPeriodYearAndPeriodMonthAndStatus(userId, year, month, PerformanceStatus.VALIDATED);
        return summarize(performances);
    }

    private PerformanceStatsDTO summarize(List<Performance> performances) {
        if (performances.isEmpty()) {
            return PerformanceStatsDTO.empty();
        }

        double totalRevenue = 0;
        double totalTarget = 0;
        long totalNewClients = 0;
        long totalAppointments = 0;
        long totalSales = 0;
        long totalEvents = 0;
        double satisfactionSum = 0;

        for (Performance performance : performances) {
            totalRevenue += performance.getRevenue();
            totalTarget += performance.getRevenueTarget();
            totalNewClients += performance.getNewClients();
            totalAppointments += performance.getAppointmentsCompleted();
            totalSales += performance.getSalesCompleted();
            totalEvents += performance.getEvents();
            satisfactionSum += performance.getSatisfaction();
        }

        return new PerformanceStatsDTO(
                totalRevenue,
                totalTarget,
                totalNewClients,
                totalAppointments,
                totalSales,
                totalEvents,
                satisfactionSum / performances.size(),
                performances.size(),
                Performance.percentage(totalSales, totalAppointments),
                Performance.percentage(totalRevenue, totalTarget));
    }
}
