package com.example.salesBack.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Performance derived values")
class PerformanceTest {

    @Test
    @DisplayName("Should derive rates rounded to whole percentages")
    void shouldDeriveRates() {
        Performance performance = new Performance("u1", new ReportingPeriod(2024, 3));
        performance.setAppointmentsCompleted(40);
        performance.setSalesCompleted(20);
        performance.setRevenue(90000);
        performance.setRevenueTarget(100000);
        performance.setTotalFiles(3);
        performance.setFilesUpdated(2);

        assertThat(performance.getConversionRate()).isEqualTo(50);
        assertThat(performance.getTargetAttainmentRate()).isEqualTo(90);
        assertThat(performance.getFileCompletionRate()).isEqualTo(67);
        assertThat(performance.getFormattedPeriod()).isEqualTo("March 2024");
    }

    @Test
    @DisplayName("Should yield zero for a zero denominator")
    void shouldHandleZeroDenominators() {
        Performance performance = new Performance("u1", new ReportingPeriod(2024, 1));
        performance.setRevenue(500);

        assertThat(performance.getConversionRate()).isZero();
        assertThat(performance.getFileCompletionRate()).isZero();
        assertThat(performance.getTargetAttainmentRate()).isZero();
        assertThat(Performance.percentage(1, 8)).isEqualTo(13);
    }

    @Test
    @DisplayName("Should start with the documented defaults")
    void shouldApplyDefaults() {
        Performance performance = new Performance();

        assertThat(performance.getSatisfaction()).isEqualTo(4.0);
        assertThat(performance.getStatus()).isEqualTo(PerformanceStatus.VALIDATED);
        assertThat(performance.getEvents()).isZero();
        assertThat(performance.getAppointmentsPlanned()).isZero();
        assertThat(performance.getFormattedPeriod()).isNull();
    }
}
