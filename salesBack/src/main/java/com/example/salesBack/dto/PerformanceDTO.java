package com.example.salesBack.dto;

import com.example.salesBack.model.PerformanceStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Body of a create-or-update request for one month of performance data.
 * Fields left null on an update keep their stored value.
 */
public class PerformanceDTO {

    @Valid
    @NotNull(message = "Period is required")
    private PeriodDTO period;

    @NotNull(message = "Revenue is required")
    @PositiveOrZero(message = "Revenue cannot be negative")
    private Double revenue;

    @NotNull(message = "Revenue target is required")
    @PositiveOrZero(message = "Revenue target cannot be negative")
    private Double revenueTarget;

    @NotNull(message = "New clients count is required")
    @PositiveOrZero(message = "New clients count cannot be negative")
    private Integer newClients;

    @NotNull(message = "Completed appointments count is required")
    @PositiveOrZero(message = "Completed appointments count cannot be negative")
    private Integer appointmentsCompleted;

    @PositiveOrZero(message = "Planned appointments count cannot be negative")
    private Integer appointmentsPlanned;

    @NotNull(message = "Completed sales count is required")
    @PositiveOrZero(message = "Completed sales count cannot be negative")
    private Integer salesCompleted;

    @NotNull(message = "Updated files count is required")
    @PositiveOrZero(message = "Updated files count cannot be negative")
    private Integer filesUpdated;

    @NotNull(message = "Total files count is required")
    @PositiveOrZero(message = "Total files count cannot be negative")
    private Integer totalFiles;

    @PositiveOrZero(message = "Events count cannot be negative")
    private Integer events;

    @DecimalMin(value = "1", message = "Satisfaction must be between 1 and 5")
    @DecimalMax(value = "5", message = "Satisfaction must be between 1 and 5")
    private Double satisfaction;

    @Size(max = 500, message = "Comments cannot exceed 500 characters")
    private String comments;

    private PerformanceStatus status;

    public static class PeriodDTO {
        @NotNull(message = "Year is required")
        @Min(value = 2020, message = "Invalid year")
        @Max(value = 2030, message = "Invalid year")
        private Integer year;

        @NotNull(message = "Month is required")
        @Min(value = 1, message = "Invalid month")
        @Max(value = 12, message = "Invalid month")
        private Integer month;

        public PeriodDTO() {}

        public PeriodDTO(Integer year, Integer month) {
            this.year = year;
            this.month = month;
        }

        public Integer getYear() {
            return year;
        }

        public void setYear(Integer year) {
            this.year = year;
        }

        public Integer getMonth() {
            return month;
        }

        public void setMonth(Integer month) {
            this.month = month;
        }
    }

    // Constructors
    public PerformanceDTO() {}

    // Getters and Setters
    public PeriodDTO getPeriod() {
        return period;
    }

    public void setPeriod(PeriodDTO period) {
        this.period = period;
    }

    public Double getRevenue() {
        return revenue;
    }

    public void setRevenue(Double revenue) {
        this.revenue = revenue;
    }

    public Double getRevenueTarget() {
        return revenueTarget;
    }

    public void setRevenueTarget(Double revenueTarget) {
        this.revenueTarget = revenueTarget;
    }

    public Integer getNewClients() {
        return newClients;
    }

    public void setNewClients(Integer newClients) {
        this.newClients = newClients;
    }

    public Integer getAppointmentsCompleted() {
        return appointmentsCompleted;
    }

    public void setAppointmentsCompleted(Integer appointmentsCompleted) {
        this.appointmentsCompleted = appointmentsCompleted;
    }

    public Integer getAppointmentsPlanned() {
        return appointmentsPlanned;
    }

    public void setAppointmentsPlanned(Integer appointmentsPlanned) {
        this.appointmentsPlanned = appointmentsPlanned;
    }

    public Integer getSalesCompleted() {
        return salesCompleted;
    }

    public void setSalesCompleted(Integer salesCompleted) {
        this.salesCompleted = salesCompleted;
    }

    public Integer getFilesUpdated() {
        return filesUpdated;
    }

    public void setFilesUpdated(Integer filesUpdated) {
        this.filesUpdated = filesUpdated;
    }

    public Integer getTotalFiles() {
        return totalFiles;
    }

    public void setTotalFiles(Integer totalFiles) {
        this.totalFiles = totalFiles;
    }

    public Integer getEvents() {
        return events;
    }

    public void setEvents(Integer events) {
        this.events = events;
    }

    public Double getSatisfaction() {
        return satisfaction;
    }

    public void setSatisfaction(Double satisfaction) {
        this.satisfaction = satisfaction;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public PerformanceStatus getStatus() {
        return status;
    }

    public void setStatus(PerformanceStatus status) {
        this.status = status;
    }
}
