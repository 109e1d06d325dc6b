package com.example.salesBack.model;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Document(collection = "performances")
@CompoundIndexes({
    // one record per employee per month
    @CompoundIndex(name = "user_period_unique", def = "{'userId': 1, 'period.year': 1, 'period.month': 1}", unique = true),
    @CompoundIndex(name = "period_idx", def = "{'period.year': 1, 'period.month': 1}")
})
public class Performance {
    public static final double DEFAULT_SATISFACTION = 4;

    @Id
    private String id;
    private String userId;
    private ReportingPeriod period;

    private double revenue;
    private double revenueTarget;
    private int newClients;
    private int appointmentsCompleted;
    private int appointmentsPlanned;
    private int salesCompleted;
    private int filesUpdated;
    private int totalFiles;
    private int events;
    private double satisfaction = DEFAULT_SATISFACTION;
    private String comments;

    @Indexed
    private PerformanceStatus status = PerformanceStatus.VALIDATED;
    private LocalDateTime validatedAt;

    @CreatedDate
    private LocalDateTime createdAt;
    @LastModifiedDate
    private LocalDateTime updatedAt;

    // Constructors
    public Performance() {}

    public Performance(String userId, ReportingPeriod period) {
        this.userId = userId;
        this.period = period;
    }

    /**
     * Whole percentage of {@code numerator / denominator}, rounded half up.
     * A zero denominator yields 0.
     */
    public static int percentage(double numerator, double denominator) {
        if (denominator == 0) {
            return 0;
        }
        return (int) Math.round(numerator / denominator * 100);
    }

    // Derived values, computed on read and never stored
    public int getConversionRate() {
        return percentage(salesCompleted, appointmentsCompleted);
    }

    public int getFileCompletionRate() {
        return percentage(filesUpdated, totalFiles);
    }

    public int getTargetAttainmentRate() {
        return percentage(revenue, revenueTarget);
    }

    public String getFormattedPeriod() {
        return period != null ? period.format() : null;
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public ReportingPeriod getPeriod() {
        return period;
    }

    public void setPeriod(ReportingPeriod period) {
        this.period = period;
    }

    public double getRevenue() {
        return revenue;
    }

    public void setRevenue(double revenue) {
        this.revenue = revenue;
    }

    public double getRevenueTarget() {
        return revenueTarget;
    }

    public void setRevenueTarget(double revenueTarget) {
        this.revenueTarget = revenueTarget;
    }

    public int getNewClients() {
        return newClients;
    }

    public void setNewClients(int newClients) {
        this.newClients = newClients;
    }

    public int getAppointmentsCompleted() {
        return appointmentsCompleted;
    }

    public void setAppointmentsCompleted(int appointmentsCompleted) {
        this.appointmentsCompleted = appointmentsCompleted;
    }

    public int getAppointmentsPlanned() {
        return appointmentsPlanned;
    }

    public void setAppointmentsPlanned(int appointmentsPlanned) {
        this.appointmentsPlanned = appointmentsPlanned;
    }

    public int getSalesCompleted() {
        return salesCompleted;
    }

    public void setSalesCompleted(int salesCompleted) {
        this.salesCompleted = salesCompleted;
    }

    public int getFilesUpdated() {
        return filesUpdated;
    }

    public void setFilesUpdated(int filesUpdated) {
        this.filesUpdated = filesUpdated;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public void setTotalFiles(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    public int getEvents() {
        return events;
    }

    public void setEvents(int events) {
        this.events = events;
    }

    public double getSatisfaction() {
        return satisfaction;
    }

    public void setSatisfaction(double satisfaction) {
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

    public LocalDateTime getValidatedAt() {
        return validatedAt;
    }

    public void setValidatedAt(LocalDateTime validatedAt) {
        this.validatedAt = validatedAt;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
