package com.example.salesBack.model;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Calendar month a performance record reports on.
 */
public class ReportingPeriod {
    private int year;
    private int month;

    public ReportingPeriod() {}

    public ReportingPeriod(int year, int month) {
        this.year = year;
        this.month = month;
    }

    public int getYear() {
        return year;
    }

    public void setYear(int year) {
        this.year = year;
    }

    public int getMonth() {
        return month;
    }

    public void setMonth(int month) {
        this.month = month;
    }

    /** e.g. "March 2024" */
    public String format() {
        return Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + year;
    }
}
