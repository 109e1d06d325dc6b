package com.example.salesBack.service;

import com.example.salesBack.dto.PerformanceStatsDTO;
import com.example.salesBack.model.Performance;
import com.example.salesBack.model.User;
import com.example.salesBack.repository.PerformanceRepository;
import com.lowagie.text.*;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Locale;

@Service
public class PerformanceReportService {

    private final PerformanceRepository performanceRepository;
    private final PerformanceStatsService performanceStatsService;
    private final UserService userService;

    public PerformanceReportService(PerformanceRepository performanceRepository,
                                    PerformanceStatsService performanceStatsService,
                                    UserService userService) {
        this.performanceRepository = performanceRepository;
        this.performanceStatsService = performanceStatsService;
        this.userService = userService;
    }

    public byte[] generateYearlyReport(String userId, int year) throws DocumentException {
        User user = userService.getById(userId);

        Document document = new Document(PageSize.A4.rotate());
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        PdfWriter.getInstance(document, outputStream);

        document.open();

        // Add title
        Font titleFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 18);
        Paragraph title = new Paragraph("Performance Report - " + user.getFullName() + " - " + year, titleFont);
        title.setAlignment(Element.ALIGN_CENTER);
        title.setSpacingAfter(20);
        document.add(title);

        addMonthlySection(document, userId, year);
        addSummarySection(document, performanceStatsService.summarize(userId, year, null));

        document.close();
        return outputStream.toByteArray();
    }

    private void addMonthlySection(Document document, String userId, int year) throws DocumentException {
        List<Performance> performances = performanceRepository.findByUserIdAndPeriodYear(
                userId, year, Sort.by(Sort.Order.asc("period.month")));

        Font sectionFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
        Paragraph sectionTitle = new Paragraph("Monthly Records", sectionFont);
        sectionTitle.setSpacingAfter(10);
        document.add(sectionTitle);

        if (performances.isEmpty()) {
            document.add(new Paragraph("No performance data for this year."));
            return;
        }

        PdfPTable table = new PdfPTable(10);
        table.setWidthPercentage(100);
        table.setSpacingBefore(10);

        addTableHeader(table, "Period", "Revenue", "Target", "Attainment", "Appointments",
                "Sales", "Conversion", "New Clients", "Satisfaction", "Status");

        for (Performance performance : performances) {
            table.addCell(performance.getFormattedPeriod());
            table.addCell(formatAmount(performance.getRevenue()));
            table.addCell(formatAmount(performance.getRevenueTarget()));
            table.addCell(performance.getTargetAttainmentRate() + "%");
            table.addCell(String.valueOf(performance.getAppointmentsCompleted()));
            table.addCell(String.valueOf(performance.getSalesCompleted()));
            table.addCell(performance.getConversionRate() + "%");
            table.addCell(String.valueOf(performance.getNewClients()));
            table.addCell(String.format(Locale.ROOT, "%.1f", performance.getSatisfaction()));
            table.addCell(performance.getStatus().getValue());
        }

        document.add(table);
    }

    private void addSummarySection(Document document, PerformanceStatsDTO stats) throws DocumentException {
        Font sectionFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
        Paragraph sectionTitle = new Paragraph("Summary (validated records)", sectionFont);
        sectionTitle.setSpacingBefore(20);
        sectionTitle.setSpacingAfter(10);
        document.add(sectionTitle);

        PdfPTable table = new PdfPTable(2);
        table.setWidthPercentage(50);
        table.setHorizontalAlignment(Element.ALIGN_LEFT);

        addTableHeader(table, "Indicator", "Value");
        table.addCell("Months reported");
        table.addCell(String.valueOf(stats.getCount()));
        table.addCell("Total revenue");
        table.addCell(formatAmount(stats.getTotalRevenue()));
        table.addCell("Total target");
        table.addCell(formatAmount(stats.getTotalTarget()));
        table.addCell("Target attainment");
        table.addCell(stats.getTargetAttainmentRate() + "%");
        table.addCell("New clients");
        table.addCell(String.valueOf(stats.getTotalNewClients()));
        table.addCell("Appointments");
        table.addCell(String.valueOf(stats.getTotalAppointments()));
        table.addCell("Sales");
        table.addCell(String.valueOf(stats.getTotalSales()));
        table.addCell("Conversion rate");
        table.addCell(stats.getConversionRate() + "%");
        table.addCell("Events");
        table.addCell(String.valueOf(stats.getTotalEvents()));
        table.addCell("Average satisfaction");
        table.addCell(String.format(Locale.ROOT, "%.2f", stats.getAverageSatisfaction()));

        document.add(table);
    }

    private void addTableHeader(PdfPTable table, String... headers) {
        Font headerFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD);
        for (String header : headers) {
            PdfPCell cell = new PdfPCell(new Phrase(header, headerFont));
            cell.setHorizontalAlignment(Element.ALIGN_CENTER);
            cell.setBackgroundColor(Color.LIGHT_GRAY);
            table.addCell(cell);
        }
    }

    private static String formatAmount(double amount) {
        return String.format(Locale.ROOT, "%,.2f", amount);
    }
}
