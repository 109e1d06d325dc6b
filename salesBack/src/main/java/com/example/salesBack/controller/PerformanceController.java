package com.example.salesBack.controller;

import com.example.salesBack.dto.ApiResponse;
import com.example.salesBack.dto.PaginationDTO;
import com.example.salesBack.dto.PerformanceDTO;
import com.example.salesBack.dto.PerformanceQuery;
import com.example.salesBack.dto.PerformanceResponse;
import com.example.salesBack.dto.PerformanceStatsDTO;
import com.example.salesBack.dto.UpsertResult;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.service.PerformanceReportService;
import com.example.salesBack.service.PerformanceService;
import com.example.salesBack.service.PerformanceStatsService;
import com.lowagie.text.DocumentException;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Year;
import java.util.List;

@RestController
@RequestMapping("/performance")
public class PerformanceController {

    private final PerformanceService performanceService;
    private final PerformanceStatsService performanceStatsService;
    private final PerformanceReportService performanceReportService;

    public PerformanceController(PerformanceService performanceService,
                                 PerformanceStatsService performanceStatsService,
                                 PerformanceReportService performanceReportService) {
        this.performanceService = performanceService;
        this.performanceStatsService = performanceStatsService;
        this.performanceReportService = performanceReportService;
    }

    // Create or update the caller's data for one month; validation happens in the service
    @PostMapping
    public ResponseEntity<ApiResponse<PerformanceResponse>> upsert(@AuthenticationPrincipal AuthenticatedUser caller,
                                                                   @RequestBody PerformanceDTO performanceDTO) {
        UpsertResult result = performanceService.upsert(caller.id(), performanceDTO);
        PerformanceResponse body = performanceService.toResponse(result.performance());

        if (result.created()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Data created successfully", body));
        }
        return ResponseEntity.ok(ApiResponse.ok("Data updated successfully", body));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PerformanceResponse>>> list(@AuthenticationPrincipal AuthenticatedUser caller,
                                                                       @Valid PerformanceQuery query) {
        Page<PerformanceResponse> page = performanceService.listForUser(caller.id(), query);
        PaginationDTO pagination = new PaginationDTO(query.getPage(), query.getLimit(), page.getTotalElements(), page.getTotalPages());
        return ResponseEntity.ok(ApiResponse.page(page.getContent(), pagination));
    }

    // Overview across all employees, admin and manager only
    @GetMapping("/all")
    public ResponseEntity<ApiResponse<List<PerformanceResponse>>> listAll(@AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.ok(performanceService.listAll(caller)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PerformanceResponse>> getById(@AuthenticationPrincipal AuthenticatedUser caller,
                                                                    @PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(performanceService.getById(id, caller)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@AuthenticationPrincipal AuthenticatedUser caller,
                                                    @PathVariable String id) {
        performanceService.delete(id, caller);
        return ResponseEntity.ok(ApiResponse.message("Data deleted successfully"));
    }

    @GetMapping("/stats/summary")
    public ResponseEntity<ApiResponse<PerformanceStatsDTO>> summary(@AuthenticationPrincipal AuthenticatedUser caller,
                                                                    @RequestParam(required = false) Integer year,
                                                                    @RequestParam(required = false) Integer month) {
        int effectiveYear = year != null ? year : Year.now().getValue();
        return ResponseEntity.ok(ApiResponse.ok(performanceStatsService.summarize(caller.id(), effectiveYear, month)));
    }

    @GetMapping("/stats/report")
    public ResponseEntity<byte[]> report(@AuthenticationPrincipal AuthenticatedUser caller,
                                         @RequestParam(required = false) Integer year) throws DocumentException {
        int effectiveYear = year != null ? year : Year.now().getValue();
        byte[] pdf = performanceReportService.generateYearlyReport(caller.id(), effectiveYear);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename("performance-report-" + effectiveYear + ".pdf")
                .build());
        return new ResponseEntity<>(pdf, headers, HttpStatus.OK);
    }
}
