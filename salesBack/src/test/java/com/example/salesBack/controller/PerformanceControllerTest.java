package com.example.salesBack.controller;

import com.example.salesBack.config.SecurityConfig;
import com.example.salesBack.dto.PerformanceDTO;
import com.example.salesBack.dto.PerformanceQuery;
import com.example.salesBack.dto.PerformanceResponse;
import com.example.salesBack.dto.PerformanceStatsDTO;
import com.example.salesBack.dto.UpsertResult;
import com.example.salesBack.dto.UserSummaryDTO;
import com.example.salesBack.exception.ForbiddenException;
import com.example.salesBack.exception.GlobalExceptionHandler;
import com.example.salesBack.exception.MissingTokenException;
import com.example.salesBack.exception.TokenExpiredException;
import com.example.salesBack.exception.ValidationException;
import com.example.salesBack.filters.JwtAuthenticationFilter;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.model.Performance;
import com.example.salesBack.model.ReportingPeriod;
import com.example.salesBack.model.Role;
import com.example.salesBack.service.AuthorizationService;
import com.example.salesBack.service.PerformanceReportService;
import com.example.salesBack.service.PerformanceService;
import com.example.salesBack.service.PerformanceStatsService;
import com.example.salesBack.service.UserDetailsServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Year;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PerformanceController.class)
@Import({SecurityConfig.class, JwtAuthenticationFilter.class, GlobalExceptionHandler.class})
@DisplayName("PerformanceController Web Tests")
class PerformanceControllerTest {

    private static final String BEARER = "Bearer valid-token";

    @Autowired
    private MockMvc mockMvc;

    @MockBean(name = "authorizationService")
    private AuthorizationService authorizationService;

    @MockBean
    private UserDetailsServiceImpl userDetailsService;

    @MockBean
    private PerformanceService performanceService;

    @MockBean
    private PerformanceStatsService performanceStatsService;

    @MockBean
    private PerformanceReportService performanceReportService;

    private final AuthenticatedUser caller = new AuthenticatedUser("u1", "jane@example.com", "Jane", "Doe");

    private static final String BODY = """
        {
          "period": {"year": 2024, "month": 3},
          "revenue": 90000,
          "revenueTarget": 100000,
          "newClients": 5,
          "appointmentsCompleted": 40,
          "salesCompleted": 20,
          "filesUpdated": 8,
          "totalFiles": 10
        }
        """;

    @BeforeEach
    void setUp() {
        when(authorizationService.authenticate(BEARER)).thenReturn(caller);
        when(authorizationService.authenticate(isNull())).thenThrow(new MissingTokenException());
    }

    private static PerformanceResponse response() {
        Performance performance = new Performance("u1", new ReportingPeriod(2024, 3));
        performance.setId("p1");
        performance.setAppointmentsCompleted(40);
        performance.setSalesCompleted(20);
        performance.setRevenue(90000);
        performance.setRevenueTarget(100000);
        return new PerformanceResponse(performance, new UserSummaryDTO("u1", "Jane", "Doe", "jane@example.com", Role.USER));
    }

    @Test
    @DisplayName("Should answer 201 when the period is new")
    void shouldCreate() throws Exception {
        PerformanceResponse body = response();
        when(performanceService.upsert(eq("u1"), any(PerformanceDTO.class)))
            .thenReturn(new UpsertResult(body.getPerformance(), true));
        when(performanceService.toResponse(body.getPerformance())).thenReturn(body);

        mockMvc.perform(post("/performance")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("Data created successfully"))
            .andExpect(jsonPath("$.data.id").value("p1"))
            .andExpect(jsonPath("$.data.conversionRate").value(50))
            .andExpect(jsonPath("$.data.targetAttainmentRate").value(90))
            .andExpect(jsonPath("$.data.formattedPeriod").value("March 2024"))
            .andExpect(jsonPath("$.data.status").value("validated"))
            .andExpect(jsonPath("$.data.user.email").value("jane@example.com"));
    }

    @Test
    @DisplayName("Should answer 200 when the period already existed")
    void shouldUpdate() throws Exception {
        PerformanceResponse body = response();
        when(performanceService.upsert(eq("u1"), any(PerformanceDTO.class)))
            .thenReturn(new UpsertResult(body.getPerformance(), false));
        when(performanceService.toResponse(body.getPerformance())).thenReturn(body);

        mockMvc.perform(post("/performance")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Data updated successfully"));
    }

    @Test
    @DisplayName("Should return field errors from the validation stage")
    void shouldReturnValidationErrors() throws Exception {
        when(performanceService.upsert(eq("u1"), any(PerformanceDTO.class)))
            .thenThrow(new ValidationException("salesCompleted", "Completed sales cannot exceed completed appointments"));

        mockMvc.perform(post("/performance")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("Invalid data"))
            .andExpect(jsonPath("$.errors[0].field").value("salesCompleted"));
    }

    @Test
    @DisplayName("Should reject requests without a token before reaching the controller")
    void shouldRequireToken() throws Exception {
        mockMvc.perform(get("/performance"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("Not authorized, token missing"));

        verifyNoInteractions(performanceService);
    }

    @Test
    @DisplayName("Should report an expired token with its own message")
    void shouldRejectExpiredToken() throws Exception {
        when(authorizationService.authenticate("Bearer old-token")).thenThrow(new TokenExpiredException());

        mockMvc.perform(get("/performance").header(HttpHeaders.AUTHORIZATION, "Bearer old-token"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("Token expired"));
    }

    @Test
    @DisplayName("Should page the caller's records")
    void shouldListWithPagination() throws Exception {
        when(performanceService.listForUser(eq("u1"), any(PerformanceQuery.class)))
            .thenReturn(new PageImpl<>(List.of(response()), PageRequest.of(1, 1), 3));

        mockMvc.perform(get("/performance")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .param("page", "2")
                .param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].id").value("p1"))
            .andExpect(jsonPath("$.pagination.page").value(2))
            .andExpect(jsonPath("$.pagination.limit").value(1))
            .andExpect(jsonPath("$.pagination.total").value(3))
            .andExpect(jsonPath("$.pagination.pages").value(3));
    }

    @Test
    @DisplayName("Should reject an out of range limit")
    void shouldRejectInvalidQuery() throws Exception {
        mockMvc.perform(get("/performance")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .param("limit", "500"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0].field").value("limit"));

        verifyNoInteractions(performanceService);
    }

    @Test
    @DisplayName("Should answer 403 to a non-owner")
    void shouldForbidNonOwner() throws Exception {
        when(performanceService.getById("p9", caller)).thenThrow(new ForbiddenException("Access denied"));

        mockMvc.perform(get("/performance/p9").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.message").value("Access denied"));
    }

    @Test
    @DisplayName("Should delete the caller's record")
    void shouldDelete() throws Exception {
        mockMvc.perform(delete("/performance/p1").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Data deleted successfully"));

        verify(performanceService).delete("p1", caller);
    }

    @Test
    @DisplayName("Should default the summary to the current year")
    void shouldSummarizeCurrentYear() throws Exception {
        when(performanceStatsService.summarize("u1", Year.now().getValue(), null))
            .thenReturn(PerformanceStatsDTO.empty());

        mockMvc.perform(get("/performance/stats/summary").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.count").value(0))
            .andExpect(jsonPath("$.data.conversionRate").value(0));
    }

    @Test
    @DisplayName("Should stream the yearly report as a PDF attachment")
    void shouldDownloadReport() throws Exception {
        byte[] pdf = "%PDF-1.4".getBytes();
        when(performanceReportService.generateYearlyReport("u1", 2024)).thenReturn(pdf);

        mockMvc.perform(get("/performance/stats/report")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .param("year", "2024"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_PDF))
            .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                "attachment; filename=\"performance-report-2024.pdf\""))
            .andExpect(content().bytes(pdf));
    }

    @Test
    @DisplayName("Should map a non-numeric year to a bad request")
    void shouldRejectBadYear() throws Exception {
        mockMvc.perform(get("/performance/stats/summary")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .param("year", "abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid parameters"));
    }

    @Test
    @DisplayName("Should refuse the global listing to regular users")
    void shouldRefuseListAll() throws Exception {
        when(performanceService.listAll(caller)).thenThrow(new ForbiddenException("Access denied: insufficient role"));

        mockMvc.perform(get("/performance/all").header(HttpHeaders.AUTHORIZATION, BEARER))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.errors").doesNotExist());
    }
}
