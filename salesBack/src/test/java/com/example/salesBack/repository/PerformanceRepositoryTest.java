package com.example.salesBack.repository;

import com.example.salesBack.AbstractMongoTest;
import com.example.salesBack.config.MongoConfig;
import com.example.salesBack.model.Performance;
import com.example.salesBack.model.PerformanceStatus;
import com.example.salesBack.model.ReportingPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataMongoTest
@Import(MongoConfig.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PerformanceRepository Integration Tests")
class PerformanceRepositoryTest extends AbstractMongoTest {

    private static final Sort NEWEST_PERIOD_FIRST = Sort.by(Sort.Order.desc("period.year"), Sort.Order.desc("period.month"));

    @Autowired
    private PerformanceRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private static Performance record(String userId, int year, int month, PerformanceStatus status) {
        Performance performance = new Performance(userId, new ReportingPeriod(year, month));
        performance.setRevenue(1000 * month);
        performance.setRevenueTarget(2000);
        performance.setNewClients(month);
        performance.setStatus(status);
        return performance;
    }

    @Test
    @DisplayName("Should reject a second record for the same user and month")
    void shouldEnforceOneRecordPerUserAndMonth() {
        // Given
        repository.save(record("u1", 2024, 3, PerformanceStatus.VALIDATED));

        // When / Then
        assertThatThrownBy(() -> repository.insert(record("u1", 2024, 3, PerformanceStatus.DRAFT)))
            .isInstanceOf(DuplicateKeyException.class);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept the same month for different users and different months for one user")
    void shouldAllowDistinctKeys() {
        repository.save(record("u1", 2024, 3, PerformanceStatus.VALIDATED));
        repository.save(record("u2", 2024, 3, PerformanceStatus.VALIDATED));
        repository.save(record("u1", 2024, 4, PerformanceStatus.VALIDATED));
        repository.save(record("u1", 2023, 3, PerformanceStatus.VALIDATED));

        assertThat(repository.count()).isEqualTo(4);
        assertThat(repository.findByUserIdAndPeriodYearAndPeriodMonth("u1", 2024, 4)).isPresent();
        assertThat(repository.findByUserIdAndPeriodYearAndPeriodMonth("u2", 2024, 4)).isEmpty();
    }

    @Test
    @DisplayName("Should page the caller's records newest period first with an unpaged total")
    void shouldPageNewestFirst() {
        // Given
        for (int month = 1; month <= 5; month++) {
            repository.save(record("u1", 2024, month, PerformanceStatus.VALIDATED));
        }
        repository.save(record("u1", 2023, 12, PerformanceStatus.VALIDATED));
        repository.save(record("u2", 2024, 6, PerformanceStatus.VALIDATED));

        // When
        Page<Performance> page = repository.findForUser("u1", null, null, null, PageRequest.of(1, 2, NEWEST_PERIOD_FIRST));

        // Then
        assertThat(page.getTotalElements()).isEqualTo(6);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getContent())
            .extracting(p -> p.getPeriod().getYear() + "-" + p.getPeriod().getMonth())
            .containsExactly("2024-3", "2024-2");
    }

    @Test
    @DisplayName("Should narrow by year, month and status together")
    void shouldFilterByPeriodAndStatus() {
        // Given
        repository.save(record("u1", 2024, 1, PerformanceStatus.VALIDATED));
        repository.save(record("u1", 2024, 2, PerformanceStatus.DRAFT));
        repository.save(record("u1", 2024, 3, PerformanceStatus.VALIDATED));
        repository.save(record("u1", 2023, 1, PerformanceStatus.VALIDATED));

        // When
        Page<Performance> validated2024 = repository.findForUser("u1", 2024, null, PerformanceStatus.VALIDATED,
                PageRequest.of(0, 10, NEWEST_PERIOD_FIRST));
        Page<Performance> january = repository.findForUser("u1", null, 1, null,
                PageRequest.of(0, 10, NEWEST_PERIOD_FIRST));

        // Then
        assertThat(validated2024.getContent())
            .extracting(p -> p.getPeriod().getMonth())
            .containsExactly(3, 1);
        assertThat(january.getContent())
            .extracting(p -> p.getPeriod().getYear())
            .containsExactly(2024, 2023);
    }

    @Test
    @DisplayName("Should answer the derived yearly and monthly status queries")
    void shouldRunDerivedQueries() {
        repository.save(record("u1", 2024, 1, PerformanceStatus.VALIDATED));
        repository.save(record("u1", 2024, 2, PerformanceStatus.DRAFT));
        repository.save(record("u1", 2025, 1, PerformanceStatus.VALIDATED));

        List<Performance> year = repository.findByUserIdAndPeriodYear("u1", 2024, Sort.by("period.month"));
        List<Performance> validated = repository.findByUserIdAndPeriodYearAndStatus("u1", 2024, PerformanceStatus.VALIDATED);
        List<Performance> drafts = repository.findByUserIdAndPeriodYearAndPeriodMonthAndStatus("u1", 2024, 2, PerformanceStatus.DRAFT);

        assertThat(year).extracting(p -> p.getPeriod().getMonth()).containsExactly(1, 2);
        assertThat(validated).hasSize(1);
        assertThat(drafts).hasSize(1);
        assertThat(year.get(0).getCreatedAt()).isNotNull();
    }
}
