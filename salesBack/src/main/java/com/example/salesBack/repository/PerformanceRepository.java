package com.example.salesBack.repository;

import com.example.salesBack.model.Performance;
import com.example.salesBack.model.PerformanceStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface PerformanceRepository extends MongoRepository<Performance, String>, PerformanceRepositoryCustom {
    Optional<Performance> findByUserIdAndPeriodYearAndPeriodMonth(String userId, int year, int month);
    List<Performance> findByUserIdAndPeriodYear(String userId, int year, Sort sort);
    List<Performance> findByUserIdAndPeriodYearAndStatus(String userId, int year, PerformanceStatus status);
    List<Performance> findByUserIdAndPeriodYearAndPeriodMonthAndStatus(String userId, int year, int month, PerformanceStatus status);
}
