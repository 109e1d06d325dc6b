package com.example.salesBack.repository;

import com.example.salesBack.model.Performance;
import com.example.salesBack.model.PerformanceStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface PerformanceRepositoryCustom {

    /**
     * Records owned by {@code userId}, narrowed by whichever of year, month and
     * status are non-null.
     */
    Page<Performance> findForUser(String userId, Integer year, Integer month, PerformanceStatus status, Pageable pageable);
}
