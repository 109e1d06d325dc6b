package com.example.salesBack.repository;

import com.example.salesBack.model.Performance;
import com.example.salesBack.model.PerformanceStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.support.PageableExecutionUtils;

import java.util.List;

public class PerformanceRepositoryCustomImpl implements PerformanceRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public PerformanceRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Page<Performance> findForUser(String userId, Integer year, Integer month, PerformanceStatus status, Pageable pageable) {
        Criteria criteria = Criteria.where("userId").is(userId);
        if (year != null) {
            criteria = criteria.and("period.year").is(year);
        }
        if (month != null) {
            criteria = criteria.and("period.month").is(month);
        }
        if (status != null) {
            criteria = criteria.and("status").is(status);
        }

        Query query = new Query(criteria).with(pageable);
        List<Performance> content = mongoTemplate.find(query, Performance.class);
        return PageableExecutionUtils.getPage(content, pageable,
                () -> mongoTemplate.count(Query.of(query).limit(-1).skip(-1), Performance.class));
    }
}
