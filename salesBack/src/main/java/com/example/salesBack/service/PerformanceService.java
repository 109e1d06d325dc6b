package com.example.salesBack.service;

import com.example.salesBack.dto.FieldErrorDTO;
import com.example.salesBack.dto.PerformanceDTO;
import com.example.salesBack.dto.PerformanceQuery;
import com.example.salesBack.dto.PerformanceResponse;
import com.example.salesBack.dto.UpsertResult;
import com.example.salesBack.dto.UserSummaryDTO;
import com.example.salesBack.exception.DuplicatePeriodException;
import com.example.salesBack.exception.ForbiddenException;
import com.example.salesBack.exception.ResourceNotFoundException;
import com.example.salesBack.exception.ValidationException;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.model.Performance;
import com.example.salesBack.model.PerformanceStatus;
import com.example.salesBack.model.ReportingPeriod;
import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;
import com.example.salesBack.repository.PerformanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Service
public class PerformanceService {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceService.class);

    private static final Sort NEWEST_PERIOD_FIRST = Sort.by(Sort.Order.desc("period.year"), Sort.Order.desc("period.month"));

    private final PerformanceRepository performanceRepository;
    private final PerformanceValidator performanceValidator;
    private final UserService userService;
    private final AuthorizationService authorizationService;

    public PerformanceService(PerformanceRepository performanceRepository,
                              PerformanceValidator performanceValidator,
                              UserService userService,
                              AuthorizationService authorizationService) {
        this.performanceRepository = performanceRepository;
        this.performanceValidator = performanceValidator;
        this.userService = userService;
        this.authorizationService = authorizationService;
    }

    /**
     * Creates the caller's record for the request period, or updates it in place
     * when one already exists. Validation runs before anything is written; a
     * concurrent insert for the same period is caught by the unique index.
     */
    public UpsertResult upsert(String userId, PerformanceDTO dto) {
        List<FieldErrorDTO> errors = performanceValidator.validate(dto);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        int year = dto.getPeriod().getYear();
        int month = dto.getPeriod().getMonth();
        Optional<Performance> existing = performanceRepository.findByUserIdAndPeriodYearAndPeriodMonth(userId, year, month);
        boolean created = existing.isEmpty();
        Performance performance = existing.orElseGet(() -> new Performance(userId, new ReportingPeriod(year, month)));
        applyFields(dto, performance);

        Performance saved;
        try {
            saved = performanceRepository.save(performance);
        } catch (DuplicateKeyException e) {
            logger.warn("Concurrent insert for user {} period {}-{} rejected", userId, year, month);
            throw new DuplicatePeriodException();
        }
        logger.info("Performance {} for user {} period {}-{}", created ? "created" : "updated", userId, year, month);
        return new UpsertResult(saved, created);
    }

    public Page<PerformanceResponse> listForUser(String userId, PerformanceQuery query) {
        PerformanceStatus status = query.getStatus() != null ? PerformanceStatus.fromValue(query.getStatus()) : null;
        PageRequest pageRequest = PageRequest.of(query.getPage() - 1, query.getLimit(), NEWEST_PERIOD_FIRST);

        Page<Performance> page = performanceRepository.findForUser(userId, query.getYear(), query.getMonth(), status, pageRequest);
        UserSummaryDTO owner = userService.findById(userId).map(UserSummaryDTO::from).orElse(null);
        return page.map(performance -> new PerformanceResponse(performance, owner));
    }

    /** Every record of every user; admin and manager only. */
    public List<PerformanceResponse> listAll(AuthenticatedUser caller) {
        authorizationService.requireRole(caller, Role.ADMIN, Role.MANAGER);

        List<Performance> performances = performanceRepository.findAll(NEWEST_PERIOD_FIRST);
        Set<String> ownerIds = performances.stream().map(Performance::getUserId).collect(Collectors.toSet());
        Map<String, UserSummaryDTO> owners = userService.findAllById(ownerIds).stream()
                .collect(Collectors.toMap(User::getId, UserSummaryDTO::from, (a, b) -> a));

        return performances.stream()
                .map(performance -> new PerformanceResponse(performance, owners.get(performance.getUserId())))
                .toList();
    }

    public PerformanceResponse getById(String id, AuthenticatedUser caller) {
        return toResponse(loadOwned(id, caller));
    }

    public PerformanceResponse toResponse(Performance performance) {
        UserSummaryDTO owner = userService.findById(performance.getUserId()).map(UserSummaryDTO::from).orElse(null);
        return new PerformanceResponse(performance, owner);
    }

    public void delete(String id, AuthenticatedUser caller) {
        Performance performance = loadOwned(id, caller);
        performanceRepository.delete(performance);
        logger.info("Performance {} deleted by user {}", id, caller.id());
    }

    // Single-record access is owner-only, whatever the caller's role
    private Performance loadOwned(String id, AuthenticatedUser caller) {
        Performance performance = performanceRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Performance data not found"));
        if (!performance.getUserId().equals(caller.id())) {
            logger.warn("User {} denied access to performance {}", caller.id(), id);
            throw new ForbiddenException("Access denied");
        }
        return performance;
    }

    private void applyFields(PerformanceDTO dto, Performance performance) {
        performance.setRevenue(dto.getRevenue());
        performance.setRevenueTarget(dto.getRevenueTarget());
        performance.setNewClients(dto.getNewClients());
        performance.setAppointmentsCompleted(dto.getAppointmentsCompleted());
        performance.setSalesCompleted(dto.getSalesCompleted());
        performance.setFilesUpdated(dto.getFilesUpdated());
        performance.setTotalFiles(dto.getTotalFiles());

        // Optional fields keep their stored (or default) value when absent
        setIfPresent(dto.getAppointmentsPlanned(), performance::setAppointmentsPlanned);
        setIfPresent(dto.getEvents(), performance::setEvents);
        setIfPresent(dto.getSatisfaction(), performance::setSatisfaction);
        setIfPresent(dto.getComments(), performance::setComments);

        boolean alreadyValidated = performance.getValidatedAt() != null;
        setIfPresent(dto.getStatus(), performance::setStatus);
        if (performance.getStatus() == PerformanceStatus.DRAFT) {
            performance.setValidatedAt(null);
        } else if (!alreadyValidated) {
            performance.setValidatedAt(LocalDateTime.now());
        }
    }

    private static <T> void setIfPresent(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
