package com.mealshift.orderservice.service;

import com.mealshift.common.contracts.AuditRecordContract;
import com.mealshift.orderservice.audit.AuditSink;
import com.mealshift.orderservice.config.MealshiftProperties;
import com.mealshift.orderservice.dto.PolicyUpdateRequest;
import com.mealshift.orderservice.event.BookingHorizonReducedEvent;
import com.mealshift.orderservice.event.EventPublisher;
import com.mealshift.orderservice.event.EventType;
import com.mealshift.orderservice.model.CutoffMode;
import com.mealshift.orderservice.model.Policy;
import com.mealshift.orderservice.model.PolicySettings;
import com.mealshift.orderservice.repository.PolicySettingsRepository;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Holds the current policy as an immutable snapshot. Readers get whichever snapshot
 * was installed last; an update replaces it in one step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyStore {

    private final PolicySettingsRepository repository;
    private final MealshiftProperties properties;
    private final ClockSource clock;
    private final EventPublisher eventPublisher;
    private final AuditSink auditSink;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final AtomicReference<Policy> snapshot = new AtomicReference<>();

    public Policy current() {
        Policy policy = snapshot.get();
        if (policy == null) {
            snapshot.compareAndSet(null, defaults());
            policy = snapshot.get();
        }
        return policy;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        reload();
        log.info("Policy loaded: {}", current());
    }

    // picks up updates made through other instances
    @Scheduled(fixedDelayString = "${mealshift.policy.reload-interval:PT60S}", initialDelayString = "${mealshift.policy.reload-interval:PT60S}")
    public void reload() {
        try {
            repository.findById(PolicySettings.DEFAULT_ID)
                    .map(this::toPolicy)
                    .ifPresent(snapshot::set);
        } catch (DataAccessException e) {
            log.warn("Policy reload failed, keeping current snapshot: {}", e.getMessage());
        }
    }

    @Transactional
    public Policy update(PolicyUpdateRequest request, UUID actorId) {
        Policy previous = current();
        PolicySettings settings = repository.findById(PolicySettings.DEFAULT_ID)
                .orElseGet(() -> toSettings(previous));

        if (request.getCutoffMode() != null) {
            settings.setCutoffMode(request.getCutoffMode());
        }
        if (request.getCutoffDays() != null) {
            settings.setCutoffDays(request.getCutoffDays());
        }
        if (request.getCutoffLeadHours() != null) {
            settings.setCutoffLeadHours(request.getCutoffLeadHours());
        }
        if (request.getWeeklyCutoffDay() != null) {
            settings.setWeeklyCutoffDay(request.getWeeklyCutoffDay());
        }
        if (request.getWeeklyCutoffHour() != null) {
            settings.setWeeklyCutoffHour(request.getWeeklyCutoffHour());
        }
        if (request.getWeeklyCutoffMinute() != null) {
            settings.setWeeklyCutoffMinute(request.getWeeklyCutoffMinute());
        }
        if (request.getOrderableDays() != null) {
            settings.setOrderableDays(formatDays(request.getOrderableDays()));
        }
        if (request.getMaxWeeksAhead() != null) {
            settings.setMaxWeeksAhead(request.getMaxWeeksAhead());
        }
        if (request.getStrikeThreshold() != null) {
            settings.setStrikeThreshold(request.getStrikeThreshold());
        }
        if (request.getRestrictionDurationDays() != null) {
            settings.setRestrictionDurationDays(request.getRestrictionDurationDays());
        }
        if (request.getBookingHorizonDays() != null) {
            settings.setBookingHorizonDays(request.getBookingHorizonDays());
        }
        if (request.getLateCancellationAllowed() != null) {
            settings.setLateCancellationAllowed(request.getLateCancellationAllowed());
        }
        if (request.getEarlyCollectionMinutes() != null) {
            settings.setEarlyCollectionMinutes(request.getEarlyCollectionMinutes());
        }
        if (request.getCollectionGraceMinutes() != null) {
            settings.setCollectionGraceMinutes(request.getCollectionGraceMinutes());
        }
        if (settings.getCutoffMode() == CutoffMode.WEEKLY
                && (settings.getWeeklyCutoffDay() == null || parseDays(settings.getOrderableDays()).isEmpty())) {
            throw new IllegalArgumentException("Weekly cutoff mode needs a cutoff day and at least one orderable day");
        }
        settings.setUpdatedAt(clock.now());
        settings.setUpdatedBy(actorId);

        Policy updated = toPolicy(repository.saveAndFlush(settings));
        installAfterCommit(updated);
        log.info("Policy updated: by={}, previous={}, current={}", actorId, previous, updated);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previous", previous);
        metadata.put("current", updated);
        auditSink.record(AuditRecordContract.builder()
                .action("policy.updated")
                .entityType("POLICY")
                .entityId(PolicySettings.DEFAULT_ID)
                .actorId(actorId)
                .description("Policy settings updated")
                .metadata(metadata)
                .occurredAt(clock.now())
                .build());
        eventPublisher.publish(EventType.POLICY_UPDATED, updated);

        // the day horizon only governs per-shift mode
        if (!updated.isWeekly() && updated.getBookingHorizonDays() < previous.getBookingHorizonDays()) {
            applicationEventPublisher.publishEvent(new BookingHorizonReducedEvent(
                    previous.getBookingHorizonDays(),
                    updated.getBookingHorizonDays(),
                    clock.today().plusDays(updated.getBookingHorizonDays())));
        }
        return updated;
    }

    // readers must never see a policy whose transaction rolled back
    private void installAfterCommit(Policy updated) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            snapshot.set(updated);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                snapshot.set(updated);
            }
        });
    }

    private Policy defaults() {
        MealshiftProperties.PolicyDefaults defaults = properties.getPolicy();
        return Policy.builder()
                .cutoffMode(defaults.getCutoffMode())
                .cutoffDays(defaults.getCutoffDays())
                .cutoffLeadHours(defaults.getCutoffLeadHours())
                .weeklyCutoffDay(defaults.getWeeklyCutoffDay())
                .weeklyCutoffHour(defaults.getWeeklyCutoffHour())
                .weeklyCutoffMinute(defaults.getWeeklyCutoffMinute())
                .orderableDays(Set.copyOf(defaults.getOrderableDays()))
                .maxWeeksAhead(defaults.getMaxWeeksAhead())
                .strikeThreshold(defaults.getStrikeThreshold())
                .restrictionDurationDays(defaults.getRestrictionDurationDays())
                .bookingHorizonDays(defaults.getBookingHorizonDays())
                .lateCancellationAllowed(defaults.isLateCancellationAllowed())
                .earlyCollectionMinutes(defaults.getEarlyCollectionMinutes())
                .collectionGraceMinutes(defaults.getCollectionGraceMinutes())
                .build();
    }

    private Policy toPolicy(PolicySettings settings) {
        return Policy.builder()
                .cutoffMode(settings.getCutoffMode())
                .cutoffDays(settings.getCutoffDays())
                .cutoffLeadHours(settings.getCutoffLeadHours())
                .weeklyCutoffDay(settings.getWeeklyCutoffDay())
                .weeklyCutoffHour(settings.getWeeklyCutoffHour())
                .weeklyCutoffMinute(settings.getWeeklyCutoffMinute())
                .orderableDays(parseDays(settings.getOrderableDays()))
                .maxWeeksAhead(settings.getMaxWeeksAhead())
                .strikeThreshold(settings.getStrikeThreshold())
                .restrictionDurationDays(settings.getRestrictionDurationDays())
                .bookingHorizonDays(settings.getBookingHorizonDays())
                .lateCancellationAllowed(settings.isLateCancellationAllowed())
                .earlyCollectionMinutes(settings.getEarlyCollectionMinutes())
                .collectionGraceMinutes(settings.getCollectionGraceMinutes())
                .updatedAt(settings.getUpdatedAt())
                .updatedBy(settings.getUpdatedBy())
                .build();
    }

    private PolicySettings toSettings(Policy policy) {
        PolicySettings settings = new PolicySettings();
        settings.setCutoffMode(policy.getCutoffMode());
        settings.setCutoffDays(policy.getCutoffDays());
        settings.setCutoffLeadHours(policy.getCutoffLeadHours());
        settings.setWeeklyCutoffDay(policy.getWeeklyCutoffDay());
        settings.setWeeklyCutoffHour(policy.getWeeklyCutoffHour());
        settings.setWeeklyCutoffMinute(policy.getWeeklyCutoffMinute());
        settings.setOrderableDays(formatDays(policy.getOrderableDays()));
        settings.setMaxWeeksAhead(policy.getMaxWeeksAhead());
        settings.setStrikeThreshold(policy.getStrikeThreshold());
        settings.setRestrictionDurationDays(policy.getRestrictionDurationDays());
        settings.setBookingHorizonDays(policy.getBookingHorizonDays());
        settings.setLateCancellationAllowed(policy.isLateCancellationAllowed());
        settings.setEarlyCollectionMinutes(policy.getEarlyCollectionMinutes());
        settings.setCollectionGraceMinutes(policy.getCollectionGraceMinutes());
        return settings;
    }

    static String formatDays(Set<DayOfWeek> days) {
        return days.stream()
                .sorted()
                .map(day -> String.valueOf(day.getValue()))
                .collect(Collectors.joining(","));
    }

    static Set<DayOfWeek> parseDays(String days) {
        if (days == null || days.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(days.split(","))
                .map(String::trim)
                .map(day -> DayOfWeek.of(Integer.parseInt(day)))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DayOfWeek.class)));
    }
}
