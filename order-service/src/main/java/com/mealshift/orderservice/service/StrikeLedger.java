package com.mealshift.orderservice.service;

import com.mealshift.common.contracts.AuditRecordContract;
import com.mealshift.common.exception.ConflictException;
import com.mealshift.common.exception.ResourceNotFoundException;
import com.mealshift.orderservice.audit.AuditSink;
import com.mealshift.orderservice.dto.PersonStandingResponse;
import com.mealshift.orderservice.dto.RestrictionResponse;
import com.mealshift.orderservice.dto.StrikeReductionResponse;
import com.mealshift.orderservice.event.EventPublisher;
import com.mealshift.orderservice.event.EventType;
import com.mealshift.orderservice.event.RestrictionOpenedEvent;
import com.mealshift.orderservice.mapper.RestrictionMapper;
import com.mealshift.orderservice.model.Person;
import com.mealshift.orderservice.model.Policy;
import com.mealshift.orderservice.model.Restriction;
import com.mealshift.orderservice.repository.PersonRepository;
import com.mealshift.orderservice.repository.RestrictionRepository;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-person strike counter and the restrictions it opens.
 *
 * <p>A restriction is in effect while its active flag is set and the clock is inside
 * [startsAt, endsAt). Nothing closes expired restrictions in the background; every
 * check compares against the current time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrikeLedger {

    private final PersonRepository personRepository;
    private final RestrictionRepository restrictionRepository;
    private final PolicyStore policyStore;
    private final ClockSource clock;
    private final EventPublisher eventPublisher;
    private final AuditSink auditSink;
    private final RestrictionMapper restrictionMapper;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Adds one strike and opens a restriction when the threshold is reached and none is in effect.
     * Must run inside the caller's transaction.
     */
    @Transactional
    public StrikeAccrual accrueFailure(UUID personId, UUID orderId) {
        if (personRepository.incrementStrikes(personId) == 0) {
            log.warn("Strike accrual for unknown person: personId={}, orderId={}", personId, orderId);
            throw new ResourceNotFoundException("Person not found with id: " + personId);
        }
        Person person = findPerson(personId);
        Policy policy = policyStore.current();
        Instant now = clock.now();
        int strikes = person.getStrikeCount();

        log.info("Strike accrued: personId={}, orderId={}, strikeCount={}, threshold={}",
                personId, orderId, strikes, policy.getStrikeThreshold());
        auditSink.record(AuditRecordContract.builder()
                .action("person.strike.accrued")
                .entityType("PERSON")
                .entityId(personId.toString())
                .personId(personId)
                .description("Missed collection recorded as strike " + strikes)
                .metadata(Map.of("orderId", String.valueOf(orderId), "strikeCount", strikes))
                .occurredAt(now)
                .build());

        if (strikes < policy.getStrikeThreshold() || restrictionRepository.existsInEffectAt(personId, now)) {
            return new StrikeAccrual(personId, strikes, null);
        }

        String reason = String.format("Automatic restriction: %d missed collections (threshold: %d)",
                strikes, policy.getStrikeThreshold());
        Restriction restriction = openRestriction(person, reason, now,
                now.plus(policy.restrictionDuration()), true, null);
        return new StrikeAccrual(personId, strikes, restriction);
    }

    /**
     * Manual restriction by an administrator; {@code durationDays == null} restricts indefinitely.
     */
    @Transactional
    public PersonStandingResponse restrict(UUID personId, String reason, Integer durationDays, UUID actorId) {
        Person person = findPerson(personId);
        Instant now = clock.now();
        if (restrictionRepository.existsInEffectAt(personId, now)) {
            log.warn("Restriction refused, already restricted: personId={}, by={}", personId, actorId);
            throw new ConflictException("Person " + personId + " is already restricted");
        }
        Instant endsAt = durationDays == null ? null : now.plus(Duration.ofDays(durationDays));
        openRestriction(person, reason, now, endsAt, false, actorId);
        return standing(person, now);
    }

    /**
     * Closes every restriction in effect for the person. The strike counter is left untouched.
     */
    @Transactional
    public PersonStandingResponse liftRestriction(UUID personId, String reason, UUID actorId) {
        Person person = findPerson(personId);
        Instant now = clock.now();
        int lifted = restrictionRepository.liftInEffect(personId, now, actorId, reason);
        if (lifted == 0) {
            log.warn("Lift requested but no restriction in effect: personId={}, by={}", personId, actorId);
            throw new ResourceNotFoundException("No restriction in effect for person: " + personId);
        }
        log.info("Restriction lifted: personId={}, by={}, count={}", personId, actorId, lifted);
        auditSink.record(AuditRecordContract.builder()
                .action("person.restriction.lifted")
                .entityType("PERSON")
                .entityId(personId.toString())
                .actorId(actorId)
                .personId(personId)
                .description(reason)
                .occurredAt(now)
                .build());

        PersonStandingResponse standing = standing(person, now);
        eventPublisher.publish(EventType.USER_UNBLOCKED, standing);
        return standing;
    }

    /**
     * Lowers the strike counter, never below zero. Dropping under the threshold also lifts
     * an automatic restriction; manual ones stay until lifted explicitly.
     */
    @Transactional
    public StrikeReductionResponse reduceStrikes(UUID personId, Integer amount, boolean toZero, String reason,
                                                 UUID actorId) {
        if (!toZero && (amount == null || amount < 1)) {
            throw new IllegalArgumentException("Either a positive amount or toZero is required");
        }
        int previous = findPerson(personId).getStrikeCount();
        personRepository.reduceStrikes(personId, toZero ? Integer.MAX_VALUE : amount);
        Person person = findPerson(personId);
        Policy policy = policyStore.current();
        Instant now = clock.now();

        boolean lifted = false;
        if (person.getStrikeCount() < policy.getStrikeThreshold()) {
            lifted = restrictionRepository.liftAutomaticInEffect(personId, now, actorId,
                    "Strikes reduced below threshold: " + reason) > 0;
        }

        log.info("Strikes reduced: personId={}, from={}, to={}, restrictionLifted={}, by={}",
                personId, previous, person.getStrikeCount(), lifted, actorId);
        auditSink.record(AuditRecordContract.builder()
                .action("person.strikes.reduced")
                .entityType("PERSON")
                .entityId(personId.toString())
                .actorId(actorId)
                .personId(personId)
                .description(reason)
                .metadata(Map.of("previousCount", previous, "newCount", person.getStrikeCount(),
                        "restrictionLifted", lifted))
                .occurredAt(now)
                .build());

        PersonStandingResponse standing = standing(person, now);
        eventPublisher.publish(EventType.USER_STRIKES_RESET, standing);
        if (lifted) {
            eventPublisher.publish(EventType.USER_UNBLOCKED, standing);
        }

        return StrikeReductionResponse.builder()
                .personId(personId)
                .previousCount(previous)
                .newCount(person.getStrikeCount())
                .threshold(policy.getStrikeThreshold())
                .restrictionLifted(lifted)
                .reason(reason)
                .build();
    }

    @Transactional(readOnly = true)
    public boolean isRestricted(UUID personId, Instant at) {
        return restrictionRepository.existsInEffectAt(personId, at);
    }

    @Transactional(readOnly = true)
    public Optional<Restriction> restrictionInEffect(UUID personId, Instant at) {
        return restrictionRepository.findCurrent(personId, at);
    }

    @Transactional(readOnly = true)
    public PersonStandingResponse standing(UUID personId) {
        return standing(findPerson(personId), clock.now());
    }

    @Transactional(readOnly = true)
    public List<RestrictionResponse> listRestrictions(boolean inEffectOnly, UUID personId) {
        Instant now = clock.now();
        List<Restriction> restrictions;
        if (personId != null) {
            restrictions = restrictionRepository.findByPersonIdOrderByStartsAtDesc(personId);
        } else if (inEffectOnly) {
            restrictions = restrictionRepository.findAllInEffectAt(now);
        } else {
            restrictions = restrictionRepository.findAllByOrderByStartsAtDesc();
        }
        return restrictions.stream()
                .filter(r -> !inEffectOnly || r.isInEffectAt(now))
                .map(r -> restrictionMapper.toRestrictionResponse(r, now))
                .toList();
    }

    private Restriction openRestriction(Person person, String reason, Instant startsAt, Instant endsAt,
                                        boolean automatic, UUID actorId) {
        Restriction restriction = new Restriction();
        restriction.setPersonId(person.getId());
        restriction.setReason(reason);
        restriction.setStartsAt(startsAt);
        restriction.setEndsAt(endsAt);
        restriction.setActive(true);
        restriction.setAutomatic(automatic);
        restriction.setCreatedBy(actorId);
        Restriction saved = restrictionRepository.save(restriction);

        log.info("Restriction opened: personId={}, restrictionId={}, endsAt={}, automatic={}",
                person.getId(), saved.getId(), endsAt, automatic);
        auditSink.record(AuditRecordContract.builder()
                .action("person.restricted")
                .entityType("PERSON")
                .entityId(person.getId().toString())
                .actorId(actorId)
                .personId(person.getId())
                .description(reason)
                .metadata(Map.of("restrictionId", saved.getId().toString(),
                        "endsAt", endsAt == null ? "indefinite" : endsAt.toString(),
                        "strikeCount", person.getStrikeCount()))
                .occurredAt(startsAt)
                .build());

        eventPublisher.publish(EventType.USER_BLACKLISTED, standing(person, startsAt));
        applicationEventPublisher.publishEvent(new RestrictionOpenedEvent(person.getId(), saved.getId(), endsAt));
        return saved;
    }

    private PersonStandingResponse standing(Person person, Instant at) {
        Optional<Restriction> current = restrictionRepository.findCurrent(person.getId(), at);
        return PersonStandingResponse.builder()
                .personId(person.getId())
                .displayName(person.getDisplayName())
                .strikeCount(person.getStrikeCount())
                .strikeThreshold(policyStore.current().getStrikeThreshold())
                .restricted(current.isPresent())
                .restriction(current.map(r -> restrictionMapper.toRestrictionResponse(r, at)).orElse(null))
                .build();
    }

    private Person findPerson(UUID personId) {
        return personRepository.findById(personId)
                .orElseThrow(() -> {
                    log.warn("Person not found: personId={}", personId);
                    return new ResourceNotFoundException("Person not found with id: " + personId);
                });
    }
}
