package com.mealshift.orderservice.service;

import com.mealshift.common.exception.ConflictException;
import com.mealshift.common.exception.ResourceNotFoundException;
import com.mealshift.orderservice.audit.AuditSink;
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
import com.mealshift.orderservice.support.MutableClockSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StrikeLedgerTest {

    @Mock
    private PersonRepository personRepository;
    @Mock
    private RestrictionRepository restrictionRepository;
    @Mock
    private PolicyStore policyStore;
    @Mock
    private EventPublisher eventPublisher;
    @Mock
    private AuditSink auditSink;
    @Mock
    private RestrictionMapper restrictionMapper;
    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private MutableClockSource clock;
    private StrikeLedger strikeLedger;
    private UUID personId;

    @BeforeEach
    void setUp() {
        clock = MutableClockSource.at(LocalDate.of(2026, 3, 10), LocalTime.of(17, 0));
        strikeLedger = new StrikeLedger(personRepository, restrictionRepository, policyStore, clock, eventPublisher,
                auditSink, restrictionMapper, applicationEventPublisher);
        personId = UUID.randomUUID();

        lenient().when(policyStore.current()).thenReturn(Policy.builder()
                .cutoffLeadHours(6)
                .strikeThreshold(3)
                .restrictionDurationDays(7)
                .bookingHorizonDays(7)
                .build());
        lenient().when(restrictionRepository.save(any(Restriction.class))).thenAnswer(i -> {
            Restriction r = i.getArgument(0);
            r.setId(UUID.randomUUID());
            return r;
        });
    }

    // --- ACCRUAL TESTS ---

    @Test
    void accrueFailure_BelowThreshold_OpensNothing() {
        when(personRepository.incrementStrikes(personId)).thenReturn(1);
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(2)));

        StrikeAccrual accrual = strikeLedger.accrueFailure(personId, UUID.randomUUID());

        assertThat(accrual.getStrikeCount()).isEqualTo(2);
        assertThat(accrual.restrictionOpened()).isFalse();
        verify(restrictionRepository, never()).save(any());
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    void accrueFailure_ReachingThreshold_OpensRestrictionForConfiguredDuration() {
        when(personRepository.incrementStrikes(personId)).thenReturn(1);
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(3)));
        when(restrictionRepository.existsInEffectAt(personId, clock.now())).thenReturn(false);

        StrikeAccrual accrual = strikeLedger.accrueFailure(personId, UUID.randomUUID());

        assertThat(accrual.restrictionOpened()).isTrue();
        Restriction opened = accrual.getOpenedRestriction();
        assertThat(opened.isAutomatic()).isTrue();
        assertThat(opened.getStartsAt()).isEqualTo(clock.now());
        assertThat(opened.getEndsAt()).isEqualTo(clock.now().plus(Duration.ofDays(7)));

        ArgumentCaptor<RestrictionOpenedEvent> event = ArgumentCaptor.forClass(RestrictionOpenedEvent.class);
        verify(applicationEventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getPersonId()).isEqualTo(personId);
        verify(eventPublisher).publish(eq(EventType.USER_BLACKLISTED), any());
    }

    @Test
    void accrueFailure_AboveThresholdWhileRestricted_DoesNotStackRestrictions() {
        when(personRepository.incrementStrikes(personId)).thenReturn(1);
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(4)));
        when(restrictionRepository.existsInEffectAt(personId, clock.now())).thenReturn(true);

        StrikeAccrual accrual = strikeLedger.accrueFailure(personId, UUID.randomUUID());

        assertThat(accrual.getStrikeCount()).isEqualTo(4);
        assertThat(accrual.restrictionOpened()).isFalse();
        verify(restrictionRepository, never()).save(any());
    }

    @Test
    void accrueFailure_Fails_ForUnknownPerson() {
        when(personRepository.incrementStrikes(personId)).thenReturn(0);

        assertThatThrownBy(() -> strikeLedger.accrueFailure(personId, UUID.randomUUID()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // --- ADMINISTRATIVE TESTS ---

    @Test
    void restrict_Fails_WhenAlreadyRestricted() {
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(0)));
        when(restrictionRepository.existsInEffectAt(personId, clock.now())).thenReturn(true);

        assertThatThrownBy(() -> strikeLedger.restrict(personId, "Misuse", 3, UUID.randomUUID()))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void restrict_WithoutDuration_IsIndefinite() {
        UUID adminId = UUID.randomUUID();
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(0)));
        when(restrictionRepository.existsInEffectAt(personId, clock.now())).thenReturn(false);

        strikeLedger.restrict(personId, "Misuse", null, adminId);

        ArgumentCaptor<Restriction> saved = ArgumentCaptor.forClass(Restriction.class);
        verify(restrictionRepository).save(saved.capture());
        assertThat(saved.getValue().getEndsAt()).isNull();
        assertThat(saved.getValue().isAutomatic()).isFalse();
        assertThat(saved.getValue().getCreatedBy()).isEqualTo(adminId);
    }

    @Test
    void liftRestriction_Fails_WhenNothingInEffect() {
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(3)));
        when(restrictionRepository.liftInEffect(eq(personId), any(), any(), anyString())).thenReturn(0);

        assertThatThrownBy(() -> strikeLedger.liftRestriction(personId, "Appeal accepted", UUID.randomUUID()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void liftRestriction_KeepsStrikeCounter() {
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(3)));
        when(restrictionRepository.liftInEffect(eq(personId), any(), any(), anyString())).thenReturn(1);

        strikeLedger.liftRestriction(personId, "Appeal accepted", UUID.randomUUID());

        verify(personRepository, never()).reduceStrikes(any(), anyInt());
        verify(eventPublisher).publish(eq(EventType.USER_UNBLOCKED), any());
    }

    @Test
    void reduceStrikes_BelowThreshold_LiftsAutomaticRestriction() {
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(3)), Optional.of(person(1)));
        when(restrictionRepository.liftAutomaticInEffect(eq(personId), any(), any(), anyString())).thenReturn(1);

        StrikeReductionResponse response = strikeLedger.reduceStrikes(personId, 2, false, "Good conduct",
                UUID.randomUUID());

        verify(personRepository).reduceStrikes(personId, 2);
        assertThat(response.getPreviousCount()).isEqualTo(3);
        assertThat(response.getNewCount()).isEqualTo(1);
        assertThat(response.isRestrictionLifted()).isTrue();
        verify(eventPublisher).publish(eq(EventType.USER_STRIKES_RESET), any());
        verify(eventPublisher).publish(eq(EventType.USER_UNBLOCKED), any());
    }

    @Test
    void reduceStrikes_ToZero_ReducesByEverything() {
        when(personRepository.findById(personId)).thenReturn(Optional.of(person(5)), Optional.of(person(0)));

        strikeLedger.reduceStrikes(personId, null, true, "Annual reset", UUID.randomUUID());

        verify(personRepository).reduceStrikes(personId, Integer.MAX_VALUE);
    }

    @Test
    void reduceStrikes_Fails_WithoutAmount() {
        assertThatThrownBy(() -> strikeLedger.reduceStrikes(personId, null, false, "Oops", UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(personRepository);
    }

    private Person person(int strikes) {
        Person person = new Person();
        person.setId(personId);
        person.setStrikeCount(strikes);
        return person;
    }
}
