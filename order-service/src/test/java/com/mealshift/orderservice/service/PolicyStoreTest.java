package com.mealshift.orderservice.service;

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
import com.mealshift.orderservice.support.MutableClockSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PolicyStoreTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    private PolicySettingsRepository repository;
    @Mock
    private EventPublisher eventPublisher;
    @Mock
    private AuditSink auditSink;
    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private PolicyStore policyStore;

    @BeforeEach
    void setUp() {
        policyStore = new PolicyStore(repository, new MealshiftProperties(),
                MutableClockSource.at(TODAY, LocalTime.NOON), eventPublisher, auditSink, applicationEventPublisher);
        lenient().when(repository.saveAndFlush(any(PolicySettings.class))).thenAnswer(i -> i.getArgument(0));
    }

    @Test
    void current_FallsBackToConfiguredDefaults() {
        Policy policy = policyStore.current();

        assertThat(policy.getCutoffLeadHours()).isEqualTo(6);
        assertThat(policy.getStrikeThreshold()).isEqualTo(3);
        assertThat(policy.getRestrictionDurationDays()).isEqualTo(7);
        assertThat(policy.getBookingHorizonDays()).isEqualTo(7);
        assertThat(policy.isLateCancellationAllowed()).isFalse();
    }

    @Test
    void reload_InstallsStoredSettings() {
        PolicySettings stored = settings(4, 5);
        when(repository.findById(PolicySettings.DEFAULT_ID)).thenReturn(Optional.of(stored));

        policyStore.reload();

        assertThat(policyStore.current().getCutoffLeadHours()).isEqualTo(4);
        assertThat(policyStore.current().getStrikeThreshold()).isEqualTo(5);
    }

    @Test
    void reload_KeepsSnapshotWhenStorageFails() {
        Policy before = policyStore.current();
        when(repository.findById(PolicySettings.DEFAULT_ID))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        policyStore.reload();

        assertThat(policyStore.current()).isSameAs(before);
    }

    @Test
    void update_ChangesOnlyProvidedFields() {
        UUID adminId = UUID.randomUUID();
        PolicyUpdateRequest request = new PolicyUpdateRequest();
        request.setStrikeThreshold(5);

        Policy updated = policyStore.update(request, adminId);

        assertThat(updated.getStrikeThreshold()).isEqualTo(5);
        assertThat(updated.getCutoffLeadHours()).isEqualTo(6);
        assertThat(updated.getUpdatedBy()).isEqualTo(adminId);
        assertThat(policyStore.current()).isSameAs(updated);
        verify(eventPublisher).publish(EventType.POLICY_UPDATED, updated);
        verify(auditSink).record(any());
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    void update_ShorterHorizon_AnnouncesLastBookableDate() {
        PolicyUpdateRequest request = new PolicyUpdateRequest();
        request.setBookingHorizonDays(3);

        policyStore.update(request, UUID.randomUUID());

        ArgumentCaptor<BookingHorizonReducedEvent> event = ArgumentCaptor.forClass(BookingHorizonReducedEvent.class);
        verify(applicationEventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getPreviousHorizonDays()).isEqualTo(7);
        assertThat(event.getValue().getCurrentHorizonDays()).isEqualTo(3);
        assertThat(event.getValue().getLastBookableDate()).isEqualTo(TODAY.plusDays(3));
    }

    @Test
    void update_LongerHorizon_ReleasesNothing() {
        PolicyUpdateRequest request = new PolicyUpdateRequest();
        request.setBookingHorizonDays(14);

        policyStore.update(request, UUID.randomUUID());

        verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
        verify(eventPublisher).publish(eq(EventType.POLICY_UPDATED), any());
    }

    @Test
    void update_InstallsSnapshotOnlyAfterCommit() {
        PolicyUpdateRequest request = new PolicyUpdateRequest();
        request.setStrikeThreshold(5);

        TransactionSynchronizationManager.initSynchronization();
        try {
            Policy updated = policyStore.update(request, UUID.randomUUID());

            assertThat(policyStore.current().getStrikeThreshold()).isEqualTo(3);

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            assertThat(policyStore.current()).isSameAs(updated);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void update_RolledBack_KeepsPreviousSnapshot() {
        Policy before = policyStore.current();
        PolicyUpdateRequest request = new PolicyUpdateRequest();
        request.setCutoffLeadHours(2);

        TransactionSynchronizationManager.initSynchronization();
        try {
            policyStore.update(request, UUID.randomUUID());

            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        assertThat(policyStore.current()).isSameAs(before);
    }

    @Test
    void update_SwitchesToWeeklyMode_WithoutReleasingOrders() {
        PolicyUpdateRequest request = new PolicyUpdateRequest();
        request.setCutoffMode(CutoffMode.WEEKLY);
        request.setWeeklyCutoffDay(DayOfWeek.THURSDAY);
        request.setOrderableDays(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY));
        request.setBookingHorizonDays(3);

        Policy updated = policyStore.update(request, UUID.randomUUID());

        assertThat(updated.isWeekly()).isTrue();
        assertThat(updated.getWeeklyCutoffDay()).isEqualTo(DayOfWeek.THURSDAY);
        assertThat(updated.getWeeklyCutoffHour()).isEqualTo(17);
        assertThat(updated.getOrderableDays()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY);
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    void update_Fails_WhenWeeklyModeHasNoOrderableDays() {
        PolicySettings stored = settings(6, 3);
        stored.setWeeklyCutoffDay(DayOfWeek.FRIDAY);
        when(repository.findById(PolicySettings.DEFAULT_ID)).thenReturn(Optional.of(stored));
        PolicyUpdateRequest request = new PolicyUpdateRequest();
        request.setCutoffMode(CutoffMode.WEEKLY);

        assertThatThrownBy(() -> policyStore.update(request, UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void orderableDays_RoundTripThroughStoredForm() {
        assertThat(PolicyStore.formatDays(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.MONDAY))).isEqualTo("1,6");
        assertThat(PolicyStore.parseDays("1, 6")).containsExactly(DayOfWeek.MONDAY, DayOfWeek.SATURDAY);
    }

    private PolicySettings settings(int cutoff, int threshold) {
        PolicySettings settings = new PolicySettings();
        settings.setCutoffLeadHours(cutoff);
        settings.setStrikeThreshold(threshold);
        settings.setRestrictionDurationDays(7);
        settings.setBookingHorizonDays(7);
        settings.setEarlyCollectionMinutes(30);
        return settings;
    }
}
