package com.mealshift.orderservice.service;

import com.mealshift.orderservice.dto.SweepResult;
import com.mealshift.orderservice.model.Order;
import com.mealshift.orderservice.model.OrderStatus;
import com.mealshift.orderservice.model.Policy;
import com.mealshift.orderservice.model.Restriction;
import com.mealshift.orderservice.model.Shift;
import com.mealshift.orderservice.repository.OrderRepository;
import com.mealshift.orderservice.support.MutableClockSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AttendanceSweeperTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderStateMachine stateMachine;
    @Mock
    private PolicyStore policyStore;
    @Mock
    private TransitionRetrier transitionRetrier;

    private MutableClockSource clock;
    private AttendanceSweeper sweeper;
    private Shift dayShift;
    private Shift nightShift;

    @BeforeEach
    void setUp() {
        clock = MutableClockSource.at(TODAY, LocalTime.of(16, 30));
        sweeper = new AttendanceSweeper(orderRepository, stateMachine, policyStore, clock, transitionRetrier);

        dayShift = shift("Day", 8, 16);
        nightShift = shift("Night", 23, 7);

        lenient().when(policyStore.current()).thenReturn(Policy.builder()
                .strikeThreshold(3)
                .collectionGraceMinutes(0)
                .build());
        lenient().when(transitionRetrier.execute(anyString(), any()))
                .thenAnswer(i -> i.<Supplier<?>>getArgument(1).get());
    }

    @Test
    void sweep_TransitionsOnlyOrdersWhoseWindowClosed() {
        Order dayToday = order(dayShift, TODAY);
        Order nightToday = order(nightShift, TODAY);
        Order nightYesterday = order(nightShift, TODAY.minusDays(1));
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(dayToday, nightToday, nightYesterday));
        when(stateMachine.markNotCollected(dayToday))
                .thenReturn(Optional.of(new StrikeAccrual(dayToday.getPersonId(), 1, null)));
        when(stateMachine.markNotCollected(nightYesterday))
                .thenReturn(Optional.of(new StrikeAccrual(nightYesterday.getPersonId(), 3, new Restriction())));

        SweepResult result = sweeper.sweep();

        assertThat(result.getDue()).isEqualTo(2);
        assertThat(result.getTransitioned()).isEqualTo(2);
        assertThat(result.getRestrictionsOpened()).isEqualTo(1);
        verify(stateMachine, never()).markNotCollected(nightToday);
    }

    @Test
    void sweep_DoesNotTouchOrderBeforeShiftEnds() {
        clock.setLocal(TODAY, LocalTime.of(15, 59));
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(order(dayShift, TODAY)));

        SweepResult result = sweeper.sweep();

        assertThat(result.getDue()).isZero();
        verifyNoInteractions(stateMachine);
    }

    @Test
    void sweep_CountsLostRaceAsSkipped() {
        Order order = order(dayShift, TODAY);
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(order));
        when(stateMachine.markNotCollected(order)).thenReturn(Optional.empty());

        SweepResult result = sweeper.sweep();

        assertThat(result.getDue()).isEqualTo(1);
        assertThat(result.getTransitioned()).isZero();
        assertThat(result.getSkipped()).isEqualTo(1);
    }

    @Test
    void sweep_ContinuesAfterSingleOrderFails() {
        Order broken = order(dayShift, TODAY);
        Order fine = order(dayShift, TODAY);
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(broken, fine));
        when(stateMachine.markNotCollected(broken)).thenThrow(new DataAccessResourceFailureException("db down"));
        when(stateMachine.markNotCollected(fine))
                .thenReturn(Optional.of(new StrikeAccrual(fine.getPersonId(), 1, null)));

        SweepResult result = sweeper.sweep();

        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getTransitioned()).isEqualTo(1);
    }

    @Test
    void sweep_RunTwice_SecondRunFindsNothing() {
        Order order = order(dayShift, TODAY);
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(order), List.of());
        when(stateMachine.markNotCollected(order))
                .thenReturn(Optional.of(new StrikeAccrual(order.getPersonId(), 1, null)));

        SweepResult first = sweeper.sweep();
        SweepResult second = sweeper.sweep();

        assertThat(first.getTransitioned()).isEqualTo(1);
        assertThat(second.getDue()).isZero();
        verify(stateMachine, times(1)).markNotCollected(any());
    }

    @Test
    void sweep_UsesShiftTimesFromBooking_NotLaterShiftEdits() {
        clock.setLocal(TODAY, LocalTime.of(11, 0));
        Order order = order(dayShift, TODAY);
        dayShift.setEndTime(LocalTime.of(10, 0));
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(order));

        SweepResult result = sweeper.sweep();

        assertThat(result.getDue()).isZero();
        verifyNoInteractions(stateMachine);
    }

    @Test
    void sweep_WaitsForShiftEnd_EvenWhenBreakIsOver() {
        Shift withBreak = shift("Lunch", 8, 16);
        withBreak.setBreakStartTime(LocalTime.of(12, 0));
        withBreak.setBreakEndTime(LocalTime.of(13, 0));
        clock.setLocal(TODAY, LocalTime.of(14, 0));
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(order(withBreak, TODAY)));

        SweepResult result = sweeper.sweep();

        assertThat(result.getDue()).isZero();
        verifyNoInteractions(stateMachine);
    }

    @Test
    void sweep_OverlappingRuns_BothEvaluateAndConditionalUpdateDecides() throws Exception {
        Order order = order(dayShift, TODAY);
        CountDownLatch inTransition = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(orderRepository.findByStatusAndOrderDateLessThanEqual(OrderStatus.PLACED, TODAY))
                .thenReturn(List.of(order));
        when(stateMachine.markNotCollected(order))
                .thenAnswer(i -> {
                    inTransition.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return Optional.of(new StrikeAccrual(order.getPersonId(), 1, null));
                })
                .thenReturn(Optional.empty());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SweepResult> first = executor.submit(sweeper::sweep);
            assertThat(inTransition.await(5, TimeUnit.SECONDS)).isTrue();

            // a second trigger while the first is still running is not turned away
            SweepResult second = sweeper.sweep();
            release.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).getTransitioned()).isEqualTo(1);
            assertThat(second.getDue()).isEqualTo(1);
            assertThat(second.getSkipped()).isEqualTo(1);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    private Shift shift(String name, int startHour, int endHour) {
        Shift shift = new Shift();
        shift.setId(UUID.randomUUID());
        shift.setName(name);
        shift.setStartTime(LocalTime.of(startHour, 0));
        shift.setEndTime(LocalTime.of(endHour, 0));
        return shift;
    }

    private Order order(Shift shift, LocalDate date) {
        Order order = new Order();
        order.setId(UUID.randomUUID());
        order.setPersonId(UUID.randomUUID());
        order.bookShift(shift);
        order.setOrderDate(date);
        order.setStatus(OrderStatus.PLACED);
        return order;
    }
}
