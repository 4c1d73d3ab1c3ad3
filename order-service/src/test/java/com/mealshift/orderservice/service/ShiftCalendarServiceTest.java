package com.mealshift.orderservice.service;

import com.mealshift.orderservice.audit.AuditSink;
import com.mealshift.orderservice.dto.ShiftRequest;
import com.mealshift.orderservice.dto.ShiftResponse;
import com.mealshift.orderservice.event.EventPublisher;
import com.mealshift.orderservice.mapper.ShiftMapper;
import com.mealshift.orderservice.model.Shift;
import com.mealshift.orderservice.repository.HolidayRepository;
import com.mealshift.orderservice.repository.ShiftRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShiftCalendarServiceTest {

    @Mock
    private ShiftRepository shiftRepository;
    @Mock
    private HolidayRepository holidayRepository;
    @Mock
    private ShiftEligibilityChecker eligibilityChecker;
    @Mock
    private ShiftMapper shiftMapper;
    @Mock
    private EventPublisher eventPublisher;
    @Mock
    private AuditSink auditSink;

    @InjectMocks
    private ShiftCalendarService shiftCalendar;

    private final UUID adminId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        lenient().when(shiftRepository.save(any(Shift.class))).thenAnswer(i -> {
            Shift shift = i.getArgument(0);
            if (shift.getId() == null) {
                shift.setId(UUID.randomUUID());
            }
            return shift;
        });
        lenient().when(shiftMapper.toShiftResponse(any())).thenReturn(new ShiftResponse());
    }

    @Test
    void createShift_StoresBreak() {
        shiftCalendar.createShift(request("10:00", "18:00", "13:00", "13:30"), adminId);

        ArgumentCaptor<Shift> captor = ArgumentCaptor.forClass(Shift.class);
        verify(shiftRepository).save(captor.capture());
        assertThat(captor.getValue().getBreakStartTime()).isEqualTo(LocalTime.of(13, 0));
        assertThat(captor.getValue().getBreakEndTime()).isEqualTo(LocalTime.of(13, 30));
        assertThat(captor.getValue().hasBreak()).isTrue();
    }

    @Test
    void createShift_AcceptsBreakAfterMidnightOfOvernightShift() {
        shiftCalendar.createShift(request("22:00", "06:00", "01:00", "01:45"), adminId);

        verify(shiftRepository).save(any(Shift.class));
    }

    @Test
    void createShift_Fails_WhenBreakOverrunsShift() {
        assertThatThrownBy(() -> shiftCalendar.createShift(request("10:00", "18:00", "17:30", "18:30"), adminId))
                .isInstanceOf(IllegalArgumentException.class);
        verify(shiftRepository, never()).save(any());
    }

    @Test
    void createShift_Fails_WhenOnlyBreakStartGiven() {
        assertThatThrownBy(() -> shiftCalendar.createShift(request("10:00", "18:00", "13:00", null), adminId))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("together");
    }

    @Test
    void updateShift_ClearsBreak_WhenOmitted() {
        Shift existing = new Shift();
        existing.setId(UUID.randomUUID());
        existing.setName("Day");
        existing.setBreakStartTime(LocalTime.of(12, 0));
        existing.setBreakEndTime(LocalTime.of(12, 30));
        when(shiftRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

        shiftCalendar.updateShift(existing.getId(), request("08:00", "16:00", null, null), adminId);

        assertThat(existing.hasBreak()).isFalse();
    }

    private ShiftRequest request(String start, String end, String breakStart, String breakEnd) {
        ShiftRequest request = new ShiftRequest();
        request.setName("Day");
        request.setStartTime(LocalTime.parse(start));
        request.setEndTime(LocalTime.parse(end));
        request.setBreakStartTime(breakStart == null ? null : LocalTime.parse(breakStart));
        request.setBreakEndTime(breakEnd == null ? null : LocalTime.parse(breakEnd));
        return request;
    }
}
