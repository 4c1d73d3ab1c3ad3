package com.mealshift.orderservice.service;

import com.mealshift.common.contracts.AuditRecordContract;
import com.mealshift.common.exception.ConflictException;
import com.mealshift.common.exception.ResourceNotFoundException;
import com.mealshift.orderservice.audit.AuditSink;
import com.mealshift.orderservice.dto.HolidayRequest;
import com.mealshift.orderservice.dto.HolidayResponse;
import com.mealshift.orderservice.dto.ShiftRequest;
import com.mealshift.orderservice.dto.ShiftResponse;
import com.mealshift.orderservice.event.EventPublisher;
import com.mealshift.orderservice.event.EventType;
import com.mealshift.orderservice.exception.OrderRejectedException;
import com.mealshift.orderservice.exception.RejectionReason;
import com.mealshift.orderservice.mapper.ShiftMapper;
import com.mealshift.orderservice.model.Holiday;
import com.mealshift.orderservice.model.Shift;
import com.mealshift.orderservice.model.ShiftWindow;
import com.mealshift.orderservice.repository.HolidayRepository;
import com.mealshift.orderservice.repository.ShiftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shifts and the holiday calendar. Edits only affect future bookability and windows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftCalendarService {

    private final ShiftRepository shiftRepository;
    private final HolidayRepository holidayRepository;
    private final ShiftEligibilityChecker eligibilityChecker;
    private final ShiftMapper shiftMapper;
    private final EventPublisher eventPublisher;
    private final AuditSink auditSink;

    /**
     * Resolves a shift a person may book on the given date, or rejects with SHIFT_UNAVAILABLE.
     */
    @Transactional(readOnly = true)
    public Shift requireBookableShift(UUID shiftId, LocalDate date, UUID personId) {
        Shift shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new OrderRejectedException(RejectionReason.SHIFT_UNAVAILABLE,
                        "Shift does not exist: " + shiftId));
        if (!shift.isActive()) {
            throw new OrderRejectedException(RejectionReason.SHIFT_UNAVAILABLE,
                    "Shift " + shift.getName() + " is not active");
        }
        if (holidayRepository.closesShiftOn(date, shiftId)) {
            throw new OrderRejectedException(RejectionReason.SHIFT_UNAVAILABLE,
                    "Shift " + shift.getName() + " is closed on " + date + " (holiday)");
        }
        if (!eligibilityChecker.isEligible(personId, shift)) {
            throw new OrderRejectedException(RejectionReason.SHIFT_UNAVAILABLE,
                    "Shift " + shift.getName() + " is not available to you");
        }
        return shift;
    }

    @Transactional(readOnly = true)
    public Shift getShift(UUID shiftId) {
        return shiftRepository.findById(shiftId)
                .orElseThrow(() -> {
                    log.warn("Shift not found: shiftId={}", shiftId);
                    return new ResourceNotFoundException("Shift not found with id: " + shiftId);
                });
    }

    @Transactional(readOnly = true)
    public List<ShiftResponse> listShifts(boolean activeOnly) {
        List<Shift> shifts = activeOnly
                ? shiftRepository.findByActiveTrueOrderByStartTimeAsc()
                : shiftRepository.findAllByOrderByStartTimeAsc();
        return shifts.stream().map(shiftMapper::toShiftResponse).toList();
    }

    @Transactional
    public ShiftResponse createShift(ShiftRequest request, UUID actorId) {
        if (shiftRepository.existsByNameIgnoreCase(request.getName())) {
            throw new ConflictException("A shift named '" + request.getName() + "' already exists");
        }
        Shift shift = new Shift();
        apply(shift, request);
        Shift saved = shiftRepository.save(shift);
        log.info("Shift created: shiftId={}, name={}, by={}", saved.getId(), saved.getName(), actorId);
        return announceShift(saved, "shift.created", actorId);
    }

    @Transactional
    public ShiftResponse updateShift(UUID shiftId, ShiftRequest request, UUID actorId) {
        Shift shift = getShift(shiftId);
        if (shiftRepository.existsByNameIgnoreCaseAndIdNot(request.getName(), shiftId)) {
            throw new ConflictException("A shift named '" + request.getName() + "' already exists");
        }
        apply(shift, request);
        Shift saved = shiftRepository.save(shift);
        log.info("Shift updated: shiftId={}, name={}, active={}, by={}", saved.getId(), saved.getName(),
                saved.isActive(), actorId);
        return announceShift(saved, "shift.updated", actorId);
    }

    @Transactional(readOnly = true)
    public List<HolidayResponse> listHolidays(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        return holidayRepository.findByDateBetweenOrderByDateAsc(from, to).stream()
                .map(shiftMapper::toHolidayResponse)
                .toList();
    }

    @Transactional
    public HolidayResponse createHoliday(HolidayRequest request, UUID actorId) {
        if (request.getShiftId() != null) {
            getShift(request.getShiftId());
        }
        Holiday holiday = new Holiday();
        holiday.setDate(request.getDate());
        holiday.setShiftId(request.getShiftId());
        holiday.setDescription(request.getDescription());
        Holiday saved = holidayRepository.save(holiday);

        log.info("Holiday created: holidayId={}, date={}, shiftId={}, by={}", saved.getId(), saved.getDate(),
                saved.getShiftId(), actorId);
        HolidayResponse response = shiftMapper.toHolidayResponse(saved);
        auditHoliday(saved, "holiday.created", actorId);
        eventPublisher.publish(EventType.HOLIDAY_UPDATED, response);
        return response;
    }

    @Transactional
    public void deleteHoliday(UUID holidayId, UUID actorId) {
        Holiday holiday = holidayRepository.findById(holidayId)
                .orElseThrow(() -> new ResourceNotFoundException("Holiday not found with id: " + holidayId));
        holidayRepository.delete(holiday);
        log.info("Holiday deleted: holidayId={}, date={}, by={}", holidayId, holiday.getDate(), actorId);
        auditHoliday(holiday, "holiday.deleted", actorId);
        eventPublisher.publish(EventType.HOLIDAY_UPDATED, Map.of("deleted", holidayId));
    }

    private void apply(Shift shift, ShiftRequest request) {
        if ((request.getBreakStartTime() == null) != (request.getBreakEndTime() == null)) {
            throw new IllegalArgumentException("Break start and end must be given together");
        }
        shift.setName(request.getName().trim());
        shift.setStartTime(request.getStartTime());
        shift.setEndTime(request.getEndTime());
        shift.setBreakStartTime(request.getBreakStartTime());
        shift.setBreakEndTime(request.getBreakEndTime());
        // the rule is the same for any date, DST aside
        if (!ShiftWindow.of(shift, LocalDate.EPOCH, ZoneOffset.UTC).breakWithinShift()) {
            throw new IllegalArgumentException("Break " + request.getBreakStartTime() + "-"
                    + request.getBreakEndTime() + " must lie within the shift");
        }
        if (request.getActive() != null) {
            shift.setActive(request.getActive());
        }
    }

    private ShiftResponse announceShift(Shift shift, String action, UUID actorId) {
        ShiftResponse response = shiftMapper.toShiftResponse(shift);
        auditSink.record(AuditRecordContract.builder()
                .action(action)
                .entityType("SHIFT")
                .entityId(shift.getId().toString())
                .actorId(actorId)
                .description(shift.getName() + " " + shift.getStartTime() + "-" + shift.getEndTime())
                .metadata(Map.of("active", shift.isActive()))
                .build());
        eventPublisher.publish(EventType.SHIFT_UPDATED, response);
        return response;
    }

    private void auditHoliday(Holiday holiday, String action, UUID actorId) {
        auditSink.record(AuditRecordContract.builder()
                .action(action)
                .entityType("HOLIDAY")
                .entityId(holiday.getId().toString())
                .actorId(actorId)
                .description(holiday.getDate() + ": " + holiday.getDescription())
                .build());
    }
}
